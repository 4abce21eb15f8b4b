package dumb.kleis.solver.z3;

import com.microsoft.z3.BoolSort;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.RealSort;
import dumb.kleis.VerificationException;

import java.util.List;

/** Complex numbers as (re, im) pairs of reals. */
final class Complexes extends Ops {

    Complexes(Context ctx, Functions functions) {
        super(ctx, functions);
    }

    Term.Complex unit() {
        return new Term.Complex(ctx.mkReal(0), ctx.mkReal(1));
    }

    @Override
    Term apply(Operator.Builtin op, List<Term> args) throws VerificationException {
        return switch (op) {
            case I -> unit();
            case COMPLEX -> new Term.Complex(real(args.get(0), op), real(args.get(1), op));
            case RE -> Term.of(complex(args.get(0), op).re());
            case IM -> Term.of(complex(args.get(0), op).im());
            case CONJ -> conj(complex(args.get(0), op));
            case COMPLEX_ADD -> add(complex(args.get(0), op), complex(args.get(1), op));
            case COMPLEX_SUB -> sub(complex(args.get(0), op), complex(args.get(1), op));
            case COMPLEX_MUL -> mul(complex(args.get(0), op), complex(args.get(1), op));
            case COMPLEX_DIV -> div(complex(args.get(0), op), complex(args.get(1), op));
            case COMPLEX_INVERSE -> inverse(complex(args.get(0), op));
            case NEG_COMPLEX -> neg(complex(args.get(0), op));
            case ABS_SQUARED -> Term.of(normSquared(complex(args.get(0), op)));
            default -> throw new IllegalArgumentException("Not a complex operator: " + op);
        };
    }

    /** Generic arithmetic with at least one complex operand; scalars are lifted to (x, 0). */
    Term lifted(Operator.Builtin op, List<Term> args) throws VerificationException {
        return switch (op) {
            case PLUS -> {
                var acc = complex(args.get(0), op);
                for (var t : args.subList(1, args.size())) acc = add(acc, complex(t, op));
                yield acc;
            }
            case TIMES -> {
                var acc = complex(args.get(0), op);
                for (var t : args.subList(1, args.size())) acc = mul(acc, complex(t, op));
                yield acc;
            }
            case MINUS -> args.size() == 1 ? neg(complex(args.get(0), op)) : sub(complex(args.get(0), op), complex(args.get(1), op));
            case NEGATE -> neg(complex(args.get(0), op));
            case DIVIDE -> div(complex(args.get(0), op), complex(args.get(1), op));
            default -> throw VerificationException.translation("'" + op.symbol() + "' is not defined on complex operands");
        };
    }

    Expr<BoolSort> equal(Term a, Term b, Operator.Builtin op) throws VerificationException {
        var x = complex(a, op);
        var y = complex(b, op);
        return ctx.mkAnd(ctx.mkEq(x.re(), y.re()), ctx.mkEq(x.im(), y.im()));
    }

    Term.Complex add(Term.Complex a, Term.Complex b) {
        return new Term.Complex(ctx.mkAdd(a.re(), b.re()), ctx.mkAdd(a.im(), b.im()));
    }

    Term.Complex sub(Term.Complex a, Term.Complex b) {
        return new Term.Complex(ctx.mkSub(a.re(), b.re()), ctx.mkSub(a.im(), b.im()));
    }

    /** (a + bi)(c + di) = (ac - bd) + (ad + bc)i */
    Term.Complex mul(Term.Complex x, Term.Complex y) {
        Expr<RealSort> re = ctx.mkSub(ctx.mkMul(x.re(), y.re()), ctx.mkMul(x.im(), y.im()));
        Expr<RealSort> im = ctx.mkAdd(ctx.mkMul(x.re(), y.im()), ctx.mkMul(x.im(), y.re()));
        return new Term.Complex(re, im);
    }

    /** (a + bi)/(c + di) = ((ac + bd) + (bc - ad)i) / (c² + d²) */
    Term.Complex div(Term.Complex x, Term.Complex y) {
        var d = normSquared(y);
        Expr<RealSort> re = ctx.mkAdd(ctx.mkMul(x.re(), y.re()), ctx.mkMul(x.im(), y.im()));
        Expr<RealSort> im = ctx.mkSub(ctx.mkMul(x.im(), y.re()), ctx.mkMul(x.re(), y.im()));
        return new Term.Complex(ctx.mkDiv(re, d), ctx.mkDiv(im, d));
    }

    Term.Complex inverse(Term.Complex z) {
        var d = normSquared(z);
        return new Term.Complex(ctx.mkDiv(z.re(), d), ctx.mkDiv(ctx.mkUnaryMinus(z.im()), d));
    }

    Term.Complex neg(Term.Complex z) {
        return new Term.Complex(ctx.mkUnaryMinus(z.re()), ctx.mkUnaryMinus(z.im()));
    }

    Term.Complex conj(Term.Complex z) {
        return new Term.Complex(z.re(), ctx.mkUnaryMinus(z.im()));
    }

    Expr<RealSort> normSquared(Term.Complex z) {
        return ctx.mkAdd(ctx.mkMul(z.re(), z.re()), ctx.mkMul(z.im(), z.im()));
    }
}
