package dumb.kleis.solver.z3;

import com.microsoft.z3.BoolSort;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import dumb.kleis.VerificationException;

import java.util.List;

/** Equality on every sort, ordering on Int and Real. */
final class Comparisons extends Ops {

    private final Complexes complexes;

    Comparisons(Context ctx, Functions functions, Complexes complexes) {
        super(ctx, functions);
        this.complexes = complexes;
    }

    @Override
    Term apply(Operator.Builtin op, List<Term> args) throws VerificationException {
        var a = args.get(0);
        var b = args.get(1);
        return switch (op) {
            case EQUALS -> Term.of(equal(a, b, op));
            case NEQ -> Term.of(ctx.mkNot(equal(a, b, op)));
            case LT -> Term.of(ctx.mkLt(arith(a, op, widen(a, b)), arith(b, op, widen(a, b))));
            case GT -> Term.of(ctx.mkGt(arith(a, op, widen(a, b)), arith(b, op, widen(a, b))));
            case LE -> Term.of(ctx.mkLe(arith(a, op, widen(a, b)), arith(b, op, widen(a, b))));
            case GE -> Term.of(ctx.mkGe(arith(a, op, widen(a, b)), arith(b, op, widen(a, b))));
            default -> throw new IllegalArgumentException("Not a comparison: " + op);
        };
    }

    /** Equality with Int widened to Real and scalars lifted against complex values. */
    Expr<BoolSort> equal(Term a, Term b, Operator.Builtin op) throws VerificationException {
        if (a.complex() || b.complex()) return complexes.equal(a, b, op);
        var va = (Term.Value) a;
        var vb = (Term.Value) b;
        if (a.numeric() && b.numeric()) {
            var w = widen(a, b);
            return ctx.mkEq(any(arith(a, op, w)), any(arith(b, op, w)));
        }
        if (!va.expr().getSort().equals(vb.expr().getSort()))
            throw VerificationException.translation("Cannot compare " + a.kind() + " with " + b.kind() + ": " + a + " = " + b);
        return ctx.mkEq(va.any(), vb.any());
    }

    private static boolean widen(Term a, Term b) {
        return a.kind() == Term.Kind.REAL || b.kind() == Term.Kind.REAL;
    }
}
