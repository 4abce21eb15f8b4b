package dumb.kleis.solver.z3;

import com.microsoft.z3.ArithSort;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.IntNum;
import dumb.kleis.VerificationException;

import java.util.List;

/** Int and Real arithmetic. Complex operands are handed to {@link Complexes}. */
final class Arithmetic extends Ops {

    private final Complexes complexes;
    private final int maxPowerExpansion;

    Arithmetic(Context ctx, Functions functions, Complexes complexes, int maxPowerExpansion) {
        super(ctx, functions);
        this.complexes = complexes;
        this.maxPowerExpansion = maxPowerExpansion;
    }

    @Override
    Term apply(Operator.Builtin op, List<Term> args) throws VerificationException {
        if (anyComplex(args)) return complexes.lifted(op, args);
        var widen = anyReal(args);
        return switch (op) {
            case PLUS -> Term.of(ctx.mkAdd(operands(op, args, widen)));
            case TIMES -> Term.of(ctx.mkMul(operands(op, args, widen)));
            case MINUS -> args.size() == 1
                    ? Term.of(ctx.mkUnaryMinus(arith(args.get(0), op)))
                    : Term.of(ctx.mkSub(arith(args.get(0), op, widen), arith(args.get(1), op, widen)));
            case NEGATE -> Term.of(ctx.mkUnaryMinus(arith(args.get(0), op)));
            case DIVIDE -> Term.of(ctx.mkDiv(real(args.get(0), op), real(args.get(1), op)));
            case INT_DIV -> Term.of(ctx.mkDiv(integer(args.get(0), op), integer(args.get(1), op)));
            case MOD -> Term.of(ctx.mkMod(integer(args.get(0), op), integer(args.get(1), op)));
            case REM -> Term.of(ctx.mkRem(integer(args.get(0), op), integer(args.get(1), op)));
            case ABS -> abs(args.get(0), op);
            case FLOOR -> floor(args.get(0), op);
            case CEIL -> args.get(0).kind() == Term.Kind.INT ? args.get(0)
                    : Term.of(ctx.mkUnaryMinus(ctx.mkReal2Int(ctx.mkUnaryMinus(real(args.get(0), op)))));
            case SQRT -> Term.of(functions.apply("sqrt", ctx.getRealSort(), real(args.get(0), op)));
            case POWER -> power(args.get(0), args.get(1), op);
            default -> throw new IllegalArgumentException("Not an arithmetic operator: " + op);
        };
    }

    @SuppressWarnings("unchecked")
    private Expr<? extends ArithSort>[] operands(Operator.Builtin op, List<Term> args, boolean widen) throws VerificationException {
        var out = new Expr[args.size()];
        for (var i = 0; i < out.length; i++) out[i] = arith(args.get(i), op, widen);
        return out;
    }

    private Term abs(Term x, Operator.Builtin op) throws VerificationException {
        var e = arith(x, op);
        var zero = x.kind() == Term.Kind.INT ? ctx.mkInt(0) : ctx.mkReal(0);
        return Term.of(ctx.mkITE(ctx.mkGe(e, zero), e, ctx.mkUnaryMinus(e)));
    }

    private Term floor(Term x, Operator.Builtin op) throws VerificationException {
        if (x.kind() == Term.Kind.INT) return x;
        return Term.of(ctx.mkReal2Int(real(x, op)));
    }

    /**
     * Numeral exponents up to the expansion limit become repeated multiplication. Larger
     * Int powers use the solver's power; symbolic exponents stay uninterpreted.
     */
    private Term power(Term base, Term exponent, Operator.Builtin op) throws VerificationException {
        var b = arith(base, op);
        if (exponent instanceof Term.Value v && v.expr() instanceof IntNum n && n.getBigInteger().signum() >= 0) {
            var k = n.getBigInteger();
            if (k.bitLength() < 31 && k.intValue() <= maxPowerExpansion) {
                var times = k.intValue();
                if (times == 0) return Term.of(base.kind() == Term.Kind.INT ? ctx.mkInt(1) : ctx.mkReal(1));
                Expr<? extends ArithSort> acc = b;
                for (var i = 1; i < times; i++) acc = ctx.mkMul(acc, b);
                return Term.of(acc);
            }
            if (base.kind() == Term.Kind.INT) return Term.of(ctx.mkPower(b, n));
        }
        var e = arith(exponent, op);
        var range = base.kind() == Term.Kind.REAL || exponent.kind() == Term.Kind.REAL ? ctx.getRealSort() : ctx.getIntSort();
        return Term.of(functions.apply("power", range, b, e));
    }
}
