package dumb.kleis.solver.z3;

import com.microsoft.z3.Context;
import dumb.kleis.VerificationException;

import java.util.List;

/** Rationals are reals; numerator and denominator have no interpretation. */
final class Rationals extends Ops {

    Rationals(Context ctx, Functions functions) {
        super(ctx, functions);
    }

    @Override
    Term apply(Operator.Builtin op, List<Term> args) throws VerificationException {
        return switch (op) {
            case RATIONAL, RATIONAL_DIV -> Term.of(ctx.mkDiv(real(args.get(0), op), real(args.get(1), op)));
            case RATIONAL_ADD -> Term.of(ctx.mkAdd(real(args.get(0), op), real(args.get(1), op)));
            case RATIONAL_SUB -> Term.of(ctx.mkSub(real(args.get(0), op), real(args.get(1), op)));
            case RATIONAL_MUL -> Term.of(ctx.mkMul(real(args.get(0), op), real(args.get(1), op)));
            case NEG_RATIONAL -> Term.of(ctx.mkUnaryMinus(real(args.get(0), op)));
            case RATIONAL_INV -> Term.of(ctx.mkDiv(ctx.mkReal(1), real(args.get(0), op)));
            case RATIONAL_LT -> Term.of(ctx.mkLt(real(args.get(0), op), real(args.get(1), op)));
            case RATIONAL_LE -> Term.of(ctx.mkLe(real(args.get(0), op), real(args.get(1), op)));
            case RATIONAL_GT -> Term.of(ctx.mkGt(real(args.get(0), op), real(args.get(1), op)));
            case RATIONAL_GE -> Term.of(ctx.mkGe(real(args.get(0), op), real(args.get(1), op)));
            case TO_REAL -> Term.of(real(args.get(0), op));
            case NUMER, DENOM -> Term.of(functions.apply(op.symbol(), ctx.getIntSort(), real(args.get(0), op)));
            default -> throw new IllegalArgumentException("Not a rational operator: " + op);
        };
    }
}
