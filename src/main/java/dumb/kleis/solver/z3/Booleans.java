package dumb.kleis.solver.z3;

import com.microsoft.z3.BoolSort;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import dumb.kleis.VerificationException;

import java.util.List;

final class Booleans extends Ops {

    Booleans(Context ctx, Functions functions) {
        super(ctx, functions);
    }

    @Override
    Term apply(Operator.Builtin op, List<Term> args) throws VerificationException {
        return switch (op) {
            case AND -> Term.of(ctx.mkAnd(operands(op, args)));
            case OR -> Term.of(ctx.mkOr(operands(op, args)));
            case NOT -> Term.of(ctx.mkNot(bool(args.get(0), op)));
            case IMPLIES -> Term.of(ctx.mkImplies(bool(args.get(0), op), bool(args.get(1), op)));
            case IFF -> Term.of(ctx.mkIff(bool(args.get(0), op), bool(args.get(1), op)));
            default -> throw new IllegalArgumentException("Not a boolean operator: " + op);
        };
    }

    @SuppressWarnings("unchecked")
    private Expr<BoolSort>[] operands(Operator.Builtin op, List<Term> args) throws VerificationException {
        var out = new Expr[args.size()];
        for (var i = 0; i < out.length; i++) out[i] = bool(args.get(i), op);
        return out;
    }
}
