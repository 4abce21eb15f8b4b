package dumb.kleis.solver.z3;

import com.microsoft.z3.ArithSort;
import com.microsoft.z3.BoolSort;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.IntSort;
import com.microsoft.z3.RealSort;
import com.microsoft.z3.Sort;
import dumb.kleis.VerificationException;

import java.util.List;

/** Shared operand coercions for the builtin operator families. */
abstract class Ops {

    protected final Context ctx;
    protected final Functions functions;

    Ops(Context ctx, Functions functions) {
        this.ctx = ctx;
        this.functions = functions;
    }

    abstract Term apply(Operator.Builtin op, List<Term> args) throws VerificationException;

    static boolean anyReal(List<Term> args) {
        return args.stream().anyMatch(a -> a.kind() == Term.Kind.REAL);
    }

    static boolean anyComplex(List<Term> args) {
        return args.stream().anyMatch(Term::complex);
    }

    Expr<BoolSort> bool(Term t, Operator.Builtin op) throws VerificationException {
        if (t instanceof Term.Value v && t.kind() == Term.Kind.BOOL) return v.bool();
        throw mismatch(op, "Bool", t);
    }

    Expr<? extends ArithSort> arith(Term t, Operator.Builtin op) throws VerificationException {
        if (t instanceof Term.Value v && t.numeric()) return v.arith();
        throw mismatch(op, "Int or Real", t);
    }

    Expr<IntSort> integer(Term t, Operator.Builtin op) throws VerificationException {
        if (t instanceof Term.Value v && t.kind() == Term.Kind.INT) return v.integer();
        throw mismatch(op, "Int", t);
    }

    @SuppressWarnings("unchecked")
    Expr<RealSort> real(Term t, Operator.Builtin op) throws VerificationException {
        if (t instanceof Term.Value v) {
            if (t.kind() == Term.Kind.INT) return ctx.mkInt2Real(v.integer());
            if (t.kind() == Term.Kind.REAL) return (Expr<RealSort>) v.expr();
        }
        throw mismatch(op, "Int or Real", t);
    }

    /** Numeric operand, widened to Real when {@code widen} is set. */
    Expr<? extends ArithSort> arith(Term t, Operator.Builtin op, boolean widen) throws VerificationException {
        return widen ? real(t, op) : arith(t, op);
    }

    Term.Complex complex(Term t, Operator.Builtin op) throws VerificationException {
        if (t instanceof Term.Complex c) return c;
        return new Term.Complex(real(t, op), ctx.mkReal(0));
    }

    @SuppressWarnings("unchecked")
    static Expr<Sort> any(Expr<?> e) {
        return (Expr<Sort>) e;
    }

    static VerificationException mismatch(Operator.Builtin op, String expected, Term got) {
        return VerificationException.translation("'" + op.symbol() + "' expects " + expected + " operands, got " + got.kind() + " (" + got + ")");
    }
}
