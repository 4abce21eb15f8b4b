package dumb.kleis.solver.z3;

import com.microsoft.z3.ArithSort;
import com.microsoft.z3.BoolSort;
import com.microsoft.z3.DatatypeSort;
import com.microsoft.z3.Expr;
import com.microsoft.z3.IntSort;
import com.microsoft.z3.RealSort;
import com.microsoft.z3.Sort;

import static java.util.Objects.requireNonNull;

/**
 * Translated value. Scalars wrap one solver expression; complex numbers are a pair of
 * real expressions.
 */
sealed public interface Term permits Term.Value, Term.Complex {

    static Term of(Expr<?> expr) {
        return new Value(expr);
    }

    Kind kind();

    default boolean complex() {
        return kind() == Kind.COMPLEX;
    }

    default boolean numeric() {
        return kind() == Kind.INT || kind() == Kind.REAL;
    }

    enum Kind {
        BOOL, INT, REAL, COMPLEX, DATA, OTHER;

        static Kind of(Sort s) {
            if (s instanceof BoolSort) return BOOL;
            if (s instanceof IntSort) return INT;
            if (s instanceof RealSort) return REAL;
            if (s instanceof DatatypeSort) return DATA;
            return OTHER;
        }
    }

    record Value(Expr<?> expr) implements Term {
        public Value {
            requireNonNull(expr);
        }

        @Override
        public Kind kind() {
            return Kind.of(expr.getSort());
        }

        @SuppressWarnings("unchecked")
        public Expr<BoolSort> bool() {
            return (Expr<BoolSort>) expr;
        }

        @SuppressWarnings("unchecked")
        public Expr<IntSort> integer() {
            return (Expr<IntSort>) expr;
        }

        @SuppressWarnings("unchecked")
        public Expr<? extends ArithSort> arith() {
            return (Expr<? extends ArithSort>) expr;
        }

        @SuppressWarnings("unchecked")
        public Expr<Sort> any() {
            return (Expr<Sort>) expr;
        }

        @Override
        public String toString() {
            return expr.toString();
        }
    }

    record Complex(Expr<RealSort> re, Expr<RealSort> im) implements Term {
        public Complex {
            requireNonNull(re);
            requireNonNull(im);
        }

        @Override
        public Kind kind() {
            return Kind.COMPLEX;
        }

        @Override
        public String toString() {
            return "(complex " + re + " " + im + ")";
        }
    }
}
