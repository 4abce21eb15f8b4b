package dumb.kleis.solver.z3;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Resolution of an operation name: one of the closed set of builtins, or an
 * uninterpreted symbol of the given arity.
 */
sealed interface Operator permits Operator.Builtin, Operator.Uninterpreted {

    static Operator resolve(String name, int arity) {
        return Builtin.named(name).<Operator>map(b -> b).orElseGet(() -> new Uninterpreted(name, arity));
    }

    enum Category {
        ARITHMETIC, BOOLEAN, COMPARISON, COMPLEX, RATIONAL
    }

    enum Builtin implements Operator {
        PLUS(Category.ARITHMETIC, 2, Integer.MAX_VALUE, "plus", "add"),
        MINUS(Category.ARITHMETIC, 1, 2, "minus", "subtract"),
        TIMES(Category.ARITHMETIC, 2, Integer.MAX_VALUE, "times", "multiply"),
        DIVIDE(Category.ARITHMETIC, 2, 2, "divide", "div_real"),
        NEGATE(Category.ARITHMETIC, 1, 1, "negate", "neg"),
        POWER(Category.ARITHMETIC, 2, 2, "power", "pow", "^"),
        SQRT(Category.ARITHMETIC, 1, 1, "sqrt"),
        ABS(Category.ARITHMETIC, 1, 1, "abs", "absolute"),
        INT_DIV(Category.ARITHMETIC, 2, 2, "int_div", "div"),
        MOD(Category.ARITHMETIC, 2, 2, "mod", "int_mod"),
        REM(Category.ARITHMETIC, 2, 2, "rem", "int_rem"),
        FLOOR(Category.ARITHMETIC, 1, 1, "floor"),
        CEIL(Category.ARITHMETIC, 1, 1, "ceil", "ceiling"),

        AND(Category.BOOLEAN, 2, Integer.MAX_VALUE, "and", "logical_and"),
        OR(Category.BOOLEAN, 2, Integer.MAX_VALUE, "or", "logical_or"),
        NOT(Category.BOOLEAN, 1, 1, "not", "logical_not"),
        IMPLIES(Category.BOOLEAN, 2, 2, "implies"),
        IFF(Category.BOOLEAN, 2, 2, "iff"),

        EQUALS(Category.COMPARISON, 2, 2, "equals", "eq"),
        NEQ(Category.COMPARISON, 2, 2, "neq", "not_equals"),
        LT(Category.COMPARISON, 2, 2, "less_than", "lt"),
        GT(Category.COMPARISON, 2, 2, "greater_than", "gt"),
        LE(Category.COMPARISON, 2, 2, "leq", "le"),
        GE(Category.COMPARISON, 2, 2, "geq", "ge"),

        I(Category.COMPLEX, 0, 0, "i"),
        COMPLEX(Category.COMPLEX, 2, 2, "complex"),
        RE(Category.COMPLEX, 1, 1, "re", "real_part"),
        IM(Category.COMPLEX, 1, 1, "im", "imag_part"),
        CONJ(Category.COMPLEX, 1, 1, "conj", "conjugate"),
        COMPLEX_ADD(Category.COMPLEX, 2, 2, "complex_add"),
        COMPLEX_SUB(Category.COMPLEX, 2, 2, "complex_sub"),
        COMPLEX_MUL(Category.COMPLEX, 2, 2, "complex_mul"),
        COMPLEX_DIV(Category.COMPLEX, 2, 2, "complex_div"),
        COMPLEX_INVERSE(Category.COMPLEX, 1, 1, "complex_inverse"),
        NEG_COMPLEX(Category.COMPLEX, 1, 1, "neg_complex"),
        ABS_SQUARED(Category.COMPLEX, 1, 1, "abs_squared"),

        RATIONAL(Category.RATIONAL, 2, 2, "rational"),
        RATIONAL_ADD(Category.RATIONAL, 2, 2, "rational_add", "rat_add"),
        RATIONAL_SUB(Category.RATIONAL, 2, 2, "rational_sub", "rat_sub"),
        RATIONAL_MUL(Category.RATIONAL, 2, 2, "rational_mul", "rat_mul"),
        RATIONAL_DIV(Category.RATIONAL, 2, 2, "rational_div", "rat_div"),
        NEG_RATIONAL(Category.RATIONAL, 1, 1, "neg_rational", "rat_neg"),
        RATIONAL_INV(Category.RATIONAL, 1, 1, "rational_inv", "rat_inv"),
        RATIONAL_LT(Category.RATIONAL, 2, 2, "rational_lt", "rat_lt"),
        RATIONAL_LE(Category.RATIONAL, 2, 2, "rational_le", "rat_le"),
        RATIONAL_GT(Category.RATIONAL, 2, 2, "rational_gt", "rat_gt"),
        RATIONAL_GE(Category.RATIONAL, 2, 2, "rational_ge", "rat_ge"),
        TO_REAL(Category.RATIONAL, 1, 1, "int_to_rational", "to_real"),
        NUMER(Category.RATIONAL, 1, 1, "numer"),
        DENOM(Category.RATIONAL, 1, 1, "denom");

        private static final Map<String, Builtin> byName = new HashMap<>();

        static {
            for (var b : values())
                for (var n : b.names)
                    if (byName.put(n, b) != null) throw new IllegalStateException("Duplicate operator alias: " + n);
        }

        public final Category category;
        public final int minArity, maxArity;
        private final String[] names;

        Builtin(Category category, int minArity, int maxArity, String... names) {
            this.category = category;
            this.minArity = minArity;
            this.maxArity = maxArity;
            this.names = names;
        }

        static Optional<Builtin> named(String name) {
            return Optional.ofNullable(byName.get(name));
        }

        /** Canonical (first) spelling. */
        public String symbol() {
            return names[0];
        }

        public boolean accepts(int arity) {
            return arity >= minArity && arity <= maxArity;
        }

        @Override
        public String toString() {
            return symbol() + Arrays.toString(names);
        }
    }

    record Uninterpreted(String name, int arity) implements Operator {
        public Uninterpreted {
            requireNonNull(name);
            if (arity < 0) throw new IllegalArgumentException("Negative arity for " + name);
        }
    }
}
