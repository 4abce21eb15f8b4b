package dumb.kleis.solver.z3;

import com.microsoft.z3.Context;
import com.microsoft.z3.Sort;
import dumb.kleis.TypeExpr;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

import static java.util.Map.entry;

/** Maps declared type names to solver sorts. */
final class Sorts {

    private static final Map<String, Term.Kind> names = Map.ofEntries(
            entry("Bool", Term.Kind.BOOL), entry("Boolean", Term.Kind.BOOL),
            entry("ℝ", Term.Kind.REAL), entry("Real", Term.Kind.REAL), entry("Scalar", Term.Kind.REAL),
            entry("ℚ", Term.Kind.REAL), entry("Rational", Term.Kind.REAL), entry("Q", Term.Kind.REAL),
            entry("ℤ", Term.Kind.INT), entry("Int", Term.Kind.INT), entry("Integer", Term.Kind.INT),
            entry("ℕ", Term.Kind.INT), entry("Nat", Term.Kind.INT), entry("Natural", Term.Kind.INT),
            entry("ℂ", Term.Kind.COMPLEX), entry("Complex", Term.Kind.COMPLEX)
    );

    static Optional<Term.Kind> builtin(String name) {
        return Optional.ofNullable(names.get(name));
    }

    private final Context ctx;
    private final DataSorts data;
    private final Consumer<String> warn;

    Sorts(Context ctx, DataSorts data, Consumer<String> warn) {
        this.ctx = ctx;
        this.data = data;
        this.warn = warn;
    }

    /** Sort shape: complex has no single solver sort. */
    record Carrier(Term.Kind kind, @Nullable Sort sort) {
        boolean complex() {
            return kind == Term.Kind.COMPLEX;
        }
    }

    Carrier of(@Nullable String annotation) {
        if (annotation == null) return carrier(Term.Kind.INT);
        var k = names.get(annotation);
        if (k != null) return carrier(k);
        var d = data.sort(annotation);
        if (d.isPresent()) return new Carrier(Term.Kind.DATA, d.get());
        warn.accept("Unknown type '" + annotation + "', treating it as Int");
        return carrier(Term.Kind.INT);
    }

    Carrier of(TypeExpr type) {
        if (type instanceof TypeExpr.Function f) return of(f.result());
        return of(type.head());
    }

    /** Argument carriers of a function signature; empty for constant signatures. */
    List<Carrier> params(TypeExpr type) {
        return type instanceof TypeExpr.Function f ? f.arguments().stream().map(this::of).toList() : List.of();
    }

    Carrier carrier(Term.Kind kind) {
        return switch (kind) {
            case BOOL -> new Carrier(kind, ctx.getBoolSort());
            case INT -> new Carrier(kind, ctx.getIntSort());
            case REAL -> new Carrier(kind, ctx.getRealSort());
            case COMPLEX -> new Carrier(kind, null);
            case DATA, OTHER -> throw new IllegalArgumentException("No default sort for " + kind);
        };
    }

    Carrier of(Term t) {
        return t instanceof Term.Value v ? new Carrier(t.kind(), v.expr().getSort()) : carrier(Term.Kind.COMPLEX);
    }
}
