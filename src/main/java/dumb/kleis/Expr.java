package dumb.kleis;

import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static java.util.Objects.requireNonNull;

/**
 * Expression tree of axioms, goals and function bodies. Immutable; rendered back to
 * s-expression text by {@link #toSexp()}.
 */
sealed public interface Expr permits Expr.Const, Expr.Obj, Expr.Op, Expr.Quant, Expr.Cond, Expr.Let, Expr.Match, Expr.Lst {

    static Const num(long value) {
        return new Const(Long.toString(value));
    }

    static Const bool(boolean value) {
        return new Const(Boolean.toString(value));
    }

    static Obj obj(String name) {
        return new Obj(name);
    }

    static Op op(String name, Expr... args) {
        return new Op(name, List.of(args));
    }

    static Quant forAll(List<QuantVar> vars, Expr body) {
        return new Quant(Quantifier.FORALL, vars, null, body);
    }

    static Quant exists(List<QuantVar> vars, Expr body) {
        return new Quant(Quantifier.EXISTS, vars, null, body);
    }

    String toSexp();

    /** Direct sub-expressions, in source order. */
    List<Expr> children();

    enum Quantifier {
        FORALL("forall"), EXISTS("exists");

        public final String symbol;

        Quantifier(String symbol) {
            this.symbol = symbol;
        }
    }

    /** Numeric or boolean literal, kept as written. */
    record Const(String value) implements Expr {
        public Const {
            requireNonNull(value);
            if (value.isBlank()) throw new IllegalArgumentException("Empty literal");
        }

        @Override
        public String toSexp() {
            return value;
        }

        @Override
        public List<Expr> children() {
            return List.of();
        }
    }

    /** Named reference: a bound variable, an element or nullary operation, or a free symbol. */
    record Obj(String name) implements Expr {
        public Obj {
            requireNonNull(name);
        }

        @Override
        public String toSexp() {
            return name;
        }

        @Override
        public List<Expr> children() {
            return List.of();
        }
    }

    record Op(String name, List<Expr> args) implements Expr {
        public Op {
            requireNonNull(name);
            args = List.copyOf(args);
        }

        public int arity() {
            return args.size();
        }

        @Override
        public String toSexp() {
            return args.isEmpty() ? "(" + name + ")" :
                    args.stream().map(Expr::toSexp).collect(Collectors.joining(" ", "(" + name + " ", ")"));
        }

        @Override
        public List<Expr> children() {
            return args;
        }
    }

    record QuantVar(String name, @Nullable String type) {
        public QuantVar {
            requireNonNull(name);
        }

        public static QuantVar of(String name) {
            return new QuantVar(name, null);
        }

        public static QuantVar of(String name, String type) {
            return new QuantVar(name, type);
        }

        String toSexp() {
            return type == null ? name : "(" + name + " " + type + ")";
        }
    }

    record Quant(Quantifier kind, List<QuantVar> vars, @Nullable Expr where, Expr body) implements Expr {
        public Quant {
            requireNonNull(kind);
            requireNonNull(body);
            vars = List.copyOf(vars);
        }

        @Override
        public String toSexp() {
            var vs = vars.stream().map(QuantVar::toSexp).collect(Collectors.joining(" ", "(", ")"));
            var guard = where == null ? "" : " (where " + where.toSexp() + ")";
            return "(" + kind.symbol + " " + vs + guard + " " + body.toSexp() + ")";
        }

        @Override
        public List<Expr> children() {
            return where == null ? List.of(body) : List.of(where, body);
        }
    }

    record Cond(Expr test, Expr then, Expr otherwise) implements Expr {
        public Cond {
            requireNonNull(test);
            requireNonNull(then);
            requireNonNull(otherwise);
        }

        @Override
        public String toSexp() {
            return "(if " + test.toSexp() + " " + then.toSexp() + " " + otherwise.toSexp() + ")";
        }

        @Override
        public List<Expr> children() {
            return List.of(test, then, otherwise);
        }
    }

    record Let(String name, Expr value, Expr body) implements Expr {
        public Let {
            requireNonNull(name);
            requireNonNull(value);
            requireNonNull(body);
        }

        @Override
        public String toSexp() {
            return "(let " + name + " " + value.toSexp() + " " + body.toSexp() + ")";
        }

        @Override
        public List<Expr> children() {
            return List.of(value, body);
        }
    }

    record Case(Pattern pattern, Expr body) {
        public Case {
            requireNonNull(pattern);
            requireNonNull(body);
        }
    }

    record Match(Expr scrutinee, List<Case> cases) implements Expr {
        public Match {
            requireNonNull(scrutinee);
            cases = List.copyOf(cases);
            if (cases.isEmpty()) throw new IllegalArgumentException("match without cases");
        }

        @Override
        public String toSexp() {
            return cases.stream()
                    .map(c -> "(" + c.pattern().toSexp() + " " + c.body().toSexp() + ")")
                    .collect(Collectors.joining(" ", "(match " + scrutinee.toSexp() + " ", ")"));
        }

        @Override
        public List<Expr> children() {
            return Stream.concat(Stream.of(scrutinee), cases.stream().map(Case::body)).toList();
        }
    }

    record Lst(List<Expr> elements) implements Expr {
        public Lst {
            elements = List.copyOf(elements);
        }

        @Override
        public String toSexp() {
            return elements.stream().map(Expr::toSexp).collect(Collectors.joining(" ", "(list" + (elements.isEmpty() ? "" : " "), ")"));
        }

        @Override
        public List<Expr> children() {
            return elements;
        }
    }
}
