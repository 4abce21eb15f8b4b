package dumb.kleis;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static java.util.Objects.requireNonNull;

/** Declared type of an operation, element, parameter or structure argument. */
sealed public interface TypeExpr permits TypeExpr.Named, TypeExpr.Parametric, TypeExpr.Function, TypeExpr.Product {

    static Named named(String name) {
        return new Named(name);
    }

    String toSexp();

    /** Head name: the type constructor for parametric types, {@code ->} and {@code *} otherwise. */
    String head();

    record Named(String name) implements TypeExpr {
        public Named {
            requireNonNull(name);
        }

        @Override
        public String toSexp() {
            return name;
        }

        @Override
        public String head() {
            return name;
        }
    }

    record Parametric(String name, List<TypeExpr> args) implements TypeExpr {
        public Parametric {
            requireNonNull(name);
            args = List.copyOf(args);
        }

        @Override
        public String toSexp() {
            return args.stream().map(TypeExpr::toSexp).collect(Collectors.joining(" ", "(" + name + " ", ")"));
        }

        @Override
        public String head() {
            return name;
        }
    }

    /** {@code params → result}; a single product parameter is kept as written. */
    record Function(List<TypeExpr> params, TypeExpr result) implements TypeExpr {
        public Function {
            params = List.copyOf(params);
            requireNonNull(result);
        }

        @Override
        public String toSexp() {
            return params.stream().map(TypeExpr::toSexp).collect(Collectors.joining(" ", "(-> ", " " + result.toSexp() + ")"));
        }

        @Override
        public String head() {
            return "->";
        }

        /** Parameters with products flattened, one entry per argument position. */
        public List<TypeExpr> arguments() {
            return params.stream()
                    .flatMap(p -> p instanceof Product prod ? prod.types().stream() : Stream.of(p))
                    .toList();
        }
    }

    record Product(List<TypeExpr> types) implements TypeExpr {
        public Product {
            types = List.copyOf(types);
        }

        @Override
        public String toSexp() {
            return types.stream().map(TypeExpr::toSexp).collect(Collectors.joining(" ", "(* ", ")"));
        }

        @Override
        public String head() {
            return "*";
        }
    }
}
