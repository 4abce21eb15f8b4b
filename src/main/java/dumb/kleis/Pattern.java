package dumb.kleis;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static java.util.Objects.requireNonNull;

/** Left-hand side of a {@code match} case. */
sealed public interface Pattern permits Pattern.Wildcard, Pattern.Variable, Pattern.Constant, Pattern.Constructor {

    Wildcard ANY = new Wildcard();

    String toSexp();

    /** Names this pattern binds, nested fields included. */
    default Stream<String> variables() {
        return Stream.empty();
    }

    /** Matches every value without testing it. */
    default boolean irrefutable() {
        return false;
    }

    record Wildcard() implements Pattern {
        @Override
        public String toSexp() {
            return "_";
        }

        @Override
        public boolean irrefutable() {
            return true;
        }
    }

    record Variable(String name) implements Pattern {
        public Variable {
            requireNonNull(name);
        }

        @Override
        public String toSexp() {
            return name;
        }

        @Override
        public Stream<String> variables() {
            return Stream.of(name);
        }

        @Override
        public boolean irrefutable() {
            return true;
        }
    }

    record Constant(String value) implements Pattern {
        public Constant {
            requireNonNull(value);
        }

        @Override
        public String toSexp() {
            return value;
        }
    }

    record Constructor(String name, List<Pattern> args) implements Pattern {
        public Constructor {
            requireNonNull(name);
            args = List.copyOf(args);
        }

        @Override
        public String toSexp() {
            return args.stream().map(Pattern::toSexp).collect(Collectors.joining(" ", "(" + name + (args.isEmpty() ? "" : " "), ")"));
        }

        @Override
        public Stream<String> variables() {
            return args.stream().flatMap(Pattern::variables);
        }
    }
}
