package dumb.kleis;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/** Raw s-expression, before it is read as an expression or declaration. */
sealed public interface Sexp permits Sexp.Atom, Sexp.Lst {

    String toSexp();

    /** 1-based source line, or -1 when unknown. */
    int line();

    record Atom(String value, boolean quoted, int line) implements Sexp {
        public Atom {
            requireNonNull(value);
        }

        public static Atom of(String value) {
            return new Atom(value, false, -1);
        }

        @Override
        public String toSexp() {
            return quoted ? '"' + value.replace("\\", "\\\\").replace("\"", "\\\"") + '"' : value;
        }

        @Override
        public String toString() {
            return toSexp();
        }
    }

    record Lst(List<Sexp> items, int line) implements Sexp {
        public Lst {
            items = List.copyOf(items);
        }

        public Sexp get(int index) {
            return items.get(index);
        }

        public int size() {
            return items.size();
        }

        public boolean isEmpty() {
            return items.isEmpty();
        }

        /** Head symbol, when the first item is an unquoted atom. */
        public Optional<String> op() {
            return items.isEmpty() || !(items.get(0) instanceof Atom a) || a.quoted() ? Optional.empty() : Optional.of(a.value());
        }

        public List<Sexp> tail() {
            return items.subList(1, items.size());
        }

        @Override
        public String toSexp() {
            return items.stream().map(Sexp::toSexp).collect(Collectors.joining(" ", "(", ")"));
        }

        @Override
        public String toString() {
            return toSexp();
        }
    }
}
