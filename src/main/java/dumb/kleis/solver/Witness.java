package dumb.kleis.solver;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/** Model found by the solver: values of the goal's free variables plus the raw model text. */
public record Witness(@JsonProperty("bindings") List<Binding> bindings, @JsonProperty("raw") String raw) {

    public Witness {
        bindings = List.copyOf(bindings);
        requireNonNull(raw);
    }

    public Optional<String> value(String name) {
        return bindings.stream().filter(b -> b.name().equals(name)).map(Binding::value).findFirst();
    }

    @Override
    public String toString() {
        return bindings.isEmpty() ? raw : bindings.stream().map(Binding::toString).collect(Collectors.joining(", "));
    }

    public record Binding(@JsonProperty("name") String name, @JsonProperty("value") String value) {
        public Binding {
            requireNonNull(name);
            requireNonNull(value);
        }

        @Override
        public String toString() {
            return name + " = " + value;
        }
    }
}
