package dumb.kleis.solver;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import static java.util.Objects.requireNonNull;

@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = Satisfiability.Satisfiable.class, name = "satisfiable"),
        @JsonSubTypes.Type(value = Satisfiability.Unsatisfiable.class, name = "unsatisfiable"),
        @JsonSubTypes.Type(value = Satisfiability.Unknown.class, name = "unknown")
})
sealed public interface Satisfiability permits Satisfiability.Satisfiable, Satisfiability.Unsatisfiable, Satisfiability.Unknown {

    default boolean satisfiable() {
        return this instanceof Satisfiable;
    }

    record Satisfiable(Witness example) implements Satisfiability {
        public Satisfiable {
            requireNonNull(example);
        }
    }

    record Unsatisfiable() implements Satisfiability {
    }

    record Unknown(String reason) implements Satisfiability {
        public Unknown {
            requireNonNull(reason);
        }
    }
}
