package dumb.kleis;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import dumb.kleis.solver.Witness;

import static java.util.Objects.requireNonNull;

/** Outcome of verifying one proposition against the loaded background axioms. */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = VerificationResult.Valid.class, name = "valid"),
        @JsonSubTypes.Type(value = VerificationResult.Invalid.class, name = "invalid"),
        @JsonSubTypes.Type(value = VerificationResult.Unknown.class, name = "unknown"),
        @JsonSubTypes.Type(value = VerificationResult.InconsistentAxioms.class, name = "inconsistent"),
        @JsonSubTypes.Type(value = VerificationResult.Disabled.class, name = "disabled")
})
sealed public interface VerificationResult permits VerificationResult.Valid, VerificationResult.Invalid, VerificationResult.Unknown, VerificationResult.InconsistentAxioms, VerificationResult.Disabled {

    VerificationResult VALID = new Valid();
    VerificationResult INCONSISTENT = new InconsistentAxioms();
    VerificationResult DISABLED = new Disabled();

    default boolean valid() {
        return this instanceof Valid;
    }

    /** The proposition holds in every model of the background axioms. */
    record Valid() implements VerificationResult {
    }

    /** Counterexample: an assignment satisfying the background but not the proposition. */
    record Invalid(Witness counterexample) implements VerificationResult {
        public Invalid {
            requireNonNull(counterexample);
        }
    }

    /** Timeout or a theory the solver could not decide. */
    record Unknown(String reason) implements VerificationResult {
        public Unknown {
            requireNonNull(reason);
        }
    }

    /** The background axioms alone are unsatisfiable, so nothing is checked. */
    record InconsistentAxioms() implements VerificationResult {
    }

    /** Verification is switched off by configuration. */
    record Disabled() implements VerificationResult {
    }
}
