package dumb.kleis;

import static java.util.Objects.requireNonNull;

/**
 * Failure of a single verifier call. The verifier stays usable afterwards: the loaded
 * structures and the background facts are as they were before the call.
 */
public class VerificationException extends Exception {

    private final Kind kind;

    public VerificationException(Kind kind, String message) {
        super(message);
        this.kind = requireNonNull(kind);
    }

    public VerificationException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = requireNonNull(kind);
    }

    public static VerificationException registration(String message) {
        return new VerificationException(Kind.REGISTRATION, message);
    }

    public static VerificationException unresolved(String message) {
        return new VerificationException(Kind.UNRESOLVED_REFERENCE, message);
    }

    public static VerificationException translation(String message) {
        return new VerificationException(Kind.TRANSLATION, message);
    }

    public static VerificationException unavailable(String message, Throwable cause) {
        return new VerificationException(Kind.SOLVER_UNAVAILABLE, message, cause);
    }

    public Kind kind() {
        return kind;
    }

    @Override
    public String getMessage() {
        return kind.label + ": " + super.getMessage();
    }

    public enum Kind {
        REGISTRATION("Registration error"),
        UNRESOLVED_REFERENCE("Unresolved reference"),
        TRANSLATION("Translation error"),
        SOLVER_UNAVAILABLE("Solver unavailable");

        private final String label;

        Kind(String label) {
            this.label = label;
        }
    }
}
