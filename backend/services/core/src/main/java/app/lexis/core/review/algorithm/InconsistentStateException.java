package app.lexis.core.review.algorithm;

/**
 * A schedule record violates the card-state invariants. Raised instead of repairing
 * the record, so the review that tripped over it fails as a whole.
 */
public class InconsistentStateException extends IllegalStateException {

    public InconsistentStateException(String message) {
        super(message);
    }

    public InconsistentStateException(String message, Throwable cause) {
        super(message, cause);
    }
}
