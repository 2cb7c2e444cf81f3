package org.javai.gof;

/**
 * Thrown when {@link Outcome#getOrThrow()} is called on a failed outcome.
 * Unchecked because it indicates misuse: the caller should have checked
 * {@link Outcome#isFail()} first.
 */
public class OutcomeFailedException extends RuntimeException {

    private final Failure failure;

    public OutcomeFailedException(Failure failure) {
        super("Outcome failed [" + failure.stage() + " of " + failure.operation() + "]: " + failure.message());
        this.failure = failure;
    }

    public Failure failure() {
        return failure;
    }
}
