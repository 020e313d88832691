package io.ledgerbridge.settlement;

import io.ledgerbridge.ledger.TransferHandle;

/**
 * Result of one governed submission step.
 */
public record SubmitAttempt(Outcome outcome, TransferHandle handle, int attempts, String error) {

    public enum Outcome {
        /** Submitted now. */
        SUBMITTED,
        /** An earlier submission was found on the ledger by its memo. */
        RECOVERED,
        /** Submission failed cleanly; retry after the cooldown. */
        FAILED,
        /** Submission outcome unknown; the next step starts with a memo lookup. */
        AMBIGUOUS,
        /** Attempt limit reached. */
        EXHAUSTED,
        COOLING_DOWN,
        /** The memo lookup itself failed, so submitting again is unsafe for now. */
        DEFERRED
    }

    static SubmitAttempt submitted(TransferHandle handle, int attempts) {
        return new SubmitAttempt(Outcome.SUBMITTED, handle, attempts, null);
    }

    static SubmitAttempt recovered(TransferHandle handle, int attempts) {
        return new SubmitAttempt(Outcome.RECOVERED, handle, attempts, null);
    }

    static SubmitAttempt failed(int attempts, String error) {
        return new SubmitAttempt(Outcome.FAILED, null, attempts, error);
    }

    static SubmitAttempt ambiguous(int attempts, String error) {
        return new SubmitAttempt(Outcome.AMBIGUOUS, null, attempts, error);
    }

    static SubmitAttempt exhausted(int attempts, String error) {
        return new SubmitAttempt(Outcome.EXHAUSTED, null, attempts, error);
    }

    static SubmitAttempt coolingDown(int attempts) {
        return new SubmitAttempt(Outcome.COOLING_DOWN, null, attempts, null);
    }

    static SubmitAttempt deferred(int attempts, String error) {
        return new SubmitAttempt(Outcome.DEFERRED, null, attempts, error);
    }
}
