package com.vrforacle.ingestion.submit;

/**
 * Outcome of one send-and-confirm attempt.
 */
public record SubmissionAttempt(Outcome outcome, String signature, RuntimeException cause) {

    public enum Outcome {
        SUCCESS,
        RETRYABLE,
        TERMINAL
    }

    public static SubmissionAttempt success(String signature) {
        return new SubmissionAttempt(Outcome.SUCCESS, signature, null);
    }

    public static SubmissionAttempt retryable(RuntimeException cause) {
        return new SubmissionAttempt(Outcome.RETRYABLE, null, cause);
    }

    public static SubmissionAttempt terminal(RuntimeException cause) {
        return new SubmissionAttempt(Outcome.TERMINAL, null, cause);
    }
}
