package com.vrforacle.ingestion.submit;

/**
 * Terminal submission failure: a non-retryable error or an exhausted retry budget.
 */
public class SubmissionFailedException extends RuntimeException {

    public SubmissionFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
