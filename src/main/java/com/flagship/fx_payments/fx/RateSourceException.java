package com.flagship.fx_payments.fx;

import lombok.Getter;

/**
 * Upstream rate failure. Never leaves the fx package as an API error.
 */
@Getter
public class RateSourceException extends RuntimeException {

    public enum Failure {
        UNAVAILABLE(true),
        RATE_LIMITED(false),
        INVALID_KEY(false),
        NETWORK(true);

        private final boolean retryable;

        Failure(boolean retryable) {
            this.retryable = retryable;
        }

        public boolean isRetryable() {
            return retryable;
        }
    }

    private final Failure failure;

    public RateSourceException(Failure failure, String message) {
        super(message);
        this.failure = failure;
    }

    public RateSourceException(Failure failure, String message, Throwable cause) {
        super(message, cause);
        this.failure = failure;
    }
}
