package com.ifip.fundamentals.exception;

/**
 * The facts provider could not be reached or refused to answer. Timeouts, transport failures,
 * server errors and rate limiting are retryable; other rejections are not.
 */
public class UpstreamUnavailableException extends FundamentalsException {

    private final boolean retryable;

    public UpstreamUnavailableException(String message) {
        this(message, null, true);
    }

    public UpstreamUnavailableException(String message, Throwable cause) {
        this(message, cause, true);
    }

    public UpstreamUnavailableException(String message, Throwable cause, boolean retryable) {
        super(message, cause);
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
