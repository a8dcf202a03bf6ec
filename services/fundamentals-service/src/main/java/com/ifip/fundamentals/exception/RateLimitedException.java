package com.ifip.fundamentals.exception;

import java.time.Duration;
import java.util.Optional;

public class RateLimitedException extends UpstreamUnavailableException {

    private final Duration retryAfter;

    public RateLimitedException(String message, Duration retryAfter) {
        super(message);
        this.retryAfter = retryAfter;
    }

    public Optional<Duration> getRetryAfter() {
        return Optional.ofNullable(retryAfter);
    }
}
