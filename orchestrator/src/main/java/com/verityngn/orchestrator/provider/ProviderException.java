package com.verityngn.orchestrator.provider;

import java.time.Duration;

/**
 * Failure of a single provider call.
 *
 * TRANSIENT, RATE_LIMITED and TIMEOUT consume the stage's retry budget for
 * the current provider; UNAVAILABLE moves straight to the next provider in
 * the fallback chain without counting as an attempt.
 */
public class ProviderException extends RuntimeException {

    public enum Kind { TRANSIENT, RATE_LIMITED, TIMEOUT, UNAVAILABLE }

    private final Kind     kind;
    private final Duration retryAfter;

    public ProviderException(Kind kind, String message) {
        this(kind, message, null, null);
    }

    public ProviderException(Kind kind, String message, Throwable cause) {
        this(kind, message, null, cause);
    }

    public ProviderException(Kind kind, String message, Duration retryAfter, Throwable cause) {
        super("[" + kind + "] " + message, cause);
        this.kind       = kind;
        this.retryAfter = retryAfter;
    }

    public static ProviderException rateLimited(String message, Duration retryAfter) {
        return new ProviderException(Kind.RATE_LIMITED, message, retryAfter, null);
    }

    public Kind getKind() { return kind; }

    /** Server-suggested wait for RATE_LIMITED, null when none was given. */
    public Duration getRetryAfter() { return retryAfter; }

    public boolean isRetryable() { return kind != Kind.UNAVAILABLE; }
}
