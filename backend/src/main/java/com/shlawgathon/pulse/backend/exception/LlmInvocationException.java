package com.shlawgathon.pulse.backend.exception;

/**
 * Transport-level failure talking to the completion service:
 * timeout, connection error, non-200 status or rate limiting.
 */
public class LlmInvocationException extends Exception {

    private final int statusCode;

    public LlmInvocationException(String message) {
        this(message, -1, null);
    }

    public LlmInvocationException(String message, Throwable cause) {
        this(message, -1, cause);
    }

    public LlmInvocationException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /**
     * HTTP status of the failed call, or -1 when no response was received.
     */
    public int getStatusCode() {
        return statusCode;
    }

    public boolean isRateLimited() {
        return statusCode == 429;
    }
}
