package com.tarifftracker.notifier.domain.exceptions;

public class DispatchException extends RuntimeException {

    protected DispatchException(String message, Throwable cause) {
        super(message, cause);
    }

    public static DispatchException transientFailure(String userId, String reason, Throwable cause) {
        return new DispatchException("Message to " + userId + " not sent: " + reason, cause);
    }

    public static DispatchException rateLimited(String userId, long retryAfterSeconds) {
        return new DispatchException(
                "Message to " + userId + " rate limited, retry after " + retryAfterSeconds + "s", null);
    }
}
