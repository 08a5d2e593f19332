package com.tarifftracker.notifier.infrastructure.telegram;

public class MalformedUpdateException extends RuntimeException {

    private MalformedUpdateException(String message, Throwable cause) {
        super(message, cause);
    }

    public static MalformedUpdateException empty() {
        return new MalformedUpdateException("Update payload is empty", null);
    }

    public static MalformedUpdateException unreadable(Throwable cause) {
        return new MalformedUpdateException("Update payload is not a valid Bot API update: " + cause.getMessage(), cause);
    }
}
