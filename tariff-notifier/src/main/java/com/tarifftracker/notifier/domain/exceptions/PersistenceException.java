package com.tarifftracker.notifier.domain.exceptions;

public class PersistenceException extends RuntimeException {

    private PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }

    public static PersistenceException of(String operation, String userId, Throwable cause) {
        return new PersistenceException("Failed to " + operation + " for user " + userId, cause);
    }

    public static PersistenceException of(String operation, Throwable cause) {
        return new PersistenceException("Failed to " + operation, cause);
    }
}
