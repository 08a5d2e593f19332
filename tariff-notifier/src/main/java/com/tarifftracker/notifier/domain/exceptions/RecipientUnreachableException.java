package com.tarifftracker.notifier.domain.exceptions;

/**
 * The recipient will never receive messages again (bot blocked, account deactivated, chat gone).
 */
public class RecipientUnreachableException extends DispatchException {

    private RecipientUnreachableException(String message) {
        super(message, null);
    }

    public static RecipientUnreachableException of(String userId, String reason) {
        return new RecipientUnreachableException("Recipient " + userId + " unreachable: " + reason);
    }
}
