package com.tarifftracker.notifier.application.controller.telegram;

public class InvalidWebhookSecretException extends RuntimeException {

    private InvalidWebhookSecretException(String message) {
        super(message);
    }

    public static InvalidWebhookSecretException missing() {
        return new InvalidWebhookSecretException("secret header missing");
    }

    public static InvalidWebhookSecretException mismatch() {
        return new InvalidWebhookSecretException("secret header mismatch");
    }
}
