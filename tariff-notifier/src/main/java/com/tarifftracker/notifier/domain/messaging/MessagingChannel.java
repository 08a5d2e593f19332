package com.tarifftracker.notifier.domain.messaging;

/**
 * Outbound user messages.
 *
 * @throws com.tarifftracker.notifier.domain.exceptions.DispatchException on transient failures
 *         (timeouts, rate limits, network errors)
 * @throws com.tarifftracker.notifier.domain.exceptions.RecipientUnreachableException when the
 *         recipient blocked the bot or no longer exists
 */
public interface MessagingChannel {

    /**
     * @param keyboard accept/decline buttons to attach, or {@code null} for a plain message
     */
    void send(String userId, String text, UpdateKeyboard keyboard);
}
