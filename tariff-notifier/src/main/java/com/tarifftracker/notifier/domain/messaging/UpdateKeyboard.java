package com.tarifftracker.notifier.domain.messaging;

/**
 * The two-button affordance attached to an update proposal.
 */
public record UpdateKeyboard(String acceptLabel, UpdateCallback accept, String declineLabel, UpdateCallback decline) {

    public static UpdateKeyboard forUser(String userId) {
        return new UpdateKeyboard(
                "✅ Update tariffs", new UpdateCallback(UpdateAction.ACCEPT, userId),
                "❌ No thanks", new UpdateCallback(UpdateAction.DECLINE, userId));
    }
}
