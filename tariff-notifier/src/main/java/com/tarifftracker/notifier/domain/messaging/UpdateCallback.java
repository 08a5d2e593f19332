package com.tarifftracker.notifier.domain.messaging;

import java.util.Locale;
import java.util.Optional;

/**
 * Button payload of an update proposal: {@code rate_update:<action>:<userId>}.
 */
public record UpdateCallback(UpdateAction action, String userId) {

    static final String PREFIX = "rate_update";
    private static final String SEPARATOR = ":";

    public String data() {
        return PREFIX + SEPARATOR + action.name().toLowerCase(Locale.ROOT) + SEPARATOR + userId;
    }

    public static Optional<UpdateCallback> parse(String data) {
        if (data == null) {
            return Optional.empty();
        }
        var parts = data.split(SEPARATOR, 3);
        if (parts.length != 3 || !PREFIX.equals(parts[0]) || parts[2].isBlank()) {
            return Optional.empty();
        }
        for (var action : UpdateAction.values()) {
            if (action.name().equalsIgnoreCase(parts[1])) {
                return Optional.of(new UpdateCallback(action, parts[2]));
            }
        }
        return Optional.empty();
    }
}
