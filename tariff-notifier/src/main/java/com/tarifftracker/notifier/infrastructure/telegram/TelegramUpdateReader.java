package com.tarifftracker.notifier.infrastructure.telegram;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.meta.api.objects.Update;

/**
 * Reads webhook payloads into Bot API {@link Update}s. Fields added by newer Bot API versions are
 * ignored.
 */
@Component
public class TelegramUpdateReader {

    private final ObjectMapper objectMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public Update read(String payload) {
        if (payload == null || payload.isBlank()) {
            throw MalformedUpdateException.empty();
        }
        try {
            var update = objectMapper.readValue(payload, Update.class);
            if (update == null) {
                throw MalformedUpdateException.empty();
            }
            return update;
        } catch (JsonProcessingException ex) {
            throw MalformedUpdateException.unreadable(ex);
        }
    }
}
