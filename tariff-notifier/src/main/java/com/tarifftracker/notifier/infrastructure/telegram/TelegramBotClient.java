package com.tarifftracker.notifier.infrastructure.telegram;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tarifftracker.notifier.domain.exceptions.DispatchException;
import com.tarifftracker.notifier.domain.exceptions.RecipientUnreachableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.telegram.telegrambots.meta.api.methods.AnswerCallbackQuery;
import org.telegram.telegrambots.meta.api.methods.BotApiMethod;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.methods.updatingmessages.EditMessageText;
import org.telegram.telegrambots.meta.exceptions.TelegramApiRequestException;
import org.telegram.telegrambots.meta.exceptions.TelegramApiValidationException;

import java.io.Serializable;
import java.util.List;
import java.util.Locale;

/**
 * Executes Bot API methods over HTTP. Failures are mapped onto the dispatch exception family:
 * permanent recipient errors become {@link RecipientUnreachableException}, everything else is
 * transient.
 */
@Slf4j
@Component
public class TelegramBotClient {

    static final List<String> UNREACHABLE_MARKERS = List.of(
            "bot was blocked by the user",
            "user is deactivated",
            "bot was kicked",
            "chat not found");

    private static final List<String> EXPIRED_QUERY_MARKERS = List.of(
            "query is too old",
            "query id is invalid");

    private static final String NOT_MODIFIED_MARKER = "message is not modified";

    private final ObjectMapper objectMapper = new ObjectMapper()
            .setDefaultPropertyInclusion(JsonInclude.Include.NON_NULL);
    private final RestClient restClient;
    private final String botToken;

    @Autowired
    public TelegramBotClient(TelegramProperties properties) {
        this(RestClient.builder().requestFactory(requestFactory(properties)), properties);
    }

    TelegramBotClient(RestClient.Builder builder, TelegramProperties properties) {
        this.restClient = builder.baseUrl(properties.apiBaseUrl()).build();
        this.botToken = properties.botToken();
    }

    public void sendMessage(SendMessage message) {
        execute(message, message.getChatId());
    }

    /**
     * Edits a previously sent message. An edit that would leave the text unchanged is not an error.
     */
    public void editMessageText(EditMessageText edit) {
        try {
            execute(edit, edit.getChatId());
        } catch (DispatchException ex) {
            if (!mentions(ex.getMessage(), List.of(NOT_MODIFIED_MARKER))) {
                throw ex;
            }
            log.debug("telegram.edit_unchanged: chat_id={}, message_id={}", edit.getChatId(), edit.getMessageId());
        }
    }

    /**
     * Acknowledges a button press. Telegram only accepts answers for a short while; expired queries
     * are ignored.
     */
    public void answerCallbackQuery(String callbackQueryId, String userId) {
        try {
            execute(new AnswerCallbackQuery(callbackQueryId), userId);
        } catch (DispatchException ex) {
            if (!mentions(ex.getMessage(), EXPIRED_QUERY_MARKERS)) {
                throw ex;
            }
            log.debug("telegram.callback_expired: user_id={}, callback_query_id={}", userId, callbackQueryId);
        }
    }

    private <T extends Serializable> T execute(BotApiMethod<T> method, String userId) {
        String payload;
        try {
            method.validate();
            payload = objectMapper.writeValueAsString(method);
        } catch (TelegramApiValidationException | JsonProcessingException ex) {
            throw new IllegalArgumentException("Invalid " + method.getMethod() + " request: " + ex.getMessage(), ex);
        }

        Reply reply;
        try {
            reply = restClient.post()
                    .uri("/bot{token}/{method}", botToken, method.getMethod())
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(payload)
                    .exchange((request, response) ->
                            new Reply(response.getStatusCode().value(), response.bodyTo(String.class)));
        } catch (ResourceAccessException ex) {
            throw DispatchException.transientFailure(userId, "network error calling " + method.getMethod(), ex);
        }

        try {
            return method.deserializeResponse(reply.body() == null ? "" : reply.body());
        } catch (TelegramApiRequestException ex) {
            throw classify(userId, reply.status(), ex);
        }
    }

    static DispatchException classify(String userId, int status, TelegramApiRequestException error) {
        var description = error.getApiResponse() == null ? "" : error.getApiResponse();
        if (mentions(description, UNREACHABLE_MARKERS)) {
            return RecipientUnreachableException.of(userId, description);
        }
        var code = error.getErrorCode() == null ? status : error.getErrorCode();
        if (code == 429) {
            var retryAfter = error.getParameters() == null || error.getParameters().getRetryAfter() == null
                    ? 0
                    : error.getParameters().getRetryAfter();
            return DispatchException.rateLimited(userId, retryAfter);
        }
        return DispatchException.transientFailure(userId, "HTTP " + code + " " + description, error);
    }

    private static boolean mentions(String text, List<String> markers) {
        if (text == null) {
            return false;
        }
        var lower = text.toLowerCase(Locale.ROOT);
        return markers.stream().anyMatch(lower::contains);
    }

    private static SimpleClientHttpRequestFactory requestFactory(TelegramProperties properties) {
        var factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(properties.connectTimeout());
        factory.setReadTimeout(properties.readTimeout());
        return factory;
    }

    private record Reply(int status, String body) {
    }
}
