package com.tarifftracker.notifier.application.controller.telegram;

import com.tarifftracker.notifier.domain.exceptions.DispatchException;
import com.tarifftracker.notifier.domain.messaging.UpdateAction;
import com.tarifftracker.notifier.domain.messaging.UpdateCallback;
import com.tarifftracker.notifier.domain.notification.NotificationFormatter;
import com.tarifftracker.notifier.domain.pending.AcceptDeclineHandler;
import com.tarifftracker.notifier.domain.pending.UpdateOutcome;
import com.tarifftracker.notifier.infrastructure.telegram.MessageHtml;
import com.tarifftracker.notifier.infrastructure.telegram.TelegramBotClient;
import com.tarifftracker.notifier.infrastructure.telegram.TelegramProperties;
import com.tarifftracker.notifier.infrastructure.telegram.TelegramUpdateReader;
import io.micrometer.core.instrument.Counter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.telegram.telegrambots.meta.api.methods.ParseMode;
import org.telegram.telegrambots.meta.api.methods.updatingmessages.EditMessageText;
import org.telegram.telegrambots.meta.api.objects.CallbackQuery;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Receives Bot API updates. Only proposal button presses are acted on. Once the secret header
 * checks out the answer is always 200 so that Telegram does not redeliver the update.
 */
@Slf4j
@RestController
@RequestMapping("/telegram")
@RequiredArgsConstructor
public class TelegramWebhookController {

    static final String SECRET_HEADER = "X-Telegram-Bot-Api-Secret-Token";
    static final String ACCEPTED_TEXT = "✅ Tariffs updated!";
    static final String DECLINED_TEXT = "🔧 You can always update your tariffs with /update.";
    static final String FAILED_TEXT = "❌ Update failed. Try again with /update.";

    private final AcceptDeclineHandler acceptDeclineHandler;
    private final TelegramBotClient botClient;
    private final TelegramUpdateReader updateReader;
    private final TelegramProperties telegramProperties;
    private final Counter updatesAcceptedCounter;
    private final Counter updatesDeclinedCounter;

    @PostMapping("/webhook")
    public ResponseEntity<Void> onUpdate(
            @RequestHeader(value = SECRET_HEADER, required = false) String secret,
            @RequestBody String payload) {
        verifySecret(secret);
        var update = updateReader.read(payload);

        if (!update.hasCallbackQuery()) {
            log.debug("webhook.ignored: update_id={}, reason=not_a_callback", update.getUpdateId());
            return ResponseEntity.ok().build();
        }

        var query = update.getCallbackQuery();
        try {
            handleCallback(query);
        } catch (RuntimeException ex) {
            log.error("webhook.failed: update_id={}, callback_query_id={}", update.getUpdateId(), query.getId(), ex);
        }
        return ResponseEntity.ok().build();
    }

    private void handleCallback(CallbackQuery query) {
        var presserId = query.getFrom() == null ? null : String.valueOf(query.getFrom().getId());
        answerQuietly(query, presserId);

        var callback = UpdateCallback.parse(query.getData()).orElse(null);
        if (callback == null) {
            log.debug("webhook.ignored: callback_query_id={}, reason=unknown_data", query.getId());
            return;
        }
        if (!callback.userId().equals(presserId)) {
            log.warn("webhook.ignored: callback_query_id={}, reason=user_mismatch, target={}, presser={}",
                    query.getId(), callback.userId(), presserId);
            return;
        }

        var outcome = callback.action() == UpdateAction.ACCEPT
                ? acceptDeclineHandler.accept(callback.userId())
                : acceptDeclineHandler.decline(callback.userId());
        countOutcome(outcome);
        log.info("webhook.handled: user_id={}, action={}, outcome={}", callback.userId(), callback.action(), outcome);

        replacePrompt(query, outcomeText(outcome));
    }

    private void replacePrompt(CallbackQuery query, String replacement) {
        var message = query.getMessage();
        if (message == null || message.getChat() == null) {
            return;
        }
        var edit = new EditMessageText();
        edit.setChatId(String.valueOf(message.getChat().getId()));
        edit.setText(MessageHtml.render(message).replace(NotificationFormatter.UPDATE_PROMPT, replacement));
        edit.setMessageId(message.getMessageId());
        edit.setParseMode(ParseMode.HTML);
        edit.setDisableWebPagePreview(true);
        botClient.editMessageText(edit);
    }

    private void answerQuietly(CallbackQuery query, String presserId) {
        try {
            botClient.answerCallbackQuery(query.getId(), presserId);
        } catch (DispatchException ex) {
            log.warn("webhook.answer_failed: callback_query_id={}, error={}", query.getId(), ex.getMessage());
        }
    }

    private void countOutcome(UpdateOutcome outcome) {
        if (outcome == UpdateOutcome.ACCEPTED) {
            updatesAcceptedCounter.increment();
        } else if (outcome == UpdateOutcome.DECLINED) {
            updatesDeclinedCounter.increment();
        }
    }

    static String outcomeText(UpdateOutcome outcome) {
        return switch (outcome) {
            case ACCEPTED -> ACCEPTED_TEXT;
            case DECLINED, NOTHING_PENDING -> DECLINED_TEXT;
            case FAILED -> FAILED_TEXT;
        };
    }

    private void verifySecret(String provided) {
        var expected = telegramProperties.webhookSecret();
        if (expected == null || expected.isBlank()) {
            return;
        }
        if (provided == null) {
            throw InvalidWebhookSecretException.missing();
        }
        if (!MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8), provided.getBytes(StandardCharsets.UTF_8))) {
            throw InvalidWebhookSecretException.mismatch();
        }
    }
}
