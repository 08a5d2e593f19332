package com.tarifftracker.notifier.infrastructure.telegram;

import com.tarifftracker.notifier.domain.messaging.MessagingChannel;
import com.tarifftracker.notifier.domain.messaging.UpdateKeyboard;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.meta.api.methods.ParseMode;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.InlineKeyboardMarkup;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.buttons.InlineKeyboardButton;

import java.util.List;

@Slf4j
@Component
@RequiredArgsConstructor
public class TelegramMessagingChannel implements MessagingChannel {

    private final TelegramBotClient client;

    @Override
    public void send(String userId, String text, UpdateKeyboard keyboard) {
        var message = new SendMessage(userId, text);
        message.setParseMode(ParseMode.HTML);
        message.setDisableWebPagePreview(true);
        if (keyboard != null) {
            message.setReplyMarkup(toMarkup(keyboard));
        }
        client.sendMessage(message);
        log.debug("telegram.sent: user_id={}, with_keyboard={}", userId, keyboard != null);
    }

    static InlineKeyboardMarkup toMarkup(UpdateKeyboard keyboard) {
        var accept = new InlineKeyboardButton(keyboard.acceptLabel());
        accept.setCallbackData(keyboard.accept().data());
        var decline = new InlineKeyboardButton(keyboard.declineLabel());
        decline.setCallbackData(keyboard.decline().data());

        var markup = new InlineKeyboardMarkup();
        markup.setKeyboard(List.of(List.of(accept, decline)));
        return markup;
    }
}
