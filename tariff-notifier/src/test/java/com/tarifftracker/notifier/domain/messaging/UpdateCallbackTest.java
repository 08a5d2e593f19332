package com.tarifftracker.notifier.domain.messaging;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullSource;
import org.junit.jupiter.params.provider.ValueSource;

class UpdateCallbackTest {

    @Test
    void shouldEncodeActionAndUser() {
        var keyboard = UpdateKeyboard.forUser("42");

        assertThat(keyboard.accept().data()).isEqualTo("rate_update:accept:42");
        assertThat(keyboard.decline().data()).isEqualTo("rate_update:decline:42");
    }

    @Test
    void shouldParseButtonData() {
        assertThat(UpdateCallback.parse("rate_update:decline:42"))
                .contains(new UpdateCallback(UpdateAction.DECLINE, "42"));
    }

    @ParameterizedTest
    @NullSource
    @ValueSource(strings = {"", "rate_update:accept", "rate_update:maybe:42", "other:accept:42", "rate_update:accept: "})
    void shouldRejectForeignData(String data) {
        assertThat(UpdateCallback.parse(data)).isEmpty();
    }
}
