package com.tarifftracker.notifier.domain.notification;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class RateFormatTest {

    @ParameterizedTest
    @CsvSource({
            "72.0, 2, 72",
            "72.5, 2, '72,50'",
            "72.456, 2, '72,46'",
            "0.1450, 4, '0,145'",
            "0.12345, 4, '0,1235'",
            "0.1, 4, '0,10'",
            "0, 4, 0",
            "1200.00, 2, 1200"
    })
    void shouldFormatWithDecimalComma(String value, int maxDecimals, String expected) {
        assertThat(RateFormat.format(new BigDecimal(value), maxDecimals)).isEqualTo(expected);
    }
}
