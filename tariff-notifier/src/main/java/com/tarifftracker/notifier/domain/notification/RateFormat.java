package com.tarifftracker.notifier.domain.notification;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Number rendering for messages: decimal comma, integers without decimals, otherwise at least two
 * decimals and at most {@code maxDecimals} (72.0 -> "72", 72.5 -> "72,50", 0.1450 -> "0,145").
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class RateFormat {

    public static final int ENERGY_DECIMALS = 4;
    public static final int FEE_DECIMALS = 2;

    public static String format(BigDecimal value, int maxDecimals) {
        var rounded = value.setScale(maxDecimals, RoundingMode.HALF_UP).stripTrailingZeros();
        if (rounded.scale() <= 0) {
            return rounded.toBigInteger().toString();
        }
        var plain = rounded.scale() < 2 ? rounded.setScale(2).toPlainString() : rounded.toPlainString();
        return plain.replace('.', ',');
    }

    public static String energy(BigDecimal value) {
        return format(value, ENERGY_DECIMALS);
    }

    public static String fee(BigDecimal value) {
        return format(value, FEE_DECIMALS);
    }
}
