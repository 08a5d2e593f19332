package com.tarifftracker.notifier.domain.comparison;

import java.math.BigDecimal;

/**
 * A strictly improved field: {@code delta = before - after}, always positive.
 */
public record FieldSaving(BigDecimal before, BigDecimal after, BigDecimal delta) {

    public static FieldSaving of(BigDecimal before, BigDecimal after) {
        return new FieldSaving(before, after, before.subtract(after));
    }
}
