package com.tarifftracker.notifier.application.controller;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class ErrorCodes {

    public static final String INVALID_WEBHOOK_SECRET = "INVALID_WEBHOOK_SECRET";
    public static final String MALFORMED_UPDATE = "MALFORMED_UPDATE";
    public static final String INTERNAL_ERROR = "INTERNAL_ERROR";
}
