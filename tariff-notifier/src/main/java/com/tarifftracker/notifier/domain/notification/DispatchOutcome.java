package com.tarifftracker.notifier.domain.notification;

public enum DispatchOutcome {
    SENT,
    NO_SAVINGS,
    ALREADY_NOTIFIED,
    FAILED,
    UNREACHABLE
}
