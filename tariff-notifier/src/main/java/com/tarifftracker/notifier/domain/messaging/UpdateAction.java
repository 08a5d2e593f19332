package com.tarifftracker.notifier.domain.messaging;

public enum UpdateAction {
    ACCEPT,
    DECLINE
}
