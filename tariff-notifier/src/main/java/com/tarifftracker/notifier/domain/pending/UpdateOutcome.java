package com.tarifftracker.notifier.domain.pending;

public enum UpdateOutcome {
    ACCEPTED,
    DECLINED,
    /** No fragment was pending, or it was already resolved. */
    NOTHING_PENDING,
    /** Storage failed; the fragment is still pending and the action can be retried. */
    FAILED
}
