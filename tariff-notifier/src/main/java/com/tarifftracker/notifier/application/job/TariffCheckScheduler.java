package com.tarifftracker.notifier.application.job;

import com.tarifftracker.notifier.domain.notification.DispatchOutcome;
import com.tarifftracker.notifier.domain.notification.DispatchReport;
import com.tarifftracker.notifier.domain.notification.NotificationDispatcher;
import io.micrometer.core.instrument.Counter;
import jakarta.persistence.EntityManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Daily tariff check. A transaction-scoped pg advisory lock keeps concurrent instances from
 * notifying the same users twice; the lock is released when the sweep's transaction ends.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TariffCheckScheduler {

    private static final long ADVISORY_LOCK_ID = 2001L;

    private final NotificationDispatcher dispatcher;
    private final EntityManager entityManager;
    private final Counter notificationsSentCounter;
    private final Counter notificationsFailedCounter;
    private final Counter notificationsSkippedCounter;

    @Scheduled(cron = "${notifier.check.cron}", zone = "${notifier.check.timezone}")
    @Transactional
    public void checkTariffs() {
        if (!acquireAdvisoryLock()) {
            log.info("Tariff check: another instance holds the lock, skipping");
            return;
        }

        var report = dispatcher.dispatch();
        record(report);
    }

    private void record(DispatchReport report) {
        if (report.aborted()) {
            return;
        }
        notificationsSentCounter.increment(report.count(DispatchOutcome.SENT));
        notificationsFailedCounter.increment(report.count(DispatchOutcome.FAILED));
        notificationsSkippedCounter.increment(report.count(DispatchOutcome.ALREADY_NOTIFIED));
    }

    private boolean acquireAdvisoryLock() {
        var result = entityManager
                .createNativeQuery("SELECT pg_try_advisory_xact_lock(:lockId)")
                .setParameter("lockId", ADVISORY_LOCK_ID)
                .getSingleResult();
        return Boolean.TRUE.equals(result);
    }
}
