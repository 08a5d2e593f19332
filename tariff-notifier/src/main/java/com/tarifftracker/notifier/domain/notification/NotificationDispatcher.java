package com.tarifftracker.notifier.domain.notification;

import com.tarifftracker.common.id.UlidGenerator;
import com.tarifftracker.notifier.domain.comparison.AggregateSavings;
import com.tarifftracker.notifier.domain.comparison.SavingsAggregator;
import com.tarifftracker.notifier.domain.comparison.UpdateSelector;
import com.tarifftracker.notifier.domain.exceptions.DispatchException;
import com.tarifftracker.notifier.domain.exceptions.PersistenceException;
import com.tarifftracker.notifier.domain.exceptions.RecipientUnreachableException;
import com.tarifftracker.notifier.domain.messaging.MessagingChannel;
import com.tarifftracker.notifier.domain.messaging.UpdateKeyboard;
import com.tarifftracker.notifier.domain.offer.CurrentOfferSnapshot;
import com.tarifftracker.notifier.domain.offer.OfferSnapshotProvider;
import com.tarifftracker.notifier.domain.pending.PendingUpdateBuilder;
import com.tarifftracker.notifier.domain.pending.PendingUpdateStore;
import com.tarifftracker.notifier.domain.pending.TariffFragment;
import com.tarifftracker.notifier.domain.profile.ProfileStore;
import com.tarifftracker.notifier.domain.tariff.TariffProfile;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * One notification sweep over every profile. Evaluation is synchronous; delivery (persist the
 * proposal, send, remember the notified snapshot) runs on the bounded dispatch executor so a slow
 * recipient only occupies one worker. Every per-user failure is contained and reported.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationDispatcher {

    private final ProfileStore profileStore;
    private final OfferSnapshotProvider offerSnapshotProvider;
    private final PendingUpdateStore pendingUpdateStore;
    private final MessagingChannel messagingChannel;
    private final SavingsAggregator savingsAggregator;
    private final NotificationGate notificationGate;
    private final UpdateSelector updateSelector;
    private final PendingUpdateBuilder pendingUpdateBuilder;
    private final NotificationFormatter notificationFormatter;
    @Qualifier("dispatchExecutor")
    private final Executor dispatchExecutor;

    public DispatchReport dispatch() {
        var cycleId = UlidGenerator.generate();
        log.info("tariff.check.started: cycle_id={}", cycleId);

        var snapshot = offerSnapshotProvider.current().orElse(null);
        if (snapshot == null || snapshot.isEmpty()) {
            log.error("tariff.check.aborted: cycle_id={}, reason=no_offer_snapshot", cycleId);
            return DispatchReport.aborted(cycleId);
        }

        List<TariffProfile> profiles;
        try {
            profiles = profileStore.findAll();
        } catch (RuntimeException ex) {
            log.error("tariff.check.aborted: cycle_id={}, reason=profiles_unavailable", cycleId, ex);
            return DispatchReport.aborted(cycleId);
        }
        if (profiles.isEmpty()) {
            log.warn("tariff.check: cycle_id={}, no registered users", cycleId);
        }

        var deliveries = new ArrayList<CompletableFuture<DispatchOutcome>>(profiles.size());
        for (var profile : profiles) {
            deliveries.add(process(profile, snapshot));
        }
        CompletableFuture.allOf(deliveries.toArray(CompletableFuture[]::new)).join();

        var report = DispatchReport.of(cycleId, deliveries.stream().map(CompletableFuture::join).toList());
        log.info("tariff.check.completed: cycle_id={}, users={}, sent={}, already_notified={}, failed={}, unreachable={}",
                cycleId, report.profiles(), report.count(DispatchOutcome.SENT),
                report.count(DispatchOutcome.ALREADY_NOTIFIED), report.count(DispatchOutcome.FAILED),
                report.count(DispatchOutcome.UNREACHABLE));
        return report;
    }

    private CompletableFuture<DispatchOutcome> process(TariffProfile profile, CurrentOfferSnapshot snapshot) {
        var userId = profile.userId();
        Notification notification;
        try {
            var aggregate = savingsAggregator.evaluate(profile, snapshot);
            var proposed = notificationGate.proposedSnapshot(profile, aggregate, snapshot);
            if (!aggregate.hasSavings()) {
                log.debug("tariff.check: user_id={}, no savings", userId);
                return CompletableFuture.completedFuture(DispatchOutcome.NO_SAVINGS);
            }
            if (!notificationGate.shouldNotify(profile, aggregate, proposed)) {
                log.debug("tariff.check: user_id={}, offer state already notified", userId);
                return CompletableFuture.completedFuture(DispatchOutcome.ALREADY_NOTIFIED);
            }
            notification = prepare(profile, aggregate, snapshot, proposed);
        } catch (RuntimeException ex) {
            log.warn("tariff.check: user_id={}, evaluation failed", userId, ex);
            return CompletableFuture.completedFuture(DispatchOutcome.FAILED);
        }

        try {
            return CompletableFuture.supplyAsync(() -> deliver(notification), dispatchExecutor)
                    .exceptionally(ex -> {
                        log.warn("notification.failed: user_id={}, reason=unexpected", userId, ex);
                        return DispatchOutcome.FAILED;
                    });
        } catch (RuntimeException ex) {
            log.warn("notification.failed: user_id={}, reason=rejected_by_executor", userId, ex);
            return CompletableFuture.completedFuture(DispatchOutcome.FAILED);
        }
    }

    private Notification prepare(TariffProfile profile, AggregateSavings aggregate, CurrentOfferSnapshot snapshot,
                                 NotifiedSnapshot proposed) {
        var updateServices = updateSelector.select(profile, aggregate, snapshot);
        var fragment = updateServices.isEmpty()
                ? null
                : pendingUpdateBuilder.build(profile, snapshot, updateServices);
        var text = notificationFormatter.format(profile, aggregate, snapshot, fragment != null);
        return new Notification(profile.userId(), text, fragment, proposed);
    }

    private DispatchOutcome deliver(Notification notification) {
        var userId = notification.userId();
        try {
            UpdateKeyboard keyboard = null;
            // a new notification always replaces an unanswered proposal
            if (notification.fragment() != null) {
                pendingUpdateStore.save(userId, notification.fragment());
                keyboard = UpdateKeyboard.forUser(userId);
            } else {
                pendingUpdateStore.clear(userId);
            }
            messagingChannel.send(userId, notification.text(), keyboard);
        } catch (RecipientUnreachableException ex) {
            log.warn("notification.unreachable: user_id={}, reason={}", userId, ex.getMessage());
            forget(userId);
            return DispatchOutcome.UNREACHABLE;
        } catch (DispatchException | PersistenceException ex) {
            log.warn("notification.failed: user_id={}, reason={}", userId, ex.getMessage());
            return DispatchOutcome.FAILED;
        }

        recordNotified(userId, notification.snapshot());
        log.info("notification.sent: user_id={}, update_proposed={}", userId, notification.fragment() != null);
        return DispatchOutcome.SENT;
    }

    private void recordNotified(String userId, NotifiedSnapshot snapshot) {
        try {
            profileStore.get(userId)
                    .map(live -> live.withLastNotifiedSnapshot(snapshot))
                    .ifPresent(profileStore::put);
        } catch (PersistenceException ex) {
            log.warn("notification.snapshot_not_saved: user_id={}, the same offer may be notified again", userId, ex);
        }
    }

    private void forget(String userId) {
        try {
            pendingUpdateStore.clear(userId);
            profileStore.delete(userId);
            log.info("profile.removed: user_id={}, reason=unreachable", userId);
        } catch (PersistenceException ex) {
            log.warn("profile.remove_failed: user_id={}", userId, ex);
        }
    }

    private record Notification(String userId, String text, TariffFragment fragment, NotifiedSnapshot snapshot) {
    }
}
