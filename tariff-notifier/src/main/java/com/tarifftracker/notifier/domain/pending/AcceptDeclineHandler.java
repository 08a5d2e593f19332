package com.tarifftracker.notifier.domain.pending;

import com.tarifftracker.notifier.domain.exceptions.PersistenceException;
import com.tarifftracker.notifier.domain.profile.ProfileStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Resolves a pending fragment after the user pressed one of the proposal buttons. Both actions
 * are safe to repeat: once the slot is empty they answer {@link UpdateOutcome#NOTHING_PENDING}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AcceptDeclineHandler {

    private final PendingUpdateStore pendingUpdateStore;
    private final ProfileStore profileStore;

    public UpdateOutcome accept(String userId) {
        try {
            var fragment = pendingUpdateStore.load(userId).orElse(null);
            if (fragment == null) {
                log.warn("pending.accept: user_id={}, result=nothing_pending", userId);
                return UpdateOutcome.NOTHING_PENDING;
            }

            // merge onto the profile as it is now, not as it was when the fragment was built
            var live = profileStore.get(userId).orElse(null);
            if (live == null) {
                log.warn("pending.accept: user_id={}, result=profile_missing, fragment_id={}", userId, fragment.id());
                pendingUpdateStore.clear(userId);
                return UpdateOutcome.NOTHING_PENDING;
            }

            profileStore.put(fragment.applyTo(live));
            clearQuietly(userId);
            log.info("pending.accept: user_id={}, result=accepted, fragment_id={}, services={}",
                    userId, fragment.id(), fragment.updateServices());
            return UpdateOutcome.ACCEPTED;
        } catch (PersistenceException ex) {
            log.error("pending.accept: user_id={}, result=failed", userId, ex);
            return UpdateOutcome.FAILED;
        }
    }

    public UpdateOutcome decline(String userId) {
        try {
            if (pendingUpdateStore.load(userId).isEmpty()) {
                log.info("pending.decline: user_id={}, result=nothing_pending", userId);
                return UpdateOutcome.NOTHING_PENDING;
            }
            pendingUpdateStore.clear(userId);
            log.info("pending.decline: user_id={}, result=declined", userId);
            return UpdateOutcome.DECLINED;
        } catch (PersistenceException ex) {
            log.error("pending.decline: user_id={}, result=failed", userId, ex);
            return UpdateOutcome.FAILED;
        }
    }

    // The profile is already updated; a leftover slot only re-applies the same rates.
    private void clearQuietly(String userId) {
        try {
            pendingUpdateStore.clear(userId);
        } catch (PersistenceException ex) {
            log.warn("pending.clear: user_id={}, result=failed_after_accept", userId, ex);
        }
    }
}
