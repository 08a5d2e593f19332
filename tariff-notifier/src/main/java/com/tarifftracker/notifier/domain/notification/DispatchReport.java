package com.tarifftracker.notifier.domain.notification;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;

/**
 * Summary of one sweep. {@code aborted} means no user was evaluated (no offers or profiles unreadable).
 */
public record DispatchReport(String cycleId, boolean aborted, int profiles, Map<DispatchOutcome, Integer> outcomes) {

    public DispatchReport {
        outcomes = Map.copyOf(outcomes);
    }

    public static DispatchReport aborted(String cycleId) {
        return new DispatchReport(cycleId, true, 0, Map.of());
    }

    public static DispatchReport of(String cycleId, Collection<DispatchOutcome> results) {
        var counts = new EnumMap<DispatchOutcome, Integer>(DispatchOutcome.class);
        results.forEach(outcome -> counts.merge(outcome, 1, Integer::sum));
        return new DispatchReport(cycleId, false, results.size(), counts);
    }

    public int count(DispatchOutcome outcome) {
        return outcomes.getOrDefault(outcome, 0);
    }
}
