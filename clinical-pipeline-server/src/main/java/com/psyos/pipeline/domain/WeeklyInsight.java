package com.psyos.pipeline.domain;

import lombok.Value;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * One week of signal activity as returned to the psychologist.
 */
@Value
public class WeeklyInsight {

    Instant weekStart;
    Instant weekEnd;
    int messageCount;
    int signalCount;
    List<SignalCount> signalsTriggered;
    Instant generatedAt;

    @Value
    public static class SignalCount {
        String key;
        int count;
    }

    /**
     * Signals ordered by count, most frequent first; keys that never fired are left out.
     */
    public static WeeklyInsight from(WeeklySummaryEntity summary) {
        List<SignalCount> triggered = new ArrayList<>();
        int total = 0;
        Map<String, Integer> counts = summary.getSignalCounts();
        for (SignalKey key : SignalKey.values()) {
            Integer count = counts != null ? counts.get(key.jsonName()) : null;
            if (count != null && count > 0) {
                triggered.add(new SignalCount(key.jsonName(), count));
                total += count;
            }
        }
        triggered.sort(Comparator.comparingInt(SignalCount::getCount).reversed());
        return new WeeklyInsight(summary.getWeekStart(), summary.getWeekEnd(), summary.getMessageCount(),
                total, triggered, summary.getGeneratedAt());
    }
}
