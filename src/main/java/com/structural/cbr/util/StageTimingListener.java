package com.structural.cbr.util;

import java.util.LinkedHashMap;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.structural.cbr.api.ReductionListener;

/**
 * Records how long each pipeline stage took.
 *
 * <p>
 * A stage that runs more than once (several reductions through the same
 * listener) accumulates its time. Not thread-safe; attach one instance per
 * reducing thread.
 */
public final class StageTimingListener implements ReductionListener {
    private static final Logger log = LogManager.getLogger(StageTimingListener.class);

    private final Map<String, Long> totals = new LinkedHashMap<>();
    private final Map<String, Integer> counts = new LinkedHashMap<>();

    @Override
    public void onStageEnd(String stage, long durationNanos) {
        totals.merge(stage, durationNanos, Long::sum);
        counts.merge(stage, 1, Integer::sum);
        log.debug("Stage '{}' took {} us", stage, durationNanos / 1000);
    }

    /** Accumulated time of {@code stage}, 0 if it never ran. */
    public long totalNanos(String stage) {
        return totals.getOrDefault(stage, 0L);
    }

    public int runs(String stage) {
        return counts.getOrDefault(stage, 0);
    }

    public Map<String, Long> totals() {
        return Map.copyOf(totals);
    }

    public void reset() {
        totals.clear();
        counts.clear();
    }

    public String dump() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%-28s | %6s | %12s\n", "Stage", "Runs", "Total (ms)"));
        sb.append("------------------------------------------------------\n");
        for (Map.Entry<String, Long> e : totals.entrySet())
            sb.append(String.format("%-28s | %6d | %12.3f\n", e.getKey(), counts.get(e.getKey()),
                    e.getValue() / 1e6));
        return sb.toString();
    }
}
