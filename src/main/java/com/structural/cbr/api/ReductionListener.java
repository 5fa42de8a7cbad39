package com.structural.cbr.api;

/**
 * Observability interface for a reduction run.
 *
 * Stages call back on entry, on exit and whenever they absorb a numerical or
 * topological problem with a fallback. Callbacks run on the reducing thread in
 * stage order.
 */
public interface ReductionListener {

    /** No-op listener. */
    ReductionListener NONE = new ReductionListener() {
    };

    /**
     * Called before a stage starts.
     *
     * @param stage Human-readable stage name.
     */
    default void onStageStart(String stage) {
    }

    /**
     * Called after a stage finished successfully.
     *
     * @param stage         Stage name.
     * @param durationNanos Wall time spent in the stage.
     */
    default void onStageEnd(String stage, long durationNanos) {
    }

    /**
     * Called when a stage degrades gracefully instead of failing.
     *
     * @param warning What happened.
     */
    default void onWarning(ReductionWarning warning) {
    }
}
