package com.structural.cbr.util;

import java.util.Arrays;

import com.structural.cbr.api.ReductionListener;
import com.structural.cbr.api.ReductionWarning;

/**
 * Fans every callback out to a list of {@link ReductionListener}s in
 * registration order.
 */
public class CompositeReductionListener implements ReductionListener {
    private ReductionListener[] listeners = new ReductionListener[0];

    public CompositeReductionListener(ReductionListener... initial) {
        for (ReductionListener l : initial)
            add(l);
    }

    public void add(ReductionListener listener) {
        if (listener == null)
            throw new IllegalArgumentException("listener must not be null");
        ReductionListener[] old = listeners;
        ReductionListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
    }

    public int size() {
        return listeners.length;
    }

    @Override
    public void onStageStart(String stage) {
        for (ReductionListener l : listeners)
            l.onStageStart(stage);
    }

    @Override
    public void onStageEnd(String stage, long durationNanos) {
        for (ReductionListener l : listeners)
            l.onStageEnd(stage, durationNanos);
    }

    @Override
    public void onWarning(ReductionWarning warning) {
        for (ReductionListener l : listeners)
            l.onWarning(warning);
    }
}
