// SPDX-License-Identifier: Apache-2.0
package org.tallymark.throttle;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.time.Duration;
import org.tallymark.core.TimeSource;
import org.tallymark.metric.IntegerMetric;

/**
 * Throttle of an integer metric. Not thread-safe, see {@link Throttle}.
 */
public final class LongThrottle extends Throttle<IntegerMetric> {

    private long pending;

    public LongThrottle(
            @NonNull IntegerMetric metric, @NonNull TimeSource timeSource, @NonNull Duration timeLimit, long opLimit) {
        super(metric, timeSource, timeLimit, opLimit);
    }

    /**
     * Overwrites the metric value if the attempt is applied; pending deltas are discarded then.
     * Otherwise the value is dropped.
     *
     * @param value the new value
     * @return {@code true} if the metric was updated
     */
    public boolean set(long value) {
        if (!tryAcquire()) {
            return false;
        }
        metric().set(value);
        pending = 0;
        return true;
    }

    /**
     * Accumulates the delta and applies all accumulated deltas if the attempt is applied.
     *
     * @param delta value to add
     * @return {@code true} if the metric was updated
     */
    public boolean add(long delta) {
        pending += delta;
        if (!tryAcquire()) {
            return false;
        }
        commit();
        return true;
    }

    /**
     * @return {@code true} if the metric was updated
     * @see #add(long)
     */
    public boolean increment() {
        return add(1L);
    }

    /**
     * Applies the accumulated deltas to the metric regardless of the throttle state.
     */
    public void commit() {
        metric().add(pending);
        pending = 0;
    }

    /**
     * @return sum of the deltas not yet applied
     */
    public long pending() {
        return pending;
    }
}
