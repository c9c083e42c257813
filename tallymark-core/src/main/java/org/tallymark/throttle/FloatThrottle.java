// SPDX-License-Identifier: Apache-2.0
package org.tallymark.throttle;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.time.Duration;
import org.tallymark.core.TimeSource;
import org.tallymark.metric.FloatMetric;

/**
 * Throttle of a float metric. Not thread-safe, see {@link Throttle}.
 */
public final class FloatThrottle extends Throttle<FloatMetric> {

    private float pending;

    public FloatThrottle(
            @NonNull FloatMetric metric, @NonNull TimeSource timeSource, @NonNull Duration timeLimit, long opLimit) {
        super(metric, timeSource, timeLimit, opLimit);
    }

    /**
     * @param value the new value
     * @return {@code true} if the metric was updated
     */
    public boolean set(float value) {
        if (!tryAcquire()) {
            return false;
        }
        metric().set(value);
        pending = 0.0f;
        return true;
    }

    /**
     * @param delta value to add
     * @return {@code true} if the metric was updated with all accumulated deltas
     */
    public boolean add(float delta) {
        pending += delta;
        if (!tryAcquire()) {
            return false;
        }
        commit();
        return true;
    }

    public void commit() {
        metric().add(pending);
        pending = 0.0f;
    }

    public float pending() {
        return pending;
    }
}
