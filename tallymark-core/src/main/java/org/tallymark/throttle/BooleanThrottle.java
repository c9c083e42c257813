// SPDX-License-Identifier: Apache-2.0
package org.tallymark.throttle;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.time.Duration;
import org.tallymark.core.TimeSource;
import org.tallymark.metric.BooleanMetric;

/**
 * Throttle of a boolean metric; values of attempts that are not applied are dropped. Not thread-safe.
 */
public final class BooleanThrottle extends Throttle<BooleanMetric> {

    public BooleanThrottle(
            @NonNull BooleanMetric metric, @NonNull TimeSource timeSource, @NonNull Duration timeLimit, long opLimit) {
        super(metric, timeSource, timeLimit, opLimit);
    }

    public void set(boolean value) {
        if (tryAcquire()) {
            metric().set(value);
        }
    }
}
