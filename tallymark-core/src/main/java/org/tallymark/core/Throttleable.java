// SPDX-License-Identifier: Apache-2.0
package org.tallymark.core;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.time.Duration;

/**
 * A metric whose updates can be coalesced by a client-side throttle.
 *
 * @param <T> the throttle type for this metric
 * @see MetricRegistry#createThrottle(Throttleable, Duration, long)
 */
public interface Throttleable<T> {

    /**
     * @param timeSource time source the throttle reads, must not be {@code null}
     * @param timeLimit  minimum time between two applied updates, must not be {@code null}
     * @param opLimit    only every {@code opLimit}-th attempt may apply, values below one mean one
     * @return a new throttle bound to this metric
     */
    @NonNull
    T newThrottle(@NonNull TimeSource timeSource, @NonNull Duration timeLimit, long opLimit);
}
