// SPDX-License-Identifier: Apache-2.0
package org.tallymark.throttle;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.time.Duration;
import java.util.Objects;
import org.tallymark.core.Metric;
import org.tallymark.core.TimeSource;

/**
 * Client-side limiter of the updates applied to one metric, for call sites too hot to update the metric every
 * time.
 * <p>
 * Every update attempt is counted. Only every {@code opLimit}-th attempt is eligible, and an eligible attempt is
 * applied only if {@code timeLimit} has passed since the last applied one (or since the throttle was created).
 * Attempts that are not applied are dropped, except for numeric deltas, which are accumulated and applied with
 * the next applied attempt or an explicit {@code commit()}.
 * <p>
 * This class is <b>not thread-safe</b>. A throttle is meant to be owned by exactly one thread; share the
 * metric, not the throttle.
 *
 * @param <M> the metric type
 */
public abstract class Throttle<M extends Metric> {

    private final M metric;
    private final TimeSource timeSource;
    private final long timeLimitMillis;
    private final long opLimit;

    private long opCount;
    private long nextEligibleTime;

    /**
     * @param metric     the throttled metric, must not be {@code null}
     * @param timeSource the time source, must not be {@code null}
     * @param timeLimit  minimum time between two applied attempts, must not be {@code null} or negative
     * @param opLimit    only every {@code opLimit}-th attempt is eligible; values below one mean one
     */
    protected Throttle(@NonNull M metric, @NonNull TimeSource timeSource, @NonNull Duration timeLimit, long opLimit) {
        this.metric = Objects.requireNonNull(metric, "metric must not be null");
        this.timeSource = Objects.requireNonNull(timeSource, "time source must not be null");
        Objects.requireNonNull(timeLimit, "time limit must not be null");
        if (timeLimit.isNegative()) {
            throw new IllegalArgumentException("Time limit must not be negative: " + timeLimit);
        }
        this.timeLimitMillis = timeLimit.toMillis();
        this.opLimit = Math.max(1L, opLimit);
        this.nextEligibleTime = timeSource.millis() + timeLimitMillis;
    }

    /**
     * @return the throttled metric
     */
    @NonNull
    public final M metric() {
        return metric;
    }

    /**
     * @return the effective operation limit, at least one
     */
    public final long opLimit() {
        return opLimit;
    }

    @NonNull
    public final Duration timeLimit() {
        return Duration.ofMillis(timeLimitMillis);
    }

    /**
     * Counts an attempt and decides whether it may be applied. The clock is only read for eligible attempts.
     *
     * @return {@code true} if the attempt may be applied now
     */
    protected final boolean tryAcquire() {
        if (++opCount % opLimit != 0) {
            return false;
        }
        final long now = timeSource.millis();
        if (now < nextEligibleTime) {
            return false;
        }
        nextEligibleTime = now + timeLimitMillis;
        return true;
    }
}
