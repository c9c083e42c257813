// SPDX-License-Identifier: Apache-2.0
package org.tallymark.core;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Source of the current time in milliseconds.
 * <p>
 * Metrics, throttles and the registry read the time only through this interface, so tests can drive
 * time-dependent behavior deterministically. Readings must be monotonic; they are only ever compared
 * with each other and never interpreted as wall-clock time.
 */
@FunctionalInterface
public interface TimeSource {

    /**
     * @return the current reading in milliseconds
     */
    long millis();

    /**
     * @return time source backed by {@link System#nanoTime()}, never {@code null}
     */
    @NonNull
    static TimeSource system() {
        return () -> System.nanoTime() / 1_000_000L;
    }
}
