// SPDX-License-Identifier: Apache-2.0
package org.tallymark.metric.container;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * A float value that may be updated atomically. This class uses an {@link AtomicInteger} to
 * represent the bits of the float value.
 */
public final class AtomicFloat {

    private final AtomicInteger container;

    /**
     * Creates a new {@code AtomicFloat} with the given initial value.
     *
     * @param initialValue the initial value
     */
    public AtomicFloat(float initialValue) {
        container = new AtomicInteger(fromFloat(initialValue));
    }

    /**
     * Creates a new {@code AtomicFloat} with an initial value of {@code 0.0}.
     */
    public AtomicFloat() {
        this(0.0f);
    }

    /**
     * @return the current value
     */
    public float get() {
        return toFloat(container.get());
    }

    /**
     * @param value the new value
     */
    public void set(float value) {
        container.set(fromFloat(value));
    }

    /**
     * Atomically sets the value to the given updated value and returns the previous value.
     *
     * @param newValue the new value
     * @return the previous value
     */
    public float getAndSet(float newValue) {
        return toFloat(container.getAndSet(fromFloat(newValue)));
    }

    /**
     * Atomically adds the given value to the current value.
     *
     * @param delta the value to add
     * @return the updated value
     */
    public float addAndGet(float delta) {
        return toFloat(container.accumulateAndGet(
                fromFloat(delta), (prev, cur) -> fromFloat(toFloat(prev) + toFloat(cur))));
    }

    private static int fromFloat(float value) {
        return Float.floatToRawIntBits(value);
    }

    private static float toFloat(int value) {
        return Float.intBitsToFloat(value);
    }
}
