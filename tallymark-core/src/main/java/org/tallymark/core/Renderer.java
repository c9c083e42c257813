// SPDX-License-Identifier: Apache-2.0
package org.tallymark.core;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Writes a snapshot of metrics to some destination.
 * <p>
 * {@link MetricRegistry#render(Renderer)} calls {@link #begin()} once, {@link #render(Metric)} for every
 * selected metric in name order and {@link #end()} once. A failure of {@link #end()} during a registry render
 * is not propagated; it is recorded and can be checked with {@link #hasSuppressedFailure()}.
 * <p>
 * Renderers are used by one render at a time and need not be thread-safe.
 */
public abstract class Renderer {

    private volatile boolean suppressedFailure;

    /**
     * Starts a snapshot. Default implementation does nothing.
     *
     * @throws RenderException if the snapshot cannot be started
     */
    public void begin() throws RenderException {}

    /**
     * Writes one metric.
     *
     * @param metric the metric, must not be {@code null}
     * @throws RenderException if the metric cannot be written
     */
    public abstract void render(@NonNull Metric metric) throws RenderException;

    /**
     * Finishes a snapshot. Default implementation does nothing.
     *
     * @throws RenderException if the snapshot cannot be finished
     */
    public void end() throws RenderException {}

    /**
     * @return {@code true} if the last registry render suppressed a failure of {@link #end()}
     */
    public final boolean hasSuppressedFailure() {
        return suppressedFailure;
    }

    final void suppressedFailure(boolean suppressedFailure) {
        this.suppressedFailure = suppressedFailure;
    }
}
