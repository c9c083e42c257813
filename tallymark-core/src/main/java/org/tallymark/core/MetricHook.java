// SPDX-License-Identifier: Apache-2.0
package org.tallymark.core;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Callback invoked after a metric has been updated, subject to the metric's hook rate limit.
 * <p>
 * Hooks are called on the updating thread. Exceptions thrown by a hook are not caught and propagate to the
 * code that updated the metric.
 */
@FunctionalInterface
public interface MetricHook {

    /**
     * @param metric the updated metric, already holding its new value
     */
    void onUpdate(@NonNull Metric metric);
}
