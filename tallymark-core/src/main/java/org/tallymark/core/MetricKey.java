// SPDX-License-Identifier: Apache-2.0
package org.tallymark.core;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Objects;

/**
 * Identifies a registered metric by name and kind for typed lookup in a {@link MetricRegistry}.
 * Concrete metric classes provide static {@code key(String)} factories.
 *
 * @param name the metric name
 * @param kind the expected kind
 * @param type the metric class returned by a lookup
 * @param <M>  the metric type
 */
public record MetricKey<M extends Metric>(@NonNull String name, @NonNull MetricKind kind, @NonNull Class<M> type) {

    public MetricKey {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(type, "metric type must not be null");
    }
}
