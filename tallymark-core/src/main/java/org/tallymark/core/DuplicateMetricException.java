// SPDX-License-Identifier: Apache-2.0
package org.tallymark.core;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Thrown when a metric is registered under a name that is already taken.
 */
public class DuplicateMetricException extends MetricException {

    private final String metricName;

    public DuplicateMetricException(@NonNull String metricName) {
        super("A metric already exists with the name \"" + metricName + "\"");
        this.metricName = metricName;
    }

    @NonNull
    public String metricName() {
        return metricName;
    }
}
