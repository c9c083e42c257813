// SPDX-License-Identifier: Apache-2.0
package org.tallymark.core;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Thrown when no metric with the requested name is registered.
 */
public class MetricNotFoundException extends MetricException {

    private final String metricName;

    public MetricNotFoundException(@NonNull String metricName) {
        super("No metric exists called \"" + metricName + "\"");
        this.metricName = metricName;
    }

    @NonNull
    public String metricName() {
        return metricName;
    }
}
