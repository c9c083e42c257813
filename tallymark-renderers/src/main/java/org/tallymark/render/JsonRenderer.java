// SPDX-License-Identifier: Apache-2.0
package org.tallymark.render;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.io.IOException;
import java.io.Writer;
import org.tallymark.core.Metric;
import org.tallymark.core.MetricKind;

/**
 * Renders all metrics as one JSON object keyed by metric name, without a trailing new line:
 * <pre>
 * {"name":{"value":1024,"unit":"bps","kind":"UINT","description":"..."},...}
 * </pre>
 * Numbers are written as in their string form, booleans as {@code true}/{@code false} literals regardless of
 * their display labels, strings as escaped JSON strings.
 */
public final class JsonRenderer extends AbstractWriterRenderer {

    private static final String VALUE = ":{\"value\":";
    private static final String UNIT = ",\"unit\":";
    private static final String KIND = ",\"kind\":";
    private static final String DESCRIPTION = ",\"description\":";

    private int count;

    public JsonRenderer(@NonNull Writer destination) {
        super(destination);
    }

    @Override
    protected void writeBegin(@NonNull Writer output) throws IOException {
        count = 0;
        output.write('{');
    }

    @Override
    protected void writeMetric(@NonNull Writer output, @NonNull Metric metric) throws IOException {
        if (count++ > 0) {
            output.write(',');
        }
        JsonStrings.appendQuoted(output, metric.name());
        output.write(VALUE);
        writeValue(output, metric);
        output.write(UNIT);
        JsonStrings.appendQuoted(output, metric.unit());
        output.write(KIND);
        JsonStrings.appendQuoted(output, metric.kindName());
        output.write(DESCRIPTION);
        JsonStrings.appendQuoted(output, metric.description());
        output.write('}');
    }

    private static void writeValue(Writer output, Metric metric) throws IOException {
        if (metric.kind() == MetricKind.STRING) {
            JsonStrings.appendQuoted(output, metric.valueAsString());
        } else if (metric.kind() == MetricKind.BOOL) {
            output.write(metric.asBoolean() ? "true" : "false");
        } else {
            output.write(metric.valueAsString());
        }
    }

    @Override
    protected void writeEnd(@NonNull Writer output) throws IOException {
        output.write('}');
    }
}
