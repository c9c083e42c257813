// SPDX-License-Identifier: Apache-2.0
package org.tallymark.render;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.io.IOException;
import java.io.Writer;
import org.tallymark.core.Metric;

/**
 * Renders one {@code name = value unit} line per metric, followed by an empty line at the end of each render.
 */
public final class PlainRenderer extends AbstractWriterRenderer {

    private static final String EQUALS = " = ";
    private static final char SPACE = ' ';
    private static final char NEW_LINE = '\n';

    public PlainRenderer(@NonNull Writer destination) {
        super(destination);
    }

    @Override
    protected void writeMetric(@NonNull Writer output, @NonNull Metric metric) throws IOException {
        output.write(metric.name());
        output.write(EQUALS);
        output.write(metric.valueAsString());
        if (!metric.unit().isEmpty()) {
            output.write(SPACE);
            output.write(metric.unit());
        }
        output.write(NEW_LINE);
    }

    @Override
    protected void writeEnd(@NonNull Writer output) throws IOException {
        output.write(NEW_LINE);
    }
}
