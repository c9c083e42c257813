// SPDX-License-Identifier: Apache-2.0
package org.tallymark.render;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.io.IOException;
import java.io.Writer;
import java.util.Locale;
import java.util.Objects;
import java.util.function.LongSupplier;
import org.tallymark.core.Metric;
import org.tallymark.core.MetricKind;

/**
 * Renders metrics in the Prometheus text exposition format:
 * <pre>
 * # HELP app::name_unit description
 * app::name_unit value timestamp
 * </pre>
 * Metric and application names are reduced to {@code [A-Za-z0-9_]}. String metrics, and metrics whose reduced
 * name is empty or starts with a digit, are skipped. The unit suffix is the lower-cased alphanumeric part of
 * the unit. Boolean values are written as {@code 1} and {@code 0}.
 * <p>
 * Metrics are separated by a new line and every render ends with one.
 */
public final class PrometheusRenderer extends AbstractWriterRenderer {

    private static final String HELP = "# HELP ";
    private static final String NAME_SEPARATOR = "::";
    private static final char UNIT_SEPARATOR = '_';
    private static final char SPACE = ' ';
    private static final char NEW_LINE = '\n';

    private final String applicationName;
    private final LongSupplier timestampSource;
    private boolean first;

    /**
     * @param destination     the writer to render to, must not be {@code null}
     * @param applicationName prefix of all metric names, must contain a valid name once reduced
     * @param timestampSource supplier of the timestamp in milliseconds written with each value
     * @throws IllegalArgumentException if the reduced application name is empty or starts with a digit
     */
    public PrometheusRenderer(
            @NonNull Writer destination, @NonNull String applicationName, @NonNull LongSupplier timestampSource) {
        super(destination);
        Objects.requireNonNull(applicationName, "application name must not be null");
        this.applicationName = sanitizeName(applicationName);
        if (!isValidName(this.applicationName)) {
            throw new IllegalArgumentException("Invalid application name: \"" + applicationName + "\"");
        }
        this.timestampSource = Objects.requireNonNull(timestampSource, "timestamp source must not be null");
    }

    /**
     * @return the application name as written
     */
    @NonNull
    public String applicationName() {
        return applicationName;
    }

    @Override
    protected void writeBegin(@NonNull Writer output) {
        first = true;
    }

    @Override
    protected void writeMetric(@NonNull Writer output, @NonNull Metric metric) throws IOException {
        if (metric.kind() == MetricKind.STRING) {
            return;
        }
        final String metricName = sanitizeName(metric.name());
        if (!isValidName(metricName)) {
            return;
        }

        final StringBuilder fullName = new StringBuilder(applicationName).append(NAME_SEPARATOR).append(metricName);
        final String unitSuffix = unitSuffix(metric.unit());
        if (!unitSuffix.isEmpty()) {
            fullName.append(UNIT_SEPARATOR).append(unitSuffix);
        }

        if (!first) {
            output.write(NEW_LINE);
        }
        first = false;

        output.write(HELP);
        output.append(fullName);
        output.write(SPACE);
        output.write(escapeDescription(metric.description()));
        output.write(NEW_LINE);
        output.append(fullName);
        output.write(SPACE);
        output.write(metric.kind() == MetricKind.BOOL ? (metric.asBoolean() ? "1" : "0") : metric.valueAsString());
        output.write(SPACE);
        output.write(Long.toString(timestampSource.getAsLong()));
    }

    @Override
    protected void writeEnd(@NonNull Writer output) throws IOException {
        output.write(NEW_LINE);
    }

    /**
     * @param name any name
     * @return the name without characters outside {@code [A-Za-z0-9_]}
     */
    @NonNull
    static String sanitizeName(@NonNull String name) {
        final StringBuilder builder = new StringBuilder(name.length());
        for (int i = 0; i < name.length(); i++) {
            final char c = name.charAt(i);
            if (isAsciiAlphanumeric(c) || c == '_') {
                builder.append(c);
            }
        }
        return builder.toString();
    }

    /**
     * @param unit any unit
     * @return the lower-cased ASCII letters and digits of the unit
     */
    @NonNull
    static String unitSuffix(@NonNull String unit) {
        final StringBuilder builder = new StringBuilder(unit.length());
        for (int i = 0; i < unit.length(); i++) {
            final char c = unit.charAt(i);
            if (isAsciiAlphanumeric(c)) {
                builder.append(c);
            }
        }
        return builder.toString().toLowerCase(Locale.ROOT);
    }

    @NonNull
    static String escapeDescription(@NonNull String description) {
        return description.replace("\\", "\\\\").replace("\n", "\\n");
    }

    private static boolean isValidName(String sanitized) {
        return !sanitized.isEmpty() && !Character.isDigit(sanitized.charAt(0));
    }

    private static boolean isAsciiAlphanumeric(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9');
    }
}
