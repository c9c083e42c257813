// SPDX-License-Identifier: Apache-2.0
package org.tallymark.core;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Objects;
import java.util.Properties;
import java.util.function.LongSupplier;

/**
 * Configuration passed to {@link RendererFactory#create}.
 *
 * @param applicationName name of the instrumented application, used by formats that prefix metric names
 * @param timestampSource supplier of wall-clock timestamps in milliseconds for formats that write them
 */
public record RendererConfig(@NonNull String applicationName, @NonNull LongSupplier timestampSource) {

    public static final String PREFIX = "tallymark.renderer.";
    public static final String DEFAULT_APPLICATION_NAME = "tallymark";

    public RendererConfig {
        Objects.requireNonNull(applicationName, "application name must not be null");
        Objects.requireNonNull(timestampSource, "timestamp source must not be null");
    }

    /**
     * @return configuration with default application name and the system clock
     */
    @NonNull
    public static RendererConfig defaults() {
        return new RendererConfig(DEFAULT_APPLICATION_NAME, System::currentTimeMillis);
    }

    /**
     * Reads {@code tallymark.renderer.applicationName}; missing keys keep their defaults.
     *
     * @param properties the properties, must not be {@code null}
     * @return the configuration
     */
    @NonNull
    public static RendererConfig fromProperties(@NonNull Properties properties) {
        Objects.requireNonNull(properties, "properties must not be null");
        return new RendererConfig(
                properties.getProperty(PREFIX + "applicationName", DEFAULT_APPLICATION_NAME),
                System::currentTimeMillis);
    }

    /**
     * @param applicationName the application name
     * @return copy of this configuration with another application name
     */
    @NonNull
    public RendererConfig withApplicationName(@NonNull String applicationName) {
        return new RendererConfig(applicationName, timestampSource);
    }

    /**
     * @param timestampSource the timestamp source
     * @return copy of this configuration with another timestamp source
     */
    @NonNull
    public RendererConfig withTimestampSource(@NonNull LongSupplier timestampSource) {
        return new RendererConfig(applicationName, timestampSource);
    }
}
