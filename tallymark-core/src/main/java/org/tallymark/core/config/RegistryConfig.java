// SPDX-License-Identifier: Apache-2.0
package org.tallymark.core.config;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.time.Duration;
import java.util.Objects;
import java.util.Properties;

/**
 * Configuration of a {@link org.tallymark.core.MetricRegistry}.
 *
 * @param defaultHookRateLimit   hook rate limit of registered metrics whose builder does not set one
 * @param defaultThrottleOpLimit operation limit of throttles created without one
 * @param renderThreadName       name of the thread running a render schedule
 */
public record RegistryConfig(
        @NonNull Duration defaultHookRateLimit, long defaultThrottleOpLimit, @NonNull String renderThreadName) {

    public static final String PREFIX = "tallymark.registry.";
    public static final Duration DEFAULT_HOOK_RATE_LIMIT = Duration.ofMillis(1000);
    public static final long DEFAULT_THROTTLE_OP_LIMIT = 1000L;
    public static final String DEFAULT_RENDER_THREAD_NAME = "tallymark-render";

    public RegistryConfig {
        Objects.requireNonNull(defaultHookRateLimit, "default hook rate limit must not be null");
        Objects.requireNonNull(renderThreadName, "render thread name must not be null");
        if (defaultHookRateLimit.isNegative()) {
            throw new IllegalArgumentException("Default hook rate limit must not be negative: " + defaultHookRateLimit);
        }
        if (defaultThrottleOpLimit < 1) {
            throw new IllegalArgumentException(
                    "Default throttle op limit must be at least 1, but was " + defaultThrottleOpLimit);
        }
        if (renderThreadName.isBlank()) {
            throw new IllegalArgumentException("Render thread name must not be blank");
        }
    }

    /**
     * @return configuration with all defaults
     */
    @NonNull
    public static RegistryConfig defaults() {
        return new RegistryConfig(DEFAULT_HOOK_RATE_LIMIT, DEFAULT_THROTTLE_OP_LIMIT, DEFAULT_RENDER_THREAD_NAME);
    }

    /**
     * Reads the configuration from properties with the {@value #PREFIX} prefix:
     * {@code defaultHookRateLimitMillis}, {@code defaultThrottleOpLimit} and {@code renderThreadName}.
     * Missing keys keep their defaults.
     *
     * @param properties the properties, must not be {@code null}
     * @return the configuration
     * @throws IllegalArgumentException if a value cannot be parsed or is out of range
     */
    @NonNull
    public static RegistryConfig fromProperties(@NonNull Properties properties) {
        Objects.requireNonNull(properties, "properties must not be null");
        return new RegistryConfig(
                Duration.ofMillis(
                        parseLong(properties, "defaultHookRateLimitMillis", DEFAULT_HOOK_RATE_LIMIT.toMillis())),
                parseLong(properties, "defaultThrottleOpLimit", DEFAULT_THROTTLE_OP_LIMIT),
                properties.getProperty(PREFIX + "renderThreadName", DEFAULT_RENDER_THREAD_NAME));
    }

    /**
     * @return the configuration read from the system properties
     * @see #fromProperties(Properties)
     */
    @NonNull
    public static RegistryConfig fromSystemProperties() {
        return fromProperties(System.getProperties());
    }

    private static long parseLong(Properties properties, String key, long defaultValue) {
        final String value = properties.getProperty(PREFIX + key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value of " + PREFIX + key + ": " + value, e);
        }
    }
}
