// SPDX-License-Identifier: Apache-2.0
package org.tallymark.render;

import com.google.auto.service.AutoService;
import edu.umd.cs.findbugs.annotations.NonNull;
import java.io.Writer;
import java.util.Objects;
import org.tallymark.core.Renderer;
import org.tallymark.core.RendererConfig;
import org.tallymark.core.RendererFactory;

/**
 * Factory of {@link PrometheusRenderer}s, format name {@value #NAME}. Uses the application name and timestamp
 * source of the configuration.
 */
@AutoService(RendererFactory.class)
public final class PrometheusRendererFactory implements RendererFactory {

    public static final String NAME = "prometheus";

    @NonNull
    @Override
    public String name() {
        return NAME;
    }

    @NonNull
    @Override
    public Renderer create(@NonNull Writer destination, @NonNull RendererConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        return new PrometheusRenderer(destination, config.applicationName(), config.timestampSource());
    }
}
