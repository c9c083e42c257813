// SPDX-License-Identifier: Apache-2.0
package org.tallymark.core;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.io.Writer;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.ServiceLoader;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * A factory for {@link Renderer}s of one output format, discovered with {@link ServiceLoader}.
 */
public interface RendererFactory {

    /**
     * @return the output format name, e.g. {@code json}, never {@code null} or blank
     */
    @NonNull
    String name();

    /**
     * Creates a renderer writing to the given destination.
     *
     * @param destination the writer to render to, must not be {@code null}
     * @param config      renderer configuration, must not be {@code null}
     * @return new renderer, never {@code null}
     * @throws IllegalArgumentException if the configuration is not usable by this format
     */
    @NonNull
    Renderer create(@NonNull Writer destination, @NonNull RendererConfig config);

    /**
     * @return all renderer factories available on the class path
     */
    @NonNull
    static List<RendererFactory> load() {
        final List<RendererFactory> factories = ServiceLoader.load(RendererFactory.class).stream()
                .map(ServiceLoader.Provider::get)
                .toList();
        Holder.logger.debug(
                "Discovered renderer factories: {}",
                factories.stream().map(RendererFactory::name).toList());
        return factories;
    }

    /**
     * @param name the output format name, must not be {@code null}
     * @return the factory of that format, empty if none is available
     */
    @NonNull
    static Optional<RendererFactory> find(@NonNull String name) {
        Objects.requireNonNull(name, "name must not be null");
        return load().stream().filter(factory -> factory.name().equals(name)).findFirst();
    }

    final class Holder {
        private static final Logger logger = LogManager.getLogger(RendererFactory.class);

        private Holder() {}
    }
}
