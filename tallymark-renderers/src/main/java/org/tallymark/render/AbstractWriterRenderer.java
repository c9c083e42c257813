// SPDX-License-Identifier: Apache-2.0
package org.tallymark.render;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.io.IOException;
import java.io.Writer;
import java.util.Objects;
import org.tallymark.core.Metric;
import org.tallymark.core.RenderException;
import org.tallymark.core.Renderer;

/**
 * Base class of renderers writing text to a {@link Writer}. {@link IOException}s are wrapped into
 * {@link RenderException}s and the writer is flushed at the end of every render.
 * <p>
 * The writer is not closed by the renderer.
 */
public abstract class AbstractWriterRenderer extends Renderer {

    private final Writer destination;

    /**
     * @param destination the writer to render to, must not be {@code null}
     */
    protected AbstractWriterRenderer(@NonNull Writer destination) {
        this.destination = Objects.requireNonNull(destination, "destination must not be null");
    }

    @Override
    public final void begin() throws RenderException {
        try {
            writeBegin(destination);
        } catch (IOException e) {
            throw new RenderException("Error writing start of metrics", e);
        }
    }

    @Override
    public final void render(@NonNull Metric metric) throws RenderException {
        Objects.requireNonNull(metric, "metric must not be null");
        try {
            writeMetric(destination, metric);
        } catch (IOException e) {
            throw new RenderException("Error writing metric " + metric.name(), e);
        }
    }

    @Override
    public final void end() throws RenderException {
        try {
            writeEnd(destination);
            destination.flush();
        } catch (IOException e) {
            throw new RenderException("Error writing end of metrics", e);
        }
    }

    protected void writeBegin(@NonNull Writer output) throws IOException {}

    protected abstract void writeMetric(@NonNull Writer output, @NonNull Metric metric) throws IOException;

    protected void writeEnd(@NonNull Writer output) throws IOException {}
}
