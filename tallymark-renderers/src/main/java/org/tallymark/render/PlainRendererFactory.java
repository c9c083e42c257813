// SPDX-License-Identifier: Apache-2.0
package org.tallymark.render;

import com.google.auto.service.AutoService;
import edu.umd.cs.findbugs.annotations.NonNull;
import java.io.Writer;
import org.tallymark.core.Renderer;
import org.tallymark.core.RendererConfig;
import org.tallymark.core.RendererFactory;

/**
 * Factory of {@link PlainRenderer}s, format name {@value #NAME}.
 */
@AutoService(RendererFactory.class)
public final class PlainRendererFactory implements RendererFactory {

    public static final String NAME = "plain";

    @NonNull
    @Override
    public String name() {
        return NAME;
    }

    @NonNull
    @Override
    public Renderer create(@NonNull Writer destination, @NonNull RendererConfig config) {
        return new PlainRenderer(destination);
    }
}
