// SPDX-License-Identifier: Apache-2.0
package org.tallymark.render;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.StringWriter;
import org.junit.jupiter.api.Test;
import org.tallymark.core.RendererConfig;
import org.tallymark.core.RendererFactory;

public class RendererFactoryTest {

    @Test
    void testAllFormatsDiscovered() {
        assertThat(RendererFactory.load())
                .extracting(RendererFactory::name)
                .containsExactlyInAnyOrder("plain", "json", "prometheus");
    }

    @Test
    void testFindByName() {
        StringWriter writer = new StringWriter();
        RendererConfig config = RendererConfig.defaults();

        assertThat(RendererFactory.find("plain").orElseThrow().create(writer, config))
                .isInstanceOf(PlainRenderer.class);
        assertThat(RendererFactory.find("json").orElseThrow().create(writer, config))
                .isInstanceOf(JsonRenderer.class);
        assertThat(RendererFactory.find("xml")).isEmpty();
    }

    @Test
    void testPrometheusUsesConfig() {
        RendererConfig config = RendererConfig.defaults().withApplicationName("my-app");

        PrometheusRenderer renderer = (PrometheusRenderer)
                RendererFactory.find("prometheus").orElseThrow().create(new StringWriter(), config);

        assertThat(renderer.applicationName()).isEqualTo("myapp");
    }

    @Test
    void testPrometheusRejectsInvalidApplicationName() {
        RendererConfig config = RendererConfig.defaults().withApplicationName("42");
        RendererFactory factory = new PrometheusRendererFactory();

        assertThatThrownBy(() -> factory.create(new StringWriter(), config))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
