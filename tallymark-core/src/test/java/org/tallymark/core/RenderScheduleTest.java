// SPDX-License-Identifier: Apache-2.0
package org.tallymark.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.tallymark.core.config.RegistryConfig;
import org.tallymark.metric.UnsignedIntMetric;

@Timeout(30)
public class RenderScheduleTest {

    private static final Duration SHORT_INTERVAL = Duration.ofMillis(20);

    private MetricRegistry registry;

    @BeforeEach
    void setUp() {
        registry = MetricRegistry.builder().build();
        registry.register(UnsignedIntMetric.builder("count")).increment();
    }

    @AfterEach
    void tearDown() {
        registry.close();
    }

    /** Renderer counting renders and releasing a latch after the given number of renders. */
    private static final class CountingRenderer extends Renderer {

        final AtomicInteger renders = new AtomicInteger();
        final CountDownLatch latch;

        CountingRenderer(int expectedRenders) {
            latch = new CountDownLatch(expectedRenders);
        }

        @Override
        public void render(Metric metric) {}

        @Override
        public void end() {
            renders.incrementAndGet();
            latch.countDown();
        }
    }

    @Test
    void testRendersPeriodicallyUntilCancelled() throws InterruptedException {
        CountingRenderer renderer = new CountingRenderer(1);

        registry.renderSchedule(renderer, Duration.ofSeconds(1));

        assertThat(registry.hasRenderSchedule()).isTrue();
        assertThat(renderer.latch.await(2500, TimeUnit.MILLISECONDS)).isTrue();

        registry.cancelRenderSchedule();
        int rendersAtCancel = renderer.renders.get();
        Thread.sleep(1500);

        assertThat(registry.hasRenderSchedule()).isFalse();
        assertThat(renderer.renders.get()).isEqualTo(rendersAtCancel);
    }

    @Test
    void testFirstRenderAfterOneInterval() throws InterruptedException {
        CountingRenderer renderer = new CountingRenderer(1);

        registry.renderSchedule(renderer, Duration.ofSeconds(2));

        assertThat(renderer.latch.await(500, TimeUnit.MILLISECONDS)).isFalse();
    }

    @Test
    void testCancelWithoutScheduleIsNoOp() {
        registry.cancelRenderSchedule();
        registry.cancelRenderSchedule();

        assertThat(registry.hasRenderSchedule()).isFalse();
    }

    @Test
    void testCancelTwice() throws InterruptedException {
        CountingRenderer renderer = new CountingRenderer(1);
        registry.renderSchedule(renderer, SHORT_INTERVAL);
        assertThat(renderer.latch.await(5, TimeUnit.SECONDS)).isTrue();

        registry.cancelRenderSchedule();
        registry.cancelRenderSchedule();

        assertThat(registry.hasRenderSchedule()).isFalse();
    }

    @Test
    void testNewScheduleReplacesActiveOne() throws InterruptedException {
        CountingRenderer first = new CountingRenderer(1);
        CountingRenderer second = new CountingRenderer(3);
        registry.renderSchedule(first, SHORT_INTERVAL);
        assertThat(first.latch.await(5, TimeUnit.SECONDS)).isTrue();

        registry.renderSchedule(second, SHORT_INTERVAL);
        int firstRenders = first.renders.get();

        assertThat(second.latch.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(first.renders.get()).isEqualTo(firstRenders);
    }

    @Test
    void testFailingRendererKeepsSchedule() throws InterruptedException {
        AtomicInteger attempts = new AtomicInteger();
        CountDownLatch latch = new CountDownLatch(3);
        Renderer renderer = new Renderer() {
            @Override
            public void render(Metric metric) throws RenderException {
                attempts.incrementAndGet();
                latch.countDown();
                throw new RenderException("always failing");
            }
        };

        registry.renderSchedule(renderer, SHORT_INTERVAL);

        assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(attempts.get()).isGreaterThanOrEqualTo(3);
    }

    @Test
    void testRuntimeExceptionKeepsSchedule() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(2);
        Renderer renderer = new Renderer() {
            @Override
            public void render(Metric metric) {
                latch.countDown();
                throw new IllegalStateException("broken renderer");
            }
        };

        registry.renderSchedule(renderer, SHORT_INTERVAL);

        assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void testCancelWaitsForRenderInProgress() throws InterruptedException {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicBoolean finished = new AtomicBoolean();
        Renderer renderer = new Renderer() {
            @Override
            public void render(Metric metric) throws RenderException {
                started.countDown();
                try {
                    release.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new RenderException("interrupted");
                }
                finished.set(true);
            }
        };
        registry.renderSchedule(renderer, SHORT_INTERVAL);
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

        Thread canceller = new Thread(registry::cancelRenderSchedule);
        canceller.start();
        canceller.join(300);
        assertThat(canceller.isAlive()).isTrue();

        release.countDown();
        canceller.join(5000);

        assertThat(canceller.isAlive()).isFalse();
        assertThat(finished.get()).isTrue();
    }

    @Test
    void testCancelFromRenderThreadWhileCallerCancels() throws InterruptedException {
        CountDownLatch renderStarted = new CountDownLatch(1);
        CountDownLatch rendererCancelled = new CountDownLatch(1);
        Renderer renderer = new Renderer() {
            @Override
            public void begin() throws RenderException {
                renderStarted.countDown();
                try {
                    // lets the other thread start stopping the schedule first
                    Thread.sleep(300);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new RenderException("interrupted");
                }
                registry.cancelRenderSchedule();
                rendererCancelled.countDown();
            }

            @Override
            public void render(Metric metric) {}
        };
        registry.renderSchedule(renderer, SHORT_INTERVAL);
        assertThat(renderStarted.await(5, TimeUnit.SECONDS)).isTrue();

        Thread canceller = new Thread(registry::cancelRenderSchedule);
        canceller.start();
        canceller.join(5000);

        assertThat(canceller.isAlive()).isFalse();
        assertThat(rendererCancelled.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(registry.hasRenderSchedule()).isFalse();
    }

    @Test
    void testCancelFromRenderThread() throws InterruptedException {
        CountDownLatch rendered = new CountDownLatch(1);
        AtomicInteger renders = new AtomicInteger();
        Renderer renderer = new Renderer() {
            @Override
            public void render(Metric metric) {
                renders.incrementAndGet();
                registry.cancelRenderSchedule();
                rendered.countDown();
            }
        };

        registry.renderSchedule(renderer, SHORT_INTERVAL);

        assertThat(rendered.await(5, TimeUnit.SECONDS)).isTrue();
        Thread.sleep(200);
        assertThat(registry.hasRenderSchedule()).isFalse();
        assertThat(renders.get()).isEqualTo(1);
    }

    @Test
    void testRenderThreadIsNamedDaemon() throws InterruptedException {
        MetricRegistry named = MetricRegistry.builder()
                .withConfig(new RegistryConfig(Duration.ZERO, 1, "metrics-writer"))
                .build();
        named.register(UnsignedIntMetric.builder("count"));
        AtomicReference<Thread> thread = new AtomicReference<>();
        CountDownLatch latch = new CountDownLatch(1);
        Renderer renderer = new Renderer() {
            @Override
            public void render(Metric metric) {
                thread.set(Thread.currentThread());
                latch.countDown();
            }
        };

        try {
            named.renderSchedule(renderer, SHORT_INTERVAL);
            assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
        } finally {
            named.close();
        }

        assertThat(thread.get().getName()).isEqualTo("metrics-writer");
        assertThat(thread.get().isDaemon()).isTrue();
    }

    @Test
    void testInvalidIntervalKeepsActiveSchedule() throws InterruptedException {
        CountingRenderer active = new CountingRenderer(1);
        registry.renderSchedule(active, SHORT_INTERVAL);

        assertThatThrownBy(() -> registry.renderSchedule(new CountingRenderer(1), Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);

        assertThat(registry.hasRenderSchedule()).isTrue();
        assertThat(active.latch.await(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void testInvalidInterval() {
        CountingRenderer renderer = new CountingRenderer(1);

        assertThatThrownBy(() -> registry.renderSchedule(renderer, Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("Render interval must be positive");
        assertThatThrownBy(() -> registry.renderSchedule(renderer, Duration.ofMillis(-5)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(registry.hasRenderSchedule()).isFalse();
    }
}
