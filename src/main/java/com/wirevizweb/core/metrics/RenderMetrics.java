package com.wirevizweb.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for rendering and decoding.
 */
@Service
public class RenderMetrics {

    private final MeterRegistry registry;

    public RenderMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * @param format  format token, e.g. "svg"
     * @param outcome "success" or "failure"
     */
    public void recordRender(String format, String outcome, long ms) {
        Timer.builder("wireviz.render.duration")
                .description("Wall-clock time of a render, staging to cleanup")
                .tag("format", format)
                .tag("outcome", outcome)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * @param reason "engine", "staging" or "request"
     */
    public void recordRenderFailure(String reason) {
        Counter.builder("wireviz.render.failures")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordDecode(boolean success) {
        Counter.builder("wireviz.plantuml.decodes")
                .tag("result", success ? "success" : "failure")
                .register(registry)
                .increment();
    }
}
