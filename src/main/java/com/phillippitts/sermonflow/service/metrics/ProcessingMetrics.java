package com.phillippitts.sermonflow.service.metrics;

import com.phillippitts.sermonflow.exception.ErrorKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Micrometer instrumentation for processing cycles.
 *
 * <p>Provides:
 * <ul>
 *   <li>cycle outcomes (viewing, degraded, error kind)</li>
 *   <li>per-chunk upload latency</li>
 *   <li>recordings and imports started</li>
 * </ul>
 */
@Component
public class ProcessingMetrics {

    private static final String METRIC_PREFIX = "sermonflow";

    private final MeterRegistry registry;

    public ProcessingMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * @param source "recording" or "import"
     */
    public void incrementStarted(String source) {
        Counter.builder(METRIC_PREFIX + ".cycles.started")
                .description("Recording or import cycles started")
                .tag("source", source)
                .register(registry)
                .increment();
    }

    public void incrementCompleted(boolean degraded) {
        Counter.builder(METRIC_PREFIX + ".cycles.completed")
                .description("Processing cycles that reached the viewing phase")
                .tag("degraded", Boolean.toString(degraded))
                .register(registry)
                .increment();
    }

    public void incrementFailure(ErrorKind kind) {
        Counter.builder(METRIC_PREFIX + ".cycles.failed")
                .description("Cycles that ended in the error phase")
                .tag("kind", kind.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    public void recordUploadLatency(long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".upload.latency")
                .description("Time taken to upload one audio chunk")
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }
}
