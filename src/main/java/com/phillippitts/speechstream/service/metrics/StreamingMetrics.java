package com.phillippitts.speechstream.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Centralized metrics for streaming recognition.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Fragment outcomes (partial, final, too_short, stale, rejected, error)</li>
 *   <li>Engine latency per call (accept, final)</li>
 *   <li>Session closes by reason (end_of_utterance, idle)</li>
 *   <li>Number of live sessions</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available under /actuator/metrics.
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class StreamingMetrics {

    static final String METRIC_PREFIX = "speechstream.stream";

    private final MeterRegistry registry;

    public StreamingMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Counts one processed fragment.
     *
     * @param outcome partial, final, too_short, stale, rejected or error
     */
    public void incrementFragment(String outcome) {
        Counter.builder(METRIC_PREFIX + ".fragments")
                .description("Number of streamed fragments by outcome")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    /**
     * Records time spent inside the engine for one call.
     *
     * @param operation accept or final
     * @param durationNanos duration in nanoseconds
     */
    public void recordEngineLatency(String operation, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".engine.latency")
                .description("Time spent in the recognition engine")
                .tag("operation", operation)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * @param reason end_of_utterance or idle
     */
    public void incrementSessionClosed(String reason) {
        Counter.builder(METRIC_PREFIX + ".sessions.closed")
                .description("Number of sessions closed")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    /**
     * Registers the live-session gauge. Called once by the session registry.
     */
    public void registerActiveSessions(Supplier<Number> activeSessions) {
        Gauge.builder(METRIC_PREFIX + ".sessions.active", activeSessions)
                .description("Number of sessions currently registered")
                .register(registry);
    }
}
