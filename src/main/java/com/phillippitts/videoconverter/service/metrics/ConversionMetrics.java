package com.phillippitts.videoconverter.service.metrics;

import com.phillippitts.videoconverter.domain.ConversionOutcome;
import com.phillippitts.videoconverter.domain.TargetFormat;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.Locale;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Centralized metrics tracking for video conversions.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Terminal outcomes (succeeded, failed, aborted)</li>
 *   <li>Rejected submissions by reason (queue full, queue closed)</li>
 *   <li>Conversion duration per target format</li>
 *   <li>Queue depth and number of running encoders</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
public class ConversionMetrics {

    private static final String METRIC_PREFIX = "videoconverter";

    public static final String REASON_QUEUE_FULL = "queue_full";
    public static final String REASON_QUEUE_CLOSED = "queue_closed";

    private final MeterRegistry registry;

    public ConversionMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records the terminal outcome and wall-clock duration of a job.
     *
     * @param outcome terminal outcome; PENDING is recorded as-is if a job ends unfinalized
     * @param format target format of the job
     * @param durationNanos duration in nanoseconds
     */
    public void recordCompletion(ConversionOutcome outcome, TargetFormat format, long durationNanos) {
        Counter.builder(METRIC_PREFIX + ".conversion.completed")
                .description("Number of conversions that reached a terminal state")
                .tag("outcome", tagValue(outcome.name()))
                .register(registry)
                .increment();

        Timer.builder(METRIC_PREFIX + ".conversion.duration")
                .description("Time from dequeue to terminal state")
                .tag("format", format.extension())
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * Increments the rejection counter.
     *
     * @param reason {@link #REASON_QUEUE_FULL} or {@link #REASON_QUEUE_CLOSED}
     */
    public void incrementRejected(String reason) {
        Counter.builder(METRIC_PREFIX + ".conversion.rejected")
                .description("Number of submissions rejected before queueing")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    /**
     * Registers the queue depth and active conversion gauges.
     */
    public void registerGauges(Supplier<Number> queueDepth, Supplier<Number> activeConversions) {
        Gauge.builder(METRIC_PREFIX + ".queue.depth", queueDepth)
                .description("Jobs waiting for a worker")
                .register(registry);
        Gauge.builder(METRIC_PREFIX + ".conversions.active", activeConversions)
                .description("Conversions with a running encoder process")
                .register(registry);
    }

    private static String tagValue(String name) {
        return name.toLowerCase(Locale.ROOT);
    }
}
