package com.phillippitts.videoconverter.service.conversion;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.Set;
import java.util.function.LongSupplier;

/**
 * Interprets the encoder's {@code -progress pipe:1} stream and turns it into throttled progress
 * updates on the {@link ConversionStatusStore}.
 *
 * <p>The stream is a sequence of {@code key=value} lines ending with {@code progress=end}. The
 * total duration of the input is not known, so each accepted sample advances the stored progress
 * by a fixed increment. The store's 99% ceiling keeps the estimate below completion until the job
 * runner finalizes it.
 *
 * <p>Stateless between calls; one instance serves all workers.
 */
public class ProgressExtractor {

    private static final Logger LOG = LogManager.getLogger(ProgressExtractor.class);

    public static final Duration DEFAULT_THROTTLE = Duration.ofMillis(500);
    public static final double DEFAULT_INCREMENT = 0.5;

    static final String END_MARKER = "progress=end";
    private static final Set<String> SAMPLE_KEYS = Set.of("out_time_us", "out_time_ms", "frame");

    private final ConversionStatusStore store;
    private final long throttleNanos;
    private final double increment;
    private final LongSupplier nanoClock;

    public ProgressExtractor(ConversionStatusStore store) {
        this(store, DEFAULT_THROTTLE, DEFAULT_INCREMENT);
    }

    public ProgressExtractor(ConversionStatusStore store, Duration throttle, double increment) {
        this(store, throttle, increment, System::nanoTime);
    }

    ProgressExtractor(ConversionStatusStore store, Duration throttle, double increment, LongSupplier nanoClock) {
        this.store = Objects.requireNonNull(store, "store");
        Objects.requireNonNull(throttle, "throttle");
        if (throttle.isNegative()) {
            throw new IllegalArgumentException("throttle must not be negative");
        }
        if (!(increment > 0)) {
            throw new IllegalArgumentException("increment must be positive");
        }
        this.throttleNanos = throttle.toNanos();
        this.increment = increment;
        this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock");
    }

    /**
     * Reads {@code progressStream} until end of stream or the end marker, updating progress for
     * {@code conversionId}. Blocks the calling worker; never throws on read failure.
     *
     * @return number of samples that produced a progress update
     */
    public int consume(String conversionId, InputStream progressStream) {
        int accepted = 0;
        boolean first = true;
        long lastAccepted = 0L;
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(progressStream, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                String trimmed = line.trim();
                if (END_MARKER.equals(trimmed)) {
                    LOG.debug("Progress stream for {} reached end marker", conversionId);
                    break;
                }
                if (!isSample(trimmed)) {
                    continue;
                }
                long now = nanoClock.getAsLong();
                if (!first && now - lastAccepted < throttleNanos) {
                    continue;
                }
                first = false;
                lastAccepted = now;
                if (advance(conversionId)) {
                    accepted++;
                }
            }
        } catch (IOException e) {
            LOG.warn("Error reading encoder progress for {}: {}", conversionId, e.toString());
        }
        return accepted;
    }

    private boolean advance(String conversionId) {
        return store.getStatus(conversionId)
                .map(status -> store.setProgressPercentage(conversionId, status.progress() + increment))
                .orElse(false);
    }

    static boolean isSample(String line) {
        int eq = line.indexOf('=');
        if (eq <= 0) {
            return false;
        }
        return SAMPLE_KEYS.contains(line.substring(0, eq));
    }
}
