package com.phillippitts.videoconverter.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration for the conversion worker pool, the encoder, metadata copying, progress
 * reporting and the event stream.
 *
 * <p>Properties:
 * <ul>
 *   <li>conversion.worker-count - Parallel encoder processes (default: available processors)</li>
 *   <li>conversion.worker-thread-name-prefix - Worker thread names (default: conversion-worker-)</li>
 *   <li>conversion.uploads-dir / conversion.converted-dir - Input and output directories</li>
 *   <li>conversion.encoder.* - ffmpeg binary, thread reserve and stderr cap</li>
 *   <li>conversion.metadata.* - exiftool toggle, binary and timeout</li>
 *   <li>conversion.progress.* - Progress throttle and increment</li>
 *   <li>conversion.events.* - Subscriber buffer size and SSE heartbeat</li>
 * </ul>
 */
@ConfigurationProperties(prefix = "conversion")
@Validated
public class ConversionProperties {

    /** Number of worker threads, and therefore of concurrent encoder processes. */
    @Positive(message = "Worker count must be positive")
    private int workerCount = Runtime.getRuntime().availableProcessors();

    @NotBlank(message = "Worker thread name prefix must not be blank")
    private String workerThreadNamePrefix = "conversion-worker-";

    @NotBlank(message = "Uploads directory must not be blank")
    private String uploadsDir = "uploads";

    @NotBlank(message = "Converted directory must not be blank")
    private String convertedDir = "converted";

    @Valid
    private Encoder encoder = new Encoder();

    @Valid
    private Metadata metadata = new Metadata();

    @Valid
    private Progress progress = new Progress();

    @Valid
    private Events events = new Events();

    public int getWorkerCount() {
        return workerCount;
    }

    public void setWorkerCount(int workerCount) {
        this.workerCount = workerCount;
    }

    public String getWorkerThreadNamePrefix() {
        return workerThreadNamePrefix;
    }

    public void setWorkerThreadNamePrefix(String workerThreadNamePrefix) {
        this.workerThreadNamePrefix = workerThreadNamePrefix;
    }

    public String getUploadsDir() {
        return uploadsDir;
    }

    public void setUploadsDir(String uploadsDir) {
        this.uploadsDir = uploadsDir;
    }

    public String getConvertedDir() {
        return convertedDir;
    }

    public void setConvertedDir(String convertedDir) {
        this.convertedDir = convertedDir;
    }

    public Encoder getEncoder() {
        return encoder;
    }

    public void setEncoder(Encoder encoder) {
        this.encoder = encoder;
    }

    public Metadata getMetadata() {
        return metadata;
    }

    public void setMetadata(Metadata metadata) {
        this.metadata = metadata;
    }

    public Progress getProgress() {
        return progress;
    }

    public void setProgress(Progress progress) {
        this.progress = progress;
    }

    public Events getEvents() {
        return events;
    }

    public void setEvents(Events events) {
        this.events = events;
    }

    /**
     * Encoder (ffmpeg) settings.
     */
    public static class Encoder {
        @NotBlank(message = "Encoder binary must not be blank")
        private String binary = "ffmpeg";

        /** CPUs left free for the rest of the service when sizing {@code -threads}. */
        @PositiveOrZero(message = "Thread reserve must not be negative")
        private int threadReserve = 2;

        @Positive(message = "Stderr cap must be positive")
        private int stderrMaxBytes = 65536;

        public String getBinary() {
            return binary;
        }

        public void setBinary(String binary) {
            this.binary = binary;
        }

        public int getThreadReserve() {
            return threadReserve;
        }

        public void setThreadReserve(int threadReserve) {
            this.threadReserve = threadReserve;
        }

        public int getStderrMaxBytes() {
            return stderrMaxBytes;
        }

        public void setStderrMaxBytes(int stderrMaxBytes) {
            this.stderrMaxBytes = stderrMaxBytes;
        }
    }

    /**
     * Metadata copy (exiftool) settings.
     */
    public static class Metadata {
        private boolean enabled = true;

        @NotBlank(message = "Metadata tool binary must not be blank")
        private String binary = "exiftool";

        @Positive(message = "Metadata timeout must be positive")
        private int timeoutSeconds = 60;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getBinary() {
            return binary;
        }

        public void setBinary(String binary) {
            this.binary = binary;
        }

        public int getTimeoutSeconds() {
            return timeoutSeconds;
        }

        public void setTimeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
        }
    }

    /**
     * Progress estimation settings.
     */
    public static class Progress {
        /** Minimum time between two accepted progress samples. */
        @PositiveOrZero(message = "Progress throttle must not be negative")
        private long throttleMs = 500;

        /** Percentage points added per accepted sample. */
        @Positive(message = "Progress increment must be positive")
        private double increment = 0.5;

        public long getThrottleMs() {
            return throttleMs;
        }

        public void setThrottleMs(long throttleMs) {
            this.throttleMs = throttleMs;
        }

        public double getIncrement() {
            return increment;
        }

        public void setIncrement(double increment) {
            this.increment = increment;
        }
    }

    /**
     * Push event settings.
     */
    public static class Events {
        @Positive(message = "Subscriber buffer size must be positive")
        private int subscriberBufferSize = 16;

        @Positive(message = "Heartbeat interval must be positive")
        private int heartbeatSeconds = 30;

        public int getSubscriberBufferSize() {
            return subscriberBufferSize;
        }

        public void setSubscriberBufferSize(int subscriberBufferSize) {
            this.subscriberBufferSize = subscriberBufferSize;
        }

        public int getHeartbeatSeconds() {
            return heartbeatSeconds;
        }

        public void setHeartbeatSeconds(int heartbeatSeconds) {
            this.heartbeatSeconds = heartbeatSeconds;
        }
    }
}
