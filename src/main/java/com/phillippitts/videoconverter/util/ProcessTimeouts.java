package com.phillippitts.videoconverter.util;

import java.time.Duration;

/**
 * Standard timeout values for external process and thread management.
 *
 * @see com.phillippitts.videoconverter.service.conversion.ConversionJobRunner
 * @see com.phillippitts.videoconverter.service.conversion.MetadataCopier
 * @see com.phillippitts.videoconverter.service.conversion.ConversionWorkerPool
 */
public final class ProcessTimeouts {

    /**
     * Time a stream gobbler gets to flush buffered output after its process exited.
     */
    public static final Duration GOBBLER_FLUSH_TIMEOUT = Duration.ofMillis(500);

    /**
     * Upper bound on how long shutdown waits for conversion workers to drain their queue.
     */
    public static final Duration WORKER_SHUTDOWN_TIMEOUT = Duration.ofHours(1);

    /**
     * Time the metadata tool gets to exit after a forced kill on timeout.
     */
    public static final Duration FORCEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(1000);

    private ProcessTimeouts() {
        // Utility class - prevent instantiation
    }
}
