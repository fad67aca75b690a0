package com.phillippitts.videoconverter.service.conversion;

import com.phillippitts.videoconverter.service.process.ProcessFactory;
import com.phillippitts.videoconverter.service.process.StreamGobbler;
import com.phillippitts.videoconverter.util.LogSanitizer;
import com.phillippitts.videoconverter.util.ProcessTimeouts;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Copies container and EXIF metadata from the source file onto the converted file with exiftool.
 *
 * <p>Best effort: any failure (tool missing, timeout, non-zero exit) is logged as a warning and
 * reported as {@code false}. It never fails the conversion.
 */
public class MetadataCopier {

    private static final Logger LOG = LogManager.getLogger(MetadataCopier.class);

    public static final String DEFAULT_BINARY = "exiftool";
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);
    private static final int OUTPUT_MAX_CHARS = 4096;
    private static final int SNIPPET_MAX_CHARS = 300;

    private final ProcessFactory processFactory;
    private final boolean enabled;
    private final String binary;
    private final Duration timeout;

    public MetadataCopier(ProcessFactory processFactory, boolean enabled, String binary, Duration timeout) {
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
        this.enabled = enabled;
        this.binary = Objects.requireNonNull(binary, "binary");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
    }

    public boolean isEnabled() {
        return enabled;
    }

    List<String> buildCommand(Path source, Path target) {
        return List.of(binary,
                "-tagsFromFile", source.toString(),
                "-all:all>all:all",
                "-preserve",
                "-overwrite_original",
                target.toString());
    }

    /**
     * Copies metadata from {@code source} to {@code target}, blocking until the tool exits or the
     * timeout elapses.
     *
     * @return true if the tool ran and exited with 0
     */
    public boolean copy(Path source, Path target) {
        if (!enabled) {
            return false;
        }
        Process process;
        try {
            process = processFactory.start(buildCommand(source, target), null);
        } catch (IOException e) {
            LOG.warn("Metadata copy could not start {}: {}", binary, e.getMessage());
            return false;
        }

        // exiftool writes a summary to stdout; drain both streams so it never blocks
        StreamGobbler out = StreamGobbler.start(process.getInputStream(), "exiftool-out", OUTPUT_MAX_CHARS);
        StreamGobbler err = StreamGobbler.start(process.getErrorStream(), "exiftool-err", OUTPUT_MAX_CHARS);
        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                process.waitFor(ProcessTimeouts.FORCEFUL_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
                LOG.warn("Metadata copy for {} timed out after {}s", target.getFileName(), timeout.toSeconds());
                return false;
            }
            out.await(ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT.toMillis());
            err.await(ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT.toMillis());
            int exitCode = process.exitValue();
            if (exitCode != 0) {
                LOG.warn("Metadata copy for {} failed (exit code {}): {}", target.getFileName(), exitCode,
                        LogSanitizer.tail(err.content(), SNIPPET_MAX_CHARS));
                return false;
            }
            LOG.debug("Metadata copied onto {}", target.getFileName());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            LOG.warn("Interrupted while copying metadata onto {}", target.getFileName());
            return false;
        }
    }
}
