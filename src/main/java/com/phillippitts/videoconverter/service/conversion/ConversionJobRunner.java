package com.phillippitts.videoconverter.service.conversion;

import com.phillippitts.videoconverter.domain.ConversionJob;
import com.phillippitts.videoconverter.domain.ConversionOutcome;
import com.phillippitts.videoconverter.domain.ConversionStatus;
import com.phillippitts.videoconverter.service.metrics.ConversionMetrics;
import com.phillippitts.videoconverter.service.process.OsProcessHandle;
import com.phillippitts.videoconverter.service.process.ProcessFactory;
import com.phillippitts.videoconverter.service.process.StreamGobbler;
import com.phillippitts.videoconverter.util.LogSanitizer;
import com.phillippitts.videoconverter.util.ProcessTimeouts;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Executes one conversion job from start to terminal state on the calling worker thread.
 *
 * <p>Lifecycle: Queued, Running, then exactly one of Succeeded, Failed or Aborted. Every
 * finalization goes through the {@link ConversionStatusStore}, whose completion guard decides
 * races with the abort path: if an abort finalized first, this runner's late success or failure
 * is a no-op and only the file cleanup remains. A non-zero exit after an abort request is
 * finalized as aborted, never as failed.
 *
 * <p>Steps:
 * <ol>
 *   <li>Ensure the output directory exists</li>
 *   <li>Start the encoder and register its handle for abort</li>
 *   <li>Drain stderr, feed stdout to the {@link ProgressExtractor}, wait for exit</li>
 *   <li>Verify exit code and output file</li>
 *   <li>Copy metadata, finalize, remove the input</li>
 * </ol>
 *
 * <p>Never throws; every failure is recorded on the job's status.
 */
public class ConversionJobRunner {

    private static final Logger LOG = LogManager.getLogger(ConversionJobRunner.class);

    static final String MDC_CONVERSION_ID = "conversionId";
    static final String TERMINATED_UNEXPECTEDLY = "Conversion process terminated unexpectedly";
    static final String EMPTY_OUTPUT = "Encoder finished but output file is empty (0 bytes)";
    static final String MISSING_OUTPUT = "Encoder finished but output file was not created";

    public static final int DEFAULT_STDERR_MAX_CHARS = 64 * 1024;
    private static final int STDERR_SNIPPET_MAX_CHARS = 500;

    // SIGKILL and SIGTERM as reported by the JDK on POSIX (128 + signal)
    private static final Set<Integer> SIGNAL_EXIT_CODES = Set.of(137, 143);

    private final ConversionStatusStore store;
    private final ProcessFactory processFactory;
    private final EncoderCommandBuilder commandBuilder;
    private final ProgressExtractor progressExtractor;
    private final MetadataCopier metadataCopier;
    private final ConversionMetrics metrics;
    private final int stderrMaxChars;

    public ConversionJobRunner(ConversionStatusStore store,
                               ProcessFactory processFactory,
                               EncoderCommandBuilder commandBuilder,
                               ProgressExtractor progressExtractor,
                               MetadataCopier metadataCopier,
                               ConversionMetrics metrics,
                               int stderrMaxChars) {
        this.store = Objects.requireNonNull(store, "store");
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
        this.commandBuilder = Objects.requireNonNull(commandBuilder, "commandBuilder");
        this.progressExtractor = Objects.requireNonNull(progressExtractor, "progressExtractor");
        this.metadataCopier = Objects.requireNonNull(metadataCopier, "metadataCopier");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        if (stderrMaxChars <= 0) {
            throw new IllegalArgumentException("stderrMaxChars must be positive");
        }
        this.stderrMaxChars = stderrMaxChars;
    }

    /**
     * Runs {@code job} to a terminal state.
     */
    public void run(ConversionJob job) {
        String id = job.conversionId();
        ThreadContext.put(MDC_CONVERSION_ID, id);
        long startNanos = System.nanoTime();
        LOG.info("Starting conversion of {} to {} (quality={})",
                job.originalFileName(), job.targetFormat().extension(), job.quality());
        try {
            execute(job);
        } catch (RuntimeException e) {
            LOG.error("Unexpected error during conversion", e);
            fail(job, "Unexpected error during conversion: " + e.getMessage());
        } finally {
            ConversionOutcome outcome = store.getStatus(id)
                    .map(ConversionStatus::outcome)
                    .orElse(ConversionOutcome.FAILED);
            metrics.recordCompletion(outcome, job.targetFormat(), System.nanoTime() - startNanos);
            LOG.info("Conversion finished with outcome {}", outcome);
            ThreadContext.remove(MDC_CONVERSION_ID);
        }
    }

    private void execute(ConversionJob job) {
        String id = job.conversionId();

        Path outputDir = job.outputPath().toAbsolutePath().getParent();
        if (outputDir != null) {
            try {
                Files.createDirectories(outputDir);
            } catch (IOException e) {
                fail(job, "Failed to create output directory: " + e.getMessage());
                return;
            }
        }

        List<String> command = commandBuilder.build(job);
        LOG.debug("Encoder command: {}", command);

        Process process;
        try {
            process = processFactory.start(command, null);
        } catch (IOException e) {
            fail(job, "Failed to start encoder: " + e.getMessage());
            return;
        }

        int exitCode;
        StreamGobbler stderr;
        boolean abortRequested;
        store.registerActiveProcess(id, new OsProcessHandle(process));
        try {
            stderr = StreamGobbler.start(process.getErrorStream(), "encoder-err-" + id, stderrMaxChars);
            progressExtractor.consume(id, process.getInputStream());
            exitCode = process.waitFor();
            stderr.await(ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            fail(job, "Conversion interrupted");
            return;
        } catch (RuntimeException e) {
            process.destroyForcibly();
            throw e;
        } finally {
            abortRequested = store.isAbortRequested(id);
            store.unregisterActiveProcess(id);
        }

        if (exitCode != 0 && abortRequested) {
            LOG.info("Encoder stopped by abort request (exit code {})", exitCode);
            if (store.updateStatusOnAbort(id)) {
                LOG.debug("Recorded abort ahead of the abort request handler");
            }
            removeArtifacts(job);
            return;
        }

        if (exitCode != 0) {
            LOG.warn("Encoder exited with code {}", exitCode);
            fail(job, describeFailedExit(exitCode, stderr.content()));
            return;
        }

        String outputProblem = checkOutput(job.outputPath());
        if (outputProblem != null) {
            fail(job, outputProblem);
            return;
        }

        if (metadataCopier.isEnabled() && !metadataCopier.copy(job.inputPath(), job.outputPath())) {
            LOG.warn("Metadata was not copied onto {}", job.outputPath().getFileName());
        }
        deleteQuietly(job.inputPath());

        if (!store.updateStatusOnSuccess(id)) {
            // finalized elsewhere (aborted) while the encoder was finishing
            LOG.info("Conversion was finalized before success could be recorded; removing output");
            deleteQuietly(job.outputPath());
        }
    }

    static String describeFailedExit(int exitCode, String stderr) {
        if (SIGNAL_EXIT_CODES.contains(exitCode)) {
            return TERMINATED_UNEXPECTEDLY;
        }
        String snippet = LogSanitizer.tail(stderr, STDERR_SNIPPET_MAX_CHARS);
        String message = "Encoder execution failed (exit code " + exitCode + ")";
        return snippet.isEmpty() ? message : message + ": " + snippet;
    }

    private static String checkOutput(Path output) {
        try {
            if (!Files.exists(output)) {
                return MISSING_OUTPUT;
            }
            if (Files.size(output) == 0) {
                return EMPTY_OUTPUT;
            }
            return null;
        } catch (IOException e) {
            return "Failed to inspect output file: " + e.getMessage();
        }
    }

    private void fail(ConversionJob job, String message) {
        if (store.updateStatusWithError(job.conversionId(), message)) {
            LOG.warn("Conversion failed: {}", message);
        } else {
            LOG.debug("Conversion already finalized; ignoring failure: {}", message);
        }
        removeArtifacts(job);
    }

    private static void removeArtifacts(ConversionJob job) {
        deleteQuietly(job.inputPath());
        deleteQuietly(job.outputPath());
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            LOG.warn("Failed to delete {}: {}", path, e.toString());
        }
    }
}
