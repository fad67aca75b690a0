package com.phillippitts.videoconverter.service.conversion;

import com.phillippitts.videoconverter.domain.ConversionJob;
import com.phillippitts.videoconverter.domain.ConversionStatus;
import com.phillippitts.videoconverter.domain.TargetFormat;
import com.phillippitts.videoconverter.exception.ConversionQueueClosedException;
import com.phillippitts.videoconverter.exception.ConversionQueueFullException;
import com.phillippitts.videoconverter.exception.VideoConverterException;
import com.phillippitts.videoconverter.service.metrics.ConversionMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.UUID;

/**
 * Accepts conversion jobs: records a pending status, then hands the job to the worker pool.
 *
 * <p>The status exists before the job is queued so a client polling right after submission never
 * sees a 404. When the pool refuses the job the status and the uploaded input are rolled back.
 *
 * <p>Uploads are saved under the uploads directory as {@code <id>-<name>}; the encoder writes
 * {@code <name without extension>-<id>.<format>} into the converted directory.
 */
public class ConversionSubmissionService {

    private static final Logger LOG = LogManager.getLogger(ConversionSubmissionService.class);

    static final String DEFAULT_UPLOAD_NAME = "upload";

    private final ConversionStatusStore store;
    private final ConversionWorkerPool workerPool;
    private final ConversionMetrics metrics;
    private final Path uploadsDir;
    private final Path convertedDir;

    public ConversionSubmissionService(ConversionStatusStore store,
                                       ConversionWorkerPool workerPool,
                                       ConversionMetrics metrics,
                                       Path uploadsDir,
                                       Path convertedDir) {
        this.store = Objects.requireNonNull(store, "store");
        this.workerPool = Objects.requireNonNull(workerPool, "workerPool");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.uploadsDir = Objects.requireNonNull(uploadsDir, "uploadsDir");
        this.convertedDir = Objects.requireNonNull(convertedDir, "convertedDir");
    }

    /**
     * Saves an uploaded video and queues its conversion.
     *
     * @param originalFileName name supplied by the client (may be null)
     * @param content upload body; read fully, not closed
     * @return the queued job, carrying the generated conversion id
     * @throws IOException if the upload cannot be saved
     * @throws ConversionQueueFullException if the queue is saturated (saved upload removed)
     * @throws ConversionQueueClosedException if the pool is shutting down (saved upload removed)
     */
    public ConversionJob submitUpload(String originalFileName, InputStream content, TargetFormat targetFormat,
                                      String quality, boolean reverseVideo, boolean removeSound)
            throws IOException {
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(targetFormat, "targetFormat");
        String conversionId = UUID.randomUUID().toString();
        String safeName = safeFileName(originalFileName);
        Path input = uploadsDir.resolve(conversionId + "-" + safeName);
        Path output = convertedDir.resolve(stripExtension(safeName) + "-" + conversionId + "."
                + targetFormat.extension());

        Files.createDirectories(uploadsDir);
        long written;
        try {
            written = Files.copy(content, input);
        } catch (IOException e) {
            deleteQuietly(input);
            throw e;
        }
        LOG.info("Saved {} bytes for conversion {} from upload {}", written, conversionId, originalFileName);

        ConversionJob job = new ConversionJob(conversionId, null, originalFileName, targetFormat, quality,
                input, output, reverseVideo, removeSound);
        submit(job);
        return job;
    }

    /**
     * Registers and queues {@code job}.
     *
     * @return the pending status that was stored
     * @throws ConversionQueueFullException if the queue is saturated (status rolled back)
     * @throws ConversionQueueClosedException if the pool is shutting down (status rolled back)
     */
    public ConversionStatus submit(ConversionJob job) {
        Objects.requireNonNull(job, "job");
        String quality = QualityCatalog.resolveQualitySetting(job.quality()).name();
        ConversionStatus pending = ConversionStatus.pending(job.inputPath(), job.outputPath(),
                job.targetFormat(), quality);
        store.setStatus(job.conversionId(), pending);

        try {
            workerPool.queueJob(job);
        } catch (ConversionQueueFullException e) {
            rollback(job, ConversionMetrics.REASON_QUEUE_FULL, e);
            throw e;
        } catch (ConversionQueueClosedException e) {
            rollback(job, ConversionMetrics.REASON_QUEUE_CLOSED, e);
            throw e;
        }
        LOG.info("Accepted conversion {} of {} to {}", job.conversionId(), job.originalFileName(),
                job.targetFormat().extension());
        return pending;
    }

    private void rollback(ConversionJob job, String reason, VideoConverterException cause) {
        LOG.warn("Rejected conversion {}: {}", job.conversionId(), cause.getMessage());
        store.deleteStatus(job.conversionId());
        deleteQuietly(job.inputPath());
        metrics.incrementRejected(reason);
    }

    /** Last path segment with everything outside {@code [A-Za-z0-9._-]} replaced by '_'. */
    static String safeFileName(String originalFileName) {
        if (originalFileName == null) {
            return DEFAULT_UPLOAD_NAME;
        }
        String name = originalFileName.substring(Math.max(originalFileName.lastIndexOf('/'),
                originalFileName.lastIndexOf('\\')) + 1);
        name = name.replaceAll("[^A-Za-z0-9._-]", "_").replaceAll("^\\.+", "");
        return name.isEmpty() ? DEFAULT_UPLOAD_NAME : name;
    }

    private static String stripExtension(String name) {
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            LOG.warn("Failed to remove {}: {}", path, e.toString());
        }
    }
}
