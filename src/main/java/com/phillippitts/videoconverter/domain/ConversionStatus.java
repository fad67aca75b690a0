package com.phillippitts.videoconverter.domain;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Immutable snapshot of a conversion's state.
 *
 * <p>The store replaces snapshots atomically, so any instance handed out is a value copy that
 * cannot be torn by concurrent updates. Once {@code complete} is true the store refuses further
 * transitions.
 *
 * @param inputPath file being converted
 * @param outputPath file the encoder writes
 * @param format target container format
 * @param quality canonical quality preset name
 * @param progress estimated progress in percent, 0-100
 * @param complete true once the job finished, successfully or not
 * @param error error message, empty when there is none
 * @param outcome typed terminal classification
 */
public record ConversionStatus(
        Path inputPath,
        Path outputPath,
        TargetFormat format,
        String quality,
        double progress,
        boolean complete,
        String error,
        ConversionOutcome outcome
) {

    public static final String ABORTED_BY_USER = "Conversion aborted by user";

    public ConversionStatus {
        Objects.requireNonNull(outputPath, "outputPath");
        Objects.requireNonNull(format, "format");
        error = error == null ? "" : error;
        outcome = outcome == null ? ConversionOutcome.PENDING : outcome;
    }

    /**
     * Creates the initial status for an accepted job: no progress, not complete, no error.
     */
    public static ConversionStatus pending(Path inputPath, Path outputPath, TargetFormat format, String quality) {
        return new ConversionStatus(inputPath, outputPath, format, quality, 0.0, false, "",
                ConversionOutcome.PENDING);
    }

    public ConversionStatus withProgress(double value) {
        return new ConversionStatus(inputPath, outputPath, format, quality, value, complete, error, outcome);
    }

    public ConversionStatus succeeded() {
        return new ConversionStatus(inputPath, outputPath, format, quality, 100.0, true, "",
                ConversionOutcome.SUCCEEDED);
    }

    public ConversionStatus failed(String message) {
        return new ConversionStatus(inputPath, outputPath, format, quality, 0.0, true, message,
                ConversionOutcome.FAILED);
    }

    public ConversionStatus aborted() {
        return new ConversionStatus(inputPath, outputPath, format, quality, 0.0, true, ABORTED_BY_USER,
                ConversionOutcome.ABORTED);
    }

    public boolean hasError() {
        return !error.isEmpty();
    }

    public boolean isSuccessful() {
        return complete && !hasError();
    }

    /** File name of the output artifact, used in projections. */
    public String outputFileName() {
        Path name = outputPath.getFileName();
        return name == null ? "" : name.toString();
    }
}
