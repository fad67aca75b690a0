package com.phillippitts.videoconverter.domain;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Unit of work handed to a conversion worker.
 *
 * <p>Linked 1:1 to the {@link ConversionStatus} stored under the same {@code conversionId}.
 *
 * @param conversionId unique, caller-generated id
 * @param sourceFileId optional reference to the remote source file (may be null)
 * @param originalFileName file name as supplied by the user
 * @param targetFormat requested output format
 * @param quality requested quality preset name (resolved leniently)
 * @param inputPath local file to convert
 * @param outputPath where the converted file is written
 * @param reverseVideo play the video (and audio) backwards
 * @param removeSound drop all audio streams
 */
public record ConversionJob(
        String conversionId,
        String sourceFileId,
        String originalFileName,
        TargetFormat targetFormat,
        String quality,
        Path inputPath,
        Path outputPath,
        boolean reverseVideo,
        boolean removeSound
) {
    public ConversionJob {
        Objects.requireNonNull(conversionId, "conversionId");
        Objects.requireNonNull(targetFormat, "targetFormat");
        Objects.requireNonNull(inputPath, "inputPath");
        Objects.requireNonNull(outputPath, "outputPath");
        if (conversionId.isBlank()) {
            throw new IllegalArgumentException("conversionId must not be blank");
        }
    }
}
