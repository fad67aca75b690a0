package com.phillippitts.videoconverter.domain;

/**
 * Lightweight view of a conversion that has a live encoder process and is not yet complete.
 */
public record ActiveConversionInfo(
        String id,
        String fileName,
        TargetFormat format,
        String quality,
        double progress
) {
}
