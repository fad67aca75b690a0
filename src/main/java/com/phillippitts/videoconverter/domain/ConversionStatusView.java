package com.phillippitts.videoconverter.domain;

/**
 * Serializable projection of a status, as sent to polling clients and event subscribers.
 *
 * @param downloadUrl relative download reference, null unless the conversion succeeded
 */
public record ConversionStatusView(
        String id,
        String fileName,
        double progress,
        boolean complete,
        String error,
        TargetFormat format,
        String quality,
        ConversionOutcome outcome,
        String downloadUrl
) {

    static final String DOWNLOAD_PREFIX = "/download/";

    public static ConversionStatusView of(String id, ConversionStatus status) {
        String fileName = status.outputFileName();
        String downloadUrl = status.isSuccessful() && !fileName.isEmpty() ? DOWNLOAD_PREFIX + fileName : null;
        return new ConversionStatusView(
                id,
                fileName,
                status.progress(),
                status.complete(),
                status.error(),
                status.format(),
                status.quality(),
                status.outcome(),
                downloadUrl
        );
    }
}
