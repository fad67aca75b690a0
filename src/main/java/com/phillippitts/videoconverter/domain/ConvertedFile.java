package com.phillippitts.videoconverter.domain;

import java.time.Instant;

/**
 * Entry of the converted-files listing.
 *
 * @param url relative download reference
 */
public record ConvertedFile(String name, long size, Instant modTime, String url) {

    public static ConvertedFile of(String name, long size, Instant modTime) {
        return new ConvertedFile(name, size, modTime, ConversionStatusView.DOWNLOAD_PREFIX + name);
    }
}
