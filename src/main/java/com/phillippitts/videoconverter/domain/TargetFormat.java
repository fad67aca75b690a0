package com.phillippitts.videoconverter.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Container formats the encoder can produce.
 */
public enum TargetFormat {
    MOV("mov", "video/quicktime"),
    MP4("mp4", "video/mp4"),
    AVI("avi", "video/x-msvideo");

    private final String extension;
    private final String mediaType;

    TargetFormat(String extension, String mediaType) {
        this.extension = extension;
        this.mediaType = mediaType;
    }

    @JsonValue
    public String extension() {
        return extension;
    }

    /** Content type served for downloads of this format. */
    public String mediaType() {
        return mediaType;
    }

    /**
     * Parses a format from its file extension, ignoring case and surrounding whitespace.
     *
     * @param value extension such as {@code "mp4"} (may be null)
     * @return matching format, or empty if unsupported
     */
    public static Optional<TargetFormat> fromExtension(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String key = value.trim().toLowerCase(Locale.ROOT);
        for (TargetFormat format : values()) {
            if (format.extension.equals(key)) {
                return Optional.of(format);
            }
        }
        return Optional.empty();
    }
}
