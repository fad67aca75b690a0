package com.phillippitts.videoconverter.exception;

/**
 * Thrown when no status is tracked for the requested conversion id.
 */
public class ConversionNotFoundException extends VideoConverterException {

    private final String conversionId;

    public ConversionNotFoundException(String conversionId) {
        super("Conversion not found: " + conversionId);
        this.conversionId = conversionId;
    }

    public String getConversionId() {
        return conversionId;
    }
}
