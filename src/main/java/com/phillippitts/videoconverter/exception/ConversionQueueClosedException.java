package com.phillippitts.videoconverter.exception;

/**
 * Thrown when a job is submitted after the worker pool has been stopped.
 */
public class ConversionQueueClosedException extends VideoConverterException {

    private final String conversionId;

    public ConversionQueueClosedException(String conversionId) {
        super("Conversion queue is closed, cannot accept job " + conversionId);
        this.conversionId = conversionId;
    }

    public String getConversionId() {
        return conversionId;
    }
}
