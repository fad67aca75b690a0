package com.phillippitts.videoconverter.exception;

/**
 * Thrown when a job cannot be queued because the bounded conversion queue is saturated.
 * Raised immediately instead of blocking so callers can answer "busy" without hanging.
 */
public class ConversionQueueFullException extends VideoConverterException {

    private final String conversionId;
    private final int capacity;

    public ConversionQueueFullException(String conversionId, int capacity) {
        super("Conversion queue is full (capacity " + capacity + "), cannot accept job " + conversionId);
        this.conversionId = conversionId;
        this.capacity = capacity;
    }

    public String getConversionId() {
        return conversionId;
    }

    public int getCapacity() {
        return capacity;
    }
}
