package com.phillippitts.videoconverter.exception;

/**
 * Thrown when a converted file requested for download or deletion does not exist.
 */
public class ConvertedFileNotFoundException extends VideoConverterException {

    private final String fileName;

    public ConvertedFileNotFoundException(String fileName) {
        super("Converted file not found: " + fileName);
        this.fileName = fileName;
    }

    public String getFileName() {
        return fileName;
    }
}
