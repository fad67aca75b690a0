package com.phillippitts.videoconverter.exception;

/**
 * Thrown when client input is rejected before any work starts: unsupported target format,
 * missing upload or a file name that would escape the converted directory.
 */
public class InvalidRequestException extends VideoConverterException {

    public InvalidRequestException(String message) {
        super(message);
    }
}
