package com.phillippitts.videoconverter.domain;

/**
 * Result of an abort request.
 *
 * @param outcome classification the caller maps to a response
 * @param message human-readable explanation
 */
public record AbortResult(Outcome outcome, String message) {

    public enum Outcome { SUCCESS, NOT_FOUND, CONFLICT, INTERNAL_ERROR }

    public static AbortResult success(String message) {
        return new AbortResult(Outcome.SUCCESS, message);
    }

    public static AbortResult notFound(String message) {
        return new AbortResult(Outcome.NOT_FOUND, message);
    }

    public static AbortResult conflict(String message) {
        return new AbortResult(Outcome.CONFLICT, message);
    }

    public static AbortResult internalError(String message) {
        return new AbortResult(Outcome.INTERNAL_ERROR, message);
    }

    public boolean isSuccess() {
        return outcome == Outcome.SUCCESS;
    }
}
