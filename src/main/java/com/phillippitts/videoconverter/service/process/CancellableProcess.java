package com.phillippitts.videoconverter.service.process;

import com.phillippitts.videoconverter.exception.ProcessSignalException;

/**
 * Handle to a running external process that can be asked to stop.
 *
 * <p>Hides the platform differences between a polite termination request (SIGTERM on POSIX)
 * and a forced kill. Callers try {@link #signalGraceful()} first and fall back to
 * {@link #signalForceful()} when the graceful signal fails for any reason other than the
 * process having already exited.
 */
public interface CancellableProcess {

    /** OS process id, or -1 when the platform does not expose one. */
    long pid();

    /**
     * Requests orderly termination.
     *
     * @throws ProcessSignalException if the request could not be delivered; check
     *         {@link ProcessSignalException#isAlreadyExited()} for the benign case
     */
    void signalGraceful() throws ProcessSignalException;

    /**
     * Terminates the process forcibly.
     *
     * @throws ProcessSignalException if the kill could not be delivered
     */
    void signalForceful() throws ProcessSignalException;
}
