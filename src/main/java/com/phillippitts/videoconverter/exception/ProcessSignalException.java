package com.phillippitts.videoconverter.exception;

/**
 * Thrown when a termination signal could not be delivered to an external process.
 *
 * <p>{@link #isAlreadyExited()} distinguishes the benign case where the process had already
 * terminated from a real delivery failure.
 */
public class ProcessSignalException extends Exception {

    private final long pid;
    private final boolean alreadyExited;

    public ProcessSignalException(long pid, String message, boolean alreadyExited) {
        super(message + " (pid: " + pid + ")");
        this.pid = pid;
        this.alreadyExited = alreadyExited;
    }

    public ProcessSignalException(long pid, String message, Throwable cause) {
        super(message + " (pid: " + pid + ")", cause);
        this.pid = pid;
        this.alreadyExited = false;
    }

    public static ProcessSignalException alreadyExited(long pid) {
        return new ProcessSignalException(pid, "process already exited", true);
    }

    public long getPid() {
        return pid;
    }

    public boolean isAlreadyExited() {
        return alreadyExited;
    }
}
