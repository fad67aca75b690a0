package com.phillippitts.videoconverter.service.process;

import com.phillippitts.videoconverter.exception.ProcessSignalException;

import java.util.Objects;

/**
 * {@link CancellableProcess} backed by a {@link java.lang.Process}.
 *
 * <p>Graceful termination maps to {@link Process#destroy()} on platforms that support normal
 * termination; elsewhere (Windows) it fails so the caller escalates to
 * {@link Process#destroyForcibly()}.
 */
public final class OsProcessHandle implements CancellableProcess {

    private final Process process;
    private final long pid;

    public OsProcessHandle(Process process) {
        this.process = Objects.requireNonNull(process, "process");
        this.pid = resolvePid(process);
    }

    private static long resolvePid(Process process) {
        try {
            return process.pid();
        } catch (UnsupportedOperationException e) {
            return -1L;
        }
    }

    @Override
    public long pid() {
        return pid;
    }

    @Override
    public void signalGraceful() throws ProcessSignalException {
        if (!process.isAlive()) {
            throw ProcessSignalException.alreadyExited(pid);
        }
        if (!supportsNormalTermination()) {
            throw new ProcessSignalException(pid, "graceful termination not supported on this platform", false);
        }
        try {
            process.destroy();
        } catch (RuntimeException e) {
            throw new ProcessSignalException(pid, "graceful termination failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void signalForceful() throws ProcessSignalException {
        if (!process.isAlive()) {
            throw ProcessSignalException.alreadyExited(pid);
        }
        try {
            process.destroyForcibly();
        } catch (RuntimeException e) {
            throw new ProcessSignalException(pid, "forceful termination failed: " + e.getMessage(), e);
        }
    }

    private boolean supportsNormalTermination() {
        try {
            return process.supportsNormalTermination();
        } catch (UnsupportedOperationException e) {
            return false;
        }
    }
}
