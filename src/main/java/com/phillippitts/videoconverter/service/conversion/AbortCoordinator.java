package com.phillippitts.videoconverter.service.conversion;

import com.phillippitts.videoconverter.domain.AbortResult;
import com.phillippitts.videoconverter.domain.ConversionOutcome;
import com.phillippitts.videoconverter.domain.ConversionStatus;
import com.phillippitts.videoconverter.exception.ProcessSignalException;
import com.phillippitts.videoconverter.service.process.CancellableProcess;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.Optional;

/**
 * Cancels a running conversion on user request.
 *
 * <p>Signals the registered encoder process (graceful first, forceful as fallback) and finalizes
 * the status as aborted. The process is marked as abort-requested before it is signalled, so the
 * worker that owns it finalizes as aborted too if it sees the exit first; whichever finalize lands
 * first wins and both agree on the outcome. File cleanup and deregistration stay with the worker.
 */
public class AbortCoordinator {

    private static final Logger LOG = LogManager.getLogger(AbortCoordinator.class);

    static final String NOT_FOUND = "Conversion not found";
    static final String ALREADY_COMPLETE = "Conversion already completed";
    static final String COMPLETED_BEFORE_ABORT = "Conversion completed before abort request processed";
    static final String PROCESS_NOT_FOUND = "Active conversion process not found";
    static final String TERMINATION_FAILED = "Abort requested, but process termination failed: ";
    static final String ABORTED = "Conversion aborted";

    private final ConversionStatusStore store;

    public AbortCoordinator(ConversionStatusStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    public AbortResult abortConversion(String conversionId) {
        Optional<ConversionStatus> status = store.getStatus(conversionId);
        if (status.isEmpty()) {
            return AbortResult.notFound(NOT_FOUND);
        }
        if (status.get().complete()) {
            return AbortResult.conflict(ALREADY_COMPLETE);
        }

        Optional<CancellableProcess> handle = store.requestAbort(conversionId);
        if (handle.isEmpty()) {
            // either queued and not started yet, or finished between the two reads
            boolean completedMeanwhile = store.getStatus(conversionId)
                    .map(ConversionStatus::complete)
                    .orElse(false);
            return completedMeanwhile
                    ? AbortResult.conflict(COMPLETED_BEFORE_ABORT)
                    : AbortResult.notFound(PROCESS_NOT_FOUND);
        }

        try {
            terminate(handle.get());
        } catch (ProcessSignalException e) {
            LOG.error("Failed to terminate encoder for {}: {}", conversionId, e.getMessage());
            store.updateStatusWithError(conversionId, TERMINATION_FAILED + e.getMessage());
            return AbortResult.internalError(TERMINATION_FAILED + e.getMessage());
        }

        if (!store.updateStatusOnAbort(conversionId) && !wasAborted(conversionId)) {
            return AbortResult.conflict(COMPLETED_BEFORE_ABORT);
        }
        LOG.info("Conversion {} aborted by user", conversionId);
        return AbortResult.success(ABORTED);
    }

    /** True if the worker recorded the abort first after seeing the process exit. */
    private boolean wasAborted(String conversionId) {
        return store.getStatus(conversionId)
                .map(status -> status.outcome() == ConversionOutcome.ABORTED)
                .orElse(false);
    }

    private static void terminate(CancellableProcess process) throws ProcessSignalException {
        try {
            process.signalGraceful();
        } catch (ProcessSignalException graceful) {
            if (graceful.isAlreadyExited()) {
                LOG.debug("Encoder pid {} already exited", process.pid());
                return;
            }
            LOG.warn("Graceful termination failed ({}); forcing pid {}", graceful.getMessage(), process.pid());
            try {
                process.signalForceful();
            } catch (ProcessSignalException forceful) {
                if (!forceful.isAlreadyExited()) {
                    forceful.addSuppressed(graceful);
                    throw forceful;
                }
            }
        }
    }
}
