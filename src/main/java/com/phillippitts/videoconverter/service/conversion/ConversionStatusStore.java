package com.phillippitts.videoconverter.service.conversion;

import com.phillippitts.videoconverter.domain.ActiveConversionInfo;
import com.phillippitts.videoconverter.domain.ConversionStatus;
import com.phillippitts.videoconverter.domain.StoreEvent;
import com.phillippitts.videoconverter.service.process.CancellableProcess;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Single source of truth for conversion status, live encoder process handles, and the push-event
 * bus that streams status changes to subscribers.
 *
 * <p><b>Thread Safety:</b> three maps (statuses, active processes, subscribers), each guarded by
 * its own {@link ReadWriteLock}. No lock is held while another is acquired, so status polling
 * never contends with process bookkeeping and there is no lock ordering to get wrong.
 *
 * <p><b>Completion guard:</b> once a status is complete, every further transition is a silent
 * no-op. Whichever of success, failure or abort finalizes first wins; the loser has no effect
 * and publishes nothing.
 *
 * <p><b>Events:</b> every mutation that changes state publishes exactly one event, after the
 * status lock is released. Delivery is best effort: a subscriber whose buffer is full misses that
 * event rather than stalling the publisher.
 */
public class ConversionStatusStore {

    private static final Logger LOG = LogManager.getLogger(ConversionStatusStore.class);

    public static final int DEFAULT_SUBSCRIBER_BUFFER_SIZE = 16;
    public static final double MAX_PROGRESS_BEFORE_COMPLETION = 99.0;

    private final Map<String, ConversionStatus> statuses = new HashMap<>();
    private final ReadWriteLock statusLock = new ReentrantReadWriteLock();

    private final Map<String, CancellableProcess> activeProcesses = new LinkedHashMap<>();
    private final Set<String> abortRequests = new HashSet<>();
    private final ReadWriteLock processLock = new ReentrantReadWriteLock();

    private final Set<EventSubscription> subscribers = new LinkedHashSet<>();
    private final ReadWriteLock subscriberLock = new ReentrantReadWriteLock();

    private final int subscriberBufferSize;

    public ConversionStatusStore() {
        this(DEFAULT_SUBSCRIBER_BUFFER_SIZE);
    }

    public ConversionStatusStore(int subscriberBufferSize) {
        if (subscriberBufferSize <= 0) {
            throw new IllegalArgumentException("subscriberBufferSize must be positive");
        }
        this.subscriberBufferSize = subscriberBufferSize;
    }

    // ---------------------------------------------------------------- statuses

    /**
     * Inserts or replaces the status for {@code id}. Always publishes a status event.
     */
    public void setStatus(String id, ConversionStatus status) {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(status, "status");
        statusLock.writeLock().lock();
        try {
            statuses.put(id, status);
        } finally {
            statusLock.writeLock().unlock();
        }
        publishStatus(id);
    }

    /**
     * Returns the current status snapshot for {@code id}.
     */
    public Optional<ConversionStatus> getStatus(String id) {
        statusLock.readLock().lock();
        try {
            return Optional.ofNullable(statuses.get(id));
        } finally {
            statusLock.readLock().unlock();
        }
    }

    /**
     * Returns a copy of every tracked status keyed by conversion id.
     */
    public Map<String, ConversionStatus> getAllStatuses() {
        statusLock.readLock().lock();
        try {
            return Map.copyOf(statuses);
        } finally {
            statusLock.readLock().unlock();
        }
    }

    /**
     * Removes the status for {@code id}. Publishes a removal event only if an entry existed.
     */
    public void deleteStatus(String id) {
        boolean existed;
        statusLock.writeLock().lock();
        try {
            existed = statuses.remove(id) != null;
        } finally {
            statusLock.writeLock().unlock();
        }
        if (existed) {
            publish(StoreEvent.removed(id));
        }
    }

    /**
     * Marks the conversion complete with an error, resetting progress to 0.
     *
     * @return true if the status changed; false if unknown or already complete
     */
    public boolean updateStatusWithError(String id, String message) {
        return transition(id, s -> !s.complete(), s -> s.failed(message));
    }

    /**
     * Marks the conversion complete as aborted by the user.
     *
     * @return true if the status changed; false if unknown or already complete
     */
    public boolean updateStatusOnAbort(String id) {
        return transition(id, s -> !s.complete(), ConversionStatus::aborted);
    }

    /**
     * Marks the conversion complete and successful: progress 100, no error.
     *
     * @return true if the status changed; false if unknown or already complete
     */
    public boolean updateStatusOnSuccess(String id) {
        return transition(id, s -> !s.complete(), ConversionStatus::succeeded);
    }

    /**
     * Stores a progress estimate clamped into [0, 99]. Only 100 is reserved for
     * {@link #updateStatusOnSuccess(String)}.
     *
     * @return true if stored; false if unknown, complete, or errored
     */
    public boolean setProgressPercentage(String id, double percentage) {
        double clamped = clampProgress(percentage);
        return transition(id, s -> !s.complete() && !s.hasError(), s -> s.withProgress(clamped));
    }

    static double clampProgress(double percentage) {
        if (Double.isNaN(percentage) || percentage < 0) {
            return 0.0;
        }
        return Math.min(percentage, MAX_PROGRESS_BEFORE_COMPLETION);
    }

    private boolean transition(String id,
                               Predicate<ConversionStatus> guard,
                               UnaryOperator<ConversionStatus> change) {
        statusLock.writeLock().lock();
        try {
            ConversionStatus current = statuses.get(id);
            if (current == null || !guard.test(current)) {
                return false;
            }
            statuses.put(id, change.apply(current));
        } finally {
            statusLock.writeLock().unlock();
        }
        publishStatus(id);
        return true;
    }

    // ---------------------------------------------------------------- active processes

    public void registerActiveProcess(String id, CancellableProcess handle) {
        Objects.requireNonNull(handle, "handle");
        processLock.writeLock().lock();
        try {
            activeProcesses.put(id, handle);
        } finally {
            processLock.writeLock().unlock();
        }
    }

    /**
     * Removes the handle and any pending abort request for {@code id}.
     */
    public void unregisterActiveProcess(String id) {
        processLock.writeLock().lock();
        try {
            activeProcesses.remove(id);
            abortRequests.remove(id);
        } finally {
            processLock.writeLock().unlock();
        }
    }

    public Optional<CancellableProcess> getActiveProcess(String id) {
        processLock.readLock().lock();
        try {
            return Optional.ofNullable(activeProcesses.get(id));
        } finally {
            processLock.readLock().unlock();
        }
    }

    /**
     * Atomically looks up the registered handle and marks an abort as requested for it.
     *
     * <p>The mark lets the worker tell a user abort apart from an unexpected process death when
     * it observes the exit before the abort path has finalized the status.
     *
     * @return the handle to signal, or empty if no process is registered (nothing is marked)
     */
    public Optional<CancellableProcess> requestAbort(String id) {
        processLock.writeLock().lock();
        try {
            CancellableProcess handle = activeProcesses.get(id);
            if (handle != null) {
                abortRequests.add(id);
            }
            return Optional.ofNullable(handle);
        } finally {
            processLock.writeLock().unlock();
        }
    }

    public boolean isAbortRequested(String id) {
        processLock.readLock().lock();
        try {
            return abortRequests.contains(id);
        } finally {
            processLock.readLock().unlock();
        }
    }

    /**
     * Lists conversions that have a registered process and are not complete.
     *
     * <p>Takes the process snapshot first and reads statuses afterwards. A job that completes in
     * between is seen as complete and left out, so the race only ever omits, never includes, a
     * finished job.
     */
    public List<ActiveConversionInfo> getActiveConversionsInfo() {
        List<String> ids;
        processLock.readLock().lock();
        try {
            ids = new ArrayList<>(activeProcesses.keySet());
        } finally {
            processLock.readLock().unlock();
        }

        List<ActiveConversionInfo> active = new ArrayList<>(ids.size());
        statusLock.readLock().lock();
        try {
            for (String id : ids) {
                ConversionStatus status = statuses.get(id);
                if (status != null && !status.complete()) {
                    active.add(new ActiveConversionInfo(id, status.outputFileName(), status.format(),
                            status.quality(), status.progress()));
                }
            }
        } finally {
            statusLock.readLock().unlock();
        }
        return active;
    }

    // ---------------------------------------------------------------- events

    /**
     * Registers a new listener with a bounded buffer.
     */
    public EventSubscription subscribe() {
        EventSubscription subscription = new EventSubscription(subscriberBufferSize);
        subscriberLock.writeLock().lock();
        try {
            subscribers.add(subscription);
        } finally {
            subscriberLock.writeLock().unlock();
        }
        LOG.debug("Subscriber registered (total={})", subscriberCount());
        return subscription;
    }

    /**
     * Deregisters and closes {@code subscription}. Unknown subscriptions are ignored.
     */
    public void unsubscribe(EventSubscription subscription) {
        if (subscription == null) {
            return;
        }
        subscriberLock.writeLock().lock();
        try {
            if (subscribers.remove(subscription)) {
                subscription.close();
            }
        } finally {
            subscriberLock.writeLock().unlock();
        }
    }

    public int subscriberCount() {
        subscriberLock.readLock().lock();
        try {
            return subscribers.size();
        } finally {
            subscriberLock.readLock().unlock();
        }
    }

    private void publishStatus(String id) {
        // re-read so the event reflects the newest state, not the one this caller wrote
        getStatus(id).ifPresent(status -> publish(StoreEvent.status(id, status)));
    }

    private void publish(StoreEvent event) {
        subscriberLock.readLock().lock();
        try {
            for (EventSubscription subscription : subscribers) {
                if (!subscription.offer(event)) {
                    LOG.debug("Dropped {} event for {}: subscriber buffer full",
                            event.type().wireName(), event.conversionId());
                }
            }
        } finally {
            subscriberLock.readLock().unlock();
        }
    }
}
