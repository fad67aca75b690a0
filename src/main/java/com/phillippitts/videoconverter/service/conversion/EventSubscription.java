package com.phillippitts.videoconverter.service.conversion;

import com.phillippitts.videoconverter.domain.StoreEvent;

import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Bounded event buffer handed to one store subscriber.
 *
 * <p>The store offers events without blocking; when the buffer is full the event is dropped for
 * this subscriber. Consumers therefore see the latest state eventually but not every intermediate
 * progress tick. Once closed, no further events are accepted; already buffered events can still
 * be drained.
 */
public final class EventSubscription {

    private final BlockingQueue<StoreEvent> buffer;
    private volatile boolean closed;

    EventSubscription(int capacity) {
        this.buffer = new ArrayBlockingQueue<>(capacity);
    }

    /**
     * Waits up to {@code timeout} for the next event.
     *
     * @return the next event, or null on timeout or when closed and drained
     * @throws InterruptedException if interrupted while waiting
     */
    public StoreEvent poll(Duration timeout) throws InterruptedException {
        StoreEvent event = buffer.poll();
        if (event != null || closed) {
            return event;
        }
        return buffer.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public boolean isClosed() {
        return closed;
    }

    /** Number of buffered, undelivered events. */
    public int pending() {
        return buffer.size();
    }

    boolean offer(StoreEvent event) {
        return !closed && buffer.offer(event);
    }

    void close() {
        closed = true;
    }
}
