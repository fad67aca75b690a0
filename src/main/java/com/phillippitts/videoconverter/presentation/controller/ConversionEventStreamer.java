package com.phillippitts.videoconverter.presentation.controller;

import com.phillippitts.videoconverter.config.properties.ConversionProperties;
import com.phillippitts.videoconverter.domain.StoreEvent;
import com.phillippitts.videoconverter.service.conversion.ConversionStatusStore;
import com.phillippitts.videoconverter.service.conversion.EventSubscription;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Duration;

/**
 * Bridges a {@link ConversionStatusStore} subscription onto a server-sent event stream.
 *
 * <p>Event names: {@code active} (initial snapshot of running conversions), {@code status} and
 * {@code removed}. A comment line is written every heartbeat interval so dead connections are
 * noticed and proxies keep the stream open. The subscription is released on completion, timeout,
 * error, or a failed write.
 */
@Component
class ConversionEventStreamer {

    private static final Logger LOG = LogManager.getLogger(ConversionEventStreamer.class);

    static final String ACTIVE_EVENT = "active";
    private static final Duration POLL_INTERVAL = Duration.ofSeconds(1);

    private final ConversionStatusStore store;
    private final TaskExecutor executor;
    private final Duration heartbeat;

    @Autowired
    ConversionEventStreamer(ConversionStatusStore store,
                            @Qualifier("eventStreamExecutor") TaskExecutor executor,
                            ConversionProperties properties) {
        this(store, executor, Duration.ofSeconds(properties.getEvents().getHeartbeatSeconds()));
    }

    ConversionEventStreamer(ConversionStatusStore store, TaskExecutor executor, Duration heartbeat) {
        this.store = store;
        this.executor = executor;
        this.heartbeat = heartbeat;
    }

    /**
     * Opens a new stream. The returned emitter never times out on its own.
     *
     * @throws org.springframework.core.task.TaskRejectedException if too many streams are open
     */
    SseEmitter open() {
        SseEmitter emitter = new SseEmitter(0L);
        EventSubscription subscription = store.subscribe();
        emitter.onCompletion(() -> store.unsubscribe(subscription));
        emitter.onTimeout(() -> store.unsubscribe(subscription));
        emitter.onError(e -> store.unsubscribe(subscription));
        try {
            executor.execute(() -> pump(emitter, subscription));
        } catch (RuntimeException e) {
            store.unsubscribe(subscription);
            throw e;
        }
        return emitter;
    }

    void pump(SseEmitter emitter, EventSubscription subscription) {
        try {
            emitter.send(SseEmitter.event().name(ACTIVE_EVENT).data(store.getActiveConversionsInfo()));
            long lastBeat = System.nanoTime();
            while (!subscription.isClosed()) {
                StoreEvent event = subscription.poll(POLL_INTERVAL);
                if (event != null) {
                    emitter.send(SseEmitter.event().name(event.type().wireName()).data(event));
                }
                long now = System.nanoTime();
                if (now - lastBeat >= heartbeat.toNanos()) {
                    emitter.send(SseEmitter.event().comment("heartbeat"));
                    lastBeat = now;
                }
            }
            emitter.complete();
        } catch (IOException | IllegalStateException e) {
            LOG.debug("Event stream closed by client: {}", e.toString());
            emitter.completeWithError(e);
        } catch (RuntimeException e) {
            LOG.warn("Event stream failed", e);
            emitter.completeWithError(e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            emitter.complete();
        } finally {
            store.unsubscribe(subscription);
        }
    }
}
