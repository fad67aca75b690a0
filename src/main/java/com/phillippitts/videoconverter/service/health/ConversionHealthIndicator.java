package com.phillippitts.videoconverter.service.health;

import com.phillippitts.videoconverter.service.conversion.ConversionStatusStore;
import com.phillippitts.videoconverter.service.conversion.ConversionWorkerPool;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the conversion worker pool.
 *
 * <p>Reports pool status for monitoring and alerting:
 * <ul>
 *   <li>UP: Workers running and the queue has room</li>
 *   <li>DEGRADED: Workers running but the queue is full; new jobs are rejected</li>
 *   <li>DOWN: Pool not started or stopped</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class ConversionHealthIndicator implements HealthIndicator {

    private final ConversionWorkerPool pool;
    private final ConversionStatusStore store;

    public ConversionHealthIndicator(ConversionWorkerPool pool, ConversionStatusStore store) {
        this.pool = pool;
        this.store = store;
    }

    @Override
    public Health health() {
        int queued = pool.queuedJobCount();
        int capacity = pool.queueCapacity();

        Health.Builder builder = new Health.Builder();
        if (!pool.isRunning()) {
            builder.down().withDetail("status", "Conversion workers not running");
        } else if (queued >= capacity) {
            builder.status("DEGRADED").withDetail("status", "Conversion queue saturated");
        } else {
            builder.up().withDetail("status", "Accepting conversions");
        }

        return builder
                .withDetail("workers", pool.workerCount())
                .withDetail("queued", queued)
                .withDetail("capacity", capacity)
                .withDetail("active", store.getActiveConversionsInfo().size())
                .build();
    }
}
