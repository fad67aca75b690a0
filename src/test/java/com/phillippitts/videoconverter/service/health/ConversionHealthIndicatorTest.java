package com.phillippitts.videoconverter.service.health;

import com.phillippitts.videoconverter.domain.ActiveConversionInfo;
import com.phillippitts.videoconverter.domain.TargetFormat;
import com.phillippitts.videoconverter.service.conversion.ConversionStatusStore;
import com.phillippitts.videoconverter.service.conversion.ConversionWorkerPool;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ConversionHealthIndicatorTest {

    private ConversionWorkerPool pool;
    private ConversionStatusStore store;
    private ConversionHealthIndicator indicator;

    @BeforeEach
    void setUp() {
        pool = mock(ConversionWorkerPool.class);
        store = mock(ConversionStatusStore.class);
        indicator = new ConversionHealthIndicator(pool, store);
        when(pool.workerCount()).thenReturn(2);
        when(pool.queueCapacity()).thenReturn(4);
        when(store.getActiveConversionsInfo()).thenReturn(List.of(
                new ActiveConversionInfo("J1", "a.mp4", TargetFormat.MP4, "default", 12.5)));
    }

    @Test
    void shouldReportUpWhenRunningWithRoom() {
        when(pool.isRunning()).thenReturn(true);
        when(pool.queuedJobCount()).thenReturn(1);

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails())
                .containsEntry("status", "Accepting conversions")
                .containsEntry("workers", 2)
                .containsEntry("queued", 1)
                .containsEntry("capacity", 4)
                .containsEntry("active", 1);
    }

    @Test
    void shouldReportDegradedWhenQueueSaturated() {
        when(pool.isRunning()).thenReturn(true);
        when(pool.queuedJobCount()).thenReturn(4);

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(new Status("DEGRADED"));
        assertThat(health.getDetails()).containsEntry("status", "Conversion queue saturated");
    }

    @Test
    void shouldReportDownWhenWorkersStopped() {
        when(pool.isRunning()).thenReturn(false);

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("status", "Conversion workers not running");
    }
}
