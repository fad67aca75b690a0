package com.phillippitts.videoconverter.service.conversion;

import com.phillippitts.videoconverter.domain.ConversionStatus;
import com.phillippitts.videoconverter.domain.TargetFormat;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProgressExtractorTest {

    private static final String ID = "J1";

    private ConversionStatusStore store;
    private AtomicLong clock;

    @BeforeEach
    void setUp() {
        store = new ConversionStatusStore();
        store.setStatus(ID, ConversionStatus.pending(Path.of("in.mov"), Path.of("out.mp4"),
                TargetFormat.MP4, "default"));
        clock = new AtomicLong();
    }

    private ProgressExtractor extractor(Duration throttle, double increment) {
        // every read of the clock advances it by 100ms
        return new ProgressExtractor(store, throttle, increment,
                () -> clock.getAndAdd(TimeUnit.MILLISECONDS.toNanos(100)));
    }

    private static InputStream stream(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    private double progress() {
        return store.getStatus(ID).orElseThrow().progress();
    }

    @Test
    void eachAcceptedSampleAddsIncrement() {
        ProgressExtractor extractor = extractor(Duration.ZERO, 0.5);

        int accepted = extractor.consume(ID, stream("""
                frame=10
                fps=25.0
                out_time_us=400000
                out_time_ms=400000
                progress=continue
                """));

        assertThat(accepted).isEqualTo(3);
        assertThat(progress()).isEqualTo(1.5);
    }

    @Test
    void throttleDropsSamplesArrivingTooSoon() {
        // clock steps 100ms per sample; a 250ms throttle accepts samples 1, 4, 7
        ProgressExtractor extractor = extractor(Duration.ofMillis(250), 1.0);

        int accepted = extractor.consume(ID, stream("frame=1\n".repeat(7)));

        assertThat(accepted).isEqualTo(3);
        assertThat(progress()).isEqualTo(3.0);
    }

    @Test
    void stopsAtEndMarker() {
        ProgressExtractor extractor = extractor(Duration.ZERO, 1.0);

        int accepted = extractor.consume(ID, stream("frame=1\nprogress=end\nframe=2\nframe=3\n"));

        assertThat(accepted).isEqualTo(1);
        assertThat(progress()).isEqualTo(1.0);
    }

    @Test
    void ignoresUnrecognizedAndMalformedLines() {
        ProgressExtractor extractor = extractor(Duration.ZERO, 1.0);

        int accepted = extractor.consume(ID, stream("bitrate=1000kbits/s\n=frame\nframe\nspeed=1.2x\n\n"));

        assertThat(accepted).isZero();
        assertThat(progress()).isZero();
    }

    @Test
    void neverReachesCompletionThroughSamples() {
        ProgressExtractor extractor = extractor(Duration.ZERO, 10.0);

        extractor.consume(ID, stream("frame=1\n".repeat(50)));

        assertThat(progress()).isEqualTo(99.0);
        assertThat(store.getStatus(ID).orElseThrow().complete()).isFalse();
    }

    @Test
    void noUpdatesForCompletedConversion() {
        store.updateStatusOnAbort(ID);
        ProgressExtractor extractor = extractor(Duration.ZERO, 1.0);

        int accepted = extractor.consume(ID, stream("frame=1\nframe=2\n"));

        assertThat(accepted).isZero();
        assertThat(progress()).isZero();
    }

    @Test
    void readErrorIsNotPropagated() {
        ProgressExtractor extractor = extractor(Duration.ZERO, 1.0);
        InputStream failing = new InputStream() {
            @Override
            public int read() throws IOException {
                throw new IOException("pipe closed");
            }
        };

        assertThat(extractor.consume(ID, failing)).isZero();
    }

    @Test
    void rejectsInvalidConfiguration() {
        assertThatThrownBy(() -> new ProgressExtractor(store, Duration.ofMillis(-1), 0.5))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ProgressExtractor(store, Duration.ZERO, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void recognizesSampleKeys() {
        assertThat(ProgressExtractor.isSample("out_time_us=1")).isTrue();
        assertThat(ProgressExtractor.isSample("out_time_ms=1")).isTrue();
        assertThat(ProgressExtractor.isSample("frame=1")).isTrue();
        assertThat(ProgressExtractor.isSample("out_time=00:00:01.000")).isFalse();
        assertThat(ProgressExtractor.isSample("progress=continue")).isFalse();
    }
}
