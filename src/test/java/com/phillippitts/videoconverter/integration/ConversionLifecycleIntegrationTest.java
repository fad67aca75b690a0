package com.phillippitts.videoconverter.integration;

import com.phillippitts.videoconverter.domain.AbortResult;
import com.phillippitts.videoconverter.domain.ConversionJob;
import com.phillippitts.videoconverter.domain.ConversionOutcome;
import com.phillippitts.videoconverter.domain.StoreEvent;
import com.phillippitts.videoconverter.domain.TargetFormat;
import com.phillippitts.videoconverter.service.conversion.AbortCoordinator;
import com.phillippitts.videoconverter.service.conversion.ConversionJobRunner;
import com.phillippitts.videoconverter.service.conversion.ConversionStatusStore;
import com.phillippitts.videoconverter.service.conversion.ConversionSubmissionService;
import com.phillippitts.videoconverter.service.conversion.ConversionWorkerPool;
import com.phillippitts.videoconverter.service.conversion.EncoderCommandBuilder;
import com.phillippitts.videoconverter.service.conversion.EventSubscription;
import com.phillippitts.videoconverter.service.conversion.MetadataCopier;
import com.phillippitts.videoconverter.service.conversion.ProgressExtractor;
import com.phillippitts.videoconverter.service.files.ConvertedFileStore;
import com.phillippitts.videoconverter.service.metrics.ConversionMetrics;
import com.phillippitts.videoconverter.testutil.BlockingProcess;
import com.phillippitts.videoconverter.testutil.FakeProcess;
import com.phillippitts.videoconverter.testutil.ScriptedProcessFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

/**
 * Wires store, runner, pool and abort coordinator together against fake encoder processes.
 */
class ConversionLifecycleIntegrationTest {

    @TempDir
    Path tempDir;

    private ConversionStatusStore store;
    private ScriptedProcessFactory processFactory;
    private ConversionWorkerPool pool;
    private ConversionSubmissionService submissionService;
    private AbortCoordinator abortCoordinator;

    @BeforeEach
    void setUp() {
        store = new ConversionStatusStore();
        processFactory = new ScriptedProcessFactory();
        ConversionMetrics metrics = new ConversionMetrics(new SimpleMeterRegistry());
        ConversionJobRunner runner = new ConversionJobRunner(
                store,
                processFactory,
                new EncoderCommandBuilder(),
                new ProgressExtractor(store, Duration.ZERO, 0.5),
                new MetadataCopier(processFactory, false, MetadataCopier.DEFAULT_BINARY, MetadataCopier.DEFAULT_TIMEOUT),
                metrics,
                ConversionJobRunner.DEFAULT_STDERR_MAX_CHARS);
        pool = new ConversionWorkerPool(1, runner);
        pool.start();
        submissionService = new ConversionSubmissionService(store, pool, metrics,
                tempDir.resolve("uploads"), tempDir.resolve("converted"));
        abortCoordinator = new AbortCoordinator(store);
    }

    @AfterEach
    void tearDown() {
        pool.stop();
    }

    private ConversionJob job(String id) throws IOException {
        Path input = tempDir.resolve("uploads").resolve(id + ".mov");
        Files.createDirectories(input.getParent());
        Files.writeString(input, "raw-video");
        return new ConversionJob(id, null, id + ".mov", TargetFormat.MP4, "fast", input,
                tempDir.resolve("converted").resolve(id + ".mp4"), false, false);
    }

    @Test
    void submittedJobRunsToSuccessAndPublishesEachStep() throws Exception {
        processFactory.thenProduce("mp4".getBytes(StandardCharsets.UTF_8),
                new FakeProcess("frame=1\nframe=2\nprogress=end\n", "", 0));
        EventSubscription subscription = store.subscribe();
        ConversionJob job = job("S1");

        submissionService.submit(job);

        await().atMost(5, TimeUnit.SECONDS)
                .until(() -> store.getStatus("S1").map(s -> s.complete()).orElse(false));
        assertThat(store.getStatus("S1").orElseThrow().outcome()).isEqualTo(ConversionOutcome.SUCCEEDED);
        assertThat(job.outputPath()).exists();
        assertThat(job.inputPath()).doesNotExist();

        List<StoreEvent> events = new ArrayList<>();
        StoreEvent event;
        while ((event = subscription.poll(Duration.ofMillis(100))) != null) {
            events.add(event);
        }
        assertThat(events).extracting(e -> e.status().progress())
                .containsExactly(0.0, 0.5, 1.0, 100.0);
        assertThat(events.get(events.size() - 1).status().downloadUrl()).isEqualTo("/download/S1.mp4");
    }

    @Test
    void uploadedVideoEndsUpInConvertedFileListing() throws Exception {
        processFactory.thenProduce("mp4".getBytes(StandardCharsets.UTF_8),
                new FakeProcess("progress=end\n", "", 0));
        ConvertedFileStore fileStore = new ConvertedFileStore(tempDir.resolve("converted"));

        ConversionJob job = submissionService.submitUpload("My Holiday.mov",
                new ByteArrayInputStream("raw-video".getBytes(StandardCharsets.UTF_8)),
                TargetFormat.MP4, "high", false, false);

        await().atMost(5, TimeUnit.SECONDS)
                .until(() -> store.getStatus(job.conversionId()).map(s -> s.complete()).orElse(false));
        assertThat(store.getStatus(job.conversionId()).orElseThrow().outcome())
                .isEqualTo(ConversionOutcome.SUCCEEDED);
        String outputName = job.outputPath().getFileName().toString();
        assertThat(fileStore.listFiles()).extracting(f -> f.name()).containsExactly(outputName);
        assertThat(fileStore.resolve(outputName)).hasContent("mp4");
        assertThat(job.inputPath()).doesNotExist();
    }

    @Test
    void abortStopsRunningEncoderAndCleansUp() throws Exception {
        BlockingProcess encoder = new BlockingProcess("frame=1\n");
        processFactory.thenReturn(encoder);
        ConversionJob job = job("A1");

        submissionService.submit(job);
        assertThat(encoder.awaitStreaming(5, TimeUnit.SECONDS)).isTrue();
        assertThat(store.getActiveConversionsInfo()).hasSize(1);

        AbortResult result = abortCoordinator.abortConversion("A1");

        assertThat(result.isSuccess()).isTrue();
        assertThat(store.getStatus("A1").orElseThrow().outcome()).isEqualTo(ConversionOutcome.ABORTED);
        await().atMost(5, TimeUnit.SECONDS).until(() -> store.getActiveProcess("A1").isEmpty());
        await().atMost(5, TimeUnit.SECONDS).until(() -> Files.notExists(job.inputPath()));
        assertThat(store.getStatus("A1").orElseThrow().outcome()).isEqualTo(ConversionOutcome.ABORTED);
        assertThat(abortCoordinator.abortConversion("A1").outcome()).isEqualTo(AbortResult.Outcome.CONFLICT);
    }

    @Test
    void abortEscalatesWhenEncoderIgnoresTermination() throws Exception {
        BlockingProcess stubborn = new BlockingProcess("frame=1\n", false);
        processFactory.thenReturn(stubborn);

        submissionService.submit(job("A2"));
        assertThat(stubborn.awaitStreaming(5, TimeUnit.SECONDS)).isTrue();

        AbortResult result = abortCoordinator.abortConversion("A2");

        assertThat(result.isSuccess()).isTrue();
        await().atMost(5, TimeUnit.SECONDS).until(() -> !stubborn.isAlive());
        assertThat(stubborn.exitValue()).isEqualTo(137);
        assertThat(store.getStatus("A2").orElseThrow().outcome()).isEqualTo(ConversionOutcome.ABORTED);
    }

    @Test
    void failedEncoderDoesNotBlockNextJob() throws Exception {
        processFactory.thenReturn(new FakeProcess("", "Unknown encoder 'libx265'", 1))
                .thenProduce("ok".getBytes(StandardCharsets.UTF_8), new FakeProcess("", "", 0));

        submissionService.submit(job("F1"));
        submissionService.submit(job("F2"));

        await().atMost(5, TimeUnit.SECONDS)
                .until(() -> store.getStatus("F2").map(s -> s.complete()).orElse(false));
        assertThat(store.getStatus("F1").orElseThrow().error()).contains("Unknown encoder");
        assertThat(store.getStatus("F2").orElseThrow().outcome()).isEqualTo(ConversionOutcome.SUCCEEDED);
    }
}
