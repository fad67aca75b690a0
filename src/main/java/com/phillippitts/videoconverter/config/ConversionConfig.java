package com.phillippitts.videoconverter.config;

import com.phillippitts.videoconverter.config.properties.ConversionProperties;
import com.phillippitts.videoconverter.service.conversion.AbortCoordinator;
import com.phillippitts.videoconverter.service.conversion.ConversionJobRunner;
import com.phillippitts.videoconverter.service.conversion.ConversionStatusStore;
import com.phillippitts.videoconverter.service.conversion.ConversionSubmissionService;
import com.phillippitts.videoconverter.service.conversion.ConversionWorkerPool;
import com.phillippitts.videoconverter.service.conversion.EncoderCommandBuilder;
import com.phillippitts.videoconverter.service.conversion.MetadataCopier;
import com.phillippitts.videoconverter.service.conversion.ProgressExtractor;
import com.phillippitts.videoconverter.service.files.ConvertedFileStore;
import com.phillippitts.videoconverter.service.metrics.ConversionMetrics;
import com.phillippitts.videoconverter.service.process.DefaultProcessFactory;
import com.phillippitts.videoconverter.service.process.ProcessFactory;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Wires the conversion core explicitly from {@link ConversionProperties}.
 *
 * <p>The core classes carry no Spring annotations; this class is the only place that knows how
 * they fit together. The worker pool is started on context refresh and stopped (draining the
 * queue) on context close.
 */
@Configuration
public class ConversionConfig {

    private final ConversionProperties properties;

    public ConversionConfig(ConversionProperties properties) {
        this.properties = properties;
    }

    @Bean
    public ConversionStatusStore conversionStatusStore() {
        return new ConversionStatusStore(properties.getEvents().getSubscriberBufferSize());
    }

    @Bean
    public ProcessFactory processFactory() {
        return new DefaultProcessFactory();
    }

    @Bean
    public ConversionMetrics conversionMetrics(MeterRegistry meterRegistry) {
        return new ConversionMetrics(meterRegistry);
    }

    @Bean
    public ProgressExtractor progressExtractor(ConversionStatusStore store) {
        ConversionProperties.Progress progress = properties.getProgress();
        return new ProgressExtractor(store, Duration.ofMillis(progress.getThrottleMs()), progress.getIncrement());
    }

    @Bean
    public EncoderCommandBuilder encoderCommandBuilder() {
        ConversionProperties.Encoder encoder = properties.getEncoder();
        return new EncoderCommandBuilder(encoder.getBinary(), encoder.getThreadReserve());
    }

    @Bean
    public MetadataCopier metadataCopier(ProcessFactory processFactory) {
        ConversionProperties.Metadata metadata = properties.getMetadata();
        return new MetadataCopier(processFactory, metadata.isEnabled(), metadata.getBinary(),
                Duration.ofSeconds(metadata.getTimeoutSeconds()));
    }

    @Bean
    public ConversionJobRunner conversionJobRunner(ConversionStatusStore store,
                                                   ProcessFactory processFactory,
                                                   EncoderCommandBuilder encoderCommandBuilder,
                                                   ProgressExtractor progressExtractor,
                                                   MetadataCopier metadataCopier,
                                                   ConversionMetrics conversionMetrics) {
        return new ConversionJobRunner(store, processFactory, encoderCommandBuilder, progressExtractor,
                metadataCopier, conversionMetrics, properties.getEncoder().getStderrMaxBytes());
    }

    /**
     * Worker pool; also registers the queue-depth and active-conversion gauges.
     */
    @Bean(initMethod = "start", destroyMethod = "stop")
    public ConversionWorkerPool conversionWorkerPool(ConversionJobRunner runner,
                                                     ConversionStatusStore store,
                                                     ConversionMetrics conversionMetrics) {
        ConversionWorkerPool pool = new ConversionWorkerPool(properties.getWorkerCount(), runner,
                properties.getWorkerThreadNamePrefix());
        conversionMetrics.registerGauges(pool::queuedJobCount, () -> store.getActiveConversionsInfo().size());
        return pool;
    }

    @Bean
    public AbortCoordinator abortCoordinator(ConversionStatusStore store) {
        return new AbortCoordinator(store);
    }

    @Bean
    public ConversionSubmissionService conversionSubmissionService(ConversionStatusStore store,
                                                                   ConversionWorkerPool pool,
                                                                   ConversionMetrics conversionMetrics) {
        return new ConversionSubmissionService(store, pool, conversionMetrics,
                Path.of(properties.getUploadsDir()), Path.of(properties.getConvertedDir()));
    }

    @Bean
    public ConvertedFileStore convertedFileStore() {
        return new ConvertedFileStore(Path.of(properties.getConvertedDir()));
    }
}
