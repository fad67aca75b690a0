/**
 * Conversion orchestration core.
 *
 * <p>Flow: {@link com.phillippitts.videoconverter.service.conversion.ConversionSubmissionService}
 * records a pending status and queues the job; a
 * {@link com.phillippitts.videoconverter.service.conversion.ConversionWorkerPool} thread hands it
 * to the {@link com.phillippitts.videoconverter.service.conversion.ConversionJobRunner}, which
 * drives the encoder and feeds its progress stream through the
 * {@link com.phillippitts.videoconverter.service.conversion.ProgressExtractor}. The
 * {@link com.phillippitts.videoconverter.service.conversion.AbortCoordinator} can stop a running
 * encoder at any point.
 *
 * <p>The {@link com.phillippitts.videoconverter.service.conversion.ConversionStatusStore} is the
 * single source of truth for status. Its completion guard lets the first finalization win; each
 * change is pushed to subscribers afterwards.
 *
 * <p>None of these classes carry Spring annotations; they are wired in
 * {@link com.phillippitts.videoconverter.config.ConversionConfig}. The worker pool runs on a
 * Spring {@code ThreadPoolTaskExecutor}.
 */
package com.phillippitts.videoconverter.service.conversion;
