/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.videoconverter.exception.VideoConverterException} - Base exception
 *       for all application-specific runtime errors</li>
 *   <li>{@link com.phillippitts.videoconverter.exception.ConversionQueueFullException} - Thrown when
 *       the bounded job queue is saturated</li>
 *   <li>{@link com.phillippitts.videoconverter.exception.ConversionQueueClosedException} - Thrown when
 *       a job arrives after the worker pool stopped</li>
 *   <li>{@link com.phillippitts.videoconverter.exception.ConversionNotFoundException} - Thrown when a
 *       conversion id is unknown</li>
 *   <li>{@link com.phillippitts.videoconverter.exception.ConvertedFileNotFoundException} - Thrown when
 *       a converted file is missing</li>
 *   <li>{@link com.phillippitts.videoconverter.exception.InvalidRequestException} - Thrown when client
 *       input is rejected up front</li>
 *   <li>{@link com.phillippitts.videoconverter.exception.ProcessSignalException} - Checked; thrown
 *       when an encoder process cannot be signalled</li>
 * </ul>
 *
 * <p>Failures that happen inside a worker (encoder start failure, non-zero exit, empty output) are
 * not thrown to any caller; they are recorded on the conversion status instead.
 *
 * @see com.phillippitts.videoconverter.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.videoconverter.exception;
