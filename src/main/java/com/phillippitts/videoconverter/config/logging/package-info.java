/**
 * Logging infrastructure and MDC (Mapped Diagnostic Context) configuration.
 *
 * <p>Key Components:
 * <ul>
 *   <li>{@link com.phillippitts.videoconverter.config.logging.MdcFilter} - Servlet filter
 *       that injects {@code requestId} into MDC for every HTTP request</li>
 * </ul>
 *
 * <p>MDC Keys:
 * <ul>
 *   <li>{@code requestId} - Unique identifier for each HTTP request (UUID format unless supplied)</li>
 *   <li>{@code conversionId} - Set by the job runner while a worker executes a conversion</li>
 * </ul>
 *
 * <p>Log Format:
 * <pre>
 * 2025-10-17 15:42:32.529 [thread-name] [requestId] [conversionId] LEVEL logger.name - message
 * </pre>
 *
 * @see com.phillippitts.videoconverter.config.logging.MdcFilter
 * @since 1.0
 */
package com.phillippitts.videoconverter.config.logging;
