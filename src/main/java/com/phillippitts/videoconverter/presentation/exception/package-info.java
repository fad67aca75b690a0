/**
 * Global exception handling for REST API responses.
 *
 * <p>Exception Mapping:
 * <ul>
 *   <li>{@link com.phillippitts.videoconverter.exception.ConversionNotFoundException} → 404 Not Found</li>
 *   <li>{@link com.phillippitts.videoconverter.exception.ConvertedFileNotFoundException} → 404 Not Found</li>
 *   <li>Unknown path → 404 Not Found; wrong method → 405 Method Not Allowed</li>
 *   <li>{@link com.phillippitts.videoconverter.exception.InvalidRequestException}, missing or malformed
 *       parameters → 400 Bad Request</li>
 *   <li>Upload over the multipart size limit → 413 Payload Too Large</li>
 *   <li>{@link com.phillippitts.videoconverter.exception.ConversionQueueFullException} → 503 Service Unavailable (retry)</li>
 *   <li>{@link com.phillippitts.videoconverter.exception.ConversionQueueClosedException} → 503 Service Unavailable</li>
 *   <li>{@link org.springframework.core.task.TaskRejectedException} (event stream pool exhausted) → 503</li>
 *   <li>{@code Exception} (catch-all) → 500 Internal Server Error</li>
 * </ul>
 *
 * <p>Response Format:
 * <pre>
 * {
 *   "errorCode": "ConversionQueueFullException",
 *   "message": "Server is busy",
 *   "details": "Too many conversions in progress. Please retry shortly",
 *   "timestamp": "2025-10-17T15:42:32.529Z"
 * }
 * </pre>
 *
 * <p>Abort outcomes are not exceptions; the controller maps them to status codes itself.
 *
 * @since 1.0
 */
package com.phillippitts.videoconverter.presentation.exception;
