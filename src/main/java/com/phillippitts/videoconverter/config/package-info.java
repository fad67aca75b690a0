/**
 * Application-wide configuration beans and properties.
 *
 * <p>Configuration Classes:
 * <ul>
 *   <li>{@link com.phillippitts.videoconverter.config.ConversionConfig} - Wires the conversion core
 *       (store, runner, worker pool, abort coordinator) from {@code conversion.*} properties</li>
 *   <li>{@link com.phillippitts.videoconverter.config.ThreadPoolConfig} - Executor for server-sent
 *       event streams</li>
 * </ul>
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code config.properties} - Type-safe {@code @ConfigurationProperties} holders</li>
 *   <li>{@code config.logging} - Logging infrastructure configuration (MDC filters)</li>
 * </ul>
 *
 * @see com.phillippitts.videoconverter.config.properties.ConversionProperties
 * @since 1.0
 */
package com.phillippitts.videoconverter.config;
