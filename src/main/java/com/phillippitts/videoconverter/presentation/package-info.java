/**
 * Presentation layer (REST API controllers and exception handling).
 *
 * <p>Presentation depends on service but not vice versa. Controllers are thin adapters over the
 * conversion core; exception handlers map domain exceptions to HTTP status codes.
 *
 * @see com.phillippitts.videoconverter.presentation.controller
 * @see com.phillippitts.videoconverter.presentation.exception
 * @since 1.0
 */
package com.phillippitts.videoconverter.presentation;
