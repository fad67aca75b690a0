/**
 * Immutable domain values shared across layers: jobs, status snapshots and their projections,
 * store events, quality presets and abort results.
 *
 * <p>All types are records or enums with no framework dependencies except the Jackson annotations
 * that fix their wire names.
 *
 * @since 1.0
 */
package com.phillippitts.videoconverter.domain;
