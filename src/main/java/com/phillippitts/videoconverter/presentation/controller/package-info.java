/**
 * REST API controllers for HTTP endpoints.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code POST /api/convert/upload} - Save a multipart upload and queue its conversion (202)</li>
 *   <li>{@code GET /api/conversion/status/{id}} - Status projection of one conversion</li>
 *   <li>{@code GET /api/conversions/active} - Conversions with a running encoder</li>
 *   <li>{@code POST /api/conversion/abort/{id}} - Abort a running conversion</li>
 *   <li>{@code GET /api/conversions/qualities} - Quality presets</li>
 *   <li>{@code GET /api/conversions/stream} - Server-sent events for every status change</li>
 *   <li>{@code GET /api/files} - Converted files, newest first</li>
 *   <li>{@code GET /download/{fileName}} - Download a converted file</li>
 *   <li>{@code DELETE /api/file/delete/{fileName}} - Delete a converted file</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.videoconverter.presentation.controller;
