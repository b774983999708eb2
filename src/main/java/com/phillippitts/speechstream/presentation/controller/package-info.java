/**
 * REST API controllers for HTTP endpoints.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code GET /health} - liveness and whether the model is loaded</li>
 *   <li>{@code POST /recognize} - single-shot WAVE upload, shared recognizer</li>
 *   <li>{@code POST /recognize_stream} - float32 fragments per client session</li>
 *   <li>{@code POST /reset} - replace the shared recognizer</li>
 * </ul>
 *
 * <p>Errors are rendered by
 * {@code GlobalExceptionHandler}.
 *
 * @since 1.0
 */
package com.phillippitts.speechstream.presentation.controller;
