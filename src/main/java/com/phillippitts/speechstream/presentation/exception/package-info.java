/**
 * Global exception handling for REST API responses.
 *
 * <p>Exception Mapping:
 * <ul>
 *   <li>{@link com.phillippitts.speechstream.exception.InvalidAudioException} → 400, error code
 *       {@code EmptyInput}, {@code MisalignedInput}, {@code InvalidWaveFormat} or {@code MissingAudioFile}</li>
 *   <li>{@link com.phillippitts.speechstream.exception.EngineUnavailableException} → 500 {@code EngineUnavailable}</li>
 *   <li>{@link com.phillippitts.speechstream.exception.TranscriptionException} → 500 {@code EngineProcessingError}</li>
 *   <li>{@code Exception} (catch-all) → 500 {@code InternalServerError}</li>
 * </ul>
 *
 * <p>Response Format:
 * <pre>
 * {
 *   "success": false,
 *   "errorCode": "MisalignedInput",
 *   "message": "Invalid audio",
 *   "details": "Fragment length must be a multiple of 4",
 *   "timestamp": "2025-10-17T15:42:32.529Z"
 * }
 * </pre>
 *
 * @since 1.0
 */
package com.phillippitts.speechstream.presentation.exception;
