/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.speechstream.exception.SpeechStreamException} - Base exception</li>
 *   <li>{@link com.phillippitts.speechstream.exception.InvalidAudioException} - Caller supplied
 *       audio that cannot be processed (HTTP 400), tagged with a
 *       {@link com.phillippitts.speechstream.exception.InvalidAudioException.Rejection}</li>
 *   <li>{@link com.phillippitts.speechstream.exception.ModelNotFoundException} - Model missing
 *       at startup</li>
 *   <li>{@link com.phillippitts.speechstream.exception.TranscriptionException} - Engine failure
 *       while creating a recognizer or accepting audio (HTTP 500)</li>
 *   <li>{@link com.phillippitts.speechstream.exception.EngineUnavailableException} - Engine not
 *       loaded (HTTP 500)</li>
 * </ul>
 *
 * <p>HTTP mapping lives in
 * {@code com.phillippitts.speechstream.presentation.exception.GlobalExceptionHandler}.
 *
 * @since 1.0
 */
package com.phillippitts.speechstream.exception;
