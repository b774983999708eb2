/**
 * Recognition engine abstractions.
 *
 * <p>Architecture:
 * <ul>
 *   <li>{@link com.phillippitts.speechstream.service.stt.RecognitionEngine} - loads the model and
 *       creates handles</li>
 *   <li>{@link com.phillippitts.speechstream.service.stt.EngineHandle} - one stateful recognizer</li>
 *   <li>{@link com.phillippitts.speechstream.service.stt.AbstractRecognitionEngine} - shared
 *       lifecycle (initialize, health, close)</li>
 *   <li>{@link com.phillippitts.speechstream.service.stt.LegacyRecognizerService} - the single
 *       process-wide recognizer behind {@code /recognize} and {@code /reset}</li>
 * </ul>
 *
 * <p>Handles accept 16kHz, 16-bit PCM, mono, little-endian audio
 * (see {@link com.phillippitts.speechstream.service.audio.AudioFormat}).
 *
 * @since 1.0
 */
package com.phillippitts.speechstream.service.stt;
