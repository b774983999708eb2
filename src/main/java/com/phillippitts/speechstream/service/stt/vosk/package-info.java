/**
 * Vosk recognition engine implementation.
 *
 * <p>Key Components:
 * <ul>
 *   <li>{@link com.phillippitts.speechstream.service.stt.vosk.VoskRecognitionEngine} - Spring
 *       component loading the shared model and creating recognizers</li>
 *   <li>{@code VoskEngineHandle} - one native recognizer, owned by a single session</li>
 * </ul>
 *
 * <p>Resource Model: single shared model (loaded once), one recognizer per streaming session.
 *
 * <p>Configuration (application.properties):
 * <pre>
 * stt.vosk.model-path=./models/vosk-model-small-en-us-0.15
 * stt.vosk.sample-rate=16000
 * </pre>
 *
 * @see com.phillippitts.speechstream.config.stt.VoskConfig
 * @since 1.0
 */
package com.phillippitts.speechstream.service.stt.vosk;
