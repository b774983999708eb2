package com.phillippitts.speechstream.service.stt;

import com.phillippitts.speechstream.exception.ModelNotFoundException;
import com.phillippitts.speechstream.exception.TranscriptionException;

/**
 * Contract for the external recognition engine.
 *
 * <p>The engine owns the loaded acoustic model and hands out {@link EngineHandle}s: independent,
 * stateful recognizers that accumulate acoustic context across the audio fed to them.
 *
 * <p>Lifecycle:
 * <ol>
 *   <li>Engine is constructed with configuration (model path, sample rate)</li>
 *   <li>{@link #initialize()} loads the model (may throw {@link ModelNotFoundException} or
 *       {@link TranscriptionException})</li>
 *   <li>{@link #createHandle(int)} creates a recognizer per streaming session</li>
 *   <li>{@link #close()} releases the model</li>
 * </ol>
 *
 * <p>Thread Safety: {@link #createHandle(int)} may be called concurrently. Handles themselves are
 * NOT thread-safe; callers serialize access to each handle.
 *
 * <p>Audio Format: handles accept 16-bit signed PCM, mono, little-endian at the sample rate they
 * were created with.
 */
public interface RecognitionEngine extends AutoCloseable {

    /**
     * Loads the model and prepares the engine.
     *
     * @throws TranscriptionException if initialization fails
     */
    void initialize();

    /**
     * Creates a fresh recognizer.
     *
     * @param sampleRate sample rate of the PCM that will be fed to the handle
     * @return new handle, exclusively owned by the caller
     * @throws TranscriptionException if the engine is not initialized or the recognizer cannot be created
     */
    EngineHandle createHandle(int sampleRate);

    /**
     * @return Engine name (e.g., "vosk")
     */
    String getEngineName();

    /**
     * @return true if the model is loaded and handles can be created
     */
    boolean isHealthy();

    @Override
    void close();
}
