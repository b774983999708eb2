package com.phillippitts.speechstream.service.stt;

import com.phillippitts.speechstream.exception.EngineUnavailableException;
import com.phillippitts.speechstream.exception.TranscriptionException;
import com.phillippitts.speechstream.service.stt.util.EngineEventPublisher;
import jakarta.annotation.PreDestroy;
import org.springframework.context.ApplicationEventPublisher;

import java.util.Map;

/**
 * Base class for recognition engines providing common lifecycle and state management.
 *
 * <p>Template Method: subclasses implement {@link #doInitialize()}, {@link #doClose()} and
 * {@link #doCreateHandle(int)}; this class guards them with an internal lock and tracks the
 * initialized/closed flags.
 *
 * <p><b>Lifecycle:</b>
 * <ol>
 *   <li><b>Uninitialized:</b> Engine created but not yet initialized</li>
 *   <li><b>Initialized:</b> {@link #initialize()} called successfully</li>
 *   <li><b>Closed:</b> {@link #close()} called, engine no longer usable</li>
 * </ol>
 *
 * <p>Both {@link #initialize()} and {@link #close()} are idempotent.
 *
 * @since 1.0
 * @see RecognitionEngine
 * @see com.phillippitts.speechstream.service.stt.vosk.VoskRecognitionEngine
 */
public abstract class AbstractRecognitionEngine implements RecognitionEngine {

    /**
     * Guards {@link #initialized}, {@link #closed} and subclass model state.
     */
    protected final Object lock = new Object();

    protected boolean initialized = false;

    protected boolean closed = false;

    /**
     * Initializes the engine. No-op if already initialized and not closed.
     *
     * @throws TranscriptionException if initialization fails
     */
    @Override
    public final void initialize() {
        synchronized (lock) {
            if (initialized && !closed) {
                return;
            }
            doInitialize();
            initialized = true;
        }
    }

    /**
     * Engine-specific initialization, called within the lock. Must throw
     * {@link TranscriptionException} on failure; if reinitialization after close is supported,
     * must reset {@code closed = false}.
     */
    protected abstract void doInitialize();

    @Override
    public final boolean isHealthy() {
        synchronized (lock) {
            return initialized && !closed;
        }
    }

    /**
     * Creates a handle after checking the engine is usable.
     *
     * @throws EngineUnavailableException if not initialized or closed
     * @throws TranscriptionException if the engine fails to create the recognizer
     */
    @Override
    public final EngineHandle createHandle(int sampleRate) {
        ensureInitialized();
        return doCreateHandle(sampleRate);
    }

    /**
     * Engine-specific handle creation. Called outside the lifecycle lock so sessions can create
     * recognizers concurrently.
     */
    protected abstract EngineHandle doCreateHandle(int sampleRate);

    /**
     * Closes the engine. Automatically invoked by Spring on shutdown.
     */
    @Override
    @PreDestroy
    public final void close() {
        synchronized (lock) {
            if (closed) {
                return;
            }
            doClose();
            closed = true;
            initialized = false;
        }
    }

    /**
     * Engine-specific cleanup, called within the lock. Must be idempotent and never throw.
     */
    protected abstract void doClose();

    /**
     * @throws EngineUnavailableException if engine is not initialized or is closed
     */
    protected final void ensureInitialized() {
        synchronized (lock) {
            if (!initialized || closed) {
                throw new EngineUnavailableException(getEngineName());
            }
        }
    }

    /**
     * Publishes a failure event and wraps the exception with engine context.
     *
     * <pre>{@code
     * try {
     *     return new VoskEngineHandle(...);
     * } catch (Exception e) {
     *     throw handleEngineError(e, publisher, context);
     * }
     * }</pre>
     *
     * @param exception the failure
     * @param publisher Spring event publisher (may be null)
     * @param context additional context for the event (may be null)
     * @return never returns normally
     * @throws TranscriptionException always
     */
    protected final TranscriptionException handleEngineError(
            Exception exception,
            ApplicationEventPublisher publisher,
            Map<String, String> context) {

        EngineEventPublisher.publishFailure(publisher, getEngineName(), "engine failure", exception, context);

        // Preserve TranscriptionException without double-wrapping
        if (exception instanceof TranscriptionException te) {
            throw te;
        }

        throw new TranscriptionException(
            getEngineName() + " engine failed: " + exception.getMessage(),
            getEngineName(),
            exception
        );
    }
}
