package com.phillippitts.speechstream.service.stt.vosk;

import com.phillippitts.speechstream.config.stt.VoskConfig;
import com.phillippitts.speechstream.exception.EngineUnavailableException;
import com.phillippitts.speechstream.exception.TranscriptionException;
import com.phillippitts.speechstream.exception.TranscriptionExceptionBuilder;
import com.phillippitts.speechstream.service.stt.AbstractRecognitionEngine;
import com.phillippitts.speechstream.service.stt.EngineHandle;
import com.phillippitts.speechstream.service.stt.EngineNames;
import com.phillippitts.speechstream.service.stt.util.EngineEventPublisher;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Objects;

/**
 * Vosk-based implementation of {@link com.phillippitts.speechstream.service.stt.RecognitionEngine}.
 *
 * <p>Holds one shared {@link org.vosk.Model} (loaded once in {@link #initialize()}) and creates a
 * new {@link org.vosk.Recognizer} per {@link #createHandle(int)} call. Each streaming session owns
 * its recognizer, so acoustic context carries across that session's fragments and nowhere else.
 *
 * <p>Thread-safe: model state is guarded by the inherited lock. Handle creation only reads the
 * model reference under the lock; the native recognizer constructor runs outside it.
 */
@Component
public class VoskRecognitionEngine extends AbstractRecognitionEngine {

    private static final Logger LOG = LogManager.getLogger(VoskRecognitionEngine.class);

    private final VoskConfig config;

    // Optional event publisher for failure events
    private final ApplicationEventPublisher publisher;

    // @GuardedBy("lock")
    private org.vosk.Model model;           // JNI resource

    public VoskRecognitionEngine(VoskConfig config, ApplicationEventPublisher publisher) {
        this.config = Objects.requireNonNull(config, "config");
        this.publisher = publisher;
    }

    /**
     * Loads the Vosk model.
     *
     * <p>Called by {@link #initialize()} within synchronized context. Supports reinitialization
     * after close by resetting the {@code closed} flag.
     *
     * @throws TranscriptionException if model loading fails
     */
    @Override
    protected void doInitialize() {
        LOG.info("Initializing Vosk engine: modelPath={}, sampleRate={}",
                config.modelPath(), config.sampleRate());
        try {
            this.model = new org.vosk.Model(config.modelPath());
            closed = false;
            LOG.info("Vosk engine initialized");
        } catch (Throwable t) {
            // Ensure partial resources are closed on failure
            safeCloseUnlocked();
            EngineEventPublisher.publishFailure(
                publisher,
                EngineNames.VOSK,
                "initialize failure",
                t,
                Map.of("modelPath", String.valueOf(config.modelPath()),
                       "sampleRate", String.valueOf(config.sampleRate()))
            );
            throw TranscriptionExceptionBuilder
                    .create("Failed to initialize Vosk")
                    .engine(EngineNames.VOSK)
                    .cause(t)
                    .metadata("modelPath", config.modelPath())
                    .metadata("sampleRate", config.sampleRate())
                    .build();
        }
    }

    @Override
    protected EngineHandle doCreateHandle(int sampleRate) {
        org.vosk.Model localModel;
        synchronized (lock) {
            localModel = this.model;
        }
        if (localModel == null) {
            // Closed between ensureInitialized() and here
            throw new EngineUnavailableException(getEngineName());
        }
        try {
            org.vosk.Recognizer recognizer = new org.vosk.Recognizer(localModel, (float) sampleRate);
            LOG.debug("Created Vosk recognizer at {} Hz", sampleRate);
            return new VoskEngineHandle(recognizer);
        } catch (Exception e) {
            throw handleEngineError(e, publisher, Map.of("sampleRate", String.valueOf(sampleRate)));
        }
    }

    @Override
    public String getEngineName() {
        return EngineNames.VOSK;
    }

    /**
     * Closes the Vosk engine and releases JNI resources.
     *
     * <p>Called by {@link #close()} within synchronized context.
     */
    @Override
    protected void doClose() {
        safeCloseUnlocked();
        LOG.info("Vosk engine closed");
    }

    /**
     * Closes JNI resources without acquiring lock.
     *
     * <p>GuardedBy: lock (caller must hold lock)
     */
    private void safeCloseUnlocked() {
        if (model != null) {
            try {
                model.close();
            } catch (Throwable t) {
                LOG.warn("Error closing model", t);
            }
            model = null;
        }
    }
}
