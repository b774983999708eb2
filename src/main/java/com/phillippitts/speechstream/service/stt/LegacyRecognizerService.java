package com.phillippitts.speechstream.service.stt;

import com.phillippitts.speechstream.config.stt.VoskConfig;
import com.phillippitts.speechstream.domain.RecognitionResult;
import com.phillippitts.speechstream.exception.EngineUnavailableException;
import com.phillippitts.speechstream.exception.TranscriptionException;
import com.phillippitts.speechstream.exception.TranscriptionExceptionBuilder;
import com.phillippitts.speechstream.service.stt.result.ResultAggregator;
import com.phillippitts.speechstream.service.stt.util.EngineEventPublisher;
import com.phillippitts.speechstream.util.LogSanitizer;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The single process-wide recognizer behind {@code POST /recognize} and {@code POST /reset}.
 *
 * <p>Unlike streaming sessions, all single-shot uploads share one handle, so acoustic context
 * carries from one upload to the next until {@link #reset()} replaces it. Access is serialized
 * by one lock; streaming sessions never touch this handle.
 */
@Service
public class LegacyRecognizerService {

    private static final Logger LOG = LogManager.getLogger(LegacyRecognizerService.class);

    private final RecognitionEngine engine;
    private final VoskConfig config;
    private final ApplicationEventPublisher publisher;
    private final ReentrantLock lock = new ReentrantLock();

    // @GuardedBy("lock")
    private EngineHandle handle;

    public LegacyRecognizerService(RecognitionEngine engine,
                                   VoskConfig config,
                                   ApplicationEventPublisher publisher) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.config = Objects.requireNonNull(config, "config");
        this.publisher = publisher;
    }

    /**
     * Feeds one complete PCM clip to the shared recognizer.
     *
     * @param pcm 16-bit mono PCM at 16 kHz
     * @return final result (confidence defaults to 0) if the engine detected a boundary, else partial
     * @throws EngineUnavailableException if the model is not loaded
     * @throws TranscriptionException if the engine fails
     */
    public RecognitionResult recognize(byte[] pcm) {
        if (!engine.isHealthy()) {
            throw new EngineUnavailableException(engine.getEngineName());
        }
        lock.lock();
        try {
            EngineHandle current = currentHandle();
            boolean boundary = current.acceptWaveform(pcm);
            RecognitionResult result;
            if (boundary) {
                RecognitionResult parsed = ResultAggregator.fromFinal(current.result());
                result = RecognitionResult.finalResult(parsed.text(),
                        parsed.confidence() != null ? parsed.confidence() : 0.0);
            } else {
                result = ResultAggregator.fromPartial(current.partialResult());
            }
            LOG.debug("Legacy recognizer: {} bytes -> {} '{}'", pcm.length,
                    result.type().wireName(), LogSanitizer.truncate(result.text(), 40));
            return result;
        } catch (TranscriptionException e) {
            throw e;
        } catch (RuntimeException e) {
            EngineEventPublisher.publishFailure(publisher, engine.getEngineName(), "legacy recognize failure", e);
            throw TranscriptionExceptionBuilder.create("Recognition failed: " + e.getMessage())
                    .engine(engine.getEngineName())
                    .cause(e)
                    .metadata("bytes", pcm.length)
                    .build();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Replaces the shared recognizer with a fresh one and releases the old one.
     * Streaming sessions are unaffected.
     *
     * @throws EngineUnavailableException if the model is not loaded
     */
    public void reset() {
        if (!engine.isHealthy()) {
            throw new EngineUnavailableException(engine.getEngineName());
        }
        lock.lock();
        try {
            EngineHandle previous = handle;
            handle = engine.createHandle(config.sampleRate());
            if (previous != null) {
                previous.close();
            }
            LOG.info("Legacy recognizer reset");
        } finally {
            lock.unlock();
        }
    }

    @PreDestroy
    public void close() {
        lock.lock();
        try {
            if (handle != null) {
                handle.close();
                handle = null;
            }
        } finally {
            lock.unlock();
        }
    }

    // Caller holds lock
    private EngineHandle currentHandle() {
        if (handle == null) {
            handle = engine.createHandle(config.sampleRate());
            LOG.debug("Created legacy recognizer handle");
        }
        return handle;
    }
}
