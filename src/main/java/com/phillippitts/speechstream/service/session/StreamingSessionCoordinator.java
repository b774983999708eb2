package com.phillippitts.speechstream.service.session;

import com.phillippitts.speechstream.config.stt.VoskConfig;
import com.phillippitts.speechstream.domain.RecognitionResult;
import com.phillippitts.speechstream.exception.EngineUnavailableException;
import com.phillippitts.speechstream.exception.InvalidAudioException;
import com.phillippitts.speechstream.exception.TranscriptionException;
import com.phillippitts.speechstream.exception.TranscriptionExceptionBuilder;
import com.phillippitts.speechstream.service.audio.FragmentNormalizer;
import com.phillippitts.speechstream.service.audio.NormalizedPcm;
import com.phillippitts.speechstream.service.metrics.StreamingMetrics;
import com.phillippitts.speechstream.service.stt.EngineHandle;
import com.phillippitts.speechstream.service.stt.RecognitionEngine;
import com.phillippitts.speechstream.service.stt.result.ResultAggregator;
import com.phillippitts.speechstream.service.stt.util.EngineEventPublisher;
import com.phillippitts.speechstream.util.LogSanitizer;
import com.phillippitts.speechstream.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Drives each streaming session through its lifecycle.
 *
 * <pre>
 *   ABSENT --first accepted fragment--> ACTIVE --end of utterance--> CLOSING --> ABSENT
 * </pre>
 *
 * <p>Every transition happens under the session's lock. Fragments for one session are processed
 * in lock-acquisition order; fragments for different sessions never wait on each other.
 *
 * <p>Audio that reaches a session after end-of-utterance closed it (the request looked the
 * session up before it was removed) is answered with an empty partial and never reaches the
 * engine. Audio that arrives after removal starts a new session under the same id.
 */
@Service
public class StreamingSessionCoordinator {

    private static final Logger LOG = LogManager.getLogger(StreamingSessionCoordinator.class);

    private static final int PREVIEW_CHARS = 40;

    private final SessionRegistry registry;
    private final RecognitionEngine engine;
    private final FragmentNormalizer normalizer;
    private final StreamingMetrics metrics;
    private final ApplicationEventPublisher publisher;
    private final int sampleRate;

    public StreamingSessionCoordinator(SessionRegistry registry,
                                       RecognitionEngine engine,
                                       FragmentNormalizer normalizer,
                                       StreamingMetrics metrics,
                                       ApplicationEventPublisher publisher,
                                       VoskConfig config) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.engine = Objects.requireNonNull(engine, "engine");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.publisher = publisher;
        this.sampleRate = Objects.requireNonNull(config, "config").sampleRate();
    }

    /**
     * Processes one audio fragment for a session.
     *
     * @param sessionId session key
     * @param fragment little-endian float32 samples
     * @return partial or final result; empty partial for too-short audio and for closed sessions
     * @throws EngineUnavailableException if the model is not loaded
     * @throws InvalidAudioException if the fragment is empty or misaligned (no session state touched)
     * @throws TranscriptionException if the engine fails; the session stays registered
     */
    public RecognitionResult acceptFragment(String sessionId, byte[] fragment) {
        requireEngine();
        String logId = LogSanitizer.safeId(sessionId);

        NormalizedPcm pcm;
        try {
            pcm = normalizer.normalize(fragment);
        } catch (InvalidAudioException e) {
            metrics.incrementFragment("rejected");
            LOG.warn("Rejected fragment for session {}: {}", logId, e.getReason());
            throw e;
        }
        if (pcm.isTooShort()) {
            metrics.incrementFragment("too_short");
            return RecognitionResult.emptyPartial();
        }

        StreamingSession session = registry.session(sessionId);
        session.lock().lock();
        long start = System.nanoTime();
        try {
            if (session.isClosed()) {
                metrics.incrementFragment("stale");
                LOG.info("Session {} already closed; dropping late fragment of {} bytes",
                        logId, pcm.sourceBytes());
                return RecognitionResult.emptyPartial();
            }

            EngineHandle handle = session.engineHandle().orElse(null);
            if (handle == null) {
                handle = engine.createHandle(sampleRate);
                session.bind(handle);
                LOG.info("Created recognizer for session {}", logId);
            }
            session.touch(Instant.now());

            boolean boundary = handle.acceptWaveform(pcm.bytes());
            RecognitionResult result = boundary
                    ? ResultAggregator.fromFinal(handle.result())
                    : ResultAggregator.fromPartial(handle.partialResult());
            metrics.recordEngineLatency("accept", System.nanoTime() - start);
            metrics.incrementFragment(result.type().wireName());

            LOG.debug("Session {}: {} samples -> {} '{}'", logId, pcm.sampleCount(),
                    result.type().wireName(), LogSanitizer.truncate(result.text(), PREVIEW_CHARS));
            return result;
        } catch (TranscriptionException e) {
            metrics.incrementFragment("error");
            throw e;
        } catch (RuntimeException e) {
            metrics.incrementFragment("error");
            throw engineFailure("Failed to process audio fragment", sessionId, start, e);
        } finally {
            session.lock().unlock();
        }
    }

    /**
     * Ends the current utterance: extracts the final transcription, releases the engine handle
     * and removes the session. The id may be reused afterwards and starts fresh.
     *
     * @param sessionId session key
     * @return final result; empty final if the session is unknown, already closed or never got audio
     * @throws EngineUnavailableException if the model is not loaded
     * @throws TranscriptionException if the engine fails while flushing (the session is still removed)
     */
    public RecognitionResult endOfUtterance(String sessionId) {
        requireEngine();
        String logId = LogSanitizer.safeId(sessionId);

        Optional<StreamingSession> found = registry.find(sessionId);
        if (found.isEmpty()) {
            LOG.debug("End of utterance for unknown session {}", logId);
            return RecognitionResult.emptyFinal();
        }

        StreamingSession session = found.get();
        session.lock().lock();
        EngineHandle handle = null;
        long start = System.nanoTime();
        try {
            if (session.isClosed()) {
                return RecognitionResult.emptyFinal();
            }
            handle = registry.closeAndRemove(session).orElse(null);
            metrics.incrementSessionClosed("end_of_utterance");
            if (handle == null) {
                LOG.debug("Session {} closed before any audio reached the engine", logId);
                return RecognitionResult.emptyFinal();
            }

            RecognitionResult result = ResultAggregator.fromFinal(handle.finalResult());
            metrics.recordEngineLatency("final", System.nanoTime() - start);
            LOG.info("Session {} final result ({} chars, confidence={})",
                    logId, result.text().length(), result.confidence());
            return result;
        } catch (TranscriptionException e) {
            throw e;
        } catch (RuntimeException e) {
            throw engineFailure("Failed to finish utterance", sessionId, start, e);
        } finally {
            if (handle != null) {
                handle.close();
            }
            session.lock().unlock();
        }
    }

    private void requireEngine() {
        if (!engine.isHealthy()) {
            throw new EngineUnavailableException(engine.getEngineName());
        }
    }

    private TranscriptionException engineFailure(String message, String sessionId, long startNanos,
                                                 RuntimeException cause) {
        long elapsedMs = TimeUtils.elapsedMillis(startNanos);
        LOG.error("{} for session {} after {}ms", message, LogSanitizer.safeId(sessionId), elapsedMs, cause);
        EngineEventPublisher.publishFailure(publisher, engine.getEngineName(), message, cause,
                Map.of("sessionId", LogSanitizer.safeId(sessionId)));
        return TranscriptionExceptionBuilder.create(message + ": " + cause.getMessage())
                .engine(engine.getEngineName())
                .cause(cause)
                .session(sessionId)
                .durationMs(elapsedMs)
                .build();
    }
}
