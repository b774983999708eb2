package com.phillippitts.speechstream.service.stt.vosk;

import com.phillippitts.speechstream.service.stt.EngineHandle;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.vosk.Recognizer;

import java.util.Objects;

/**
 * {@link EngineHandle} backed by one native Vosk {@link Recognizer}.
 *
 * <p>Not thread-safe; callers hold the owning session's lock.
 */
final class VoskEngineHandle implements EngineHandle {

    private static final Logger LOG = LogManager.getLogger(VoskEngineHandle.class);

    private final Recognizer recognizer;
    private boolean closed;

    VoskEngineHandle(Recognizer recognizer) {
        this.recognizer = Objects.requireNonNull(recognizer, "recognizer");
    }

    @Override
    public boolean acceptWaveform(byte[] pcm) {
        ensureOpen();
        return recognizer.acceptWaveForm(pcm, pcm.length);
    }

    @Override
    public String partialResult() {
        ensureOpen();
        return recognizer.getPartialResult();
    }

    @Override
    public String result() {
        ensureOpen();
        return recognizer.getResult();
    }

    @Override
    public String finalResult() {
        ensureOpen();
        return recognizer.getFinalResult();
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            recognizer.close();
        } catch (Throwable t) {
            LOG.warn("Error closing Vosk recognizer", t);
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Vosk recognizer already closed");
        }
    }
}
