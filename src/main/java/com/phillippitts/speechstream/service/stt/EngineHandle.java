package com.phillippitts.speechstream.service.stt;

/**
 * One stateful recognizer created by {@link RecognitionEngine#createHandle(int)}.
 *
 * <p>Results are the engine's native JSON documents; see
 * {@link com.phillippitts.speechstream.service.stt.result.ResultAggregator} for their mapping.
 *
 * <p>Not thread-safe. A handle is owned by exactly one streaming session (or by the legacy
 * recognizer) and only touched under that owner's lock.
 */
public interface EngineHandle extends AutoCloseable {

    /**
     * Feeds PCM audio.
     *
     * @param pcm 16-bit signed little-endian mono PCM
     * @return true if the engine detected an utterance boundary
     */
    boolean acceptWaveform(byte[] pcm);

    /**
     * @return tentative result for the current utterance, e.g. {@code {"partial": "hello wor"}}
     */
    String partialResult();

    /**
     * Result for the utterance that just ended. Valid after {@link #acceptWaveform(byte[])}
     * returned true.
     *
     * @return e.g. {@code {"text": "hello world"}}
     */
    String result();

    /**
     * Flushes buffered audio and returns the final result for everything not yet reported.
     *
     * @return e.g. {@code {"text": "hello world"}}
     */
    String finalResult();

    /**
     * Releases the recognizer. Idempotent; never throws.
     */
    @Override
    void close();
}
