package com.phillippitts.speechstream.service.audio;

import java.util.Objects;

/**
 * Engine-ready audio produced by {@link FragmentNormalizer}: 16-bit signed little-endian PCM,
 * even length, at most {@link FragmentNormalizer#MAX_PCM_BYTES} bytes.
 *
 * <p>A "too short" instance carries no audio; the caller must answer with an empty partial result
 * and must not invoke the engine.
 *
 * <p>The byte array is handed over without copying and is meant to be consumed exactly once.
 */
public final class NormalizedPcm {

    private final byte[] pcm;
    private final int sourceBytes;
    private final boolean tooShort;

    private NormalizedPcm(byte[] pcm, int sourceBytes, boolean tooShort) {
        this.pcm = pcm;
        this.sourceBytes = sourceBytes;
        this.tooShort = tooShort;
    }

    static NormalizedPcm of(byte[] pcm, int sourceBytes) {
        Objects.requireNonNull(pcm, "pcm");
        if (pcm.length % AudioFormat.REQUIRED_BLOCK_ALIGN != 0) {
            throw new IllegalArgumentException("PCM length must be a multiple of "
                    + AudioFormat.REQUIRED_BLOCK_ALIGN + ", got " + pcm.length);
        }
        return new NormalizedPcm(pcm, sourceBytes, false);
    }

    static NormalizedPcm tooShort(int sourceBytes) {
        return new NormalizedPcm(new byte[0], sourceBytes, true);
    }

    /**
     * @return PCM bytes for the engine; empty when {@link #isTooShort()}
     */
    public byte[] bytes() {
        return pcm;
    }

    public int length() {
        return pcm.length;
    }

    public int sampleCount() {
        return pcm.length / AudioFormat.REQUIRED_BLOCK_ALIGN;
    }

    /**
     * @return size of the float32 fragment this buffer was produced from
     */
    public int sourceBytes() {
        return sourceBytes;
    }

    public boolean isTooShort() {
        return tooShort;
    }
}
