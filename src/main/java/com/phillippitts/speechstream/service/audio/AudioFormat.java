package com.phillippitts.speechstream.service.audio;

/**
 * Single source of truth for the audio formats the service deals with.
 *
 * <p>Engine input: 16 kHz, 16-bit signed PCM, mono, little-endian.
 * Streaming input: little-endian IEEE-754 float32 samples in [-1.0, 1.0].
 */
public final class AudioFormat {

    /** Required sample rate in Hz. */
    public static final int REQUIRED_SAMPLE_RATE = 16_000;
    /** Required bits per sample. */
    public static final int REQUIRED_BITS_PER_SAMPLE = 16;
    /** Required number of channels (mono). */
    public static final int REQUIRED_CHANNELS = 1;

    /** Bytes per PCM frame (sample for all channels). */
    public static final int REQUIRED_BLOCK_ALIGN = (REQUIRED_BITS_PER_SAMPLE / 8) * REQUIRED_CHANNELS; // 2 bytes
    /** Bytes per second at required format. */
    public static final int REQUIRED_BYTE_RATE = REQUIRED_SAMPLE_RATE * REQUIRED_BLOCK_ALIGN;           // 32,000

    /** Bytes per incoming float32 sample. */
    public static final int FLOAT_SAMPLE_BYTES = Float.BYTES;

    /** Scale factor from a [-1.0, 1.0] float sample to a 16-bit integer sample. */
    public static final int PCM16_SCALE = Short.MAX_VALUE; // 32767

    private AudioFormat() {}
}
