package com.phillippitts.speechstream.service.audio;

/**
 * Structural constants of the WAV (RIFF/WAVE) container.
 *
 * <p>Used by {@link com.phillippitts.speechstream.service.validation.WavReader} to walk the chunk
 * list of single-shot uploads.
 *
 * <pre>
 * RIFF header (12 bytes)            RIFF_HEADER_SIZE
 * fmt chunk header (8) + data (>=16) CHUNK_HEADER_SIZE, FMT_CHUNK_MIN_SIZE
 * [other chunks, e.g. LIST]
 * data chunk header (8) + PCM
 * </pre>
 *
 * @since 1.0
 */
public final class WavFormat {

    /** "RIFF" + size + "WAVE". */
    public static final int RIFF_HEADER_SIZE = 12;

    /** Chunk ID (4 bytes) + little-endian chunk size (4 bytes). */
    public static final int CHUNK_HEADER_SIZE = 8;

    /** Minimum fmt chunk payload for PCM: format, channels, rate, byte rate, block align, bits. */
    public static final int FMT_CHUNK_MIN_SIZE = 16;

    /** fmt audio format code for uncompressed PCM. */
    public static final int AUDIO_FORMAT_PCM = 1;

    private WavFormat() {
        // Utility class - prevent instantiation
    }
}
