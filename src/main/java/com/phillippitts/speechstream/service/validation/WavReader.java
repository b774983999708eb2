package com.phillippitts.speechstream.service.validation;

import com.phillippitts.speechstream.config.properties.AudioValidationProperties;
import com.phillippitts.speechstream.exception.InvalidAudioException;
import com.phillippitts.speechstream.exception.InvalidAudioException.Rejection;
import com.phillippitts.speechstream.service.audio.WavFormat;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static com.phillippitts.speechstream.service.audio.AudioFormat.REQUIRED_BITS_PER_SAMPLE;
import static com.phillippitts.speechstream.service.audio.AudioFormat.REQUIRED_BLOCK_ALIGN;
import static com.phillippitts.speechstream.service.audio.AudioFormat.REQUIRED_CHANNELS;
import static com.phillippitts.speechstream.service.audio.AudioFormat.REQUIRED_SAMPLE_RATE;

/**
 * Validates a single-shot WAVE upload and extracts its PCM payload.
 *
 * <p>Parses the chunk structure to locate fmt and data chunks, so files with extra chunks
 * (LIST, fact) or an extended fmt chunk are accepted. Only mono, 16-bit, 16 kHz PCM passes.
 */
@Component
public class WavReader {

    private static final Logger LOG = LogManager.getLogger(WavReader.class);

    private final AudioValidationProperties props;

    public WavReader(AudioValidationProperties props) {
        this.props = props;
    }

    /**
     * @param wav complete RIFF/WAVE file
     * @return the data chunk's PCM, truncated to whole frames
     * @throws InvalidAudioException if the upload is empty, too large, not a WAVE file, or not
     *         mono 16-bit 16 kHz PCM
     */
    public byte[] readPcm(byte[] wav) {
        if (wav == null || wav.length == 0) {
            throw new InvalidAudioException(Rejection.EMPTY_INPUT, "Uploaded audio file is empty");
        }

        // Guard against oversized payloads
        if (wav.length > props.getMaxFileSizeBytes()) {
            throw new InvalidAudioException(Rejection.INVALID_WAVE_FORMAT, wav.length,
                    "Audio payload too large. Max: " + props.getMaxFileSizeBytes() + " bytes");
        }

        if (!isWav(wav)) {
            throw new InvalidAudioException(Rejection.INVALID_WAVE_FORMAT, wav.length,
                    "Not a RIFF/WAVE file");
        }

        WavChunks chunks = parseWavChunks(wav);
        requireChunk(chunks.fmtOffset, "fmt");
        validateFmtChunk(wav, chunks.fmtOffset, chunks.fmtSize);
        requireChunk(chunks.dataOffset, "data");

        int usable = chunks.dataSize - (chunks.dataSize % REQUIRED_BLOCK_ALIGN);
        LOG.debug("WAVE upload: {} bytes, {} bytes PCM", wav.length, usable);
        return Arrays.copyOfRange(wav, chunks.dataOffset, chunks.dataOffset + usable);
    }

    private static boolean isWav(byte[] a) {
        return a.length >= WavFormat.RIFF_HEADER_SIZE
            && a[0] == 'R' && a[1] == 'I' && a[2] == 'F' && a[3] == 'F'
            && a[8] == 'W' && a[9] == 'A' && a[10] == 'V' && a[11] == 'E';
    }

    private static void requireChunk(int offset, String chunkName) {
        if (offset == -1) {
            throw new InvalidAudioException(Rejection.INVALID_WAVE_FORMAT,
                    "Missing " + chunkName + " chunk in WAV file");
        }
    }

    /**
     * Walks the chunk list after the RIFF header.
     */
    private static WavChunks parseWavChunks(byte[] wav) {
        int offset = WavFormat.RIFF_HEADER_SIZE;
        int fmtOffset = -1;
        int fmtSize = 0;
        int dataOffset = -1;
        int dataSize = 0;

        while (offset + WavFormat.CHUNK_HEADER_SIZE <= wav.length) {
            String chunkId = new String(wav, offset, 4, StandardCharsets.US_ASCII);
            int chunkSize = readLEInt(wav, offset + 4);

            if (chunkSize < 0 || offset + WavFormat.CHUNK_HEADER_SIZE + chunkSize > wav.length) {
                throw new InvalidAudioException(Rejection.INVALID_WAVE_FORMAT,
                        "Invalid chunk size: " + chunkSize + " at offset " + offset);
            }

            if ("fmt ".equals(chunkId)) {
                fmtOffset = offset + WavFormat.CHUNK_HEADER_SIZE;
                fmtSize = chunkSize;
            } else if ("data".equals(chunkId)) {
                dataOffset = offset + WavFormat.CHUNK_HEADER_SIZE;
                dataSize = chunkSize;
                break;
            }

            offset += WavFormat.CHUNK_HEADER_SIZE + chunkSize;
            if (chunkSize % 2 == 1) {
                offset++; // WAV chunks are padded to even byte boundaries
            }
        }

        return new WavChunks(fmtOffset, fmtSize, dataOffset, dataSize);
    }

    private static void validateFmtChunk(byte[] wav, int offset, int size) {
        if (size < WavFormat.FMT_CHUNK_MIN_SIZE) {
            throw new InvalidAudioException(Rejection.INVALID_WAVE_FORMAT, "fmt chunk too small: " + size
                    + " bytes (expected at least " + WavFormat.FMT_CHUNK_MIN_SIZE + ")");
        }

        int audioFormat = readLEShort(wav, offset);
        int channels = readLEShort(wav, offset + 2);
        int sampleRate = readLEInt(wav, offset + 4);
        int bitsPerSample = readLEShort(wav, offset + 14);

        if (audioFormat != WavFormat.AUDIO_FORMAT_PCM) {
            throw new InvalidAudioException(Rejection.INVALID_WAVE_FORMAT, "Unsupported audio encoding: "
                    + audioFormat + " (expected " + WavFormat.AUDIO_FORMAT_PCM + " for PCM)");
        }
        if (channels != REQUIRED_CHANNELS
                || bitsPerSample != REQUIRED_BITS_PER_SAMPLE
                || sampleRate != REQUIRED_SAMPLE_RATE) {
            throw new InvalidAudioException(Rejection.INVALID_WAVE_FORMAT,
                    "Unsupported audio format. Required: mono, 16-bit, 16kHz. Found: "
                    + channels + " channel(s), " + bitsPerSample + "-bit, " + sampleRate + "Hz");
        }
    }

    private record WavChunks(int fmtOffset, int fmtSize, int dataOffset, int dataSize) {
    }

    private static int readLEShort(byte[] a, int off) {
        return (a[off] & 0xFF) | ((a[off + 1] & 0xFF) << 8);
    }

    private static int readLEInt(byte[] a, int off) {
        return (a[off] & 0xFF)
             | ((a[off + 1] & 0xFF) << 8)
             | ((a[off + 2] & 0xFF) << 16)
             | ((a[off + 3] & 0xFF) << 24);
    }
}
