package com.phillippitts.speechstream.service.audio;

import com.phillippitts.speechstream.exception.InvalidAudioException;
import com.phillippitts.speechstream.exception.InvalidAudioException.Rejection;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.FloatBuffer;

/**
 * Turns a raw float32 fragment from a streaming client into a bounded, declicked 16-bit PCM
 * buffer that the recognition engine can take a processing step on.
 *
 * <p>Pipeline, in order:
 * <ol>
 *   <li>Reject empty input and input that is not a whole number of float32 samples</li>
 *   <li>Replace NaN with 0.0, +Infinity with 1.0, -Infinity with -1.0</li>
 *   <li>Clamp to [-1.0, 1.0]</li>
 *   <li>Quantize: multiply by 32767 and truncate toward zero</li>
 *   <li>Below {@value #MIN_PCM_BYTES} bytes (20 ms): return a "too short" buffer</li>
 *   <li>Drop a trailing odd byte (16-bit output is always even)</li>
 *   <li>Cap at {@value #MAX_PCM_BYTES} bytes (1 s); samples past the cap are never quantized</li>
 *   <li>Declick: a sample jumping more than {@value #DECLICK_THRESHOLD} from its predecessor is
 *       replaced by the predecessor (single forward pass)</li>
 *   <li>Zero-pad to at least {@value #MIN_ENGINE_SAMPLES} samples</li>
 * </ol>
 *
 * <p>Thread-safe: stateless.
 */
@Component
public class FragmentNormalizer {

    private static final Logger LOG = LogManager.getLogger(FragmentNormalizer.class);

    /** 320 samples, 20 ms at 16 kHz. */
    public static final int MIN_PCM_BYTES = 640;

    /** 16000 samples, 1 s at 16 kHz. */
    public static final int MAX_PCM_BYTES = AudioFormat.REQUIRED_BYTE_RATE;

    public static final int DECLICK_THRESHOLD = 20_000;

    /** Smallest window the engine reliably steps on (10 ms). */
    public static final int MIN_ENGINE_SAMPLES = 160;

    private static final float SILENCE_RANGE = 1e-6f;

    /**
     * Normalizes one fragment.
     *
     * @param fragment little-endian float32 samples
     * @return engine-ready PCM, or a buffer flagged {@link NormalizedPcm#isTooShort()}
     * @throws InvalidAudioException with {@link Rejection#EMPTY_INPUT} or {@link Rejection#MISALIGNED_INPUT}
     */
    public NormalizedPcm normalize(byte[] fragment) {
        if (fragment == null || fragment.length == 0) {
            throw new InvalidAudioException(Rejection.EMPTY_INPUT, "Audio fragment is empty");
        }
        if (fragment.length % AudioFormat.FLOAT_SAMPLE_BYTES != 0) {
            throw new InvalidAudioException(Rejection.MISALIGNED_INPUT, fragment.length,
                    "Fragment length must be a multiple of " + AudioFormat.FLOAT_SAMPLE_BYTES);
        }

        int totalSamples = fragment.length / AudioFormat.FLOAT_SAMPLE_BYTES;
        int pcmBytes = totalSamples * AudioFormat.REQUIRED_BLOCK_ALIGN;

        if (pcmBytes < MIN_PCM_BYTES) {
            LOG.debug("Fragment too short: {} bytes PCM (min {}), skipping engine", pcmBytes, MIN_PCM_BYTES);
            return NormalizedPcm.tooShort(fragment.length);
        }

        int sampleCount = totalSamples;
        int maxSamples = MAX_PCM_BYTES / AudioFormat.REQUIRED_BLOCK_ALIGN;
        if (sampleCount > maxSamples) {
            LOG.debug("Fragment too long: {} bytes PCM, truncating to {}", pcmBytes, MAX_PCM_BYTES);
            sampleCount = maxSamples;
        }

        // Samples past the cap are never converted
        short[] samples = quantize(fragment, sampleCount);

        int smoothed = declick(samples, sampleCount);
        if (smoothed > 0) {
            LOG.debug("Declick replaced {} sample(s) jumping more than {}", smoothed, DECLICK_THRESHOLD);
        }

        int outSamples = Math.max(sampleCount, MIN_ENGINE_SAMPLES);
        if (outSamples > sampleCount) {
            LOG.debug("Padding {} samples to engine minimum of {}", sampleCount, MIN_ENGINE_SAMPLES);
        }

        LOG.debug("Normalized fragment: {} float bytes -> {} samples ({} ms)",
                fragment.length, outSamples, outSamples * 1000L / AudioFormat.REQUIRED_SAMPLE_RATE);
        return NormalizedPcm.of(toLittleEndian(samples, sampleCount, outSamples), fragment.length);
    }

    /**
     * Steps 2-4: sanitize, clamp and quantize the first {@code count} float samples.
     */
    static short[] quantize(byte[] fragment, int count) {
        FloatBuffer floats = ByteBuffer.wrap(fragment).order(ByteOrder.LITTLE_ENDIAN).asFloatBuffer();
        short[] out = new short[Math.min(count, floats.remaining())];
        boolean nonFinite = false;
        float min = Float.MAX_VALUE;
        float max = -Float.MAX_VALUE;
        for (int i = 0; i < out.length; i++) {
            float f = floats.get(i);
            if (Float.isNaN(f)) {
                f = 0.0f;
                nonFinite = true;
            } else if (f == Float.POSITIVE_INFINITY) {
                f = 1.0f;
                nonFinite = true;
            } else if (f == Float.NEGATIVE_INFINITY) {
                f = -1.0f;
                nonFinite = true;
            }
            f = Math.max(-1.0f, Math.min(1.0f, f));
            min = Math.min(min, f);
            max = Math.max(max, f);
            out[i] = (short) (int) (f * AudioFormat.PCM16_SCALE);
        }
        if (nonFinite) {
            LOG.debug("Fragment contained NaN/Infinity samples; sanitized");
        }
        if (LOG.isDebugEnabled() && out.length > 0 && max - min < SILENCE_RANGE) {
            LOG.debug("Fragment range {} is below {}, probably silence", max - min, SILENCE_RANGE);
        }
        return out;
    }

    /**
     * Step 8, in place over the first {@code count} samples.
     *
     * @return number of samples replaced
     */
    static int declick(short[] samples, int count) {
        int replaced = 0;
        for (int i = 1; i < count; i++) {
            if (Math.abs(samples[i] - samples[i - 1]) > DECLICK_THRESHOLD) {
                samples[i] = samples[i - 1];
                replaced++;
            }
        }
        return replaced;
    }

    private static byte[] toLittleEndian(short[] samples, int count, int outSamples) {
        ByteBuffer buf = ByteBuffer.allocate(outSamples * AudioFormat.REQUIRED_BLOCK_ALIGN)
                .order(ByteOrder.LITTLE_ENDIAN);
        for (int i = 0; i < count; i++) {
            buf.putShort(samples[i]);
        }
        // Remaining bytes are already zero: that is the padding
        return buf.array();
    }
}
