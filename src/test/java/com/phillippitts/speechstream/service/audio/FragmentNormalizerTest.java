package com.phillippitts.speechstream.service.audio;

import com.phillippitts.speechstream.exception.InvalidAudioException;
import com.phillippitts.speechstream.exception.InvalidAudioException.Rejection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static com.phillippitts.speechstream.testutil.PcmTestData.constant;
import static com.phillippitts.speechstream.testutil.PcmTestData.floats;
import static com.phillippitts.speechstream.testutil.PcmTestData.shorts;
import static com.phillippitts.speechstream.testutil.PcmTestData.sine;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FragmentNormalizerTest {

    private FragmentNormalizer normalizer;

    @BeforeEach
    void setUp() {
        normalizer = new FragmentNormalizer();
    }

    @Test
    void rejectsEmptyFragment() {
        assertThatThrownBy(() -> normalizer.normalize(new byte[0]))
                .isInstanceOf(InvalidAudioException.class)
                .extracting(e -> ((InvalidAudioException) e).getRejection())
                .isEqualTo(Rejection.EMPTY_INPUT);
    }

    @Test
    void rejectsNullFragment() {
        assertThatThrownBy(() -> normalizer.normalize(null))
                .isInstanceOf(InvalidAudioException.class)
                .extracting(e -> ((InvalidAudioException) e).getRejection())
                .isEqualTo(Rejection.EMPTY_INPUT);
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 3, 5, 641, 19_201})
    void rejectsLengthsThatAreNotWholeFloats(int length) {
        assertThatThrownBy(() -> normalizer.normalize(new byte[length]))
                .isInstanceOf(InvalidAudioException.class)
                .satisfies(e -> {
                    InvalidAudioException ex = (InvalidAudioException) e;
                    assertThat(ex.getRejection()).isEqualTo(Rejection.MISALIGNED_INPUT);
                    assertThat(ex.getAudioSize()).isEqualTo(length);
                    assertThat(ex.getRejection().code()).isEqualTo("MisalignedInput");
                });
    }

    @Test
    void fragmentBelowTwentyMillisecondsIsTooShort() {
        // 319 samples -> 638 bytes of PCM
        NormalizedPcm pcm = normalizer.normalize(constant(319, 0.1f));

        assertThat(pcm.isTooShort()).isTrue();
        assertThat(pcm.length()).isZero();
        assertThat(pcm.sourceBytes()).isEqualTo(319 * 4);
    }

    @Test
    void fragmentOfExactlyTwentyMillisecondsIsAccepted() {
        NormalizedPcm pcm = normalizer.normalize(constant(320, 0.1f));

        assertThat(pcm.isTooShort()).isFalse();
        assertThat(pcm.length()).isEqualTo(FragmentNormalizer.MIN_PCM_BYTES);
        assertThat(pcm.sampleCount()).isEqualTo(320);
    }

    @Test
    void sanitizesNonFiniteValuesAndClamps() {
        float[] samples = new float[400];
        samples[0] = Float.POSITIVE_INFINITY;
        samples[1] = 1.0f;
        samples[2] = 0.6f;
        samples[3] = Float.NaN;
        samples[4] = -0.6f;
        samples[5] = Float.NEGATIVE_INFINITY;
        samples[6] = -2.0f;
        for (int i = 7; i < samples.length; i++) {
            samples[i] = -1.0f;
        }

        short[] out = shorts(normalizer.normalize(floats(samples)).bytes());

        assertThat(out[0]).isEqualTo((short) 32767);
        assertThat(out[1]).isEqualTo((short) 32767);
        assertThat(out[2]).isEqualTo((short) 19660);
        assertThat(out[3]).isEqualTo((short) 0);
        assertThat(out[4]).isEqualTo((short) -19660);
        assertThat(out[5]).isEqualTo((short) -32767);
        assertThat(out[6]).isEqualTo((short) -32767);
        assertThat(out[399]).isEqualTo((short) -32767);
    }

    @Test
    void quantizationTruncatesTowardZero() {
        float[] samples = new float[320];
        samples[0] = 0.99999f;   // 32766.67 -> 32766
        samples[1] = 0.5f;       // 16383.5 -> 16383
        samples[2] = 0.00001f;   // 0.33 -> 0
        samples[3] = -0.5f;      // -16383.5 -> -16383

        short[] out = shorts(normalizer.normalize(floats(samples)).bytes());

        assertThat(out[0]).isEqualTo((short) 32766);
        assertThat(out[1]).isEqualTo((short) 16383);
        assertThat(out[2]).isEqualTo((short) 0);
        assertThat(out[3]).isEqualTo((short) -16383);
    }

    @Test
    void capsAtOneSecondOfAudio() {
        NormalizedPcm pcm = normalizer.normalize(constant(40_000, 0.25f));

        assertThat(pcm.length()).isEqualTo(FragmentNormalizer.MAX_PCM_BYTES);
        assertThat(pcm.sampleCount()).isEqualTo(16_000);
        assertThat(pcm.sourceBytes()).isEqualTo(160_000);
    }

    @ParameterizedTest
    @ValueSource(ints = {320, 321, 1_000, 4_800, 16_000, 16_001, 48_000})
    void outputIsEvenAndWithinBounds(int sampleCount) {
        NormalizedPcm pcm = normalizer.normalize(sine(sampleCount, 440, 16_000, 0.8f));

        assertThat(pcm.isTooShort()).isFalse();
        assertThat(pcm.length() % 2).isZero();
        assertThat(pcm.length()).isBetween(FragmentNormalizer.MIN_PCM_BYTES, FragmentNormalizer.MAX_PCM_BYTES);
    }

    @Test
    void declickReplacesLargeJumpsWithPreviousSample() {
        short[] samples = {0, 25_000, 25_000, 0, 100};

        int replaced = FragmentNormalizer.declick(samples, samples.length);

        // Each sample is compared with the already filtered predecessor
        assertThat(samples).containsExactly((short) 0, (short) 0, (short) 0, (short) 0, (short) 100);
        assertThat(replaced).isEqualTo(2);
    }

    @Test
    void declickLeavesGradualChangesAlone() {
        short[] samples = {0, 15_000, 30_000, 20_001, 1};

        int replaced = FragmentNormalizer.declick(samples, samples.length);

        assertThat(samples).containsExactly((short) 0, (short) 15_000, (short) 30_000, (short) 20_001, (short) 1);
        assertThat(replaced).isZero();
    }

    @Test
    void declickOnlyScansRequestedPrefix() {
        short[] samples = {0, 1, 30_000};

        int replaced = FragmentNormalizer.declick(samples, 2);

        assertThat(samples[2]).isEqualTo((short) 30_000);
        assertThat(replaced).isZero();
    }

    @Test
    void normalizeRemovesClickFromFragment() {
        float[] samples = new float[640];
        samples[100] = 1.0f;  // isolated spike: 0 -> 32767 -> 0

        short[] out = shorts(normalizer.normalize(floats(samples)).bytes());

        assertThat(out[100]).isEqualTo((short) 0);
        for (short s : out) {
            assertThat(s).isEqualTo((short) 0);
        }
    }

    @Test
    void twentyFourKilohertzSineFragmentIsNormalizedWithoutRejection() {
        // 4800 samples at 24 kHz = 200 ms; 19200 bytes of float32
        byte[] fragment = sine(4_800, 440, 24_000, 0.5f);
        assertThat(fragment).hasSize(19_200);

        NormalizedPcm pcm = normalizer.normalize(fragment);

        assertThat(pcm.isTooShort()).isFalse();
        assertThat(pcm.length()).isEqualTo(9_600);
        assertThat(pcm.length()).isBetween(FragmentNormalizer.MIN_PCM_BYTES, FragmentNormalizer.MAX_PCM_BYTES);
    }

    @Test
    void quantizeConvertsOnlyRequestedPrefix() {
        byte[] tenSeconds = constant(160_000, 0.5f);

        short[] out = FragmentNormalizer.quantize(tenSeconds, 16_000);

        assertThat(out).hasSize(16_000);
        assertThat(out[0]).isEqualTo((short) 16_383);
    }

    @Test
    void oversizedFragmentIsCappedBeforeConversion() {
        float[] samples = new float[48_000];
        samples[0] = 0.25f;
        samples[16_000] = Float.NaN; // first sample past the cap

        NormalizedPcm pcm = normalizer.normalize(floats(samples));

        assertThat(pcm.length()).isEqualTo(FragmentNormalizer.MAX_PCM_BYTES);
        assertThat(shorts(pcm.bytes())[0]).isEqualTo((short) 8_191);
    }

    @Test
    void silenceIsAcceptedAsZeroSamples() {
        NormalizedPcm pcm = normalizer.normalize(constant(800, 0.0f));

        assertThat(pcm.isTooShort()).isFalse();
        assertThat(shorts(pcm.bytes())).containsOnly((short) 0);
    }
}
