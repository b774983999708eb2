/**
 * Audio format definitions and fragment normalization.
 *
 * <p>Every byte that reaches the recognition engine is 16 kHz, 16-bit signed, mono,
 * little-endian PCM ({@link com.phillippitts.speechstream.service.audio.AudioFormat}).
 * Streaming clients send float32 fragments which
 * {@link com.phillippitts.speechstream.service.audio.FragmentNormalizer} converts, bounds and
 * declicks; single-shot uploads are WAVE files read by
 * {@link com.phillippitts.speechstream.service.validation.WavReader}.
 *
 * @since 1.0
 */
package com.phillippitts.speechstream.service.audio;
