/**
 * Validation of single-shot WAVE uploads.
 *
 * <p>{@link com.phillippitts.speechstream.service.validation.WavReader} accepts mono, 16-bit,
 * 16 kHz PCM WAVE files and rejects anything else with
 * {@link com.phillippitts.speechstream.exception.InvalidAudioException} (HTTP 400), naming the
 * channel count, bit width and sample rate it found.
 *
 * <p>Configuration (application.properties):
 * <pre>
 * audio.validation.max-file-size-bytes=10485760
 * </pre>
 *
 * @since 1.0
 */
package com.phillippitts.speechstream.service.validation;
