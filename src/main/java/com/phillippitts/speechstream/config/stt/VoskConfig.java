package com.phillippitts.speechstream.config.stt;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

/**
 * Configuration properties for the Vosk recognition engine.
 * Binds to properties prefixed with "stt.vosk".
 *
 * <p>Example application.properties:
 * <pre>
 * stt.vosk.model-path=./models/vosk-model-small-en-us-0.15
 * stt.vosk.sample-rate=16000
 * </pre>
 *
 * @param modelPath Path to the Vosk model directory (must exist)
 * @param sampleRate Sample rate in Hz that recognizer handles are created with
 */
@ConfigurationProperties(prefix = "stt.vosk")
@Validated
public record VoskConfig(
        @NotBlank(message = "Vosk model path must not be blank")
        String modelPath,

        @Positive(message = "Sample rate must be positive")
        int sampleRate
) {
    /**
     * Default constructor with standard values.
     */
    public VoskConfig() {
        this("./models/vosk-model-small-en-us-0.15", 16_000);
    }
}
