package com.phillippitts.speechstream.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.Positive;

/**
 * Limits applied to single-shot WAVE uploads on {@code /recognize}.
 */
@ConfigurationProperties(prefix = "audio.validation")
@Validated
public class AudioValidationProperties {

    /** Maximum accepted WAVE upload size in bytes (security cap). */
    @Positive
    private int maxFileSizeBytes = 10 * 1024 * 1024; // 10 MB

    public int getMaxFileSizeBytes() {
        return maxFileSizeBytes;
    }

    public void setMaxFileSizeBytes(int maxFileSizeBytes) {
        this.maxFileSizeBytes = maxFileSizeBytes;
    }
}
