package com.phillippitts.speechstream.config.properties;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class StreamingSessionPropertiesTest {

    @Test
    void evictionDisabledByDefault() {
        StreamingSessionProperties props = new StreamingSessionProperties();

        assertThat(props.getIdleTimeout()).isEqualTo(Duration.ZERO);
        assertThat(props.getSweepIntervalMs()).isEqualTo(60_000);
        assertThat(props.isEvictionEnabled()).isFalse();
    }

    @Test
    void positiveTimeoutEnablesEviction() {
        StreamingSessionProperties props = new StreamingSessionProperties();
        props.setIdleTimeout(Duration.ofMinutes(5));

        assertThat(props.isEvictionEnabled()).isTrue();
    }

    @Test
    void negativeOrMissingTimeoutKeepsEvictionOff() {
        StreamingSessionProperties props = new StreamingSessionProperties();
        props.setIdleTimeout(Duration.ofSeconds(-1));
        assertThat(props.isEvictionEnabled()).isFalse();

        props.setIdleTimeout(null);
        assertThat(props.isEvictionEnabled()).isFalse();
    }
}
