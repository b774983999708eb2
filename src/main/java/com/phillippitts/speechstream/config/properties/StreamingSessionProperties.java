package com.phillippitts.speechstream.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;

/**
 * Streaming session housekeeping.
 *
 * <p>Properties:
 * <ul>
 *   <li>stream.session.idle-timeout - Evict sessions that received no audio for this long.
 *       Zero (the default) disables eviction: sessions live until end-of-utterance.</li>
 *   <li>stream.session.sweep-interval-ms - How often the idle sweeper runs (default: 60000)</li>
 * </ul>
 */
@ConfigurationProperties(prefix = "stream.session")
@Validated
public class StreamingSessionProperties {

    @NotNull
    private Duration idleTimeout = Duration.ZERO;

    @Positive(message = "Sweep interval must be positive")
    private long sweepIntervalMs = 60_000;

    public Duration getIdleTimeout() {
        return idleTimeout;
    }

    public void setIdleTimeout(Duration idleTimeout) {
        this.idleTimeout = idleTimeout;
    }

    public long getSweepIntervalMs() {
        return sweepIntervalMs;
    }

    public void setSweepIntervalMs(long sweepIntervalMs) {
        this.sweepIntervalMs = sweepIntervalMs;
    }

    /**
     * @return true when a positive idle timeout is configured
     */
    public boolean isEvictionEnabled() {
        return idleTimeout != null && !idleTimeout.isZero() && !idleTimeout.isNegative();
    }
}
