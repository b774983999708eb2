package com.phillippitts.speechstream.service.session;

import com.phillippitts.speechstream.config.properties.StreamingSessionProperties;
import com.phillippitts.speechstream.service.metrics.StreamingMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Periodically evicts sessions whose client stopped streaming without sending end-of-utterance.
 *
 * <p>Disabled unless {@code stream.session.idle-timeout} is positive. Sessions with a request in
 * flight are never evicted.
 */
@Component
public class IdleSessionSweeper {

    private static final Logger LOG = LogManager.getLogger(IdleSessionSweeper.class);

    private final SessionRegistry registry;
    private final StreamingSessionProperties props;
    private final StreamingMetrics metrics;

    public IdleSessionSweeper(SessionRegistry registry,
                              StreamingSessionProperties props,
                              StreamingMetrics metrics) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.props = Objects.requireNonNull(props, "props");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        if (props.isEvictionEnabled()) {
            LOG.info("Idle session eviction enabled: timeout={}, interval={}ms",
                    props.getIdleTimeout(), props.getSweepIntervalMs());
        }
    }

    @Scheduled(fixedDelayString = "${stream.session.sweep-interval-ms:60000}")
    public void sweep() {
        sweep(Instant.now());
    }

    /**
     * @return number of sessions evicted
     */
    int sweep(Instant now) {
        if (!props.isEvictionEnabled()) {
            return 0;
        }
        List<String> evicted = registry.evictIdle(now.minus(props.getIdleTimeout()));
        for (int i = 0; i < evicted.size(); i++) {
            metrics.incrementSessionClosed("idle");
        }
        if (!evicted.isEmpty()) {
            LOG.info("Evicted {} idle session(s); {} remain", evicted.size(), registry.activeSessionCount());
        }
        return evicted.size();
    }
}
