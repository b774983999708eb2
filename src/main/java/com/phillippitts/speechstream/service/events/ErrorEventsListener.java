package com.phillippitts.speechstream.service.events;

import com.phillippitts.speechstream.service.stt.event.EngineFailureEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized handler for engine failure events. Privacy-safe and throttled to avoid log spam
 * when every fragment of a busy session fails the same way.
 */
@Component
class ErrorEventsListener {
    private static final Logger LOG = LogManager.getLogger(ErrorEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    @EventListener
    void onEngineFailure(EngineFailureEvent e) {
        String reason = e.cause() != null ? e.cause().getClass().getSimpleName() : "none";
        String key = "engine-" + e.engine() + '-' + e.message() + '-' + reason;
        if (shouldLog(key)) {
            LOG.warn("Engine failure: engine={}, msg={}, cause={}, context={}",
                    e.engine(), e.message(), reason, e.context());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
