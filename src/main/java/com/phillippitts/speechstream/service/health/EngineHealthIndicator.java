package com.phillippitts.speechstream.service.health;

import com.phillippitts.speechstream.service.session.SessionRegistry;
import com.phillippitts.speechstream.service.stt.RecognitionEngine;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the recognition engine.
 *
 * <ul>
 *   <li>UP: model loaded, streaming accepted</li>
 *   <li>DOWN: model not loaded; recognition endpoints answer HTTP 500</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class EngineHealthIndicator implements HealthIndicator {

    private final RecognitionEngine engine;
    private final SessionRegistry registry;

    public EngineHealthIndicator(RecognitionEngine engine, SessionRegistry registry) {
        this.engine = engine;
        this.registry = registry;
    }

    @Override
    public Health health() {
        boolean healthy = engine.isHealthy();
        Health.Builder builder = healthy ? Health.up() : Health.down();
        return builder
                .withDetail("engine", engine.getEngineName())
                .withDetail("status", healthy ? "ready" : "model not loaded")
                .withDetail("activeSessions", registry.activeSessionCount())
                .build();
    }
}
