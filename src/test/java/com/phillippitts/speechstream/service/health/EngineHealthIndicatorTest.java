package com.phillippitts.speechstream.service.health;

import com.phillippitts.speechstream.service.metrics.StreamingMetrics;
import com.phillippitts.speechstream.service.session.SessionRegistry;
import com.phillippitts.speechstream.testutil.FakeRecognitionEngine;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import static org.assertj.core.api.Assertions.assertThat;

class EngineHealthIndicatorTest {

    private FakeRecognitionEngine engine;
    private SessionRegistry registry;
    private EngineHealthIndicator indicator;

    @BeforeEach
    void setUp() {
        engine = new FakeRecognitionEngine();
        registry = new SessionRegistry(new StreamingMetrics(new SimpleMeterRegistry()));
        indicator = new EngineHealthIndicator(engine, registry);
    }

    @Test
    void upWhenEngineReady() {
        registry.session("a");
        registry.session("b");

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails())
                .containsEntry("engine", "fake")
                .containsEntry("status", "ready")
                .containsEntry("activeSessions", 2);
    }

    @Test
    void downWhenModelNotLoaded() {
        engine.healthy = false;

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("status", "model not loaded");
    }
}
