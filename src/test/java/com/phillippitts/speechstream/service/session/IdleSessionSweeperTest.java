package com.phillippitts.speechstream.service.session;

import com.phillippitts.speechstream.config.properties.StreamingSessionProperties;
import com.phillippitts.speechstream.service.metrics.StreamingMetrics;
import com.phillippitts.speechstream.testutil.FakeEngineHandle;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class IdleSessionSweeperTest {

    private SimpleMeterRegistry meters;
    private SessionRegistry registry;
    private StreamingSessionProperties props;
    private IdleSessionSweeper sweeper;

    @BeforeEach
    void setUp() {
        meters = new SimpleMeterRegistry();
        StreamingMetrics metrics = new StreamingMetrics(meters);
        registry = new SessionRegistry(metrics);
        props = new StreamingSessionProperties();
        sweeper = new IdleSessionSweeper(registry, props, metrics);
    }

    @Test
    void disabledByDefault() {
        registry.session("s1");

        assertThat(sweeper.sweep(Instant.now().plus(Duration.ofDays(1)))).isZero();
        assertThat(registry.find("s1")).isPresent();
    }

    @Test
    void evictsOnlySessionsPastTimeout() {
        props.setIdleTimeout(Duration.ofMinutes(5));
        Instant now = Instant.now();
        StreamingSession stale = registry.session("stale");
        StreamingSession fresh = registry.session("fresh");
        stale.touch(now.minus(Duration.ofMinutes(10)));
        fresh.touch(now.minus(Duration.ofMinutes(1)));
        FakeEngineHandle handle = new FakeEngineHandle();
        stale.lock().lock();
        try {
            stale.bind(handle);
        } finally {
            stale.lock().unlock();
        }

        int evicted = sweeper.sweep(now);

        assertThat(evicted).isEqualTo(1);
        assertThat(registry.find("stale")).isEmpty();
        assertThat(registry.find("fresh")).isPresent();
        assertThat(stale.isClosed()).isTrue();
        assertThat(handle.isClosed()).isTrue();
        assertThat(meters.get("speechstream.stream.sessions.closed").tag("reason", "idle").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void leavesBusySessionForNextSweep() throws Exception {
        props.setIdleTimeout(Duration.ofSeconds(30));
        Instant now = Instant.now();
        StreamingSession busy = registry.session("busy");
        busy.touch(now.minus(Duration.ofMinutes(2)));

        Thread holder = new Thread(() -> busy.lock().lock());
        holder.start();
        holder.join();

        assertThat(sweeper.sweep(now)).isZero();
        assertThat(registry.find("busy")).isPresent();
        assertThat(busy.isClosed()).isFalse();
    }

    @Test
    void publicSweepUsesWallClock() {
        props.setIdleTimeout(Duration.ofHours(1));
        registry.session("recent");

        sweeper.sweep();

        assertThat(registry.activeSessionCount()).isEqualTo(1);
    }
}
