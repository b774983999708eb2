package com.phillippitts.speechstream.service.stt.util;

import com.phillippitts.speechstream.service.stt.event.EngineFailureEvent;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;
import java.util.Map;

/**
 * Utility class for publishing recognition engine failure events.
 *
 * <p>Centralizes null-checking the publisher and creating {@link EngineFailureEvent} instances,
 * shared by the engine itself and by the session coordinator.
 *
 * @since 1.0
 */
public final class EngineEventPublisher {

    private EngineEventPublisher() {
        // Utility class - prevent instantiation
    }

    /**
     * Publishes an engine failure event if a publisher is available.
     *
     * <p>If the publisher is null, this method does nothing. This allows engines to work
     * without event publishing in test scenarios.
     *
     * @param publisher the Spring event publisher (may be null)
     * @param engineName the name of the engine experiencing the failure
     * @param message a human-readable description of the failure
     * @param cause the exception that caused the failure (may be null)
     * @param context additional context as key-value pairs (may be null or empty)
     */
    public static void publishFailure(ApplicationEventPublisher publisher,
                                       String engineName,
                                       String message,
                                       Throwable cause,
                                       Map<String, String> context) {
        if (publisher != null) {
            publisher.publishEvent(new EngineFailureEvent(
                engineName,
                Instant.now(),
                message,
                cause,
                context
            ));
        }
    }

    /**
     * Publishes an engine failure event with no additional context.
     */
    public static void publishFailure(ApplicationEventPublisher publisher,
                                       String engineName,
                                       String message,
                                       Throwable cause) {
        publishFailure(publisher, engineName, message, cause, null);
    }
}
