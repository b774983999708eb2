package com.phillippitts.speechstream.service.stt.event;

import java.time.Instant;
import java.util.Map;

/**
 * Published when the recognition engine fails (model load error, native recognizer error,
 * failure while feeding a session's handle).
 *
 * <p>PII note: Do not include transcript text in context. Restrict to technical diagnostics.
 */
public record EngineFailureEvent(
        String engine,
        Instant at,
        String message,
        Throwable cause,
        Map<String, String> context
) {
    public EngineFailureEvent {
        if (at == null) {
            at = Instant.now();
        }
        context = context == null ? Map.of() : Map.copyOf(context);
    }
}
