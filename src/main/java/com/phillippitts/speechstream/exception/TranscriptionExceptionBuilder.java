package com.phillippitts.speechstream.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for {@link TranscriptionException} with contextual details.
 *
 * <p><b>Usage Examples:</b>
 * <pre>
 * throw TranscriptionExceptionBuilder.create("Failed to create recognizer")
 *         .engine("vosk")
 *         .session(sessionId)
 *         .cause(exception)
 *         .metadata("sampleRate", 16000)
 *         .build();
 * </pre>
 */
public final class TranscriptionExceptionBuilder {

    private final String message;
    private String engineName;
    private Throwable cause;
    private String sessionId;
    private Long durationMs;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private TranscriptionExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * Creates a new builder with the base error message.
     *
     * @param message base error message (must not be null)
     * @return new builder instance
     */
    public static TranscriptionExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new TranscriptionExceptionBuilder(message);
    }

    public TranscriptionExceptionBuilder engine(String engineName) {
        this.engineName = engineName;
        return this;
    }

    public TranscriptionExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    /**
     * Sets the streaming session the failure belongs to.
     *
     * @param sessionId session identifier
     * @return this builder for chaining
     */
    public TranscriptionExceptionBuilder session(String sessionId) {
        this.sessionId = sessionId;
        return this;
    }

    public TranscriptionExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /**
     * Adds a metadata key-value pair to the exception message. Null keys or values are ignored.
     *
     * @param key metadata key
     * @param value metadata value
     * @return this builder for chaining
     */
    public TranscriptionExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    /**
     * Builds the exception. Message format:
     * <pre>
     * {message} (session={id}, durationMs={ms}, {key1}={val1}, ...)
     * </pre>
     *
     * @return constructed TranscriptionException
     */
    public TranscriptionException build() {
        String detailedMessage = buildDetailedMessage();
        String engine = engineName != null ? engineName : "unknown";

        if (cause != null) {
            return new TranscriptionException(detailedMessage, engine, cause);
        } else {
            return new TranscriptionException(detailedMessage, engine);
        }
    }

    private String buildDetailedMessage() {
        Map<String, String> details = new LinkedHashMap<>();
        if (sessionId != null) {
            details.put("session", sessionId);
        }
        if (durationMs != null) {
            details.put("durationMs", String.valueOf(durationMs));
        }
        details.putAll(metadata);

        if (details.isEmpty()) {
            return message;
        }

        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;
        for (Map.Entry<String, String> entry : details.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append("=").append(entry.getValue());
            first = false;
        }
        return sb.append(")").toString();
    }
}
