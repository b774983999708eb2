package com.phillippitts.speechstream.exception;

/**
 * Thrown when the recognition engine fails while creating a handle or accepting audio.
 * The failing request gets HTTP 500; other sessions are unaffected.
 */
public class TranscriptionException extends SpeechStreamException {

    private final String engineName;

    public TranscriptionException(String message) {
        super(message);
        this.engineName = "unknown";
    }

    public TranscriptionException(String message, String engineName) {
        super(message + " (engine: " + engineName + ")");
        this.engineName = engineName;
    }

    public TranscriptionException(String message, Throwable cause) {
        super(message, cause);
        this.engineName = "unknown";
    }

    public TranscriptionException(String message, String engineName, Throwable cause) {
        super(message + " (engine: " + engineName + ")", cause);
        this.engineName = engineName;
    }

    public String getEngineName() {
        return engineName;
    }
}
