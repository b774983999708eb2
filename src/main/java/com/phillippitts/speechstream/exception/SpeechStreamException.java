package com.phillippitts.speechstream.exception;

/**
 * Base exception for all speechstream application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class SpeechStreamException extends RuntimeException {

    public SpeechStreamException(String message) {
        super(message);
    }

    public SpeechStreamException(String message, Throwable cause) {
        super(message, cause);
    }

    public SpeechStreamException(Throwable cause) {
        super(cause);
    }
}
