package com.phillippitts.speechstream.exception;

/**
 * Thrown when a request arrives while the recognition engine is not loaded.
 * Fatal for the process until an operator fixes the model; nothing retries automatically.
 */
public class EngineUnavailableException extends TranscriptionException {

    public EngineUnavailableException(String engineName) {
        super("Recognition engine not initialized", engineName);
    }
}
