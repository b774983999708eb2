package com.phillippitts.speechstream.exception;

/**
 * Thrown when the recognition model cannot be found at the configured path.
 * This is a fatal error that prevents the engine from starting.
 */
public class ModelNotFoundException extends SpeechStreamException {

    private final String modelPath;

    public ModelNotFoundException(String modelPath) {
        super("Recognition model not found at path: " + modelPath);
        this.modelPath = modelPath;
    }

    public ModelNotFoundException(String modelPath, Throwable cause) {
        super("Recognition model not found at path: " + modelPath, cause);
        this.modelPath = modelPath;
    }

    public String getModelPath() {
        return modelPath;
    }
}
