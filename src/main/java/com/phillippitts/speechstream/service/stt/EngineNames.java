package com.phillippitts.speechstream.service.stt;

/**
 * Engine name identifiers used in logs, metrics tags and exceptions.
 *
 * @since 1.0
 */
public final class EngineNames {

    /** Vosk offline recognizer (Kaldi based). */
    public static final String VOSK = "vosk";

    private EngineNames() {
        // Utility class - prevent instantiation
    }
}
