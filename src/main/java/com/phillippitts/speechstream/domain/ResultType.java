package com.phillippitts.speechstream.domain;

/**
 * Kind of transcription carried by a {@link RecognitionResult}.
 */
public enum ResultType {
    /** Tentative text for the utterance in progress; may still change. */
    PARTIAL("partial"),
    /** Text the engine committed at an utterance boundary or on an explicit flush. */
    FINAL("final");

    private final String wireName;

    ResultType(String wireName) {
        this.wireName = wireName;
    }

    /**
     * @return lowercase name used in HTTP responses
     */
    public String wireName() {
        return wireName;
    }
}
