package com.phillippitts.speechstream.domain;

import java.util.Objects;

/**
 * Immutable result of pushing audio through a recognition engine handle.
 *
 * <p>Empty text is valid: silence, fragments shorter than one engine window and audio that
 * arrives for an already closed session all produce an empty result.
 *
 * @param text       recognized text (never null, may be empty)
 * @param confidence engine confidence, or {@code null} when the engine reported none
 * @param type       partial or final
 */
public record RecognitionResult(
        String text,
        Double confidence,
        ResultType type
) {

    public RecognitionResult {
        Objects.requireNonNull(text, "Recognition text must not be null");
        Objects.requireNonNull(type, "Result type must not be null");
    }

    public static RecognitionResult partial(String text) {
        return new RecognitionResult(text, null, ResultType.PARTIAL);
    }

    public static RecognitionResult finalResult(String text, Double confidence) {
        return new RecognitionResult(text, confidence, ResultType.FINAL);
    }

    public static RecognitionResult emptyPartial() {
        return partial("");
    }

    public static RecognitionResult emptyFinal() {
        return finalResult("", null);
    }
}
