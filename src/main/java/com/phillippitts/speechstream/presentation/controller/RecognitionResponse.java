package com.phillippitts.speechstream.presentation.controller;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.phillippitts.speechstream.domain.RecognitionResult;

/**
 * Successful recognition response body.
 *
 * <pre>
 * {"text": "hello world", "confidence": 0.93, "success": true, "type": "final"}
 * </pre>
 * {@code confidence} is omitted when the engine reported none.
 */
record RecognitionResponse(
        String text,
        @JsonInclude(JsonInclude.Include.NON_NULL) Double confidence,
        boolean success,
        String type
) {

    static RecognitionResponse from(RecognitionResult result) {
        return new RecognitionResponse(result.text(), result.confidence(), true, result.type().wireName());
    }
}
