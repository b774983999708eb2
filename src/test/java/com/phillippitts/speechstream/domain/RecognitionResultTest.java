package com.phillippitts.speechstream.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RecognitionResultTest {

    @Test
    void partialNeverCarriesConfidence() {
        RecognitionResult r = RecognitionResult.partial("hel");

        assertThat(r.confidence()).isNull();
        assertThat(r.type()).isEqualTo(ResultType.PARTIAL);
        assertThat(r.type().wireName()).isEqualTo("partial");
    }

    @Test
    void finalMayOmitConfidence() {
        assertThat(RecognitionResult.finalResult("hello", 0.8).confidence()).isEqualTo(0.8);
        assertThat(RecognitionResult.finalResult("hello", null).confidence()).isNull();
        assertThat(RecognitionResult.emptyFinal().type().wireName()).isEqualTo("final");
    }

    @Test
    void emptyResultsHaveEmptyText() {
        assertThat(RecognitionResult.emptyPartial().text()).isEmpty();
        assertThat(RecognitionResult.emptyFinal().text()).isEmpty();
        assertThat(RecognitionResult.emptyFinal().type()).isEqualTo(ResultType.FINAL);
    }

    @Test
    void rejectsNullTextOrType() {
        assertThatThrownBy(() -> new RecognitionResult(null, null, ResultType.FINAL))
                .isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> new RecognitionResult("x", null, null))
                .isInstanceOf(NullPointerException.class);
    }
}
