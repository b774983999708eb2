package com.phillippitts.speechstream.service.stt;

import com.phillippitts.speechstream.config.stt.VoskConfig;
import com.phillippitts.speechstream.domain.RecognitionResult;
import com.phillippitts.speechstream.domain.ResultType;
import com.phillippitts.speechstream.exception.EngineUnavailableException;
import com.phillippitts.speechstream.exception.TranscriptionException;
import com.phillippitts.speechstream.testutil.EventCapturingPublisher;
import com.phillippitts.speechstream.testutil.FakeEngineHandle;
import com.phillippitts.speechstream.testutil.FakeRecognitionEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LegacyRecognizerServiceTest {

    private FakeRecognitionEngine engine;
    private EventCapturingPublisher publisher;
    private LegacyRecognizerService service;

    @BeforeEach
    void setUp() {
        engine = new FakeRecognitionEngine();
        publisher = new EventCapturingPublisher();
        service = new LegacyRecognizerService(engine, new VoskConfig("unused", 16_000), publisher);
    }

    @Test
    void sharesOneHandleAcrossUploads() {
        service.recognize(new byte[3_200]);
        service.recognize(new byte[3_200]);

        assertThat(engine.handles()).hasSize(1);
        assertThat(engine.lastHandle().accepted()).hasSize(2);
    }

    @Test
    void returnsPartialWithoutBoundary() {
        engine.handleFactory = () -> {
            FakeEngineHandle h = new FakeEngineHandle();
            h.partialText = "so far";
            return h;
        };

        RecognitionResult result = service.recognize(new byte[3_200]);

        assertThat(result.type()).isEqualTo(ResultType.PARTIAL);
        assertThat(result.text()).isEqualTo("so far");
        assertThat(result.confidence()).isNull();
    }

    @Test
    void finalWithoutEngineConfidenceReportsZero() {
        engine.handleFactory = () -> {
            FakeEngineHandle h = new FakeEngineHandle();
            h.boundary = true;
            h.resultText = "done";
            return h;
        };

        RecognitionResult result = service.recognize(new byte[3_200]);

        assertThat(result.type()).isEqualTo(ResultType.FINAL);
        assertThat(result.text()).isEqualTo("done");
        assertThat(result.confidence()).isEqualTo(0.0);
    }

    @Test
    void resetReplacesAndClosesHandle() {
        service.recognize(new byte[3_200]);
        FakeEngineHandle before = engine.lastHandle();

        service.reset();
        service.recognize(new byte[3_200]);

        assertThat(before.isClosed()).isTrue();
        assertThat(engine.handles()).hasSize(2);
        assertThat(engine.lastHandle().accepted()).hasSize(1);
    }

    @Test
    void resetBeforeAnyUploadCreatesHandle() {
        service.reset();

        assertThat(engine.handles()).hasSize(1);
    }

    @Test
    void unhealthyEngineIsUnavailable() {
        engine.healthy = false;

        assertThatThrownBy(() -> service.recognize(new byte[3_200]))
                .isInstanceOf(EngineUnavailableException.class);
        assertThatThrownBy(service::reset)
                .isInstanceOf(EngineUnavailableException.class);
    }

    @Test
    void engineFailureIsWrappedAndPublished() {
        engine.handleFactory = () -> {
            FakeEngineHandle h = new FakeEngineHandle();
            h.failure = new IllegalStateException("decoder crashed");
            return h;
        };

        assertThatThrownBy(() -> service.recognize(new byte[3_200]))
                .isInstanceOf(TranscriptionException.class)
                .hasMessageContaining("decoder crashed")
                .hasMessageContaining("bytes=3200");
        assertThat(publisher.failures()).hasSize(1);
    }

    @Test
    void closeReleasesHandle() {
        service.recognize(new byte[3_200]);

        service.close();
        service.close();

        assertThat(engine.lastHandle().isClosed()).isTrue();
    }
}
