package com.phillippitts.speechstream.presentation.controller;

import com.phillippitts.speechstream.domain.RecognitionResult;
import com.phillippitts.speechstream.service.stt.LegacyRecognizerService;
import com.phillippitts.speechstream.service.stt.RecognitionEngine;
import com.phillippitts.speechstream.service.validation.WavReader;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health check, single-shot WAVE recognition and reset of the shared recognizer.
 */
@RestController
@CrossOrigin
class SpeechController {

    private static final Logger LOG = LogManager.getLogger(SpeechController.class);

    private final RecognitionEngine engine;
    private final LegacyRecognizerService legacyRecognizer;
    private final WavReader wavReader;

    SpeechController(RecognitionEngine engine, LegacyRecognizerService legacyRecognizer, WavReader wavReader) {
        this.engine = engine;
        this.legacyRecognizer = legacyRecognizer;
        this.wavReader = wavReader;
    }

    @GetMapping("/health")
    ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("model_loaded", engine.isHealthy());
        return ResponseEntity.ok(body);
    }

    /**
     * Recognizes one uploaded WAVE file (multipart part {@code audio}) with the shared recognizer.
     */
    @PostMapping(path = "/recognize", produces = MediaType.APPLICATION_JSON_VALUE)
    ResponseEntity<RecognitionResponse> recognize(@RequestParam("audio") MultipartFile audio) throws IOException {
        LOG.info("Recognize upload: name={}, size={} bytes", audio.getOriginalFilename(), audio.getSize());
        byte[] pcm = wavReader.readPcm(audio.getBytes());
        RecognitionResult result = legacyRecognizer.recognize(pcm);
        return ResponseEntity.ok(RecognitionResponse.from(result));
    }

    @PostMapping(path = "/reset", produces = MediaType.APPLICATION_JSON_VALUE)
    ResponseEntity<Map<String, Object>> reset() {
        legacyRecognizer.reset();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("message", "Recognizer reset");
        return ResponseEntity.ok(body);
    }
}
