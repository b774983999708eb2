package com.phillippitts.speechstream.presentation.controller;

import com.phillippitts.speechstream.domain.RecognitionResult;
import com.phillippitts.speechstream.service.session.StreamingSessionCoordinator;
import jakarta.servlet.http.HttpServletRequest;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Locale;
import java.util.Set;

/**
 * Streaming recognition: {@code POST /recognize_stream}.
 *
 * <p>The body is raw little-endian float32 audio. The session is taken from the
 * {@code X-Session-Id} header, else the {@code session_id} query parameter, else the caller's
 * address. {@code X-End-Of-Utterance: 1|true|yes} ends the utterance; the body is then ignored
 * and may be empty.
 */
@RestController
@CrossOrigin
class StreamingRecognitionController {

    private static final Logger LOG = LogManager.getLogger(StreamingRecognitionController.class);

    static final String SESSION_ID_HEADER = "X-Session-Id";
    static final String END_OF_UTTERANCE_HEADER = "X-End-Of-Utterance";
    static final String DEFAULT_SESSION_ID = "default";

    private static final Set<String> TRUE_VALUES = Set.of("1", "true", "yes");

    private final StreamingSessionCoordinator coordinator;

    StreamingRecognitionController(StreamingSessionCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    @PostMapping(path = "/recognize_stream", produces = MediaType.APPLICATION_JSON_VALUE)
    ResponseEntity<RecognitionResponse> recognizeStream(
            @RequestHeader(name = SESSION_ID_HEADER, required = false) String sessionHeader,
            @RequestParam(name = "session_id", required = false) String sessionParam,
            @RequestHeader(name = END_OF_UTTERANCE_HEADER, required = false) String endOfUtterance,
            @RequestBody(required = false) byte[] body,
            HttpServletRequest request) {

        String sessionId = resolveSessionId(sessionHeader, sessionParam, request.getRemoteAddr());
        RecognitionResult result;
        if (isEndOfUtterance(endOfUtterance)) {
            result = coordinator.endOfUtterance(sessionId);
        } else {
            LOG.debug("Received {} bytes of float32 audio", body == null ? 0 : body.length);
            result = coordinator.acceptFragment(sessionId, body);
        }
        return ResponseEntity.ok(RecognitionResponse.from(result));
    }

    static String resolveSessionId(String header, String param, String remoteAddr) {
        if (header != null && !header.isBlank()) {
            return header;
        }
        if (param != null && !param.isBlank()) {
            return param;
        }
        if (remoteAddr != null && !remoteAddr.isBlank()) {
            return remoteAddr;
        }
        return DEFAULT_SESSION_ID;
    }

    static boolean isEndOfUtterance(String headerValue) {
        return headerValue != null && TRUE_VALUES.contains(headerValue.toLowerCase(Locale.ROOT));
    }
}
