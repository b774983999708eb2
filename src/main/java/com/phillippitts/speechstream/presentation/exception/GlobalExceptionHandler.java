package com.phillippitts.speechstream.presentation.exception;

import com.phillippitts.speechstream.exception.EngineUnavailableException;
import com.phillippitts.speechstream.exception.InvalidAudioException;
import com.phillippitts.speechstream.exception.ModelNotFoundException;
import com.phillippitts.speechstream.exception.TranscriptionException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.MultipartException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.time.Instant;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 * Logs errors for monitoring while protecting sensitive details from clients.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    static final String MISSING_AUDIO_FILE = InvalidAudioException.Rejection.MISSING_AUDIO_FILE.code();
    static final String INVALID_WAVE_FORMAT = InvalidAudioException.Rejection.INVALID_WAVE_FORMAT.code();

    /**
     * Client error - invalid input (HTTP 400). The error code is the rejection category.
     */
    @ExceptionHandler(InvalidAudioException.class)
    ResponseEntity<ApiError> handleInvalidAudio(InvalidAudioException ex) {
        LOG.warn("Invalid audio: size={}, reason={}", ex.getAudioSize(), ex.getReason());
        return error(HttpStatus.BAD_REQUEST, ex.getRejection().code(), "Invalid audio", ex.getReason());
    }

    /**
     * Client error - upload above the multipart size limit (HTTP 400). Same code as an oversized
     * payload rejected by the WAVE reader.
     */
    @ExceptionHandler(MaxUploadSizeExceededException.class)
    ResponseEntity<ApiError> handleUploadTooLarge(MaxUploadSizeExceededException ex) {
        LOG.warn("Upload too large: limit={}", ex.getMaxUploadSize());
        return error(HttpStatus.BAD_REQUEST, INVALID_WAVE_FORMAT, "Invalid audio",
                "Audio payload too large. Max: " + ex.getMaxUploadSize() + " bytes");
    }

    /**
     * Client error - multipart upload without an {@code audio} part (HTTP 400).
     */
    @ExceptionHandler({MissingServletRequestPartException.class, MultipartException.class})
    ResponseEntity<ApiError> handleMissingAudioFile(Exception ex) {
        LOG.warn("Missing audio file: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, MISSING_AUDIO_FILE, "Audio file not found",
                "Send the WAVE file as multipart part 'audio'");
    }

    /**
     * Model not loaded (HTTP 500). Nothing recovers automatically; an operator has to fix the model.
     */
    @ExceptionHandler(EngineUnavailableException.class)
    ResponseEntity<ApiError> handleEngineUnavailable(EngineUnavailableException ex) {
        LOG.error("Recognition requested but engine {} is not initialized", ex.getEngineName());
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "EngineUnavailable",
                "Recognition engine not initialized", "Model not loaded. Contact administrator.");
    }

    @ExceptionHandler(ModelNotFoundException.class)
    ResponseEntity<ApiError> handleModelNotFound(ModelNotFoundException ex) {
        LOG.error("Model not found at path: {}", ex.getModelPath());
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "EngineUnavailable",
                "Recognition engine not initialized", "Model not loaded. Contact administrator.");
    }

    /**
     * Engine failed while processing this request (HTTP 500). Other sessions are unaffected.
     */
    @ExceptionHandler(TranscriptionException.class)
    ResponseEntity<ApiError> handleTranscriptionFailure(TranscriptionException ex) {
        LOG.error("Recognition failed: engine={}", ex.getEngineName(), ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "EngineProcessingError",
                "Recognition failed", ex.getMessage());
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "InternalServerError",
                "An unexpected error occurred", "Please contact support with request ID");
    }

    private static ResponseEntity<ApiError> error(HttpStatus status, String code, String message, String details) {
        return ResponseEntity
            .status(status)
            .body(new ApiError(false, code, message, details, Instant.now()));
    }

    /**
     * Standardized error response for API clients.
     */
    record ApiError(
        boolean success,
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
