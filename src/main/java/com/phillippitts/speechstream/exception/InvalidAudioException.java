package com.phillippitts.speechstream.exception;

/**
 * Thrown when audio supplied by a caller cannot be processed: an empty or misaligned
 * float32 fragment, a WAVE upload in the wrong format, or a missing upload part.
 *
 * <p>Always reported to the caller as HTTP 400 and never retried.
 */
public class InvalidAudioException extends SpeechStreamException {

    /**
     * Validation failure categories. {@link #code()} is the value reported to clients.
     */
    public enum Rejection {
        EMPTY_INPUT("EmptyInput"),
        MISALIGNED_INPUT("MisalignedInput"),
        INVALID_WAVE_FORMAT("InvalidWaveFormat"),
        MISSING_AUDIO_FILE("MissingAudioFile");

        private final String code;

        Rejection(String code) {
            this.code = code;
        }

        public String code() {
            return code;
        }
    }

    private final Rejection rejection;
    private final int audioSize;
    private final String reason;

    public InvalidAudioException(Rejection rejection, String reason) {
        super("Invalid audio data: " + reason);
        this.rejection = rejection;
        this.audioSize = 0;
        this.reason = reason;
    }

    public InvalidAudioException(Rejection rejection, int audioSize, String reason) {
        super("Invalid audio data (" + audioSize + " bytes): " + reason);
        this.rejection = rejection;
        this.audioSize = audioSize;
        this.reason = reason;
    }

    public Rejection getRejection() {
        return rejection;
    }

    public int getAudioSize() {
        return audioSize;
    }

    public String getReason() {
        return reason;
    }
}
