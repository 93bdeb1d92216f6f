package com.printshop_voice_backend.exceptions;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;

@RestControllerAdvice(basePackages = "com.printshop_voice_backend.controllers")
@Slf4j
public class VoicePipelineExceptionHandler {

    /**
     * Handle voice session related exceptions
     */
    @ExceptionHandler(VoiceSessionException.class)
    public ResponseEntity<?> handleVoiceSessionException(VoiceSessionException e) {
        log.warn("Voice session error: {}", e.getMessage());

        Map<String, Object> errorResponse = errorBody(e.getMessage(), "VOICE_SESSION_ERROR");
        if (e.getSessionId() != null) {
            errorResponse.put("sessionId", e.getSessionId());
        }

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(errorResponse);
    }

    /**
     * Handle rate limiting exceptions
     */
    @ExceptionHandler(RateLimitExceededException.class)
    public ResponseEntity<?> handleRateLimitExceeded(RateLimitExceededException e) {
        log.warn("Rate limit exceeded: {}", e.getMessage());

        Map<String, Object> errorResponse = errorBody(e.getMessage(), "RATE_LIMIT_EXCEEDED");
        errorResponse.put("retryAfter", e.getRetryAfterSeconds() + " seconds");

        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS).body(errorResponse);
    }

    /**
     * Handle illegal argument exceptions (unknown sessions, bad input)
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<?> handleIllegalArgument(IllegalArgumentException e) {
        log.warn("Invalid voice pipeline request: {}", e.getMessage());

        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(errorBody(e.getMessage(), "INVALID_REQUEST"));
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<?> handleRuntimeException(RuntimeException e) {
        log.error("Unexpected error in voice pipeline endpoint: {}", e.getMessage(), e);

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(errorBody("An unexpected error occurred", "INTERNAL_ERROR"));
    }

    private Map<String, Object> errorBody(String message, String type) {
        Map<String, Object> errorResponse = new HashMap<>();
        errorResponse.put("error", message);
        errorResponse.put("type", type);
        errorResponse.put("timestamp", LocalDateTime.now());
        return errorResponse;
    }

    // Custom exception classes

    /**
     * A turn could not proceed for a reason the user should hear about
     * (busy, nothing recorded, nothing recognised, nothing generated).
     */
    public static class VoiceSessionException extends RuntimeException {
        private final String sessionId;

        public VoiceSessionException(String message, String sessionId) {
            super(message);
            this.sessionId = sessionId;
        }

        public String getSessionId() {
            return sessionId;
        }
    }

    /**
     * Failure of one of the external services a turn depends on.
     */
    public static class PipelineStageException extends RuntimeException {
        private final String stage;

        public PipelineStageException(String message, String stage) {
            super(message);
            this.stage = stage;
        }

        public PipelineStageException(String message, String stage, Throwable cause) {
            super(message, cause);
            this.stage = stage;
        }

        public String getStage() {
            return stage;
        }
    }

    public static class TranscriptionException extends PipelineStageException {
        public TranscriptionException(String message, Throwable cause) {
            super(message, "transcription", cause);
        }
    }

    public static class LanguageModelException extends PipelineStageException {
        public LanguageModelException(String message, Throwable cause) {
            super(message, "dialogue", cause);
        }
    }

    public static class TextToSpeechException extends PipelineStageException {
        public TextToSpeechException(String message) {
            super(message, "synthesis");
        }

        public TextToSpeechException(String message, Throwable cause) {
            super(message, "synthesis", cause);
        }
    }

    public static class ToolExecutionException extends RuntimeException {
        private final String toolName;

        public ToolExecutionException(String message, String toolName) {
            super(message);
            this.toolName = toolName;
        }

        public ToolExecutionException(String message, String toolName, Throwable cause) {
            super(message, cause);
            this.toolName = toolName;
        }

        public String getToolName() {
            return toolName;
        }
    }

    public static class RateLimitExceededException extends RuntimeException {
        private final int retryAfterSeconds;

        public RateLimitExceededException(String message, int retryAfterSeconds) {
            super(message);
            this.retryAfterSeconds = retryAfterSeconds;
        }

        public int getRetryAfterSeconds() {
            return retryAfterSeconds;
        }
    }
}
