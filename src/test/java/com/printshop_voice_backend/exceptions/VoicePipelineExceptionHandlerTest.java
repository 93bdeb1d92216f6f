package com.printshop_voice_backend.exceptions;

import com.printshop_voice_backend.exceptions.VoicePipelineExceptionHandler.RateLimitExceededException;
import com.printshop_voice_backend.exceptions.VoicePipelineExceptionHandler.TranscriptionException;
import com.printshop_voice_backend.exceptions.VoicePipelineExceptionHandler.VoiceSessionException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class VoicePipelineExceptionHandlerTest {

    private final VoicePipelineExceptionHandler handler = new VoicePipelineExceptionHandler();

    @Test
    void voiceSessionErrorReturns400WithSessionId() {
        ResponseEntity<?> response = handler.handleVoiceSessionException(
                new VoiceSessionException("No audio recorded", "s-1"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(body(response))
                .containsEntry("error", "No audio recorded")
                .containsEntry("type", "VOICE_SESSION_ERROR")
                .containsEntry("sessionId", "s-1")
                .containsKey("timestamp");
    }

    @Test
    void rateLimitReturns429WithRetryAfter() {
        ResponseEntity<?> response = handler.handleRateLimitExceeded(new RateLimitExceededException("slow down", 60));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.TOO_MANY_REQUESTS);
        assertThat(body(response)).containsEntry("retryAfter", "60 seconds");
    }

    @Test
    void unknownSessionReturns400() {
        ResponseEntity<?> response = handler.handleIllegalArgument(
                new IllegalArgumentException("Voice session not found: x"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(body(response)).containsEntry("error", "Voice session not found: x");
    }

    @Test
    void unexpectedErrorDoesNotLeakDetails() {
        ResponseEntity<?> response = handler.handleRuntimeException(new IllegalStateException("db password wrong"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(body(response).get("error")).isEqualTo("An unexpected error occurred");
    }

    @Test
    void stageExceptionsCarryStageName() {
        assertThat(new TranscriptionException("boom", null).getStage()).isEqualTo("transcription");
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> body(ResponseEntity<?> response) {
        return (Map<String, Object>) response.getBody();
    }
}
