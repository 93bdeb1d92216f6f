package com.printshop_voice_backend.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Server-to-client frame on the voice pipeline channel.
 * Serialized as JSON with the {@code type} discriminator; absent fields are omitted.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PipelineEvent {

    public static final String CONNECTED = "connected";
    public static final String RECORDING_STARTED = "recording_started";
    public static final String PROCESSING_STARTED = "processing_started";
    public static final String TRANSCRIPT = "transcript";
    public static final String RESPONSE_TEXT = "response_text";
    public static final String AUDIO_CHUNK = "audio_chunk";
    public static final String AUDIO_COMPLETE = "audio_complete";
    public static final String PROCESSING_COMPLETE = "processing_complete";
    public static final String RESET_COMPLETE = "reset_complete";
    public static final String ERROR = "error";

    private String type;
    private String message;
    private String text;
    private String data; // Base64 encoded audio

    public static PipelineEvent connected() {
        return PipelineEvent.builder().type(CONNECTED).message("Voice pipeline ready").build();
    }

    public static PipelineEvent recordingStarted() {
        return PipelineEvent.builder().type(RECORDING_STARTED).message("Ready to receive audio").build();
    }

    public static PipelineEvent processingStarted() {
        return PipelineEvent.builder().type(PROCESSING_STARTED).build();
    }

    public static PipelineEvent transcript(String text) {
        return PipelineEvent.builder().type(TRANSCRIPT).text(text).build();
    }

    public static PipelineEvent responseText(String text) {
        return PipelineEvent.builder().type(RESPONSE_TEXT).text(text).build();
    }

    public static PipelineEvent audioChunk(String base64Audio) {
        return PipelineEvent.builder().type(AUDIO_CHUNK).data(base64Audio).build();
    }

    public static PipelineEvent audioComplete() {
        return PipelineEvent.builder().type(AUDIO_COMPLETE).build();
    }

    public static PipelineEvent processingComplete() {
        return PipelineEvent.builder().type(PROCESSING_COMPLETE).build();
    }

    public static PipelineEvent resetComplete() {
        return PipelineEvent.builder().type(RESET_COMPLETE).message("Session reset").build();
    }

    public static PipelineEvent error(String message) {
        return PipelineEvent.builder().type(ERROR).message(message).build();
    }
}
