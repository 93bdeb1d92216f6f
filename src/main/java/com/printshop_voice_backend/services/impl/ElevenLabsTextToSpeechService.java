package com.printshop_voice_backend.services.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.printshop_voice_backend.config.VoiceAIConfig;
import com.printshop_voice_backend.exceptions.VoicePipelineExceptionHandler.TextToSpeechException;
import com.printshop_voice_backend.services.TextToSpeechService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Streaming synthesis through the ElevenLabs {@code /v1/text-to-speech/{voice}/stream} endpoint.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ElevenLabsTextToSpeechService implements TextToSpeechService {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final OkHttpClient textToSpeechHttpClient;
    private final VoiceAIConfig voiceAIConfig;
    private final ObjectMapper objectMapper;

    @Override
    public void streamSpeech(String text, Consumer<byte[]> chunkConsumer) {
        Request request = new Request.Builder()
                .url(voiceAIConfig.getElevenLabsBaseUrl() + "/v1/text-to-speech/"
                        + voiceAIConfig.getElevenLabsVoiceId() + "/stream")
                .header("xi-api-key", voiceAIConfig.getElevenLabsApiKey())
                .header("Accept", "audio/mpeg")
                .post(RequestBody.create(requestBody(text), JSON))
                .build();

        log.info("Converting text to speech. Text length: {}", text.length());

        try (Response response = textToSpeechHttpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            if (!response.isSuccessful() || body == null) {
                throw new TextToSpeechException("ElevenLabs TTS failed: " + response.code());
            }

            byte[] buffer = new byte[voiceAIConfig.getTtsChunkSize()];
            int chunks = 0;
            long totalBytes = 0;
            try (InputStream in = body.byteStream()) {
                int read;
                while ((read = in.read(buffer)) != -1) {
                    if (read == 0) {
                        continue;
                    }
                    chunkConsumer.accept(Arrays.copyOf(buffer, read));
                    chunks++;
                    totalBytes += read;
                }
            }
            log.debug("Streamed {} audio chunks ({} bytes)", chunks, totalBytes);
        } catch (IOException e) {
            throw new TextToSpeechException("ElevenLabs TTS stream failed: " + e.getMessage(), e);
        }
    }

    private String requestBody(String text) {
        Map<String, Object> payload = Map.of(
                "text", text,
                "model_id", voiceAIConfig.getElevenLabsModelId(),
                "voice_settings", Map.of(
                        "stability", voiceAIConfig.getVoiceStability(),
                        "similarity_boost", voiceAIConfig.getVoiceSimilarityBoost()));
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new TextToSpeechException("Could not encode TTS request", e);
        }
    }
}
