package com.printshop_voice_backend.services.impl;

import com.printshop_voice_backend.config.VoiceAIConfig;
import com.printshop_voice_backend.exceptions.VoicePipelineExceptionHandler.TranscriptionException;
import com.printshop_voice_backend.services.SpeechToTextService;
import com.theokanning.openai.audio.CreateTranscriptionRequest;
import com.theokanning.openai.service.OpenAiService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.springframework.stereotype.Service;

import java.io.File;
import java.io.IOException;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class WhisperSpeechToTextService implements SpeechToTextService {

    private final OpenAiService openAiService;
    private final VoiceAIConfig voiceAIConfig;

    @Override
    public String transcribe(byte[] audio) {
        File tempFile = new File(voiceAIConfig.getTempDirectory(),
                "voice_" + UUID.randomUUID() + "." + voiceAIConfig.getSttFileExtension());

        try {
            FileUtils.writeByteArrayToFile(tempFile, audio);
            log.info("Starting speech-to-text conversion for {}", FileUtils.byteCountToDisplaySize(audio.length));

            CreateTranscriptionRequest request = CreateTranscriptionRequest.builder()
                    .model(voiceAIConfig.getWhisperModel())
                    .language(voiceAIConfig.getSttLanguage())
                    .responseFormat("json")
                    .temperature(0.0)
                    .build();

            String transcription = openAiService.createTranscription(request, tempFile).getText();

            log.info("Speech-to-text conversion completed. Transcription length: {} characters",
                    transcription != null ? transcription.length() : 0);
            return transcription;
        } catch (IOException e) {
            throw new TranscriptionException("Could not stage audio for transcription", e);
        } catch (RuntimeException e) {
            throw new TranscriptionException("Transcription failed: " + e.getMessage(), e);
        } finally {
            FileUtils.deleteQuietly(tempFile);
        }
    }
}
