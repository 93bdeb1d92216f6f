package com.printshop_voice_backend.config;

import com.theokanning.openai.service.OpenAiService;
import lombok.Getter;
import okhttp3.OkHttpClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.io.File;
import java.time.Duration;

@Configuration
@Getter
public class VoiceAIConfig {

    // OpenAI API Configuration
    @Value("${openai.api.key}")
    private String openaiApiKey;

    @Value("${openai.api.timeout:60000}")
    private int apiTimeout;

    // Model Configuration
    @Value("${openai.models.whisper:whisper-1}")
    private String whisperModel;

    @Value("${openai.models.gpt:gpt-4o}")
    private String gptModel;

    @Value("${openai.chat.max-tokens:1024}")
    private int maxTokens;

    @Value("${openai.chat.temperature:0.7}")
    private double temperature;

    // Speech-to-text
    @Value("${voice.stt.language:en}")
    private String sttLanguage;

    @Value("${voice.stt.file-extension:webm}")
    private String sttFileExtension;

    @Value("${voice.stt.temp-dir:${java.io.tmpdir}/voice-pipeline}")
    private String tempDirectory;

    // ElevenLabs text-to-speech
    @Value("${elevenlabs.api.key:}")
    private String elevenLabsApiKey;

    @Value("${elevenlabs.api.base-url:https://api.elevenlabs.io}")
    private String elevenLabsBaseUrl;

    @Value("${elevenlabs.voice-id:pNInz6obpgDQGcFmaJgB}")
    private String elevenLabsVoiceId;

    @Value("${elevenlabs.model-id:eleven_turbo_v2_5}")
    private String elevenLabsModelId;

    @Value("${elevenlabs.voice-settings.stability:0.5}")
    private double voiceStability;

    @Value("${elevenlabs.voice-settings.similarity-boost:0.75}")
    private double voiceSimilarityBoost;

    @Value("${voice.tts.chunk-size:4096}")
    private int ttsChunkSize;

    @Value("${voice.tts.read-timeout:30000}")
    private int ttsReadTimeout;

    @Bean
    public OpenAiService openAiService() {
        Duration timeout = Duration.ofMillis(apiTimeout);

        return new OpenAiService(openaiApiKey, timeout);
    }

    @Bean
    public OkHttpClient textToSpeechHttpClient() {
        return new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(10))
                .readTimeout(Duration.ofMillis(ttsReadTimeout))
                .build();
    }

    @Bean("voicePipelineExecutor")
    public ThreadPoolTaskExecutor voicePipelineExecutor(VoicePipelineProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getExecutorCorePoolSize());
        executor.setMaxPoolSize(properties.getExecutorMaxPoolSize());
        executor.setQueueCapacity(properties.getExecutorQueueCapacity());
        executor.setThreadNamePrefix("VoicePipeline-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    public File getTempDirectory() {
        File dir = new File(tempDirectory);
        if (!dir.exists()) {
            dir.mkdirs();
        }
        return dir;
    }

    public String getSystemPrompt() {
        return """
            You are Jarvis, an AI assistant for a print shop management system.

            Your role is to help users create quotes for custom printing orders through natural conversation.

            When a user describes an order, you should:
            1. Listen carefully to all details (product, quantity, sizes, decoration method)
            2. Ask clarifying questions if information is missing
            3. Create the quote in the system
            4. Confirm the quote was created and provide the quote number and total

            Be professional, friendly, and efficient. Speak naturally and conversationally.
            Your replies are spoken aloud, so keep them short and avoid lists or markup.
            """;
    }
}
