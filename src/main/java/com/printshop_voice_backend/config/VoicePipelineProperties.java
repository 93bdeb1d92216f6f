package com.printshop_voice_backend.config;

import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "voice.pipeline")
@Validated
@Data
public class VoicePipelineProperties {

    private String endpoint = "/ws/voice-pipeline";
    private String allowedOrigins = "*";

    @Min(1)
    private int maxAudioChunks = 1000; // Prevent memory exhaustion

    @Min(3)
    private int maxConversationHistory = 20;

    // Entries dropped beyond the limit when history is trimmed
    @Min(1)
    private int historyTrimSlack = 2;

    @Min(1)
    private long sessionTimeoutMs = 1800000; // 30 minutes

    @Min(1)
    private long processingTimeoutMs = 60000; // 60 seconds

    @Min(1)
    private int turnsPerMinute = 20;

    private int maxBinaryMessageBytes = 1024 * 1024;
    private int sendTimeLimitMs = 10000;
    private int sendBufferSizeLimit = 512 * 1024;

    private int schedulerPoolSize = 4;
    private int executorCorePoolSize = 5;
    private int executorMaxPoolSize = 20;
    private int executorQueueCapacity = 100;

    public String[] getAllowedOriginPatterns() {
        return allowedOrigins.split(",");
    }
}
