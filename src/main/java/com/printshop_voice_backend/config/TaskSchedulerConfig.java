package com.printshop_voice_backend.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@Configuration
@Slf4j
public class TaskSchedulerConfig {

    /**
     * Scheduler for per-session idle timers and per-turn processing deadlines.
     * Primary because @EnableWebSocket registers its own SockJS scheduler bean.
     */
    @Bean
    @Primary
    public TaskScheduler voiceSessionScheduler(VoicePipelineProperties properties) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(properties.getSchedulerPoolSize());
        scheduler.setThreadNamePrefix("voice-timer-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();

        log.info("Voice session scheduler configured with pool size {}", properties.getSchedulerPoolSize());
        return scheduler;
    }
}
