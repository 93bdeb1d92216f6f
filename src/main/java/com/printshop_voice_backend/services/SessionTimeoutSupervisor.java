package com.printshop_voice_backend.services;

import com.printshop_voice_backend.config.VoicePipelineProperties;
import com.printshop_voice_backend.dto.PipelineEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Closes sessions that have been idle for {@code voice.pipeline.session-timeout-ms}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SessionTimeoutSupervisor {

    public static final int TIMEOUT_CLOSE_CODE = 1000;
    public static final String TIMEOUT_CLOSE_REASON = "Session timeout";
    public static final String TIMEOUT_MESSAGE = "Session timed out due to inactivity";

    private final TaskScheduler taskScheduler;
    private final VoicePipelineProperties properties;
    private final VoiceSessionManager sessionManager;

    /**
     * Record activity and restart the idle countdown, replacing any pending timer.
     */
    public void arm(VoiceSession session) {
        session.touch();
        long timeoutMs = properties.getSessionTimeoutMs();
        session.rearmIdleTimer(generation -> taskScheduler.schedule(
                () -> onIdleTimeout(session, generation),
                Instant.now().plusMillis(timeoutMs)));
    }

    public void cancel(VoiceSession session) {
        session.cancelIdleTimer();
    }

    void onIdleTimeout(VoiceSession session, long generation) {
        if (!session.isCurrentIdleTimer(generation)) {
            return;
        }

        log.info("Voice session {} idle for {} ms, closing", session.getSessionId(), properties.getSessionTimeoutMs());
        try {
            session.getConnection().send(PipelineEvent.error(TIMEOUT_MESSAGE));
            session.getConnection().close(TIMEOUT_CLOSE_CODE, TIMEOUT_CLOSE_REASON);
        } finally {
            sessionManager.closeSession(session.getSessionId(), TIMEOUT_CLOSE_REASON);
        }
    }
}
