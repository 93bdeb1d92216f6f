package com.printshop_voice_backend.services;

import com.printshop_voice_backend.config.VoicePipelineProperties;
import com.printshop_voice_backend.dto.PipelineEvent;
import com.printshop_voice_backend.testutil.RecordingClientConnection;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import static org.assertj.core.api.Assertions.assertThat;

class SessionTimeoutSupervisorTest {

    private ThreadPoolTaskScheduler scheduler;
    private VoicePipelineProperties properties;
    private VoiceSessionManager sessionManager;
    private SessionTimeoutSupervisor supervisor;
    private RecordingClientConnection connection;
    private VoiceSession session;

    @BeforeEach
    void setUp() {
        scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.initialize();

        properties = new VoicePipelineProperties();
        sessionManager = new VoiceSessionManager(properties, new RateLimitingService(properties));
        supervisor = new SessionTimeoutSupervisor(scheduler, properties, sessionManager);
        connection = new RecordingClientConnection("idle-1");
        session = sessionManager.createSession(connection);
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdown();
    }

    @Test
    void idleSessionIsNotifiedClosedAndRemoved() throws Exception {
        properties.setSessionTimeoutMs(100);

        supervisor.arm(session);
        connection.awaitClosed(2000);

        assertThat(connection.errorMessages()).containsExactly(SessionTimeoutSupervisor.TIMEOUT_MESSAGE);
        assertThat(connection.getCloseCode()).isEqualTo(1000);
        assertThat(connection.getCloseReason()).isEqualTo("Session timeout");
        assertThat(connection.getCloseCount()).isEqualTo(1);
        assertThat(sessionManager.findSession("idle-1")).isEmpty();
        assertThat(session.isClosed()).isTrue();
    }

    @Test
    void rearmPostponesTimeout() throws Exception {
        properties.setSessionTimeoutMs(400);

        supervisor.arm(session);
        Thread.sleep(250);
        supervisor.arm(session);
        Thread.sleep(250);

        // The first timer would have fired by now
        assertThat(connection.isOpen()).isTrue();

        connection.awaitClosed(2000);
        assertThat(connection.getCloseCount()).isEqualTo(1);
    }

    @Test
    void cancelledTimerNeverFires() throws Exception {
        properties.setSessionTimeoutMs(100);

        supervisor.arm(session);
        supervisor.cancel(session);
        Thread.sleep(300);

        assertThat(connection.isOpen()).isTrue();
        assertThat(connection.types()).doesNotContain(PipelineEvent.ERROR);
        assertThat(sessionManager.findSession("idle-1")).isPresent();
    }

    @Test
    void staleTimerGenerationIsIgnored() {
        supervisor.arm(session);
        supervisor.arm(session);

        supervisor.onIdleTimeout(session, 1);

        assertThat(connection.isOpen()).isTrue();
        assertThat(sessionManager.findSession("idle-1")).isPresent();
    }

    @Test
    void closedSessionIsNotRearmed() {
        sessionManager.closeSession("idle-1", "test");

        supervisor.arm(session);

        assertThat(session.hasPendingIdleTimer()).isFalse();
    }
}
