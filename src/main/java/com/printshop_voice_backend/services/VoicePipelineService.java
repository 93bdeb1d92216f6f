package com.printshop_voice_backend.services;

import com.printshop_voice_backend.config.VoicePipelineProperties;
import com.printshop_voice_backend.dto.ControlMessage;
import com.printshop_voice_backend.dto.PipelineEvent;
import com.printshop_voice_backend.exceptions.VoicePipelineExceptionHandler.PipelineStageException;
import com.printshop_voice_backend.exceptions.VoicePipelineExceptionHandler.RateLimitExceededException;
import com.printshop_voice_backend.exceptions.VoicePipelineExceptionHandler.VoiceSessionException;
import com.printshop_voice_backend.services.PipelineTurn.TurnCancelledException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledFuture;

/**
 * Drives one session's turns: recording control, then speech-to-text, dialogue and
 * streamed synthesis on a worker thread, raced against the processing deadline.
 */
@Service
@Slf4j
public class VoicePipelineService {

    public static final String BUSY_MESSAGE = "Already processing a request";
    public static final String RECORDING_WHILE_BUSY_MESSAGE = "Cannot start recording while processing";
    public static final String NO_AUDIO_MESSAGE = "No audio recorded";
    public static final String NO_SPEECH_MESSAGE = "No speech detected in audio";
    public static final String NO_RESPONSE_MESSAGE = "No response generated";
    public static final String TIMEOUT_MESSAGE = "Processing timeout";
    public static final String OVERLOADED_MESSAGE = "Server is busy. Please try again in a moment.";

    private final VoicePipelineProperties properties;
    private final AudioBufferManager audioBufferManager;
    private final SpeechToTextService speechToTextService;
    private final DialogueOrchestrator dialogueOrchestrator;
    private final SpeechSynthesisStreamer speechSynthesisStreamer;
    private final SessionTimeoutSupervisor sessionTimeoutSupervisor;
    private final RateLimitingService rateLimitingService;
    private final AsyncTaskExecutor voicePipelineExecutor;
    private final TaskScheduler taskScheduler;

    public VoicePipelineService(VoicePipelineProperties properties,
                                AudioBufferManager audioBufferManager,
                                SpeechToTextService speechToTextService,
                                DialogueOrchestrator dialogueOrchestrator,
                                SpeechSynthesisStreamer speechSynthesisStreamer,
                                SessionTimeoutSupervisor sessionTimeoutSupervisor,
                                RateLimitingService rateLimitingService,
                                @Qualifier("voicePipelineExecutor") AsyncTaskExecutor voicePipelineExecutor,
                                TaskScheduler taskScheduler) {
        this.properties = properties;
        this.audioBufferManager = audioBufferManager;
        this.speechToTextService = speechToTextService;
        this.dialogueOrchestrator = dialogueOrchestrator;
        this.speechSynthesisStreamer = speechSynthesisStreamer;
        this.sessionTimeoutSupervisor = sessionTimeoutSupervisor;
        this.rateLimitingService = rateLimitingService;
        this.voicePipelineExecutor = voicePipelineExecutor;
        this.taskScheduler = taskScheduler;
    }

    public void handleControl(VoiceSession session, ControlMessage message) {
        log.debug("Control message {} for session {}", message.getType().getWireName(), session.getSessionId());

        switch (message.getType()) {
            case START_RECORDING -> startRecording(session);
            case STOP_RECORDING -> stopRecording(session);
            case RESET -> reset(session);
        }
    }

    public void startRecording(VoiceSession session) {
        if (session.isProcessing()) {
            session.getConnection().send(PipelineEvent.error(RECORDING_WHILE_BUSY_MESSAGE));
            return;
        }

        audioBufferManager.clear(session);
        session.getConnection().send(PipelineEvent.recordingStarted());
    }

    public void stopRecording(VoiceSession session) {
        if (session.isProcessing()) {
            session.getConnection().send(PipelineEvent.error(BUSY_MESSAGE));
            return;
        }
        if (session.getAudioBuffer().isEmpty()) {
            session.getConnection().send(PipelineEvent.error(NO_AUDIO_MESSAGE));
            return;
        }

        try {
            rateLimitingService.checkSessionRateLimit(session.getSessionId());
        } catch (RateLimitExceededException e) {
            session.getConnection().send(PipelineEvent.error(e.getMessage()));
            return;
        }

        runTurn(session);
    }

    /**
     * Abandon any in-flight turn and empty the session. Always leaves the session idle.
     */
    public void reset(VoiceSession session) {
        PipelineTurn turn = session.getCurrentTurn();
        if (turn != null) {
            if (turn.abandon()) {
                log.info("Abandoned in-flight turn for session {} on reset", session.getSessionId());
            }
            session.endTurn(turn);
        }
        session.finishProcessing();

        audioBufferManager.clear(session);
        session.getHistory().clear();
        session.getConnection().send(PipelineEvent.resetComplete());
    }

    /**
     * Start a turn over the buffered audio. Returns immediately; the turn runs on the
     * pipeline executor.
     *
     * @return the started turn, or null if the session was already processing
     */
    public PipelineTurn runTurn(VoiceSession session) {
        if (!session.tryStartProcessing()) {
            session.getConnection().send(PipelineEvent.error(BUSY_MESSAGE));
            return null;
        }

        PipelineTurn turn = new PipelineTurn(session);
        session.beginTurn(turn);
        turn.emit(PipelineEvent.processingStarted());

        byte[] audio = audioBufferManager.drain(session);
        if (audio.length == 0) {
            if (turn.fail(NO_AUDIO_MESSAGE)) {
                finish(turn);
            }
            return turn;
        }

        log.info("Starting turn {} for session {} ({} bytes of audio)",
                session.getTurnCount(), session.getSessionId(), audio.length);

        try {
            Future<?> worker = voicePipelineExecutor.submit(() -> execute(turn, audio));
            ScheduledFuture<?> deadline = taskScheduler.schedule(
                    () -> onProcessingTimeout(turn),
                    Instant.now().plusMillis(properties.getProcessingTimeoutMs()));
            turn.attach(worker, deadline);
        } catch (TaskRejectedException e) {
            log.error("Voice pipeline executor rejected turn for session {}", session.getSessionId(), e);
            if (turn.fail(OVERLOADED_MESSAGE)) {
                finish(turn);
            }
        }
        return turn;
    }

    void execute(PipelineTurn turn, byte[] audio) {
        VoiceSession session = turn.getSession();
        String sessionId = session.getSessionId();

        try {
            String transcript = speechToTextService.transcribe(audio);
            if (transcript == null || transcript.isBlank()) {
                throw new VoiceSessionException(NO_SPEECH_MESSAGE, sessionId);
            }
            transcript = transcript.trim();
            turn.ensureActive();
            turn.emit(PipelineEvent.transcript(transcript));
            stageCompleted(turn);

            String response = dialogueOrchestrator.respond(turn, transcript);
            if (response == null || response.isBlank()) {
                throw new VoiceSessionException(NO_RESPONSE_MESSAGE, sessionId);
            }
            turn.ensureActive();
            turn.emit(PipelineEvent.responseText(response));
            stageCompleted(turn);

            speechSynthesisStreamer.stream(turn, response);

            if (turn.complete(PipelineEvent.processingComplete())) {
                log.info("Completed turn for session {} in {} ms", sessionId, turn.elapsedMillis());
                finish(turn);
            }
        } catch (TurnCancelledException e) {
            log.debug("Worker for session {} stopped: turn is {}", sessionId, turn.getState());
        } catch (VoiceSessionException e) {
            log.warn("Turn for session {} ended early: {}", sessionId, e.getMessage());
            if (turn.fail(e.getMessage())) {
                finish(turn);
            }
        } catch (PipelineStageException e) {
            if (turn.isActive()) {
                log.error("Voice pipeline {} stage failed for session {}", e.getStage(), sessionId, e);
            }
            if (turn.fail(e.getMessage())) {
                finish(turn);
            }
        } catch (RuntimeException e) {
            log.error("Unexpected voice pipeline failure for session {}", sessionId, e);
            if (turn.fail("Processing failed: " + e.getMessage())) {
                finish(turn);
            }
        }
    }

    void onProcessingTimeout(PipelineTurn turn) {
        if (turn.expire(TIMEOUT_MESSAGE)) {
            log.warn("Turn for session {} exceeded {} ms, cancelled",
                    turn.getSession().getSessionId(), properties.getProcessingTimeoutMs());
            finish(turn);
        }
    }

    // Every finished stage counts as session activity
    private void stageCompleted(PipelineTurn turn) {
        VoiceSession session = turn.getSession();
        if (turn.isActive() && !session.isClosed()) {
            sessionTimeoutSupervisor.arm(session);
        }
    }

    /**
     * Run exactly once per turn by whichever party ended it.
     */
    private void finish(PipelineTurn turn) {
        VoiceSession session = turn.getSession();
        session.endTurn(turn);
        if (!session.isClosed()) {
            sessionTimeoutSupervisor.arm(session);
        }
    }
}
