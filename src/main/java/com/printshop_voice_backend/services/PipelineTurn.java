package com.printshop_voice_backend.services;

import com.printshop_voice_backend.dto.ConversationMessage;
import com.printshop_voice_backend.dto.PipelineEvent;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.Future;

/**
 * One stop_recording-triggered run of STT, dialogue and synthesis.
 * <p>
 * The turn leaves RUNNING exactly once. Whoever performs that transition owns the
 * terminal frame and the session cleanup; every event emitted afterwards is dropped.
 */
@Slf4j
public class PipelineTurn {

    public enum State {
        RUNNING,
        COMPLETED,
        TIMED_OUT,
        ABANDONED
    }

    private final VoiceSession session;
    private final long startedAtMillis = System.currentTimeMillis();

    // Guarded by this
    private State state = State.RUNNING;
    private Future<?> worker;
    private Future<?> deadline;

    public PipelineTurn(VoiceSession session) {
        this.session = session;
    }

    public VoiceSession getSession() {
        return session;
    }

    public synchronized State getState() {
        return state;
    }

    public synchronized boolean isActive() {
        return state == State.RUNNING;
    }

    public long elapsedMillis() {
        return System.currentTimeMillis() - startedAtMillis;
    }

    public synchronized void attach(Future<?> worker, Future<?> deadline) {
        this.worker = worker;
        this.deadline = deadline;
        if (state != State.RUNNING) {
            cancelTasks();
        }
    }

    /**
     * Send an intermediate event if the turn is still running.
     */
    public synchronized boolean emit(PipelineEvent event) {
        if (state != State.RUNNING) {
            log.debug("Dropping {} for session {}: turn is {}", event.getType(), session.getSessionId(), state);
            return false;
        }
        return session.getConnection().send(event);
    }

    /**
     * Append entries to the session history if the turn is still running.
     * A turn that lost the race never touches the history again.
     */
    public synchronized boolean commit(List<ConversationMessage> entries) {
        if (state != State.RUNNING) {
            log.debug("Discarding {} history entries for session {}: turn is {}",
                    entries.size(), session.getSessionId(), state);
            return false;
        }
        ConversationHistory history = session.getHistory();
        for (ConversationMessage entry : entries) {
            history.append(entry);
        }
        return true;
    }

    /**
     * Throws if the turn has been timed out or abandoned, so the worker stops early.
     */
    public void ensureActive() {
        if (!isActive() || Thread.currentThread().isInterrupted()) {
            throw new TurnCancelledException(session.getSessionId());
        }
    }

    public synchronized boolean complete(PipelineEvent finalEvent) {
        if (!transition(State.COMPLETED)) {
            return false;
        }
        session.getConnection().send(finalEvent);
        return true;
    }

    public synchronized boolean fail(String message) {
        if (!transition(State.COMPLETED)) {
            return false;
        }
        session.getConnection().send(PipelineEvent.error(message));
        return true;
    }

    public synchronized boolean expire(String message) {
        if (!transition(State.TIMED_OUT)) {
            return false;
        }
        session.getConnection().send(PipelineEvent.error(message));
        return true;
    }

    public synchronized boolean abandon() {
        return transition(State.ABANDONED);
    }

    private boolean transition(State target) {
        if (state != State.RUNNING) {
            return false;
        }
        state = target;
        cancelTasks();
        return true;
    }

    private void cancelTasks() {
        if (deadline != null) {
            deadline.cancel(false);
        }
        // The worker is only interrupted when it lost the race; a completing worker is finishing anyway.
        if (worker != null && state != State.COMPLETED) {
            worker.cancel(true);
        }
    }

    /**
     * Raised inside a worker whose turn is no longer running.
     */
    public static class TurnCancelledException extends RuntimeException {
        public TurnCancelledException(String sessionId) {
            super("Turn no longer active for session " + sessionId);
        }
    }
}
