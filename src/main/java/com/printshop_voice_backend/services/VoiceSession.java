package com.printshop_voice_backend.services;

import com.printshop_voice_backend.websocket.ClientConnection;
import lombok.Getter;

import java.time.LocalDateTime;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.LongFunction;

/**
 * Live state of one connected voice client.
 */
public class VoiceSession {

    @Getter
    private final String sessionId;
    @Getter
    private final ClientConnection connection;
    @Getter
    private final AudioBuffer audioBuffer;
    @Getter
    private final ConversationHistory history;
    @Getter
    private final LocalDateTime createdAt;

    @Getter
    private volatile LocalDateTime lastActivityAt;
    @Getter
    private volatile PipelineTurn currentTurn;

    private final AtomicBoolean processing = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicInteger turnCount = new AtomicInteger();

    // Guarded by this
    private ScheduledFuture<?> idleTimer;
    private long idleTimerGeneration;

    public VoiceSession(String sessionId, ClientConnection connection, AudioBuffer audioBuffer,
                        ConversationHistory history) {
        this.sessionId = sessionId;
        this.connection = connection;
        this.audioBuffer = audioBuffer;
        this.history = history;
        this.createdAt = LocalDateTime.now();
        this.lastActivityAt = createdAt;
    }

    public boolean isProcessing() {
        return processing.get();
    }

    public boolean isClosed() {
        return closed.get();
    }

    public int getTurnCount() {
        return turnCount.get();
    }

    public boolean tryStartProcessing() {
        return processing.compareAndSet(false, true);
    }

    public void finishProcessing() {
        processing.set(false);
    }

    public synchronized void beginTurn(PipelineTurn turn) {
        this.currentTurn = turn;
        turnCount.incrementAndGet();
    }

    /**
     * Ends the given turn and clears the processing flag, unless another turn has
     * already replaced it (after a reset).
     *
     * @return true if the turn was still the current one
     */
    public synchronized boolean endTurn(PipelineTurn turn) {
        if (currentTurn != turn) {
            return false;
        }
        currentTurn = null;
        processing.set(false);
        return true;
    }

    public void touch() {
        this.lastActivityAt = LocalDateTime.now();
    }

    /**
     * Cancel the pending idle timer, if any, and install the one produced by {@code scheduler}.
     * The scheduler receives the new timer's generation so the timer can check it is still current.
     *
     * @return false if the session is already closed and nothing was scheduled
     */
    public synchronized boolean rearmIdleTimer(LongFunction<ScheduledFuture<?>> scheduler) {
        if (closed.get()) {
            return false;
        }
        if (idleTimer != null) {
            idleTimer.cancel(false);
        }
        long generation = ++idleTimerGeneration;
        idleTimer = scheduler.apply(generation);
        return true;
    }

    public synchronized boolean isCurrentIdleTimer(long generation) {
        return !closed.get() && generation == idleTimerGeneration;
    }

    public synchronized void cancelIdleTimer() {
        if (idleTimer != null) {
            idleTimer.cancel(false);
            idleTimer = null;
        }
        idleTimerGeneration++;
    }

    public synchronized boolean hasPendingIdleTimer() {
        return idleTimer != null && !idleTimer.isDone();
    }

    /**
     * Mark closed and release everything the session holds. Safe to call more than once.
     *
     * @return true on the first call
     */
    public boolean release() {
        if (!closed.compareAndSet(false, true)) {
            return false;
        }
        cancelIdleTimer();
        PipelineTurn turn = currentTurn;
        if (turn != null) {
            turn.abandon();
        }
        audioBuffer.clear();
        history.clear();
        processing.set(false);
        return true;
    }
}
