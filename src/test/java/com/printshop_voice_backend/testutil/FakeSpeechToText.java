package com.printshop_voice_backend.testutil;

import com.printshop_voice_backend.exceptions.VoicePipelineExceptionHandler.TranscriptionException;
import com.printshop_voice_backend.services.SpeechToTextService;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Test double for SpeechToTextService with canned output, optional delay and failure mode.
 * Fields are mutable so a test can change behaviour between turns.
 */
public class FakeSpeechToText implements SpeechToTextService {

    public volatile String cannedText;
    public volatile long delayMs;
    public volatile boolean shouldFail;

    private final AtomicInteger calls = new AtomicInteger();
    private volatile byte[] lastAudio;

    public FakeSpeechToText(String cannedText) {
        this.cannedText = cannedText;
    }

    @Override
    public String transcribe(byte[] audio) {
        calls.incrementAndGet();
        lastAudio = audio;
        if (delayMs > 0) {
            try {
                Thread.sleep(delayMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new TranscriptionException("Transcription interrupted", e);
            }
        }
        if (shouldFail) {
            throw new TranscriptionException("Transcription failed: simulated outage", null);
        }
        return cannedText;
    }

    public int getCalls() {
        return calls.get();
    }

    public byte[] getLastAudio() {
        return lastAudio;
    }
}
