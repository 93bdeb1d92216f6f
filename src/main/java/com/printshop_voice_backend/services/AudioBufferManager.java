package com.printshop_voice_backend.services;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Component
@Slf4j
public class AudioBufferManager {

    /**
     * Buffer an inbound audio frame. Frames arriving while a turn is processing are dropped.
     *
     * @return true if the chunk was buffered
     */
    public boolean accept(VoiceSession session, byte[] chunk) {
        if (session.isProcessing()) {
            log.warn("Dropping {} byte audio chunk for session {}: turn in progress",
                    chunk.length, session.getSessionId());
            return false;
        }

        AudioBuffer buffer = session.getAudioBuffer();
        if (buffer.append(chunk)) {
            log.debug("Audio buffer full for session {}, evicted oldest chunk (max {})",
                    session.getSessionId(), buffer.getMaxChunks());
        }
        return true;
    }

    public byte[] drain(VoiceSession session) {
        AudioBuffer buffer = session.getAudioBuffer();
        int chunkCount = buffer.size();
        byte[] audio = buffer.drain();
        log.debug("Drained {} chunks ({} bytes) for session {}", chunkCount, audio.length, session.getSessionId());
        return audio;
    }

    public void clear(VoiceSession session) {
        session.getAudioBuffer().clear();
    }
}
