package com.printshop_voice_backend.services;

import com.printshop_voice_backend.dto.PipelineEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Base64;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Forwards synthesized audio to the client chunk by chunk, then marks the end of the stream.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SpeechSynthesisStreamer {

    private final TextToSpeechService textToSpeechService;

    public void stream(PipelineTurn turn, String text) {
        AtomicInteger chunkCount = new AtomicInteger();

        textToSpeechService.streamSpeech(text, chunk -> {
            turn.ensureActive();
            turn.emit(PipelineEvent.audioChunk(Base64.getEncoder().encodeToString(chunk)));
            chunkCount.incrementAndGet();
        });

        turn.emit(PipelineEvent.audioComplete());
        log.debug("Sent {} audio chunks to session {}", chunkCount.get(), turn.getSession().getSessionId());
    }
}
