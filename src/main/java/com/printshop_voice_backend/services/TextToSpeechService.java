package com.printshop_voice_backend.services;

import java.util.function.Consumer;

public interface TextToSpeechService {

    /**
     * Synthesize {@code text}, handing each audio chunk to {@code chunkConsumer} as soon as it arrives.
     * Returns once the provider's stream ends.
     */
    void streamSpeech(String text, Consumer<byte[]> chunkConsumer);
}
