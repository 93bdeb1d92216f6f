package com.printshop_voice_backend.services;

public interface SpeechToTextService {

    /**
     * Transcribe one recorded utterance.
     *
     * @param audio the concatenated recording as sent by the browser (webm/opus by default)
     * @return the transcript, possibly blank when nothing was said
     * @throws com.printshop_voice_backend.exceptions.VoicePipelineExceptionHandler.TranscriptionException
     *         when the provider call fails
     */
    String transcribe(byte[] audio);
}
