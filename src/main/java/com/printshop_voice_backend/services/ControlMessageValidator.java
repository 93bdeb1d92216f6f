package com.printshop_voice_backend.services;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.printshop_voice_backend.dto.ControlMessage;
import com.printshop_voice_backend.dto.ControlType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Decides whether an inbound frame is a control command, a malformed command, or audio.
 * Anything that is not valid JSON is audio; valid JSON must be a well-formed control object.
 */
@Component
@Slf4j
public class ControlMessageValidator {

    public static final String INVALID_MESSAGE = "Invalid message format";

    private final ObjectMapper objectMapper = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    public FrameClassification classify(String text) {
        return classify(text.getBytes(StandardCharsets.UTF_8));
    }

    public FrameClassification classify(byte[] payload) {
        if (payload == null || payload.length == 0) {
            return FrameClassification.audio(payload == null ? new byte[0] : payload);
        }

        JsonNode node;
        try {
            node = objectMapper.readTree(payload);
        } catch (IOException e) {
            // Not JSON: treat as audio
            return FrameClassification.audio(payload);
        }

        if (node == null || node.isMissingNode()) {
            return FrameClassification.audio(payload);
        }

        return validate(node)
                .map(FrameClassification::control)
                .orElseGet(FrameClassification::invalid);
    }

    private Optional<ControlMessage> validate(JsonNode node) {
        if (!node.isObject()) {
            log.warn("Rejecting control frame: not a JSON object");
            return Optional.empty();
        }

        JsonNode type = node.get("type");
        if (type == null || !type.isTextual()) {
            log.warn("Rejecting control frame: missing or non-string type");
            return Optional.empty();
        }

        Optional<ControlType> controlType = ControlType.fromWireName(type.asText());
        if (controlType.isEmpty()) {
            log.warn("Rejecting control frame: unknown type '{}'", type.asText());
            return Optional.empty();
        }

        return Optional.of(new ControlMessage(controlType.get(), node.get("data")));
    }

    public static final class FrameClassification {

        public enum Kind {
            CONTROL,
            AUDIO,
            INVALID
        }

        private final Kind kind;
        private final ControlMessage controlMessage;
        private final byte[] audio;

        private FrameClassification(Kind kind, ControlMessage controlMessage, byte[] audio) {
            this.kind = kind;
            this.controlMessage = controlMessage;
            this.audio = audio;
        }

        static FrameClassification control(ControlMessage message) {
            return new FrameClassification(Kind.CONTROL, message, null);
        }

        static FrameClassification audio(byte[] audio) {
            return new FrameClassification(Kind.AUDIO, null, audio);
        }

        static FrameClassification invalid() {
            return new FrameClassification(Kind.INVALID, null, null);
        }

        public Kind getKind() {
            return kind;
        }

        public ControlMessage getControlMessage() {
            return controlMessage;
        }

        public byte[] getAudio() {
            return audio;
        }
    }
}
