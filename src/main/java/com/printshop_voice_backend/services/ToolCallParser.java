package com.printshop_voice_backend.services;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Finds a {@code {"tool": ..., "params": {...}}} object in free-form model output.
 * <p>
 * The first balanced JSON object that parses and carries a non-blank {@code tool} string wins,
 * wherever it sits in the reply (code fences and surrounding prose are ignored). A reply that
 * mentions a {@code "tool"} key without such an object is reported as malformed.
 */
@Component
@Slf4j
public class ToolCallParser {

    private static final Pattern TOOL_MARKER = Pattern.compile("\"tool\"\\s*:");

    private final ObjectMapper objectMapper = new ObjectMapper();

    public ModelReply parse(String reply) {
        if (reply == null) {
            return new ModelReply.PlainText("");
        }
        if (!TOOL_MARKER.matcher(reply).find()) {
            return new ModelReply.PlainText(reply);
        }

        for (int start = reply.indexOf('{'); start >= 0; start = reply.indexOf('{', start + 1)) {
            int end = findBlockEnd(reply, start);
            if (end < 0) {
                continue;
            }

            ModelReply.ToolCall call = toToolCall(reply, reply.substring(start, end + 1));
            if (call != null) {
                return call;
            }
        }

        log.warn("Model reply mentions a tool but contains no readable tool call");
        return new ModelReply.MalformedToolCall(reply);
    }

    private ModelReply.ToolCall toToolCall(String reply, String candidate) {
        JsonNode node;
        try {
            node = objectMapper.readTree(candidate);
        } catch (JsonProcessingException e) {
            return null;
        }

        if (node == null || !node.isObject()) {
            return null;
        }
        JsonNode tool = node.get("tool");
        if (tool == null || !tool.isTextual() || tool.asText().isBlank()) {
            return null;
        }

        JsonNode params = node.get("params");
        if (params instanceof ObjectNode) {
            return new ModelReply.ToolCall(reply, tool.asText().trim(), (ObjectNode) params, false);
        }
        return new ModelReply.ToolCall(reply, tool.asText().trim(), objectMapper.createObjectNode(), true);
    }

    /**
     * Index of the brace closing the object opened at {@code start}, or -1 if it never closes.
     * Braces inside string literals do not count.
     */
    static int findBlockEnd(String text, int start) {
        int depth = 0;
        boolean inString = false;
        boolean escaped = false;

        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }

            if (c == '"') {
                inString = true;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }
}
