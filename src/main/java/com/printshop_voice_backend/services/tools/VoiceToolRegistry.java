package com.printshop_voice_backend.services.tools;

import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Central registry of the tools the assistant may call.
 * Execution never throws: failures come back as {@code {"success": false, "error": ...}}.
 */
@Component
@Slf4j
public class VoiceToolRegistry {

    private final Map<String, VoiceTool> tools = new LinkedHashMap<>();

    public VoiceToolRegistry(List<VoiceTool> voiceTools) {
        for (VoiceTool tool : voiceTools) {
            register(tool);
        }
    }

    public VoiceToolRegistry register(VoiceTool tool) {
        if (tool == null) {
            throw new IllegalArgumentException("Tool cannot be null");
        }
        String name = tool.getName();
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Tool name cannot be null or empty");
        }
        if (tools.containsKey(name)) {
            log.warn("Overwriting existing tool: {}", name);
        }
        tools.put(name, tool);
        log.info("Registered voice tool: {}", name);
        return this;
    }

    public boolean hasTool(String name) {
        return tools.containsKey(name);
    }

    public Collection<VoiceTool> getTools() {
        return tools.values();
    }

    public Map<String, Object> execute(String toolName, ObjectNode params) {
        VoiceTool tool = tools.get(toolName);
        if (tool == null) {
            log.warn("No tool registered with name: {}", toolName);
            return failure("Unknown tool: " + toolName);
        }

        try {
            log.info("Invoking tool: {}", toolName);
            Map<String, Object> result = tool.execute(params);
            return result != null ? result : failure("Tool returned no result");
        } catch (Exception e) {
            log.error("Error invoking tool: {}", toolName, e);
            return failure(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    /**
     * Tool catalog as it appears in the system prompt.
     */
    public String describeTools() {
        StringBuilder description = new StringBuilder();
        for (VoiceTool tool : tools.values()) {
            description.append("- ").append(tool.getName()).append(": ").append(tool.getDescription()).append('\n')
                    .append("  params: ").append(tool.getParameterSchema()).append('\n');
        }
        return description.toString();
    }

    private static Map<String, Object> failure(String error) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("success", false);
        result.put("error", error);
        return result;
    }
}
