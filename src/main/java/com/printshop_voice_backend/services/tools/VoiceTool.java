package com.printshop_voice_backend.services.tools;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Map;

/**
 * A business operation the language model can invoke by replying with
 * {@code {"tool": "<name>", "params": {...}}}.
 */
public interface VoiceTool {

    /**
     * Name the model uses to select this tool (e.g. "create_quote").
     */
    String getName();

    /**
     * One-line description included in the system prompt.
     */
    String getDescription();

    /**
     * JSON sketch of the expected params object, shown to the model verbatim.
     */
    String getParameterSchema();

    /**
     * Runs the tool.
     *
     * @param params the params object from the model's reply, never null
     * @return a JSON-serialisable result, fed back to the model
     * @throws Exception when the params are invalid or the operation fails
     */
    Map<String, Object> execute(ObjectNode params) throws Exception;
}
