package com.printshop_voice_backend.services;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.printshop_voice_backend.config.VoiceAIConfig;
import com.printshop_voice_backend.dto.ConversationMessage;
import com.printshop_voice_backend.exceptions.VoicePipelineExceptionHandler.LanguageModelException;
import com.printshop_voice_backend.services.tools.VoiceToolRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Runs the language-model side of a turn: record the utterance, ask the model, and if it
 * asks for a tool, run that tool once and ask the model to summarise the result.
 * Only a turn that is still running may write to the session history.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DialogueOrchestrator {

    public static final String MALFORMED_TOOL_CALL_REPLY =
            "Sorry, I had trouble understanding that request. Could you say it again?";
    public static final String TOOL_RESULT_PREFIX = "Tool executed: ";

    private final LanguageModelService languageModelService;
    private final ToolCallParser toolCallParser;
    private final VoiceToolRegistry toolRegistry;
    private final VoiceAIConfig voiceAIConfig;
    private final ObjectMapper objectMapper;

    /**
     * The user's utterance is committed up front. Tool results and replies are built on a
     * working copy and committed only if the turn is still running at the end.
     *
     * @return the text to speak back, possibly blank if the model produced nothing
     * @throws LanguageModelException if the first model call fails
     * @throws PipelineTurn.TurnCancelledException if the turn ended while the dialogue was running
     */
    public String respond(PipelineTurn turn, String transcript) {
        commit(turn, List.of(ConversationMessage.user(transcript)));
        ConversationHistory working = turn.getSession().getHistory().copy();
        List<ConversationMessage> pending = new ArrayList<>();

        String systemPrompt = buildSystemPrompt();
        String reply = languageModelService.complete(systemPrompt, working.snapshot());
        ModelReply parsed = toolCallParser.parse(reply);

        String spoken;
        if (parsed instanceof ModelReply.ToolCall) {
            spoken = runTool(turn, working, pending, systemPrompt, (ModelReply.ToolCall) parsed);
        } else if (parsed instanceof ModelReply.MalformedToolCall) {
            spoken = MALFORMED_TOOL_CALL_REPLY;
            record(working, pending, spoken);
        } else {
            spoken = parsed.getRawText();
            record(working, pending, spoken);
        }

        commit(turn, pending);
        return spoken;
    }

    private String runTool(PipelineTurn turn, ConversationHistory working, List<ConversationMessage> pending,
                           String systemPrompt, ModelReply.ToolCall call) {
        if (call.isParamsDefaulted()) {
            log.warn("Tool call to {} had no params object, using {}", call.getToolName(), "{}");
        }

        turn.ensureActive();
        Map<String, Object> result = toolRegistry.execute(call.getToolName(), call.getParams());
        record(working, pending, TOOL_RESULT_PREFIX + toJson(result));

        turn.ensureActive();
        String followUp;
        try {
            followUp = languageModelService.complete(systemPrompt, working.snapshot());
        } catch (LanguageModelException e) {
            log.error("Follow-up after tool {} failed", call.getToolName(), e);
            followUp = toolFailureApology(call.getToolName());
        }

        // A second tool request is not executed; its text is spoken as-is
        record(working, pending, followUp);
        return followUp;
    }

    private void record(ConversationHistory working, List<ConversationMessage> pending, String assistantText) {
        if (assistantText != null && !assistantText.isBlank()) {
            ConversationMessage message = ConversationMessage.assistant(assistantText);
            working.append(message);
            pending.add(message);
        }
    }

    private void commit(PipelineTurn turn, List<ConversationMessage> entries) {
        if (!turn.commit(entries)) {
            throw new PipelineTurn.TurnCancelledException(turn.getSession().getSessionId());
        }
    }

    String buildSystemPrompt() {
        return voiceAIConfig.getSystemPrompt()
                + "\nAvailable tools:\n"
                + toolRegistry.describeTools()
                + "\nTo use a tool, reply with only a JSON object of the form "
                + "{\"tool\": \"<tool name>\", \"params\": {...}}. "
                + "Otherwise reply in plain spoken sentences.";
    }

    static String toolFailureApology(String toolName) {
        return "Sorry, I ran into a problem while handling the " + toolName.replace('_', ' ')
                + " request. Please try again.";
    }

    private String toJson(Map<String, Object> result) {
        try {
            return objectMapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialise tool result, falling back to toString: {}", e.getMessage());
            return String.valueOf(result);
        }
    }
}
