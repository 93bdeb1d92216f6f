package com.printshop_voice_backend.services;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.printshop_voice_backend.config.VoiceAIConfig;
import com.printshop_voice_backend.dto.ConversationMessage;
import com.printshop_voice_backend.dto.ConversationRole;
import com.printshop_voice_backend.exceptions.VoicePipelineExceptionHandler.LanguageModelException;
import com.printshop_voice_backend.services.tools.VoiceTool;
import com.printshop_voice_backend.services.PipelineTurn.TurnCancelledException;
import com.printshop_voice_backend.services.tools.VoiceToolRegistry;
import com.printshop_voice_backend.testutil.RecordingClientConnection;
import com.printshop_voice_backend.testutil.ScriptedLanguageModel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DialogueOrchestratorTest {

    private ConversationHistory history;
    private VoiceSession session;
    private AtomicReference<ObjectNode> lastParams;
    private AtomicReference<PipelineTurn> runningTurn;
    private VoiceToolRegistry registry;

    @BeforeEach
    void setUp() {
        history = new ConversationHistory(20, 2);
        session = new VoiceSession("d-1", new RecordingClientConnection("d-1"), new AudioBuffer(10), history);
        lastParams = new AtomicReference<>();
        runningTurn = new AtomicReference<>();
        registry = new VoiceToolRegistry(List.of(
                new EchoTool(lastParams), new BrokenTool(), new AbandoningTool(runningTurn)));
    }

    @Test
    void plainReplyIsRecordedAndReturned() {
        ScriptedLanguageModel model = new ScriptedLanguageModel("We can do that. How many shirts?");

        String reply = orchestrator(model).respond(turn(), "I need some t-shirts");

        assertThat(reply).isEqualTo("We can do that. How many shirts?");
        List<ConversationMessage> entries = history.snapshot();
        assertThat(entries).extracting(ConversationMessage::getRole)
                .containsExactly(ConversationRole.USER, ConversationRole.ASSISTANT);
        assertThat(model.getCallCount()).isEqualTo(1);
    }

    @Test
    void toolCallRunsToolOnceAndReturnsFollowUp() {
        ScriptedLanguageModel model = new ScriptedLanguageModel(
                "{\"tool\": \"echo\", \"params\": {\"value\": \"blue\"}}",
                "The echo tool said blue.");

        String reply = orchestrator(model).respond(turn(), "echo blue");

        assertThat(reply).isEqualTo("The echo tool said blue.");
        assertThat(lastParams.get().get("value").asText()).isEqualTo("blue");
        assertThat(model.getCallCount()).isEqualTo(2);

        List<ConversationMessage> followUpRequest = model.getRequest(1);
        assertThat(followUpRequest.get(followUpRequest.size() - 1).getContent())
                .startsWith(DialogueOrchestrator.TOOL_RESULT_PREFIX)
                .contains("\"success\":true")
                .contains("\"echo\":\"blue\"");
        assertThat(history.snapshot()).hasSize(3);
    }

    @Test
    void followUpToolCallIsNotExecuted() {
        String secondCall = "{\"tool\": \"echo\", \"params\": {\"value\": \"again\"}}";
        ScriptedLanguageModel model = new ScriptedLanguageModel(
                "{\"tool\": \"echo\", \"params\": {\"value\": \"first\"}}",
                secondCall);

        String reply = orchestrator(model).respond(turn(), "echo twice");

        assertThat(reply).isEqualTo(secondCall);
        assertThat(lastParams.get().get("value").asText()).isEqualTo("first");
        assertThat(model.getCallCount()).isEqualTo(2);
    }

    @Test
    void failingToolResultIsStillSummarised() {
        ScriptedLanguageModel model = new ScriptedLanguageModel(
                "{\"tool\": \"broken\", \"params\": {}}",
                "I couldn't finish that.");

        String reply = orchestrator(model).respond(turn(), "break it");

        assertThat(reply).isEqualTo("I couldn't finish that.");
        assertThat(model.getRequest(1).get(1).getContent())
                .contains("\"success\":false")
                .contains("database unavailable");
    }

    @Test
    void unknownToolIsReportedToModel() {
        ScriptedLanguageModel model = new ScriptedLanguageModel(
                "{\"tool\": \"teleport\", \"params\": {}}",
                "I can't do that.");

        orchestrator(model).respond(turn(), "teleport me");

        assertThat(model.getRequest(1).get(1).getContent()).contains("Unknown tool: teleport");
    }

    @Test
    void followUpFailureBecomesSpokenApology() {
        ScriptedLanguageModel model = new ScriptedLanguageModel(
                "{\"tool\": \"echo\", \"params\": {\"value\": \"x\"}}",
                null);

        String reply = orchestrator(model).respond(turn(), "echo x");

        assertThat(reply).isEqualTo(DialogueOrchestrator.toolFailureApology("echo"));
        assertThat(reply).startsWith("Sorry, I ran into a problem while");
    }

    @Test
    void malformedToolCallBecomesApology() {
        ScriptedLanguageModel model = new ScriptedLanguageModel("{\"tool\": \"echo\", \"params\": {");

        String reply = orchestrator(model).respond(turn(), "do something");

        assertThat(reply).isEqualTo(DialogueOrchestrator.MALFORMED_TOOL_CALL_REPLY);
        assertThat(lastParams.get()).isNull();
        assertThat(model.getCallCount()).isEqualTo(1);
    }

    @Test
    void firstModelFailurePropagates() {
        ScriptedLanguageModel model = new ScriptedLanguageModel((String) null);

        assertThatThrownBy(() -> orchestrator(model).respond(turn(), "hello"))
                .isInstanceOf(LanguageModelException.class);
    }

    @Test
    void blankReplyIsReturnedButNotRecorded() {
        ScriptedLanguageModel model = new ScriptedLanguageModel("   ");

        String reply = orchestrator(model).respond(turn(), "hello");

        assertThat(reply).isBlank();
        assertThat(history.snapshot()).hasSize(1);
    }

    @Test
    void historyStaysBoundedOverManyTurns() {
        ScriptedLanguageModel model = new ScriptedLanguageModel(
                "{\"tool\": \"echo\", \"params\": {\"value\": \"v\"}}", "done");
        DialogueOrchestrator orchestrator = orchestrator(model);

        for (int i = 0; i < 30; i++) {
            orchestrator.respond(turn(), "turn " + i);
            assertThat(history.size()).isLessThanOrEqualTo(20);
        }
    }

    @Test
    void turnEndedDuringToolLeavesOnlyUtteranceInHistory() {
        ScriptedLanguageModel model = new ScriptedLanguageModel(
                "{\"tool\": \"abandon\", \"params\": {}}",
                "This follow-up is never requested.");
        PipelineTurn turn = turn();
        runningTurn.set(turn);

        assertThatThrownBy(() -> orchestrator(model).respond(turn, "start over"))
                .isInstanceOf(TurnCancelledException.class);

        assertThat(model.getCallCount()).isEqualTo(1);
        assertThat(history.snapshot()).extracting(ConversationMessage::getContent)
                .containsExactly("start over");
    }

    @Test
    void endedTurnDoesNotRecordUtterance() {
        ScriptedLanguageModel model = new ScriptedLanguageModel("hello");
        PipelineTurn turn = turn();
        turn.expire("Processing timeout");

        assertThatThrownBy(() -> orchestrator(model).respond(turn, "anyone there?"))
                .isInstanceOf(TurnCancelledException.class);

        assertThat(history.size()).isZero();
        assertThat(model.getCallCount()).isZero();
    }

    @Test
    void systemPromptListsTools() {
        String prompt = orchestrator(new ScriptedLanguageModel("ok")).buildSystemPrompt();

        assertThat(prompt).contains("Jarvis").contains("- echo:").contains("- broken:").contains("\"tool\"");
    }

    private PipelineTurn turn() {
        return new PipelineTurn(session);
    }

    private DialogueOrchestrator orchestrator(ScriptedLanguageModel model) {
        return new DialogueOrchestrator(model, new ToolCallParser(), registry, new VoiceAIConfig(), new ObjectMapper());
    }

    private static class EchoTool implements VoiceTool {
        private final AtomicReference<ObjectNode> lastParams;

        EchoTool(AtomicReference<ObjectNode> lastParams) {
            this.lastParams = lastParams;
        }

        @Override
        public String getName() {
            return "echo";
        }

        @Override
        public String getDescription() {
            return "Echo a value";
        }

        @Override
        public String getParameterSchema() {
            return "{\"value\": string}";
        }

        @Override
        public Map<String, Object> execute(ObjectNode params) {
            lastParams.set(params);
            return Map.of("success", true, "echo", params.path("value").asText());
        }
    }

    private static class AbandoningTool implements VoiceTool {
        private final AtomicReference<PipelineTurn> turn;

        AbandoningTool(AtomicReference<PipelineTurn> turn) {
            this.turn = turn;
        }

        @Override
        public String getName() {
            return "abandon";
        }

        @Override
        public String getDescription() {
            return "Ends the running turn, as a reset would";
        }

        @Override
        public String getParameterSchema() {
            return "{}";
        }

        @Override
        public Map<String, Object> execute(ObjectNode params) {
            turn.get().abandon();
            return Map.of("success", true);
        }
    }

    private static class BrokenTool implements VoiceTool {
        @Override
        public String getName() {
            return "broken";
        }

        @Override
        public String getDescription() {
            return "Always fails";
        }

        @Override
        public String getParameterSchema() {
            return "{}";
        }

        @Override
        public Map<String, Object> execute(ObjectNode params) {
            throw new IllegalStateException("database unavailable");
        }
    }
}
