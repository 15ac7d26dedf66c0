package me.golemcore.agentloop.adapter.outbound.llm;

import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.TokenUsage;
import me.golemcore.agentloop.domain.model.FunctionCallResult;
import me.golemcore.agentloop.domain.model.FunctionSpec;
import me.golemcore.agentloop.domain.model.LlmCompletion;
import me.golemcore.agentloop.domain.model.LlmMessage;
import me.golemcore.agentloop.infrastructure.config.AgentLoopProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class Langchain4jLlmAdapterTest {

    private static final String MODEL = "gpt-4o-mini";

    private ChatModel chatModel;
    private AgentLoopProperties properties;
    private Langchain4jLlmAdapter adapter;

    @BeforeEach
    void setUp() {
        chatModel = mock(ChatModel.class);
        properties = new AgentLoopProperties();
        properties.getLlm().setModel(MODEL);
        adapter = new Langchain4jLlmAdapter(properties, chatModel);
    }

    // ==================== complete ====================

    @Test
    void shouldReturnTextAndUsage() {
        when(chatModel.chat(anyList())).thenReturn(ChatResponse.builder()
                .aiMessage(AiMessage.from("{\"thoughts\":\"ok\"}"))
                .tokenUsage(new TokenUsage(12, 8))
                .build());

        LlmCompletion completion = adapter.complete(List.of(LlmMessage.user("hi"))).join();

        assertEquals("{\"thoughts\":\"ok\"}", completion.getContent());
        assertEquals(12, completion.getUsage().getInputTokens());
        assertEquals(8, completion.getUsage().getOutputTokens());
        assertEquals(20, completion.getUsage().getTotalTokens());
        assertEquals(MODEL, completion.getUsage().getModel());
    }

    @Test
    void shouldLeaveUsageEmptyWhenModelReportsNone() {
        when(chatModel.chat(anyList())).thenReturn(ChatResponse.builder()
                .aiMessage(AiMessage.from("plain"))
                .build());

        LlmCompletion completion = adapter.complete(List.of(LlmMessage.user("hi"))).join();

        assertEquals("plain", completion.getContent());
        assertNull(completion.getUsage());
    }

    @Test
    void shouldFailFutureOnNonRetriableError() {
        RuntimeException failure = new RuntimeException("invalid api key");
        when(chatModel.chat(anyList())).thenThrow(failure);

        CompletionException error = assertThrows(CompletionException.class,
                () -> adapter.complete(List.of(LlmMessage.user("hi"))).join());

        assertSame(failure, error.getCause());
        verify(chatModel, times(1)).chat(anyList());
    }

    @Test
    void shouldRequireApiKeyWhenNoModelIsInjected() {
        Langchain4jLlmAdapter unconfigured = new Langchain4jLlmAdapter(properties);

        CompletionException error = assertThrows(CompletionException.class,
                () -> unconfigured.complete(List.of(LlmMessage.user("hi"))).join());

        assertInstanceOf(IllegalStateException.class, error.getCause());
        assertEquals("LLM provider not configured. Set agent.llm.api-key", error.getCause().getMessage());
    }

    // ==================== function calling ====================

    @Test
    void shouldReturnFirstRequestedFunction() {
        ToolExecutionRequest request = ToolExecutionRequest.builder()
                .id("call-1")
                .name("web_search")
                .arguments("{\"query\":\"java\"}")
                .build();
        when(chatModel.chat(any(ChatRequest.class))).thenReturn(ChatResponse.builder()
                .aiMessage(AiMessage.from(request))
                .tokenUsage(new TokenUsage(5, 3))
                .build());

        FunctionCallResult result = adapter.completeWithFunctions(List.of(LlmMessage.user("search")),
                List.of(searchFunction())).join();

        assertTrue(result.hasFunctionCall());
        assertEquals("web_search", result.getFunctionName());
        assertEquals("{\"query\":\"java\"}", result.getArgumentsJson());
        assertEquals(8, result.getUsage().getTotalTokens());

        ArgumentCaptor<ChatRequest> captor = ArgumentCaptor.forClass(ChatRequest.class);
        verify(chatModel).chat(captor.capture());
        assertEquals(1, captor.getValue().toolSpecifications().size());
        assertEquals("web_search", captor.getValue().toolSpecifications().get(0).name());
        assertEquals(1, captor.getValue().messages().size());
    }

    @Test
    void shouldReturnTextWhenNoFunctionRequested() {
        when(chatModel.chat(any(ChatRequest.class))).thenReturn(ChatResponse.builder()
                .aiMessage(AiMessage.from("just text"))
                .build());

        FunctionCallResult result = adapter.completeWithFunctions(List.of(LlmMessage.user("search")),
                List.of(searchFunction())).join();

        assertFalse(result.hasFunctionCall());
        assertEquals("just text", result.getAssistantContent());
        assertTrue(adapter.supportsFunctionCalling());
    }

    // ==================== conversion ====================

    @Test
    void shouldConvertRolesAndSkipEmptyMessages() {
        List<ChatMessage> converted = adapter.convertMessages(List.of(
                LlmMessage.system("rules"),
                LlmMessage.builder().role(LlmMessage.ROLE_ASSISTANT).content("earlier reply").build(),
                LlmMessage.user("question"),
                LlmMessage.builder().role("tool").content("odd role").build(),
                LlmMessage.builder().content("no role").build(),
                LlmMessage.builder().role(LlmMessage.ROLE_USER).content(null).build(),
                LlmMessage.user("   ")));

        assertEquals(5, converted.size());
        assertEquals("rules", ((SystemMessage) converted.get(0)).text());
        assertEquals("earlier reply", ((AiMessage) converted.get(1)).text());
        assertEquals("question", ((UserMessage) converted.get(2)).singleText());
        assertEquals("odd role", ((UserMessage) converted.get(3)).singleText());
        assertEquals("no role", ((UserMessage) converted.get(4)).singleText());
    }

    @Test
    void shouldConvertFunctionSchema() {
        ToolSpecification spec = adapter.convertFunction(searchFunction());

        assertEquals("web_search", spec.name());
        assertEquals("Search the web", spec.description());
        JsonObjectSchema parameters = spec.parameters();
        assertEquals(List.of("query"), parameters.required());
        assertInstanceOf(JsonStringSchema.class, parameters.properties().get("query"));
        assertInstanceOf(JsonIntegerSchema.class, parameters.properties().get("limit"));
        assertInstanceOf(JsonEnumSchema.class, parameters.properties().get("engine"));
        JsonArraySchema tags = assertInstanceOf(JsonArraySchema.class, parameters.properties().get("tags"));
        assertInstanceOf(JsonStringSchema.class, tags.items());
        JsonObjectSchema filter = assertInstanceOf(JsonObjectSchema.class, parameters.properties().get("filter"));
        assertInstanceOf(JsonIntegerSchema.class, filter.properties().get("year"));
    }

    @Test
    void shouldOmitParametersWithoutSchema() {
        ToolSpecification spec = adapter.convertFunction(FunctionSpec.builder()
                .name("now")
                .description("Current time")
                .build());

        assertEquals("now", spec.name());
        assertNull(spec.parameters());
    }

    // ==================== rate limits ====================

    @Test
    void shouldRecognizeRateLimitErrors() {
        assertTrue(Langchain4jLlmAdapter.isRateLimitError(new RateLimitException("slow down")));
        assertTrue(Langchain4jLlmAdapter.isRateLimitError(new RuntimeException("HTTP 429")));
        assertTrue(Langchain4jLlmAdapter.isRateLimitError(new RuntimeException("Too Many Requests")));
        assertTrue(Langchain4jLlmAdapter.isRateLimitError(
                new IllegalStateException("wrapped", new RuntimeException("rate_limit_error"))));
        assertFalse(Langchain4jLlmAdapter.isRateLimitError(new RuntimeException("invalid api key")));
        assertFalse(Langchain4jLlmAdapter.isRateLimitError(new RuntimeException((String) null)));
    }

    private static FunctionSpec searchFunction() {
        return FunctionSpec.builder()
                .name("web_search")
                .description("Search the web")
                .parametersSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "query", Map.of("type", "string", "description", "Search terms"),
                                "limit", Map.of("type", "integer"),
                                "engine", Map.of("type", "string", "enum", List.of("brave", "ddg")),
                                "tags", Map.of("type", "array", "items", Map.of("type", "string")),
                                "filter", Map.of("type", "object",
                                        "properties", Map.of("year", Map.of("type", "integer")))),
                        "required", List.of("query")))
                .build();
    }
}
