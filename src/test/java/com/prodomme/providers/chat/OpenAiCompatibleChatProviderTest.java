package com.prodomme.providers.chat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.prodomme.models.Message;
import com.prodomme.models.ModelResponse;
import com.prodomme.models.TextContent;
import com.prodomme.models.ToolResultContent;
import com.prodomme.models.ToolUseContent;
import com.prodomme.settings.ProjectConfig;
import com.prodomme.tools.ToolCatalog;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OpenAiCompatibleChatProviderTest {

    private static final String TOOL_CALL_RESPONSE = "{\"id\":\"chatcmpl-1\",\"model\":\"gpt-test\","
        + "\"choices\":[{\"index\":0,\"finish_reason\":\"tool_calls\",\"message\":{\"role\":\"assistant\","
        + "\"content\":null,\"tool_calls\":[{\"id\":\"call_1\",\"type\":\"function\","
        + "\"function\":{\"name\":\"write_file\",\"arguments\":\"{\\\"path\\\":\\\"b.txt\\\",\\\"content\\\":\\\"x\\\"}\"}}]}}]}";

    private final ObjectMapper mapper = new ObjectMapper();
    private StubHttpServer server;

    @BeforeEach
    void startServer() throws Exception {
        server = new StubHttpServer();
    }

    @AfterEach
    void stopServer() {
        server.close();
    }

    private OpenAiCompatibleChatProvider provider(String providerName, String baseUrl, String apiKey) {
        ProjectConfig config = new ProjectConfig();
        config.setProvider(providerName);
        config.setModel("gpt-test");
        config.setMaxOutputTokens(2048);
        config.setBaseUrl(baseUrl);
        config.setApiKey(apiKey);
        config.setRequestTimeoutMs(5000);
        HttpClient client = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(2)).build();
        return new OpenAiCompatibleChatProvider(mapper, client, config, ToolCatalog.standard(), providerName);
    }

    @Test
    void reconstructsToolUseFromToolCalls() throws Exception {
        server.respond(200, TOOL_CALL_RESPONSE);

        ModelResponse response = provider("openai", server.baseUrl(), "test-key")
            .query(List.of(Message.user("make b.txt")), "sys");

        assertEquals("chatcmpl-1", response.getId());
        assertEquals("gpt-test", response.getModel());
        assertEquals("tool_calls", response.getStopReason());
        assertEquals(1, response.getContent().size());
        ToolUseContent toolUse = (ToolUseContent) response.getContent().get(0);
        assertEquals("call_1", toolUse.getId());
        assertEquals("write_file", toolUse.getName());
        assertEquals("b.txt", toolUse.getInput().get("path").asText());
        assertEquals("x", toolUse.getInput().get("content").asText());
    }

    @Test
    void malformedToolArgumentsAreASerializationError() {
        server.respond(200, "{\"id\":\"c\",\"model\":\"m\",\"choices\":[{\"finish_reason\":\"tool_calls\","
            + "\"message\":{\"role\":\"assistant\",\"tool_calls\":[{\"id\":\"call_1\",\"type\":\"function\","
            + "\"function\":{\"name\":\"read_file\",\"arguments\":\"{not json\"}}]}}]}");

        InferenceException e = assertThrows(InferenceException.class,
            () -> provider("openai", server.baseUrl(), "test-key").query(List.of(Message.user("hi")), null));
        assertEquals(InferenceException.Kind.SERIALIZATION_ERROR, e.getKind());
    }

    @Test
    void encodesToolCallsAndResultsInOpenAiShape() throws Exception {
        server.respond(200, "{\"id\":\"c\",\"model\":\"gpt-test\",\"choices\":[{\"finish_reason\":\"stop\","
            + "\"message\":{\"role\":\"assistant\",\"content\":\"all done\"}}]}");
        ToolUseContent toolUse = new ToolUseContent("call_1", "read_file", mapper.readTree("{\"path\":\"a.txt\"}"));
        List<Message> history = List.of(
            Message.user("show a.txt"),
            Message.assistant(List.of(new TextContent("Let me look."), toolUse)),
            Message.toolResults(List.of(new ToolResultContent("call_1", "contents")))
        );

        ModelResponse response = provider("openai", server.baseUrl(), "test-key").query(history, "sys");

        assertEquals(List.of(new TextContent("all done")), response.getContent());
        assertEquals("/v1/chat/completions", server.lastPath());
        assertEquals("Bearer test-key", server.lastHeader("Authorization"));

        JsonNode body = mapper.readTree(server.lastBody());
        assertEquals(2048, body.get("max_tokens").asInt());
        assertEquals("function", body.get("tools").get(0).get("type").asText());
        assertEquals("read_file", body.get("tools").get(0).get("function").get("name").asText());
        assertEquals("object", body.get("tools").get(0).get("function").get("parameters").get("type").asText());

        JsonNode messages = body.get("messages");
        assertEquals(4, messages.size());
        assertEquals("developer", messages.get(0).get("role").asText());
        assertEquals("sys", messages.get(0).get("content").asText());
        assertEquals("user", messages.get(1).get("role").asText());
        JsonNode assistant = messages.get(2);
        assertEquals("Let me look.", assistant.get("content").asText());
        JsonNode call = assistant.get("tool_calls").get(0);
        assertEquals("call_1", call.get("id").asText());
        assertEquals("read_file", call.get("function").get("name").asText());
        assertEquals("a.txt", mapper.readTree(call.get("function").get("arguments").asText()).get("path").asText());
        JsonNode tool = messages.get(3);
        assertEquals("tool", tool.get("role").asText());
        assertEquals("call_1", tool.get("tool_call_id").asText());
        assertEquals("contents", tool.get("content").asText());
    }

    @Test
    void genericProviderUsesSystemRoleAndStripsVersionSuffix() throws Exception {
        server.respond(200, "{\"id\":\"c\",\"model\":\"m\",\"choices\":[{\"finish_reason\":\"stop\","
            + "\"message\":{\"role\":\"assistant\",\"content\":\"hi\"}}]}");

        provider("custom", server.baseUrl() + "/v1/", "test-key").query(List.of(Message.user("hello")), "sys");

        assertEquals("/v1/chat/completions", server.lastPath());
        JsonNode body = mapper.readTree(server.lastBody());
        assertEquals("system", body.get("messages").get(0).get("role").asText());
    }

    @Test
    void localServersNeedNoApiKey() throws Exception {
        server.respond(200, "{\"id\":\"c\",\"model\":\"m\",\"choices\":[{\"finish_reason\":\"stop\","
            + "\"message\":{\"role\":\"assistant\",\"content\":\"hi\"}}]}");

        ModelResponse response = provider("lmstudio", server.baseUrl(), "").query(List.of(Message.user("hello")), null);

        assertEquals(List.of(new TextContent("hi")), response.getContent());
        assertNull(server.lastHeader("Authorization"));
    }

    @Test
    void hostedProviderWithoutKeyFailsFast() {
        InferenceException e = assertThrows(InferenceException.class,
            () -> provider("openai", server.baseUrl(), null).query(List.of(Message.user("hello")), null));
        assertEquals(InferenceException.Kind.MISSING_API_KEY, e.getKind());
        assertEquals(0, server.requestCount());
    }

    @Test
    void emptyChoicesIsAnInvalidResponse() {
        server.respond(200, "{\"id\":\"c\",\"model\":\"m\",\"choices\":[]}");
        InferenceException e = assertThrows(InferenceException.class,
            () -> provider("openai", server.baseUrl(), "test-key").query(List.of(Message.user("hello")), null));
        assertEquals(InferenceException.Kind.INVALID_RESPONSE, e.getKind());
    }

    @Test
    void serverErrorBecomesApiError() {
        server.respond(500, "internal");
        InferenceException e = assertThrows(InferenceException.class,
            () -> provider("openai", server.baseUrl(), "test-key").query(List.of(Message.user("hello")), null));
        assertEquals(InferenceException.Kind.API_ERROR, e.getKind());
        assertEquals(500, e.getStatus());
        assertEquals("internal", e.getBody());
    }

    @Test
    void refusedConnectionBecomesNetworkError() throws Exception {
        String refused = StubHttpServer.refusedBaseUrl();
        InferenceException e = assertThrows(InferenceException.class,
            () -> provider("openai", refused, "test-key").query(List.of(Message.user("hello")), null));
        assertEquals(InferenceException.Kind.NETWORK_ERROR, e.getKind());
    }
}
