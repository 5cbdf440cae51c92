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

class AnthropicChatProviderTest {

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

    private AnthropicChatProvider provider(String baseUrl, String apiKey) {
        ProjectConfig config = new ProjectConfig();
        config.setProvider("anthropic");
        config.setModel("claude-test");
        config.setMaxOutputTokens(1024);
        config.setBaseUrl(baseUrl);
        config.setApiKey(apiKey);
        config.setRequestTimeoutMs(5000);
        HttpClient client = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(2)).build();
        return new AnthropicChatProvider(mapper, client, config, ToolCatalog.standard());
    }

    @Test
    void mapsTextAndToolUseBlocks() throws Exception {
        server.respond(200, "{\"id\":\"msg_1\",\"type\":\"message\",\"role\":\"assistant\",\"model\":\"claude-test\","
            + "\"content\":[{\"type\":\"text\",\"text\":\"Reading it.\"},"
            + "{\"type\":\"tool_use\",\"id\":\"t1\",\"name\":\"read_file\",\"input\":{\"path\":\"a.txt\"}}],"
            + "\"stop_reason\":\"tool_use\",\"stop_sequence\":null,"
            + "\"usage\":{\"input_tokens\":10,\"output_tokens\":5}}");

        ModelResponse response = provider(server.baseUrl(), "test-key")
            .query(List.of(Message.user("show a.txt")), "be helpful");

        assertEquals("msg_1", response.getId());
        assertEquals("claude-test", response.getModel());
        assertEquals("assistant", response.getRole());
        assertEquals("tool_use", response.getStopReason());
        assertNull(response.getStopSequence());
        assertEquals(2, response.getContent().size());
        assertEquals(new TextContent("Reading it."), response.getContent().get(0));
        ToolUseContent toolUse = (ToolUseContent) response.getContent().get(1);
        assertEquals("t1", toolUse.getId());
        assertEquals("read_file", toolUse.getName());
        assertEquals("a.txt", toolUse.getInput().get("path").asText());
    }

    @Test
    void sendsNativeRequestShape() throws Exception {
        server.respond(200, "{\"id\":\"msg_2\",\"role\":\"assistant\",\"model\":\"claude-test\","
            + "\"content\":[{\"type\":\"text\",\"text\":\"done\"}],\"stop_reason\":\"end_turn\"}");
        ToolUseContent toolUse = new ToolUseContent("t1", "read_file", mapper.readTree("{\"path\":\"a.txt\"}"));
        List<Message> history = List.of(
            Message.user("show a.txt"),
            Message.assistant(List.of(toolUse)),
            Message.toolResults(List.of(new ToolResultContent("t1", "hello")))
        );

        provider(server.baseUrl() + "/", "test-key").query(history, "system prompt");

        assertEquals("/v1/messages", server.lastPath());
        assertEquals("test-key", server.lastHeader("x-api-key"));
        assertEquals(AnthropicChatProvider.API_VERSION, server.lastHeader("anthropic-version"));

        JsonNode body = mapper.readTree(server.lastBody());
        assertEquals("claude-test", body.get("model").asText());
        assertEquals(1024, body.get("max_tokens").asInt());
        assertEquals("system prompt", body.get("system").asText());
        assertEquals(4, body.get("tools").size());
        assertEquals("read_file", body.get("tools").get(0).get("name").asText());
        assertTrue(body.get("tools").get(0).has("input_schema"));

        JsonNode messages = body.get("messages");
        assertEquals(3, messages.size());
        assertEquals("user", messages.get(0).get("role").asText());
        assertEquals("text", messages.get(0).get("content").get(0).get("type").asText());
        JsonNode toolUseBlock = messages.get(1).get("content").get(0);
        assertEquals("assistant", messages.get(1).get("role").asText());
        assertEquals("tool_use", toolUseBlock.get("type").asText());
        assertEquals("a.txt", toolUseBlock.get("input").get("path").asText());
        JsonNode resultBlock = messages.get(2).get("content").get(0);
        assertEquals("tool_result", resultBlock.get("type").asText());
        assertEquals("t1", resultBlock.get("tool_use_id").asText());
        assertEquals("hello", resultBlock.get("content").asText());
    }

    @Test
    void missingApiKeyFailsBeforeAnyRequest() {
        InferenceException e = assertThrows(InferenceException.class,
            () -> provider(server.baseUrl(), "").query(List.of(Message.user("hi")), null));
        assertEquals(InferenceException.Kind.MISSING_API_KEY, e.getKind());
        assertEquals(0, server.requestCount());
    }

    @Test
    void serverErrorBecomesApiError() {
        server.respond(500, "{\"error\":\"overloaded\"}");
        InferenceException e = assertThrows(InferenceException.class,
            () -> provider(server.baseUrl(), "test-key").query(List.of(Message.user("hi")), null));
        assertEquals(InferenceException.Kind.API_ERROR, e.getKind());
        assertEquals(500, e.getStatus());
        assertEquals("{\"error\":\"overloaded\"}", e.getBody());
    }

    @Test
    void refusedConnectionBecomesNetworkError() throws Exception {
        String refused = StubHttpServer.refusedBaseUrl();
        InferenceException e = assertThrows(InferenceException.class,
            () -> provider(refused, "test-key").query(List.of(Message.user("hi")), null));
        assertEquals(InferenceException.Kind.NETWORK_ERROR, e.getKind());
    }

    @Test
    void unparseableBodyBecomesInvalidResponse() {
        server.respond(200, "<html>gateway</html>");
        InferenceException e = assertThrows(InferenceException.class,
            () -> provider(server.baseUrl(), "test-key").query(List.of(Message.user("hi")), null));
        assertEquals(InferenceException.Kind.INVALID_RESPONSE, e.getKind());
    }

    @Test
    void bodyWithoutContentBecomesInvalidResponse() {
        server.respond(200, "{\"id\":\"msg_3\"}");
        InferenceException e = assertThrows(InferenceException.class,
            () -> provider(server.baseUrl(), "test-key").query(List.of(Message.user("hi")), null));
        assertEquals(InferenceException.Kind.INVALID_RESPONSE, e.getKind());
    }
}
