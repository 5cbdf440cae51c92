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
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DeepSeekChatProviderTest {

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

    private DeepSeekChatProvider provider(String apiKey) {
        ProjectConfig config = new ProjectConfig();
        config.setProvider("deepseek");
        config.setModel("deepseek-chat");
        config.setBaseUrl(server.baseUrl());
        config.setApiKey(apiKey);
        config.setRequestTimeoutMs(5000);
        return new DeepSeekChatProvider(mapper, HttpClient.newHttpClient(), config, ToolCatalog.standard());
    }

    @Test
    void flattensEveryMessageToOneString() throws Exception {
        server.respond(200, "{\"id\":\"d1\",\"model\":\"deepseek-chat\",\"choices\":[{\"finish_reason\":\"stop\","
            + "\"message\":{\"role\":\"assistant\",\"content\":\"ok\"}}]}");
        ToolUseContent toolUse = new ToolUseContent("call_1", "read_file", mapper.readTree("{\"path\":\"a.txt\"}"));
        List<Message> history = List.of(
            Message.user("show a.txt"),
            Message.assistant(List.of(new TextContent("Looking."), toolUse)),
            Message.toolResults(List.of(new ToolResultContent("call_1", "hello")))
        );

        provider("ds-key").query(history, "sys");

        assertEquals("/chat/completions", server.lastPath());
        assertEquals("Bearer ds-key", server.lastHeader("Authorization"));
        JsonNode messages = mapper.readTree(server.lastBody()).get("messages");
        assertEquals(4, messages.size());
        assertEquals("system", messages.get(0).get("role").asText());
        assertEquals("show a.txt", messages.get(1).get("content").asText());
        assertEquals("Looking. tool read_file with input: {\"path\":\"a.txt\"}", messages.get(2).get("content").asText());
        assertFalse(messages.get(2).has("tool_calls"));
        assertEquals("user", messages.get(3).get("role").asText());
        assertEquals("tool result: hello", messages.get(3).get("content").asText());
        assertEquals(4, mapper.readTree(server.lastBody()).get("tools").size());
    }

    @Test
    void nullContentWithToolCallsYieldsOnlyToolUse() throws Exception {
        server.respond(200, "{\"id\":\"d2\",\"model\":\"deepseek-chat\",\"choices\":[{\"finish_reason\":\"tool_calls\","
            + "\"message\":{\"role\":\"assistant\",\"content\":null,\"tool_calls\":[{\"id\":\"call_9\","
            + "\"type\":\"function\",\"function\":{\"name\":\"execute\",\"arguments\":\"{\\\"statement\\\":\\\"ls\\\"}\"}}]}}]}");

        ModelResponse response = provider("ds-key").query(List.of(Message.user("list")), null);

        assertEquals(1, response.getContent().size());
        ToolUseContent toolUse = (ToolUseContent) response.getContent().get(0);
        assertEquals("execute", toolUse.getName());
        assertEquals("ls", toolUse.getInput().get("statement").asText());
    }

    @Test
    void requiresApiKey() {
        InferenceException e = assertThrows(InferenceException.class,
            () -> provider("").query(List.of(Message.user("list")), null));
        assertEquals(InferenceException.Kind.MISSING_API_KEY, e.getKind());
    }
}
