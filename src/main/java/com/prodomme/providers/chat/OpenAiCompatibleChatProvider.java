package com.prodomme.providers.chat;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.prodomme.models.ContentItem;
import com.prodomme.models.Message;
import com.prodomme.models.ModelResponse;
import com.prodomme.models.Role;
import com.prodomme.models.TextContent;
import com.prodomme.models.ToolResultContent;
import com.prodomme.models.ToolUseContent;
import com.prodomme.settings.ProjectConfig;
import com.prodomme.tools.ToolCatalog;
import com.prodomme.tools.ToolSchemaRegistry;

import java.net.http.HttpClient;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * OpenAI-compatible chat completions provider.
 * Handles openai and any unrecognized provider name (custom gateways, local servers).
 */
public class OpenAiCompatibleChatProvider extends AbstractChatProvider {

    private static final Set<String> KEYLESS_PROVIDERS = Set.of(
        "lmstudio", "ollama", "jan", "koboldcpp"
    );

    private final String providerName;

    public OpenAiCompatibleChatProvider(ObjectMapper mapper, HttpClient httpClient, ProjectConfig config,
                                        ToolSchemaRegistry tools, String providerName) {
        super(mapper, httpClient, config, tools);
        this.providerName = providerName;
    }

    @Override
    public String getProviderName() {
        return providerName;
    }

    @Override
    public ModelResponse query(List<Message> messages, String systemMessage)
        throws InferenceException, InterruptedException {
        String apiKey = KEYLESS_PROVIDERS.contains(providerName) ? config.getApiKey() : requireApiKey();

        ObjectNode payload = mapper.createObjectNode();
        payload.put("model", config.getModel());
        payload.put("max_tokens", config.getMaxOutputTokens());
        payload.set("messages", encodeMessages(messages, systemMessage));
        payload.set("tools", ToolCatalog.openAiTools(mapper, tools));

        Map<String, String> headers = new HashMap<>();
        if (apiKey != null && !apiKey.isBlank()) {
            headers.put("Authorization", "Bearer " + apiKey.trim());
        }
        JsonNode response = sendJsonPost(completionsUrl(), payload, headers);
        return parseCompletion(response);
    }

    protected String completionsUrl() {
        return normalizeOpenAiBaseUrl(config.getBaseUrl(), defaultOpenAiBase(providerName)) + "/v1/chat/completions";
    }

    protected Role systemRole() {
        return "openai".equals(providerName) ? Role.DEVELOPER : Role.SYSTEM;
    }

    /**
     * Assistant tool uses become {@code tool_calls}; tool results become {@code role: tool}
     * messages placed before any user text so they directly follow the assistant's calls.
     */
    protected ArrayNode encodeMessages(List<Message> messages, String systemMessage) throws InferenceException {
        ArrayNode wire = mapper.createArrayNode();
        if (systemMessage != null && !systemMessage.isBlank()) {
            ObjectNode sys = wire.addObject();
            sys.put("role", systemRole().wireName());
            sys.put("content", systemMessage);
        }
        for (Message message : messages) {
            if (message.getRole() == Role.ASSISTANT) {
                encodeAssistant(wire, message);
                continue;
            }
            for (ContentItem item : message.getContent()) {
                if (item instanceof ToolResultContent) {
                    ToolResultContent result = (ToolResultContent) item;
                    ObjectNode tool = wire.addObject();
                    tool.put("role", "tool");
                    tool.put("tool_call_id", result.getToolUseId());
                    tool.put("content", result.getContent());
                }
            }
            String text = message.text();
            if (!text.isEmpty()) {
                ObjectNode msg = wire.addObject();
                msg.put("role", message.getRole().wireName());
                msg.put("content", text);
            }
        }
        return wire;
    }

    private void encodeAssistant(ArrayNode wire, Message message) throws InferenceException {
        ObjectNode msg = wire.addObject();
        msg.put("role", Role.ASSISTANT.wireName());
        String text = message.text();
        List<ToolUseContent> toolUses = message.toolUses();
        if (text.isEmpty() && !toolUses.isEmpty()) {
            msg.putNull("content");
        } else {
            msg.put("content", text);
        }
        if (toolUses.isEmpty()) {
            return;
        }
        ArrayNode calls = msg.putArray("tool_calls");
        for (ToolUseContent toolUse : toolUses) {
            ObjectNode call = calls.addObject();
            call.put("id", toolUse.getId());
            call.put("type", "function");
            ObjectNode function = call.putObject("function");
            function.put("name", toolUse.getName());
            try {
                function.put("arguments", mapper.writeValueAsString(toolUse.getInput()));
            } catch (JsonProcessingException e) {
                throw InferenceException.serialization(getProviderName(),
                    "Failed to encode tool arguments: " + e.getOriginalMessage(), e);
            }
        }
    }

    protected ModelResponse parseCompletion(JsonNode response) throws InferenceException {
        JsonNode choices = response.path("choices");
        if (!choices.isArray() || choices.size() == 0) {
            throw InferenceException.invalidResponse(getProviderName(), "No choices in response", null);
        }
        JsonNode choice = choices.get(0);
        JsonNode messageNode = choice.path("message");
        if (!messageNode.isObject()) {
            throw InferenceException.invalidResponse(getProviderName(), "Choice has no message", null);
        }

        List<ContentItem> content = new ArrayList<>();
        JsonNode contentNode = messageNode.path("content");
        if (contentNode.isTextual()) {
            if (!contentNode.asText().isEmpty()) {
                content.add(new TextContent(contentNode.asText()));
            }
        } else if (contentNode.isArray()) {
            for (JsonNode part : contentNode) {
                JsonNode text = part.path("text");
                if (text.isTextual()) {
                    content.add(new TextContent(text.asText()));
                }
            }
        }

        JsonNode toolCalls = messageNode.path("tool_calls");
        if (toolCalls.isArray()) {
            for (JsonNode call : toolCalls) {
                String type = call.path("type").asText("function");
                if (!"function".equals(type)) {
                    continue;
                }
                JsonNode function = call.path("function");
                JsonNode input = parseToolArguments(function.get("arguments"));
                content.add(new ToolUseContent(
                    textOrNull(call.get("id")),
                    textOrNull(function.get("name")),
                    input));
            }
        }

        return new ModelResponse(
            content,
            textOrNull(response.get("id")),
            textOrNull(response.get("model")),
            messageNode.path("role").asText(Role.ASSISTANT.wireName()),
            textOrNull(choice.get("finish_reason")),
            null
        );
    }

    private String defaultOpenAiBase(String provider) {
        switch (provider) {
            case "openai":
                return "https://api.openai.com";
            case "ollama":
                return "http://localhost:11434";
            case "lmstudio":
            case "jan":
            case "koboldcpp":
            default:
                return "http://localhost:1234";
        }
    }

    private String normalizeOpenAiBaseUrl(String baseUrl, String fallback) {
        String url = normalizeBaseUrl(baseUrl, fallback);
        if (url.endsWith("/api/v1")) {
            url = url.substring(0, url.length() - 7);
        }
        if (url.endsWith("/v1")) {
            url = url.substring(0, url.length() - 3);
        }
        return url;
    }
}
