package com.prodomme.providers.chat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.prodomme.models.ContentItem;
import com.prodomme.models.Message;
import com.prodomme.models.ModelResponse;
import com.prodomme.models.Role;
import com.prodomme.models.TextContent;
import com.prodomme.models.ToolUseContent;
import com.prodomme.settings.ProjectConfig;
import com.prodomme.tools.ToolCatalog;
import com.prodomme.tools.ToolSchemaRegistry;

import java.net.http.HttpClient;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Anthropic messages API. Content blocks map one-to-one onto {@link ContentItem}s,
 * so tool calls and results keep their native shape in both directions.
 */
public class AnthropicChatProvider extends AbstractChatProvider {

    static final String API_VERSION = "2023-06-01";

    public AnthropicChatProvider(ObjectMapper mapper, HttpClient httpClient, ProjectConfig config,
                                 ToolSchemaRegistry tools) {
        super(mapper, httpClient, config, tools);
    }

    @Override
    public String getProviderName() {
        return "anthropic";
    }

    @Override
    public ModelResponse query(List<Message> messages, String systemMessage)
        throws InferenceException, InterruptedException {
        String apiKey = requireApiKey();
        String url = normalizeAnthropicBaseUrl(config.getBaseUrl(), "https://api.anthropic.com") + "/v1/messages";

        ObjectNode payload = mapper.createObjectNode();
        payload.put("model", config.getModel());
        payload.put("max_tokens", config.getMaxOutputTokens());
        if (systemMessage != null && !systemMessage.isBlank()) {
            payload.put("system", systemMessage);
        }

        ArrayNode wireMessages = payload.putArray("messages");
        for (Message message : messages) {
            if (message.getRole() != Role.USER && message.getRole() != Role.ASSISTANT) {
                continue;
            }
            ObjectNode msg = wireMessages.addObject();
            msg.put("role", message.getRole().wireName());
            ArrayNode content = msg.putArray("content");
            for (ContentItem item : message.getContent()) {
                content.add(mapper.<JsonNode>valueToTree(item));
            }
        }
        payload.set("tools", ToolCatalog.anthropicTools(mapper, tools));

        JsonNode response = sendJsonPost(url, payload, Map.of(
            "x-api-key", apiKey,
            "anthropic-version", API_VERSION
        ));

        JsonNode contentNode = response.path("content");
        if (!contentNode.isArray()) {
            throw InferenceException.invalidResponse(getProviderName(), "Response has no content array", null);
        }
        List<ContentItem> content = new ArrayList<>();
        for (JsonNode block : contentNode) {
            String type = block.path("type").asText("");
            switch (type) {
                case "text":
                    content.add(new TextContent(block.path("text").asText("")));
                    break;
                case "tool_use":
                    content.add(new ToolUseContent(
                        textOrNull(block.get("id")),
                        textOrNull(block.get("name")),
                        block.get("input")));
                    break;
                default:
                    logger.debug("Skipping unsupported anthropic content block: " + type);
            }
        }

        return new ModelResponse(
            content,
            textOrNull(response.get("id")),
            textOrNull(response.get("model")),
            response.path("role").asText(Role.ASSISTANT.wireName()),
            textOrNull(response.get("stop_reason")),
            textOrNull(response.get("stop_sequence"))
        );
    }

    private String normalizeAnthropicBaseUrl(String baseUrl, String fallback) {
        String url = normalizeBaseUrl(baseUrl, fallback);
        if (url.endsWith("/v1")) {
            url = url.substring(0, url.length() - 3);
        }
        return url;
    }
}
