package com.prodomme.providers.chat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.prodomme.models.Message;
import com.prodomme.models.Role;
import com.prodomme.settings.ProjectConfig;
import com.prodomme.tools.ToolSchemaRegistry;

import java.net.http.HttpClient;
import java.util.List;

/**
 * DeepSeek chat completions. Requests carry one flat string per message: text is joined
 * with spaces and tool calls/results are written out as plain descriptions. The reply
 * still uses OpenAI-style {@code tool_calls}.
 */
public class DeepSeekChatProvider extends OpenAiCompatibleChatProvider {

    public DeepSeekChatProvider(ObjectMapper mapper, HttpClient httpClient, ProjectConfig config,
                                ToolSchemaRegistry tools) {
        super(mapper, httpClient, config, tools, "deepseek");
    }

    @Override
    protected String completionsUrl() {
        return normalizeBaseUrl(config.getBaseUrl(), "https://api.deepseek.com") + "/chat/completions";
    }

    @Override
    protected Role systemRole() {
        return Role.SYSTEM;
    }

    @Override
    protected ArrayNode encodeMessages(List<Message> messages, String systemMessage) {
        ArrayNode wire = mapper.createArrayNode();
        if (systemMessage != null) {
            ObjectNode sys = wire.addObject();
            sys.put("role", systemRole().wireName());
            sys.put("content", systemMessage);
        }
        for (Message message : messages) {
            ObjectNode msg = wire.addObject();
            msg.put("role", message.getRole().wireName());
            msg.put("content", message.flattenText());
        }
        return wire;
    }
}
