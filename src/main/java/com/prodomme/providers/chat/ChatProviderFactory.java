package com.prodomme.providers.chat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.prodomme.AppLogger;
import com.prodomme.settings.ProjectConfig;
import com.prodomme.tools.ToolCatalog;
import com.prodomme.tools.ToolSchemaRegistry;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Locale;

/**
 * Picks the chat provider for a session. Selection happens once; a session keeps
 * its provider for its whole lifetime.
 */
public class ChatProviderFactory {

    private final ObjectMapper mapper;
    private final HttpClient httpClient;
    private final ToolSchemaRegistry tools;

    public ChatProviderFactory(ObjectMapper mapper) {
        this(mapper, HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_1_1)
            .connectTimeout(Duration.ofSeconds(10))
            .build(), ToolCatalog.standard());
    }

    public ChatProviderFactory(ObjectMapper mapper, HttpClient httpClient, ToolSchemaRegistry tools) {
        this.mapper = mapper;
        this.httpClient = httpClient;
        this.tools = tools;
    }

    /**
     * Unrecognized or blank provider names fall back to a generic OpenAI-compatible backend.
     */
    public ChatProvider create(ProjectConfig config) {
        String providerName = config.getProvider();
        if (providerName == null || providerName.isBlank()) {
            providerName = "custom";
        }
        providerName = providerName.trim().toLowerCase(Locale.ROOT);

        ChatProvider provider;
        switch (providerName) {
            case "anthropic":
                provider = new AnthropicChatProvider(mapper, httpClient, config, tools);
                break;
            case "bedrock":
                provider = new BedrockChatProvider(mapper, config, tools);
                break;
            case "deepseek":
                provider = new DeepSeekChatProvider(mapper, httpClient, config, tools);
                break;
            case "openai":
            default:
                provider = new OpenAiCompatibleChatProvider(mapper, httpClient, config, tools, providerName);
                break;
        }
        AppLogger.get().info("Using " + provider.getProviderName() + " provider with model " + config.getModel());
        return provider;
    }
}
