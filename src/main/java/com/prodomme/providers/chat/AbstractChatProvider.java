package com.prodomme.providers.chat;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.prodomme.AppLogger;
import com.prodomme.settings.ProjectConfig;
import com.prodomme.tools.ToolSchemaRegistry;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

/**
 * Abstract base class for chat providers with shared HTTP logic.
 */
public abstract class AbstractChatProvider implements ChatProvider {

    protected final ObjectMapper mapper;
    protected final HttpClient httpClient;
    protected final ProjectConfig config;
    protected final ToolSchemaRegistry tools;
    protected final AppLogger logger = AppLogger.get();
    protected static final int DEFAULT_REQUEST_TIMEOUT_SECONDS = 300;

    protected AbstractChatProvider(ObjectMapper mapper, HttpClient httpClient, ProjectConfig config,
                                   ToolSchemaRegistry tools) {
        this.mapper = mapper;
        this.httpClient = httpClient;
        this.config = config;
        this.tools = tools;
    }

    /**
     * Fail fast before building any request when credentials are required but absent.
     */
    protected String requireApiKey() throws InferenceException {
        String apiKey = config.getApiKey();
        if (apiKey == null || apiKey.isBlank()) {
            throw InferenceException.missingApiKey(getProviderName());
        }
        return apiKey.trim();
    }

    /**
     * Send a JSON POST request and return the parsed response.
     */
    protected JsonNode sendJsonPost(String url, JsonNode payload, Map<String, String> headers)
        throws InferenceException, InterruptedException {
        String body;
        try {
            body = mapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw InferenceException.serialization(getProviderName(), "Failed to encode request: " + e.getOriginalMessage(), e);
        }

        HttpRequest.Builder builder;
        try {
            builder = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(resolveTimeout(config.getRequestTimeoutMs()))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body));
        } catch (IllegalArgumentException e) {
            throw InferenceException.network(getProviderName(), e);
        }
        headers.forEach(builder::header);
        if (logger.isEnabled(AppLogger.Level.DEBUG)) {
            logger.debug("POST " + url + " " + body);
        }

        HttpResponse<String> response;
        try {
            response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            logger.warn(getProviderName() + " request to " + url + " failed: " + e);
            throw InferenceException.network(getProviderName(), e);
        }

        int status = response.statusCode();
        String responseText = response.body() != null ? response.body() : "";
        logger.info(getProviderName() + " response (" + status + "): " + responseText);
        if (status < 200 || status >= 300) {
            throw InferenceException.api(getProviderName(), status, responseText);
        }

        JsonNode parsed;
        try {
            parsed = mapper.readTree(responseText);
        } catch (JsonProcessingException e) {
            throw InferenceException.invalidResponse(getProviderName(),
                "Failed to parse response: " + e.getOriginalMessage(), e);
        }
        if (parsed == null || !parsed.isObject()) {
            throw InferenceException.invalidResponse(getProviderName(), "Response body is not a JSON object", null);
        }
        return parsed;
    }

    /**
     * Tool arguments arrive as a JSON-encoded string on OpenAI-style APIs.
     */
    protected JsonNode parseToolArguments(JsonNode arguments) throws InferenceException {
        if (arguments == null || arguments.isNull() || arguments.isMissingNode()) {
            return mapper.createObjectNode();
        }
        if (arguments.isObject()) {
            return arguments;
        }
        String raw = arguments.asText();
        if (raw.isBlank()) {
            return mapper.createObjectNode();
        }
        try {
            return mapper.readTree(raw);
        } catch (JsonProcessingException e) {
            throw InferenceException.serialization(getProviderName(),
                "Failed to parse tool arguments: " + e.getOriginalMessage(), e);
        }
    }

    protected Duration resolveTimeout(Integer timeoutMs) {
        if (timeoutMs != null && timeoutMs > 0) {
            return Duration.ofMillis(timeoutMs);
        }
        return Duration.ofSeconds(DEFAULT_REQUEST_TIMEOUT_SECONDS);
    }

    /**
     * Normalize a base URL by removing trailing slashes.
     */
    protected String normalizeBaseUrl(String baseUrl, String fallback) {
        String url = (baseUrl == null || baseUrl.isBlank()) ? fallback : baseUrl.trim();
        while (url.endsWith("/")) {
            url = url.substring(0, url.length() - 1);
        }
        return url;
    }

    protected String textOrNull(JsonNode node) {
        return node == null || node.isNull() || node.isMissingNode() ? null : node.asText();
    }
}
