package com.prodomme.settings;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Per-project provider settings, read from {@code .prodomme.json}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ProjectConfig {

    public static final String DEFAULT_PROVIDER = "openai";
    public static final String DEFAULT_MODEL = "gpt-4o";
    public static final int DEFAULT_MAX_CONTEXT = 64_000;
    public static final int DEFAULT_MAX_OUTPUT_TOKENS = 8096;
    public static final int DEFAULT_REQUEST_TIMEOUT_MS = 300_000;
    public static final int DEFAULT_COMPILE_CHECK_TIMEOUT_SECONDS = 5;
    public static final String DEFAULT_AWS_REGION = "us-east-1";

    private String provider = DEFAULT_PROVIDER;
    private String model = DEFAULT_MODEL;
    @JsonProperty("max_context")
    private int maxContext = DEFAULT_MAX_CONTEXT;
    @JsonProperty("max_output_tokens")
    private int maxOutputTokens = DEFAULT_MAX_OUTPUT_TOKENS;
    @JsonProperty("api_key")
    private String apiKey = "";
    @JsonProperty("base_url")
    private String baseUrl = "";
    @JsonProperty("request_timeout_ms")
    private int requestTimeoutMs = DEFAULT_REQUEST_TIMEOUT_MS;
    @JsonProperty("compile_check_timeout_seconds")
    private int compileCheckTimeoutSeconds = DEFAULT_COMPILE_CHECK_TIMEOUT_SECONDS;
    @JsonProperty("aws_region")
    private String awsRegion = "";

    public String getProvider() {
        return provider;
    }

    public void setProvider(String provider) {
        this.provider = provider;
    }

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public int getMaxContext() {
        return maxContext;
    }

    public void setMaxContext(int maxContext) {
        this.maxContext = maxContext;
    }

    public int getMaxOutputTokens() {
        return maxOutputTokens;
    }

    public void setMaxOutputTokens(int maxOutputTokens) {
        this.maxOutputTokens = maxOutputTokens;
    }

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public int getRequestTimeoutMs() {
        return requestTimeoutMs;
    }

    public void setRequestTimeoutMs(int requestTimeoutMs) {
        this.requestTimeoutMs = requestTimeoutMs;
    }

    public int getCompileCheckTimeoutSeconds() {
        return compileCheckTimeoutSeconds;
    }

    public void setCompileCheckTimeoutSeconds(int compileCheckTimeoutSeconds) {
        this.compileCheckTimeoutSeconds = compileCheckTimeoutSeconds;
    }

    /**
     * Region for the bedrock provider; other providers ignore it.
     */
    public String getAwsRegion() {
        return awsRegion;
    }

    public void setAwsRegion(String awsRegion) {
        this.awsRegion = awsRegion;
    }
}
