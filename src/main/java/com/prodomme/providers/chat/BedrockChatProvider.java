package com.prodomme.providers.chat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.prodomme.AppLogger;
import com.prodomme.models.ContentItem;
import com.prodomme.models.Message;
import com.prodomme.models.ModelResponse;
import com.prodomme.models.Role;
import com.prodomme.models.TextContent;
import com.prodomme.models.ToolResultContent;
import com.prodomme.models.ToolUseContent;
import com.prodomme.settings.ProjectConfig;
import com.prodomme.tools.ToolSchema;
import com.prodomme.tools.ToolSchemaRegistry;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.awscore.exception.AwsErrorDetails;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.SdkNumber;
import software.amazon.awssdk.core.document.Document;
import software.amazon.awssdk.core.exception.AbortedException;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.exception.SdkServiceException;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.core.retry.RetryPolicy;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.bedrockruntime.BedrockRuntimeClient;
import software.amazon.awssdk.services.bedrockruntime.BedrockRuntimeClientBuilder;
import software.amazon.awssdk.services.bedrockruntime.model.ContentBlock;
import software.amazon.awssdk.services.bedrockruntime.model.ConversationRole;
import software.amazon.awssdk.services.bedrockruntime.model.ConverseRequest;
import software.amazon.awssdk.services.bedrockruntime.model.ConverseResponse;
import software.amazon.awssdk.services.bedrockruntime.model.InferenceConfiguration;
import software.amazon.awssdk.services.bedrockruntime.model.SystemContentBlock;
import software.amazon.awssdk.services.bedrockruntime.model.Tool;
import software.amazon.awssdk.services.bedrockruntime.model.ToolConfiguration;
import software.amazon.awssdk.services.bedrockruntime.model.ToolInputSchema;
import software.amazon.awssdk.services.bedrockruntime.model.ToolResultBlock;
import software.amazon.awssdk.services.bedrockruntime.model.ToolResultContentBlock;
import software.amazon.awssdk.services.bedrockruntime.model.ToolSpecification;
import software.amazon.awssdk.services.bedrockruntime.model.ToolUseBlock;

import java.math.BigDecimal;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Amazon Bedrock through the Converse API. Credentials and region come from the AWS
 * SDK (default credential chain, {@code aws_region} in the project config); a non-blank
 * {@code base_url} overrides the regional endpoint.
 */
public class BedrockChatProvider implements ChatProvider {

    static final float TEMPERATURE = 0.2f;

    private final ObjectMapper mapper;
    private final ProjectConfig config;
    private final ToolSchemaRegistry tools;
    private final AwsCredentialsProvider credentials;
    private final AppLogger logger = AppLogger.get();
    private BedrockRuntimeClient client;

    public BedrockChatProvider(ObjectMapper mapper, ProjectConfig config, ToolSchemaRegistry tools) {
        this(mapper, config, tools, DefaultCredentialsProvider.create());
    }

    public BedrockChatProvider(ObjectMapper mapper, ProjectConfig config, ToolSchemaRegistry tools,
                               AwsCredentialsProvider credentials) {
        this.mapper = mapper;
        this.config = config;
        this.tools = tools;
        this.credentials = credentials;
    }

    @Override
    public String getProviderName() {
        return "bedrock";
    }

    @Override
    public ModelResponse query(List<Message> messages, String systemMessage)
        throws InferenceException, InterruptedException {
        try {
            credentials.resolveCredentials();
        } catch (SdkClientException e) {
            logger.warn("No AWS credentials for bedrock: " + e.getMessage());
            throw InferenceException.missingApiKey(getProviderName());
        }

        ConverseRequest.Builder request = ConverseRequest.builder()
            .modelId(config.getModel())
            .messages(encodeMessages(messages))
            .inferenceConfig(InferenceConfiguration.builder()
                .maxTokens(config.getMaxOutputTokens())
                .temperature(TEMPERATURE)
                .build())
            .toolConfig(toolConfiguration());
        if (systemMessage != null && !systemMessage.isBlank()) {
            request.system(SystemContentBlock.fromText(systemMessage));
        }

        ConverseResponse response;
        try {
            response = client().converse(request.build());
        } catch (AbortedException e) {
            Thread.currentThread().interrupt();
            InterruptedException interrupted = new InterruptedException("Bedrock request aborted");
            interrupted.initCause(e);
            throw interrupted;
        } catch (SdkServiceException e) {
            logger.warn("bedrock request failed (" + e.statusCode() + "): " + e.getMessage());
            throw InferenceException.api(getProviderName(), e.statusCode(), errorBody(e));
        } catch (SdkClientException e) {
            logger.warn("bedrock request failed: " + e.getMessage());
            throw InferenceException.network(getProviderName(), e);
        } catch (SdkException e) {
            throw InferenceException.invalidResponse(getProviderName(), "Unexpected SDK failure: " + e.getMessage(), e);
        }
        return toModelResponse(response);
    }

    private synchronized BedrockRuntimeClient client() {
        if (client == null) {
            Duration timeout = config.getRequestTimeoutMs() > 0
                ? Duration.ofMillis(config.getRequestTimeoutMs())
                : Duration.ofMillis(ProjectConfig.DEFAULT_REQUEST_TIMEOUT_MS);
            BedrockRuntimeClientBuilder builder = BedrockRuntimeClient.builder()
                .region(Region.of(config.getAwsRegion() == null || config.getAwsRegion().isBlank()
                    ? ProjectConfig.DEFAULT_AWS_REGION
                    : config.getAwsRegion()))
                .credentialsProvider(credentials)
                .overrideConfiguration(ClientOverrideConfiguration.builder()
                    .retryPolicy(RetryPolicy.none())
                    .apiCallTimeout(timeout)
                    .build());
            String baseUrl = config.getBaseUrl();
            if (baseUrl != null && !baseUrl.isBlank()) {
                builder.endpointOverride(URI.create(baseUrl.trim()));
            }
            client = builder.build();
        }
        return client;
    }

    private List<software.amazon.awssdk.services.bedrockruntime.model.Message> encodeMessages(List<Message> messages) {
        List<software.amazon.awssdk.services.bedrockruntime.model.Message> wire = new ArrayList<>();
        for (Message message : messages) {
            ConversationRole role;
            if (message.getRole() == Role.USER) {
                role = ConversationRole.USER;
            } else if (message.getRole() == Role.ASSISTANT) {
                role = ConversationRole.ASSISTANT;
            } else {
                continue;
            }
            List<ContentBlock> blocks = new ArrayList<>();
            for (ContentItem item : message.getContent()) {
                if (item instanceof TextContent) {
                    String text = ((TextContent) item).getText();
                    if (!text.isEmpty()) {
                        blocks.add(ContentBlock.fromText(text));
                    }
                } else if (item instanceof ToolUseContent) {
                    ToolUseContent toolUse = (ToolUseContent) item;
                    blocks.add(ContentBlock.fromToolUse(ToolUseBlock.builder()
                        .toolUseId(toolUse.getId())
                        .name(toolUse.getName())
                        .input(toDocument(toolUse.getInput()))
                        .build()));
                } else if (item instanceof ToolResultContent) {
                    ToolResultContent result = (ToolResultContent) item;
                    blocks.add(ContentBlock.fromToolResult(ToolResultBlock.builder()
                        .toolUseId(result.getToolUseId())
                        .content(ToolResultContentBlock.fromText(result.getContent()))
                        .build()));
                }
            }
            wire.add(software.amazon.awssdk.services.bedrockruntime.model.Message.builder()
                .role(role)
                .content(blocks)
                .build());
        }
        return wire;
    }

    private ToolConfiguration toolConfiguration() {
        List<Tool> specs = new ArrayList<>();
        for (ToolSchema schema : tools.getSchemas()) {
            specs.add(Tool.fromToolSpec(ToolSpecification.builder()
                .name(schema.getToolId())
                .description(schema.getDescription())
                .inputSchema(ToolInputSchema.fromJson(toDocument(schema.toJsonSchema(mapper))))
                .build()));
        }
        return ToolConfiguration.builder().tools(specs).build();
    }

    private ModelResponse toModelResponse(ConverseResponse response) throws InferenceException {
        if (response.output() == null || response.output().message() == null) {
            throw InferenceException.invalidResponse(getProviderName(), "Response has no output message", null);
        }
        software.amazon.awssdk.services.bedrockruntime.model.Message message = response.output().message();
        List<ContentItem> content = new ArrayList<>();
        for (ContentBlock block : message.content()) {
            if (block.text() != null) {
                content.add(new TextContent(block.text()));
            } else if (block.toolUse() != null) {
                ToolUseBlock toolUse = block.toolUse();
                content.add(new ToolUseContent(toolUse.toolUseId(), toolUse.name(), toJson(toolUse.input())));
            } else {
                logger.debug("Skipping unsupported bedrock content block: " + block);
            }
        }
        String requestId = response.responseMetadata() != null ? response.responseMetadata().requestId() : null;
        return new ModelResponse(
            content,
            requestId,
            config.getModel(),
            message.roleAsString() != null ? message.roleAsString() : Role.ASSISTANT.wireName(),
            response.stopReasonAsString(),
            null
        );
    }

    private String errorBody(SdkServiceException e) {
        if (e instanceof AwsServiceException) {
            AwsErrorDetails details = ((AwsServiceException) e).awsErrorDetails();
            if (details != null && details.rawResponse() != null) {
                return details.rawResponse().asUtf8String();
            }
            if (details != null && details.errorMessage() != null) {
                return details.errorMessage();
            }
        }
        return e.getMessage();
    }

    static Document toDocument(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return Document.fromNull();
        }
        if (node.isObject()) {
            Map<String, Document> map = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                map.put(field.getKey(), toDocument(field.getValue()));
            }
            return Document.fromMap(map);
        }
        if (node.isArray()) {
            List<Document> list = new ArrayList<>();
            for (JsonNode element : node) {
                list.add(toDocument(element));
            }
            return Document.fromList(list);
        }
        if (node.isBoolean()) {
            return Document.fromBoolean(node.booleanValue());
        }
        if (node.isIntegralNumber()) {
            return Document.fromNumber(node.bigIntegerValue());
        }
        if (node.isNumber()) {
            return Document.fromNumber(node.decimalValue());
        }
        return Document.fromString(node.asText());
    }

    static JsonNode toJson(Document document) {
        JsonNodeFactory factory = JsonNodeFactory.instance;
        if (document == null || document.isNull()) {
            return factory.objectNode();
        }
        return toJsonValue(document);
    }

    private static JsonNode toJsonValue(Document document) {
        JsonNodeFactory factory = JsonNodeFactory.instance;
        if (document.isNull()) {
            return factory.nullNode();
        }
        if (document.isMap()) {
            ObjectNode object = factory.objectNode();
            document.asMap().forEach((key, value) -> object.set(key, toJsonValue(value)));
            return object;
        }
        if (document.isList()) {
            ArrayNode array = factory.arrayNode();
            document.asList().forEach(value -> array.add(toJsonValue(value)));
            return array;
        }
        if (document.isBoolean()) {
            return factory.booleanNode(document.asBoolean());
        }
        if (document.isNumber()) {
            SdkNumber number = document.asNumber();
            BigDecimal value = number.bigDecimalValue();
            return value.scale() <= 0 ? factory.numberNode(value.toBigInteger()) : factory.numberNode(value);
        }
        return factory.textNode(document.asString());
    }
}
