package com.prodomme.models;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * One block of message content: plain text, a tool invocation emitted by the model,
 * or the result of running a tool.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = TextContent.class, name = "text"),
    @JsonSubTypes.Type(value = ToolUseContent.class, name = "tool_use"),
    @JsonSubTypes.Type(value = ToolResultContent.class, name = "tool_result")
})
public abstract class ContentItem {

    ContentItem() {
    }

    /**
     * Plain-text rendering used for token estimation and flat-text backends.
     */
    public abstract String describe();
}
