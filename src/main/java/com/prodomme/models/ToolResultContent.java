package com.prodomme.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Output of a dispatched tool. {@code toolUseId} must match the id of a
 * {@link ToolUseContent} in an earlier assistant message; this is not checked.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ToolResultContent extends ContentItem {

    private final String toolUseId;
    private final String content;

    @JsonCreator
    public ToolResultContent(@JsonProperty("tool_use_id") String toolUseId,
                             @JsonProperty("content") String content) {
        this.toolUseId = toolUseId;
        this.content = content == null ? "" : content;
    }

    @JsonProperty("tool_use_id")
    public String getToolUseId() {
        return toolUseId;
    }

    public String getContent() {
        return content;
    }

    @Override
    public String describe() {
        return "tool result: " + content;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ToolResultContent)) return false;
        ToolResultContent other = (ToolResultContent) o;
        return Objects.equals(toolUseId, other.toolUseId) && content.equals(other.content);
    }

    @Override
    public int hashCode() {
        return Objects.hash(toolUseId, content);
    }

    @Override
    public String toString() {
        return "ToolResult(" + toolUseId + ", " + content + ")";
    }
}
