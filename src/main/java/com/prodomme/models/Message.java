package com.prodomme.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A single turn entry in the conversation. Instances are immutable.
 */
public final class Message {

    private final Role role;
    private final List<ContentItem> content;

    @JsonCreator
    public Message(@JsonProperty("role") Role role,
                   @JsonProperty("content") List<ContentItem> content) {
        this.role = Objects.requireNonNull(role, "role");
        this.content = content == null ? List.of() : List.copyOf(content);
    }

    public static Message user(String text) {
        return new Message(Role.USER, List.of(new TextContent(text)));
    }

    public static Message assistant(List<ContentItem> content) {
        return new Message(Role.ASSISTANT, content);
    }

    /**
     * Tool results travel back to the model in a user-role message.
     */
    public static Message toolResults(List<ToolResultContent> results) {
        return new Message(Role.USER, List.copyOf(results));
    }

    public Role getRole() {
        return role;
    }

    public List<ContentItem> getContent() {
        return content;
    }

    @JsonIgnore
    public List<ToolUseContent> toolUses() {
        return content.stream()
            .filter(ToolUseContent.class::isInstance)
            .map(ToolUseContent.class::cast)
            .collect(Collectors.toList());
    }

    @JsonIgnore
    public String text() {
        return content.stream()
            .filter(TextContent.class::isInstance)
            .map(item -> ((TextContent) item).getText())
            .collect(Collectors.joining(" "));
    }

    /**
     * All content items rendered as text and joined with a single space.
     */
    public String flattenText() {
        return content.stream()
            .map(ContentItem::describe)
            .collect(Collectors.joining(" "));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Message)) return false;
        Message other = (Message) o;
        return role == other.role && content.equals(other.content);
    }

    @Override
    public int hashCode() {
        return Objects.hash(role, content);
    }

    @Override
    public String toString() {
        return role.wireName() + content;
    }
}
