package com.prodomme.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.util.Objects;

/**
 * A tool invocation requested by the model. The input is untrusted, schema-less JSON;
 * required fields are checked when the tool is dispatched.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ToolUseContent extends ContentItem {

    private final String id;
    private final String name;
    private final JsonNode input;

    @JsonCreator
    public ToolUseContent(@JsonProperty("id") String id,
                          @JsonProperty("name") String name,
                          @JsonProperty("input") JsonNode input) {
        this.id = id;
        this.name = name;
        this.input = input != null ? input.deepCopy() : JsonNodeFactory.instance.objectNode();
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    /**
     * @return a copy; the stored input never changes
     */
    public JsonNode getInput() {
        return input.deepCopy();
    }

    @Override
    public String describe() {
        return "tool " + name + " with input: " + input;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ToolUseContent)) return false;
        ToolUseContent other = (ToolUseContent) o;
        return Objects.equals(id, other.id)
            && Objects.equals(name, other.name)
            && Objects.equals(input, other.input);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, input);
    }

    @Override
    public String toString() {
        return "ToolUse(" + id + ", " + name + ", " + input + ")";
    }
}
