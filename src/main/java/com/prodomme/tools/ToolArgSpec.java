package com.prodomme.tools;

import com.fasterxml.jackson.databind.JsonNode;

public class ToolArgSpec {
    public enum Type {
        STRING("string");

        private final String jsonType;

        Type(String jsonType) {
            this.jsonType = jsonType;
        }

        public String getJsonType() {
            return jsonType;
        }
    }

    private final String name;
    private final Type type;
    private final boolean required;
    private final String description;

    public ToolArgSpec(String name, Type type, boolean required, String description) {
        this.name = name;
        this.type = type;
        this.required = required;
        this.description = description;
    }

    public String getName() {
        return name;
    }

    public Type getType() {
        return type;
    }

    public boolean isRequired() {
        return required;
    }

    public String getDescription() {
        return description;
    }

    /**
     * @return null when the value is acceptable, otherwise an exception describing the problem
     */
    public ToolInputException validate(String toolId, JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return required ? ToolInputException.missingField(toolId, name) : null;
        }
        if (type == Type.STRING && !node.isTextual()) {
            return ToolInputException.wrongFieldType(toolId, name, type.getJsonType(), node);
        }
        return null;
    }
}
