package com.prodomme.tools;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Raised when a model-emitted tool invocation is malformed. Unlike operational tool
 * failures, which are returned to the model as text, this is a hard failure for the caller.
 */
public class ToolInputException extends Exception {

    public enum Kind {
        MISSING_FIELD,
        WRONG_FIELD_TYPE
    }

    private final Kind kind;
    private final String toolName;
    private final String field;
    private final String reason;

    public ToolInputException(Kind kind, String toolName, String field, String reason) {
        super("Invalid input for tool '" + toolName + "': field '" + field + "' " + reason);
        this.kind = kind;
        this.toolName = toolName;
        this.field = field;
        this.reason = reason;
    }

    public static ToolInputException missingField(String toolName, String field) {
        return new ToolInputException(Kind.MISSING_FIELD, toolName, field, "is missing");
    }

    public static ToolInputException wrongFieldType(String toolName, String field, String expected, JsonNode actual) {
        String found = actual == null ? "nothing" : actual.getNodeType().name().toLowerCase();
        return new ToolInputException(Kind.WRONG_FIELD_TYPE, toolName, field,
            "must be a " + expected + " but was " + found);
    }

    public Kind getKind() {
        return kind;
    }

    public String getToolName() {
        return toolName;
    }

    public String getField() {
        return field;
    }

    public String getReason() {
        return reason;
    }
}
