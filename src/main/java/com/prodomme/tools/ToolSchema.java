package com.prodomme.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Name, description and flat parameter schema of one tool the model may call.
 */
public class ToolSchema {
    private final String toolId;
    private final String description;
    // Insertion order is kept so the encoded schema is stable across requests.
    private final Map<String, ToolArgSpec> args = new LinkedHashMap<>();

    public ToolSchema(String toolId, String description) {
        this.toolId = toolId;
        this.description = description;
    }

    public ToolSchema arg(String name, ToolArgSpec.Type type, boolean required, String description) {
        args.put(name, new ToolArgSpec(name, type, required, description));
        return this;
    }

    public String getToolId() {
        return toolId;
    }

    public String getDescription() {
        return description;
    }

    public Set<String> getArgNames() {
        return Collections.unmodifiableSet(args.keySet());
    }

    public Map<String, ToolArgSpec> getArgSpecs() {
        return Collections.unmodifiableMap(args);
    }

    /**
     * Check every declared argument against the given input. Extra fields are ignored.
     *
     * @throws ToolInputException for the first missing or mistyped argument
     */
    public void validate(JsonNode input) throws ToolInputException {
        if (input == null || !input.isObject()) {
            ToolArgSpec first = args.values().stream().filter(ToolArgSpec::isRequired).findFirst().orElse(null);
            if (first != null) {
                throw ToolInputException.missingField(toolId, first.getName());
            }
            return;
        }
        for (ToolArgSpec spec : args.values()) {
            ToolInputException error = spec.validate(toolId, input.get(spec.getName()));
            if (error != null) {
                throw error;
            }
        }
    }

    /**
     * JSON Schema object for the parameters: {@code {type, properties, required}}.
     */
    public ObjectNode toJsonSchema(ObjectMapper mapper) {
        ObjectNode schema = mapper.createObjectNode();
        schema.put("type", "object");
        ObjectNode properties = schema.putObject("properties");
        ArrayNode required = schema.putArray("required");
        for (ToolArgSpec spec : args.values()) {
            ObjectNode property = properties.putObject(spec.getName());
            property.put("type", spec.getType().getJsonType());
            if (spec.getDescription() != null) {
                property.put("description", spec.getDescription());
            }
            if (spec.isRequired()) {
                required.add(spec.getName());
            }
        }
        return schema;
    }
}
