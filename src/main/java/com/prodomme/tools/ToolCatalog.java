package com.prodomme.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * The fixed set of tools offered to the model, and their vendor encodings.
 * Every backend sends the same four tools; only the wrapping differs.
 */
public final class ToolCatalog {

    public static final String READ_FILE = "read_file";
    public static final String WRITE_FILE = "write_file";
    public static final String EXECUTE = "execute";
    public static final String COMPILE_CHECK = "compile_check";

    private static final String PATH_DESCRIPTION = "The file path relative to the project root directory";

    private ToolCatalog() {
    }

    public static ToolSchemaRegistry standard() {
        return new ToolSchemaRegistry()
            .register(new ToolSchema(READ_FILE,
                "Read file as string using path relative to root directory of project.")
                .arg("path", ToolArgSpec.Type.STRING, true, PATH_DESCRIPTION))
            .register(new ToolSchema(WRITE_FILE,
                "Write string to file at path relative to root directory of project.")
                .arg("path", ToolArgSpec.Type.STRING, true, PATH_DESCRIPTION)
                .arg("content", ToolArgSpec.Type.STRING, true, "The content to write to the file"))
            .register(new ToolSchema(EXECUTE,
                "Execute bash statements as a single string.")
                .arg("statement", ToolArgSpec.Type.STRING, true, "The bash statement to be executed."))
            .register(new ToolSchema(COMPILE_CHECK,
                "Check if project compiles or runs without error.")
                .arg("cmd", ToolArgSpec.Type.STRING, true, "The command to check for compiler/interpreter errors."));
    }

    /**
     * Anthropic messages API shape: {@code [{name, description, input_schema}]}.
     */
    public static ArrayNode anthropicTools(ObjectMapper mapper, ToolSchemaRegistry registry) {
        ArrayNode tools = mapper.createArrayNode();
        for (ToolSchema schema : registry.getSchemas()) {
            ObjectNode tool = tools.addObject();
            tool.put("name", schema.getToolId());
            tool.put("description", schema.getDescription());
            tool.set("input_schema", schema.toJsonSchema(mapper));
        }
        return tools;
    }

    /**
     * OpenAI chat completions shape: {@code [{type: function, function: {name, description, parameters}}]}.
     */
    public static ArrayNode openAiTools(ObjectMapper mapper, ToolSchemaRegistry registry) {
        ArrayNode tools = mapper.createArrayNode();
        for (ToolSchema schema : registry.getSchemas()) {
            ObjectNode tool = tools.addObject();
            tool.put("type", "function");
            ObjectNode function = tool.putObject("function");
            function.put("name", schema.getToolId());
            function.put("description", schema.getDescription());
            function.set("parameters", schema.toJsonSchema(mapper));
        }
        return tools;
    }
}
