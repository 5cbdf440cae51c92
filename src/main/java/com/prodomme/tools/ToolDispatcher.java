package com.prodomme.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.prodomme.AppLogger;
import com.prodomme.models.ToolUseContent;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Executes model-requested tools against the project directory.
 * <p>
 * Operational failures (missing file, non-zero exit) come back as text so the model can
 * react to them in its next turn. Only malformed input raises {@link ToolInputException}.
 */
public class ToolDispatcher {

    private final Path projectRoot;
    private final ToolSchemaRegistry registry;
    private final ShellRunner shellRunner;
    private final Duration compileCheckTimeout;
    private final AppLogger logger;

    public ToolDispatcher(Path projectRoot, Duration compileCheckTimeout) {
        this(projectRoot, ToolCatalog.standard(), new ShellRunner(), compileCheckTimeout);
    }

    public ToolDispatcher(Path projectRoot, ToolSchemaRegistry registry, ShellRunner shellRunner,
                          Duration compileCheckTimeout) {
        this.projectRoot = projectRoot.toAbsolutePath().normalize();
        this.registry = registry;
        this.shellRunner = shellRunner;
        this.compileCheckTimeout = compileCheckTimeout;
        this.logger = AppLogger.get();
    }

    public Path getProjectRoot() {
        return projectRoot;
    }

    public String dispatch(ToolUseContent toolUse) throws ToolInputException, InterruptedException {
        String tool = toolUse.getName();
        ToolSchema schema = registry.getSchema(tool);
        if (schema == null) {
            logger.warn("Model requested unknown tool: " + tool);
            return "Unknown tool: " + tool;
        }
        JsonNode input = toolUse.getInput();
        schema.validate(input);
        logger.info("Dispatching " + tool + " (" + toolUse.getId() + ")");

        switch (tool) {
            case ToolCatalog.READ_FILE:
                return readFile(input.get("path").asText());
            case ToolCatalog.WRITE_FILE:
                return writeFile(input.get("path").asText(), input.get("content").asText());
            case ToolCatalog.EXECUTE:
                return runShell(input.get("statement").asText(), null);
            case ToolCatalog.COMPILE_CHECK:
                return runShell(input.get("cmd").asText(), compileCheckTimeout);
            default:
                return "Unknown tool: " + tool;
        }
    }

    private String readFile(String relativePath) {
        Path target;
        try {
            target = resolvePath(relativePath);
        } catch (SecurityException e) {
            return "Error reading file " + relativePath + ": " + e.getMessage() + ".";
        }
        try {
            return Files.readString(target, StandardCharsets.UTF_8);
        } catch (IOException e) {
            logger.warn("read_file failed for " + target + " (" + e.getMessage() + ")");
            return "Error reading file " + target + ": " + describe(e) + ".";
        }
    }

    private String writeFile(String relativePath, String content) {
        Path target;
        try {
            target = resolvePath(relativePath);
        } catch (SecurityException e) {
            return "Error writing to file " + relativePath + ": " + e.getMessage() + ".";
        }
        try {
            Path parent = target.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, content, StandardCharsets.UTF_8);
            return "Successfully wrote content to file " + target + ".";
        } catch (IOException e) {
            logger.warn("write_file failed for " + target + " (" + e.getMessage() + ")");
            return "Error writing to file " + target + ": " + describe(e) + ".";
        }
    }

    private String runShell(String statement, Duration timeout) throws InterruptedException {
        ShellRunner.ShellResult result;
        try {
            result = shellRunner.run(statement, projectRoot, timeout);
        } catch (IOException e) {
            logger.warn("Failed to run '" + statement + "' (" + e.getMessage() + ")");
            return "Error executing statement: " + describe(e) + ".";
        }
        StringBuilder output = new StringBuilder();
        output.append("Stdout:\n").append(result.getStdout())
            .append("\nStderr:\n").append(result.getStderr());
        if (result.isTimedOut()) {
            output.append("\nProcess stopped after ").append(timeout.toSeconds()).append(" seconds.");
        }
        return output.toString();
    }

    /**
     * Resolves a project-relative path, keeping it inside the project root.
     *
     * @throws SecurityException if the path escapes the project root
     */
    Path resolvePath(String relativePath) {
        if (relativePath == null || relativePath.isBlank() || ".".equals(relativePath)) {
            return projectRoot;
        }

        String normalized = relativePath.replace('\\', '/');

        // Treat "/src/App.java" as project-relative
        if (normalized.startsWith("/")) {
            Path absolute = Path.of(normalized).normalize();
            if (absolute.startsWith(projectRoot)) {
                return absolute;
            }
            normalized = normalized.substring(1);
        }

        Path resolved = projectRoot.resolve(normalized).normalize();
        if (!resolved.startsWith(projectRoot)) {
            throw new SecurityException("path escapes project root");
        }
        return resolved;
    }

    private String describe(IOException e) {
        if (e instanceof NoSuchFileException) {
            return "No such file or directory";
        }
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }
}
