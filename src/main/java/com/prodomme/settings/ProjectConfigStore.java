package com.prodomme.settings;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.prodomme.AppLogger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;

/**
 * Loads {@link ProjectConfig} from disk and fills in credentials from the environment.
 * Backends never read the environment themselves.
 */
public class ProjectConfigStore {

    private static final Map<String, String> KEY_VARIABLES = Map.of(
        "anthropic", "ANTHROPIC_API_KEY",
        "openai", "OPENAI_API_KEY",
        "deepseek", "DEEPSEEK_API_KEY"
    );

    private final ObjectMapper mapper;
    private final Map<String, String> environment;
    private final AppLogger logger = AppLogger.get();

    public ProjectConfigStore(ObjectMapper mapper) {
        this(mapper, System.getenv());
    }

    public ProjectConfigStore(ObjectMapper mapper, Map<String, String> environment) {
        this.mapper = mapper;
        this.environment = environment != null ? environment : Map.of();
    }

    /**
     * Read the config file, falling back to defaults when it does not exist.
     *
     * @throws IOException if the file exists but cannot be read or parsed
     */
    public ProjectConfig load(Path configFile) throws IOException {
        ProjectConfig config;
        if (configFile != null && Files.isRegularFile(configFile)) {
            config = mapper.readValue(configFile.toFile(), ProjectConfig.class);
            logger.info("Loaded project config from " + configFile);
        } else {
            config = new ProjectConfig();
            logger.info("No project config at " + configFile + "; using defaults");
        }
        normalize(config);
        return config;
    }

    public ProjectConfig loadOrDefault(Path configFile) {
        try {
            return load(configFile);
        } catch (IOException e) {
            logger.warn("Failed to read project config " + configFile + " (" + e.getMessage() + "); using defaults");
            ProjectConfig config = new ProjectConfig();
            normalize(config);
            return config;
        }
    }

    private void normalize(ProjectConfig config) {
        String provider = config.getProvider() == null ? "" : config.getProvider().trim().toLowerCase(Locale.ROOT);
        config.setProvider(provider.isEmpty() ? ProjectConfig.DEFAULT_PROVIDER : provider);
        if (config.getModel() == null || config.getModel().isBlank()) {
            config.setModel(ProjectConfig.DEFAULT_MODEL);
        }
        if (config.getMaxOutputTokens() <= 0) {
            config.setMaxOutputTokens(ProjectConfig.DEFAULT_MAX_OUTPUT_TOKENS);
        }
        if (config.getMaxContext() < 0) {
            config.setMaxContext(ProjectConfig.DEFAULT_MAX_CONTEXT);
        }
        if (config.getCompileCheckTimeoutSeconds() <= 0) {
            config.setCompileCheckTimeoutSeconds(ProjectConfig.DEFAULT_COMPILE_CHECK_TIMEOUT_SECONDS);
        }
        if (config.getBaseUrl() == null) {
            config.setBaseUrl("");
        }
        if (config.getAwsRegion() == null || config.getAwsRegion().isBlank()) {
            String region = environment.getOrDefault("AWS_REGION", environment.get("AWS_DEFAULT_REGION"));
            config.setAwsRegion(region != null && !region.isBlank() ? region.trim() : ProjectConfig.DEFAULT_AWS_REGION);
        }
        if (config.getApiKey() == null || config.getApiKey().isBlank()) {
            String variable = KEY_VARIABLES.get(config.getProvider());
            String fromEnv = variable != null ? environment.get(variable) : null;
            config.setApiKey(fromEnv != null ? fromEnv.trim() : "");
        }
    }
}
