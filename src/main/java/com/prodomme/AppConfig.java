package com.prodomme;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Command-line level settings: which project to work on, where its
 * configuration and log live, and whether to echo logs to the console.
 */
public class AppConfig {

    public static final String CONFIG_FILE_NAME = ".prodomme.json";
    public static final String LOG_FILE_NAME = ".prodomme.log";

    private final Path projectPath;
    private final Path configPath;
    private final Path logPath;
    private final boolean devMode;

    private AppConfig(Path projectPath, Path configPath, Path logPath, boolean devMode) {
        this.projectPath = projectPath;
        this.configPath = configPath;
        this.logPath = logPath;
        this.devMode = devMode;
    }

    /**
     * Directory the session starts from; the git root above it becomes the project root.
     */
    public Path getProjectPath() {
        return projectPath;
    }

    /**
     * Explicit configuration file, or null to use {@value #CONFIG_FILE_NAME} in the project root.
     */
    public Path getConfigPath() {
        return configPath;
    }

    public Path getLogPath() {
        return logPath;
    }

    public boolean isDevMode() {
        return devMode;
    }

    /**
     * Builder for AppConfig.
     */
    public static class Builder {
        private Path projectPath = null;
        private Path configPath = null;
        private boolean devMode = false;

        public Builder projectPath(String path) {
            if (path != null && !path.isEmpty()) {
                this.projectPath = Paths.get(path).toAbsolutePath().normalize();
            }
            return this;
        }

        public Builder configPath(String path) {
            if (path != null && !path.isEmpty()) {
                this.configPath = Paths.get(path).toAbsolutePath().normalize();
            }
            return this;
        }

        public Builder devMode(boolean devMode) {
            this.devMode = devMode;
            return this;
        }

        public Builder parseArgs(String[] args) {
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];

                // Handle --project=value or --project value
                if (arg.startsWith("--project=")) {
                    projectPath(arg.substring("--project=".length()));
                } else if ("--project".equals(arg) && i + 1 < args.length) {
                    projectPath(args[++i]);
                }

                // Handle --config=value or --config value
                else if (arg.startsWith("--config=")) {
                    configPath(arg.substring("--config=".length()));
                } else if ("--config".equals(arg) && i + 1 < args.length) {
                    configPath(args[++i]);
                }

                else if ("--dev".equals(arg)) {
                    this.devMode = true;
                }
            }
            return this;
        }

        public AppConfig build() {
            Path project = projectPath != null
                ? projectPath
                : Paths.get("").toAbsolutePath().normalize();
            Path logPath = project.resolve(LOG_FILE_NAME);
            return new AppConfig(project, configPath, logPath, devMode);
        }
    }
}
