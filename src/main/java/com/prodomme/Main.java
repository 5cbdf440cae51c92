package com.prodomme;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.prodomme.models.Message;
import com.prodomme.models.ToolUseContent;
import com.prodomme.providers.chat.ChatProvider;
import com.prodomme.providers.chat.ChatProviderFactory;
import com.prodomme.providers.chat.InferenceException;
import com.prodomme.session.ChatSession;
import com.prodomme.session.JtokkitTokenEstimator;
import com.prodomme.session.ToolLoop;
import com.prodomme.session.TurnListener;
import com.prodomme.settings.ProjectConfig;
import com.prodomme.settings.ProjectConfigStore;
import com.prodomme.tools.ToolDispatcher;
import com.prodomme.workspace.GitProjectTree;

import java.io.BufferedReader;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;

public class Main {

    private static final String VERSION = "1.0.0";
    private static final int TOOL_OUTPUT_PREVIEW = 400;
    private static final ObjectMapper objectMapper = new ObjectMapper();
    private static AppLogger logger;

    public static void main(String[] args) {
        try {
            AppConfig config = new AppConfig.Builder()
                .parseArgs(args)
                .build();

            Path projectRoot = resolveProjectRoot(config.getProjectPath());

            AppLogger.initialize(projectRoot.resolve(AppConfig.LOG_FILE_NAME), config.isDevMode());
            logger = AppLogger.get();
            GitProjectTree tree = new GitProjectTree(projectRoot);

            Path configFile = config.getConfigPath() != null
                ? config.getConfigPath()
                : projectRoot.resolve(AppConfig.CONFIG_FILE_NAME);
            ProjectConfig projectConfig = new ProjectConfigStore(objectMapper).loadOrDefault(configFile);

            ChatProvider provider = new ChatProviderFactory(objectMapper).create(projectConfig);
            ChatSession session = new ChatSession(provider, new JtokkitTokenEstimator(), tree,
                projectConfig.getMaxContext());
            ToolDispatcher dispatcher = new ToolDispatcher(projectRoot,
                Duration.ofSeconds(projectConfig.getCompileCheckTimeoutSeconds()));
            ToolLoop loop = new ToolLoop(session, dispatcher, new ConsoleListener(System.out));

            printBanner(projectRoot, projectConfig);
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                logger.info("Shutting down...");
                logger.close();
            }));

            runRepl(session, loop);
        } catch (Exception e) {
            System.err.println("Failed to start Prodomme: " + e.getMessage());
            e.printStackTrace();
            System.exit(1);
        }
    }

    private static Path resolveProjectRoot(Path fallback) throws IOException {
        try {
            return new GitProjectTree(fallback).getGitRoot();
        } catch (FileNotFoundException e) {
            return fallback;
        }
    }

    private static void printBanner(Path projectRoot, ProjectConfig projectConfig) {
        System.out.println("========================================");
        System.out.println("  Prodomme v" + VERSION);
        System.out.println("========================================");
        System.out.println("  Project:  " + projectRoot);
        System.out.println("  Provider: " + projectConfig.getProvider() + " (" + projectConfig.getModel() + ")");
        System.out.println("  Type /exit to quit, /clear to forget the conversation.");
        System.out.println();
    }

    private static void runRepl(ChatSession session, ToolLoop loop) throws IOException {
        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        while (true) {
            System.out.print("> ");
            System.out.flush();
            String line = in.readLine();
            if (line == null || "/exit".equals(line.trim())) {
                break;
            }
            String input = line.trim();
            if (input.isEmpty()) {
                continue;
            }
            if ("/clear".equals(input)) {
                loop.clear();
                System.out.println("Conversation cleared.");
                continue;
            }
            if ("/tokens".equals(input)) {
                System.out.println(session.estimateTokens() + " / " + session.getMaxTokens() + " tokens in history");
                continue;
            }
            try {
                loop.run(input);
            } catch (InferenceException e) {
                logger.error("Request failed", e);
                System.out.println("Request failed: " + e.getMessage());
            } catch (IOException e) {
                logger.error("Could not list project files", e);
                System.out.println("Could not list project files: " + e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
    }

    private static final class ConsoleListener implements TurnListener {
        private final PrintStream out;

        private ConsoleListener(PrintStream out) {
            this.out = out;
        }

        @Override
        public void onAssistantMessage(Message message) {
            String text = message.text();
            if (!text.isBlank()) {
                out.println();
                out.println(text);
                out.println();
            }
        }

        @Override
        public void onToolUse(ToolUseContent toolUse) {
            out.println("[" + toolUse.getName() + "] " + preview(toolUse.getInput().toString()));
        }

        @Override
        public void onToolResult(ToolUseContent toolUse, String output) {
            out.println(preview(output));
        }

        private String preview(String text) {
            return text.length() > TOOL_OUTPUT_PREVIEW ? text.substring(0, TOOL_OUTPUT_PREVIEW) + "..." : text;
        }
    }
}
