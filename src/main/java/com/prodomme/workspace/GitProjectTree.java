package com.prodomme.workspace;

import com.prodomme.AppLogger;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Lists project files through git, so ignored build output stays out of the prompt.
 * Outside a repository it falls back to walking the start directory.
 */
public class GitProjectTree implements ProjectTree {

    private static final long GIT_TIMEOUT_SECONDS = 30;

    private final Path startDir;
    private final AppLogger logger = AppLogger.get();
    private Path gitRoot;

    public GitProjectTree(Path startDir) {
        this.startDir = startDir.toAbsolutePath().normalize();
    }

    @Override
    public synchronized Path getGitRoot() throws IOException {
        if (gitRoot != null) {
            return gitRoot;
        }
        GitOutput output = git(startDir, "rev-parse", "--show-toplevel");
        String root = output.stdout.trim();
        if (output.exitCode != 0 || root.isEmpty()) {
            throw new FileNotFoundException("Not inside a git repository: " + startDir);
        }
        gitRoot = Path.of(root).toAbsolutePath().normalize();
        return gitRoot;
    }

    @Override
    public String getTree() throws IOException {
        Path root;
        try {
            root = getGitRoot();
        } catch (FileNotFoundException e) {
            logger.info(e.getMessage() + "; listing files by walking " + startDir);
            return walk(startDir);
        }
        GitOutput output = git(root, "ls-files", "--cached", "--others", "--exclude-standard");
        if (output.exitCode != 0) {
            throw new IOException("git ls-files failed: " + output.stdout.trim());
        }
        return output.stdout.lines()
            .map(String::trim)
            .filter(line -> !line.isEmpty())
            .sorted()
            .collect(Collectors.joining("\n"));
    }

    private String walk(Path dir) throws IOException {
        try (Stream<Path> paths = Files.walk(dir)) {
            return paths
                .filter(Files::isRegularFile)
                .map(dir::relativize)
                .filter(rel -> !rel.startsWith(".git"))
                .map(rel -> rel.toString().replace('\\', '/'))
                .sorted()
                .collect(Collectors.joining("\n"));
        }
    }

    private GitOutput git(Path workingDir, String... args) throws IOException {
        List<String> command = new ArrayList<>();
        command.add("git");
        command.addAll(Arrays.asList(args));
        Process process;
        try {
            process = new ProcessBuilder(command)
                .directory(workingDir.toFile())
                .redirectErrorStream(true)
                .start();
        } catch (IOException e) {
            throw new FileNotFoundException("git is not available: " + e.getMessage());
        }
        process.getOutputStream().close();
        String stdout;
        try (InputStream in = process.getInputStream()) {
            stdout = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
        try {
            if (!process.waitFor(GIT_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                throw new IOException("git " + String.join(" ", args) + " timed out");
            }
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while running git", e);
        }
        return new GitOutput(stdout, process.exitValue());
    }

    private static final class GitOutput {
        private final String stdout;
        private final int exitCode;

        private GitOutput(String stdout, int exitCode) {
            this.stdout = stdout;
            this.exitCode = exitCode;
        }
    }
}
