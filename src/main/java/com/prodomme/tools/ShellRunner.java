package com.prodomme.tools;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Runs a single shell statement and captures its output.
 * Output goes to temp files rather than pipes so a forcibly killed process tree
 * can never leave a reader blocked.
 */
public class ShellRunner {

    private static final long REAP_GRACE_SECONDS = 5;

    private final String shell;

    public ShellRunner() {
        this("bash");
    }

    public ShellRunner(String shell) {
        this.shell = shell;
    }

    /**
     * @param timeout upper bound on wall-clock time, or null to wait for completion
     */
    public ShellResult run(String statement, Path workingDir, Duration timeout)
        throws IOException, InterruptedException {
        Path stdoutFile = Files.createTempFile("prodomme-stdout", ".log");
        Path stderrFile = Files.createTempFile("prodomme-stderr", ".log");
        try {
            ProcessBuilder pb = new ProcessBuilder(shell, "-c", statement)
                .directory(workingDir.toFile())
                .redirectOutput(stdoutFile.toFile())
                .redirectError(stderrFile.toFile());

            Process process = pb.start();
            process.getOutputStream().close();

            boolean finished;
            try {
                if (timeout == null) {
                    process.waitFor();
                    finished = true;
                } else {
                    finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
                }
            } catch (InterruptedException e) {
                destroyTree(process);
                throw e;
            }

            if (!finished) {
                destroyTree(process);
                process.waitFor(REAP_GRACE_SECONDS, TimeUnit.SECONDS);
            }

            String stdout = readLossy(stdoutFile);
            String stderr = readLossy(stderrFile);
            int exitCode = finished ? process.exitValue() : -1;
            return new ShellResult(stdout, stderr, exitCode, !finished);
        } finally {
            Files.deleteIfExists(stdoutFile);
            Files.deleteIfExists(stderrFile);
        }
    }

    private void destroyTree(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
    }

    private String readLossy(Path file) throws IOException {
        return new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
    }

    public static final class ShellResult {
        private final String stdout;
        private final String stderr;
        private final int exitCode;
        private final boolean timedOut;

        public ShellResult(String stdout, String stderr, int exitCode, boolean timedOut) {
            this.stdout = stdout;
            this.stderr = stderr;
            this.exitCode = exitCode;
            this.timedOut = timedOut;
        }

        public String getStdout() {
            return stdout;
        }

        public String getStderr() {
            return stderr;
        }

        /**
         * @return the process exit code, or -1 when it was killed on timeout
         */
        public int getExitCode() {
            return exitCode;
        }

        public boolean isTimedOut() {
            return timedOut;
        }
    }
}
