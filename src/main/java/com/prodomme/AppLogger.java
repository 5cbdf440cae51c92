package com.prodomme;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Process-wide log for a Prodomme session.
 * <p>
 * Lines go to {@code .prodomme.log} in the project root. In dev mode they are echoed to
 * stderr and DEBUG lines are kept; otherwise DEBUG is dropped. Until {@link #initialize}
 * runs, {@link #get()} hands out a logger that discards everything, so library code and
 * tests never need a log file.
 */
public class AppLogger {

    public enum Level {
        DEBUG,
        INFO,
        WARN,
        ERROR
    }

    static final long MAX_LOG_BYTES = 5L * 1024 * 1024;

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS");
    private static final AppLogger DISCARD = new AppLogger(null, null, Level.ERROR);

    private static AppLogger instance;

    private final PrintStream file;
    private final PrintStream echo;
    private final Level threshold;

    private AppLogger(PrintStream file, PrintStream echo, Level threshold) {
        this.file = file;
        this.echo = echo;
        this.threshold = threshold;
    }

    /**
     * Open the log file for appending. A log that has grown past {@link #MAX_LOG_BYTES}
     * is moved aside to {@code <name>.1} first. Later calls are ignored.
     */
    public static synchronized void initialize(Path logFile, boolean devMode) throws IOException {
        if (instance != null) {
            return;
        }
        if (Files.isRegularFile(logFile) && Files.size(logFile) > MAX_LOG_BYTES) {
            Path previous = logFile.resolveSibling(logFile.getFileName() + ".1");
            Files.move(logFile, previous, StandardCopyOption.REPLACE_EXISTING);
        }
        PrintStream out = new PrintStream(
            Files.newOutputStream(logFile, StandardOpenOption.CREATE, StandardOpenOption.APPEND),
            true, StandardCharsets.UTF_8);
        out.println();
        out.println("--- session " + LocalDateTime.now().format(TIME_FORMAT) + " ---");
        instance = new AppLogger(out, devMode ? System.err : null, devMode ? Level.DEBUG : Level.INFO);
    }

    public static synchronized AppLogger get() {
        return instance != null ? instance : DISCARD;
    }

    public boolean isEnabled(Level level) {
        return (file != null || echo != null) && level.compareTo(threshold) >= 0;
    }

    public void debug(String message) {
        log(Level.DEBUG, message, null);
    }

    public void info(String message) {
        log(Level.INFO, message, null);
    }

    public void warn(String message) {
        log(Level.WARN, message, null);
    }

    public void error(String message) {
        log(Level.ERROR, message, null);
    }

    public void error(String message, Throwable t) {
        log(Level.ERROR, message, t);
    }

    private synchronized void log(Level level, String message, Throwable t) {
        if (!isEnabled(level)) {
            return;
        }
        String line = LocalDateTime.now().format(TIME_FORMAT)
            + " " + level
            + " [" + Thread.currentThread().getName() + "] "
            + message;
        write(file, line, t);
        write(echo, line, t);
    }

    private static void write(PrintStream target, String line, Throwable t) {
        if (target == null) {
            return;
        }
        target.println(line);
        if (t != null) {
            t.printStackTrace(target);
        }
    }

    public synchronized void close() {
        if (file != null) {
            file.flush();
            file.close();
        }
    }
}
