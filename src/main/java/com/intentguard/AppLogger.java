package com.intentguard;

import java.io.FileOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Process-wide logger for validation decisions and server lifecycle. Lines go to the log file
 * chosen by {@link AppConfig} and, when enabled, to stdout.
 *
 * <p>Code that embeds the validator without starting {@link Main} gets a stdout-only logger
 * from {@link #get()}.
 */
public class AppLogger {

    private enum Level {
        INFO,
        WARN,
        ERROR
    }

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final AppLogger STDOUT_ONLY = new AppLogger(null, true);

    private static volatile AppLogger instance;

    private final PrintStream file;
    private final boolean toStdout;

    private AppLogger(PrintStream file, boolean toStdout) {
        this.file = file;
        this.toStdout = toStdout;
    }

    public static synchronized void initialize(Path logFile, boolean toStdout) throws IOException {
        if (instance != null) {
            return;
        }
        PrintStream file = new PrintStream(new FileOutputStream(logFile.toFile(), true), true, StandardCharsets.UTF_8);
        file.println();
        file.println("--- Intent Guard session " + LocalDateTime.now().format(TIMESTAMP) + " ---");
        instance = new AppLogger(file, toStdout);
    }

    public static AppLogger get() {
        AppLogger current = instance;
        return current != null ? current : STDOUT_ONLY;
    }

    public void info(String message) {
        log(Level.INFO, message);
    }

    public void warn(String message) {
        log(Level.WARN, message);
    }

    public void error(String message) {
        log(Level.ERROR, message);
    }

    public void error(String message, Throwable t) {
        log(Level.ERROR, message);
        if (file != null) {
            t.printStackTrace(file);
        }
        if (toStdout) {
            t.printStackTrace(System.out);
        }
    }

    /**
     * Unformatted line, used for banners and generator output.
     */
    public void console(String message) {
        write(message);
    }

    public void close() {
        if (file != null) {
            file.close();
        }
    }

    private void log(Level level, String message) {
        write("[" + LocalDateTime.now().format(TIMESTAMP) + "] [" + level + "] " + message);
    }

    private void write(String line) {
        if (file != null) {
            file.println(line);
        }
        if (toStdout) {
            System.out.println(line);
        }
    }
}
