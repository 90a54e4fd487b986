package com.popupkit;

import java.io.FileOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Writes timestamped log lines to the console and an append-only log file.
 * Library classes call {@link #get()} and skip logging when it returns null.
 */
public class AppLogger {

    public enum Level {
        DEBUG, INFO, WARN, ERROR
    }

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private static AppLogger instance;

    private final PrintStream fileOutput;
    private final PrintStream consoleOutput = System.out;
    private final boolean consoleEnabled;
    private final Level threshold;

    private AppLogger(PrintStream fileOutput, boolean consoleEnabled, Level threshold) {
        this.fileOutput = fileOutput;
        this.consoleEnabled = consoleEnabled;
        this.threshold = threshold;
    }

    public static synchronized void initialize(Path logFile, boolean consoleEnabled) throws IOException {
        initialize(logFile, consoleEnabled, false);
    }

    /**
     * @param logFile file to append to, or null for console-only logging
     * @param verbose also emit DEBUG lines
     */
    public static synchronized void initialize(Path logFile, boolean consoleEnabled, boolean verbose) throws IOException {
        if (instance != null) {
            return;
        }
        PrintStream file = null;
        if (logFile != null) {
            file = new PrintStream(new FileOutputStream(logFile.toFile(), true), true, "UTF-8");
            file.println();
            file.println("=".repeat(60));
            file.println(AppConfig.APP_NAME + " started at " + LocalDateTime.now().format(TIME_FORMAT));
            file.println("=".repeat(60));
        }
        instance = new AppLogger(file, consoleEnabled, verbose ? Level.DEBUG : Level.INFO);
    }

    public static AppLogger get() {
        return instance;
    }

    public boolean isEnabled(Level level) {
        return level.compareTo(threshold) >= 0;
    }

    public void debug(String message) {
        log(Level.DEBUG, message);
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
        if (fileOutput != null) {
            t.printStackTrace(fileOutput);
        }
        if (consoleEnabled) {
            t.printStackTrace(consoleOutput);
        }
    }

    private void log(Level level, String message) {
        if (!isEnabled(level)) {
            return;
        }
        write(String.format("[%s] [%s] %s", LocalDateTime.now().format(TIME_FORMAT), level, message));
    }

    /**
     * Console and file, without timestamp or level. Used for the startup banner.
     */
    public void console(String message) {
        write(message);
    }

    private void write(String line) {
        if (consoleEnabled) {
            consoleOutput.println(line);
        }
        if (fileOutput != null) {
            fileOutput.println(line);
        }
    }

    public void close() {
        if (fileOutput != null) {
            fileOutput.close();
        }
    }
}
