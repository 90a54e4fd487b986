package com.popupkit;

import java.io.IOException;
import java.net.ServerSocket;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Application configuration: platform-specific log location, HTTP port and feature flags.
 */
public class AppConfig {

    public static final String APP_NAME = "popup-kit";
    private static final int DEFAULT_PORT = 7420;

    private final Path logPath;
    private final int port;
    private final boolean devMode;
    private final boolean injectOther;

    private AppConfig(Path logPath, int port, boolean devMode, boolean injectOther) {
        this.logPath = logPath;
        this.port = port;
        this.devMode = devMode;
        this.injectOther = injectOther;
    }

    public Path getLogPath() {
        return logPath;
    }

    public int getPort() {
        return port;
    }

    public boolean isDevMode() {
        return devMode;
    }

    /**
     * Whether parsed popups get an "Other (please specify)" option on every choice.
     */
    public boolean isInjectOther() {
        return injectOther;
    }

    /**
     * Get the log directory path based on the operating system.
     * Windows: %APPDATA%\popup-kit\logs
     * macOS: ~/Library/Logs/popup-kit
     * Linux: ~/.local/share/popup-kit/logs
     */
    public static Path getLogDirectory() {
        String os = System.getProperty("os.name").toLowerCase();
        String userHome = System.getProperty("user.home");

        if (os.contains("win")) {
            String appData = System.getenv("APPDATA");
            if (appData == null) {
                appData = Paths.get(userHome, "AppData", "Roaming").toString();
            }
            return Paths.get(appData, APP_NAME, "logs");
        } else if (os.contains("mac")) {
            return Paths.get(userHome, "Library", "Logs", APP_NAME);
        } else {
            return Paths.get(userHome, ".local", "share", APP_NAME, "logs");
        }
    }

    public static Path getLogFilePath() {
        return getLogDirectory().resolve("popup-kit.log");
    }

    /**
     * Find an available port, starting with the preferred port.
     */
    public static int findAvailablePort(int preferredPort) {
        if (isPortAvailable(preferredPort)) {
            return preferredPort;
        }
        for (int port = preferredPort + 1; port < preferredPort + 100; port++) {
            if (isPortAvailable(port)) {
                return port;
            }
        }
        // Let the server fail later with a clear bind error
        return preferredPort;
    }

    public static boolean isPortAvailable(int port) {
        try (ServerSocket socket = new ServerSocket(port)) {
            socket.setReuseAddress(true);
            return true;
        } catch (IOException e) {
            return false;
        }
    }

    public static Path ensureLogDirectory() throws IOException {
        Files.createDirectories(getLogDirectory());
        return getLogFilePath();
    }

    /**
     * Builder for AppConfig. Command-line arguments win over environment variables.
     */
    public static class Builder {
        private int preferredPort = DEFAULT_PORT;
        private boolean devMode = false;
        private boolean injectOther = false;
        private Path logPath = null;

        public Builder port(int port) {
            this.preferredPort = port;
            return this;
        }

        public Builder devMode(boolean devMode) {
            this.devMode = devMode;
            return this;
        }

        public Builder injectOther(boolean injectOther) {
            this.injectOther = injectOther;
            return this;
        }

        public Builder logPath(Path logPath) {
            this.logPath = logPath;
            return this;
        }

        public Builder fromEnvironment() {
            this.preferredPort = parsePort(System.getenv("POPUPKIT_PORT"), preferredPort);
            String dev = System.getenv("POPUPKIT_DEV");
            if (dev != null) {
                this.devMode = "1".equals(dev.trim()) || "true".equalsIgnoreCase(dev.trim());
            }
            return this;
        }

        /**
         * Accepts {@code --port=N}, {@code --port N}, {@code --log=FILE}, {@code --dev} and
         * {@code --inject-other}. Unknown arguments are ignored.
         */
        public Builder parseArgs(String[] args) {
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                if (arg.startsWith("--port=")) {
                    this.preferredPort = parsePort(arg.substring("--port=".length()), preferredPort);
                } else if ("--port".equals(arg) && i + 1 < args.length) {
                    this.preferredPort = parsePort(args[++i], preferredPort);
                } else if (arg.startsWith("--log=")) {
                    logPath(Paths.get(arg.substring("--log=".length())).toAbsolutePath().normalize());
                } else if ("--dev".equals(arg)) {
                    this.devMode = true;
                } else if ("--inject-other".equals(arg)) {
                    this.injectOther = true;
                }
            }
            return this;
        }

        private static int parsePort(String value, int fallback) {
            if (value == null || value.isBlank()) {
                return fallback;
            }
            try {
                int port = Integer.parseInt(value.trim());
                return port > 0 && port < 65536 ? port : fallback;
            } catch (NumberFormatException e) {
                return fallback;
            }
        }

        int getPreferredPort() {
            return preferredPort;
        }

        boolean isDevMode() {
            return devMode;
        }

        boolean isInjectOther() {
            return injectOther;
        }

        public AppConfig build() throws IOException {
            int port = findAvailablePort(preferredPort);
            Path log = logPath != null ? logPath : ensureLogDirectory();
            return new AppConfig(log, port, devMode, injectOther);
        }
    }
}
