package com.intentguard;

import java.io.IOException;
import java.net.ServerSocket;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Application configuration handling platform-specific paths and settings.
 */
public class AppConfig {

    private static final String APP_NAME = "IntentGuard";
    public static final String ALL_SCENARIOS = "all";

    public enum Mode {
        SERVE,
        GENERATE
    }

    private final Mode mode;
    private final Path logPath;
    private final int port;
    private final boolean devMode;
    private final Path templateDir;
    private final Path outputDir;
    private final List<String> scenarios;
    private final int numPrompts;
    private final Long seed;

    private AppConfig(Builder builder, Path logPath, int port) {
        this.mode = builder.mode;
        this.logPath = logPath;
        this.port = port;
        this.devMode = builder.devMode;
        this.templateDir = builder.templateDir;
        this.outputDir = builder.outputDir;
        this.scenarios = Collections.unmodifiableList(new ArrayList<>(builder.scenarios));
        this.numPrompts = builder.numPrompts;
        this.seed = builder.seed;
    }

    public Mode getMode() {
        return mode;
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

    public Path getTemplateDir() {
        return templateDir;
    }

    public Path getOutputDir() {
        return outputDir;
    }

    /**
     * Scenario ids requested for generation; contains {@value #ALL_SCENARIOS} when every scenario is wanted.
     */
    public List<String> getScenarios() {
        return scenarios;
    }

    public boolean isAllScenarios() {
        return scenarios.contains(ALL_SCENARIOS);
    }

    public int getNumPrompts() {
        return numPrompts;
    }

    public Long getSeed() {
        return seed;
    }

    /**
     * Get the log directory path based on the operating system.
     * Windows: %APPDATA%\IntentGuard\logs
     * macOS: ~/Library/Logs/IntentGuard
     * Linux: ~/.local/share/IntentGuard/logs
     */
    public static Path getDefaultLogDirectory() {
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

    /**
     * Find an available port, starting with the preferred port.
     * If the preferred port is in use, finds the next available port.
     */
    public static int findAvailablePort(int preferredPort) {
        if (isPortAvailable(preferredPort)) {
            return preferredPort;
        }

        try (ServerSocket socket = new ServerSocket(0)) {
            socket.setReuseAddress(true);
            return socket.getLocalPort();
        } catch (IOException e) {
            for (int port = preferredPort + 1; port < preferredPort + 100; port++) {
                if (isPortAvailable(port)) {
                    return port;
                }
            }
        }

        // Let the server fail later with a clear error
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

    /**
     * Builder for AppConfig.
     */
    public static class Builder {
        private Mode mode = Mode.SERVE;
        private Path logDir = null;
        private int preferredPort = 8090;
        private boolean devMode = false;
        private Path templateDir = Paths.get("attack_scenario_prompts");
        private Path outputDir = Paths.get("generated_prompts");
        private final List<String> scenarios = new ArrayList<>(List.of(ALL_SCENARIOS));
        private int numPrompts = 5;
        private Long seed = null;

        public Builder logDir(String path) {
            if (path != null && !path.isEmpty()) {
                this.logDir = Paths.get(path).toAbsolutePath().normalize();
            }
            return this;
        }

        public Builder port(int port) {
            this.preferredPort = port;
            return this;
        }

        public Builder devMode(boolean devMode) {
            this.devMode = devMode;
            return this;
        }

        public Builder templateDir(String path) {
            if (path != null && !path.isEmpty()) {
                this.templateDir = Paths.get(path);
            }
            return this;
        }

        public Builder outputDir(String path) {
            if (path != null && !path.isEmpty()) {
                this.outputDir = Paths.get(path);
            }
            return this;
        }

        public Builder mode(Mode mode) {
            if (mode != null) {
                this.mode = mode;
            }
            return this;
        }

        public Builder scenarios(List<String> ids) {
            if (ids != null && !ids.isEmpty()) {
                scenarios.clear();
                scenarios.addAll(ids);
            }
            return this;
        }

        public Builder numPrompts(int numPrompts) {
            if (numPrompts > 0) {
                this.numPrompts = numPrompts;
            }
            return this;
        }

        public Builder seed(Long seed) {
            this.seed = seed;
            return this;
        }

        public Builder parseArgs(String[] args) {
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];

                if (arg.startsWith("--port=")) {
                    parsePort(arg.substring("--port=".length()));
                } else if ("--port".equals(arg) && i + 1 < args.length) {
                    parsePort(args[++i]);
                }

                else if ("--dev".equals(arg)) {
                    this.devMode = true;
                } else if ("--generate".equals(arg)) {
                    this.mode = Mode.GENERATE;
                }

                else if (arg.startsWith("--log-dir=")) {
                    logDir(arg.substring("--log-dir=".length()));
                } else if ("--log-dir".equals(arg) && i + 1 < args.length) {
                    logDir(args[++i]);
                } else if (arg.startsWith("--templates=")) {
                    templateDir(arg.substring("--templates=".length()));
                } else if ("--templates".equals(arg) && i + 1 < args.length) {
                    templateDir(args[++i]);
                } else if (arg.startsWith("--output-dir=")) {
                    outputDir(arg.substring("--output-dir=".length()));
                } else if ("--output-dir".equals(arg) && i + 1 < args.length) {
                    outputDir(args[++i]);
                }

                else if (arg.startsWith("--num-prompts=")) {
                    parseNumPrompts(arg.substring("--num-prompts=".length()));
                } else if ("--num-prompts".equals(arg) && i + 1 < args.length) {
                    parseNumPrompts(args[++i]);
                } else if (arg.startsWith("--seed=")) {
                    parseSeed(arg.substring("--seed=".length()));
                } else if ("--seed".equals(arg) && i + 1 < args.length) {
                    parseSeed(args[++i]);
                }

                // --scenarios a,b or --scenarios a b (until the next flag)
                else if (arg.startsWith("--scenarios=")) {
                    scenarios(splitList(arg.substring("--scenarios=".length())));
                } else if ("--scenarios".equals(arg)) {
                    List<String> ids = new ArrayList<>();
                    while (i + 1 < args.length && !args[i + 1].startsWith("--")) {
                        ids.addAll(splitList(args[++i]));
                    }
                    scenarios(ids);
                }
            }
            return this;
        }

        private void parsePort(String value) {
            try {
                this.preferredPort = Integer.parseInt(value.trim());
            } catch (NumberFormatException ignored) {}
        }

        private void parseNumPrompts(String value) {
            try {
                numPrompts(Integer.parseInt(value.trim()));
            } catch (NumberFormatException ignored) {}
        }

        private void parseSeed(String value) {
            try {
                this.seed = Long.parseLong(value.trim());
            } catch (NumberFormatException ignored) {}
        }

        private static List<String> splitList(String value) {
            List<String> out = new ArrayList<>();
            for (String part : value.split(",")) {
                String trimmed = part.trim();
                if (!trimmed.isEmpty()) {
                    out.add(trimmed);
                }
            }
            return out;
        }

        public AppConfig build() throws IOException {
            Path dir = logDir != null ? logDir : getDefaultLogDirectory();
            Files.createDirectories(dir);
            Path logPath = dir.resolve("intent-guard.log");

            // Generation never binds a port.
            int port = mode == Mode.SERVE ? findAvailablePort(preferredPort) : preferredPort;

            return new AppConfig(this, logPath, port);
        }
    }
}
