package com.finopti;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Map;

/**
 * Application configuration: listener port, registry catalog, policy service,
 * delegation timeouts and the agents each remediation phase delegates to.
 */
public class AppConfig {

    private static final String APP_NAME = "FinOpti";

    public static final int DEFAULT_PORT = 8080;
    public static final String DEFAULT_POLICY_URL = "http://opa:8181";
    public static final long DEFAULT_POLICY_TIMEOUT_MS = 5_000L;
    public static final long DEFAULT_AGENT_TIMEOUT_MS = 600_000L;

    private final int port;
    private final Path registryPath;
    private final String policyUrl;
    private final Duration policyTimeout;
    private final Duration agentTimeout;
    private final String defaultAgentId;
    private final int validationAttempts;
    private final String infraAgentId;
    private final String monitoringAgentId;
    private final String browserAgentId;
    private final String storageAgentId;
    private final Path logPath;
    private final boolean devMode;

    private AppConfig(Builder b) {
        this.port = b.port;
        this.registryPath = b.registryPath;
        this.policyUrl = b.policyUrl;
        this.policyTimeout = Duration.ofMillis(b.policyTimeoutMs);
        this.agentTimeout = Duration.ofMillis(b.agentTimeoutMs);
        this.defaultAgentId = b.defaultAgentId;
        this.validationAttempts = b.validationAttempts;
        this.infraAgentId = b.infraAgentId;
        this.monitoringAgentId = b.monitoringAgentId;
        this.browserAgentId = b.browserAgentId;
        this.storageAgentId = b.storageAgentId;
        this.logPath = b.logPath != null ? b.logPath : getLogFilePath();
        this.devMode = b.devMode;
    }

    public int getPort() {
        return port;
    }

    /**
     * Catalog file to load agents from, or null to use the bundled catalog.
     */
    public Path getRegistryPath() {
        return registryPath;
    }

    public String getPolicyUrl() {
        return policyUrl;
    }

    public Duration getPolicyTimeout() {
        return policyTimeout;
    }

    public Duration getAgentTimeout() {
        return agentTimeout;
    }

    public String getDefaultAgentId() {
        return defaultAgentId;
    }

    public int getValidationAttempts() {
        return validationAttempts;
    }

    public String getInfraAgentId() {
        return infraAgentId;
    }

    public String getMonitoringAgentId() {
        return monitoringAgentId;
    }

    public String getBrowserAgentId() {
        return browserAgentId;
    }

    public String getStorageAgentId() {
        return storageAgentId;
    }

    public Path getLogPath() {
        return logPath;
    }

    public boolean isDevMode() {
        return devMode;
    }

    /**
     * Get the log directory path based on the operating system.
     * Windows: %APPDATA%\FinOpti\logs
     * macOS: ~/Library/Logs/FinOpti
     * Linux: ~/.local/share/FinOpti/logs
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
        return getLogDirectory().resolve("orchestrator.log");
    }

    /**
     * Ensure the parent directory of the given log file exists.
     */
    public static Path ensureLogDirectory(Path logFile) throws IOException {
        Path parent = logFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        return logFile;
    }

    /**
     * Builder for AppConfig. Environment values are applied first, then
     * command-line arguments override them.
     */
    public static class Builder {
        private int port = DEFAULT_PORT;
        private Path registryPath = null;
        private String policyUrl = DEFAULT_POLICY_URL;
        private long policyTimeoutMs = DEFAULT_POLICY_TIMEOUT_MS;
        private long agentTimeoutMs = DEFAULT_AGENT_TIMEOUT_MS;
        private String defaultAgentId = "gcloud_infrastructure_specialist";
        private int validationAttempts = 1;
        private String infraAgentId = "gcloud_infrastructure_specialist";
        private String monitoringAgentId = "monitoring_specialist";
        private String browserAgentId = "puppeteer_browser_specialist";
        private String storageAgentId = "storage_specialist";
        private Path logPath = null;
        private boolean devMode = false;

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder registryPath(String path) {
            if (path != null && !path.isBlank()) {
                this.registryPath = Paths.get(path.trim()).toAbsolutePath().normalize();
            }
            return this;
        }

        public Builder policyUrl(String url) {
            if (url != null && !url.isBlank()) {
                this.policyUrl = url.trim();
            }
            return this;
        }

        public Builder policyTimeoutMs(long timeoutMs) {
            if (timeoutMs > 0) {
                this.policyTimeoutMs = timeoutMs;
            }
            return this;
        }

        public Builder agentTimeoutMs(long timeoutMs) {
            if (timeoutMs > 0) {
                this.agentTimeoutMs = timeoutMs;
            }
            return this;
        }

        public Builder defaultAgentId(String agentId) {
            if (agentId != null && !agentId.isBlank()) {
                this.defaultAgentId = agentId.trim();
            }
            return this;
        }

        public Builder validationAttempts(int attempts) {
            this.validationAttempts = Math.max(1, attempts);
            return this;
        }

        public Builder infraAgentId(String agentId) {
            if (agentId != null && !agentId.isBlank()) {
                this.infraAgentId = agentId.trim();
            }
            return this;
        }

        public Builder monitoringAgentId(String agentId) {
            if (agentId != null && !agentId.isBlank()) {
                this.monitoringAgentId = agentId.trim();
            }
            return this;
        }

        public Builder browserAgentId(String agentId) {
            if (agentId != null && !agentId.isBlank()) {
                this.browserAgentId = agentId.trim();
            }
            return this;
        }

        public Builder storageAgentId(String agentId) {
            if (agentId != null && !agentId.isBlank()) {
                this.storageAgentId = agentId.trim();
            }
            return this;
        }

        public Builder logPath(String path) {
            if (path != null && !path.isBlank()) {
                this.logPath = Paths.get(path.trim()).toAbsolutePath().normalize();
            }
            return this;
        }

        public Builder devMode(boolean devMode) {
            this.devMode = devMode;
            return this;
        }

        public Builder fromEnvironment(Map<String, String> env) {
            if (env == null) {
                return this;
            }
            Integer envPort = parseInt(env.get("FINOPTI_PORT"));
            if (envPort != null) {
                port(envPort);
            }
            registryPath(env.get("AGENT_REGISTRY_PATH"));
            policyUrl(env.get("OPA_URL"));
            Long policyTimeout = parseLong(env.get("OPA_TIMEOUT_MS"));
            if (policyTimeout != null) {
                policyTimeoutMs(policyTimeout);
            }
            Long agentTimeout = parseLong(env.get("AGENT_TIMEOUT_MS"));
            if (agentTimeout != null) {
                agentTimeoutMs(agentTimeout);
            }
            Integer attempts = parseInt(env.get("VALIDATION_ATTEMPTS"));
            if (attempts != null) {
                validationAttempts(attempts);
            }
            defaultAgentId(env.get("DEFAULT_AGENT_ID"));
            infraAgentId(env.get("INFRA_AGENT_ID"));
            monitoringAgentId(env.get("MONITORING_AGENT_ID"));
            browserAgentId(env.get("BROWSER_AGENT_ID"));
            storageAgentId(env.get("STORAGE_AGENT_ID"));
            logPath(env.get("FINOPTI_LOG_PATH"));
            return this;
        }

        public Builder parseArgs(String[] args) {
            if (args == null) {
                return this;
            }
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                String value = null;
                String name = arg;
                int eq = arg.indexOf('=');
                if (arg.startsWith("--") && eq > 0) {
                    name = arg.substring(0, eq);
                    value = arg.substring(eq + 1);
                } else if (arg.startsWith("--") && !"--dev".equals(arg) && i + 1 < args.length) {
                    value = args[++i];
                }

                switch (name) {
                    case "--port": {
                        Integer parsed = parseInt(value);
                        if (parsed != null) {
                            port(parsed);
                        }
                        break;
                    }
                    case "--registry":
                        registryPath(value);
                        break;
                    case "--policy-url":
                        policyUrl(value);
                        break;
                    case "--policy-timeout-ms": {
                        Long parsed = parseLong(value);
                        if (parsed != null) {
                            policyTimeoutMs(parsed);
                        }
                        break;
                    }
                    case "--agent-timeout-ms": {
                        Long parsed = parseLong(value);
                        if (parsed != null) {
                            agentTimeoutMs(parsed);
                        }
                        break;
                    }
                    case "--log":
                        logPath(value);
                        break;
                    case "--dev":
                        this.devMode = true;
                        break;
                    default:
                        break;
                }
            }
            return this;
        }

        public AppConfig build() {
            return new AppConfig(this);
        }

        private static Integer parseInt(String value) {
            if (value == null || value.isBlank()) {
                return null;
            }
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }

        private static Long parseLong(String value) {
            if (value == null || value.isBlank()) {
                return null;
            }
            try {
                return Long.parseLong(value.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
    }
}
