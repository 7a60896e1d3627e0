package com.finopti;

import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AppConfigTest {

    @Test
    void defaults() {
        AppConfig config = new AppConfig.Builder().build();

        assertEquals(AppConfig.DEFAULT_PORT, config.getPort());
        assertNull(config.getRegistryPath());
        assertEquals("http://opa:8181", config.getPolicyUrl());
        assertEquals(Duration.ofSeconds(5), config.getPolicyTimeout());
        assertEquals(Duration.ofMinutes(10), config.getAgentTimeout());
        assertEquals(1, config.getValidationAttempts());
        assertEquals("storage_specialist", config.getStorageAgentId());
        assertFalse(config.isDevMode());
    }

    @Test
    void environmentIsRead() {
        AppConfig config = new AppConfig.Builder()
            .fromEnvironment(Map.of(
                "FINOPTI_PORT", "9090",
                "OPA_URL", "http://policy:8181",
                "OPA_TIMEOUT_MS", "750",
                "VALIDATION_ATTEMPTS", "3",
                "MONITORING_AGENT_ID", "observability_specialist",
                "AGENT_REGISTRY_PATH", "/etc/finopti/agents.json"))
            .build();

        assertEquals(9090, config.getPort());
        assertEquals("http://policy:8181", config.getPolicyUrl());
        assertEquals(Duration.ofMillis(750), config.getPolicyTimeout());
        assertEquals(3, config.getValidationAttempts());
        assertEquals("observability_specialist", config.getMonitoringAgentId());
        assertEquals(Paths.get("/etc/finopti/agents.json").toAbsolutePath().normalize(), config.getRegistryPath());
    }

    @Test
    void argumentsOverrideEnvironment() {
        AppConfig config = new AppConfig.Builder()
            .fromEnvironment(Map.of("FINOPTI_PORT", "9090", "OPA_URL", "http://env:8181"))
            .parseArgs(new String[] {"--port", "7070", "--policy-url=http://args:8181", "--dev",
                "--agent-timeout-ms", "1500"})
            .build();

        assertEquals(7070, config.getPort());
        assertEquals("http://args:8181", config.getPolicyUrl());
        assertEquals(Duration.ofMillis(1500), config.getAgentTimeout());
        assertTrue(config.isDevMode());
    }

    @Test
    void invalidNumbersKeepDefaults() {
        AppConfig config = new AppConfig.Builder()
            .fromEnvironment(Map.of("FINOPTI_PORT", "eighty", "OPA_TIMEOUT_MS", "-5"))
            .parseArgs(new String[] {"--policy-timeout-ms", "soon"})
            .build();

        assertEquals(AppConfig.DEFAULT_PORT, config.getPort());
        assertEquals(Duration.ofMillis(AppConfig.DEFAULT_POLICY_TIMEOUT_MS), config.getPolicyTimeout());
    }
}
