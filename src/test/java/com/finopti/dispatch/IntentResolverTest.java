package com.finopti.dispatch;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.finopti.models.AgentDescriptor;
import com.finopti.registry.AgentRegistry;
import com.finopti.support.TestCatalogs;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class IntentResolverTest {

    @TempDir
    Path tempDir;

    private AgentRegistry registry;

    @BeforeEach
    void setUp() throws Exception {
        registry = TestCatalogs.standardRegistry(tempDir, new ObjectMapper());
    }

    @Test
    void picksAgentWithMostCapabilityHits() {
        IntentResolver resolver = new IntentResolver(registry, null);

        assertEquals("puppeteer_browser_specialist", resolver.resolve("Open the browser and take a screenshot"));
        assertEquals("storage_specialist", resolver.resolve("upload the report to the bucket"));
    }

    @Test
    void shortCapabilitiesMatchWholeWordsOnly() {
        IntentResolver resolver = new IntentResolver(registry, null);

        assertEquals("gcloud_infrastructure_specialist", resolver.resolve("grant the IAM role"));
        assertNull(resolver.resolve("the diameter is wrong"), "'iam' inside a word is not a match");
    }

    @Test
    void fallsBackToDefaultAgent() {
        IntentResolver resolver = new IntentResolver(registry, "monitoring_specialist");

        assertEquals("monitoring_specialist", resolver.resolve("something unrelated"));
    }

    @Test
    void defaultMissingFromRegistryGivesNull() {
        IntentResolver resolver = new IntentResolver(registry, "retired_agent");

        assertNull(resolver.resolve("something unrelated"));
        assertNull(resolver.resolve("  "));
    }

    @Test
    void scoreCountsEachCapabilityOnce() {
        AgentDescriptor agent = new AgentDescriptor("a", "A", "http://a", List.of("vm", "cloud run"));

        assertEquals(2, IntentResolver.score(agent, "restart the vm on cloud run", Set.of("restart", "the", "vm", "on", "cloud", "run")));
        assertEquals(0, IntentResolver.score(agent, "vmware", Set.of("vmware")));
    }
}
