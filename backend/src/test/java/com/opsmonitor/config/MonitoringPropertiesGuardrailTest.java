package com.opsmonitor.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MonitoringPropertiesGuardrailTest {

    @Test
    void agentBaseUrlIsNormalized() {
        MonitoringProperties properties = new MonitoringProperties();
        properties.getAgent().setBaseUrl(" http://agent.internal:2024// ");
        assertEquals("http://agent.internal:2024", properties.getAgent().getBaseUrl());

        properties.getAgent().setBaseUrl("   ");
        assertNull(properties.getAgent().getBaseUrl());
    }

    @Test
    void schedulerValuesAreClamped() {
        MonitoringProperties properties = new MonitoringProperties();
        properties.getScheduler().setTickIntervalMs(5);
        properties.getScheduler().setWorkerCount(0);
        properties.getScheduler().setMaxJobsPerTick(-1);
        assertEquals(1000, properties.getScheduler().getTickIntervalMs());
        assertEquals(1, properties.getScheduler().getWorkerCount());
        assertEquals(1, properties.getScheduler().getMaxJobsPerTick());
    }

    @Test
    void blankCronSecretDisablesTheCheck() {
        MonitoringProperties properties = new MonitoringProperties();
        properties.getScheduler().setCronSecret("  ");
        assertNull(properties.getScheduler().getCronSecret());
    }

    @Test
    void githubPrivateKeyNewlinesAreExpanded() {
        MonitoringProperties properties = new MonitoringProperties();
        assertFalse(properties.getGithub().isConfigured());

        properties.getGithub().setAppId("12345");
        properties.getGithub().setPrivateKey("line1\\nline2");
        assertEquals("line1\nline2", properties.getGithub().getPrivateKey());
        assertTrue(properties.getGithub().isConfigured());
    }
}
