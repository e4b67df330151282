package com.manifold;

import com.manifold.core.engine.ResearchEngine;
import com.manifold.core.health.HealthCheckService;
import com.manifold.core.health.HealthStatus;
import com.manifold.core.store.InMemoryRunStore;
import com.manifold.core.store.RunStore;
import com.manifold.source.SourceToolRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Boots the full application context with the test profile (in-memory store, no backends).
 */
@SpringBootTest
class ManifoldApplicationTest {

    @Autowired
    private ResearchEngine researchEngine;

    @Autowired
    private RunStore runStore;

    @Autowired
    private SourceToolRegistry registry;

    @Autowired
    private HealthCheckService healthCheckService;

    @Test
    @DisplayName("context wires the engine against the configured store")
    void contextLoads() {
        assertNotNull(researchEngine);
        assertInstanceOf(InMemoryRunStore.class, runStore);
    }

    @Test
    @DisplayName("with no endpoints configured no capability is bound and health reports it")
    void noBackendsBound() {
        assertTrue(registry.capabilities().isEmpty());
        var capabilities = healthCheckService.checkAll().stream()
                .filter(h -> h.component().equals("capabilities"))
                .findFirst()
                .orElseThrow();
        assertEquals(HealthStatus.Status.DOWN, capabilities.status());
    }
}
