package com.metbull.sync;

import com.metbull.sync.config.SyncProperties;
import com.metbull.sync.reconcile.service.ReconciliationOrchestrator;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class MetbullSyncApplicationTest {

    @Autowired
    private SyncProperties properties;

    @Autowired
    private ReconciliationOrchestrator orchestrator;

    @Test
    void contextLoadsWithConfiguredProfiles() {
        assertThat(orchestrator).isNotNull();
        assertThat(properties.getCli().isRun()).isFalse();
        assertThat(properties.getProfiles()).containsKeys("recent", "deep", "rescan", "history", "harvest");
        assertThat(properties.requireProfile("deep").getYearFloor()).isEqualTo(2012);
        assertThat(properties.requireProfile("rescan").isStopOnEmptyPage()).isFalse();
        assertThat(properties.requireProfile("rescan").getPageDelayMs()).isEqualTo(500);
        assertThat(properties.requireProfile("history").getStartPage()).isEqualTo(100);
    }
}
