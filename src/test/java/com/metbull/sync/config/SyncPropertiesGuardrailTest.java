package com.metbull.sync.config;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SyncPropertiesGuardrailTest {

    @Test
    void userAgentFallsBackToBrowserDefault() {
        SyncProperties properties = new SyncProperties();
        properties.setUserAgent("   ");
        assertTrue(properties.getUserAgent().startsWith("Mozilla/5.0"));
    }

    @Test
    void numericSettingsAreClamped() {
        SyncProperties properties = new SyncProperties();
        properties.setRequestTimeoutSeconds(0);
        properties.setRecordsPerPage(-5);
        properties.setCheckpointEveryPages(0);
        assertEquals(1, properties.getRequestTimeoutSeconds());
        assertEquals(1, properties.getRecordsPerPage());
        assertEquals(1, properties.getCheckpointEveryPages());
    }

    @Test
    void profileBoundsAreNormalized() {
        SyncProperties.Profile profile = new SyncProperties.Profile("odd", 10, 4);
        profile.setEmptyPagesBeforeStop(0);
        profile.setPageDelayMs(-1);
        assertEquals(10, profile.getEndPage());
        assertEquals(1, profile.getEmptyPagesBeforeStop());
        assertEquals(0, profile.getPageDelayMs());
    }

    @Test
    void outputAndCheckpointPathsDefaultFromInput() {
        SyncProperties.Data data = new SyncProperties.Data();
        data.setInputCsv("data/landings.csv");
        assertThat(data.getOutputCsv()).isEqualTo("data/landings.csv");
        assertThat(data.getCheckpointJson()).isEqualTo("data/landings.csv.checkpoint.json");
    }

    @Test
    void profilesAreLookedUpCaseInsensitivelyAndNamed() {
        SyncProperties properties = new SyncProperties();
        properties.getProfiles().put("deep", new SyncProperties.Profile());
        SyncProperties.Profile profile = properties.requireProfile(" DEEP ");
        assertThat(profile.getName()).isEqualTo("deep");
        assertThatThrownBy(() -> properties.requireProfile("nope"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("nope");
    }
}
