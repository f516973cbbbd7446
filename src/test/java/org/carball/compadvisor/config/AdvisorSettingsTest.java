package org.carball.compadvisor.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

public class AdvisorSettingsTest {

    @Test
    void shouldExcludeSystemSchemas() {
        AdvisorSettings settings = AdvisorSettings.defaults();

        assertThat(settings.isExcludedSchema("SYS")).isTrue();
        assertThat(settings.isExcludedSchema("system")).isTrue();
        assertThat(settings.isExcludedSchema("APEX_230100")).isTrue();
        assertThat(settings.isExcludedSchema("ORACLE_OCM")).isTrue();
        assertThat(settings.isExcludedSchema("SALES")).isFalse();
        assertThat(settings.isExcludedSchema(null)).isFalse();
    }

    @Test
    void shouldExposeDurations() {
        AdvisorSettings settings = AdvisorSettings.builder()
                .objectTimeoutSeconds(5)
                .executionTimeoutMinutes(2)
                .modificationWindowDays(14)
                .build();

        assertThat(settings.getObjectTimeout()).isEqualTo(Duration.ofSeconds(5));
        assertThat(settings.getExecutionTimeout()).isEqualTo(Duration.ofMinutes(2));
        assertThat(settings.getModificationWindow()).isEqualTo(Duration.ofDays(14));
    }

    @Test
    void shouldSummarizeConfiguration() {
        String summary = AdvisorSettings.defaults().toBuilder().minSavingsPct(25).build().getConfigurationSummary();

        assertThat(summary).contains("Parallelism: 4").contains("Min savings: 25");
    }
}
