package com.axonops.ingestprep.config;

import com.axonops.ingestprep.metrics.NoOpMetricsRegistry;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class IngestConfigTest {

    @Test
    void testDefaults() {
        IngestConfig config = IngestConfig.DEFAULT;

        assertThat(config.maxLabelsPerTimeseries()).isEqualTo(40);
        assertThat(config.maxLabelValueLen()).isEqualTo(4096);
        assertThat(config.logThrottleIntervalMillis()).isEqualTo(5000);
        assertThat(config.maxIdleExtractors()).isEqualTo(1024);
        assertThat(config.metricsRegistry()).isSameAs(NoOpMetricsRegistry.INSTANCE);
        assertThat(IngestConfig.MAX_LABEL_NAME_LEN).isEqualTo(256);
        assertThat(IngestConfig.builder().build()).isEqualTo(IngestConfig.DEFAULT);
    }

    @Test
    void testBuilder() {
        IngestConfig config = IngestConfig.builder()
            .maxLabelsPerTimeseries(30)
            .maxLabelValueLen(1024)
            .logThrottleIntervalMillis(100)
            .maxIdleExtractors(0)
            .build();

        assertThat(config.maxLabelsPerTimeseries()).isEqualTo(30);
        assertThat(config.maxLabelValueLen()).isEqualTo(1024);
        assertThat(config.logThrottleIntervalMillis()).isEqualTo(100);
        assertThat(config.maxIdleExtractors()).isZero();
    }

    @Test
    void testRejectsNonPositiveLimits() {
        assertThatThrownBy(() -> IngestConfig.builder().maxLabelsPerTimeseries(0).build())
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("maxLabelsPerTimeseries");
        assertThatThrownBy(() -> IngestConfig.builder().maxLabelValueLen(-1).build())
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("maxLabelValueLen");
        assertThatThrownBy(() -> IngestConfig.builder().logThrottleIntervalMillis(0).build())
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("logThrottleIntervalMillis");
        assertThatThrownBy(() -> IngestConfig.builder().maxIdleExtractors(-1).build())
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("maxIdleExtractors");
    }

    @Test
    void testRejectsNullMetricsRegistry() {
        assertThatThrownBy(() -> IngestConfig.builder().metricsRegistry(null))
            .isInstanceOf(NullPointerException.class)
            .hasMessageContaining("metricsRegistry cannot be null");
        assertThatThrownBy(() -> new IngestConfig(40, 4096, 5000, 1, null))
            .isInstanceOf(NullPointerException.class);
    }
}
