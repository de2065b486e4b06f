package io.scraperelay.spring;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Path;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class ScrapeRelayPropertiesTest {

    @Test
    void defaultsMatchConventionalRelationNames() {
        ScrapeRelayProperties properties = new ScrapeRelayProperties();

        assertThat(properties.isEnabled()).isTrue();
        assertThat(properties.getConsumer().getRelationName()).isEqualTo("metrics-endpoint");
        assertThat(properties.getProvider().getRelationName()).isEqualTo("metrics-endpoint");
        assertThat(properties.getProvider().getAlertRulesPath()).isEqualTo("./src/prometheus_alert_rules");
        assertThat(properties.getRules().getRelationName()).isEqualTo("prometheus-rules");
        assertThat(properties.getRules().isRecursive()).isTrue();
        assertThat(properties.getAggregator().getPrometheusRelation()).isEqualTo("downstream-prometheus-scrape");
        assertThat(properties.getAggregator().getScrapeTargetRelation()).isEqualTo("prometheus-target");
        assertThat(properties.getAggregator().getAlertRulesRelation()).isEqualTo("prometheus-rules");
        assertThat(properties.getAggregator().isRelabelInstance()).isTrue();
        assertThat(properties.getTransform().getTimeout()).isEqualTo(Duration.ofSeconds(5));
        assertThat(properties.getTransform().getDirectory()).isEqualTo(Path.of("."));
    }

    @Test
    void rejectsBlankRelationNames() {
        ScrapeRelayProperties properties = new ScrapeRelayProperties();

        assertThatThrownBy(() -> properties.getConsumer().setRelationName(" "))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("scrape-relay.relation-name must not be null or blank");
        assertThatThrownBy(() -> properties.getAggregator().setScrapeTargetRelation(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("scrape-relay.aggregator.scrape-target-relation must not be null or blank");
    }

    @Test
    void rejectsNonPositiveToolTimeout() {
        ScrapeRelayProperties.TransformProperties transform = new ScrapeRelayProperties().getTransform();

        assertThatThrownBy(() -> transform.setTimeout(Duration.ZERO))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("scrape-relay.transform.timeout must be positive");
    }
}
