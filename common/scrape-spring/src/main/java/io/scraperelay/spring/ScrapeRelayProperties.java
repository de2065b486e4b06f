package io.scraperelay.spring;

import io.scraperelay.topology.TopologyDefaults;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.nio.file.Path;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties that drive the scrape relay auto-configuration.
 */
@Validated
@ConfigurationProperties(prefix = "scrape-relay")
public class ScrapeRelayProperties {

    private boolean enabled = true;
    @Valid
    private final ConsumerProperties consumer = new ConsumerProperties();
    @Valid
    private final ProviderProperties provider = new ProviderProperties();
    @Valid
    private final AggregatorProperties aggregator = new AggregatorProperties();
    @Valid
    private final RulesProperties rules = new RulesProperties();
    @Valid
    private final TransformProperties transform = new TransformProperties();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public ConsumerProperties getConsumer() {
        return consumer;
    }

    public ProviderProperties getProvider() {
        return provider;
    }

    public AggregatorProperties getAggregator() {
        return aggregator;
    }

    public RulesProperties getRules() {
        return rules;
    }

    public TransformProperties getTransform() {
        return transform;
    }

    public static class EndpointProperties {
        private boolean enabled;
        @NotBlank
        private String relationName = TopologyDefaults.DEFAULT_RELATION_NAME;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getRelationName() {
            return relationName;
        }

        public void setRelationName(String relationName) {
            this.relationName = requireText(relationName, "relation-name");
        }
    }

    public static final class ConsumerProperties extends EndpointProperties {
    }

    public static final class ProviderProperties extends EndpointProperties {
        private Path baseDirectory = Path.of(".");
        private String alertRulesPath = TopologyDefaults.DEFAULT_ALERT_RULES_RELATIVE_PATH;

        public Path getBaseDirectory() {
            return baseDirectory;
        }

        public void setBaseDirectory(Path baseDirectory) {
            this.baseDirectory = baseDirectory;
        }

        public String getAlertRulesPath() {
            return alertRulesPath;
        }

        public void setAlertRulesPath(String alertRulesPath) {
            this.alertRulesPath = alertRulesPath;
        }
    }

    public static final class RulesProperties extends EndpointProperties {
        private Path baseDirectory = Path.of(".");
        private String directory = TopologyDefaults.DEFAULT_ALERT_RULES_RELATIVE_PATH;
        private boolean recursive = true;

        public RulesProperties() {
            setRelationName("prometheus-rules");
        }

        public Path getBaseDirectory() {
            return baseDirectory;
        }

        public void setBaseDirectory(Path baseDirectory) {
            this.baseDirectory = baseDirectory;
        }

        public String getDirectory() {
            return directory;
        }

        public void setDirectory(String directory) {
            this.directory = directory;
        }

        public boolean isRecursive() {
            return recursive;
        }

        public void setRecursive(boolean recursive) {
            this.recursive = recursive;
        }
    }

    public static final class AggregatorProperties {
        private boolean enabled;
        @NotBlank
        private String prometheusRelation = "downstream-prometheus-scrape";
        @NotBlank
        private String scrapeTargetRelation = "prometheus-target";
        @NotBlank
        private String alertRulesRelation = "prometheus-rules";
        private boolean relabelInstance = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getPrometheusRelation() {
            return prometheusRelation;
        }

        public void setPrometheusRelation(String prometheusRelation) {
            this.prometheusRelation = requireText(prometheusRelation, "aggregator.prometheus-relation");
        }

        public String getScrapeTargetRelation() {
            return scrapeTargetRelation;
        }

        public void setScrapeTargetRelation(String scrapeTargetRelation) {
            this.scrapeTargetRelation = requireText(scrapeTargetRelation,
                "aggregator.scrape-target-relation");
        }

        public String getAlertRulesRelation() {
            return alertRulesRelation;
        }

        public void setAlertRulesRelation(String alertRulesRelation) {
            this.alertRulesRelation = requireText(alertRulesRelation, "aggregator.alert-rules-relation");
        }

        public boolean isRelabelInstance() {
            return relabelInstance;
        }

        public void setRelabelInstance(boolean relabelInstance) {
            this.relabelInstance = relabelInstance;
        }
    }

    /**
     * Location and limits of the external PromQL label-injection tool. When disabled,
     * alert expressions are forwarded unchanged.
     */
    public static final class TransformProperties {
        private boolean enabled = true;
        @NotNull
        private Path directory = Path.of(".");
        @NotNull
        private Duration timeout = Duration.ofSeconds(5);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Path getDirectory() {
            return directory;
        }

        public void setDirectory(Path directory) {
            this.directory = directory;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            if (timeout == null || timeout.isNegative() || timeout.isZero()) {
                throw new IllegalArgumentException("scrape-relay.transform.timeout must be positive");
            }
            this.timeout = timeout;
        }
    }

    private static String requireText(String value, String property) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("scrape-relay." + property + " must not be null or blank");
        }
        return value;
    }
}
