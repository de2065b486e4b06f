package io.scraperelay.spring;

import io.scraperelay.rules.ExpressionLabeler;
import io.scraperelay.rules.LabelMatcherToolLocator;
import io.scraperelay.rules.PromqlTransformLocator;
import io.scraperelay.sdk.ports.RelationDataPort;
import io.scraperelay.sdk.ports.UnitContextPort;
import io.scraperelay.sdk.runtime.AggregatorRelations;
import io.scraperelay.sdk.runtime.JobLabeler;
import io.scraperelay.sdk.runtime.MetricsEndpointAggregator;
import io.scraperelay.sdk.runtime.MetricsEndpointConsumer;
import io.scraperelay.sdk.runtime.MetricsEndpointProvider;
import io.scraperelay.sdk.runtime.PrometheusRulesProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Wires the scrape relay components around the host's {@link RelationDataPort} and
 * {@link UnitContextPort}. Each role is opt-in; the host dispatches relation notifications
 * to the resulting {@code RelationEventListener} beans.
 */
@AutoConfiguration
@ConditionalOnProperty(prefix = "scrape-relay", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(ScrapeRelayProperties.class)
public class ScrapeRelayAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(ScrapeRelayAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    JobLabeler scrapeRelayJobLabeler() {
        return new JobLabeler();
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "scrape-relay.transform", name = "enabled", havingValue = "true", matchIfMissing = true)
    LabelMatcherToolLocator scrapeRelayLabelMatcherToolLocator(ScrapeRelayProperties properties) {
        ScrapeRelayProperties.TransformProperties transform = properties.getTransform();
        PromqlTransformLocator locator =
            PromqlTransformLocator.forCurrentPlatform(transform.getDirectory(), transform.getTimeout());
        log.debug("Label matcher tool expected at {}", transform.getDirectory().resolve(locator.toolName()));
        return locator;
    }

    @Bean
    @ConditionalOnMissingBean
    ExpressionLabeler scrapeRelayExpressionLabeler(ObjectProvider<LabelMatcherToolLocator> locator) {
        LabelMatcherToolLocator available = locator.getIfAvailable();
        return available == null ? ExpressionLabeler.passThrough() : new ExpressionLabeler(available);
    }

    @Bean
    @ConditionalOnBean(RelationDataPort.class)
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "scrape-relay.consumer", name = "enabled", havingValue = "true")
    MetricsEndpointConsumer scrapeRelayConsumer(RelationDataPort relations, ScrapeRelayProperties properties,
                                                JobLabeler jobLabeler, ExpressionLabeler expressionLabeler) {
        return new MetricsEndpointConsumer(relations, properties.getConsumer().getRelationName(),
            jobLabeler, expressionLabeler);
    }

    @Bean
    @ConditionalOnBean({RelationDataPort.class, UnitContextPort.class})
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "scrape-relay.provider", name = "enabled", havingValue = "true")
    MetricsEndpointProvider scrapeRelayProvider(RelationDataPort relations, UnitContextPort unit,
                                                ScrapeRelayProperties properties) {
        ScrapeRelayProperties.ProviderProperties provider = properties.getProvider();
        MetricsEndpointProvider endpoint = new MetricsEndpointProvider(relations, unit, provider.getRelationName());
        if (provider.getAlertRulesPath() != null && !provider.getAlertRulesPath().isBlank()) {
            endpoint.setAlertRulesPath(provider.getBaseDirectory(), provider.getAlertRulesPath());
        }
        return endpoint;
    }

    @Bean
    @ConditionalOnBean({RelationDataPort.class, UnitContextPort.class})
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "scrape-relay.aggregator", name = "enabled", havingValue = "true")
    MetricsEndpointAggregator scrapeRelayAggregator(RelationDataPort relations, UnitContextPort unit,
                                                    ScrapeRelayProperties properties) {
        ScrapeRelayProperties.AggregatorProperties aggregator = properties.getAggregator();
        AggregatorRelations names = new AggregatorRelations(
            aggregator.getPrometheusRelation(),
            aggregator.getScrapeTargetRelation(),
            aggregator.getAlertRulesRelation());
        return new MetricsEndpointAggregator(relations, unit, names, aggregator.isRelabelInstance());
    }

    @Bean
    @ConditionalOnBean({RelationDataPort.class, UnitContextPort.class})
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "scrape-relay.rules", name = "enabled", havingValue = "true")
    PrometheusRulesProvider scrapeRelayRulesProvider(RelationDataPort relations, UnitContextPort unit,
                                                     ScrapeRelayProperties properties) {
        ScrapeRelayProperties.RulesProperties rules = properties.getRules();
        return new PrometheusRulesProvider(relations, unit, rules.getRelationName(),
            rules.getBaseDirectory(), rules.getDirectory(), rules.isRecursive());
    }
}
