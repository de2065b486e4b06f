package io.scraperelay.sdk.runtime;

import java.util.Objects;

/**
 * Endpoint names used by {@link MetricsEndpointAggregator}.
 *
 * @param prometheus   relation towards the monitoring side
 * @param scrapeTarget relation whose units publish {@code hostname} and {@code port}
 * @param alertRules   relation whose units publish a {@code groups} rule list
 */
public record AggregatorRelations(String prometheus, String scrapeTarget, String alertRules) {

  public AggregatorRelations {
    Objects.requireNonNull(prometheus, "prometheus");
    Objects.requireNonNull(scrapeTarget, "scrapeTarget");
    Objects.requireNonNull(alertRules, "alertRules");
  }
}
