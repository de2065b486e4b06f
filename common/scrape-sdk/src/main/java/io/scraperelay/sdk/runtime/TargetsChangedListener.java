package io.scraperelay.sdk.runtime;

/**
 * Notified by {@link MetricsEndpointConsumer} when the scrape targets or alert rules of a
 * relation may have changed. Implementations typically re-read
 * {@link MetricsEndpointConsumer#jobs()} and rewrite their configuration.
 */
@FunctionalInterface
public interface TargetsChangedListener {

  void targetsChanged(int relationId);
}
