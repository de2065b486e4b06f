package io.scraperelay.topology;

/**
 * Compile-time constants shared by every component that labels or names scrape
 * configuration. Safe for use in annotation attributes and other constant-expression
 * contexts.
 */
public final class TopologyDefaults {

  private TopologyDefaults() {
  }

  public static final String LABEL_PREFIX = "juju_";

  public static final String MODEL_LABEL = LABEL_PREFIX + "model";

  public static final String MODEL_UUID_LABEL = LABEL_PREFIX + "model_uuid";

  public static final String APPLICATION_LABEL = LABEL_PREFIX + "application";

  public static final String UNIT_LABEL = LABEL_PREFIX + "unit";

  public static final String CHARM_LABEL = LABEL_PREFIX + "charm";

  /** Placeholder replaced by {@link Topology#render(String)}. */
  public static final String TOPOLOGY_STUB = "%%juju_topology%%";

  public static final int SHORT_MODEL_UUID_LENGTH = 7;

  public static final String RELATION_INTERFACE = "prometheus-scrape";

  public static final String DEFAULT_RELATION_NAME = "metrics-endpoint";

  public static final String DEFAULT_ALERT_RULES_RELATIVE_PATH = "./src/prometheus_alert_rules";

  public static final String SCRAPE_JOB_SUFFIX = "_prometheus_scrape";

  public static final String ALERT_GROUP_SUFFIX = "alerts";

  public static final String AGGREGATOR_GROUP_SUFFIX = "_alert_rules";
}
