package io.scraperelay.model;

/**
 * Keys exchanged over the scrape relation.
 */
public final class RelationDataKeys {

    private RelationDataKeys() {
    }

    // application data
    public static final String SCRAPE_METADATA = "scrape_metadata";
    public static final String SCRAPE_JOBS = "scrape_jobs";
    public static final String ALERT_RULES = "alert_rules";

    // unit data written by providers
    public static final String UNIT_ADDRESS = "prometheus_scrape_unit_address";
    public static final String UNIT_NAME = "prometheus_scrape_unit_name";
    /** Older providers publish their address under this key. */
    public static final String LEGACY_HOST = "prometheus_scrape_host";

    // unit data read by the aggregator
    public static final String HOSTNAME = "hostname";
    public static final String PORT = "port";
    public static final String GROUPS = "groups";
}
