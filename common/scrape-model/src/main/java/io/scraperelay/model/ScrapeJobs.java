package io.scraperelay.model;

import io.scraperelay.errors.MalformedFragmentException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Process-wide scrape job constants and the allow-list sanitizer applied to every job
 * supplied by a peer or a workload.
 */
public final class ScrapeJobs {

    public static final Set<String> ALLOWED_KEYS = Set.of(
        "job_name",
        "metrics_path",
        "static_configs",
        "scrape_interval",
        "scrape_timeout",
        "proxy_url",
        "relabel_configs",
        "metrics_relabel_configs",
        "sample_limit",
        "label_limit",
        "label_name_length_limit",
        "label_value_length_limit");

    public static final String DEFAULT_METRICS_PATH = "/metrics";

    public static final String DEFAULT_TARGET = "*:80";

    /** Job used when a workload declares none: every unit on port 80 under {@code /metrics}. */
    public static final ScrapeJob DEFAULT_JOB =
        new ScrapeJob(null, DEFAULT_METRICS_PATH, List.of(StaticConfig.of(DEFAULT_TARGET)));

    private ScrapeJobs() {
    }

    /**
     * Restricts a free-form job to {@link #ALLOWED_KEYS} and fills missing fields from
     * {@link #DEFAULT_JOB}.
     *
     * @throws MalformedFragmentException when an allowed field has an unusable shape
     */
    public static ScrapeJob sanitize(Map<String, ?> job) {
        if (job == null || job.isEmpty()) {
            return DEFAULT_JOB;
        }
        Map<String, Object> allowed = new LinkedHashMap<>();
        job.forEach((key, value) -> {
            if (ALLOWED_KEYS.contains(key)) {
                allowed.put(key, value);
            }
        });
        try {
            return sanitize(RelationJson.mapper().convertValue(allowed, ScrapeJob.class));
        } catch (IllegalArgumentException ex) {
            throw new MalformedFragmentException("Invalid scrape job " + allowed.get("job_name"), ex);
        }
    }

    public static ScrapeJob sanitize(ScrapeJob job) {
        if (job == null) {
            return DEFAULT_JOB;
        }
        ScrapeJob sanitized = job;
        if (sanitized.metricsPath() == null) {
            sanitized = sanitized.withMetricsPath(DEFAULT_JOB.metricsPath());
        }
        if (sanitized.staticConfigs() == null) {
            sanitized = sanitized.withStaticConfigs(DEFAULT_JOB.staticConfigs());
        }
        return sanitized;
    }

    public static List<ScrapeJob> sanitizeAll(List<? extends Map<String, ?>> jobs) {
        if (jobs == null || jobs.isEmpty()) {
            return List.of();
        }
        return jobs.stream().map(ScrapeJobs::sanitize).toList();
    }
}
