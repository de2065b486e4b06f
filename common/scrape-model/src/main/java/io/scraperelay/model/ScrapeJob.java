package io.scraperelay.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Scrape job fragment restricted to the fields listed in {@link ScrapeJobs#ALLOWED_KEYS}.
 * Unknown fields are dropped when a job is decoded; absent fields stay {@code null} and
 * are not written back.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ScrapeJob(
    @JsonProperty("job_name") String jobName,
    @JsonProperty("metrics_path") String metricsPath,
    @JsonProperty("static_configs") List<StaticConfig> staticConfigs,
    @JsonProperty("scrape_interval") String scrapeInterval,
    @JsonProperty("scrape_timeout") String scrapeTimeout,
    @JsonProperty("proxy_url") String proxyUrl,
    @JsonProperty("relabel_configs") List<RelabelConfig> relabelConfigs,
    @JsonProperty("metrics_relabel_configs") List<RelabelConfig> metricsRelabelConfigs,
    @JsonProperty("sample_limit") Integer sampleLimit,
    @JsonProperty("label_limit") Integer labelLimit,
    @JsonProperty("label_name_length_limit") Integer labelNameLengthLimit,
    @JsonProperty("label_value_length_limit") Integer labelValueLengthLimit) {

    public ScrapeJob {
        staticConfigs = staticConfigs == null ? null : List.copyOf(staticConfigs);
        relabelConfigs = relabelConfigs == null ? null : List.copyOf(relabelConfigs);
        metricsRelabelConfigs = metricsRelabelConfigs == null ? null : List.copyOf(metricsRelabelConfigs);
    }

    public ScrapeJob(String jobName, String metricsPath, List<StaticConfig> staticConfigs) {
        this(jobName, metricsPath, staticConfigs, null, null, null, null, null, null, null, null, null);
    }

    public ScrapeJob withJobName(String name) {
        return new ScrapeJob(name, metricsPath, staticConfigs, scrapeInterval, scrapeTimeout, proxyUrl,
            relabelConfigs, metricsRelabelConfigs, sampleLimit, labelLimit, labelNameLengthLimit,
            labelValueLengthLimit);
    }

    public ScrapeJob withMetricsPath(String path) {
        return new ScrapeJob(jobName, path, staticConfigs, scrapeInterval, scrapeTimeout, proxyUrl,
            relabelConfigs, metricsRelabelConfigs, sampleLimit, labelLimit, labelNameLengthLimit,
            labelValueLengthLimit);
    }

    public ScrapeJob withStaticConfigs(List<StaticConfig> configs) {
        return new ScrapeJob(jobName, metricsPath, configs, scrapeInterval, scrapeTimeout, proxyUrl,
            relabelConfigs, metricsRelabelConfigs, sampleLimit, labelLimit, labelNameLengthLimit,
            labelValueLengthLimit);
    }

    public ScrapeJob withRelabelConfigs(List<RelabelConfig> configs) {
        return new ScrapeJob(jobName, metricsPath, staticConfigs, scrapeInterval, scrapeTimeout, proxyUrl,
            configs, metricsRelabelConfigs, sampleLimit, labelLimit, labelNameLengthLimit,
            labelValueLengthLimit);
    }

    public List<StaticConfig> staticConfigsOrEmpty() {
        return staticConfigs == null ? List.of() : staticConfigs;
    }

    public List<RelabelConfig> relabelConfigsOrEmpty() {
        return relabelConfigs == null ? List.of() : relabelConfigs;
    }
}
