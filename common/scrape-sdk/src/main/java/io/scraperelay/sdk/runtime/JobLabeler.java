package io.scraperelay.sdk.runtime;

import static io.scraperelay.topology.TopologyDefaults.APPLICATION_LABEL;
import static io.scraperelay.topology.TopologyDefaults.MODEL_LABEL;
import static io.scraperelay.topology.TopologyDefaults.MODEL_UUID_LABEL;
import static io.scraperelay.topology.TopologyDefaults.UNIT_LABEL;

import io.scraperelay.errors.TargetFormatException;
import io.scraperelay.model.RelabelConfig;
import io.scraperelay.model.ScrapeJob;
import io.scraperelay.model.ScrapeJobs;
import io.scraperelay.model.ScrapeTarget;
import io.scraperelay.model.StaticConfig;
import io.scraperelay.topology.LabelScope;
import io.scraperelay.topology.Topology;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a job fragment published by a workload into a topology-labelled job.
 * <p>
 * Targets written as {@code *:PORT} expand to one static group per known unit, labelled
 * with {@code juju_unit}; fixed {@code host:port} targets stay in a single group carrying
 * only application-level labels. A trailing relabel rule derives the {@code instance}
 * label from topology so it stays stable when a unit is re-created.
 */
public final class JobLabeler {

  private static final Logger log = LoggerFactory.getLogger(JobLabeler.class);

  private static final List<String> INSTANCE_SOURCE_LABELS =
      List.of(MODEL_LABEL, MODEL_UUID_LABEL, APPLICATION_LABEL);

  /**
   * @param job           fragment as published; {@code null} yields the default job
   * @param jobNamePrefix used as the job name, or as {@code prefix_name} when the fragment
   *                      names itself
   * @param unitAddresses unit name to address, iterated in map order
   */
  public ScrapeJob label(ScrapeJob job, String jobNamePrefix, Map<String, String> unitAddresses,
      Topology topology) {
    Objects.requireNonNull(jobNamePrefix, "jobNamePrefix");
    Objects.requireNonNull(unitAddresses, "unitAddresses");
    Objects.requireNonNull(topology, "topology");

    ScrapeJob sanitized = ScrapeJobs.sanitize(job);
    String jobName = jobName(jobNamePrefix, sanitized.jobName());
    Map<String, String> topologyLabels = topology.labels(LabelScope.RULE);

    List<StaticConfig> groups = new ArrayList<>();
    boolean perUnit = false;
    for (StaticConfig config : sanitized.staticConfigsOrEmpty()) {
      List<String> wildcardPorts = new ArrayList<>();
      List<String> fixedTargets = new ArrayList<>();
      for (String target : config.targets()) {
        ScrapeTarget parsed;
        try {
          parsed = ScrapeTarget.parse(target);
        } catch (TargetFormatException ex) {
          log.warn("Dropping target of job {}: {}", jobName, ex.getMessage());
          continue;
        }
        if (parsed.isWildcard()) {
          wildcardPorts.add(parsed.port());
        } else {
          fixedTargets.add(target);
        }
      }

      Map<String, String> peerLabels = new LinkedHashMap<>(config.labels());
      peerLabels.putAll(topologyLabels);
      if (!fixedTargets.isEmpty()) {
        groups.add(new StaticConfig(fixedTargets, peerLabels));
      }
      for (Map.Entry<String, String> unit : unitAddresses.entrySet()) {
        groups.add(unitGroup(unit.getKey(), unit.getValue(), wildcardPorts, peerLabels));
        perUnit = true;
      }
    }

    List<RelabelConfig> relabelConfigs = new ArrayList<>(sanitized.relabelConfigsOrEmpty());
    relabelConfigs.add(instanceRelabel(perUnit));

    return sanitized.withJobName(jobName)
        .withStaticConfigs(groups)
        .withRelabelConfigs(relabelConfigs);
  }

  static RelabelConfig instanceRelabel(boolean includeUnit) {
    List<String> sourceLabels = new ArrayList<>(INSTANCE_SOURCE_LABELS);
    if (includeUnit) {
      sourceLabels.add(UNIT_LABEL);
    }
    return RelabelConfig.instanceFrom(sourceLabels);
  }

  private static StaticConfig unitGroup(String unit, String address, List<String> ports,
      Map<String, String> peerLabels) {
    Map<String, String> labels = new LinkedHashMap<>(peerLabels);
    labels.put(UNIT_LABEL, unit);
    List<String> targets = new ArrayList<>();
    if (ports.isEmpty()) {
      targets.add(address);
    } else {
      for (String port : ports) {
        targets.add(address + ":" + port);
      }
    }
    return new StaticConfig(targets, labels);
  }

  private static String jobName(String prefix, String name) {
    return name == null || name.isBlank() ? prefix : prefix + "_" + name;
  }
}
