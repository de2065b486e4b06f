package io.scraperelay.sdk.runtime;

import io.scraperelay.errors.InvalidAlertRulePathException;
import io.scraperelay.model.AlertRuleSet;
import io.scraperelay.model.RelationDataKeys;
import io.scraperelay.model.RelationJson;
import io.scraperelay.model.ScrapeJob;
import io.scraperelay.model.ScrapeJobs;
import io.scraperelay.rules.AlertRuleLoader;
import io.scraperelay.rules.AlertRulePaths;
import io.scraperelay.sdk.ports.RelationDataPort;
import io.scraperelay.sdk.ports.RelationView;
import io.scraperelay.sdk.ports.UnitContext;
import io.scraperelay.sdk.ports.UnitContextPort;
import io.scraperelay.topology.RelationRole;
import io.scraperelay.topology.Topology;
import io.scraperelay.topology.TopologyDefaults;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Workload-side publisher of scrape jobs, topology metadata and alert rules.
 * <p>
 * Every unit publishes its own address and name. Only the leader writes the
 * application-level {@code scrape_metadata}, {@code scrape_jobs} and {@code alert_rules};
 * alert rules are re-read from disk on each publication.
 */
public final class MetricsEndpointProvider implements RelationEventListener {

  private static final Logger log = LoggerFactory.getLogger(MetricsEndpointProvider.class);

  private final RelationDataPort relations;
  private final UnitContextPort unit;
  private final String relationName;
  private volatile List<ScrapeJob> jobs = List.of();
  private volatile Path alertRulesPath;

  public MetricsEndpointProvider(RelationDataPort relations, UnitContextPort unit, String relationName) {
    this.relations = Objects.requireNonNull(relations, "relations");
    this.unit = Objects.requireNonNull(unit, "unit");
    this.relationName = Objects.requireNonNull(relationName, "relationName");
    RelationValidator.validate(relations, relationName, TopologyDefaults.RELATION_INTERFACE,
        RelationRole.PROVIDES);
  }

  /**
   * Replaces the published jobs. Each job is restricted to the allowed fields; an empty list
   * publishes the default job.
   */
  public void setJobs(List<? extends Map<String, ?>> rawJobs) {
    this.jobs = ScrapeJobs.sanitizeAll(rawJobs);
  }

  public List<ScrapeJob> scrapeJobs() {
    List<ScrapeJob> current = jobs;
    return current.isEmpty() ? List.of(ScrapeJobs.DEFAULT_JOB) : current;
  }

  /**
   * Sets the alert rules directory relative to {@code baseDirectory}. An invalid path is
   * logged and kept as given, so no rules are published until it appears.
   */
  public void setAlertRulesPath(Path baseDirectory, String relativePath) {
    try {
      this.alertRulesPath = AlertRulePaths.resolve(baseDirectory, relativePath);
    } catch (InvalidAlertRulePathException ex) {
      log.warn("Invalid Prometheus alert rules folder at {}: {}", ex.path(), ex.getMessage());
      this.alertRulesPath = baseDirectory.resolve(relativePath);
    }
  }

  public Path alertRulesPath() {
    return alertRulesPath;
  }

  @Override
  public void onJoined(RelationEvent event) {
    publish();
  }

  @Override
  public void onChanged(RelationEvent event) {
    publish();
  }

  /** Republishes everything; call on leader election and after an upgrade. */
  public void publish() {
    UnitContext context = unit.current();
    List<RelationView> current = relations.relations(relationName);
    for (RelationView relation : current) {
      if (context.bindAddress() != null) {
        relation.setLocalUnitValue(RelationDataKeys.UNIT_ADDRESS, context.bindAddress());
      }
      relation.setLocalUnitValue(RelationDataKeys.UNIT_NAME, context.unit());
    }
    if (!context.leader()) {
      return;
    }

    Topology topology = context.topology();
    AlertRuleSet rules = loadAlertRules(topology);
    String metadata = RelationJson.writeMetadata(topology.asMetadata());
    String scrapeJobs = RelationJson.writeJobs(scrapeJobs());
    for (RelationView relation : current) {
      relation.setLocalApplicationValue(RelationDataKeys.SCRAPE_METADATA, metadata);
      relation.setLocalApplicationValue(RelationDataKeys.SCRAPE_JOBS, scrapeJobs);
      if (!rules.isEmpty()) {
        relation.setLocalApplicationValue(RelationDataKeys.ALERT_RULES, RelationJson.writeRuleSet(rules));
      }
    }
    log.debug("Published {} scrape jobs and {} alert rule groups on {} relations",
        scrapeJobs().size(), rules.groups().size(), current.size());
  }

  private AlertRuleSet loadAlertRules(Topology topology) {
    Path path = alertRulesPath;
    if (path == null) {
      return AlertRuleSet.EMPTY;
    }
    AlertRuleLoader loader = new AlertRuleLoader(topology);
    loader.add(path, true);
    return loader.finalizeRules();
  }
}
