package io.scraperelay.sdk.runtime;

import static io.scraperelay.topology.TopologyDefaults.APPLICATION_LABEL;
import static io.scraperelay.topology.TopologyDefaults.MODEL_LABEL;
import static io.scraperelay.topology.TopologyDefaults.MODEL_UUID_LABEL;
import static io.scraperelay.topology.TopologyDefaults.UNIT_LABEL;

import io.scraperelay.errors.MalformedFragmentException;
import io.scraperelay.model.AggregateDocument;
import io.scraperelay.model.AlertRule;
import io.scraperelay.model.AlertRuleGroup;
import io.scraperelay.model.RelabelConfig;
import io.scraperelay.model.RelationDataKeys;
import io.scraperelay.model.ScrapeJob;
import io.scraperelay.model.StaticConfig;
import io.scraperelay.rules.RuleYaml;
import io.scraperelay.sdk.ports.RelationDataPort;
import io.scraperelay.sdk.ports.RelationView;
import io.scraperelay.sdk.ports.UnitContext;
import io.scraperelay.sdk.ports.UnitContextPort;
import io.scraperelay.topology.Topology;
import io.scraperelay.topology.TopologyDefaults;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collects scrape targets and alert rules from workloads that do not speak the scrape
 * interface and republishes them, labelled with topology, to every related monitoring
 * application.
 * <p>
 * Each peer application maps to one job and one rule group with a deterministic name.
 * Changes replace that fragment in the published document; departures remove only the
 * departing unit's targets and rules. Redelivering a notification therefore leaves the
 * published values byte-for-byte unchanged. A monitoring application that joins receives
 * a full resync built from the current relation data.
 */
public final class MetricsEndpointAggregator implements RelationEventListener {

  private static final Logger log = LoggerFactory.getLogger(MetricsEndpointAggregator.class);

  static final String DEFAULT_PORT = "80";
  static final String HOST_LABEL = "host";

  private final RelationDataPort relations;
  private final UnitContextPort unit;
  private final AggregatorRelations names;
  private final boolean relabelInstance;
  private final PeerStateTracker peers = new PeerStateTracker();

  public MetricsEndpointAggregator(RelationDataPort relations, UnitContextPort unit,
      AggregatorRelations names, boolean relabelInstance) {
    this.relations = Objects.requireNonNull(relations, "relations");
    this.unit = Objects.requireNonNull(unit, "unit");
    this.names = Objects.requireNonNull(names, "names");
    this.relabelInstance = relabelInstance;
  }

  public PeerStateTracker peers() {
    return peers;
  }

  @Override
  public void onJoined(RelationEvent event) {
    String relationName = event.relationName();
    if (relationName.equals(names.prometheus())) {
      resync(event.relation());
    } else if (isPeerRelation(relationName)) {
      peers.joined(relationName, event.relation().id());
    }
  }

  @Override
  public void onChanged(RelationEvent event) {
    String relationName = event.relationName();
    if (relationName.equals(names.scrapeTarget())) {
      peers.changed(relationName, event.relation().id());
      targetJob(event.relation()).ifPresent(job -> update(doc -> doc.upsertJob(job)));
    } else if (relationName.equals(names.alertRules())) {
      peers.changed(relationName, event.relation().id());
      ruleGroup(event.relation()).ifPresent(group -> update(doc -> doc.upsertRuleGroup(group)));
    }
  }

  @Override
  public void onDeparted(RelationEvent event) {
    String relationName = event.relationName();
    if (!isPeerRelation(relationName)) {
      return;
    }
    RelationView relation = event.relation();
    String departing = event.departing().orElse(null);
    Optional<String> application = relation.remoteApplication();
    if (departing == null || application.isEmpty()) {
      log.debug("Ignoring departure on relation {} without unit or application", relation.id());
      return;
    }
    boolean lastUnit = relation.remoteUnits().stream().allMatch(departing::equals);
    peers.departed(relationName, relation.id(), lastUnit);

    if (relationName.equals(names.scrapeTarget())) {
      String jobName = jobName(application.get());
      update(doc -> doc.removeUnitFromJob(jobName, departing));
    } else {
      String groupName = groupName(application.get());
      update(doc -> doc.removeUnitFromRuleGroup(groupName, departing));
    }
  }

  /**
   * Publishes a job for {@code application} built from explicit targets instead of unit
   * data, for peers that publish their targets some other way.
   *
   * @param targets       unit name to target
   * @param extraRelabels relabel rules appended after the instance rule
   */
  public void publishTargetJob(String application, Map<String, TargetAddress> targets,
      List<RelabelConfig> extraRelabels) {
    Objects.requireNonNull(application, "application");
    Objects.requireNonNull(targets, "targets");
    ScrapeJob job = staticScrapeJob(application, targets,
        extraRelabels == null ? List.of() : extraRelabels);
    update(doc -> doc.upsertJob(job));
  }

  /** The complete document built from every current peer. */
  public AggregateDocument aggregate() {
    AggregateDocument document = AggregateDocument.empty();
    for (RelationView relation : relations.relations(names.scrapeTarget())) {
      targetJob(relation).ifPresent(document::upsertJob);
    }
    for (RelationView relation : relations.relations(names.alertRules())) {
      ruleGroup(relation).ifPresent(document::upsertRuleGroup);
    }
    return document;
  }

  String jobName(String application) {
    return TopologyDefaults.LABEL_PREFIX + aggregatorTopology(application, null).shortIdentifier()
        + TopologyDefaults.SCRAPE_JOB_SUFFIX;
  }

  String groupName(String application) {
    return TopologyDefaults.LABEL_PREFIX + aggregatorTopology(application, null).shortIdentifier()
        + TopologyDefaults.AGGREGATOR_GROUP_SUFFIX;
  }

  private void resync(RelationView downstream) {
    if (!unit.current().leader()) {
      log.debug("Not the leader; skipping resync of relation {}", downstream.id());
      return;
    }
    AggregateDocument document = aggregate();
    write(downstream, document);
    log.info("Resynced relation {} with {} jobs and {} rule groups", downstream.id(),
        document.jobs().size(), document.ruleSet().groups().size());
  }

  private void update(Predicate<AggregateDocument> change) {
    if (!unit.current().leader()) {
      log.debug("Not the leader; leaving the published aggregate unchanged");
      return;
    }
    for (RelationView downstream : relations.relations(names.prometheus())) {
      AggregateDocument document = read(downstream);
      if (change.test(document)) {
        write(downstream, document);
      }
    }
  }

  private Optional<ScrapeJob> targetJob(RelationView relation) {
    Optional<String> application = relation.remoteApplication();
    if (application.isEmpty()) {
      return Optional.empty();
    }
    Map<String, TargetAddress> targets = new LinkedHashMap<>();
    for (String remoteUnit : relation.remoteUnits()) {
      Optional<String> hostname = relation.remoteUnitValue(remoteUnit, RelationDataKeys.HOSTNAME)
          .filter(value -> !value.isBlank());
      if (hostname.isPresent()) {
        String port = relation.remoteUnitValue(remoteUnit, RelationDataKeys.PORT)
            .filter(value -> !value.isBlank())
            .orElse(DEFAULT_PORT);
        targets.put(remoteUnit, new TargetAddress(hostname.get(), port));
      }
    }
    if (targets.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(staticScrapeJob(application.get(), targets, List.of()));
  }

  private ScrapeJob staticScrapeJob(String application, Map<String, TargetAddress> targets,
      List<RelabelConfig> extraRelabels) {
    UnitContext context = unit.current();
    List<StaticConfig> configs = new ArrayList<>(targets.size());
    targets.forEach((unitName, target) -> {
      Map<String, String> labels = new LinkedHashMap<>();
      labels.put(MODEL_LABEL, context.model());
      labels.put(MODEL_UUID_LABEL, context.modelUuid());
      labels.put(APPLICATION_LABEL, application);
      labels.put(UNIT_LABEL, unitName);
      labels.put(HOST_LABEL, target.hostname());
      configs.add(new StaticConfig(List.of(target.target()), labels));
    });
    List<RelabelConfig> relabels = new ArrayList<>();
    if (relabelInstance) {
      relabels.add(JobLabeler.instanceRelabel(true));
    }
    relabels.addAll(extraRelabels);
    return new ScrapeJob(jobName(application), null, configs)
        .withRelabelConfigs(relabels);
  }

  private Optional<AlertRuleGroup> ruleGroup(RelationView relation) {
    Optional<String> application = relation.remoteApplication();
    if (application.isEmpty()) {
      return Optional.empty();
    }
    List<AlertRule> labelled = new ArrayList<>();
    for (String remoteUnit : relation.remoteUnits()) {
      List<AlertRule> unitRules;
      try {
        unitRules = RuleYaml.readRules(
            relation.remoteUnitValue(remoteUnit, RelationDataKeys.GROUPS).orElse(null));
      } catch (MalformedFragmentException ex) {
        log.warn("Skipping alert rules of unit {}: {}", remoteUnit, ex.getMessage());
        continue;
      }
      Map<String, String> topologyLabels = aggregatorTopology(application.get(), remoteUnit).labels();
      for (AlertRule rule : unitRules) {
        labelled.add(rule.withLabels(topologyLabels));
      }
    }
    if (labelled.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(new AlertRuleGroup(groupName(application.get()), labelled));
  }

  private Topology aggregatorTopology(String application, String unitName) {
    UnitContext context = unit.current();
    return Topology.forAggregator(context.model(), context.modelUuid(), application, unitName);
  }

  private boolean isPeerRelation(String relationName) {
    return relationName.equals(names.scrapeTarget()) || relationName.equals(names.alertRules());
  }

  private static AggregateDocument read(RelationView downstream) {
    try {
      return AggregateDocument.decode(
          downstream.localApplicationValue(RelationDataKeys.SCRAPE_JOBS).orElse(null),
          downstream.localApplicationValue(RelationDataKeys.ALERT_RULES).orElse(null));
    } catch (MalformedFragmentException ex) {
      log.warn("Discarding unreadable aggregate on relation {}: {}", downstream.id(), ex.getMessage());
      return AggregateDocument.empty();
    }
  }

  private static void write(RelationView downstream, AggregateDocument document) {
    writeIfChanged(downstream, RelationDataKeys.SCRAPE_JOBS, document.encodeJobs());
    writeIfChanged(downstream, RelationDataKeys.ALERT_RULES, document.encodeRules());
  }

  private static void writeIfChanged(RelationView downstream, String key, String value) {
    if (!value.equals(downstream.localApplicationValue(key).orElse(null))) {
      downstream.setLocalApplicationValue(key, value);
    }
  }

  /** Address of one scrape target. */
  public record TargetAddress(String hostname, String port) {

    public TargetAddress {
      Objects.requireNonNull(hostname, "hostname");
      port = port == null || port.isBlank() ? DEFAULT_PORT : port;
    }

    String target() {
      return hostname + ":" + port;
    }
  }
}
