package io.scraperelay.sdk.runtime;

import io.scraperelay.errors.MalformedFragmentException;
import io.scraperelay.model.AlertRule;
import io.scraperelay.model.AlertRuleGroup;
import io.scraperelay.model.AlertRuleSet;
import io.scraperelay.model.RelationDataKeys;
import io.scraperelay.model.RelationJson;
import io.scraperelay.model.ScrapeJob;
import io.scraperelay.model.ScrapeJobs;
import io.scraperelay.rules.ExpressionLabeler;
import io.scraperelay.sdk.ports.RelationDataPort;
import io.scraperelay.sdk.ports.RelationView;
import io.scraperelay.topology.RelationRole;
import io.scraperelay.topology.Topology;
import io.scraperelay.topology.TopologyDefaults;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Monitoring-side view of every workload related over the scrape interface.
 * <p>
 * Nothing is cached: {@link #jobs()} and {@link #alerts()} are recomputed from relation
 * data on each call. A fragment that cannot be decoded is logged and skipped without
 * affecting the other relations.
 */
public final class MetricsEndpointConsumer implements RelationEventListener {

  private static final Logger log = LoggerFactory.getLogger(MetricsEndpointConsumer.class);

  private final RelationDataPort relations;
  private final String relationName;
  private final JobLabeler jobLabeler;
  private final ExpressionLabeler expressionLabeler;
  private final List<TargetsChangedListener> listeners = new CopyOnWriteArrayList<>();

  public MetricsEndpointConsumer(RelationDataPort relations, String relationName,
      JobLabeler jobLabeler, ExpressionLabeler expressionLabeler) {
    this.relations = Objects.requireNonNull(relations, "relations");
    this.relationName = Objects.requireNonNull(relationName, "relationName");
    this.jobLabeler = Objects.requireNonNull(jobLabeler, "jobLabeler");
    this.expressionLabeler = Objects.requireNonNull(expressionLabeler, "expressionLabeler");
    RelationValidator.validate(relations, relationName, TopologyDefaults.RELATION_INTERFACE,
        RelationRole.REQUIRES);
  }

  public String relationName() {
    return relationName;
  }

  public void addListener(TargetsChangedListener listener) {
    listeners.add(Objects.requireNonNull(listener, "listener"));
  }

  @Override
  public void onChanged(RelationEvent event) {
    fireTargetsChanged(event);
  }

  @Override
  public void onDeparted(RelationEvent event) {
    fireTargetsChanged(event);
  }

  /**
   * Labelled scrape jobs of every related workload. Jobs of a relation without
   * {@code scrape_metadata} are returned as published.
   */
  public List<ScrapeJob> jobs() {
    List<ScrapeJob> jobs = new ArrayList<>();
    for (RelationView relation : relations.relations(relationName)) {
      if (relation.remoteUnits().isEmpty()) {
        continue;
      }
      try {
        jobs.addAll(relationJobs(relation));
      } catch (MalformedFragmentException | IllegalArgumentException ex) {
        log.warn("Skipping scrape jobs of relation {}: {}", relation.id(), ex.getMessage());
      }
    }
    return jobs;
  }

  /**
   * Alert rule files keyed by the topology identifier of the publishing workload, suitable
   * as file names. Expressions of rules with known topology carry topology label matchers.
   */
  public Map<String, AlertRuleSet> alerts() {
    Map<String, AlertRuleSet> alerts = new LinkedHashMap<>();
    for (RelationView relation : relations.relations(relationName)) {
      if (relation.remoteUnits().isEmpty()) {
        continue;
      }
      AlertRuleSet rules;
      Optional<Topology> topology;
      try {
        rules = RelationJson.readRuleSet(remoteValue(relation, RelationDataKeys.ALERT_RULES));
        topology = topology(relation);
      } catch (MalformedFragmentException | IllegalArgumentException ex) {
        log.warn("Skipping alert rules of relation {}: {}", relation.id(), ex.getMessage());
        continue;
      }
      if (rules.isEmpty()) {
        continue;
      }
      if (topology.isPresent()) {
        alerts.put(topology.get().applicationIdentifier(), expressionLabeler.apply(rules));
        continue;
      }
      log.debug("Relation {} has no scrape_metadata", relation.id());
      String identifier = identifierFromRules(rules);
      if (identifier == null) {
        log.error("Alert rules were found but no usable group or identifier was present");
        continue;
      }
      alerts.put(identifier, rules);
    }
    return alerts;
  }

  private List<ScrapeJob> relationJobs(RelationView relation) {
    String published = remoteValue(relation, RelationDataKeys.SCRAPE_JOBS);
    Optional<Topology> topology = topology(relation);
    if (topology.isEmpty()) {
      return RelationJson.readJobs(published);
    }
    List<Map<String, Object>> rawJobs = RelationJson.readRawJobs(published);
    if (rawJobs.isEmpty()) {
      return List.of();
    }
    String prefix = topology.get().scrapeIdentifier();
    Map<String, String> hosts = relationHosts(relation);
    List<ScrapeJob> labelled = new ArrayList<>(rawJobs.size());
    for (Map<String, Object> raw : rawJobs) {
      labelled.add(jobLabeler.label(ScrapeJobs.sanitize(raw), prefix, hosts, topology.get()));
    }
    return labelled;
  }

  private static Optional<Topology> topology(RelationView relation) {
    Map<String, String> metadata = RelationJson.readMetadata(
        remoteValue(relation, RelationDataKeys.SCRAPE_METADATA));
    return metadata.isEmpty() ? Optional.empty() : Optional.of(Topology.fromMetadata(metadata));
  }

  /** Unit name to address for every remote unit that published an address. */
  static Map<String, String> relationHosts(RelationView relation) {
    Map<String, String> hosts = new LinkedHashMap<>();
    for (String unit : relation.remoteUnits()) {
      String name = nonBlank(relation.remoteUnitValue(unit, RelationDataKeys.UNIT_NAME)).orElse(unit);
      Optional<String> address = nonBlank(relation.remoteUnitValue(unit, RelationDataKeys.UNIT_ADDRESS))
          .or(() -> nonBlank(relation.remoteUnitValue(unit, RelationDataKeys.LEGACY_HOST)));
      address.ifPresent(value -> hosts.put(name, value));
    }
    return hosts;
  }

  /**
   * Identifier for rules published without metadata: {@code model_uuid_application} from
   * the labels of a group's first rule, falling back to the first group name.
   */
  static String identifierFromRules(AlertRuleSet rules) {
    for (AlertRuleGroup group : rules.groups()) {
      if (group.rules().isEmpty()) {
        continue;
      }
      AlertRule first = group.rules().get(0);
      String model = first.labels().get(TopologyDefaults.MODEL_LABEL);
      String uuid = first.labels().get(TopologyDefaults.MODEL_UUID_LABEL);
      String application = first.labels().get(TopologyDefaults.APPLICATION_LABEL);
      if (model != null && uuid != null && application != null) {
        return model + "_" + uuid + "_" + application;
      }
    }
    log.warn("No labeled alert rules were found and no scrape_metadata was available; "
        + "using the alert group name as identifier");
    for (AlertRuleGroup group : rules.groups()) {
      if (group.name() != null && !group.name().isBlank()) {
        return group.name();
      }
    }
    return null;
  }

  private void fireTargetsChanged(RelationEvent event) {
    int relationId = event.relation().id();
    for (TargetsChangedListener listener : listeners) {
      listener.targetsChanged(relationId);
    }
  }

  private static String remoteValue(RelationView relation, String key) {
    return relation.remoteApplicationValue(key).orElse(null);
  }

  private static Optional<String> nonBlank(Optional<String> value) {
    return value.filter(v -> !v.isBlank());
  }
}
