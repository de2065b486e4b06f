package io.scraperelay.sdk.runtime;

import io.scraperelay.errors.InvalidAlertRulePathException;
import io.scraperelay.model.AlertRuleSet;
import io.scraperelay.model.RelationDataKeys;
import io.scraperelay.model.RelationJson;
import io.scraperelay.rules.AlertRuleLoader;
import io.scraperelay.rules.AlertRulePaths;
import io.scraperelay.sdk.ports.RelationDataPort;
import io.scraperelay.sdk.ports.RelationView;
import io.scraperelay.sdk.ports.UnitContextPort;
import java.nio.file.Path;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Forwards rule files that apply across workloads. Rules are sent as found on disk, without
 * topology labels, and encoded with sorted keys so unchanged rules never produce a new value.
 */
public final class PrometheusRulesProvider implements RelationEventListener {

  private static final Logger log = LoggerFactory.getLogger(PrometheusRulesProvider.class);

  private final RelationDataPort relations;
  private final UnitContextPort unit;
  private final String relationName;
  private final Path directory;
  private final boolean recursive;

  public PrometheusRulesProvider(RelationDataPort relations, UnitContextPort unit, String relationName,
      Path baseDirectory, String relativePath, boolean recursive) {
    this.relations = Objects.requireNonNull(relations, "relations");
    this.unit = Objects.requireNonNull(unit, "unit");
    this.relationName = Objects.requireNonNull(relationName, "relationName");
    this.directory = resolve(baseDirectory, relativePath);
    this.recursive = recursive;
  }

  @Override
  public void onJoined(RelationEvent event) {
    publish();
  }

  @Override
  public void onChanged(RelationEvent event) {
    publish();
  }

  /** Reloads the rule files and writes them to every relation; leader only. */
  public void publish() {
    if (!unit.current().leader()) {
      return;
    }
    AlertRuleLoader loader = AlertRuleLoader.withoutTopology();
    loader.add(directory, recursive);
    AlertRuleSet rules = loader.finalizeRules();
    String encoded = RelationJson.writeSorted(rules, "alert rules");

    log.info("Updating relation data with rule files from disk");
    for (RelationView relation : relations.relations(relationName)) {
      relation.setLocalApplicationValue(RelationDataKeys.ALERT_RULES, encoded);
    }
  }

  private static Path resolve(Path baseDirectory, String relativePath) {
    Objects.requireNonNull(baseDirectory, "baseDirectory");
    Objects.requireNonNull(relativePath, "relativePath");
    try {
      return AlertRulePaths.resolve(baseDirectory, relativePath);
    } catch (InvalidAlertRulePathException ex) {
      log.warn("Invalid Prometheus alert rules folder at {}: {}", ex.path(), ex.getMessage());
      return baseDirectory.resolve(relativePath);
    }
  }
}
