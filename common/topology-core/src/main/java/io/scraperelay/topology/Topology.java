package io.scraperelay.topology;

import static io.scraperelay.topology.TopologyDefaults.APPLICATION_LABEL;
import static io.scraperelay.topology.TopologyDefaults.CHARM_LABEL;
import static io.scraperelay.topology.TopologyDefaults.MODEL_LABEL;
import static io.scraperelay.topology.TopologyDefaults.MODEL_UUID_LABEL;
import static io.scraperelay.topology.TopologyDefaults.UNIT_LABEL;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Stable identity of a publishing model/application/unit used to label and namespace
 * scrape jobs and alert rules.
 * <p>
 * Instances are only created through the named factories; {@link Kind} records which
 * one was used and selects the default label scope. Values are immutable and every
 * derived view is a pure function of the fields.
 */
public final class Topology {

  public enum Kind {
    PROVIDER,
    AGGREGATOR
  }

  public static final String MODEL_KEY = "model";
  public static final String MODEL_UUID_KEY = "model_uuid";
  public static final String APPLICATION_KEY = "application";
  public static final String UNIT_KEY = "unit";
  public static final String CHARM_NAME_KEY = "charm_name";

  private final Kind kind;
  private final String model;
  private final String modelUuid;
  private final String application;
  private final String unit;
  private final String charmName;

  private Topology(Kind kind, String model, String modelUuid, String application, String unit,
      String charmName) {
    this.kind = Objects.requireNonNull(kind, "kind");
    this.model = requireName(requireText(model, MODEL_KEY), MODEL_KEY);
    this.modelUuid = requireName(requireText(modelUuid, MODEL_UUID_KEY), MODEL_UUID_KEY);
    this.application = requireName(requireText(application, APPLICATION_KEY), APPLICATION_KEY);
    this.unit = requireUnit(normalize(unit), this.application);
    this.charmName = requireName(normalize(charmName), CHARM_NAME_KEY);
  }

  public static Topology forProvider(String model, String modelUuid, String application,
      String unit, String charmName) {
    return new Topology(Kind.PROVIDER, model, modelUuid, application, unit, charmName);
  }

  public static Topology forProvider(String model, String modelUuid, String application) {
    return forProvider(model, modelUuid, application, null, null);
  }

  public static Topology forAggregator(String model, String modelUuid, String application,
      String unit) {
    return new Topology(Kind.AGGREGATOR, model, modelUuid, application, unit, null);
  }

  /**
   * Rebuilds a provider topology from {@code scrape_metadata} relation data.
   *
   * @throws IllegalArgumentException when a required key is missing or blank
   */
  public static Topology fromMetadata(Map<String, ?> metadata) {
    Objects.requireNonNull(metadata, "metadata");
    return forProvider(
        text(metadata.get(MODEL_KEY)),
        text(metadata.get(MODEL_UUID_KEY)),
        text(metadata.get(APPLICATION_KEY)),
        text(metadata.get(UNIT_KEY)),
        text(metadata.get(CHARM_NAME_KEY)));
  }

  public Kind kind() {
    return kind;
  }

  public String model() {
    return model;
  }

  public String modelUuid() {
    return modelUuid;
  }

  public String application() {
    return application;
  }

  public Optional<String> unit() {
    return Optional.ofNullable(unit);
  }

  public Optional<String> charmName() {
    return Optional.ofNullable(charmName);
  }

  /**
   * Terse identity of every present field in the order model, model uuid, application,
   * unit, charm name, joined with {@code _}. Path separators are replaced so the value can
   * be used as a file or group name. Fields may not contain either separator and the unit
   * always spans two segments, so distinct topologies never share an identifier.
   */
  public String identifier() {
    return join(labels(LabelScope.FULL));
  }

  /**
   * {@link #identifier()} without the unit. Names that must survive a change of leader
   * unit (provider job prefixes, rule groups) are built from this value.
   */
  public String applicationIdentifier() {
    return join(labels(LabelScope.RULE));
  }

  /**
   * Aggregator identity: {@code model_uuid7_application}. The truncated uuid makes this
   * weaker than {@link #applicationIdentifier()}; it is only used for names published by
   * an aggregator.
   */
  public String shortIdentifier() {
    return String.join("_", model, shortModelUuid(), application).replace("/", "_");
  }

  /** Job-name prefix used by providers and consumers. */
  public String scrapeIdentifier() {
    return TopologyDefaults.LABEL_PREFIX + applicationIdentifier() + TopologyDefaults.SCRAPE_JOB_SUFFIX;
  }

  /** Labels of the default scope for this kind. */
  public Map<String, String> labels() {
    return labels(kind == Kind.AGGREGATOR ? LabelScope.AGGREGATOR : LabelScope.RULE);
  }

  public Map<String, String> labels(LabelScope scope) {
    Objects.requireNonNull(scope, "scope");
    Map<String, String> labels = new LinkedHashMap<>();
    labels.put(MODEL_LABEL, model);
    labels.put(MODEL_UUID_LABEL, scope == LabelScope.AGGREGATOR ? shortModelUuid() : modelUuid);
    labels.put(APPLICATION_LABEL, application);
    if (unit != null && scope != LabelScope.RULE) {
      labels.put(UNIT_LABEL, unit);
    }
    if (charmName != null) {
      labels.put(CHARM_LABEL, charmName);
    }
    return Collections.unmodifiableMap(labels);
  }

  /** Renders the default-scope labels as PromQL label matchers. */
  public String promqlLabels() {
    return labels().entrySet().stream()
        .map(e -> e.getKey() + "=\"" + e.getValue() + "\"")
        .collect(Collectors.joining(", "));
  }

  /** Replaces {@link TopologyDefaults#TOPOLOGY_STUB} in {@code template}. */
  public String render(String template) {
    if (template == null) {
      return null;
    }
    return template.replace(TopologyDefaults.TOPOLOGY_STUB, promqlLabels());
  }

  /** Ordered {@code scrape_metadata} representation; absent optionals are omitted. */
  public Map<String, String> asMetadata() {
    Map<String, String> metadata = new LinkedHashMap<>();
    metadata.put(MODEL_KEY, model);
    metadata.put(MODEL_UUID_KEY, modelUuid);
    metadata.put(APPLICATION_KEY, application);
    if (unit != null) {
      metadata.put(UNIT_KEY, unit);
    }
    if (charmName != null) {
      metadata.put(CHARM_NAME_KEY, charmName);
    }
    return Collections.unmodifiableMap(metadata);
  }

  private String shortModelUuid() {
    int length = Math.min(TopologyDefaults.SHORT_MODEL_UUID_LENGTH, modelUuid.length());
    return modelUuid.substring(0, length);
  }

  private static String join(Map<String, String> labels) {
    return String.join("_", labels.values()).replace("/", "_");
  }

  private static String requireText(String value, String field) {
    String normalized = normalize(value);
    if (normalized == null) {
      throw new IllegalArgumentException("topology " + field + " must not be null or blank");
    }
    return normalized;
  }

  /** Separators are reserved so that {@link #identifier()} stays unambiguous. */
  private static String requireName(String value, String field) {
    if (value != null && (value.indexOf('_') >= 0 || value.indexOf('/') >= 0)) {
      throw new IllegalArgumentException("topology " + field + " must not contain '_' or '/': " + value);
    }
    return value;
  }

  private static String requireUnit(String value, String application) {
    if (value == null) {
      return null;
    }
    String prefix = application + "/";
    String number = value.startsWith(prefix) ? value.substring(prefix.length()) : "";
    if (number.isEmpty() || !number.chars().allMatch(c -> c >= '0' && c <= '9')) {
      throw new IllegalArgumentException("topology unit must be " + application + "/<number>: " + value);
    }
    return value;
  }

  private static String normalize(String value) {
    if (value == null) {
      return null;
    }
    String trimmed = value.trim();
    return trimmed.isEmpty() ? null : trimmed;
  }

  private static String text(Object value) {
    return value == null ? null : value.toString();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Topology other)) {
      return false;
    }
    return kind == other.kind
        && model.equals(other.model)
        && modelUuid.equals(other.modelUuid)
        && application.equals(other.application)
        && Objects.equals(unit, other.unit)
        && Objects.equals(charmName, other.charmName);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, model, modelUuid, application, unit, charmName);
  }

  @Override
  public String toString() {
    return "Topology{" + kind + " " + identifier() + "}";
  }
}
