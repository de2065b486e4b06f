package io.scraperelay.rules;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.scraperelay.model.AlertRule;
import io.scraperelay.model.AlertRuleGroup;
import io.scraperelay.model.AlertRuleSet;
import io.scraperelay.topology.TopologyDefaults;
import io.scraperelay.topology.Topology;
import java.io.IOException;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collects Prometheus alert rules from rule files, directories or peer-supplied YAML and
 * stamps them with topology labels.
 * <p>
 * Two file shapes are accepted: the official rule file ({@code groups: [...]}) and a
 * single rule per file ({@code alert:} and {@code expr:} at the top level), which becomes
 * a group named after the file. Anything else is logged and skipped; a broken file never
 * prevents the remaining rules from being collected.
 * <p>
 * Group names are {@code <topology>_<relative dir>_<group>_alerts}. Groups that end up
 * with the same name (for instance two files of one directory declaring the same group)
 * are combined.
 */
public final class AlertRuleLoader {

  private static final Logger log = LoggerFactory.getLogger(AlertRuleLoader.class);

  private static final Set<String> RULE_FILE_SUFFIXES = Set.of(".rule", ".rules");

  private static final TypeReference<List<AlertRuleGroup>> GROUPS_TYPE = new TypeReference<>() {};

  private final ObjectMapper yamlMapper = RuleYaml.mapper();
  private final Topology topology;
  private final Map<String, AlertRuleGroup> groups = new LinkedHashMap<>();

  /**
   * @param topology topology stamped on every rule, or {@code null} to forward rules
   *                 without topology labels
   */
  public AlertRuleLoader(Topology topology) {
    this.topology = topology;
  }

  public static AlertRuleLoader withoutTopology() {
    return new AlertRuleLoader(null);
  }

  /**
   * Adds a rule file, or every {@code *.rule}/{@code *.rules} file of a directory.
   *
   * @param recursive whether sub-directories are scanned; ignored for a single file
   * @return number of groups added by this call
   */
  public int add(Path path, boolean recursive) {
    Objects.requireNonNull(path, "path");
    if (Files.isDirectory(path)) {
      return addAll(fromDirectory(path, recursive));
    }
    if (Files.isRegularFile(path)) {
      Path parent = path.toAbsolutePath().getParent();
      return addAll(fromFile(parent, path.toAbsolutePath()));
    }
    log.warn("Alert rule path does not exist: {}", path);
    return 0;
  }

  /**
   * Adds rules supplied as YAML (or JSON) text, e.g. read from relation data.
   *
   * @param sourceName name used for the synthetic group of a single-rule document
   */
  public int add(String rulesText, String sourceName) {
    Objects.requireNonNull(sourceName, "sourceName");
    if (rulesText == null || rulesText.isBlank()) {
      return 0;
    }
    Object parsed;
    try {
      parsed = yamlMapper.readValue(rulesText, Object.class);
    } catch (IOException ex) {
      log.error("Failed to read alert rules from {}: {}", sourceName, ex.getMessage());
      return 0;
    }
    return addAll(toGroups(parsed, "", sourceName));
  }

  /**
   * Returns the collected rules; the result is empty when nothing usable was added.
   */
  public AlertRuleSet finalizeRules() {
    if (groups.isEmpty()) {
      return AlertRuleSet.EMPTY;
    }
    return new AlertRuleSet(List.copyOf(groups.values()));
  }

  static boolean isOfficialFormat(Map<?, ?> document) {
    return document.containsKey("groups");
  }

  static boolean isSingleRuleFormat(Map<?, ?> document) {
    return document.containsKey("alert") && document.containsKey("expr");
  }

  private List<AlertRuleGroup> fromDirectory(Path directory, boolean recursive) {
    List<Path> files = new ArrayList<>();
    try {
      Files.walkFileTree(directory, EnumSet.noneOf(FileVisitOption.class),
          recursive ? Integer.MAX_VALUE : 1, new RuleFileCollector(files));
    } catch (IOException ex) {
      log.error("Failed to scan alert rules under {}: {}", directory, ex.getMessage());
    }
    Collections.sort(files);
    List<AlertRuleGroup> collected = new ArrayList<>();
    for (Path file : files) {
      List<AlertRuleGroup> fromFile = fromFile(directory, file);
      if (!fromFile.isEmpty()) {
        log.debug("Reading alert rule from {}", file);
        collected.addAll(fromFile);
      }
    }
    return collected;
  }

  private List<AlertRuleGroup> fromFile(Path root, Path file) {
    Object parsed;
    try {
      parsed = yamlMapper.readValue(file.toFile(), Object.class);
    } catch (IOException ex) {
      log.error("Failed to read alert rules from {}: {}", file.getFileName(), ex.getMessage());
      return List.of();
    }
    return toGroups(parsed, relativeDirectory(root, file), stem(file));
  }

  private List<AlertRuleGroup> toGroups(Object parsed, String relativeDirectory, String stem) {
    if (!(parsed instanceof Map<?, ?> document)) {
      log.error("Invalid rules file: {}", stem);
      return List.of();
    }
    List<AlertRuleGroup> parsedGroups;
    try {
      if (isOfficialFormat(document)) {
        parsedGroups = yamlMapper.convertValue(document.get("groups"), GROUPS_TYPE);
      } else if (isSingleRuleFormat(document)) {
        AlertRule rule = yamlMapper.convertValue(document, AlertRule.class);
        parsedGroups = List.of(new AlertRuleGroup(stem, List.of(rule)));
      } else {
        log.error("Invalid rules file: {}", stem);
        return List.of();
      }
    } catch (IllegalArgumentException ex) {
      log.error("Invalid rules file {}: {}", stem, ex.getMessage());
      return List.of();
    }
    if (parsedGroups == null) {
      return List.of();
    }
    List<AlertRuleGroup> stamped = new ArrayList<>(parsedGroups.size());
    for (AlertRuleGroup group : parsedGroups) {
      if (group == null) {
        continue;
      }
      stamped.add(new AlertRuleGroup(
          groupName(relativeDirectory, group.name()),
          group.interval(),
          group.rules().stream().map(this::stamp).toList()));
    }
    return stamped;
  }

  private AlertRule stamp(AlertRule rule) {
    if (topology == null) {
      return rule;
    }
    return rule.withLabels(topology.labels()).withExpr(topology.render(rule.expr()));
  }

  private String groupName(String relativeDirectory, String originalName) {
    List<String> parts = new ArrayList<>();
    if (topology != null) {
      parts.add(topology.applicationIdentifier());
    }
    parts.add(relativeDirectory);
    parts.add(originalName);
    parts.add(TopologyDefaults.ALERT_GROUP_SUFFIX);
    return parts.stream()
        .filter(part -> part != null && !part.isEmpty())
        .collect(Collectors.joining("_"));
  }

  private int addAll(Collection<AlertRuleGroup> additions) {
    for (AlertRuleGroup group : additions) {
      groups.merge(group.name(), group, AlertRuleLoader::combine);
    }
    return additions.size();
  }

  private static AlertRuleGroup combine(AlertRuleGroup existing, AlertRuleGroup addition) {
    List<AlertRule> rules = new ArrayList<>(existing.rules());
    rules.addAll(addition.rules());
    return existing.withRules(rules);
  }

  private static String relativeDirectory(Path root, Path file) {
    Path parent = file.toAbsolutePath().getParent();
    Path base = root.toAbsolutePath();
    if (parent == null || parent.equals(base)) {
      return "";
    }
    String relative = base.relativize(parent).toString();
    return relative.replace(parent.getFileSystem().getSeparator(), "_");
  }

  /**
   * Collects rule files; entries that cannot be read are logged and skipped so the rest of
   * the tree is still aggregated.
   */
  private static final class RuleFileCollector extends SimpleFileVisitor<Path> {

    private final List<Path> files;

    RuleFileCollector(List<Path> files) {
      this.files = files;
    }

    @Override
    public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
      if (attrs.isRegularFile() && hasRuleSuffix(file)) {
        files.add(file);
      }
      return FileVisitResult.CONTINUE;
    }

    @Override
    public FileVisitResult visitFileFailed(Path file, IOException exc) {
      log.error("Skipping unreadable alert rule path {}: {}", file, exc.toString());
      return FileVisitResult.CONTINUE;
    }

    @Override
    public FileVisitResult postVisitDirectory(Path dir, IOException exc) {
      if (exc != null) {
        log.error("Failed to list alert rules in {}: {}", dir, exc.toString());
      }
      return FileVisitResult.CONTINUE;
    }
  }

  private static boolean hasRuleSuffix(Path file) {
    String name = file.getFileName().toString();
    int dot = name.lastIndexOf('.');
    return dot >= 0 && RULE_FILE_SUFFIXES.contains(name.substring(dot));
  }

  private static String stem(Path file) {
    String name = file.getFileName().toString();
    int dot = name.lastIndexOf('.');
    return dot > 0 ? name.substring(0, dot) : name;
  }
}
