package io.scraperelay.rules;

import io.scraperelay.errors.ToolUnavailableException;
import io.scraperelay.model.AlertRule;
import io.scraperelay.model.AlertRuleGroup;
import io.scraperelay.model.AlertRuleSet;
import io.scraperelay.topology.TopologyDefaults;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Injects topology label matchers into alert expressions through an external tool.
 * <p>
 * The tool is located lazily on first use. Once the lookup failed the labeler stays
 * {@link ToolState#UNAVAILABLE} and returns every expression unchanged without retrying.
 * A failed invocation leaves that one expression unchanged and is logged at debug level.
 * Safe for concurrent use.
 */
public final class ExpressionLabeler {

  private static final Logger log = LoggerFactory.getLogger(ExpressionLabeler.class);

  public enum ToolState {
    UNRESOLVED,
    AVAILABLE,
    UNAVAILABLE
  }

  private static final List<String> MATCHER_ORDER = List.of(
      TopologyDefaults.MODEL_LABEL,
      TopologyDefaults.MODEL_UUID_LABEL,
      TopologyDefaults.APPLICATION_LABEL,
      TopologyDefaults.CHARM_LABEL,
      TopologyDefaults.UNIT_LABEL);

  private final LabelMatcherToolLocator locator;
  private ToolState state = ToolState.UNRESOLVED;
  private LabelMatcherTool tool;

  public ExpressionLabeler(LabelMatcherToolLocator locator) {
    this.locator = Objects.requireNonNull(locator, "locator");
  }

  /** Labeler whose tool is never available; every expression passes through. */
  public static ExpressionLabeler passThrough() {
    return new ExpressionLabeler(() -> {
      throw new ToolUnavailableException("label matcher tool disabled");
    });
  }

  public synchronized ToolState state() {
    return state;
  }

  /**
   * Returns {@code expression} with {@code matchers} injected, or {@code expression}
   * itself when the tool is unavailable or fails.
   */
  public String apply(String expression, Map<String, String> matchers) {
    if (expression == null || expression.isBlank() || matchers == null || matchers.isEmpty()) {
      return expression;
    }
    LabelMatcherTool resolved = resolve();
    if (resolved == null) {
      return expression;
    }
    try {
      return resolved.inject(expression, matchers);
    } catch (RuntimeException ex) {
      log.debug("Failed to inject label matchers into '{}': {}", expression, ex.toString());
      return expression;
    }
  }

  /**
   * Injects, into every rule's expression, the topology labels the rule itself carries,
   * in the order model, model uuid, application, charm, unit.
   */
  public AlertRuleSet apply(AlertRuleSet rules) {
    Objects.requireNonNull(rules, "rules");
    if (rules.isEmpty() || resolve() == null) {
      return rules;
    }
    return rewrite(rules, rule -> apply(rule.expr(), topologyMatchers(rule.labels())));
  }

  /**
   * Applies {@code matchers} to the expression of every rule. Rules keep their position
   * and all other fields.
   */
  public AlertRuleSet apply(AlertRuleSet rules, Map<String, String> matchers) {
    Objects.requireNonNull(rules, "rules");
    if (rules.isEmpty() || resolve() == null) {
      return rules;
    }
    return rewrite(rules, rule -> apply(rule.expr(), matchers));
  }

  static Map<String, String> topologyMatchers(Map<String, String> labels) {
    Map<String, String> matchers = new LinkedHashMap<>();
    for (String key : MATCHER_ORDER) {
      String value = labels.get(key);
      if (value != null) {
        matchers.put(key, value);
      }
    }
    return matchers;
  }

  private static AlertRuleSet rewrite(AlertRuleSet rules, Function<AlertRule, String> expression) {
    List<AlertRuleGroup> groups = new ArrayList<>(rules.groups().size());
    for (AlertRuleGroup group : rules.groups()) {
      List<AlertRule> labelled = new ArrayList<>(group.rules().size());
      for (AlertRule rule : group.rules()) {
        labelled.add(rule.withExpr(expression.apply(rule)));
      }
      groups.add(group.withRules(labelled));
    }
    return new AlertRuleSet(groups);
  }

  private synchronized LabelMatcherTool resolve() {
    if (state == ToolState.UNRESOLVED) {
      try {
        tool = locator.locate();
        state = ToolState.AVAILABLE;
        log.debug("Label matcher tool resolved");
      } catch (ToolUnavailableException ex) {
        state = ToolState.UNAVAILABLE;
        log.debug("Label matcher tool unavailable, expressions are left unchanged: {}",
            ex.getMessage());
      }
    }
    return tool;
  }
}
