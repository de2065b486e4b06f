package io.scraperelay.rules;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.scraperelay.errors.MalformedFragmentException;
import io.scraperelay.model.AlertRule;
import java.util.List;
import java.util.Objects;

/**
 * YAML codec for rule files and for the rule lists peers publish in unit data.
 */
public final class RuleYaml {

  private static final ObjectMapper MAPPER = new ObjectMapper(new YAMLFactory()).findAndRegisterModules();

  private static final TypeReference<List<AlertRule>> RULES_TYPE = new TypeReference<>() {};

  private RuleYaml() {
  }

  static ObjectMapper mapper() {
    return MAPPER;
  }

  /**
   * Reads a YAML list of alert rules.
   *
   * @return the rules, empty for blank input
   * @throws MalformedFragmentException when the text is not a list of rules
   */
  public static List<AlertRule> readRules(String yaml) {
    if (yaml == null || yaml.isBlank()) {
      return List.of();
    }
    List<AlertRule> rules;
    try {
      rules = MAPPER.readValue(yaml, RULES_TYPE);
    } catch (JsonProcessingException e) {
      throw new MalformedFragmentException("Failed to parse alert rule list: " + e.getOriginalMessage(), e);
    }
    return rules == null ? List.of() : rules.stream().filter(Objects::nonNull).toList();
  }
}
