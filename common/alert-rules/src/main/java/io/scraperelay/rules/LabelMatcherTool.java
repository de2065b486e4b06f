package io.scraperelay.rules;

import io.scraperelay.errors.ToolFailureException;
import java.util.Map;

/**
 * Injects label matchers into every vector selector of a PromQL expression.
 */
@FunctionalInterface
public interface LabelMatcherTool {

  /**
   * @param expression PromQL expression to rewrite
   * @param matchers   ordered label matchers to inject
   * @return the rewritten expression
   * @throws ToolFailureException when this invocation fails or times out
   */
  String inject(String expression, Map<String, String> matchers);
}
