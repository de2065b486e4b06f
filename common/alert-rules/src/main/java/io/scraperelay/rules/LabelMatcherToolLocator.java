package io.scraperelay.rules;

import io.scraperelay.errors.ToolUnavailableException;

/**
 * Finds a usable {@link LabelMatcherTool} for the running platform.
 */
@FunctionalInterface
public interface LabelMatcherToolLocator {

  LabelMatcherTool locate() throws ToolUnavailableException;
}
