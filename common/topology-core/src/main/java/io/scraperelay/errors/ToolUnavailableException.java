package io.scraperelay.errors;

/**
 * The external label-matcher tool is not installed or cannot run on this platform.
 */
public class ToolUnavailableException extends ScrapeRelayException {

  public ToolUnavailableException(String message) {
    super(message);
  }

  public ToolUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
