package io.scraperelay.errors;

/**
 * A single invocation of the external label-matcher tool failed or timed out.
 */
public class ToolFailureException extends ScrapeRelayException {

  public ToolFailureException(String message) {
    super(message);
  }

  public ToolFailureException(String message, Throwable cause) {
    super(message, cause);
  }
}
