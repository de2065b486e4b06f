package io.scraperelay.errors;

/**
 * Root of the unchecked exceptions raised while labeling, merging or publishing scrape
 * configuration.
 */
public class ScrapeRelayException extends RuntimeException {

  public ScrapeRelayException(String message) {
    super(message);
  }

  public ScrapeRelayException(String message, Throwable cause) {
    super(message, cause);
  }
}
