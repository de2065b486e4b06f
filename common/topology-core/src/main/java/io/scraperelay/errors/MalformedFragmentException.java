package io.scraperelay.errors;

/**
 * A scrape job or alert rule fragment supplied by one peer could not be used. Callers log
 * it and skip that fragment; other peers are still processed.
 */
public class MalformedFragmentException extends ScrapeRelayException {

  public MalformedFragmentException(String message) {
    super(message);
  }

  public MalformedFragmentException(String message, Throwable cause) {
    super(message, cause);
  }
}
