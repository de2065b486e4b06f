package io.scraperelay.errors;

/**
 * A relation is declared with the wrong name, interface or role. Raised while wiring a
 * component, before any relation data is exchanged, and never recovered from.
 */
public class ConfigMismatchException extends ScrapeRelayException {

  private final String relationName;

  public ConfigMismatchException(String relationName, String message) {
    super(message);
    this.relationName = relationName;
  }

  public String relationName() {
    return relationName;
  }
}
