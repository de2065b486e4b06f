package io.scraperelay.errors;

/**
 * A scrape target is not of the form {@code host:port}.
 */
public class TargetFormatException extends MalformedFragmentException {

  private final String target;

  public TargetFormatException(String target) {
    super("Scrape target '" + target + "' must contain exactly one ':' separating host and port");
    this.target = target;
  }

  public String target() {
    return target;
  }
}
