package io.scraperelay.errors;

import java.nio.file.Path;

/**
 * The alert rules folder cannot be found or is not a directory.
 */
public class InvalidAlertRulePathException extends ScrapeRelayException {

  private final Path path;

  public InvalidAlertRulePathException(Path path, String message) {
    super(path + ": " + message);
    this.path = path;
  }

  public Path path() {
    return path;
  }
}
