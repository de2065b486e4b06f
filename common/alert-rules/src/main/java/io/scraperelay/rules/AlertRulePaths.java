package io.scraperelay.rules;

import io.scraperelay.errors.InvalidAlertRulePathException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

public final class AlertRulePaths {

  private AlertRulePaths() {
  }

  /**
   * Resolves the alert rules directory relative to {@code baseDirectory}.
   *
   * @throws InvalidAlertRulePathException when the path does not exist or is not a directory
   */
  public static Path resolve(Path baseDirectory, String relativePath) {
    Objects.requireNonNull(baseDirectory, "baseDirectory");
    Objects.requireNonNull(relativePath, "relativePath");
    Path path = baseDirectory.resolve(relativePath).normalize();
    if (!Files.exists(path)) {
      throw new InvalidAlertRulePathException(path, "directory does not exist");
    }
    if (!Files.isDirectory(path)) {
      throw new InvalidAlertRulePathException(path, "is not a directory");
    }
    return path;
  }
}
