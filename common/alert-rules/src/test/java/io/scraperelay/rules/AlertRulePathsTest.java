package io.scraperelay.rules;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.scraperelay.errors.InvalidAlertRulePathException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class AlertRulePathsTest {

  @TempDir
  Path charmDir;

  @Test
  void resolvesExistingDirectory() throws IOException {
    Path rules = Files.createDirectories(charmDir.resolve("src").resolve("prometheus_alert_rules"));

    assertThat(AlertRulePaths.resolve(charmDir, "./src/prometheus_alert_rules")).isEqualTo(rules);
  }

  @Test
  void rejectsMissingDirectoryAndPlainFile() throws IOException {
    Files.writeString(charmDir.resolve("rules"), "groups: []");

    assertThatThrownBy(() -> AlertRulePaths.resolve(charmDir, "absent"))
        .isInstanceOf(InvalidAlertRulePathException.class)
        .hasMessageContaining("does not exist");
    assertThatThrownBy(() -> AlertRulePaths.resolve(charmDir, "rules"))
        .isInstanceOf(InvalidAlertRulePathException.class)
        .hasMessageContaining("not a directory");
  }
}
