package io.scraperelay.rules;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assumptions.assumeFalse;

import io.scraperelay.model.AlertRule;
import io.scraperelay.model.AlertRuleGroup;
import io.scraperelay.model.AlertRuleSet;
import io.scraperelay.topology.Topology;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

class AlertRuleLoaderTest {

  private static final String UUID = "2d8bcb5c-2a5b-4f4b-8f2c-7a0c8e9d1f00";
  private static final String PREFIX = "lma_" + UUID + "_grafana";

  private static final String OFFICIAL = """
      groups:
        - name: cpu
          rules:
            - alert: CpuHigh
              expr: rate(cpu_seconds{%%juju_topology%%}[5m]) > 0.9
              for: 5m
              labels:
                severity: warning
      """;

  private static final String SINGLE = """
      alert: TargetDown
      expr: up < 1
      labels:
        severity: critical
      annotations:
        summary: target down
      """;

  @TempDir
  Path rulesDir;

  private final Topology topology = Topology.forProvider("lma", UUID, "grafana", "grafana/0", null);

  @Test
  void officialFileIsPrefixedAndStamped() throws IOException {
    Files.writeString(rulesDir.resolve("cpu.rules"), OFFICIAL);

    AlertRuleLoader loader = new AlertRuleLoader(topology);
    assertThat(loader.add(rulesDir, false)).isEqualTo(1);

    AlertRuleSet rules = loader.finalizeRules();
    assertThat(rules.groups()).extracting(AlertRuleGroup::name)
        .containsExactly(PREFIX + "_cpu_alerts");
    AlertRule rule = rules.groups().get(0).rules().get(0);
    assertThat(rule.forDuration()).isEqualTo("5m");
    assertThat(rule.labels()).containsEntry("severity", "warning")
        .containsEntry("juju_model", "lma")
        .containsEntry("juju_model_uuid", UUID)
        .containsEntry("juju_application", "grafana")
        .doesNotContainKey("juju_unit");
    assertThat(rule.expr()).isEqualTo("rate(cpu_seconds{juju_model=\"lma\", juju_model_uuid=\""
        + UUID + "\", juju_application=\"grafana\"}[5m]) > 0.9");
  }

  @Test
  void malformedFileIsSkippedAndSingleRuleFileBecomesGroup() throws IOException {
    Files.writeString(rulesDir.resolve("broken.rule"), "groups: [\n  - name: x\n");
    Files.writeString(rulesDir.resolve("target_down.rule"), SINGLE);
    Files.writeString(rulesDir.resolve("notes.txt"), SINGLE);

    AlertRuleLoader loader = new AlertRuleLoader(topology);
    loader.add(rulesDir, false);

    AlertRuleSet rules = loader.finalizeRules();
    assertThat(rules.groups()).hasSize(1);
    AlertRuleGroup group = rules.groups().get(0);
    assertThat(group.name()).isEqualTo(PREFIX + "_target_down_alerts");
    assertThat(group.rules()).singleElement().satisfies(rule -> {
      assertThat(rule.alert()).isEqualTo("TargetDown");
      assertThat(rule.annotations()).containsEntry("summary", "target down");
    });
  }

  @Test
  void documentsOfUnknownShapeAreSkipped() throws IOException {
    Files.writeString(rulesDir.resolve("list.rules"), "- alert: A\n  expr: up\n");
    Files.writeString(rulesDir.resolve("other.rules"), "name: nothing\n");

    AlertRuleLoader loader = new AlertRuleLoader(topology);
    loader.add(rulesDir, false);

    assertThat(loader.finalizeRules().isEmpty()).isTrue();
  }

  @Test
  void nestedDirectoriesAreOnlyReadWhenRecursive() throws IOException {
    Path nested = Files.createDirectories(rulesDir.resolve("sub").resolve("dir"));
    Files.writeString(nested.resolve("down.rule"), SINGLE);

    AlertRuleLoader flat = new AlertRuleLoader(topology);
    flat.add(rulesDir, false);
    assertThat(flat.finalizeRules().isEmpty()).isTrue();

    AlertRuleLoader recursive = new AlertRuleLoader(topology);
    recursive.add(rulesDir, true);
    assertThat(recursive.finalizeRules().groups()).extracting(AlertRuleGroup::name)
        .containsExactly(PREFIX + "_sub_dir_down_alerts");
  }

  @Test
  void groupsWithTheSameNameAreCombined() throws IOException {
    Files.writeString(rulesDir.resolve("a.rules"), OFFICIAL);
    Files.writeString(rulesDir.resolve("b.rules"), OFFICIAL.replace("CpuHigh", "CpuVeryHigh"));

    AlertRuleLoader loader = new AlertRuleLoader(topology);
    loader.add(rulesDir, false);

    AlertRuleSet rules = loader.finalizeRules();
    assertThat(rules.groups()).hasSize(1);
    assertThat(rules.groups().get(0).rules()).extracting(AlertRule::alert)
        .containsExactly("CpuHigh", "CpuVeryHigh");
  }

  @Test
  void rulesWithoutTopologyAreForwardedUntouched() throws IOException {
    Path file = rulesDir.resolve("cpu.rules");
    Files.writeString(file, OFFICIAL);

    AlertRuleLoader loader = AlertRuleLoader.withoutTopology();
    loader.add(file, false);

    AlertRuleGroup group = loader.finalizeRules().groups().get(0);
    assertThat(group.name()).isEqualTo("cpu_alerts");
    assertThat(group.rules().get(0).labels()).isEqualTo(Map.of("severity", "warning"));
    assertThat(group.rules().get(0).expr()).contains("%%juju_topology%%");
  }

  @Test
  void rulesCanBeAddedFromText() {
    AlertRuleLoader loader = new AlertRuleLoader(topology);

    assertThat(loader.add(SINGLE, "down")).isEqualTo(1);
    assertThat(loader.add("", "empty")).isZero();
    assertThat(loader.add("{{{", "garbage")).isZero();

    assertThat(loader.finalizeRules().groups()).extracting(AlertRuleGroup::name)
        .containsExactly(PREFIX + "_down_alerts");
  }

  @Test
  void missingPathContributesNothing() {
    AlertRuleLoader loader = new AlertRuleLoader(topology);

    assertThat(loader.add(rulesDir.resolve("absent"), true)).isZero();
    assertThat(loader.finalizeRules()).isSameAs(AlertRuleSet.EMPTY);
  }

  @Test
  @EnabledOnOs({OS.LINUX, OS.MAC})
  void unreadableSubdirectoryDoesNotHideReadableRules() throws IOException {
    Files.writeString(rulesDir.resolve("target_down.rule"), SINGLE);
    Path locked = Files.createDirectory(rulesDir.resolve("locked"));
    Files.writeString(locked.resolve("cpu.rules"), OFFICIAL);
    Files.setPosixFilePermissions(locked, PosixFilePermissions.fromString("---------"));
    try {
      assumeFalse(Files.isReadable(locked), "permissions are not enforced for this user");

      AlertRuleLoader loader = new AlertRuleLoader(topology);
      assertThat(loader.add(rulesDir, true)).isEqualTo(1);

      assertThat(loader.finalizeRules().groups()).extracting(AlertRuleGroup::name)
          .containsExactly(PREFIX + "_target_down_alerts");
    } finally {
      Files.setPosixFilePermissions(locked, PosixFilePermissions.fromString("rwx------"));
    }
  }
}
