package io.scraperelay.rules;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.scraperelay.errors.ToolUnavailableException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

class PromqlTransformLocatorTest {

  @TempDir
  Path resources;

  @Test
  void machineNamesMapToPublishedSuffixes() {
    assertThat(PromqlTransformLocator.normalizeArchitecture("x86_64")).isEqualTo("amd64");
    assertThat(PromqlTransformLocator.normalizeArchitecture("aarch64")).isEqualTo("arm64");
    assertThat(PromqlTransformLocator.normalizeArchitecture("AMD64")).isEqualTo("amd64");
    assertThat(PromqlTransformLocator.normalizeArchitecture("s390x")).isEqualTo("s390x");
    assertThat(new PromqlTransformLocator(resources, "x86_64", Duration.ofSeconds(1)).toolName())
        .isEqualTo("promql-transform-amd64");
  }

  @Test
  void missingExecutableIsReportedAsUnavailable() {
    PromqlTransformLocator locator = new PromqlTransformLocator(resources, "aarch64", Duration.ofSeconds(1));

    assertThatThrownBy(locator::locate)
        .isInstanceOf(ToolUnavailableException.class)
        .hasMessageContaining("promql-transform-arm64");
  }

  @Test
  void commandPassesMatchersBeforeTheExpression() {
    PromqlTransformTool tool = new PromqlTransformTool(Path.of("/opt/promql-transform-amd64"), Duration.ofSeconds(1));
    Map<String, String> matchers = new LinkedHashMap<>();
    matchers.put("juju_model", "lma");
    matchers.put("juju_application", "grafana");

    assertThat(tool.command("up < 1", matchers)).containsExactly(
        "/opt/promql-transform-amd64",
        "--label-matcher=juju_model=lma",
        "--label-matcher=juju_application=grafana",
        "up < 1");
  }

  @Test
  @EnabledOnOs({OS.LINUX, OS.MAC})
  void locatedToolRunsTheExecutable() throws IOException {
    Path script = resources.resolve("promql-transform-amd64");
    Files.writeString(script, "#!/bin/sh\nfor last; do :; done\necho \"rewritten:$last\"\n");
    Files.setPosixFilePermissions(script, PosixFilePermissions.fromString("rwxr-xr-x"));

    LabelMatcherTool tool = new PromqlTransformLocator(resources, "x86_64", Duration.ofSeconds(10)).locate();

    assertThat(tool.inject("up < 1", Map.of("juju_model", "lma"))).isEqualTo("rewritten:up < 1");
  }

  @Test
  @EnabledOnOs({OS.LINUX, OS.MAC})
  void hungToolIsCutOffAtTheDeadline() throws IOException {
    Path script = resources.resolve("promql-transform-amd64");
    Files.writeString(script, "#!/bin/sh\nexec sleep 20\n");
    Files.setPosixFilePermissions(script, PosixFilePermissions.fromString("rwxr-xr-x"));
    ExpressionLabeler labeler = new ExpressionLabeler(
        new PromqlTransformLocator(resources, "x86_64", Duration.ofMillis(300)));

    long started = System.nanoTime();
    String result = labeler.apply("up < 1", Map.of("juju_model", "lma"));
    Duration elapsed = Duration.ofNanos(System.nanoTime() - started);

    assertThat(result).isEqualTo("up < 1");
    assertThat(elapsed).isLessThan(Duration.ofSeconds(5));
    assertThat(labeler.state()).isEqualTo(ExpressionLabeler.ToolState.AVAILABLE);
  }
}
