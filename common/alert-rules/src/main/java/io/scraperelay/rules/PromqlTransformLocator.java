package io.scraperelay.rules;

import io.scraperelay.errors.ToolUnavailableException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * Looks for {@code promql-transform-<arch>} in a resource directory.
 */
public final class PromqlTransformLocator implements LabelMatcherToolLocator {

  static final String TOOL_PREFIX = "promql-transform-";

  private final Path directory;
  private final String architecture;
  private final Duration timeout;

  public PromqlTransformLocator(Path directory, String architecture, Duration timeout) {
    this.directory = Objects.requireNonNull(directory, "directory");
    this.architecture = Objects.requireNonNull(architecture, "architecture");
    this.timeout = Objects.requireNonNull(timeout, "timeout");
  }

  /** Locator for the architecture of the running JVM. */
  public static PromqlTransformLocator forCurrentPlatform(Path directory, Duration timeout) {
    return new PromqlTransformLocator(directory, System.getProperty("os.arch", ""), timeout);
  }

  /**
   * Maps machine names to the suffixes the tool is published under; {@code x86_64} and
   * {@code aarch64} become {@code amd64} and {@code arm64}, anything else is kept.
   */
  static String normalizeArchitecture(String arch) {
    String lower = arch.trim().toLowerCase(Locale.ROOT);
    return switch (lower) {
      case "x86_64", "amd64" -> "amd64";
      case "aarch64", "arm64" -> "arm64";
      default -> lower;
    };
  }

  public String toolName() {
    return TOOL_PREFIX + normalizeArchitecture(architecture);
  }

  @Override
  public LabelMatcherTool locate() {
    if (architecture.isBlank()) {
      throw new ToolUnavailableException("Unknown platform architecture");
    }
    Path candidate = directory.resolve(toolName());
    if (!Files.isRegularFile(candidate)) {
      throw new ToolUnavailableException("Could not locate " + toolName() + " in " + directory);
    }
    if (!Files.isExecutable(candidate)) {
      throw new ToolUnavailableException(candidate + " is not executable");
    }
    return new PromqlTransformTool(candidate, timeout);
  }
}
