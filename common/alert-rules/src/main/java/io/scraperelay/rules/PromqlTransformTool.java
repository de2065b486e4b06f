package io.scraperelay.rules;

import io.scraperelay.errors.ToolFailureException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the {@code promql-transform} executable once per expression. Each matcher is passed
 * as {@code --label-matcher=key=value} followed by the expression; the rewritten
 * expression is read from standard output.
 */
public final class PromqlTransformTool implements LabelMatcherTool {

  private static final Logger log = LoggerFactory.getLogger(PromqlTransformTool.class);

  private final Path executable;
  private final Duration timeout;

  public PromqlTransformTool(Path executable, Duration timeout) {
    this.executable = Objects.requireNonNull(executable, "executable");
    this.timeout = Objects.requireNonNull(timeout, "timeout");
    if (timeout.isNegative() || timeout.isZero()) {
      throw new IllegalArgumentException("timeout must be positive");
    }
  }

  List<String> command(String expression, Map<String, String> matchers) {
    List<String> command = new ArrayList<>();
    command.add(executable.toString());
    matchers.forEach((key, value) -> command.add("--label-matcher=" + key + "=" + value));
    command.add(expression);
    return command;
  }

  @Override
  public String inject(String expression, Map<String, String> matchers) {
    Objects.requireNonNull(expression, "expression");
    Objects.requireNonNull(matchers, "matchers");
    List<String> command = command(expression, matchers);
    Path output = null;
    Process process = null;
    try {
      output = Files.createTempFile("promql-transform", ".out");
      process = new ProcessBuilder(command)
          .redirectOutput(output.toFile())
          .redirectError(ProcessBuilder.Redirect.DISCARD)
          .start();
      if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
        throw new ToolFailureException("promql-transform timed out after " + timeout);
      }
      int exit = process.exitValue();
      if (exit != 0) {
        throw new ToolFailureException("promql-transform exited with " + exit);
      }
      String rewritten = Files.readString(output, StandardCharsets.UTF_8).strip();
      if (rewritten.isEmpty()) {
        throw new ToolFailureException("promql-transform produced no output");
      }
      return rewritten;
    } catch (IOException ex) {
      throw new ToolFailureException("Failed to run " + executable + ": " + ex.getMessage(), ex);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new ToolFailureException("Interrupted while running " + executable, ex);
    } finally {
      if (process != null && process.isAlive()) {
        process.destroyForcibly();
      }
      deleteQuietly(output);
    }
  }

  private static void deleteQuietly(Path file) {
    if (file == null) {
      return;
    }
    try {
      Files.deleteIfExists(file);
    } catch (IOException ex) {
      log.debug("Could not delete {}: {}", file, ex.getMessage());
    }
  }
}
