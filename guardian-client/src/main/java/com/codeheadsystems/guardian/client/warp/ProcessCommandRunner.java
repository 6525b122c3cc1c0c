package com.codeheadsystems.guardian.client.warp;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link CommandRunner} over {@link ProcessBuilder}. Processes that outlive the timeout are
 * destroyed and reported with exit code -1.
 * <p>
 * Combined stdout and stderr go to a temporary file rather than a pipe, so a child that writes
 * more than the pipe buffer never stalls before it exits.
 */
public class ProcessCommandRunner implements CommandRunner {

  private static final Logger log = LoggerFactory.getLogger(ProcessCommandRunner.class);

  private final Duration timeout;

  public ProcessCommandRunner(final Duration timeout) {
    this.timeout = timeout;
  }

  @Override
  public CommandResult run(final List<String> command) throws IOException, InterruptedException {
    log.debug("run({})", command);
    final Path output = Files.createTempFile("guardian-cmd-", ".out");
    try {
      Process process = new ProcessBuilder(command)
          .redirectErrorStream(true)
          .redirectOutput(output.toFile())
          .start();
      try {
        if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
          process.destroyForcibly();
          return new CommandResult(-1, "timed out after " + timeout);
        }
        return new CommandResult(process.exitValue(), Files.readString(output, StandardCharsets.UTF_8));
      } finally {
        if (process.isAlive()) {
          process.destroyForcibly();
        }
      }
    } finally {
      Files.deleteIfExists(output);
    }
  }
}
