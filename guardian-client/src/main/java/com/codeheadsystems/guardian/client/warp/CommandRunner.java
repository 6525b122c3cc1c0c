package com.codeheadsystems.guardian.client.warp;

import java.io.IOException;
import java.util.List;

/**
 * Runs an external command to completion.
 */
@FunctionalInterface
public interface CommandRunner {

  /**
   * Runs the command.
   *
   * @param command program and arguments
   * @return exit code and combined output
   * @throws IOException  if the program cannot be started
   * @throws InterruptedException if interrupted while waiting
   */
  CommandResult run(List<String> command) throws IOException, InterruptedException;

  /**
   * Result of one command.
   *
   * @param exitCode the exit code
   * @param output   stdout and stderr
   */
  record CommandResult(int exitCode, String output) {

    public boolean succeeded() {
      return exitCode == 0;
    }
  }
}
