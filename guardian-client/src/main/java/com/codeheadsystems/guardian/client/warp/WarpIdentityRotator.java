package com.codeheadsystems.guardian.client.warp;

import com.codeheadsystems.guardian.client.exceptions.IdentityRotationException;
import com.codeheadsystems.guardian.core.collaborator.IdentityRotator;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rotates the egress address by reconnecting Cloudflare WARP through {@code warp-cli}.
 * <p>
 * Rotation is disconnect, a short pause, then connect and poll {@code warp-cli status} until it
 * reports connected or the connect timeout passes. Disconnect and connect (including its wait)
 * are each tried {@value #MAX_ATTEMPTS} times with exponential backoff of 1, 2, 4... seconds,
 * capped at 8.
 */
public class WarpIdentityRotator implements IdentityRotator {

  static final int MAX_ATTEMPTS = 3;
  static final Duration RECONNECT_PAUSE = Duration.ofSeconds(2);
  static final Duration POLL_INTERVAL = Duration.ofSeconds(2);
  private static final Duration MAX_BACKOFF = Duration.ofSeconds(8);

  private static final String WARP_CLI = "warp-cli";
  private static final Logger log = LoggerFactory.getLogger(WarpIdentityRotator.class);

  private final CommandRunner commandRunner;
  private final Sleeper sleeper;
  private final Duration connectTimeout;

  /**
   * Rotator running the real {@code warp-cli}.
   *
   * @param connectTimeout how long to wait for a connection
   */
  public WarpIdentityRotator(final Duration connectTimeout) {
    this(new ProcessCommandRunner(Duration.ofSeconds(30)), Sleeper.THREAD, connectTimeout);
  }

  WarpIdentityRotator(final CommandRunner commandRunner, final Sleeper sleeper, final Duration connectTimeout) {
    log.info("WarpIdentityRotator(connectTimeout={})", connectTimeout);
    this.commandRunner = commandRunner;
    this.sleeper = sleeper;
    this.connectTimeout = connectTimeout;
  }

  @Override
  public void rotate() {
    log.debug("rotate()");
    withRetry("disconnect", () -> command("disconnect"));
    pause(RECONNECT_PAUSE);
    withRetry("connect", () -> {
      command("connect");
      awaitConnection();
    });
    log.info("WARP identity rotated");
  }

  /**
   * Whether {@code warp-cli status} reports a connection.
   *
   * @return the boolean
   */
  public boolean isConnected() {
    final CommandRunner.CommandResult result = execute(List.of(WARP_CLI, "status"));
    final String output = result.output() == null ? "" : result.output().toLowerCase(Locale.ROOT);
    return output.contains("connected") && !output.contains("disconnected");
  }

  private void awaitConnection() {
    final long polls = Math.max(1, connectTimeout.toMillis() / POLL_INTERVAL.toMillis());
    for (long i = 0; i < polls; i++) {
      if (isConnected()) {
        return;
      }
      pause(POLL_INTERVAL);
    }
    throw new IdentityRotationException("WARP did not connect within " + connectTimeout, null);
  }

  private void command(final String verb) {
    CommandRunner.CommandResult result = execute(List.of(WARP_CLI, verb));
    if (!result.succeeded()) {
      throw new IdentityRotationException(WARP_CLI + " " + verb + " exited with " + result.exitCode(), null);
    }
  }

  private CommandRunner.CommandResult execute(final List<String> command) {
    try {
      return commandRunner.run(command);
    } catch (IOException e) {
      throw new IdentityRotationException("Could not run " + String.join(" ", command), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IdentityRotationException("Interrupted running " + String.join(" ", command), e);
    }
  }

  private void withRetry(final String step, final Runnable action) {
    Duration backoff = Duration.ofSeconds(1);
    for (int attempt = 1; ; attempt++) {
      try {
        action.run();
        return;
      } catch (IdentityRotationException e) {
        if (attempt >= MAX_ATTEMPTS || Thread.currentThread().isInterrupted()) {
          throw new IdentityRotationException("WARP " + step + " failed after " + attempt + " attempt(s)", e);
        }
        log.debug("WARP {} attempt {} failed, retrying in {}: {}", step, attempt, backoff, e.getMessage());
        pause(backoff);
        backoff = backoff.multipliedBy(2).compareTo(MAX_BACKOFF) > 0 ? MAX_BACKOFF : backoff.multipliedBy(2);
      }
    }
  }

  private void pause(final Duration duration) {
    try {
      sleeper.sleep(duration);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IdentityRotationException("Interrupted while waiting for WARP", e);
    }
  }
}
