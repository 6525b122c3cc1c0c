package com.codeheadsystems.guardian.client.warp;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.guardian.client.exceptions.IdentityRotationException;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class WarpIdentityRotatorTest {

  private static final Duration TIMEOUT = Duration.ofSeconds(6);

  private final FakeRunner runner = new FakeRunner();
  private final List<Duration> sleeps = new ArrayList<>();
  private final WarpIdentityRotator rotator = new WarpIdentityRotator(runner, sleeps::add, TIMEOUT);

  @AfterEach
  void clearInterrupt() {
    Thread.interrupted();
  }

  @Test
  void rotate_disconnectsPausesConnectsAndPolls() {
    runner.status("Status update: Connecting", "Status update: Connected");

    rotator.rotate();

    assertThat(runner.commands).containsExactly(
        "warp-cli disconnect", "warp-cli connect", "warp-cli status", "warp-cli status");
    assertThat(sleeps).containsExactly(WarpIdentityRotator.RECONNECT_PAUSE, WarpIdentityRotator.POLL_INTERVAL);
  }

  @Test
  void rotate_disconnectFailsTwice_retriesWithBackoff() {
    runner.failDisconnects = 2;
    runner.status("Status update: Connected");

    rotator.rotate();

    assertThat(runner.commands).startsWith("warp-cli disconnect", "warp-cli disconnect", "warp-cli disconnect",
        "warp-cli connect");
    assertThat(sleeps).startsWith(Duration.ofSeconds(1), Duration.ofSeconds(2), WarpIdentityRotator.RECONNECT_PAUSE);
  }

  @Test
  void rotate_disconnectAlwaysFails_throwsAfterThreeAttempts() {
    runner.failDisconnects = Integer.MAX_VALUE;

    assertThatThrownBy(rotator::rotate)
        .isInstanceOf(IdentityRotationException.class)
        .hasMessageContaining("disconnect failed after 3 attempt(s)");
    assertThat(runner.commands).containsExactly("warp-cli disconnect", "warp-cli disconnect", "warp-cli disconnect");
  }

  @Test
  void rotate_neverConnects_timesOutEachAttempt() {
    runner.status("Status update: Disconnected");

    assertThatThrownBy(rotator::rotate)
        .isInstanceOf(IdentityRotationException.class)
        .hasMessageContaining("connect failed after 3 attempt(s)")
        .hasRootCauseMessage("WARP did not connect within " + TIMEOUT);
    long polls = runner.commands.stream().filter("warp-cli status"::equals).count();
    assertThat(polls).isEqualTo(3 * 3);
  }

  @Test
  void rotate_cliMissing_throwsIdentityRotationException() {
    WarpIdentityRotator missing = new WarpIdentityRotator(command -> {
      throw new IOException("warp-cli: not found");
    }, sleeps::add, TIMEOUT);

    assertThatThrownBy(missing::rotate)
        .isInstanceOf(IdentityRotationException.class)
        .hasRootCauseInstanceOf(IOException.class);
  }

  @Test
  void rotate_interruptedDuringPause_stopsRetrying() {
    WarpIdentityRotator interrupted = new WarpIdentityRotator(runner, duration -> {
      throw new InterruptedException("stop");
    }, TIMEOUT);

    assertThatThrownBy(interrupted::rotate).isInstanceOf(IdentityRotationException.class);
    assertThat(Thread.currentThread().isInterrupted()).isTrue();
  }

  @Test
  void isConnected_disconnectedIsNotConnected() {
    runner.status("Status update: Disconnected");

    assertThat(rotator.isConnected()).isFalse();
  }

  private static class FakeRunner implements CommandRunner {

    private final List<String> commands = new ArrayList<>();
    private final Deque<String> statuses = new ArrayDeque<>();
    private int failDisconnects;

    void status(String... outputs) {
      statuses.addAll(List.of(outputs));
    }

    @Override
    public CommandResult run(List<String> command) {
      String joined = String.join(" ", command);
      commands.add(joined);
      if (joined.endsWith("disconnect") && failDisconnects > 0) {
        failDisconnects--;
        return new CommandResult(1, "Error: daemon busy");
      }
      if (joined.endsWith("status")) {
        String output = statuses.size() > 1 ? statuses.poll() : statuses.peek();
        return new CommandResult(0, output == null ? "" : output);
      }
      return new CommandResult(0, "Success");
    }
  }
}
