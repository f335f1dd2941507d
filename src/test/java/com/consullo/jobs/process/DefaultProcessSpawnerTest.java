package com.consullo.jobs.process;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

/**
 * Tests for the default spawner and signal delivery, against real POSIX processes.
 *
 * @since 1.0
 */
@DisabledOnOs(OS.WINDOWS)
public class DefaultProcessSpawnerTest {

  private final DefaultProcessSpawner spawner = new DefaultProcessSpawner();

  @Test
  @DisplayName("Should fail with SpawnException carrying the command when the executable does not exist")
  void spawn_MissingExecutable_ThrowsSpawnException() {
    final SpawnRequest request = new SpawnRequest(
        List.of("/definitely/not/here/tool"), null, null, ExecFlag.defaults());

    assertThatThrownBy(() -> spawner.spawn(request))
        .isInstanceOf(SpawnException.class)
        .satisfies(e -> assertThat(((SpawnException) e).getCommand()).containsExactly("/definitely/not/here/tool"));
  }

  @Test
  @DisplayName("Should report no exit code while running and the real one after exit")
  void exitCode_AfterExit_ReportsCode() throws Exception {
    final SpawnedProcess process = spawner.spawn(sh("exit 7"));

    assertThat(process.waitForExit(Duration.ofSeconds(10))).hasValue(7);
    assertThat(process.exitCode()).hasValue(7);
    assertThat(process.isAlive()).isFalse();
    assertThat(process.hasBlockingStreams()).isFalse();
  }

  @Test
  @DisplayName("Should keep stdout and stderr apart and apply environment overrides")
  void spawn_WithEnvironment_SeparatesStreams() throws Exception {
    final SpawnRequest request = new SpawnRequest(
        List.of("/bin/sh", "-c", "printf '%s' \"$GREETING\"; printf 'bad' >&2"),
        null,
        Map.of("GREETING", "hello"),
        ExecFlag.defaults());
    final SpawnedProcess process = spawner.spawn(request);
    process.waitForExit(Duration.ofSeconds(10));

    assertThat(readAll(process.stdout())).isEqualTo("hello");
    assertThat(readAll(process.stderr())).isEqualTo("bad");
  }

  @Test
  @DisplayName("Should terminate a running process with TERM")
  void kill_Term_EndsProcess() throws Exception {
    final SpawnedProcess process = spawner.spawn(sh("exec sleep 30"));

    assertThat(process.kill(Signal.TERM, KillScope.PROCESS_ONLY)).isEqualTo(KillResult.OK);

    final OptionalInt code = process.waitForExit(Duration.ofSeconds(10));
    assertThat(code).isPresent();
    assertThat(code.getAsInt()).isNotZero();
  }

  @Test
  @DisplayName("Should deliver INT through the kill utility")
  void kill_Int_Delivered() throws Exception {
    final SpawnedProcess process = spawner.spawn(sh("exec sleep 30"));
    try {
      // Delivery only: a child started from a background shell may inherit an ignored SIGINT.
      assertThat(process.kill(Signal.INT, KillScope.PROCESS_ONLY)).isEqualTo(KillResult.OK);
    } finally {
      process.destroyForcibly();
    }
  }

  @Test
  @DisplayName("Should report NO_PROCESS for a process that already exited")
  void kill_Exited_ReportsNoProcess() throws Exception {
    final SpawnedProcess process = spawner.spawn(sh("exit 0"));
    process.waitForExit(Duration.ofSeconds(10));

    await().atMost(Duration.ofSeconds(5)).until(() -> ProcessHandle.of(process.pid()).isEmpty()
        || !ProcessHandle.of(process.pid()).get().isAlive());
    assertThat(process.kill(Signal.TERM, KillScope.PROCESS_ONLY)).isEqualTo(KillResult.NO_PROCESS);
  }

  @Test
  @DisplayName("Should reach descendants with CHILDREN scope when spawned as group leader")
  void kill_ChildrenOfGroupLeader_EndsDescendants() throws Exception {
    final SpawnRequest request = new SpawnRequest(
        List.of("/bin/sh", "-c", "sleep 30 & wait"), null, null,
        EnumSet.of(ExecFlag.ASYNC, ExecFlag.MAKE_GROUP_LEADER));
    final SpawnedProcess process = spawner.spawn(request);

    await().atMost(Duration.ofSeconds(5)).until(() -> descendantOf(process.pid()).isPresent());
    final ProcessHandle child = descendantOf(process.pid()).orElseThrow();

    assertThat(process.kill(Signal.KILL, KillScope.CHILDREN)).isEqualTo(KillResult.OK);

    await().atMost(Duration.ofSeconds(10)).until(() -> !child.isAlive());
    assertThat(process.waitForExit(Duration.ofSeconds(10))).isPresent();
  }

  @Test
  @DisplayName("Should reject an empty command")
  void spawnRequest_EmptyCommand_Rejected() {
    assertThatThrownBy(() -> new SpawnRequest(List.of(), null, null, null))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  @Timeout(30)
  @DisplayName("Should attach the child to a pseudo-terminal with separate stdout and stderr for SHOW_CONSOLE")
  void spawn_ShowConsole_RunsOnPtyWithSeparateStderr() throws Exception {
    final SpawnRequest request = new SpawnRequest(
        List.of("/bin/sh", "-c", "[ -t 1 ] && printf 'tty' || printf 'nope'; printf 'oops' >&2; sleep 5"),
        null,
        null,
        EnumSet.of(ExecFlag.ASYNC, ExecFlag.SHOW_CONSOLE));
    final SpawnedProcess process = spawner.spawn(request);
    try {
      assertThat(process.hasBlockingStreams()).isTrue();
      assertThat(new String(process.stdout().readNBytes(3), StandardCharsets.UTF_8)).isEqualTo("tty");
      assertThat(new String(process.stderr().readNBytes(4), StandardCharsets.UTF_8)).isEqualTo("oops");
    } finally {
      process.destroyForcibly();
    }
  }

  private static SpawnRequest sh(final String script) {
    return new SpawnRequest(List.of("/bin/sh", "-c", script), null, null, ExecFlag.defaults());
  }

  private static Optional<ProcessHandle> descendantOf(final long pid) {
    return ProcessHandle.of(pid).flatMap(h -> h.descendants().findFirst());
  }

  private static String readAll(final InputStream in) throws IOException {
    return new String(in.readAllBytes(), StandardCharsets.UTF_8);
  }
}
