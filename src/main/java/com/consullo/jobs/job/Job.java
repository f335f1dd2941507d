package com.consullo.jobs.job;

import com.consullo.jobs.host.HostDispatcher;
import com.consullo.jobs.host.Tick;
import com.consullo.jobs.host.TickScheduler;
import com.consullo.jobs.pipe.StreamReader;
import com.consullo.jobs.pipe.StreamReaderConfig;
import com.consullo.jobs.process.ExecFlag;
import com.consullo.jobs.process.KillResult;
import com.consullo.jobs.process.KillScope;
import com.consullo.jobs.process.ProcessSpawner;
import com.consullo.jobs.process.Signal;
import com.consullo.jobs.process.SpawnException;
import com.consullo.jobs.process.SpawnRequest;
import com.consullo.jobs.process.SpawnedProcess;
import java.lang.ref.Cleaner;
import java.lang.ref.WeakReference;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.OptionalLong;
import java.util.Set;
import java.util.function.Consumer;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Supervises one external child process on behalf of a single-threaded host.
 *
 * <p>
 * Owns:
 * <ul>
 * <li>the spawned process handle</li>
 * <li>one {@link StreamReader} for stdout and one for stderr</li>
 * <li>an optional periodic tick that calls {@link #poll()}</li>
 * </ul>
 * </p>
 *
 * <p>
 * The host either calls {@link #poll()} from its own loop or sets a poll interval so a tick does it. Each poll
 * hands newly read stdout text to {@code onData}, stderr text to {@code onError}, and once the process has
 * exited and its pipes are drained, fires {@code onExit} exactly once. All callbacks are delivered through the
 * {@link HostDispatcher}; reader threads never call them.
 * </p>
 *
 * <p>
 * Lifecycle: {@link JobState#IDLE} → {@link #start()} → {@link JobState#RUNNING} → exit seen by {@link #poll()}
 * or forced by {@link #terminate()} → {@link JobState#TERMINATED}. A terminated job cannot be restarted.
 * </p>
 *
 * <p>
 * Owners should {@link #close()} a job they no longer need. A job that becomes unreachable with its process
 * still running has that process killed as a last resort. The poll tick holds the job weakly, so an armed
 * tick does not keep an abandoned job reachable; the tick cancels itself once the job is gone.
 * </p>
 *
 * @since 1.0
 */
public final class Job implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(Job.class);

  /** Exit code reported when a terminated process did not report one within the grace period. */
  public static final int EXIT_CODE_UNKNOWN = -1;

  /** Default time {@link #terminate()} waits for the killed process to report its exit code. */
  public static final Duration DEFAULT_TERMINATE_GRACE = Duration.ofMillis(500L);

  private static final Cleaner CLEANER = Cleaner.create();

  private final ProcessSpawner spawner;
  private final HostDispatcher dispatcher;
  private final TickScheduler tickScheduler;
  private final StreamReaderConfig readerConfig;

  private List<String> command;
  private Set<ExecFlag> flags = ExecFlag.defaults();
  private Map<String, String> environment = new LinkedHashMap<>();
  private Duration pollInterval;
  private Duration terminateGrace = DEFAULT_TERMINATE_GRACE;

  private volatile Consumer<String> onData;
  private volatile Consumer<String> onError;
  private volatile ExitListener onExit;

  private JobState state = JobState.IDLE;
  private SpawnedProcess process;
  private long pid;
  private StreamReader stdoutReader;
  private StreamReader stderrReader;
  private Tick tick;
  private Integer pendingExitCode;
  private boolean exitNotified;

  private final ProcessReaper reaper = new ProcessReaper();
  private final Cleaner.Cleanable cleanable;

  /**
   * Creates an idle job.
   *
   * @param command command and arguments to run on {@link #start()}
   * @param spawner process spawner
   * @param dispatcher delivers callbacks onto the host
   * @param tickScheduler drives {@link #poll()} when a poll interval is set
   * @param readerConfig settings for the stdout/stderr readers; the thread name is used as a prefix
   */
  public Job(
      final List<String> command,
      final ProcessSpawner spawner,
      final HostDispatcher dispatcher,
      final TickScheduler tickScheduler,
      final StreamReaderConfig readerConfig) {
    Validate.notNull(command, "command must not be null");
    Validate.notNull(spawner, "spawner must not be null");
    Validate.notNull(dispatcher, "dispatcher must not be null");
    Validate.notNull(tickScheduler, "tickScheduler must not be null");
    Validate.notNull(readerConfig, "readerConfig must not be null");
    this.command = List.copyOf(command);
    this.spawner = spawner;
    this.dispatcher = dispatcher;
    this.tickScheduler = tickScheduler;
    this.readerConfig = readerConfig;
    this.cleanable = CLEANER.register(this, reaper);
  }

  /**
   * Starts the process in the current working directory.
   *
   * @return process id
   * @throws SpawnException if the process cannot be created
   */
  public long start() throws SpawnException {
    return start(null);
  }

  /**
   * Starts the process, both stream readers and, if a poll interval is set, the poll tick.
   *
   * @param workingDirectory working directory for the child; null uses the current one
   * @return process id
   * @throws SpawnException if the process cannot be created; the job stays idle
   * @throws JobStateException if the job is not idle or the command is empty
   */
  public synchronized long start(final Path workingDirectory) throws SpawnException {
    if (state != JobState.IDLE) {
      throw new JobStateException("Cannot start a job that is " + state + ".");
    }
    if (command.isEmpty()) {
      throw new JobStateException("Cannot start a job without a command.");
    }

    final SpawnRequest request = new SpawnRequest(command, workingDirectory, environment, flags);
    final SpawnedProcess spawned = spawner.spawn(request);

    this.process = spawned;
    this.pid = spawned.pid();
    this.reaper.process = spawned;
    this.pendingExitCode = null;
    this.exitNotified = false;

    final StreamReaderConfig streamConfig = spawned.hasBlockingStreams()
        ? readerConfig.withBlockingReads(true)
        : readerConfig;
    this.stdoutReader = new StreamReader(spawned.stdout(),
        streamConfig.withThreadName(readerConfig.threadName() + "-stdout-" + pid));
    this.stderrReader = new StreamReader(spawned.stderr(),
        streamConfig.withThreadName(readerConfig.threadName() + "-stderr-" + pid));
    this.stdoutReader.start();
    this.stderrReader.start();

    this.state = JobState.RUNNING;
    armTick();

    LOGGER.info("Job started: pid={} command={}", pid, command);
    return pid;
  }

  /**
   * Terminates the process with {@link Signal#TERM}, leaving its children alone.
   *
   * @return outcome of the kill request
   */
  public KillResult terminate() {
    return terminate(Signal.TERM, KillScope.PROCESS_ONLY);
  }

  /**
   * Kills the process and finishes the job.
   *
   * <p>
   * Returns {@link KillResult#NOT_RUNNING} without doing anything if no process is running. If the kill request
   * fails (bad signal, access denied, error) the job keeps running so the caller can retry, for example with
   * {@link Signal#KILL}. Otherwise both readers are told to stop, {@code onExit} is fired with the process's exit
   * code and the job becomes {@link JobState#TERMINATED}. Does not wait for the reader threads to finish.
   * </p>
   *
   * <p>
   * A process still alive after the terminate grace period (one that ignores {@link Signal#TERM}, for example)
   * is killed forcibly and given one more grace period to report its exit code.
   * </p>
   *
   * @param signal signal to send
   * @param scope whether children of the process are signalled too
   * @return outcome of the kill request
   */
  public synchronized KillResult terminate(final Signal signal, final KillScope scope) {
    Validate.notNull(signal, "signal must not be null");
    Validate.notNull(scope, "scope must not be null");
    if (!isRunning()) {
      return KillResult.NOT_RUNNING;
    }

    disarmTick();
    final KillResult result = process.kill(signal, scope);
    if (result != KillResult.OK && result != KillResult.NO_PROCESS) {
      LOGGER.warn("Job pid={}: {} request failed: {}", pid, signal, result);
      armTick();
      return result;
    }

    stopReaders();
    finish(awaitExitCode(true));
    return result;
  }

  /**
   * Dispatches new stdout and stderr text to the callbacks and detects process exit.
   *
   * <p>
   * Order within one call is fixed: exit status query, stdout, stderr, exit handling. When the process has
   * exited the readers are stopped; {@code onExit} fires on the poll that finds both readers finished and
   * drained, so output written just before the exit is normally still delivered first. No-op when no process
   * is attached. Never blocks.
   * </p>
   */
  public synchronized void poll() {
    if (process == null) {
      return;
    }

    if (pendingExitCode == null) {
      final OptionalInt exit = process.exitCode();
      if (exit.isPresent()) {
        LOGGER.debug("Job pid={} exited with {}; draining pipes", pid, exit.getAsInt());
        pendingExitCode = exit.getAsInt();
        stopReaders();
      }
    }

    dispatchAvailable(stdoutReader, onData);
    dispatchAvailable(stderrReader, onError);

    if (pendingExitCode != null && isDrained()) {
      finish(pendingExitCode);
    }
  }

  /**
   * Shuts the job down: kills a running process and its children, then marks the job terminated. Idempotent.
   */
  @Override
  public synchronized void close() {
    if (isRunning()) {
      final KillResult result = terminate(Signal.KILL, KillScope.CHILDREN);
      if (isRunning()) {
        LOGGER.warn("Job pid={}: kill on close failed ({}); destroying forcibly", pid, result);
        process.destroyForcibly();
        stopReaders();
        finish(awaitExitCode(false));
      }
    }
    disarmTick();
    state = JobState.TERMINATED;
    cleanable.clean();
  }

  public synchronized boolean isRunning() {
    return state == JobState.RUNNING && process != null;
  }

  public synchronized JobState getState() {
    return state;
  }

  /**
   * Returns the process id of the running process.
   *
   * @return pid, or empty before start and after termination
   */
  public synchronized OptionalLong getPid() {
    return process == null ? OptionalLong.empty() : OptionalLong.of(pid);
  }

  public synchronized List<String> getCommand() {
    return command;
  }

  /**
   * Sets the command to run.
   *
   * @param command command and arguments
   * @throws JobStateException if the process is running
   */
  public synchronized void setCommand(final List<String> command) {
    Validate.notNull(command, "command must not be null");
    requireNotRunning("command");
    this.command = List.copyOf(command);
  }

  public synchronized Set<ExecFlag> getFlags() {
    return Collections.unmodifiableSet(flags);
  }

  /**
   * Sets the execution flags.
   *
   * @param flags flags handed to the spawner
   * @throws JobStateException if the process is running
   */
  public synchronized void setFlags(final Set<ExecFlag> flags) {
    Validate.notNull(flags, "flags must not be null");
    requireNotRunning("flags");
    this.flags = flags.isEmpty() ? EnumSet.noneOf(ExecFlag.class) : EnumSet.copyOf(flags);
  }

  public synchronized Map<String, String> getEnvironment() {
    return Collections.unmodifiableMap(environment);
  }

  /**
   * Sets environment variables added to, or overriding, the parent's environment.
   *
   * @param environment variables
   * @throws JobStateException if the process is running
   */
  public synchronized void setEnvironment(final Map<String, String> environment) {
    Validate.notNull(environment, "environment must not be null");
    requireNotRunning("environment");
    this.environment = new LinkedHashMap<>(environment);
  }

  public synchronized Duration getPollInterval() {
    return pollInterval;
  }

  /**
   * Sets the poll tick interval. Null disables the tick; the host must then call {@link #poll()} itself. On a
   * running job the tick is re-armed at the new interval.
   *
   * @param pollInterval positive interval, or null
   * @throws JobStateException if the interval is zero or negative
   */
  public synchronized void setPollInterval(final Duration pollInterval) {
    if (pollInterval != null && (pollInterval.isZero() || pollInterval.isNegative())) {
      throw new JobStateException("pollInterval must be positive or null, got " + pollInterval + ".");
    }
    this.pollInterval = pollInterval;
    if (isRunning()) {
      disarmTick();
      armTick();
    }
  }

  public synchronized Duration getTerminateGrace() {
    return terminateGrace;
  }

  public synchronized void setTerminateGrace(final Duration terminateGrace) {
    Validate.notNull(terminateGrace, "terminateGrace must not be null");
    Validate.isTrue(!terminateGrace.isNegative(), "terminateGrace must not be negative");
    this.terminateGrace = terminateGrace;
  }

  public Consumer<String> getOnData() {
    return onData;
  }

  /**
   * Sets the callback receiving stdout text. Chunks may be coalesced across several reads.
   *
   * @param onData callback, or null
   */
  public void setOnData(final Consumer<String> onData) {
    this.onData = onData;
  }

  public Consumer<String> getOnError() {
    return onError;
  }

  /**
   * Sets the callback receiving stderr text.
   *
   * @param onError callback, or null
   */
  public void setOnError(final Consumer<String> onError) {
    this.onError = onError;
  }

  public ExitListener getOnExit() {
    return onExit;
  }

  public void setOnExit(final ExitListener onExit) {
    this.onExit = onExit;
  }

  boolean isTickArmed() {
    return tick != null && !tick.isCancelled();
  }

  private void requireNotRunning(final String property) {
    if (isRunning()) {
      throw new JobStateException("Cannot set property '" + property + "' while the process is running.");
    }
  }

  private void armTick() {
    if (pollInterval == null || tick != null) {
      return;
    }
    final PollTickAction action = new PollTickAction(this);
    tick = tickScheduler.schedule(action, pollInterval);
    action.tick = tick;
  }

  private void disarmTick() {
    if (tick != null) {
      tick.cancel();
      tick = null;
    }
  }

  /**
   * Tick handler; identical to an explicit {@link #poll()}.
   */
  private void onTick() {
    poll();
  }

  private void dispatchAvailable(final StreamReader reader, final Consumer<String> callback) {
    if (!reader.hasData()) {
      return;
    }
    final String text = reader.read();
    if (callback != null && !text.isEmpty()) {
      dispatcher.dispatch(() -> callback.accept(text));
    }
  }

  private boolean isDrained() {
    return !stdoutReader.isAlive() && !stderrReader.isAlive()
        && !stdoutReader.hasData() && !stderrReader.hasData();
  }

  private void stopReaders() {
    stdoutReader.stop();
    stderrReader.stop();
  }

  /**
   * Waits up to the terminate grace period for the exit code. With {@code escalate}, a process that is still
   * alive afterwards is destroyed forcibly and waited for once more.
   */
  private int awaitExitCode(final boolean escalate) {
    OptionalInt exit = waitForExitCode();
    if (exit.isEmpty() && escalate && process.isAlive()) {
      LOGGER.warn("Job pid={} still running {} ms after the kill request; destroying forcibly",
          pid, terminateGrace.toMillis());
      process.destroyForcibly();
      exit = waitForExitCode();
    }
    return exit.orElse(EXIT_CODE_UNKNOWN);
  }

  private OptionalInt waitForExitCode() {
    final OptionalInt now = process.exitCode();
    if (now.isPresent()) {
      return now;
    }
    try {
      return process.waitForExit(terminateGrace);
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      return OptionalInt.empty();
    }
  }

  /**
   * Detaches the process and runs the terminate sequence. A process without a known exit code stays with the
   * reaper, so {@link #close()} or abandonment still kills it if it is alive.
   */
  private void finish(final int exitCode) {
    final long endedPid = pid;
    final SpawnedProcess ended = process;
    process = null;
    reaper.process = exitCode == EXIT_CODE_UNKNOWN ? ended : null;
    pendingExitCode = null;
    state = JobState.TERMINATED;
    onTerminate(endedPid, exitCode);
  }

  /**
   * Terminate sequence. Runs for both forced and natural termination and fires {@code onExit} at most once.
   */
  private void onTerminate(final long endedPid, final int exitCode) {
    disarmTick();
    if (exitNotified) {
      return;
    }
    exitNotified = true;
    LOGGER.info("Job exited: pid={} exitCode={}", endedPid, exitCode);

    final ExitListener listener = onExit;
    if (listener != null) {
      dispatcher.dispatch(() -> listener.onExit(endedPid, exitCode));
    }
  }

  /**
   * Tick action that reaches the job through a weak reference and cancels its tick once the job is collected.
   */
  private static final class PollTickAction implements Runnable {

    private final WeakReference<Job> job;
    private volatile Tick tick;

    private PollTickAction(final Job job) {
      this.job = new WeakReference<>(job);
    }

    @Override
    public void run() {
      final Job target = job.get();
      if (target != null) {
        target.onTick();
        return;
      }
      final Tick t = tick;
      if (t != null) {
        LOGGER.debug("Job collected; cancelling its poll tick");
        t.cancel();
      }
    }
  }

  /**
   * Last-resort cleanup for a job dropped without {@link #close()}. Must not reference the job.
   */
  private static final class ProcessReaper implements Runnable {

    private volatile SpawnedProcess process;

    @Override
    public void run() {
      final SpawnedProcess p = process;
      process = null;
      if (p == null) {
        return;
      }
      try {
        if (p.isAlive()) {
          LOGGER.debug("Killing abandoned job process pid={}", p.pid());
          p.destroyForcibly();
        }
      } catch (final RuntimeException e) {
        LOGGER.debug("Killing abandoned job process failed: {}", e.getMessage());
      }
    }
  }
}
