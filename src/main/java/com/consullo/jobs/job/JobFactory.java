package com.consullo.jobs.job;

import com.consullo.jobs.host.HostDispatcher;
import com.consullo.jobs.host.ScheduledTickScheduler;
import com.consullo.jobs.host.TickScheduler;
import com.consullo.jobs.pipe.StreamReaderConfig;
import com.consullo.jobs.process.DefaultProcessSpawner;
import com.consullo.jobs.process.ExecFlag;
import com.consullo.jobs.process.ProcessSpawner;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.commons.lang3.Validate;

/**
 * Creates {@link Job}s that share one spawner, host dispatcher, tick scheduler and reader configuration.
 *
 * <p>
 * This class centralizes the default wiring:
 * <ul>
 * <li>{@link DefaultProcessSpawner} (plain pipes, PTY when a console is requested)</li>
 * <li>a {@link ScheduledTickScheduler} bound to the host dispatcher</li>
 * <li>{@link StreamReaderConfig#defaults(String)} for the pipe readers</li>
 * </ul>
 * </p>
 *
 * @since 1.0
 */
public final class JobFactory implements AutoCloseable {

  private static final String READER_THREAD_PREFIX = "JobStreamReader";

  private final ProcessSpawner spawner;
  private final HostDispatcher dispatcher;
  private final TickScheduler tickScheduler;
  private final StreamReaderConfig readerConfig;
  private final boolean ownsTickScheduler;

  public JobFactory(
      final ProcessSpawner spawner,
      final HostDispatcher dispatcher,
      final TickScheduler tickScheduler,
      final StreamReaderConfig readerConfig) {
    this(spawner, dispatcher, tickScheduler, readerConfig, false);
  }

  private JobFactory(
      final ProcessSpawner spawner,
      final HostDispatcher dispatcher,
      final TickScheduler tickScheduler,
      final StreamReaderConfig readerConfig,
      final boolean ownsTickScheduler) {
    Validate.notNull(spawner, "spawner must not be null");
    Validate.notNull(dispatcher, "dispatcher must not be null");
    Validate.notNull(tickScheduler, "tickScheduler must not be null");
    Validate.notNull(readerConfig, "readerConfig must not be null");
    this.spawner = spawner;
    this.dispatcher = dispatcher;
    this.tickScheduler = tickScheduler;
    this.readerConfig = readerConfig;
    this.ownsTickScheduler = ownsTickScheduler;
  }

  /**
   * Creates a factory with default spawner, tick scheduler and reader settings.
   *
   * @param dispatcher delivers callbacks onto the host
   * @return factory; closing it stops its tick scheduler
   */
  public static JobFactory create(final HostDispatcher dispatcher) {
    Validate.notNull(dispatcher, "dispatcher must not be null");
    return new JobFactory(
        new DefaultProcessSpawner(),
        dispatcher,
        new ScheduledTickScheduler(dispatcher),
        StreamReaderConfig.defaults(READER_THREAD_PREFIX),
        true);
  }

  /**
   * Creates an idle job with default flags and host-driven polling.
   *
   * @param command command and arguments
   * @return idle job
   */
  public Job createJob(final List<String> command) {
    return new Job(command, spawner, dispatcher, tickScheduler, readerConfig);
  }

  /**
   * Creates an idle job.
   *
   * @param command command and arguments
   * @param flags execution flags
   * @param environment environment overrides (may be null)
   * @param pollInterval poll tick interval, or null for host-driven polling
   * @return idle job
   */
  public Job createJob(
      final List<String> command,
      final Set<ExecFlag> flags,
      final Map<String, String> environment,
      final Duration pollInterval) {
    final Job job = createJob(command);
    if (flags != null) {
      job.setFlags(flags);
    }
    if (environment != null) {
      job.setEnvironment(environment);
    }
    job.setPollInterval(pollInterval);
    return job;
  }

  public HostDispatcher dispatcher() {
    return dispatcher;
  }

  @Override
  public void close() {
    if (ownsTickScheduler && tickScheduler instanceof ScheduledTickScheduler) {
      ((ScheduledTickScheduler) tickScheduler).close();
    }
  }
}
