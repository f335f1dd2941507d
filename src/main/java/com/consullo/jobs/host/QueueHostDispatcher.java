package com.consullo.jobs.host;

import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link HostDispatcher} backed by a thread-safe FIFO queue that the host drains from its own loop.
 *
 * <p>
 * Typical host loop:
 * <pre>
 *   while (running) {
 *     dispatcher.awaitAndRunPending(Duration.ofMillis(50));
 *   }
 * </pre>
 * Tasks run in submission order on whichever thread drains the queue.
 * </p>
 *
 * @since 1.0
 */
public final class QueueHostDispatcher implements HostDispatcher {

  private static final Logger LOGGER = LoggerFactory.getLogger(QueueHostDispatcher.class);

  private final BlockingQueue<Runnable> tasks = new LinkedBlockingQueue<>();

  @Override
  public void dispatch(final Runnable task) {
    Validate.notNull(task, "task must not be null");
    tasks.add(task);
  }

  /**
   * Runs every pending task on the calling thread, including tasks enqueued by the tasks themselves.
   *
   * @return number of tasks run
   */
  public int runPending() {
    int count = 0;
    Runnable task;
    while ((task = tasks.poll()) != null) {
      runSafely(task);
      count++;
    }
    return count;
  }

  /**
   * Waits up to {@code timeout} for a task to arrive, then runs everything pending.
   *
   * @param timeout maximum time to wait for the first task
   * @return number of tasks run
   * @throws InterruptedException if interrupted while waiting
   */
  public int awaitAndRunPending(final Duration timeout) throws InterruptedException {
    Validate.notNull(timeout, "timeout must not be null");
    final Runnable first = tasks.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    if (first == null) {
      return 0;
    }
    runSafely(first);
    return 1 + runPending();
  }

  /**
   * Returns the number of tasks waiting to run.
   *
   * @return queue size
   */
  public int pendingCount() {
    return tasks.size();
  }

  private static void runSafely(final Runnable task) {
    try {
      task.run();
    } catch (final RuntimeException e) {
      LOGGER.warn("Host task failed: {}", e.getMessage(), e);
    }
  }
}
