package com.consullo.jobs.host;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link TickScheduler} driven by a single daemon timer thread.
 *
 * <p>
 * The timer thread never runs the action itself: each tick hands the action to the {@link HostDispatcher},
 * so a ticked action runs on the host exactly like an explicit call would. While a tick is still waiting in
 * the host's queue further ticks are skipped rather than piled up.
 * </p>
 *
 * @since 1.0
 */
public final class ScheduledTickScheduler implements TickScheduler, AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(ScheduledTickScheduler.class);

  private final HostDispatcher dispatcher;
  private final ScheduledExecutorService timer;

  public ScheduledTickScheduler(final HostDispatcher dispatcher) {
    Validate.notNull(dispatcher, "dispatcher must not be null");
    this.dispatcher = dispatcher;
    this.timer = Executors.newSingleThreadScheduledExecutor(r -> {
      final Thread t = new Thread(r, "JobPollTimer");
      t.setDaemon(true);
      return t;
    });
  }

  @Override
  public Tick schedule(final Runnable action, final Duration interval) {
    Validate.notNull(action, "action must not be null");
    Validate.notNull(interval, "interval must not be null");
    Validate.isTrue(!interval.isZero() && !interval.isNegative(), "interval must be positive");

    final ScheduledTick tick = new ScheduledTick(action);
    final long millis = Math.max(1L, interval.toMillis());
    tick.future = timer.scheduleAtFixedRate(tick::fire, millis, millis, TimeUnit.MILLISECONDS);
    LOGGER.debug("Tick armed every {} ms", millis);
    return tick;
  }

  @Override
  public void close() {
    timer.shutdownNow();
  }

  private final class ScheduledTick implements Tick {

    private final Runnable action;
    private final AtomicBoolean queued = new AtomicBoolean();
    private volatile boolean cancelled;
    private volatile ScheduledFuture<?> future;

    private ScheduledTick(final Runnable action) {
      this.action = action;
    }

    private void fire() {
      if (cancelled || !queued.compareAndSet(false, true)) {
        return;
      }
      try {
        dispatcher.dispatch(() -> {
          queued.set(false);
          if (!cancelled) {
            action.run();
          }
        });
      } catch (final RuntimeException e) {
        // An exception escaping here would silently end the fixed-rate schedule.
        queued.set(false);
        LOGGER.warn("Tick action failed: {}", e.getMessage(), e);
      }
    }

    @Override
    public void cancel() {
      cancelled = true;
      final ScheduledFuture<?> f = future;
      if (f != null) {
        f.cancel(false);
      }
    }

    @Override
    public boolean isCancelled() {
      return cancelled;
    }
  }
}
