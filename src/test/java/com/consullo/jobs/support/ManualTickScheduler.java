package com.consullo.jobs.support;

import com.consullo.jobs.host.Tick;
import com.consullo.jobs.host.TickScheduler;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link TickScheduler} for tests: records armed ticks and fires them only when told to.
 */
public final class ManualTickScheduler implements TickScheduler {

  private final List<ManualTick> ticks = new ArrayList<>();

  @Override
  public synchronized Tick schedule(final Runnable action, final Duration interval) {
    final ManualTick tick = new ManualTick(action, interval);
    ticks.add(tick);
    return tick;
  }

  public synchronized List<ManualTick> ticks() {
    return new ArrayList<>(ticks);
  }

  /**
   * Returns the ticks that are still armed.
   *
   * @return armed ticks
   */
  public synchronized List<ManualTick> armed() {
    final List<ManualTick> out = new ArrayList<>();
    for (ManualTick t : ticks) {
      if (!t.isCancelled()) {
        out.add(t);
      }
    }
    return out;
  }

  /**
   * Fires every armed tick once.
   */
  public void fireAll() {
    for (ManualTick t : armed()) {
      t.fire();
    }
  }

  public static final class ManualTick implements Tick {

    private final Runnable action;
    private final Duration interval;
    private volatile boolean cancelled;

    private ManualTick(final Runnable action, final Duration interval) {
      this.action = action;
      this.interval = interval;
    }

    public Duration interval() {
      return interval;
    }

    public void fire() {
      if (!cancelled) {
        action.run();
      }
    }

    @Override
    public void cancel() {
      cancelled = true;
    }

    @Override
    public boolean isCancelled() {
      return cancelled;
    }
  }
}
