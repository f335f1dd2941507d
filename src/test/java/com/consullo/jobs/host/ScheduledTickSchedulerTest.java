package com.consullo.jobs.host;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

/**
 * Tests for the timer-driven tick scheduler.
 *
 * @since 1.0
 */
public class ScheduledTickSchedulerTest {

  @Test
  @DisplayName("Should hand every tick to the host dispatcher instead of running it on the timer thread")
  void schedule_Ticking_RunsActionOnHostThread() throws Exception {
    final QueueHostDispatcher host = new QueueHostDispatcher();
    final List<Thread> ranOn = new CopyOnWriteArrayList<>();

    try (final ScheduledTickScheduler scheduler = new ScheduledTickScheduler(host)) {
      final Tick tick = scheduler.schedule(() -> ranOn.add(Thread.currentThread()), Duration.ofMillis(10L));

      await().atMost(Duration.ofSeconds(5)).until(() -> {
        host.runPending();
        return ranOn.size() >= 3;
      });
      tick.cancel();
    }

    assertThat(ranOn).containsOnly(Thread.currentThread());
  }

  @Test
  @DisplayName("Should not pile up ticks while the host is not draining")
  void schedule_HostBusy_KeepsAtMostOneTickQueued() throws Exception {
    final QueueHostDispatcher host = new QueueHostDispatcher();
    final AtomicInteger runs = new AtomicInteger();

    try (final ScheduledTickScheduler scheduler = new ScheduledTickScheduler(host)) {
      scheduler.schedule(runs::incrementAndGet, Duration.ofMillis(5L));
      Thread.sleep(150L);

      assertThat(host.pendingCount()).isEqualTo(1);
      host.runPending();
      assertThat(runs.get()).isEqualTo(1);
    }
  }

  @Test
  @DisplayName("Should stop ticking once cancelled, even for a tick already queued")
  void cancel_Armed_StopsTicks() throws Exception {
    final QueueHostDispatcher host = new QueueHostDispatcher();
    final AtomicInteger runs = new AtomicInteger();

    try (final ScheduledTickScheduler scheduler = new ScheduledTickScheduler(host)) {
      final Tick tick = scheduler.schedule(runs::incrementAndGet, Duration.ofMillis(5L));
      await().atMost(Duration.ofSeconds(5)).until(() -> host.pendingCount() > 0);

      tick.cancel();
      Thread.sleep(50L);
      host.runPending();

      assertThat(tick.isCancelled()).isTrue();
      assertThat(runs.get()).isZero();
    }
  }

  @Test
  @DisplayName("Should reject a non-positive interval")
  void schedule_ZeroInterval_Throws() {
    try (final ScheduledTickScheduler scheduler = new ScheduledTickScheduler(new DirectHostDispatcher())) {
      assertThatThrownBy(() -> scheduler.schedule(() -> { }, Duration.ZERO))
          .isInstanceOf(IllegalArgumentException.class);
    }
  }
}
