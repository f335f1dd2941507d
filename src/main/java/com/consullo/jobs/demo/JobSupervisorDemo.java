package com.consullo.jobs.demo;

import com.consullo.jobs.host.QueueHostDispatcher;
import com.consullo.jobs.job.Job;
import com.consullo.jobs.job.JobFactory;
import com.consullo.jobs.process.ExecFlag;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Minimal demo that supervises {@link OutputFixtureApp} from a single-threaded host loop and prints what the
 * job reports.
 *
 * <p>
 * The main thread plays the host: it drains a {@link QueueHostDispatcher} while the job's poll tick and the
 * two pipe readers run in the background.
 *
 * @since 1.0
 */
public final class JobSupervisorDemo {

  private static final Logger LOGGER = LoggerFactory.getLogger(JobSupervisorDemo.class);

  private JobSupervisorDemo() {
  }

  /**
   * Demo entry point.
   *
   * @param args args
   * @throws Exception if demo fails
   */
  public static void main(final String[] args) throws Exception {
    final List<String> cmd = new ArrayList<>();
    cmd.add(Path.of(System.getProperty("java.home"), "bin", "java").toString());
    cmd.add("-cp");
    cmd.add(System.getProperty("java.class.path"));
    cmd.add(OutputFixtureApp.class.getName());
    cmd.add("3");

    final QueueHostDispatcher host = new QueueHostDispatcher();
    final AtomicBoolean exited = new AtomicBoolean();

    try (final JobFactory factory = JobFactory.create(host);
        final Job job = factory.createJob(cmd, ExecFlag.defaults(), null, Duration.ofMillis(50L))) {

      job.setOnData(text -> System.out.print("[out] " + text));
      job.setOnError(text -> System.out.print("[err] " + text));
      job.setOnExit((pid, exitCode) -> {
        System.out.println("=== pid " + pid + " exited with " + exitCode + " ===");
        exited.set(true);
      });

      final long pid = job.start(Path.of(".").toAbsolutePath().normalize());
      LOGGER.info("Started demo job PID={}", pid);

      while (!exited.get()) {
        host.awaitAndRunPending(Duration.ofMillis(200L));
      }
      LOGGER.info("Demo completed");
    }
  }
}
