package com.consullo.jobs.demo;

import java.io.PrintStream;

/**
 * Deterministic child process used for demo verification.
 *
 * <p>This app emits:
 * 1) A few lines on stdout with short gaps
 * 2) A burst of numbered lines, faster than a slow host would poll
 * 3) A warning on stderr
 * 4) Exits with the code given as first argument (default 0)
 *
 * @since 1.0
 */
public final class OutputFixtureApp {

  private OutputFixtureApp() {
  }

  /**
   * Entry point.
   *
   * @param args optional exit code
   * @throws Exception if sleep is interrupted
   */
  public static void main(final String[] args) throws Exception {
    final PrintStream out = System.out;
    final PrintStream err = System.err;
    final int exitCode = args.length > 0 ? Integer.parseInt(args[0]) : 0;

    out.println("fixture: start");
    out.flush();
    Thread.sleep(50L);
    out.println("fixture: line 1");
    out.flush();
    Thread.sleep(50L);

    for (int i = 0; i < 20; i++) {
      out.println("fixture: burst " + i);
      out.flush();
      Thread.sleep(10L);
    }

    err.println("fixture: warning on stderr");
    err.flush();

    out.println("fixture: done");
    out.flush();
    System.exit(exitCode);
  }
}
