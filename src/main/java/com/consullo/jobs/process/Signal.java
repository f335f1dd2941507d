package com.consullo.jobs.process;

/**
 * Signals that can be delivered to a supervised process on every supported platform.
 *
 * @since 1.0
 */
public enum Signal {

  /** Polite termination request. */
  TERM(15),

  /** Forced termination; cannot be handled by the child. */
  KILL(9),

  /** Interrupt, as sent by Ctrl-C on a terminal. POSIX only. */
  INT(2);

  private final int number;

  Signal(final int number) {
    this.number = number;
  }

  /**
   * Returns the POSIX signal number.
   *
   * @return signal number
   */
  public int number() {
    return number;
  }
}
