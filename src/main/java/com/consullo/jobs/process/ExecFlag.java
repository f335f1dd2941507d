package com.consullo.jobs.process;

import java.util.EnumSet;
import java.util.Set;

/**
 * Execution option flags handed to a {@link ProcessSpawner}.
 *
 * @since 1.0
 */
public enum ExecFlag {

  /** Spawn and return immediately. Default. */
  ASYNC,

  /** Spawn and wait for the child to finish. Honored only by spawners that support it. */
  SYNC,

  /** Attach the child to a pseudo-terminal so it behaves as if run from a visible console. */
  SHOW_CONSOLE,

  /** Run the child detached from any console. */
  HIDE_CONSOLE,

  /** Treat the child as the leader of its own group, so a kill can reach its descendants. */
  MAKE_GROUP_LEADER;

  /**
   * Returns the default flag set.
   *
   * @return mutable set containing {@link #ASYNC}
   */
  public static Set<ExecFlag> defaults() {
    return EnumSet.of(ASYNC);
  }
}
