package com.consullo.jobs.process;

/**
 * Which processes a kill request reaches.
 *
 * @since 1.0
 */
public enum KillScope {

  /** Only the supervised process. */
  PROCESS_ONLY,

  /**
   * The supervised process and all of its descendants. Effective only when the process was spawned with
   * {@link ExecFlag#MAKE_GROUP_LEADER}; otherwise treated as {@link #PROCESS_ONLY}.
   */
  CHILDREN
}
