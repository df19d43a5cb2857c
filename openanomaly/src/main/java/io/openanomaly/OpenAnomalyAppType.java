package io.openanomaly;

/** The first command line argument selects which roles the process runs. */
public final class OpenAnomalyAppType {
  public static final String SCHEDULER_APP = "scheduler";
  public static final String WORKER_APP = "worker";
  // scheduler and worker in one process
  public static final String STANDALONE_APP = "standalone";
  // one-shot ops command, the remaining arguments are the command
  public static final String OPS_APP = "ops";

  private OpenAnomalyAppType() {}
}
