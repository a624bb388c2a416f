package dev.aahmedlab.taskengine;

/**
 * Policy for handling task submissions when the work queue is full. None of the policies discards
 * work: a submission is either queued, executed, or fails.
 *
 * @since 1.0.0
 */
public enum RejectionPolicy {
  /**
   * Blocks the submitting thread until space becomes available.
   *
   * @since 1.0.0
   */
  BLOCK,

  /**
   * Throws {@link java.util.concurrent.RejectedExecutionException}.
   *
   * @since 1.0.0
   */
  ABORT,

  /**
   * Runs the task in the submitting thread and publishes its outcome like a worker would.
   *
   * @since 1.0.0
   */
  CALLER_RUNS
}
