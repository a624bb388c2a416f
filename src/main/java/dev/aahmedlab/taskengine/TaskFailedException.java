package dev.aahmedlab.taskengine;

import java.util.concurrent.ExecutionException;

/**
 * Thrown when the result of a task is requested and the task body threw. {@link #getCause()} is
 * the original throwable, unwrapped.
 *
 * @since 1.0.0
 */
public class TaskFailedException extends ExecutionException {
  private static final long serialVersionUID = 1L;

  private final String taskId;

  public TaskFailedException(String taskId, Throwable cause) {
    super("Task " + taskId + " failed: " + cause, cause);
    this.taskId = taskId;
  }

  public String getTaskId() {
    return taskId;
  }
}
