package dev.aahmedlab.taskengine;

import java.util.concurrent.CancellationException;

/**
 * Thrown when the result of a task is requested and the task was discarded by {@code
 * stop(false)} before a worker picked it up.
 *
 * @since 1.0.0
 */
public class TaskCancelledException extends CancellationException {
  private static final long serialVersionUID = 1L;

  private final String taskId;

  public TaskCancelledException(String taskId) {
    super("Task " + taskId + " was cancelled before it ran");
    this.taskId = taskId;
  }

  public String getTaskId() {
    return taskId;
  }
}
