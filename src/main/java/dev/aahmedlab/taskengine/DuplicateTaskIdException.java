package dev.aahmedlab.taskengine;

/**
 * Thrown by {@code submit} when the id is still in use: the task is pending, or its result has
 * not been claimed yet.
 *
 * @since 1.0.0
 */
public class DuplicateTaskIdException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  private final String taskId;

  public DuplicateTaskIdException(String taskId) {
    super("Task id already in use: " + taskId);
    this.taskId = taskId;
  }

  public String getTaskId() {
    return taskId;
  }
}
