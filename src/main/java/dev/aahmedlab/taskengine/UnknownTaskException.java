package dev.aahmedlab.taskengine;

import java.util.NoSuchElementException;

/**
 * Thrown when a result is requested for a task id the engine holds nothing for: it was never
 * submitted, its result was already delivered, or the result expired unclaimed.
 *
 * @since 1.0.0
 */
public class UnknownTaskException extends NoSuchElementException {
  private static final long serialVersionUID = 1L;

  private final String taskId;

  public UnknownTaskException(String taskId) {
    super("Unknown task id: " + taskId);
    this.taskId = taskId;
  }

  public String getTaskId() {
    return taskId;
  }
}
