package dev.aahmedlab.taskengine;

import java.util.Objects;

/**
 * The result of one task: a value, the throwable the task raised, or a cancellation because the
 * task was discarded before it ran.
 *
 * <p>Outcomes are immutable and may be read any number of times.
 *
 * @param <T> the value type
 * @since 1.0.0
 */
public final class Outcome<T> {

  /** The kind of an {@link Outcome}. */
  public enum Kind {
    OK,
    ERR,
    CANCELLED
  }

  private static final Outcome<?> CANCELLED = new Outcome<>(Kind.CANCELLED, null, null);

  private final Kind kind;
  private final T value;
  private final Throwable error;

  private Outcome(Kind kind, T value, Throwable error) {
    this.kind = kind;
    this.value = value;
    this.error = error;
  }

  public static <T> Outcome<T> ok(T value) {
    return new Outcome<>(Kind.OK, value, null);
  }

  public static <T> Outcome<T> err(Throwable error) {
    return new Outcome<>(Kind.ERR, null, Objects.requireNonNull(error, "error"));
  }

  @SuppressWarnings("unchecked")
  public static <T> Outcome<T> cancelled() {
    return (Outcome<T>) CANCELLED;
  }

  public Kind getKind() {
    return kind;
  }

  public boolean isOk() {
    return kind == Kind.OK;
  }

  public boolean isErr() {
    return kind == Kind.ERR;
  }

  public boolean isCancelled() {
    return kind == Kind.CANCELLED;
  }

  /**
   * Returns the value of an {@code OK} outcome.
   *
   * @throws IllegalStateException if this outcome is not {@code OK}
   */
  public T getValue() {
    if (kind != Kind.OK) {
      throw new IllegalStateException("Outcome is " + kind + ", not OK");
    }
    return value;
  }

  /**
   * Returns the throwable of an {@code ERR} outcome.
   *
   * @throws IllegalStateException if this outcome is not {@code ERR}
   */
  public Throwable getError() {
    if (kind != Kind.ERR) {
      throw new IllegalStateException("Outcome is " + kind + ", not ERR");
    }
    return error;
  }

  /**
   * Unwraps this outcome for the task {@code taskId}: returns the value, or throws the failure the
   * caller should see.
   *
   * @param taskId the id reported in the exception
   * @return the value of an {@code OK} outcome
   * @throws TaskFailedException if the task threw
   * @throws TaskCancelledException if the task was cancelled before it ran
   */
  public T unwrap(String taskId) throws TaskFailedException {
    return switch (kind) {
      case OK -> value;
      case ERR -> throw new TaskFailedException(taskId, error);
      case CANCELLED -> throw new TaskCancelledException(taskId);
    };
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Outcome)) return false;
    Outcome<?> that = (Outcome<?>) o;
    return kind == that.kind
        && Objects.equals(value, that.value)
        && Objects.equals(error, that.error);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, value, error);
  }

  @Override
  public String toString() {
    return switch (kind) {
      case OK -> "Ok(" + value + ")";
      case ERR -> "Err(" + error + ")";
      case CANCELLED -> "Cancelled";
    };
  }
}
