package dev.aahmedlab.taskengine;

/**
 * Thrown when a {@link TaskEngine} operation is called in a lifecycle state that does not allow
 * it, for example {@code submit} before {@code start} or after {@code stop}.
 *
 * @since 1.0.0
 */
public class InvalidEngineStateException extends IllegalStateException {
  private static final long serialVersionUID = 1L;

  private final EngineState state;

  public InvalidEngineStateException(String operation, EngineState state) {
    super("Cannot " + operation + " while engine is " + state);
    this.state = state;
  }

  /** The engine state observed when the call was rejected. */
  public EngineState getState() {
    return state;
  }
}
