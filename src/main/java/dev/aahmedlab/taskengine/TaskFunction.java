package dev.aahmedlab.taskengine;

/**
 * The body of a task. Receives the arguments it was submitted with and returns a value or throws.
 * Whatever it throws is captured and delivered to the caller as a failed {@link Outcome}.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface TaskFunction {
  Object call(TaskArguments arguments) throws Exception;
}
