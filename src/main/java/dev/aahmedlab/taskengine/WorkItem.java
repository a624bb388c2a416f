package dev.aahmedlab.taskengine;

import java.util.Objects;

/**
 * One unit of submitted work: the task id, its function, the arguments to call it with and the
 * result box its outcome is published to. Immutable, and consumed exactly once.
 */
final class WorkItem {
  private final String id;
  private final TaskFunction function;
  private final TaskArguments arguments;
  private final ResultBox results;

  WorkItem(String id, TaskFunction function, TaskArguments arguments, ResultBox results) {
    this.id = Objects.requireNonNull(id, "id");
    this.function = Objects.requireNonNull(function, "function");
    this.arguments = Objects.requireNonNull(arguments, "arguments");
    this.results = Objects.requireNonNull(results, "results");
  }

  String getId() {
    return id;
  }

  ResultBox getResults() {
    return results;
  }

  /** Calls the function and captures whatever it returns or throws. */
  Outcome<Object> execute() {
    try {
      return Outcome.ok(function.call(arguments));
    } catch (Throwable t) {
      return Outcome.err(t);
    }
  }

  @Override
  public String toString() {
    return "WorkItem{id=" + id + ", arguments=" + arguments + "}";
  }
}
