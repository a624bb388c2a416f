package dev.aahmedlab.taskengine;

/**
 * Per-item function used by {@link TaskEngine#mapTasks} and {@link TaskEngine#batchProcess}.
 *
 * @param <T> the input item type
 * @param <R> the result type
 * @since 1.0.0
 */
@FunctionalInterface
public interface MapFunction<T, R> {
  R apply(T item) throws Exception;
}
