package dev.aahmedlab.taskengine;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A concurrent task engine: a fixed pool of worker threads executing submitted tasks from one FIFO
 * queue, with results retrieved by task id.
 *
 * <p>Callers submit a {@link TaskFunction} under an id of their choosing, and later collect the
 * outcome with {@link #getResult(String)}. A task that throws never affects its worker or other
 * tasks: the throwable is handed back to the caller as the cause of a {@link TaskFailedException}.
 * The bulk operations {@link #mapTasks} and {@link #batchProcess} return results in input order,
 * whatever order the workers finish in.
 *
 * <p>Lifecycle: an engine is created in {@link EngineState#CREATED}, accepts work only while
 * {@link EngineState#RUNNING}, and ends in {@link EngineState#STOPPED}. Results stay retrievable
 * after the engine stops.
 *
 * <p>Ids must be unique among tasks whose result has not been collected yet; a duplicate is
 * rejected with {@link DuplicateTaskIdException}. Once a result is delivered its id may be reused.
 * The items of bulk operations are tracked apart from submitted tasks, so their ids never clash.
 *
 * <p>The engine never interrupts a running task. {@code stop(false)} only cancels work that has not
 * been picked up by a worker yet.
 *
 * @author Abdullah Ahmed
 * @since 1.0.0
 */
public final class TaskEngine {
  private static final Logger logger = LoggerFactory.getLogger(TaskEngine.class);

  private final TaskEngineConfig config;
  private final WorkQueue<WorkItem> queue;
  private final ResultBox results;
  // map items never share ids with caller-submitted tasks
  private final ResultBox mapResults = new ResultBox(Duration.ZERO);
  private final WorkerPool workers;
  private final ReentrantLock engineLock = new ReentrantLock();
  private final AtomicLong mapSequence = new AtomicLong();
  private final AtomicLong cancelledCount = new AtomicLong();
  private volatile EngineState state = EngineState.CREATED;

  /**
   * Creates an engine with the default configuration. The engine must be started before it accepts
   * work.
   *
   * @since 1.0.0
   */
  public TaskEngine() {
    this(TaskEngineConfig.defaults());
  }

  /**
   * Creates an engine with the given configuration. The engine must be started before it accepts
   * work.
   *
   * @param config the engine configuration
   * @since 1.0.0
   */
  public TaskEngine(TaskEngineConfig config) {
    this.config = Objects.requireNonNull(config, "config");
    this.queue = new WorkQueue<>(config.getQueueCapacity());
    this.results = new ResultBox(config.getResultTtl());
    this.workers = new WorkerPool(queue);
  }

  /**
   * Creates an engine with the default configuration, one worker per available processor. This is
   * the most common configuration.
   *
   * @return a new, not yet started engine
   * @since 1.0.0
   */
  public static TaskEngine create() {
    return new TaskEngine();
  }

  /**
   * Creates an engine for CPU-bound tasks: one worker per available processor and a small queue.
   * When the queue is full the submitting thread runs the task itself.
   *
   * @return a new, not yet started engine
   * @since 1.0.0
   */
  public static TaskEngine createCpuBound() {
    int processors = Runtime.getRuntime().availableProcessors();
    return new TaskEngine(
        TaskEngineConfig.builder()
            .workerCount(processors)
            .queueCapacity(processors * 4)
            .rejectionPolicy(RejectionPolicy.CALLER_RUNS)
            .build());
  }

  /**
   * Creates an engine for I/O-bound tasks: twice as many workers as available processors and a
   * larger queue. Submitters block while the queue is full.
   *
   * @return a new, not yet started engine
   * @since 1.0.0
   */
  public static TaskEngine createIoBound() {
    int processors = Runtime.getRuntime().availableProcessors();
    return new TaskEngine(
        TaskEngineConfig.builder()
            .workerCount(processors * 2)
            .queueCapacity(processors * 64)
            .rejectionPolicy(RejectionPolicy.BLOCK)
            .build());
  }

  /**
   * Starts the configured number of workers.
   *
   * @throws InvalidEngineStateException if the engine is not in {@link EngineState#CREATED}
   * @since 1.0.0
   */
  public void start() {
    start(config.getWorkerCount());
  }

  /**
   * Starts {@code workerCount} workers, overriding the configured count.
   *
   * @param workerCount the number of worker threads
   * @throws IllegalArgumentException if workerCount is less than or equal to 0
   * @throws InvalidEngineStateException if the engine is not in {@link EngineState#CREATED}
   * @since 1.0.0
   */
  public void start(int workerCount) {
    if (workerCount <= 0) throw new IllegalArgumentException("workerCount must be > 0");
    engineLock.lock();
    try {
      if (state != EngineState.CREATED) {
        throw new InvalidEngineStateException("start", state);
      }
      workers.start(workerCount, config.getThreadFactory());
      state = EngineState.RUNNING;
    } finally {
      engineLock.unlock();
    }
    logger.info(
        "Task engine started with {} workers (queue capacity {}, rejection policy {})",
        workerCount,
        config.getQueueCapacity(),
        config.getRejectionPolicy());
  }

  /**
   * Submits a task for execution.
   *
   * @param id the task id, unique among tasks whose result has not been collected
   * @param function the task body
   * @param arguments the arguments the task body is called with
   * @throws NullPointerException if any argument is null
   * @throws InvalidEngineStateException if the engine is not running
   * @throws DuplicateTaskIdException if the id is still in use
   * @throws RejectedExecutionException if the queue is full and the policy is ABORT
   * @throws InterruptedException if interrupted while waiting for queue space (BLOCK policy)
   * @since 1.0.0
   */
  public void submit(String id, TaskFunction function, TaskArguments arguments)
      throws InterruptedException {
    enqueue(new WorkItem(id, function, arguments, results), null);
  }

  /**
   * Submits a task that takes no arguments.
   *
   * @param id the task id, unique among tasks whose result has not been collected
   * @param task the task body
   * @throws NullPointerException if id or task is null
   * @throws InvalidEngineStateException if the engine is not running
   * @throws DuplicateTaskIdException if the id is still in use
   * @throws RejectedExecutionException if the queue is full and the policy is ABORT
   * @throws InterruptedException if interrupted while waiting for queue space (BLOCK policy)
   * @since 1.0.0
   */
  public void submit(String id, Callable<?> task) throws InterruptedException {
    if (task == null) throw new NullPointerException("task");
    submit(id, arguments -> task.call(), TaskArguments.empty());
  }

  /**
   * Waits for the result of a task without a time limit. The result is removed from the engine once
   * delivered.
   *
   * @param id the task id
   * @return the value the task returned
   * @throws TaskFailedException if the task threw; the cause is the original throwable
   * @throws TaskCancelledException if the task was cancelled by {@code stop(false)}
   * @throws UnknownTaskException if the engine holds nothing for this id
   * @throws InterruptedException if interrupted while waiting
   * @since 1.0.0
   */
  public Object getResult(String id) throws InterruptedException, TaskFailedException {
    if (id == null) throw new NullPointerException("id");
    return results.await(id).unwrap(id);
  }

  /**
   * Waits at most {@code timeout} for the result of a task. On timeout the result is kept, so the
   * call can be repeated.
   *
   * @param id the task id
   * @param timeout the maximum time to wait
   * @param unit the time unit of the timeout argument
   * @return the value the task returned
   * @throws TimeoutException if the task did not finish in time
   * @throws TaskFailedException if the task threw; the cause is the original throwable
   * @throws TaskCancelledException if the task was cancelled by {@code stop(false)}
   * @throws UnknownTaskException if the engine holds nothing for this id
   * @throws InterruptedException if interrupted while waiting
   * @since 1.0.0
   */
  public Object getResult(String id, long timeout, TimeUnit unit)
      throws InterruptedException, TaskFailedException, TimeoutException {
    if (id == null) throw new NullPointerException("id");
    if (unit == null) throw new NullPointerException("unit");
    return results.await(id, timeout, unit).unwrap(id);
  }

  /**
   * Same as {@link #getResult(String, long, TimeUnit)}, casting the value to {@code type}.
   *
   * @throws ClassCastException if the value is not a {@code type}
   * @since 1.0.0
   */
  public <T> T getResult(String id, Class<T> type, long timeout, TimeUnit unit)
      throws InterruptedException, TaskFailedException, TimeoutException {
    return type.cast(getResult(id, timeout, unit));
  }

  /**
   * Runs {@code function} on every item concurrently and returns the results in input order.
   *
   * <p>Fails fast: as soon as any item fails, in completion order, the call stops waiting and
   * throws that failure. Items still running finish in the background and their results are
   * discarded.
   *
   * @param function the function applied to each item
   * @param items the inputs
   * @return one result per item, in input order
   * @throws TaskFailedException for the first item that threw
   * @throws TaskCancelledException if an item was cancelled by {@code stop(false)}
   * @throws InvalidEngineStateException if the engine is not running
   * @throws RejectedExecutionException if the queue is full and the policy is ABORT
   * @throws InterruptedException if interrupted while submitting or waiting
   * @since 1.0.0
   */
  public <T, R> List<R> mapTasks(
      MapFunction<? super T, ? extends R> function, List<? extends T> items)
      throws InterruptedException, TaskFailedException {
    MapCompletion completion = runMap(function, items, true);
    List<R> values = new ArrayList<>(items.size());
    for (Outcome<?> outcome : completion.all()) {
      values.add(this.<R>cast(outcome).getValue());
    }
    return values;
  }

  /**
   * Runs {@code function} on every item concurrently and waits for all of them, failed or not.
   *
   * @param function the function applied to each item
   * @param items the inputs
   * @return one outcome per item, in input order
   * @throws InvalidEngineStateException if the engine is not running
   * @throws RejectedExecutionException if the queue is full and the policy is ABORT
   * @throws InterruptedException if interrupted while submitting or waiting
   * @since 1.0.0
   */
  public <T, R> List<Outcome<R>> mapOutcomes(
      MapFunction<? super T, ? extends R> function, List<? extends T> items)
      throws InterruptedException {
    MapCompletion completion;
    try {
      completion = runMap(function, items, false);
    } catch (TaskFailedException e) {
      throw new AssertionError("collect-all map cannot fail fast", e);
    }
    List<Outcome<R>> outcomes = new ArrayList<>(items.size());
    for (Outcome<?> outcome : completion.all()) {
      outcomes.add(this.<R>cast(outcome));
    }
    return outcomes;
  }

  /**
   * Maps the items in consecutive chunks of {@code batchSize}, one chunk at a time, and
   * concatenates the results. This bounds the number of queued items for large inputs; the result
   * is the same as {@link #mapTasks}.
   *
   * @param function the function applied to each item
   * @param items the inputs
   * @param batchSize the maximum number of items in flight
   * @return one result per item, in input order
   * @throws IllegalArgumentException if batchSize is less than or equal to 0
   * @throws TaskFailedException for the first item that threw
   * @throws InvalidEngineStateException if the engine is not running
   * @throws InterruptedException if interrupted while submitting or waiting
   * @since 1.0.0
   */
  public <T, R> List<R> batchProcess(
      MapFunction<? super T, ? extends R> function, List<? extends T> items, int batchSize)
      throws InterruptedException, TaskFailedException {
    if (batchSize <= 0) throw new IllegalArgumentException("batchSize must be > 0");
    if (function == null) throw new NullPointerException("function");
    if (items == null) throw new NullPointerException("items");
    ensureRunning("batchProcess");

    List<R> values = new ArrayList<>(items.size());
    for (int from = 0; from < items.size(); from += batchSize) {
      int to = Math.min(from + batchSize, items.size());
      values.addAll(mapTasks(function, items.subList(from, to)));
    }
    return values;
  }

  /**
   * Stops the engine.
   *
   * <p>With {@code drain} set, queued tasks still run before the workers exit. Without it, tasks
   * no worker has picked up yet are cancelled: each gets a cancelled outcome and its id is
   * returned. Items of a bulk operation are reported under internal ids that {@link
   * #getResult(String)} does not know. Running tasks are never interrupted. Either way this call
   * returns once every worker has exited.
   *
   * <p>Calling {@code stop} again, or on an engine that is already stopping, does nothing and
   * returns an empty list. Stopping an engine that was never started just marks it stopped.
   *
   * @param drain whether queued tasks should still run
   * @return the ids of the cancelled tasks
   * @throws InterruptedException if interrupted while waiting for workers; {@link
   *     #awaitTermination} can finish the wait
   * @since 1.0.0
   */
  public List<String> stop(boolean drain) throws InterruptedException {
    List<WorkItem> discarded;
    engineLock.lock();
    try {
      switch (state) {
        case STOPPING, STOPPED -> {
          return Collections.emptyList();
        }
        case CREATED -> {
          queue.close();
          state = EngineState.STOPPED;
          logger.info("Task engine stopped before it was started");
          return Collections.emptyList();
        }
        case RUNNING -> {
          state = EngineState.STOPPING;
          if (drain) {
            queue.close();
            discarded = Collections.emptyList();
          } else {
            discarded = queue.closeAndDrain();
          }
        }
        default -> throw new AssertionError("Unhandled engine state: " + state);
      }
    } finally {
      engineLock.unlock();
    }

    logger.info(
        "Stopping task engine, {}", drain ? "draining queued tasks" : "cancelling queued tasks");

    List<String> cancelledIds = new ArrayList<>(discarded.size());
    for (WorkItem item : discarded) {
      item.getResults().publish(item.getId(), Outcome.cancelled());
      cancelledIds.add(item.getId());
    }
    if (!cancelledIds.isEmpty()) {
      cancelledCount.addAndGet(cancelledIds.size());
      logger.warn("Cancelled {} queued tasks: {}", cancelledIds.size(), cancelledIds);
    }

    workers.join();
    markStopped();
    return cancelledIds;
  }

  /**
   * Blocks until all workers have exited after a stop request, or the timeout occurs, or the
   * current thread is interrupted, whichever happens first.
   *
   * @param timeout the maximum time to wait
   * @param unit the time unit of the timeout argument
   * @return true if the engine is stopped, false if it is still running or the timeout elapsed
   * @throws InterruptedException if interrupted while waiting
   * @since 1.0.0
   */
  public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
    EngineState current = state;
    if (current == EngineState.STOPPED) {
      return true;
    }
    if (current != EngineState.STOPPING) {
      return false;
    }
    if (!workers.join(timeout, unit)) {
      return false;
    }
    markStopped();
    return true;
  }

  /**
   * Evicts completed results that have stayed unclaimed for longer than the configured TTL.
   * Eviction also runs on its own during submission.
   *
   * @return the number of evicted results
   * @since 1.0.0
   */
  public int evictExpiredResults() {
    return results.evictExpired();
  }

  /**
   * Returns the current lifecycle state of this engine.
   *
   * @return the engine state
   * @since 1.0.0
   */
  public EngineState getState() {
    return state;
  }

  /**
   * Returns true if this engine is running and accepting new tasks.
   *
   * @return true if this engine is running
   * @since 1.0.0
   */
  public boolean isRunning() {
    return state == EngineState.RUNNING;
  }

  /**
   * Returns true once the engine is stopped and all its workers have exited.
   *
   * @return true if this engine is terminated
   * @since 1.0.0
   */
  public boolean isTerminated() {
    return state == EngineState.STOPPED;
  }

  /**
   * Returns the configuration this engine was created with.
   *
   * @return the engine configuration
   * @since 1.0.0
   */
  public TaskEngineConfig getConfig() {
    return config;
  }

  /**
   * Returns the number of worker threads, 0 before {@link #start()}.
   *
   * @return the number of worker threads
   * @since 1.0.0
   */
  public int getWorkerCount() {
    return workers.size();
  }

  /**
   * Returns the number of tasks waiting in the queue.
   *
   * @return the number of queued tasks
   * @since 1.0.0
   */
  public int getQueueSize() {
    return queue.size();
  }

  /**
   * Returns the number of tasks the queue can accept without blocking or rejecting.
   *
   * @return the remaining queue capacity
   * @since 1.0.0
   */
  public int getQueueRemainingCapacity() {
    return queue.remainingCapacity();
  }

  /**
   * Returns the number of task ids the engine holds a pending or uncollected result for, counting
   * the items of bulk operations still in progress.
   *
   * @return the number of pending results
   * @since 1.0.0
   */
  public int getPendingResultCount() {
    return results.size() + mapResults.size();
  }

  /**
   * Returns the number of tasks that ran and returned normally.
   *
   * @return the number of completed tasks
   * @since 1.0.0
   */
  public long getCompletedTaskCount() {
    return workers.getCompletedCount();
  }

  /**
   * Returns the number of tasks that ran and threw.
   *
   * @return the number of failed tasks
   * @since 1.0.0
   */
  public long getFailedTaskCount() {
    return workers.getFailedCount();
  }

  /**
   * Returns the number of queued tasks cancelled by {@code stop(false)}.
   *
   * @return the number of cancelled tasks
   * @since 1.0.0
   */
  public long getCancelledTaskCount() {
    return cancelledCount.get();
  }

  /**
   * Returns the number of unclaimed results evicted after the result TTL.
   *
   * @return the number of evicted results
   * @since 1.0.0
   */
  public long getEvictedResultCount() {
    return results.getEvictedCount();
  }

  private <T, R> MapCompletion runMap(
      MapFunction<? super T, ? extends R> function, List<? extends T> items, boolean failFast)
      throws InterruptedException, TaskFailedException {
    if (function == null) throw new NullPointerException("function");
    if (items == null) throw new NullPointerException("items");
    ensureRunning("map");

    MapCompletion completion = new MapCompletion(items.size(), failFast);
    if (items.isEmpty()) {
      return completion;
    }

    String prefix = "map-" + mapSequence.incrementAndGet() + "-";
    TaskFunction itemFunction = applyToFirstArgument(function);
    List<String> ids = new ArrayList<>(items.size());
    int failedIndex;
    try {
      for (int i = 0; i < items.size(); i++) {
        String id = prefix + i;
        int index = i;
        enqueue(
            new WorkItem(id, itemFunction, TaskArguments.of(items.get(i)), mapResults),
            outcome -> completion.record(index, outcome));
        ids.add(id);
      }
      failedIndex = completion.await();
    } catch (RuntimeException | InterruptedException e) {
      discardAll(ids);
      throw e;
    }

    // Every slot of this map is either complete or no longer wanted.
    discardAll(ids);
    if (failedIndex >= 0) {
      completion.get(failedIndex).unwrap(ids.get(failedIndex));
      throw new AssertionError("unwrap of a failed outcome returned normally");
    }
    return completion;
  }

  private static <T, R> TaskFunction applyToFirstArgument(
      MapFunction<? super T, ? extends R> function) {
    return arguments -> {
      @SuppressWarnings("unchecked")
      T item = (T) arguments.get(0);
      return function.apply(item);
    };
  }

  @SuppressWarnings("unchecked")
  private <R> Outcome<R> cast(Outcome<?> outcome) {
    return (Outcome<R>) outcome;
  }

  private void discardAll(List<String> ids) {
    for (String id : ids) {
      mapResults.discard(id);
    }
  }

  @SuppressFBWarnings(
      value = "CWO_CLOSED_WITHOUT_OPENED",
      justification = "Lock is properly acquired before the try block and released in finally")
  private void enqueue(WorkItem item, Consumer<Outcome<Object>> listener)
      throws InterruptedException {
    String id = item.getId();
    ResultBox box = item.getResults();

    if (config.getRejectionPolicy() == RejectionPolicy.BLOCK) {
      ensureRunning("submit");
      ResultSlot slot = register(item, listener);
      try {
        queue.put(item);
      } catch (IllegalStateException closed) {
        box.release(id, slot);
        throw new InvalidEngineStateException("submit", state);
      } catch (InterruptedException interrupted) {
        box.release(id, slot);
        throw interrupted;
      }
      return;
    }

    boolean shouldRunInCaller = false;

    engineLock.lock();
    try {
      ensureRunning("submit");
      ResultSlot slot = register(item, listener);

      switch (config.getRejectionPolicy()) {
        case ABORT -> {
          if (!queue.tryPut(item)) {
            box.release(id, slot);
            throw new RejectedExecutionException("Work queue is full, rejected task " + id);
          }
        }
        case CALLER_RUNS -> {
          if (!queue.tryPut(item)) {
            shouldRunInCaller = true;
          }
        }
        case BLOCK -> throw new AssertionError("BLOCK policy should be handled before switch");
        default ->
            throw new AssertionError("Unhandled rejection policy: " + config.getRejectionPolicy());
      }
    } finally {
      engineLock.unlock();
    }

    // Run rejected task in caller thread for CALLER_RUNS policy
    if (shouldRunInCaller) {
      workers.execute(item);
    }
  }

  private ResultSlot register(WorkItem item, Consumer<Outcome<Object>> listener) {
    ResultSlot slot = item.getResults().register(item.getId());
    if (listener != null) {
      slot.onComplete(listener);
    }
    return slot;
  }

  private void ensureRunning(String operation) {
    EngineState current = state;
    if (current != EngineState.RUNNING) {
      throw new InvalidEngineStateException(operation, current);
    }
  }

  private void markStopped() {
    engineLock.lock();
    try {
      if (state != EngineState.STOPPING) {
        return;
      }
      state = EngineState.STOPPED;
    } finally {
      engineLock.unlock();
    }
    logger.info(
        "Task engine stopped ({} completed, {} failed, {} cancelled)",
        workers.getCompletedCount(),
        workers.getFailedCount(),
        cancelledCount.get());
  }
}
