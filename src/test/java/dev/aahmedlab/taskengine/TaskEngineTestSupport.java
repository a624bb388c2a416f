package dev.aahmedlab.taskengine;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/** Utility class providing common factory methods and test patterns for TaskEngine tests. */
public class TaskEngineTestSupport {

  // Factory methods for started engines

  public static TaskEngine startBlockingEngine(int workers, int capacity) {
    return startEngine(workers, capacity, RejectionPolicy.BLOCK);
  }

  public static TaskEngine startAbortEngine(int workers, int capacity) {
    return startEngine(workers, capacity, RejectionPolicy.ABORT);
  }

  public static TaskEngine startCallerRunsEngine(int workers, int capacity) {
    return startEngine(workers, capacity, RejectionPolicy.CALLER_RUNS);
  }

  public static TaskEngine startEngine(int workers, int capacity, RejectionPolicy policy) {
    TaskEngine engine =
        new TaskEngine(
            TaskEngineConfig.builder()
                .workerCount(workers)
                .queueCapacity(capacity)
                .rejectionPolicy(policy)
                .resultTtl(Duration.ZERO)
                .build());
    engine.start();
    return engine;
  }

  // Common test patterns

  /**
   * Creates a pair of latches for controlling task execution. The started latch is counted down
   * when the task begins. The finish latch blocks the task until counted down.
   */
  public static TaskLatches createTaskLatches() {
    return new TaskLatches(new CountDownLatch(1), new CountDownLatch(1));
  }

  /**
   * Creates a task that counts down startedLatch when it begins, waits on finishLatch and then
   * returns {@code result}.
   */
  public static TaskFunction createBlockingTask(TaskLatches latches, Object result) {
    return arguments -> {
      latches.started.countDown();
      latches.finish.await();
      return result;
    };
  }

  /** Creates a task that sleeps for {@code millis} and returns {@code result}. */
  public static TaskFunction sleepingTask(long millis, Object result) {
    return arguments -> {
      Thread.sleep(millis);
      return result;
    };
  }

  /**
   * Stops the engine without draining from a helper thread, so a test that left a task blocked
   * cannot hang the teardown. Returns true if the engine stopped within the timeout.
   */
  public static boolean stopAndAwait(TaskEngine engine, long timeout, TimeUnit unit)
      throws InterruptedException {
    Thread stopper =
        new Thread(
            () -> {
              try {
                engine.stop(false);
              } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
              }
            },
            "engine-stopper");
    stopper.setDaemon(true);
    stopper.start();
    stopper.join(unit.toMillis(timeout));
    return !stopper.isAlive();
  }

  /** Helper class for managing task execution latches. */
  public static class TaskLatches {
    public final CountDownLatch started;
    public final CountDownLatch finish;

    public TaskLatches(CountDownLatch started, CountDownLatch finish) {
      this.started = started;
      this.finish = finish;
    }
  }
}
