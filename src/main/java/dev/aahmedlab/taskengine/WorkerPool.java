package dev.aahmedlab.taskengine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fixed set of worker threads. Each one takes work items from the shared queue in FIFO order, runs
 * them and publishes the outcome to the item's result box, until the queue is closed and empty.
 */
final class WorkerPool {
  private static final Logger logger = LoggerFactory.getLogger(WorkerPool.class);

  private final WorkQueue<WorkItem> queue;
  private final AtomicLong completedCount = new AtomicLong();
  private final AtomicLong failedCount = new AtomicLong();
  private volatile List<Thread> workerThreads = Collections.emptyList();

  WorkerPool(WorkQueue<WorkItem> queue) {
    this.queue = queue;
  }

  void start(int workerCount, ThreadFactory threadFactory) {
    if (workerCount <= 0) throw new IllegalArgumentException("workerCount must be > 0");
    List<Thread> threads = new ArrayList<>(workerCount);
    for (int i = 0; i < workerCount; i++) {
      Thread t = threadFactory.newThread(new Worker());
      if (t == null) {
        throw new IllegalStateException("threadFactory returned null for worker " + i);
      }
      threads.add(t);
    }
    workerThreads = Collections.unmodifiableList(threads);
    for (Thread t : threads) {
      t.start();
    }
  }

  /**
   * Runs one item in the calling thread and publishes its outcome. A throwing task only produces an
   * error outcome.
   */
  void execute(WorkItem item) {
    Outcome<Object> outcome = item.execute();
    if (outcome.isOk()) {
      completedCount.incrementAndGet();
    } else {
      failedCount.incrementAndGet();
      Throwable error = outcome.getError();
      if (error instanceof Error) {
        logger.error("Task {} threw an error", item.getId(), error);
      } else {
        logger.debug("Task {} failed", item.getId(), error);
      }
    }
    item.getResults().publish(item.getId(), outcome);
  }

  /**
   * Waits for every worker thread to exit, or the timeout to elapse.
   *
   * @return true if all workers exited
   */
  boolean join(long timeout, TimeUnit unit) throws InterruptedException {
    long deadlineNanos = System.nanoTime() + unit.toNanos(timeout);
    for (Thread workerThread : workerThreads) {
      long remainingNanos = deadlineNanos - System.nanoTime();
      if (remainingNanos <= 0) {
        return allExited();
      }

      long millis = remainingNanos / 1_000_000L;
      int nanos = (int) (remainingNanos % 1_000_000L);

      workerThread.join(millis, nanos);
      if (workerThread.isAlive()) {
        return false;
      }
    }
    return true;
  }

  void join() throws InterruptedException {
    for (Thread workerThread : workerThreads) {
      workerThread.join();
    }
  }

  private boolean allExited() {
    for (Thread workerThread : workerThreads) {
      if (workerThread.isAlive()) {
        return false;
      }
    }
    return true;
  }

  int size() {
    return workerThreads.size();
  }

  long getCompletedCount() {
    return completedCount.get();
  }

  long getFailedCount() {
    return failedCount.get();
  }

  private final class Worker implements Runnable {
    @Override
    public void run() {
      logger.debug("Worker {} started", Thread.currentThread().getName());
      while (true) {
        WorkItem item;
        try {
          item = queue.take();
        } catch (InterruptedException e) {
          // The engine never interrupts its workers; keep serving until the queue is closed.
          logger.debug("Worker {} interrupted while waiting", Thread.currentThread().getName());
          continue;
        }
        // null means the queue is closed and empty
        if (item == null) {
          break;
        }

        execute(item);

        // A task must not leave its interrupt status behind for the next one.
        Thread.interrupted();
      }
      logger.debug("Worker {} exiting", Thread.currentThread().getName());
    }
  }
}
