package dev.aahmedlab.taskengine;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Wait channel for the outcome of one task. Completed once by the thread that ran the task; read
 * by any number of waiting callers.
 */
final class ResultSlot {
  private final ReentrantLock lock = new ReentrantLock();
  private final Condition done = lock.newCondition();
  private final String taskId;

  private Outcome<Object> outcome;
  private long completedAtNanos;
  private int waiters;
  private List<Consumer<Outcome<Object>>> listeners;

  ResultSlot(String taskId) {
    this.taskId = taskId;
  }

  Outcome<Object> await() throws InterruptedException {
    lock.lock();
    try {
      waiters++;
      try {
        while (outcome == null) {
          done.await();
        }
        return outcome;
      } finally {
        waiters--;
      }
    } finally {
      lock.unlock();
    }
  }

  Outcome<Object> await(long timeout, TimeUnit unit)
      throws InterruptedException, TimeoutException {
    lock.lock();
    try {
      waiters++;
      try {
        long remainingNanos = unit.toNanos(timeout);
        while (outcome == null) {
          if (remainingNanos <= 0) {
            throw new TimeoutException(
                "Timed out after " + timeout + " " + unit + " waiting for task " + taskId);
          }
          remainingNanos = done.awaitNanos(remainingNanos);
        }
        return outcome;
      } finally {
        waiters--;
      }
    } finally {
      lock.unlock();
    }
  }

  /**
   * Stores the outcome and wakes every waiter, then runs the completion listeners in the calling
   * thread.
   *
   * @return false if the slot was already complete; the new outcome is ignored
   */
  boolean complete(Outcome<Object> result, long nowNanos) {
    List<Consumer<Outcome<Object>>> toNotify;
    lock.lock();
    try {
      if (outcome != null) {
        return false;
      }
      outcome = result;
      completedAtNanos = nowNanos;
      toNotify = listeners;
      listeners = null;
      done.signalAll();
    } finally {
      lock.unlock();
    }
    if (toNotify != null) {
      for (Consumer<Outcome<Object>> listener : toNotify) {
        listener.accept(result);
      }
    }
    return true;
  }

  /** Registers a listener; runs it immediately if the slot is already complete. */
  void onComplete(Consumer<Outcome<Object>> listener) {
    Outcome<Object> completed;
    lock.lock();
    try {
      completed = outcome;
      if (completed == null) {
        if (listeners == null) {
          listeners = new ArrayList<>(1);
        }
        listeners.add(listener);
        return;
      }
    } finally {
      lock.unlock();
    }
    listener.accept(completed);
  }

  /** A slot expires once it has been complete for {@code ttlNanos} and nobody is waiting on it. */
  boolean isExpired(long nowNanos, long ttlNanos) {
    lock.lock();
    try {
      return outcome != null && waiters == 0 && nowNanos - completedAtNanos >= ttlNanos;
    } finally {
      lock.unlock();
    }
  }
}
