package dev.aahmedlab.taskengine;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Collects the outcomes of one map call by input position. In fail-fast mode the wait ends at the
 * first outcome that is not {@code OK}, in whatever order the tasks complete.
 */
final class MapCompletion {
  private final ReentrantLock lock = new ReentrantLock();
  private final Condition changed = lock.newCondition();
  private final Outcome<?>[] outcomes;
  private final boolean failFast;
  private int remaining;
  private int firstFailure = -1;

  MapCompletion(int size, boolean failFast) {
    this.outcomes = new Outcome<?>[size];
    this.failFast = failFast;
    this.remaining = size;
  }

  void record(int index, Outcome<?> outcome) {
    lock.lock();
    try {
      if (outcomes[index] != null) {
        return;
      }
      outcomes[index] = outcome;
      remaining--;
      if (failFast && firstFailure < 0 && !outcome.isOk()) {
        firstFailure = index;
      }
      if (remaining == 0 || firstFailure >= 0) {
        changed.signalAll();
      }
    } finally {
      lock.unlock();
    }
  }

  /**
   * Waits until every outcome is in, or, in fail-fast mode, until one failed.
   *
   * @return the index of the failed item, or -1 if all completed
   */
  int await() throws InterruptedException {
    lock.lock();
    try {
      while (remaining > 0 && firstFailure < 0) {
        changed.await();
      }
      return firstFailure;
    } finally {
      lock.unlock();
    }
  }

  Outcome<?> get(int index) {
    lock.lock();
    try {
      return outcomes[index];
    } finally {
      lock.unlock();
    }
  }

  /** Returns all outcomes in input order. Only meaningful after {@link #await()} returned -1. */
  List<Outcome<?>> all() {
    lock.lock();
    try {
      return Arrays.asList(outcomes.clone());
    } finally {
      lock.unlock();
    }
  }
}
