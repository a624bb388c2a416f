package dev.aahmedlab.taskengine;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded FIFO queue shared by the workers. Closing it wakes every waiting thread: consumers then
 * drain what is left and receive {@code null} once it is empty, producers fail.
 *
 * @param <T> the type of elements held in this queue
 */
final class WorkQueue<T> {
  private static final int INITIAL_CAPACITY = 64;

  private final ReentrantLock lock = new ReentrantLock();
  private final Condition notEmpty = lock.newCondition();
  private final Condition notFull = lock.newCondition();
  private final int capacity;
  private final Deque<T> queue;
  private boolean closed;

  WorkQueue(int capacity) {
    if (capacity <= 0) throw new IllegalArgumentException("capacity must be > 0");
    this.capacity = capacity;
    this.queue = new ArrayDeque<>(Math.min(capacity, INITIAL_CAPACITY));
  }

  void close() {
    lock.lock();
    try {
      closed = true;
      notEmpty.signalAll();
      notFull.signalAll();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Closes the queue and removes everything still in it, in one step. No consumer can take an
   * element between the two.
   */
  List<T> closeAndDrain() {
    lock.lock();
    try {
      closed = true;
      List<T> drained = new ArrayList<>(queue);
      queue.clear();
      notEmpty.signalAll();
      notFull.signalAll();
      return drained;
    } finally {
      lock.unlock();
    }
  }

  /** Returns the head of the queue, or {@code null} once the queue is closed and empty. */
  T take() throws InterruptedException {
    lock.lock();
    try {
      while (queue.isEmpty()) {
        if (closed) {
          return null;
        }
        notEmpty.await();
      }
      T item = queue.removeFirst();
      notFull.signal();
      return item;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Appends without waiting.
   *
   * @return false if the queue is full
   * @throws IllegalStateException if the queue is closed
   */
  @SuppressFBWarnings(
      value = "CWO_CLOSED_WITHOUT_OPENED",
      justification = "Lock is properly acquired before the try block and released in finally")
  boolean tryPut(T item) {
    if (item == null) throw new NullPointerException("item");
    lock.lock();
    try {
      if (closed) throw new IllegalStateException("queue is closed");
      if (queue.size() == capacity) return false;
      queue.addLast(item);
      notEmpty.signal();
      return true;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Appends, waiting for space if the queue is full.
   *
   * @throws IllegalStateException if the queue is closed, or gets closed while waiting
   */
  void put(T item) throws InterruptedException {
    if (item == null) throw new NullPointerException("item");
    lock.lock();
    try {
      while (queue.size() == capacity) {
        if (closed) {
          throw new IllegalStateException("queue is closed");
        }
        notFull.await();
      }
      if (closed) {
        throw new IllegalStateException("queue is closed");
      }
      queue.addLast(item);
      notEmpty.signal();
    } finally {
      lock.unlock();
    }
  }

  int size() {
    lock.lock();
    try {
      return queue.size();
    } finally {
      lock.unlock();
    }
  }

  int remainingCapacity() {
    lock.lock();
    try {
      return capacity - queue.size();
    } finally {
      lock.unlock();
    }
  }

  boolean isClosed() {
    lock.lock();
    try {
      return closed;
    } finally {
      lock.unlock();
    }
  }
}
