package dev.aahmedlab.taskengine;

import java.time.Duration;
import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Correlates task ids with their outcomes.
 *
 * <p>A slot is registered when a task is submitted and completed by whichever thread runs the
 * task. The entry is removed once {@link #await} has delivered the outcome; a timed-out await
 * leaves it in place. Completed entries nobody claims are evicted after the configured TTL. A zero
 * TTL keeps them until they are claimed.
 */
final class ResultBox {
  private static final Logger logger = LoggerFactory.getLogger(ResultBox.class);

  private final Map<String, ResultSlot> slots = new ConcurrentHashMap<>();
  private final long ttlNanos;
  private final long sweepIntervalNanos;
  private final LongSupplier nanoClock;
  private final AtomicLong lastSweepNanos;
  private final AtomicLong evictedCount = new AtomicLong();

  ResultBox(Duration resultTtl) {
    this(resultTtl, System::nanoTime);
  }

  ResultBox(Duration resultTtl, LongSupplier nanoClock) {
    if (resultTtl.isNegative()) throw new IllegalArgumentException("resultTtl must be >= 0");
    this.ttlNanos = resultTtl.toNanos();
    this.sweepIntervalNanos = ttlNanos / 2;
    this.nanoClock = nanoClock;
    this.lastSweepNanos = new AtomicLong(nanoClock.getAsLong());
  }

  /**
   * Creates the slot for a newly submitted task.
   *
   * @throws DuplicateTaskIdException if the id already has an entry
   */
  ResultSlot register(String taskId) {
    sweepIfDue();
    ResultSlot slot = new ResultSlot(taskId);
    if (slots.putIfAbsent(taskId, slot) != null) {
      throw new DuplicateTaskIdException(taskId);
    }
    return slot;
  }

  /** Publishes the outcome of a task. Outcomes for discarded or evicted ids are dropped. */
  void publish(String taskId, Outcome<Object> outcome) {
    ResultSlot slot = slots.get(taskId);
    if (slot == null) {
      logger.debug("Dropping outcome of task {}, nobody holds its slot anymore", taskId);
      return;
    }
    if (!slot.complete(outcome, nanoClock.getAsLong())) {
      logger.warn("Ignoring second outcome for task {}", taskId);
    }
  }

  /**
   * Waits for the outcome of {@code taskId} and removes the entry once delivered.
   *
   * @throws UnknownTaskException if there is no entry for the id
   */
  Outcome<Object> await(String taskId) throws InterruptedException {
    ResultSlot slot = lookup(taskId);
    Outcome<Object> outcome = slot.await();
    slots.remove(taskId, slot);
    return outcome;
  }

  /**
   * Waits at most {@code timeout} for the outcome of {@code taskId} and removes the entry once
   * delivered. On timeout the entry is kept.
   *
   * @throws UnknownTaskException if there is no entry for the id
   */
  Outcome<Object> await(String taskId, long timeout, TimeUnit unit)
      throws InterruptedException, TimeoutException {
    ResultSlot slot = lookup(taskId);
    Outcome<Object> outcome = slot.await(timeout, unit);
    slots.remove(taskId, slot);
    return outcome;
  }

  /** Removes the entry for {@code taskId} if it is still {@code slot}. */
  void release(String taskId, ResultSlot slot) {
    slots.remove(taskId, slot);
  }

  /** Forgets {@code taskId}. A later outcome for it is dropped. */
  void discard(String taskId) {
    slots.remove(taskId);
  }

  /**
   * Removes completed entries that have been unclaimed for longer than the TTL.
   *
   * @return the number of evicted entries
   */
  int evictExpired() {
    if (ttlNanos == 0) {
      return 0;
    }
    long now = nanoClock.getAsLong();
    lastSweepNanos.set(now);
    int evicted = 0;
    Iterator<Map.Entry<String, ResultSlot>> it = slots.entrySet().iterator();
    while (it.hasNext()) {
      Map.Entry<String, ResultSlot> entry = it.next();
      ResultSlot slot = entry.getValue();
      if (slot.isExpired(now, ttlNanos) && slots.remove(entry.getKey(), slot)) {
        logger.warn("Evicted unclaimed result of task {}", entry.getKey());
        evicted++;
      }
    }
    evictedCount.addAndGet(evicted);
    return evicted;
  }

  private void sweepIfDue() {
    if (ttlNanos == 0) {
      return;
    }
    long last = lastSweepNanos.get();
    long now = nanoClock.getAsLong();
    if (now - last >= sweepIntervalNanos && lastSweepNanos.compareAndSet(last, now)) {
      evictExpired();
    }
  }

  private ResultSlot lookup(String taskId) {
    ResultSlot slot = slots.get(taskId);
    if (slot == null) {
      throw new UnknownTaskException(taskId);
    }
    return slot;
  }

  boolean contains(String taskId) {
    return slots.containsKey(taskId);
  }

  int size() {
    return slots.size();
  }

  long getEvictedCount() {
    return evictedCount.get();
  }
}
