package dev.aahmedlab.taskengine;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Immutable settings of a {@link TaskEngine}.
 *
 * <p>Defaults:
 *
 * <ul>
 *   <li>{@code workerCount}: the number of available processors
 *   <li>{@code queueCapacity}: 1024
 *   <li>{@code rejectionPolicy}: {@link RejectionPolicy#BLOCK}
 *   <li>{@code resultTtl}: 10 minutes; {@link Duration#ZERO} keeps unclaimed results forever
 *   <li>{@code threadFactory}: daemon threads named {@code task-engine-worker-<n>}
 * </ul>
 *
 * @since 1.0.0
 */
public final class TaskEngineConfig {
  public static final int DEFAULT_QUEUE_CAPACITY = 1024;
  public static final Duration DEFAULT_RESULT_TTL = Duration.ofMinutes(10);
  public static final String DEFAULT_THREAD_NAME_PREFIX = "task-engine-worker-";

  private final int workerCount;
  private final int queueCapacity;
  private final RejectionPolicy rejectionPolicy;
  private final Duration resultTtl;
  private final ThreadFactory threadFactory;

  private TaskEngineConfig(Builder builder) {
    this.workerCount = builder.workerCount;
    this.queueCapacity = builder.queueCapacity;
    this.rejectionPolicy = builder.rejectionPolicy;
    this.resultTtl = builder.resultTtl;
    this.threadFactory =
        builder.threadFactory != null
            ? builder.threadFactory
            : workerThreadFactory(DEFAULT_THREAD_NAME_PREFIX);
  }

  public static TaskEngineConfig defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns a factory for daemon worker threads named {@code prefix + index}.
   *
   * @param prefix the thread name prefix
   * @return the thread factory
   * @since 1.0.0
   */
  public static ThreadFactory workerThreadFactory(String prefix) {
    Objects.requireNonNull(prefix, "prefix");
    AtomicInteger index = new AtomicInteger();
    return runnable -> {
      Thread t = new Thread(runnable, prefix + index.getAndIncrement());
      t.setDaemon(true); // Make daemon to prevent JVM hangs
      return t;
    };
  }

  public int getWorkerCount() {
    return workerCount;
  }

  public int getQueueCapacity() {
    return queueCapacity;
  }

  public RejectionPolicy getRejectionPolicy() {
    return rejectionPolicy;
  }

  public Duration getResultTtl() {
    return resultTtl;
  }

  public ThreadFactory getThreadFactory() {
    return threadFactory;
  }

  public Builder toBuilder() {
    return new Builder()
        .workerCount(workerCount)
        .queueCapacity(queueCapacity)
        .rejectionPolicy(rejectionPolicy)
        .resultTtl(resultTtl)
        .threadFactory(threadFactory);
  }

  @Override
  public String toString() {
    return "TaskEngineConfig{workerCount="
        + workerCount
        + ", queueCapacity="
        + queueCapacity
        + ", rejectionPolicy="
        + rejectionPolicy
        + ", resultTtl="
        + resultTtl
        + "}";
  }

  /** Builder for {@link TaskEngineConfig}. Values are validated in {@link #build()}. */
  public static final class Builder {
    private int workerCount = Runtime.getRuntime().availableProcessors();
    private int queueCapacity = DEFAULT_QUEUE_CAPACITY;
    private RejectionPolicy rejectionPolicy = RejectionPolicy.BLOCK;
    private Duration resultTtl = DEFAULT_RESULT_TTL;
    private ThreadFactory threadFactory;

    private Builder() {}

    public Builder workerCount(int workerCount) {
      this.workerCount = workerCount;
      return this;
    }

    public Builder queueCapacity(int queueCapacity) {
      this.queueCapacity = queueCapacity;
      return this;
    }

    public Builder rejectionPolicy(RejectionPolicy rejectionPolicy) {
      this.rejectionPolicy = rejectionPolicy;
      return this;
    }

    public Builder resultTtl(Duration resultTtl) {
      this.resultTtl = resultTtl;
      return this;
    }

    /** Sets the factory that creates worker threads; {@code null} restores the default. */
    public Builder threadFactory(ThreadFactory threadFactory) {
      this.threadFactory = threadFactory;
      return this;
    }

    /**
     * Builds the configuration.
     *
     * @throws IllegalArgumentException if a value is out of range
     * @throws NullPointerException if the rejection policy or TTL is null
     */
    public TaskEngineConfig build() {
      if (workerCount <= 0) throw new IllegalArgumentException("workerCount must be > 0");
      if (queueCapacity <= 0) throw new IllegalArgumentException("queueCapacity must be > 0");
      Objects.requireNonNull(rejectionPolicy, "rejectionPolicy");
      Objects.requireNonNull(resultTtl, "resultTtl");
      if (resultTtl.isNegative()) throw new IllegalArgumentException("resultTtl must be >= 0");
      return new TaskEngineConfig(this);
    }
  }
}
