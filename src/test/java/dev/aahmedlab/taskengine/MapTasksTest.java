package dev.aahmedlab.taskengine;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class MapTasksTest {

  private TaskEngine engine;

  @AfterEach
  void tearDown() throws InterruptedException {
    if (engine != null) {
      assertTrue(TaskEngineTestSupport.stopAndAwait(engine, 3, TimeUnit.SECONDS));
    }
  }

  @Test
  void resultsFollowInputOrderNotCompletionOrder() throws Exception {
    engine = TaskEngineTestSupport.startBlockingEngine(5, 20);
    List<Integer> items = Arrays.asList(1, 2, 3, 4, 5);
    List<Integer> completionOrder = Collections.synchronizedList(new ArrayList<>());

    // Later items sleep less, so they finish first.
    List<Integer> squares =
        engine.mapTasks(
            (Integer x) -> {
              Thread.sleep(50L * (6 - x));
              completionOrder.add(x);
              return x * x;
            },
            items);

    assertEquals(Arrays.asList(1, 4, 9, 16, 25), squares);
    assertNotEquals(items, completionOrder, "tasks did not complete out of order");
    assertEquals(0, engine.getPendingResultCount());
  }

  @Test
  void emptyInputReturnsEmptyList() throws Exception {
    engine = TaskEngineTestSupport.startBlockingEngine(1, 5);

    List<Integer> results = engine.mapTasks((Integer x) -> x, Collections.emptyList());

    assertTrue(results.isEmpty());
    assertEquals(0, engine.getCompletedTaskCount());
  }

  @Test
  void nullItemsArePassedThrough() throws Exception {
    engine = TaskEngineTestSupport.startBlockingEngine(2, 5);

    List<String> results =
        engine.mapTasks((String s) -> s == null ? "<null>" : s, Arrays.asList("a", null, "c"));

    assertEquals(Arrays.asList("a", "<null>", "c"), results);
  }

  @Test
  void failsFastOnTheFirstFailureToComplete() throws Exception {
    engine = TaskEngineTestSupport.startBlockingEngine(4, 20);
    CountDownLatch slowRelease = new CountDownLatch(1);

    long start = System.nanoTime();
    TaskFailedException thrown =
        assertThrows(
            TaskFailedException.class,
            () ->
                engine.mapTasks(
                    (Integer x) -> {
                      if (x == 3) {
                        throw new IllegalStateException("item " + x);
                      }
                      // Siblings would hold the map open for seconds without fail-fast.
                      slowRelease.await(5, TimeUnit.SECONDS);
                      return x;
                    },
                    Arrays.asList(1, 2, 3, 4)));
    long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
    slowRelease.countDown();

    assertInstanceOf(IllegalStateException.class, thrown.getCause());
    assertEquals("item 3", thrown.getCause().getMessage());
    assertTrue(thrown.getTaskId().endsWith("-2"), thrown.getTaskId());
    assertTrue(elapsedMillis < 2000, "fail-fast waited " + elapsedMillis + " ms");
  }

  @Test
  void discardedResultsOfAFailedMapDoNotLinger() throws Exception {
    engine = TaskEngineTestSupport.startBlockingEngine(2, 20);

    assertThrows(
        TaskFailedException.class,
        () ->
            engine.mapTasks(
                (Integer x) -> {
                  if (x == 0) {
                    throw new IllegalArgumentException("first");
                  }
                  Thread.sleep(100);
                  return x;
                },
                Arrays.asList(0, 1, 2, 3)));

    engine.stop(true);
    assertEquals(0, engine.getPendingResultCount());
  }

  @Test
  void mapOutcomesCollectsEveryOutcome() throws Exception {
    engine = TaskEngineTestSupport.startBlockingEngine(3, 20);

    List<Outcome<Integer>> outcomes =
        engine.mapOutcomes(
            (Integer x) -> {
              if (x % 2 == 0) {
                throw new IllegalArgumentException("even " + x);
              }
              return x * 10;
            },
            Arrays.asList(1, 2, 3, 4, 5));

    assertEquals(5, outcomes.size());
    assertEquals(Outcome.ok(10), outcomes.get(0));
    assertTrue(outcomes.get(1).isErr());
    assertEquals("even 2", outcomes.get(1).getError().getMessage());
    assertEquals(Outcome.ok(30), outcomes.get(2));
    assertTrue(outcomes.get(3).isErr());
    assertEquals(Outcome.ok(50), outcomes.get(4));
    assertEquals(0, engine.getPendingResultCount());
  }

  @Test
  void batchProcessMatchesMapTasks() throws Exception {
    engine = TaskEngineTestSupport.startBlockingEngine(4, 50);
    List<Integer> items = IntStream.range(0, 23).boxed().collect(Collectors.toList());
    MapFunction<Integer, String> fn = x -> "item-" + (x * 3 + 1);

    List<String> mapped = engine.mapTasks(fn, items);
    List<String> batched = engine.batchProcess(fn, items, 5);

    assertEquals(23, batched.size());
    assertEquals(mapped, batched);
  }

  @Test
  void batchProcessBoundsTheNumberOfItemsInFlight() throws Exception {
    engine = TaskEngineTestSupport.startBlockingEngine(4, 50);
    List<Integer> items = IntStream.range(0, 40).boxed().collect(Collectors.toList());
    AtomicInteger maxInFlight = new AtomicInteger();

    List<Integer> results =
        engine.batchProcess(
            (Integer x) -> {
              maxInFlight.accumulateAndGet(engine.getPendingResultCount(), Math::max);
              return x;
            },
            items,
            5);

    assertEquals(items, results);
    assertTrue(maxInFlight.get() <= 5, "in flight: " + maxInFlight.get());
  }

  @Test
  void batchProcessRejectsNonPositiveBatchSize() {
    engine = TaskEngineTestSupport.startBlockingEngine(1, 5);

    assertThrows(
        IllegalArgumentException.class,
        () -> engine.batchProcess((Integer x) -> x, Arrays.asList(1, 2), 0));
  }

  @Test
  void batchProcessStopsAtTheFirstFailingBatch() throws Exception {
    engine = TaskEngineTestSupport.startBlockingEngine(2, 10);
    AtomicInteger executed = new AtomicInteger();

    assertThrows(
        TaskFailedException.class,
        () ->
            engine.batchProcess(
                (Integer x) -> {
                  executed.incrementAndGet();
                  if (x == 1) {
                    throw new IllegalStateException("bad batch");
                  }
                  return x;
                },
                IntStream.range(0, 9).boxed().collect(Collectors.toList()),
                3));

    engine.stop(true);
    assertTrue(executed.get() <= 3, "later batches ran: " + executed.get());
  }

  @Test
  void mapRequiresARunningEngine() throws Exception {
    engine = new TaskEngine(TaskEngineConfig.builder().workerCount(1).build());

    assertThrows(
        InvalidEngineStateException.class,
        () -> engine.mapTasks((Integer x) -> x, Arrays.asList(1, 2)));
    assertThrows(
        InvalidEngineStateException.class,
        () -> engine.batchProcess((Integer x) -> x, Collections.emptyList(), 2));
  }

  @Test
  void callerTaskWithAMapLikeIdIsNeverTouchedByMaps() throws Exception {
    engine = TaskEngineTestSupport.startBlockingEngine(2, 20);
    engine.submit("map-1-0", () -> "mine");
    engine.submit("map-2-0", () -> "also mine");

    assertEquals(Arrays.asList(1, 2), engine.mapTasks((Integer x) -> x, Arrays.asList(1, 2)));
    assertThrows(
        TaskFailedException.class,
        () ->
            engine.mapTasks(
                (Integer x) -> {
                  throw new IllegalStateException("bad item " + x);
                },
                Arrays.asList(1, 2)));

    assertEquals("mine", engine.getResult("map-1-0", 1, TimeUnit.SECONDS));
    assertEquals("also mine", engine.getResult("map-2-0", 1, TimeUnit.SECONDS));
    assertEquals(0, engine.getPendingResultCount());
  }

  @Test
  void mapTasksFailsWithCancellationWhenQueuedItemsAreCancelled() throws Exception {
    engine = TaskEngineTestSupport.startBlockingEngine(1, 10);
    TaskEngineTestSupport.TaskLatches latches = TaskEngineTestSupport.createTaskLatches();
    TaskFunction blocker = TaskEngineTestSupport.createBlockingTask(latches, "done");
    engine.submit("blocker", blocker, TaskArguments.empty());
    assertTrue(latches.started.await(1, TimeUnit.SECONDS));

    AtomicReference<Throwable> mapFailure = new AtomicReference<>();
    Thread mapper =
        new Thread(
            () -> {
              try {
                engine.mapTasks((Integer x) -> x * 2, Arrays.asList(1, 2, 3));
              } catch (Throwable t) {
                mapFailure.set(t);
              }
            });
    mapper.start();
    awaitQueueSize(3);

    List<String> cancelled = stopWhileBlockerRuns(latches);
    mapper.join(2000);

    assertFalse(mapper.isAlive());
    assertEquals(3, cancelled.size());
    assertInstanceOf(TaskCancelledException.class, mapFailure.get());
    assertEquals(3, engine.getCancelledTaskCount());
    // only the blocker's uncollected result remains
    assertEquals(1, engine.getPendingResultCount());
    assertEquals("done", engine.getResult("blocker", 1, TimeUnit.SECONDS));
    assertEquals(0, engine.getPendingResultCount());
  }

  @Test
  void mapOutcomesReportsCancelledItems() throws Exception {
    engine = TaskEngineTestSupport.startBlockingEngine(1, 10);
    TaskEngineTestSupport.TaskLatches latches = TaskEngineTestSupport.createTaskLatches();
    TaskFunction blocker = TaskEngineTestSupport.createBlockingTask(latches, "done");
    engine.submit("blocker", blocker, TaskArguments.empty());
    assertTrue(latches.started.await(1, TimeUnit.SECONDS));

    AtomicReference<List<Outcome<Integer>>> outcomes = new AtomicReference<>();
    Thread mapper =
        new Thread(
            () -> {
              try {
                outcomes.set(engine.mapOutcomes((Integer x) -> x * 2, Arrays.asList(1, 2)));
              } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
              }
            });
    mapper.start();
    awaitQueueSize(2);

    stopWhileBlockerRuns(latches);
    mapper.join(2000);

    assertFalse(mapper.isAlive());
    assertEquals(Arrays.asList(Outcome.cancelled(), Outcome.cancelled()), outcomes.get());
    assertEquals("done", engine.getResult("blocker", 1, TimeUnit.SECONDS));
    assertEquals(0, engine.getPendingResultCount());
  }

  private void awaitQueueSize(int size) throws InterruptedException {
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(2);
    while (engine.getQueueSize() < size) {
      assertTrue(System.nanoTime() < deadline, "map items were not queued in time");
      Thread.sleep(5);
    }
  }

  /**
   * Calls {@code stop(false)} while the blocker still occupies the only worker, so every queued
   * map item is cancelled. The blocker is released shortly after so that stop can return.
   */
  private List<String> stopWhileBlockerRuns(TaskEngineTestSupport.TaskLatches latches)
      throws InterruptedException {
    Thread releaser =
        new Thread(
            () -> {
              try {
                Thread.sleep(200);
              } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
              }
              latches.finish.countDown();
            });
    releaser.start();
    List<String> cancelled = engine.stop(false);
    releaser.join(1000);
    return cancelled;
  }
}
