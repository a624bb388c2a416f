package examples;

import dev.aahmedlab.taskengine.TaskArguments;
import dev.aahmedlab.taskengine.TaskEngine;
import dev.aahmedlab.taskengine.TaskFailedException;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Example demonstrating basic usage of TaskEngine.
 * This is not part of the API - just a demonstration.
 */
public class BasicUsageExample {
    public static void main(String[] args) throws InterruptedException {
        // Create an engine sized for CPU-bound work and start its workers
        TaskEngine engine = TaskEngine.createCpuBound();
        engine.start();

        try {
            // Submit tasks by id and collect their results
            for (int i = 0; i < 10; i++) {
                engine.submit("square-" + i, arguments -> {
                    int n = arguments.get(0, Integer.class);
                    return n * n;
                }, TaskArguments.of(i));
            }
            for (int i = 0; i < 10; i++) {
                System.out.println("square-" + i + " = "
                    + engine.getResult("square-" + i, 5, TimeUnit.SECONDS));
            }

            // Apply one function to many inputs, results in input order
            List<String> words = Arrays.asList("alpha", "beta", "gamma");
            List<Integer> lengths = engine.mapTasks(String::length, words);
            System.out.println("lengths = " + lengths);

            // Same, with at most two tasks in flight at a time
            List<String> upper = engine.batchProcess(String::toUpperCase, words, 2);
            System.out.println("upper = " + upper);
        } catch (TaskFailedException e) {
            System.err.println("Task " + e.getTaskId() + " failed: " + e.getCause());
        } catch (java.util.concurrent.TimeoutException e) {
            System.err.println(e.getMessage());
        } finally {
            // Let queued tasks finish, then stop the workers
            engine.stop(true);
        }
    }
}
