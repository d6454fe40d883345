package examples;

import dev.aahmedlab.workerpool.Async;
import dev.aahmedlab.workerpool.Future;
import dev.aahmedlab.workerpool.WorkerPool;
import dev.aahmedlab.workerpool.lock.LockRegistry;
import dev.aahmedlab.workerpool.lock.Locked;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Example demonstrating basic usage of WorkerPool, Async and Locked.
 * This is not part of the API - just a demonstration.
 */
public class BasicUsageExample {
    public static void main(String[] args) throws InterruptedException {
        WorkerPool pool = new WorkerPool("example", 2, 4, true);
        LockRegistry registry = new LockRegistry();
        StringBuilder log = new StringBuilder();

        // Appends to the shared log one job at a time
        List<Future<Void>> futures = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            final int jobId = i;
            Locked<Void> append = Locked.of(() -> log.append(jobId).append(' '),
                registry.lockFor(log));
            futures.add(new Async<>(append, pool).call());
        }

        for (Future<Void> future : futures) {
            try {
                future.get();
            } catch (ExecutionException e) {
                System.err.println("Job failed: " + e.getCause());
            }
        }
        System.out.println("Log: " + log);
        System.out.println("Workers used: " + pool.getThreads().size());

        pool.shutdown();
        pool.awaitTermination(5, TimeUnit.SECONDS);
    }
}
