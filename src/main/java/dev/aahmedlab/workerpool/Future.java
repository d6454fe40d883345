package dev.aahmedlab.workerpool;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * A single-assignment handle to the result of a job submitted to a {@link WorkerPool}.
 *
 * @param <T> the result type
 * @since 1.0.0
 */
public interface Future<T> {
  T get() throws InterruptedException, ExecutionException;

  T get(long timeout, TimeUnit unit)
      throws InterruptedException, ExecutionException, TimeoutException;

  boolean isResolved();
}
