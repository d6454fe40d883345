package dev.aahmedlab.workerpool;

import java.util.concurrent.Callable;

/**
 * Wraps a callable so that calling the wrapper queues it on a {@link WorkerPool} and returns the
 * job's future immediately, while the callable runs on a worker thread.
 *
 * <pre>{@code
 * Async<Report> build = new Async<>(this::buildReport, pool);
 * Future<Report> report = build.call();
 * }</pre>
 *
 * @param <T> the result type of the wrapped callable
 * @since 1.0.0
 */
public final class Async<T> implements Callable<Future<T>> {
  private final Callable<T> task;
  private final WorkerPool pool;

  public Async(Callable<T> task, WorkerPool pool) {
    if (task == null) throw new NullPointerException("task");
    if (pool == null) throw new NullPointerException("pool");
    this.task = task;
    this.pool = pool;
  }

  /**
   * Submits the wrapped callable.
   *
   * @return the future of the submitted job
   * @throws PoolShutDownException if the pool has been shut down
   */
  @Override
  public Future<T> call() {
    return pool.submit(task);
  }
}
