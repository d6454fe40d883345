package dev.aahmedlab.workerpool.lock;

import java.util.concurrent.Callable;

/**
 * Wraps a callable so that every call runs it while holding a {@link VLock}. The lock is released
 * whether the callable returns or throws. Only callers that use the same lock are excluded from
 * each other.
 *
 * @param <T> the result type of the wrapped callable
 * @since 1.0.0
 */
public final class Locked<T> implements Callable<T> {
  private final Callable<T> task;
  private final VLock lock;

  public Locked(Callable<T> task, VLock lock) {
    if (task == null) throw new NullPointerException("task");
    if (lock == null) throw new NullPointerException("lock");
    this.task = task;
    this.lock = lock;
  }

  /**
   * Wraps a runnable; the resulting callable returns null.
   *
   * @param task the runnable to guard
   * @param lock the lock to hold while it runs
   * @return a guarded callable
   */
  public static Locked<Void> of(Runnable task, VLock lock) {
    if (task == null) throw new NullPointerException("task");
    return new Locked<>(
        () -> {
          task.run();
          return null;
        },
        lock);
  }

  @Override
  public T call() throws Exception {
    lock.acquire();
    try {
      return task.call();
    } finally {
      lock.release();
    }
  }

  public VLock getLock() {
    return lock;
  }
}
