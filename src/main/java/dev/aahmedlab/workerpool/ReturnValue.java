package dev.aahmedlab.workerpool;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Write-once {@link Future} filled in by the worker that executes the job. Readers block until the
 * outcome is stored; afterwards every read returns the cached outcome without blocking.
 *
 * <p>A failed outcome is re-raised on every read as a {@link JobFailureException} whose cause is
 * the original throwable.
 *
 * @param <T> the result type
 * @since 1.0.0
 */
public final class ReturnValue<T> implements Future<T> {
  private final ReentrantLock lock = new ReentrantLock();
  private final Condition resolvedCondition = lock.newCondition();

  private T value;
  private Throwable error;
  private volatile boolean resolved;

  @Override
  public T get() throws InterruptedException, JobFailureException {
    if (!resolved) {
      lock.lock();
      try {
        while (!resolved) {
          resolvedCondition.await();
        }
      } finally {
        lock.unlock();
      }
    }
    return report();
  }

  @Override
  public T get(long timeout, TimeUnit unit)
      throws InterruptedException, JobFailureException, TimeoutException {
    if (!resolved) {
      lock.lock();
      try {
        long remainingNanos = unit.toNanos(timeout);
        while (!resolved) {
          if (remainingNanos <= 0) {
            throw new TimeoutException("Future not resolved within " + timeout + " " + unit);
          }
          remainingNanos = resolvedCondition.awaitNanos(remainingNanos);
        }
      } finally {
        lock.unlock();
      }
    }
    return report();
  }

  @Override
  public boolean isResolved() {
    return resolved;
  }

  /**
   * Returns true if this future was resolved with an error.
   *
   * @return true if resolved and failed
   */
  public boolean isFailed() {
    return resolved && error != null;
  }

  /**
   * Stores a successful result and wakes all waiting readers.
   *
   * @param result the job's result, may be null
   * @throws AlreadyResolvedException if an outcome is already stored
   */
  public void resolve(T result) {
    complete(result, null);
  }

  /**
   * Stores a failure and wakes all waiting readers.
   *
   * @param failure the throwable raised by the job
   * @throws AlreadyResolvedException if an outcome is already stored
   */
  public void fail(Throwable failure) {
    if (failure == null) throw new NullPointerException("failure");
    complete(null, failure);
  }

  private void complete(T result, Throwable failure) {
    lock.lock();
    try {
      if (resolved) {
        throw new AlreadyResolvedException();
      }
      this.value = result;
      this.error = failure;
      // Published last; the unlocked fast path in get() relies on this ordering
      this.resolved = true;
      resolvedCondition.signalAll();
    } finally {
      lock.unlock();
    }
  }

  private T report() throws JobFailureException {
    if (error != null) {
      throw new JobFailureException(error);
    }
    return value;
  }

  @Override
  public String toString() {
    if (!resolved) {
      return "ReturnValue[pending]";
    }
    return error != null ? "ReturnValue[failed: " + error + "]" : "ReturnValue[" + value + "]";
  }
}
