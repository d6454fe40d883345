package dev.aahmedlab.workerpool;

import java.util.concurrent.Callable;

/**
 * A unit of work held by the {@link JobQueue}: the callable to run, the future that receives its
 * outcome and an optional caller-supplied value associated with the submission. A job without a
 * callable is a poison pill that stops the worker which takes it.
 *
 * @param <T> the result type of the callable
 */
final class Job<T> {
  private final Callable<T> callable;
  private final ReturnValue<T> future;
  private final Object associatedValue;

  Job(Callable<T> callable, ReturnValue<T> future, Object associatedValue) {
    this.callable = callable;
    this.future = future;
    this.associatedValue = associatedValue;
  }

  static Job<Void> poisonPill() {
    return new Job<>(null, null, null);
  }

  static <T> Job<T> poisonPill(ReturnValue<T> future) {
    return new Job<>(null, future, null);
  }

  boolean isPoisonPill() {
    return callable == null;
  }

  Callable<T> getCallable() {
    return callable;
  }

  ReturnValue<T> getFuture() {
    return future;
  }

  Object getAssociatedValue() {
    return associatedValue;
  }
}
