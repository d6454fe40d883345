package dev.aahmedlab.workerpool;

import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A thread owned by a {@link WorkerPool} that repeatedly takes a job from the pool's queue, calls
 * it and stores the outcome in the job's future.
 *
 * <p>A worker stops only when it takes a poison pill, when it is interrupted while waiting for work,
 * or when a job raises a throwable that the pool's {@link FailurePolicy} treats as fatal. A
 * terminated worker is never restarted; the pool spawns new ones as needed.
 *
 * @since 1.0.0
 */
public final class Worker implements Runnable {
  private static final Logger logger = LoggerFactory.getLogger(Worker.class);

  private final JobQueue queue;
  private final FailurePolicy failurePolicy;
  private final Consumer<Worker> exitHook;
  private final Thread thread;

  private volatile WorkerState state = WorkerState.IDLE;
  private volatile Job<?> currentJob;

  Worker(
      String name,
      boolean daemon,
      JobQueue queue,
      FailurePolicy failurePolicy,
      Consumer<Worker> exitHook) {
    this.queue = queue;
    this.failurePolicy = failurePolicy;
    this.exitHook = exitHook;
    this.thread = new Thread(this, name);
    this.thread.setDaemon(daemon);
    this.thread.setUncaughtExceptionHandler(
        (t, e) -> logger.error("Worker {} terminated by fatal error", t.getName(), e));
  }

  void start() {
    thread.start();
  }

  @Override
  public void run() {
    try {
      while (true) {
        currentJob = null;
        state = WorkerState.IDLE;

        Job<?> job;
        try {
          job = queue.take();
        } catch (InterruptedException e) {
          logger.warn("Worker {} interrupted while waiting for work, exiting", getName());
          Thread.currentThread().interrupt();
          return;
        }

        currentJob = job;
        state = WorkerState.RUNNING;

        if (job.isPoisonPill()) {
          if (job.getFuture() != null) {
            job.getFuture().resolve(null);
          }
          logger.debug("Worker {} received poison pill", getName());
          return;
        }

        execute(job);
        // An interrupt raised inside a job must not end the next take()
        Thread.interrupted();
      }
    } finally {
      currentJob = null;
      state = WorkerState.TERMINATED;
      exitHook.accept(this);
    }
  }

  private <T> void execute(Job<T> job) {
    ReturnValue<T> future = job.getFuture();
    T result;
    try {
      result = job.getCallable().call();
    } catch (Throwable t) {
      if (failurePolicy.isCapturable(t)) {
        logger.debug("Job failed in worker {}", getName(), t);
        future.fail(t);
        return;
      }
      if (failurePolicy.resolvesFatal()) {
        future.fail(t);
      }
      if (t instanceof Error) {
        throw (Error) t;
      }
      if (t instanceof RuntimeException) {
        throw (RuntimeException) t;
      }
      throw new FatalWorkerException(getName(), t);
    }
    future.resolve(result);
  }

  public String getName() {
    return thread.getName();
  }

  public Thread getThread() {
    return thread;
  }

  public WorkerState getState() {
    return state;
  }

  public boolean isBusy() {
    return state == WorkerState.RUNNING;
  }

  /**
   * Returns true until the worker has left its run loop.
   *
   * @return true if the worker has not terminated
   */
  public boolean isAlive() {
    return state != WorkerState.TERMINATED;
  }

  /**
   * Returns the value associated with the job this worker is running.
   *
   * @return the associated value, or null if idle or none was given
   */
  public Object getAssociatedValue() {
    Job<?> job = currentJob;
    return job == null ? null : job.getAssociatedValue();
  }

  @Override
  public String toString() {
    return "Worker[" + getName() + ", " + state + "]";
  }
}
