package dev.aahmedlab.workerpool;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An elastic pool of worker threads fed from a shared unbounded FIFO queue.
 *
 * <p>The pool keeps at least {@code minThreads} workers alive. Whenever work is submitted and
 * there are fewer idle workers than queued jobs, it spawns additional workers, never holding more
 * than {@code maxThreads}; surplus jobs wait in the queue. Workers are only retired through poison
 * pills queued by {@link #shutdown()} or by dying from a fatal job error, after which the next
 * submission replaces them.
 *
 * <p>Every submission returns a {@link Future} immediately. Jobs are taken in submission order;
 * completion order across workers is not guaranteed.
 *
 * @since 1.0.0
 */
public final class WorkerPool {
  private static final Logger logger = LoggerFactory.getLogger(WorkerPool.class);

  public static final String DEFAULT_NAME = "Worker Pool";
  public static final int DEFAULT_MIN_THREADS = 2;
  public static final int DEFAULT_MAX_THREADS = 10;

  private final String name;
  private final int minThreads;
  private final int maxThreads;
  private final boolean daemon;
  private final FailurePolicy failurePolicy;

  private final JobQueue queue = new JobQueue();
  private final List<Worker> workers = new ArrayList<>();
  private final ReentrantLock poolLock = new ReentrantLock();
  private final Condition workerExited = poolLock.newCondition();
  private int threadCounter;
  private volatile PoolState poolState;

  /**
   * Creates a worker pool and starts its minimum number of workers.
   *
   * @param name diagnostic label, used as the prefix of worker thread names
   * @param minThreads number of workers kept alive even with an empty queue
   * @param maxThreads upper bound on live workers
   * @param daemon whether worker threads are daemon threads
   * @param failurePolicy how job failures are split between captured and fatal
   * @throws IllegalArgumentException if minThreads is negative, maxThreads is less than 1 or less
   *     than minThreads
   * @since 1.0.0
   */
  public WorkerPool(
      String name, int minThreads, int maxThreads, boolean daemon, FailurePolicy failurePolicy) {
    if (name == null) throw new NullPointerException("name");
    if (failurePolicy == null) throw new NullPointerException("failurePolicy");
    if (minThreads < 0) throw new IllegalArgumentException("minThreads must be >= 0");
    if (maxThreads <= 0) throw new IllegalArgumentException("maxThreads must be > 0");
    if (maxThreads < minThreads) {
      throw new IllegalArgumentException("maxThreads must be >= minThreads");
    }
    this.name = name;
    this.minThreads = minThreads;
    this.maxThreads = maxThreads;
    this.daemon = daemon;
    this.failurePolicy = failurePolicy;
    this.poolState = PoolState.RUNNING;
    checkThreads();
  }

  /**
   * Creates a worker pool with the {@link FailurePolicy#CAPTURE_EXCEPTIONS} policy.
   *
   * @param name diagnostic label
   * @param minThreads number of workers kept alive even with an empty queue
   * @param maxThreads upper bound on live workers
   * @param daemon whether worker threads are daemon threads
   * @since 1.0.0
   */
  public WorkerPool(String name, int minThreads, int maxThreads, boolean daemon) {
    this(name, minThreads, maxThreads, daemon, FailurePolicy.CAPTURE_EXCEPTIONS);
  }

  /**
   * Creates a daemon worker pool with the default name and failure policy.
   *
   * @param minThreads number of workers kept alive even with an empty queue
   * @param maxThreads upper bound on live workers
   * @since 1.0.0
   */
  public WorkerPool(int minThreads, int maxThreads) {
    this(DEFAULT_NAME, minThreads, maxThreads, true);
  }

  /**
   * Creates a daemon pool named {@value #DEFAULT_NAME} with between {@value #DEFAULT_MIN_THREADS}
   * and {@value #DEFAULT_MAX_THREADS} workers.
   *
   * @return a new WorkerPool instance
   * @since 1.0.0
   */
  public static WorkerPool create() {
    return new WorkerPool(DEFAULT_MIN_THREADS, DEFAULT_MAX_THREADS);
  }

  /**
   * Creates a pool that holds exactly {@code poolSize} workers once they are started.
   *
   * @param poolSize the number of worker threads
   * @return a new WorkerPool instance
   * @throws IllegalArgumentException if poolSize is less than or equal to 0
   * @since 1.0.0
   */
  public static WorkerPool createFixed(int poolSize) {
    if (poolSize <= 0) throw new IllegalArgumentException("poolSize must be > 0");
    return new WorkerPool(poolSize, poolSize);
  }

  /**
   * Creates a pool for CPU-bound jobs: one idle worker, growing to the number of processors.
   *
   * @return a new WorkerPool instance optimized for CPU-bound jobs
   * @since 1.0.0
   */
  public static WorkerPool createCpuBound() {
    int processors = Runtime.getRuntime().availableProcessors();
    return new WorkerPool(1, processors);
  }

  /**
   * Creates a pool for I/O-bound jobs: one worker per processor, growing to ten per processor.
   *
   * @return a new WorkerPool instance optimized for I/O-bound jobs
   * @since 1.0.0
   */
  public static WorkerPool createIoBound() {
    int processors = Runtime.getRuntime().availableProcessors();
    return new WorkerPool(processors, processors * 10);
  }

  /**
   * Queues a callable and returns a future for its result without blocking.
   *
   * @param task the job to run
   * @param <T> the result type
   * @return a future resolved by the worker that runs the job
   * @throws NullPointerException if task is null
   * @throws PoolShutDownException if the pool has been shut down
   * @since 1.0.0
   */
  public <T> Future<T> submit(Callable<T> task) {
    return submit(task, null);
  }

  /**
   * Queues a callable together with a value that workers report through {@link
   * Worker#getAssociatedValue()} while they run it.
   *
   * @param task the job to run
   * @param associatedValue caller-defined value describing the job, may be null
   * @param <T> the result type
   * @return a future resolved by the worker that runs the job
   * @throws NullPointerException if task is null
   * @throws PoolShutDownException if the pool has been shut down
   * @since 1.0.0
   */
  public <T> Future<T> submit(Callable<T> task, Object associatedValue) {
    if (task == null) throw new NullPointerException("task");

    ReturnValue<T> future = new ReturnValue<>();
    poolLock.lock();
    try {
      if (poolState != PoolState.RUNNING) {
        throw new PoolShutDownException(name);
      }
      queue.put(new Job<>(task, future, associatedValue));
      checkThreads();
    } finally {
      poolLock.unlock();
    }
    return future;
  }

  /**
   * Queues a runnable. The returned future resolves to null once it has run.
   *
   * @param task the job to run
   * @return a future resolved by the worker that runs the job
   * @throws NullPointerException if task is null
   * @throws PoolShutDownException if the pool has been shut down
   * @since 1.0.0
   */
  public Future<Void> submit(Runnable task) {
    if (task == null) throw new NullPointerException("task");
    return submit(
        () -> {
          task.run();
          return null;
        },
        null);
  }

  /**
   * Brings the worker count in line with the pool's bounds. Dead workers are forgotten, the pool is
   * topped up to {@code minThreads}, and one worker is added for every queued job that no idle
   * worker is available for, up to {@code maxThreads}.
   *
   * <p>Called on construction and on every submission; clients rarely need to call it.
   *
   * @throws PoolShutDownException if the pool has been shut down
   * @since 1.0.0
   */
  @SuppressFBWarnings(
      value = "CWO_CLOSED_WITHOUT_OPENED",
      justification = "Lock is properly acquired before the try block and released in finally")
  public void checkThreads() {
    poolLock.lock();
    try {
      if (poolState != PoolState.RUNNING) {
        throw new PoolShutDownException(name);
      }
      workers.removeIf(w -> !w.isAlive());
      while (workers.size() < minThreads) {
        addWorker();
      }
      while (countIdle() < queue.size() && workers.size() < maxThreads) {
        addWorker();
      }
    } finally {
      poolLock.unlock();
    }
  }

  private int countIdle() {
    int idle = 0;
    for (Worker worker : workers) {
      if (worker.isAlive() && !worker.isBusy()) {
        idle++;
      }
    }
    return idle;
  }

  private void addWorker() {
    Worker worker =
        new Worker(
            name + "-" + threadCounter++, daemon, queue, failurePolicy, this::onWorkerExit);
    workers.add(worker);
    worker.start();
    logger.debug("Pool {} started {} ({} workers)", name, worker.getName(), workers.size());
  }

  private void onWorkerExit(Worker worker) {
    logger.debug("Pool {} lost {}", name, worker.getName());
    poolLock.lock();
    try {
      workerExited.signalAll();
    } finally {
      poolLock.unlock();
    }
  }

  /**
   * Initiates a graceful shutdown of the pool.
   *
   * <p>This method:
   *
   * <ul>
   *   <li>Sets the pool state to SHUTDOWN, so later submissions throw {@link
   *       PoolShutDownException}
   *   <li>Queues one poison pill per live worker behind the jobs already queued
   *   <li>Lets running and queued jobs complete
   * </ul>
   *
   * <p>It does not wait for the workers to exit; use {@link #awaitTermination(long, TimeUnit)}.
   * Calling it again has no effect.
   *
   * @since 1.0.0
   */
  public void shutdown() {
    poolLock.lock();
    try {
      if (poolState != PoolState.RUNNING) {
        return;
      }
      poolState = PoolState.SHUTDOWN;
      workers.removeIf(w -> !w.isAlive());
      for (int i = 0; i < workers.size(); i++) {
        queue.put(Job.poisonPill());
      }
      logger.debug("Pool {} shutting down {} workers", name, workers.size());
    } finally {
      poolLock.unlock();
    }
  }

  /**
   * Blocks until every worker of the pool has exited, or the timeout elapses, or the current
   * thread is interrupted, whichever happens first.
   *
   * @param timeout the maximum time to wait
   * @param unit the time unit of the timeout argument
   * @return true if all workers exited and false if the timeout elapsed first
   * @throws InterruptedException if interrupted while waiting
   * @since 1.0.0
   */
  public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
    poolLock.lock();
    try {
      long remainingNanos = unit.toNanos(timeout);
      while (hasLiveWorkers()) {
        if (remainingNanos <= 0) {
          return false;
        }
        remainingNanos = workerExited.awaitNanos(remainingNanos);
      }
      if (poolState == PoolState.SHUTDOWN) {
        poolState = PoolState.TERMINATED;
      }
      return true;
    } finally {
      poolLock.unlock();
    }
  }

  /**
   * Shuts the pool down, waits for all of its workers to exit and then re-opens it for
   * submissions with a fresh set of {@code minThreads} workers.
   *
   * <p>Jobs queued before the call run to completion first. Poison pills left over by workers that
   * died from fatal errors are discarded so that they cannot stop the new workers.
   *
   * @throws InterruptedException if interrupted while waiting for the workers to exit; the pool
   *     then stays shut down
   * @since 1.0.0
   */
  public void restart() throws InterruptedException {
    shutdown();
    poolLock.lock();
    try {
      while (hasLiveWorkers()) {
        workerExited.await();
      }
      int discarded = queue.removeIf(Job::isPoisonPill);
      workers.clear();
      poolState = PoolState.RUNNING;
      logger.debug("Pool {} restarted, {} stale poison pills discarded", name, discarded);
      checkThreads();
    } finally {
      poolLock.unlock();
    }
  }

  private boolean hasLiveWorkers() {
    for (Worker worker : workers) {
      if (worker.isAlive()) {
        return true;
      }
    }
    return false;
  }

  /**
   * Returns every worker tracked by the pool, whether alive or dead, busy or idle. Dead workers
   * are forgotten on the next submission.
   *
   * @return a snapshot of the tracked workers
   * @since 1.0.0
   */
  public List<Worker> getThreads() {
    poolLock.lock();
    try {
      return new ArrayList<>(workers);
    } finally {
      poolLock.unlock();
    }
  }

  public List<Worker> getBusyThreads() {
    poolLock.lock();
    try {
      List<Worker> busy = new ArrayList<>();
      for (Worker worker : workers) {
        if (worker.isBusy()) {
          busy.add(worker);
        }
      }
      return busy;
    } finally {
      poolLock.unlock();
    }
  }

  public List<Worker> getIdleThreads() {
    poolLock.lock();
    try {
      List<Worker> idle = new ArrayList<>();
      for (Worker worker : workers) {
        if (worker.isAlive() && !worker.isBusy()) {
          idle.add(worker);
        }
      }
      return idle;
    } finally {
      poolLock.unlock();
    }
  }

  public List<Worker> getLiveThreads() {
    poolLock.lock();
    try {
      List<Worker> live = new ArrayList<>();
      for (Worker worker : workers) {
        if (worker.isAlive()) {
          live.add(worker);
        }
      }
      return live;
    } finally {
      poolLock.unlock();
    }
  }

  /**
   * Returns the current number of jobs (and pending poison pills) in the queue.
   *
   * @return the number of queued jobs
   * @since 1.0.0
   */
  public int getQueueSize() {
    return queue.size();
  }

  public String getName() {
    return name;
  }

  public int getMinThreads() {
    return minThreads;
  }

  public int getMaxThreads() {
    return maxThreads;
  }

  public boolean isDaemon() {
    return daemon;
  }

  public FailurePolicy getFailurePolicy() {
    return failurePolicy;
  }

  /**
   * Returns true if this pool is running and accepting new jobs.
   *
   * @return true if this pool is running
   * @since 1.0.0
   */
  public boolean isRunning() {
    return poolState == PoolState.RUNNING;
  }

  /**
   * Returns true if this pool has been shut down.
   *
   * @return true if this pool has been shut down
   * @since 1.0.0
   */
  public boolean isShutdown() {
    return poolState != PoolState.RUNNING;
  }

  /**
   * Returns true if this pool has been shut down and a later {@link #awaitTermination(long,
   * TimeUnit)} observed all of its workers exit.
   *
   * @return true if this pool has terminated
   * @since 1.0.0
   */
  public boolean isTerminated() {
    return poolState == PoolState.TERMINATED;
  }

  PoolState getPoolState() {
    return poolState;
  }

  @Override
  public String toString() {
    return "WorkerPool[" + name + ", " + poolState + ", min=" + minThreads + ", max=" + maxThreads
        + "]";
  }
}
