package dev.aahmedlab.workerpool.lock;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A reentrant mutual-exclusion lock with a visible owner and a visible queue of the threads
 * waiting to acquire it, for diagnosing contention and deadlocks.
 *
 * <p>The owning thread may acquire the lock again without blocking; each acquisition must be
 * balanced by a {@link #release()}. Threads enter the wait queue in the order they start waiting,
 * but the order in which waiters are granted the lock is not guaranteed to follow it.
 *
 * @since 1.0.0
 */
public final class VLock {
  private final ReentrantLock stateLock = new ReentrantLock();
  private final Condition available = stateLock.newCondition();
  private final List<Thread> waiting = new ArrayList<>();

  private Thread owner;
  private int holdCount;

  /**
   * Acquires the lock, blocking until it is available.
   *
   * @return always true
   * @since 1.0.0
   */
  public boolean acquire() {
    return acquire(true);
  }

  /**
   * Acquires the lock. If it is held by another thread, a blocking caller joins the wait queue and
   * waits uninterruptibly; a non-blocking caller returns false at once without joining it.
   *
   * @param blocking whether to wait for the lock
   * @return true if the lock was acquired
   * @since 1.0.0
   */
  @SuppressFBWarnings(
      value = "CWO_CLOSED_WITHOUT_OPENED",
      justification = "Lock is properly acquired before the try block and released in finally")
  public boolean acquire(boolean blocking) {
    Thread current = Thread.currentThread();
    stateLock.lock();
    try {
      if (owner == current) {
        holdCount++;
        return true;
      }
      if (owner != null) {
        if (!blocking) {
          return false;
        }
        waiting.add(current);
        try {
          while (owner != null) {
            available.awaitUninterruptibly();
          }
        } finally {
          waiting.remove(current);
        }
      }
      grant(current);
      return true;
    } finally {
      stateLock.unlock();
    }
  }

  /**
   * Acquires the lock if it becomes available within the given time. The caller is in the wait
   * queue only while it waits.
   *
   * @param timeout the maximum time to wait
   * @param unit the time unit of the timeout argument
   * @return true if the lock was acquired, false if the timeout elapsed
   * @throws InterruptedException if interrupted while waiting
   * @since 1.0.0
   */
  public boolean tryAcquire(long timeout, TimeUnit unit) throws InterruptedException {
    Thread current = Thread.currentThread();
    stateLock.lockInterruptibly();
    try {
      if (owner == current) {
        holdCount++;
        return true;
      }
      if (owner != null) {
        long remainingNanos = unit.toNanos(timeout);
        waiting.add(current);
        try {
          while (owner != null) {
            if (remainingNanos <= 0) {
              return false;
            }
            remainingNanos = available.awaitNanos(remainingNanos);
          }
        } finally {
          waiting.remove(current);
        }
      }
      grant(current);
      return true;
    } finally {
      stateLock.unlock();
    }
  }

  private void grant(Thread thread) {
    owner = thread;
    holdCount = 1;
  }

  /**
   * Releases one hold on the lock. The lock becomes available to other threads only when the
   * owner's last hold is released.
   *
   * @return true if this call freed the lock, false if the owner still holds it
   * @throws NotOwnerException if the calling thread does not own the lock
   * @since 1.0.0
   */
  public boolean release() {
    Thread current = Thread.currentThread();
    stateLock.lock();
    try {
      if (owner != current) {
        throw new NotOwnerException(current, owner);
      }
      holdCount--;
      if (holdCount > 0) {
        return false;
      }
      owner = null;
      // Waiters may include timed ones that already gave up
      available.signalAll();
      return true;
    } finally {
      stateLock.unlock();
    }
  }

  public boolean isLocked() {
    stateLock.lock();
    try {
      return owner != null;
    } finally {
      stateLock.unlock();
    }
  }

  public boolean isHeldByCurrentThread() {
    stateLock.lock();
    try {
      return owner == Thread.currentThread();
    } finally {
      stateLock.unlock();
    }
  }

  /**
   * Returns the thread that holds the lock.
   *
   * @return the owner, or null if the lock is free
   */
  public Thread getOwner() {
    stateLock.lock();
    try {
      return owner;
    } finally {
      stateLock.unlock();
    }
  }

  /**
   * Returns the threads currently blocked acquiring this lock, in the order they started waiting.
   *
   * @return a snapshot of the wait queue
   */
  public List<Thread> getWaiting() {
    stateLock.lock();
    try {
      return new ArrayList<>(waiting);
    } finally {
      stateLock.unlock();
    }
  }

  public int getHoldCount() {
    stateLock.lock();
    try {
      return holdCount;
    } finally {
      stateLock.unlock();
    }
  }

  @Override
  public String toString() {
    stateLock.lock();
    try {
      List<String> names = new ArrayList<>(waiting.size());
      for (Thread thread : waiting) {
        names.add(thread.getName());
      }
      return "VLock[owner="
          + (owner == null ? "none" : owner.getName())
          + ", holds="
          + holdCount
          + ", waiting="
          + names
          + "]";
    } finally {
      stateLock.unlock();
    }
  }
}
