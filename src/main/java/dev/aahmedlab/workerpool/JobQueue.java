package dev.aahmedlab.workerpool;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;

/**
 * Internal unbounded FIFO of jobs shared by all workers of a pool. This class is package-private
 * and not part of the public API.
 */
final class JobQueue {
  private final ReentrantLock lock = new ReentrantLock();
  private final Condition notEmpty = lock.newCondition();
  private final Deque<Job<?>> queue = new ArrayDeque<>();

  public void put(Job<?> job) {
    if (job == null) throw new NullPointerException("job");
    lock.lock();
    try {
      queue.addLast(job);
      notEmpty.signal();
    } finally {
      lock.unlock();
    }
  }

  public Job<?> take() throws InterruptedException {
    lock.lock();
    try {
      while (queue.isEmpty()) {
        notEmpty.await();
      }
      return queue.removeFirst();
    } finally {
      lock.unlock();
    }
  }

  public int removeIf(Predicate<? super Job<?>> filter) {
    lock.lock();
    try {
      int before = queue.size();
      queue.removeIf(filter);
      return before - queue.size();
    } finally {
      lock.unlock();
    }
  }

  public int size() {
    lock.lock();
    try {
      return queue.size();
    } finally {
      lock.unlock();
    }
  }

  public boolean isEmpty() {
    lock.lock();
    try {
      return queue.isEmpty();
    } finally {
      lock.unlock();
    }
  }
}
