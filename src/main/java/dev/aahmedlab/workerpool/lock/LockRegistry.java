package dev.aahmedlab.workerpool.lock;

import java.util.IdentityHashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Associates a {@link VLock} with arbitrary objects, so that code can serialize access to an
 * object it does not control. Objects are matched by identity, not by {@code equals}.
 *
 * <p>Locks are created on first use and kept until {@link #deleteLockFor(Object)} removes them;
 * the registry holds strong references to its keys. A lock only excludes threads that go through
 * the same registry.
 *
 * @since 1.0.0
 */
public final class LockRegistry {
  private final ReentrantLock registryLock = new ReentrantLock();
  private final Map<Object, VLock> locks = new IdentityHashMap<>();

  /**
   * Returns the lock registered for the object, registering a new one if there is none.
   *
   * @param target the object to lock
   * @return the object's lock
   * @throws NullPointerException if target is null
   */
  public VLock lockFor(Object target) {
    if (target == null) throw new NullPointerException("target");
    registryLock.lock();
    try {
      return locks.computeIfAbsent(target, k -> new VLock());
    } finally {
      registryLock.unlock();
    }
  }

  /**
   * Acquires the object's lock, blocking until it is available. Every call must be balanced by
   * {@link #unlock(Object)} before other threads can lock the object.
   *
   * @param target the object to lock
   */
  public void lock(Object target) {
    // Acquired outside registryLock so a blocked caller does not stall the registry
    lockFor(target).acquire();
  }

  /**
   * Releases one hold on the object's lock. Does nothing if the object has no lock.
   *
   * @param target the locked object
   * @return true if the lock is now free, false if it is still held or was never registered
   * @throws NotOwnerException if the object's lock is registered but not owned by the caller
   */
  public boolean unlock(Object target) {
    VLock lock;
    registryLock.lock();
    try {
      lock = locks.get(target);
    } finally {
      registryLock.unlock();
    }
    return lock != null && lock.release();
  }

  /**
   * Forgets the object's lock, if any. Threads still holding or waiting on the removed lock keep
   * their references to it; later calls for the object use a new lock.
   *
   * @param target the object whose lock is removed
   * @return true if a lock was removed
   */
  public boolean deleteLockFor(Object target) {
    registryLock.lock();
    try {
      return locks.remove(target) != null;
    } finally {
      registryLock.unlock();
    }
  }

  public int size() {
    registryLock.lock();
    try {
      return locks.size();
    } finally {
      registryLock.unlock();
    }
  }
}
