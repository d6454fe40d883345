package dev.aahmedlab.workerpool.lock;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class VLockTest {

  private final VLock lock = new VLock();
  private Thread contender;

  @AfterEach
  void tearDown() throws InterruptedException {
    if (contender != null) {
      contender.join(2000);
    }
  }

  private static boolean eventually(BooleanSupplier condition) throws InterruptedException {
    for (int i = 0; i < 100; i++) {
      if (condition.getAsBoolean()) {
        return true;
      }
      Thread.sleep(10);
    }
    return condition.getAsBoolean();
  }

  @Test
  void freshLockIsFree() {
    assertFalse(lock.isLocked());
    assertNull(lock.getOwner());
    assertTrue(lock.getWaiting().isEmpty());
    assertEquals(0, lock.getHoldCount());
  }

  @Test
  void acquireRecordsOwner() {
    assertTrue(lock.acquire());

    assertTrue(lock.isLocked());
    assertSame(Thread.currentThread(), lock.getOwner());
    assertTrue(lock.isHeldByCurrentThread());
    assertEquals(1, lock.getHoldCount());

    assertTrue(lock.release());
    assertFalse(lock.isLocked());
    assertNull(lock.getOwner());
  }

  @Test
  void reentrantAcquireNeedsMatchingReleases() {
    lock.acquire();
    assertTrue(lock.acquire());
    assertTrue(lock.acquire(false));
    assertEquals(3, lock.getHoldCount());

    assertFalse(lock.release());
    assertFalse(lock.release());
    assertTrue(lock.isLocked());
    assertTrue(lock.release());
    assertFalse(lock.isLocked());
  }

  @Test
  void releaseByNonOwnerIsRejected() throws Exception {
    assertThrows(NotOwnerException.class, lock::release);

    lock.acquire();
    AtomicReference<Throwable> failure = new AtomicReference<>();
    contender =
        new Thread(
            () -> {
              try {
                lock.release();
              } catch (Throwable t) {
                failure.set(t);
              }
            });
    contender.start();
    contender.join(1000);

    assertInstanceOf(NotOwnerException.class, failure.get());
    assertInstanceOf(IllegalMonitorStateException.class, failure.get());
    assertSame(Thread.currentThread(), lock.getOwner());
    assertEquals(1, lock.getHoldCount());
    lock.release();
  }

  @Test
  void nonBlockingAcquireFailsWithoutQueueing() throws Exception {
    lock.acquire();
    AtomicBoolean acquired = new AtomicBoolean(true);
    contender = new Thread(() -> acquired.set(lock.acquire(false)));
    contender.start();
    contender.join(1000);

    assertFalse(acquired.get());
    assertTrue(lock.getWaiting().isEmpty());
    lock.release();
  }

  @Test
  void blockedThreadIsVisibleUntilItAcquires() throws Exception {
    lock.acquire();
    CountDownLatch acquired = new CountDownLatch(1);
    CountDownLatch releaseIt = new CountDownLatch(1);

    contender =
        new Thread(
            () -> {
              lock.acquire();
              acquired.countDown();
              try {
                releaseIt.await();
              } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
              } finally {
                lock.release();
              }
            },
            "contender");
    contender.start();

    assertTrue(eventually(() -> lock.getWaiting().contains(contender)));
    assertEquals(List.of(contender), lock.getWaiting());
    assertTrue(lock.toString().contains("contender"));
    assertSame(Thread.currentThread(), lock.getOwner());

    lock.release();

    assertTrue(acquired.await(1, TimeUnit.SECONDS));
    assertFalse(lock.getWaiting().contains(contender));
    assertSame(contender, lock.getOwner());

    releaseIt.countDown();
    contender.join(1000);
    assertFalse(lock.isLocked());
  }

  @Test
  void waitQueueReflectsAttemptOrder() throws Exception {
    lock.acquire();
    Thread first = new Thread(() -> { lock.acquire(); lock.release(); }, "first");
    Thread second = new Thread(() -> { lock.acquire(); lock.release(); }, "second");

    first.start();
    assertTrue(eventually(() -> lock.getWaiting().size() == 1));
    second.start();
    assertTrue(eventually(() -> lock.getWaiting().size() == 2));

    assertEquals(List.of(first, second), lock.getWaiting());

    lock.release();
    first.join(1000);
    second.join(1000);
    assertTrue(lock.getWaiting().isEmpty());
    assertFalse(lock.isLocked());
  }

  @Test
  void tryAcquireTimesOutAndLeavesQueue() throws Exception {
    lock.acquire();
    AtomicBoolean acquired = new AtomicBoolean(true);
    contender =
        new Thread(
            () -> {
              try {
                acquired.set(lock.tryAcquire(50, TimeUnit.MILLISECONDS));
              } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
              }
            });
    contender.start();
    contender.join(1000);

    assertFalse(acquired.get());
    assertTrue(lock.getWaiting().isEmpty());
    assertSame(Thread.currentThread(), lock.getOwner());
    lock.release();
  }

  @Test
  void tryAcquireSucceedsOnFreeOrOwnedLock() throws Exception {
    assertTrue(lock.tryAcquire(0, TimeUnit.MILLISECONDS));
    assertTrue(lock.tryAcquire(0, TimeUnit.MILLISECONDS));
    assertEquals(2, lock.getHoldCount());
    lock.release();
    lock.release();
  }

  @Test
  void interruptedTryAcquireLeavesQueue() throws Exception {
    lock.acquire();
    AtomicBoolean interrupted = new AtomicBoolean();
    contender =
        new Thread(
            () -> {
              try {
                lock.tryAcquire(10, TimeUnit.SECONDS);
              } catch (InterruptedException e) {
                interrupted.set(true);
              }
            });
    contender.start();
    assertTrue(eventually(() -> lock.getWaiting().contains(contender)));

    contender.interrupt();
    contender.join(1000);

    assertTrue(interrupted.get());
    assertTrue(lock.getWaiting().isEmpty());
    lock.release();
  }
}
