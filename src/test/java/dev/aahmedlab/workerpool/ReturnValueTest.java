package dev.aahmedlab.workerpool;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;

class ReturnValueTest {

  @Test
  void resolvedValueIsReturnedOnEveryRead() throws Exception {
    ReturnValue<String> future = new ReturnValue<>();
    assertFalse(future.isResolved());

    future.resolve("value");

    assertTrue(future.isResolved());
    assertFalse(future.isFailed());
    for (int i = 0; i < 5; i++) {
      assertSame("value", future.get());
    }
  }

  @Test
  void resolvingTwiceIsRejected() {
    ReturnValue<Integer> future = new ReturnValue<>();
    future.resolve(1);

    assertThrows(AlreadyResolvedException.class, () -> future.resolve(2));
    assertThrows(AlreadyResolvedException.class, () -> future.fail(new RuntimeException()));
  }

  @Test
  void failingThenResolvingIsRejected() throws Exception {
    ReturnValue<Integer> future = new ReturnValue<>();
    future.fail(new IOException("boom"));

    assertThrows(AlreadyResolvedException.class, () -> future.resolve(2));
    assertTrue(future.isFailed());
  }

  @Test
  void failureIsRethrownWithOriginalCause() {
    ReturnValue<Integer> future = new ReturnValue<>();
    IOException cause = new IOException("disk gone");
    future.fail(cause);

    for (int i = 0; i < 3; i++) {
      ExecutionException thrown = assertThrows(ExecutionException.class, future::get);
      assertInstanceOf(JobFailureException.class, thrown);
      assertSame(cause, thrown.getCause());
    }
  }

  @Test
  void nullFailureIsRejected() {
    ReturnValue<Integer> future = new ReturnValue<>();
    assertThrows(NullPointerException.class, () -> future.fail(null));
    assertFalse(future.isResolved());
  }

  @Test
  void getBlocksUntilResolved() throws Exception {
    ReturnValue<Integer> future = new ReturnValue<>();
    CountDownLatch reading = new CountDownLatch(1);
    AtomicReference<Integer> seen = new AtomicReference<>();

    Thread reader =
        new Thread(
            () -> {
              reading.countDown();
              try {
                seen.set(future.get());
              } catch (Exception e) {
                fail(e);
              }
            });
    reader.start();

    assertTrue(reading.await(1, TimeUnit.SECONDS));
    Thread.sleep(100);
    assertTrue(reader.isAlive(), "reader should still be blocked");

    future.resolve(7);
    reader.join(1000);

    assertFalse(reader.isAlive());
    assertEquals(7, seen.get());
  }

  @Test
  void allConcurrentReadersObserveTheSameOutcome() throws Exception {
    ReturnValue<Object> future = new ReturnValue<>();
    Object result = new Object();
    int readers = 8;
    CountDownLatch done = new CountDownLatch(readers);
    List<Object> seen = Collections.synchronizedList(new ArrayList<>());

    for (int i = 0; i < readers; i++) {
      new Thread(
              () -> {
                try {
                  seen.add(future.get());
                } catch (Exception e) {
                  seen.add(e);
                } finally {
                  done.countDown();
                }
              })
          .start();
    }

    Thread.sleep(50);
    future.resolve(result);

    assertTrue(done.await(1, TimeUnit.SECONDS));
    assertEquals(readers, seen.size());
    for (Object o : seen) {
      assertSame(result, o);
    }
  }

  @Test
  void timedGetTimesOutWhenUnresolved() {
    ReturnValue<Integer> future = new ReturnValue<>();
    assertThrows(TimeoutException.class, () -> future.get(50, TimeUnit.MILLISECONDS));
  }

  @Test
  void timedGetReturnsResolvedValue() throws Exception {
    ReturnValue<Integer> future = new ReturnValue<>();
    future.resolve(3);
    assertEquals(3, future.get(0, TimeUnit.MILLISECONDS));
  }

  @Test
  void nullIsAValidResult() throws Exception {
    ReturnValue<String> future = new ReturnValue<>();
    future.resolve(null);
    assertTrue(future.isResolved());
    assertNull(future.get());
  }
}
