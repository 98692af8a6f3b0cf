package ca.gc.cra.display.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.display.domain.Toggle;
import ca.gc.cra.display.domain.UninitializedStateException;
import ca.gc.cra.display.testutil.RecordingDestination;
import ca.gc.cra.display.testutil.TestDisplays;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DisplayConcurrencyTest {
  private static final long WRITE_DELAY_MILLIS = 40;

  private RecordingDestination out;
  private RecordingDestination err;
  private Display display;
  private ExecutorService executor;

  @BeforeEach
  void setUp() {
    out = new RecordingDestination("out", WRITE_DELAY_MILLIS);
    err = new RecordingDestination("err", WRITE_DELAY_MILLIS);
    display = TestDisplays.initialized(out, err);
    display.setColorfulness(false);
    display.setShowTrace(false);
    executor = Executors.newFixedThreadPool(4);
  }

  @AfterEach
  void tearDown() {
    display.unlock();
    executor.shutdownNow();
    display.teardown();
  }

  @Test
  void bracketedPrintsAreNotInterleaved() throws Exception {
    AtomicReference<Thread> intruder = new AtomicReference<>();
    CountDownLatch intruderStarted = new CountDownLatch(1);

    display.lock();
    display.print("main", "A1");
    Future<?> other = executor.submit(() -> {
      intruder.set(Thread.currentThread());
      intruderStarted.countDown();
      display.print("other", "B1");
    });
    assertTrue(intruderStarted.await(1, TimeUnit.SECONDS));
    awaitBlocked(intruder.get());
    display.print("main", "A2");
    display.unlock();

    other.get(2, TimeUnit.SECONDS);
    assertEquals(List.of("A1\n", "A2\n", "B1\n"), out.writes());
  }

  @Test
  void unbracketedPrintsFromManyThreadsNeverOverlap() throws Exception {
    int threads = 4;
    int printsPerThread = 5;
    CountDownLatch start = new CountDownLatch(1);
    Future<?>[] futures = new Future<?>[threads];
    for (int t = 0; t < threads; t++) {
      int id = t;
      futures[t] = executor.submit(() -> {
        start.await();
        for (int i = 0; i < printsPerThread; i++) {
          if (i % 2 == 0) {
            display.print("worker", "t%d-%d", id, i);
          } else {
            display.error("worker", "t%d-%d", id, i);
          }
        }
        return null;
      });
    }
    start.countDown();
    for (Future<?> future : futures) {
      future.get(10, TimeUnit.SECONDS);
    }

    assertEquals(0, out.overlaps());
    assertEquals(0, err.overlaps());
    assertEquals(threads * printsPerThread, out.writes().size() + err.writes().size());
  }

  @Test
  void forgottenUnlockStarvesOtherThreadsUntilReleased() throws Exception {
    display.lock();

    Future<Boolean> blocked = executor.submit(() -> display.error("other", "waiting"));

    assertThrows(TimeoutException.class, () -> blocked.get(200, TimeUnit.MILLISECONDS));
    assertEquals("", err.text());

    display.unlock();
    assertTrue(blocked.get(2, TimeUnit.SECONDS));
    assertEquals("[ERROR] waiting\n", err.text());
  }

  @Test
  void settersWaitForAnotherThreadsBracket() throws Exception {
    AtomicReference<Thread> setter = new AtomicReference<>();
    CountDownLatch setterStarted = new CountDownLatch(1);

    display.lock();
    Future<?> change = executor.submit(() -> {
      setter.set(Thread.currentThread());
      setterStarted.countDown();
      display.setVerbosity(false);
    });
    assertTrue(setterStarted.await(1, TimeUnit.SECONDS));
    awaitBlocked(setter.get());

    assertTrue(display.print("main", "still verbose"));
    assertEquals(Toggle.ENABLE, display.getVerbosity());

    display.unlock();
    change.get(2, TimeUnit.SECONDS);
    assertEquals(Toggle.DISABLE, display.getVerbosity());
  }

  @Test
  void printBlockedAcrossTeardownFailsWithoutWriting() throws Exception {
    AtomicReference<Thread> waiter = new AtomicReference<>();
    CountDownLatch waiterStarted = new CountDownLatch(1);

    display.lock();
    Future<Boolean> late = executor.submit(() -> {
      waiter.set(Thread.currentThread());
      waiterStarted.countDown();
      return display.print("other", "after teardown");
    });
    assertTrue(waiterStarted.await(1, TimeUnit.SECONDS));
    awaitBlocked(waiter.get());

    display.teardown();

    ExecutionException ex = assertThrows(ExecutionException.class, () -> late.get(2, TimeUnit.SECONDS));
    assertInstanceOf(UninitializedStateException.class, ex.getCause());
    assertTrue(out.writes().isEmpty());
    assertFalse(display.isLocked());
  }

  @Test
  void unlockFromAnotherThreadDoesNotBreakTheBracket() throws Exception {
    display.lock();

    Future<Boolean> foreignUnlock = executor.submit(display::unlock);

    assertFalse(foreignUnlock.get(1, TimeUnit.SECONDS));
    assertTrue(display.isLocked());
    assertTrue(display.unlock());
    assertFalse(display.isLocked());
  }

  @Test
  void atomicallyInsideBracketKeepsOuterHold() {
    display.lock();

    display.atomically(() -> display.print("main", "inner"));

    assertTrue(display.isLocked());
    display.unlock();
    display.atomically(() -> display.print("main", "outer"));
    assertFalse(display.isLocked());
    assertEquals(List.of("inner\n", "outer\n"), out.writes());
  }

  private static void awaitBlocked(Thread thread) throws InterruptedException {
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(2);
    while (System.nanoTime() < deadline) {
      Thread.State state = thread.getState();
      if (state == Thread.State.WAITING || state == Thread.State.BLOCKED) {
        return;
      }
      Thread.sleep(5);
    }
    throw new AssertionError("thread " + thread.getName() + " never blocked on the display lock");
  }
}
