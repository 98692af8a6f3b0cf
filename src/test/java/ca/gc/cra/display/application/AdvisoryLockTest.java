package ca.gc.cra.display.application;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class AdvisoryLockTest {
  private final AdvisoryLock lock = new AdvisoryLock();
  private final ExecutorService executor = Executors.newSingleThreadExecutor();

  @AfterEach
  void tearDown() {
    lock.unlock();
    executor.shutdownNow();
  }

  @Test
  void secondLockByHolderIsNoOp() {
    assertTrue(lock.lock());
    assertFalse(lock.lock());

    assertTrue(lock.unlock());
    assertFalse(lock.isLocked(), "one unlock must fully release a double lock");
  }

  @Test
  void unlockWithoutHoldingIsNoOp() {
    assertFalse(lock.unlock());
    assertFalse(lock.isLocked());
  }

  @Test
  void enterInsideBracketDoesNotAcquireOrRelease() {
    lock.lock();

    try (AdvisoryLock.Hold hold = lock.enter()) {
      assertFalse(hold.acquired());
      assertEquals(0L, hold.waitNanos());
    }

    assertTrue(lock.isHeldByCurrentThread(), "bracket must survive an inner operation");
  }

  @Test
  void enterOutsideBracketReleasesOnClose() {
    try (AdvisoryLock.Hold hold = lock.enter()) {
      assertTrue(hold.acquired());
      assertTrue(lock.isHeldByCurrentThread());
    }

    assertFalse(lock.isLocked());
  }

  @Test
  void otherThreadCannotReleaseTheBracket() throws Exception {
    lock.lock();

    Future<Boolean> released = executor.submit(lock::unlock);

    assertFalse(released.get(1, TimeUnit.SECONDS));
    assertTrue(lock.isHeldByCurrentThread());
  }

  @Test
  void otherThreadBlocksUntilHolderUnlocks() throws Exception {
    lock.lock();
    CountDownLatch started = new CountDownLatch(1);
    AtomicBoolean entered = new AtomicBoolean();

    CompletableFuture<Void> waiter = CompletableFuture.runAsync(() -> {
      started.countDown();
      try (AdvisoryLock.Hold hold = lock.enter()) {
        entered.set(true);
      }
    }, executor);

    assertTrue(started.await(1, TimeUnit.SECONDS));
    awaitWaiter();
    assertFalse(entered.get(), "waiter entered while the bracket was held");

    lock.unlock();
    waiter.get(1, TimeUnit.SECONDS);
    assertTrue(entered.get());
  }

  private void awaitWaiter() throws InterruptedException {
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(2);
    while (!lock.hasWaiters() && System.nanoTime() < deadline) {
      Thread.sleep(5);
    }
    assertTrue(lock.hasWaiters(), "waiter never queued on the lock");
  }
}
