package ca.gc.cra.display.application;

import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Advisory lock that serializes display output across threads.
 * <p><strong>Why:</strong> Prevents interleaved lines while letting a caller bracket several prints as one block:
 * {@code lock(); print; print; unlock();}. Prints issued by the holder skip acquisition, so the bracket does not
 * deadlock on itself.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>{@link #lock()} blocks until the mutex is free; a second call by the holder is a no-op.</li>
 *   <li>{@link #unlock()} releases only when the calling thread is the holder; otherwise it is a no-op.</li>
 *   <li>{@link #enter()} gives internal operations the acquire-unless-held, release-if-acquired behavior.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Owner identity is tracked by the underlying {@link ReentrantLock}, so one
 * thread can never release another thread's bracket. The hold count never exceeds one.</p>
 * <p><strong>Liveness:</strong> Waiters block without timeout. A holder that never calls {@link #unlock()} starves
 * every other printing thread; that is part of the contract.</p>
 *
 * @since 0.1.0
 */
public final class AdvisoryLock {
  private static final Logger log = LoggerFactory.getLogger(AdvisoryLock.class);

  private final ReentrantLock mutex = new ReentrantLock();

  /**
   * Acquires the lock for the calling thread, blocking while another thread holds it.
   *
   * @return {@code true} if this call acquired the lock, {@code false} if the caller already held it
   */
  public boolean lock() {
    if (mutex.isHeldByCurrentThread()) {
      return false;
    }
    mutex.lock();
    return true;
  }

  /**
   * Releases the lock if the calling thread holds it.
   *
   * @return {@code true} if the lock was released
   */
  public boolean unlock() {
    if (!mutex.isHeldByCurrentThread()) {
      if (mutex.isLocked()) {
        log.debug("Ignoring unlock from {}: display lock is held by another thread",
            Thread.currentThread().getName());
      }
      return false;
    }
    mutex.unlock();
    return true;
  }

  /**
   * Enters the critical section for one internal operation.
   *
   * <p>Use with try-with-resources; closing the returned hold releases the lock only if this call acquired it.</p>
   *
   * @return hold describing the acquisition
   */
  public Hold enter() {
    if (mutex.isHeldByCurrentThread()) {
      return new Hold(this, false, 0L);
    }
    long start = System.nanoTime();
    mutex.lock();
    return new Hold(this, true, System.nanoTime() - start);
  }

  /**
   * @return {@code true} while any thread holds the lock
   */
  public boolean isLocked() {
    return mutex.isLocked();
  }

  /**
   * @return {@code true} if the calling thread holds the lock
   */
  public boolean isHeldByCurrentThread() {
    return mutex.isHeldByCurrentThread();
  }

  /**
   * @return {@code true} if threads are blocked waiting for the lock
   */
  public boolean hasWaiters() {
    return mutex.hasQueuedThreads();
  }

  /**
   * Scoped acquisition returned by {@link #enter()}.
   */
  public static final class Hold implements AutoCloseable {
    private final AdvisoryLock owner;
    private final boolean acquired;
    private final long waitNanos;

    private Hold(AdvisoryLock owner, boolean acquired, long waitNanos) {
      this.owner = owner;
      this.acquired = acquired;
      this.waitNanos = waitNanos;
    }

    /**
     * @return {@code true} if entering acquired the lock, {@code false} if the caller already held it
     */
    public boolean acquired() {
      return acquired;
    }

    /**
     * @return time spent blocked on the mutex; zero when the caller already held it
     */
    public long waitNanos() {
      return waitNanos;
    }

    @Override
    public void close() {
      if (acquired) {
        owner.mutex.unlock();
      }
    }
  }
}
