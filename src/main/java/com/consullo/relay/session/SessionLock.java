package com.consullo.relay.session;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fair mutual exclusion over the interactive session.
 *
 * <p>Waiters are served in arrival order. A waiter gives up after its acquisition timeout instead of
 * queuing indefinitely. When the lease is older than the maximum hold time, the waiter interrupts the
 * holding thread and waits up to the reclaim grace for it to close its lease. The permit is never
 * taken from a holder, so a holder that does not stop keeps the session and the waiter is refused.
 *
 * @since 1.0
 */
public final class SessionLock {

  private static final Logger LOGGER = LoggerFactory.getLogger(SessionLock.class);

  private static final Duration DEFAULT_RECLAIM_GRACE = Duration.ofSeconds(5);

  private final Semaphore permit = new Semaphore(1, true);
  private final Duration maxHold;
  private final Duration reclaimGrace;
  private final Clock clock;

  private final AtomicLong acquisitions = new AtomicLong();
  private final AtomicLong releases = new AtomicLong();

  private Lease current;

  public SessionLock(Duration maxHold, Clock clock) {
    this(maxHold, DEFAULT_RECLAIM_GRACE, clock);
  }

  /**
   * @param maxHold lease age after which a waiter may interrupt the holder
   * @param reclaimGrace how long that waiter then waits for the holder to let go
   * @param clock time source for lease ages
   */
  public SessionLock(Duration maxHold, Duration reclaimGrace, Clock clock) {
    Validate.notNull(maxHold, "maxHold must not be null");
    Validate.isTrue(!maxHold.isNegative() && !maxHold.isZero(), "maxHold must be positive");
    Validate.notNull(reclaimGrace, "reclaimGrace must not be null");
    Validate.isTrue(!reclaimGrace.isNegative(), "reclaimGrace must not be negative");
    Validate.notNull(clock, "clock must not be null");
    this.maxHold = maxHold;
    this.reclaimGrace = reclaimGrace;
    this.clock = clock;
  }

  /**
   * Waits up to {@code timeout} for the session.
   *
   * @param holder description of the requester, for logs
   * @param timeout acquisition timeout
   * @return the lease, empty if the session stayed busy
   * @throws InterruptedException if interrupted while waiting
   */
  public Optional<Lease> tryAcquire(String holder, Duration timeout) throws InterruptedException {
    Validate.notBlank(holder, "holder must not be blank");
    Validate.notNull(timeout, "timeout must not be null");
    if (!permit.tryAcquire(timeout.toMillis(), TimeUnit.MILLISECONDS)
        && !(interruptExpired() && permit.tryAcquire(reclaimGrace.toMillis(), TimeUnit.MILLISECONDS))) {
      return Optional.empty();
    }
    final Lease lease = new Lease(holder, clock.instant(), Thread.currentThread());
    synchronized (this) {
      current = lease;
    }
    acquisitions.incrementAndGet();
    LOGGER.debug("Session lock acquired by {}", holder);
    return Optional.of(lease);
  }

  public synchronized boolean isHeld() {
    return current != null;
  }

  /**
   * @return holder of the current lease, empty when free
   */
  public synchronized Optional<String> holder() {
    return current == null ? Optional.empty() : Optional.of(current.holder());
  }

  public Duration maxHold() {
    return maxHold;
  }

  public long acquisitions() {
    return acquisitions.get();
  }

  public long releases() {
    return releases.get();
  }

  /**
   * Interrupts the holder of a lease older than {@code maxHold}. The holder still releases the permit
   * itself when it unwinds.
   *
   * @return true if the current lease is overdue
   */
  private synchronized boolean interruptExpired() {
    if (current == null || clock.instant().isBefore(current.acquiredAt().plus(maxHold))) {
      return false;
    }
    if (current.reclaimed.compareAndSet(false, true)) {
      LOGGER.error("Session lock held by {} since {} exceeded {}, interrupting {}",
          current.holder(), current.acquiredAt(), maxHold, current.owner.getName());
    }
    current.owner.interrupt();
    return true;
  }

  private void release(Lease lease) {
    synchronized (this) {
      if (current != lease) {
        return;
      }
      current = null;
    }
    releases.incrementAndGet();
    permit.release();
    LOGGER.debug("Session lock released by {}", lease.holder());
  }

  /** Ownership of the session; closing it releases the lock exactly once. */
  public final class Lease implements AutoCloseable {

    private final String holder;
    private final Instant acquiredAt;
    private final Thread owner;
    private final AtomicBoolean released = new AtomicBoolean();
    private final AtomicBoolean reclaimed = new AtomicBoolean();

    private Lease(String holder, Instant acquiredAt, Thread owner) {
      this.holder = holder;
      this.acquiredAt = acquiredAt;
      this.owner = owner;
    }

    public String holder() {
      return holder;
    }

    public Instant acquiredAt() {
      return acquiredAt;
    }

    public boolean isReleased() {
      return released.get();
    }

    /** Whether a waiter found this lease overdue and interrupted its holder. */
    public boolean isReclaimed() {
      return reclaimed.get();
    }

    @Override
    public void close() {
      if (released.compareAndSet(false, true)) {
        release(this);
      }
    }
  }
}
