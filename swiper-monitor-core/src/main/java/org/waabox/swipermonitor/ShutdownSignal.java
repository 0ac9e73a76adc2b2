package org.waabox.swipermonitor;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A set-once cancellation token observed cooperatively by the monitor loop.
 *
 * <p>Triggering is idempotent: the first call records its reason and wakes
 * every waiter, later calls are ignored. The loop polls
 * {@link #isTriggered()} between states and blocks on {@link #await(Duration)}
 * while sleeping, so a shutdown never waits for a full poll interval.
 *
 * <p>This class is thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ShutdownSignal {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(ShutdownSignal.class);

  /** Released exactly once, when the signal is triggered. */
  private final CountDownLatch latch = new CountDownLatch(1);

  /** The reason given by the first trigger, null until triggered. */
  private final AtomicReference<String> reason = new AtomicReference<>();

  /**
   * Triggers the signal.
   *
   * @param theReason a description of what requested the shutdown, such as
   *                  the name of the received signal, never null
   *
   * @return true if this call triggered the signal, false if it was already
   *         triggered
   */
  public boolean trigger(final String theReason) {
    Objects.requireNonNull(theReason, "reason must not be null");
    if (!reason.compareAndSet(null, theReason)) {
      log.debug("Shutdown already requested, ignoring '{}'", theReason);
      return false;
    }
    log.info("Received {}. Initiating graceful shutdown...", theReason);
    latch.countDown();
    return true;
  }

  /**
   * Returns whether the signal has been triggered.
   *
   * @return true once {@link #trigger(String)} has been called
   */
  public boolean isTriggered() {
    return latch.getCount() == 0;
  }

  /**
   * Returns the reason given by the first trigger.
   *
   * @return the reason, empty if the signal has not been triggered
   */
  public Optional<String> reason() {
    return Optional.ofNullable(reason.get());
  }

  /**
   * Blocks until the signal is triggered or the timeout elapses.
   *
   * <p>An interrupt of the waiting thread is treated as a shutdown request:
   * the interrupt status is restored and true is returned.
   *
   * @param timeout the maximum time to wait, never null
   *
   * @return true if the signal was triggered (or the thread interrupted),
   *         false if the timeout elapsed first
   */
  public boolean await(final Duration timeout) {
    Objects.requireNonNull(timeout, "timeout must not be null");
    try {
      return latch.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      return true;
    }
  }
}
