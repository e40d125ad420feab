package io.draftops.draftline.application.resilience;

import java.time.Duration;

/**
 * Waits between reconnect attempts. Tests substitute a recording implementation.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface BackoffSleeper {
  /**
   * Blocks for the given delay.
   *
   * @param delay wait duration
   * @throws InterruptedException when shutdown interrupts the wait
   */
  void sleep(Duration delay) throws InterruptedException;

  /** Sleeps on the calling thread. */
  BackoffSleeper THREAD = delay -> Thread.sleep(delay.toMillis());
}
