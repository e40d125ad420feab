package io.draftops.draftline.application.port;

/**
 * <strong>What:</strong> Port supplying wall-clock timestamps to the draft engine.
 * <p><strong>Why:</strong> Pick timestamps, snapshot capture times and heartbeat checks all read time; tests
 * substitute a controllable clock.</p>
 * <p><strong>Role:</strong> Domain port consumed by the state store and the resilience manager.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe; the writer, heartbeat and recovery
 * threads read the clock concurrently.</p>
 *
 * @implNote Default implementation delegates to {@link System#currentTimeMillis()}.
 * @since 0.1.0
 * @see io.draftops.draftline.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z
   */
  long nowMillis();

  /**
   * Default {@link ClockPort} using {@link System#currentTimeMillis()}.
   */
  ClockPort SYSTEM = System::currentTimeMillis;
}
