package io.draftops.draftline.infrastructure.time;

import io.draftops.draftline.application.port.ClockPort;

/**
 * {@link ClockPort} backed by the JVM wall clock. Pick timestamps and heartbeat checks read it.
 *
 * @since 0.1.0
 */
public final class SystemClockAdapter implements ClockPort {

  @Override
  public long nowMillis() {
    return System.currentTimeMillis();
  }
}
