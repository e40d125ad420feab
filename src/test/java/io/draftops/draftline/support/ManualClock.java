package io.draftops.draftline.support;

import io.draftops.draftline.application.port.ClockPort;
import java.util.concurrent.atomic.AtomicLong;

/** Clock advanced explicitly by tests. */
public final class ManualClock implements ClockPort {
  private final AtomicLong now;

  public ManualClock(long startMillis) {
    this.now = new AtomicLong(startMillis);
  }

  @Override
  public long nowMillis() {
    return now.get();
  }

  public void advance(long millis) {
    now.addAndGet(millis);
  }
}
