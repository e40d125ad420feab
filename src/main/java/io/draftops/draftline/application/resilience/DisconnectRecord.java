package io.draftops.draftline.application.resilience;

import java.util.Objects;

/**
 * State captured at the moment a disconnection was detected.
 *
 * @param lastKnownPickNumber pick number the store had reached
 * @param messageCount inbound frames received so far
 * @param timestampMillis detection time
 * @param reason cause, e.g. {@code heartbeat timeout}
 * @since 0.1.0
 */
public record DisconnectRecord(int lastKnownPickNumber, long messageCount, long timestampMillis, String reason) {

  public DisconnectRecord {
    Objects.requireNonNull(reason, "reason");
  }
}
