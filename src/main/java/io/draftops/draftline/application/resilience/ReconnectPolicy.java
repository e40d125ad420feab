package io.draftops.draftline.application.resilience;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Heartbeat and reconnection tuning.
 *
 * @param maxAttempts reconnect attempts before giving up; positive
 * @param backoff waits applied before attempts 2, 3, ...; the last value repeats once exhausted
 * @param heartbeatInterval period of the heartbeat check
 * @param heartbeatTimeout silence after which the connection is considered lost
 * @since 0.1.0
 */
public record ReconnectPolicy(
    int maxAttempts, List<Duration> backoff, Duration heartbeatInterval, Duration heartbeatTimeout) {

  /**
   * Validates the policy.
   *
   * @throws IllegalArgumentException when attempts are not positive, backoff is empty or a duration is
   *         not positive
   */
  public ReconnectPolicy {
    if (maxAttempts <= 0) {
      throw new IllegalArgumentException("maxAttempts must be positive (was " + maxAttempts + ")");
    }
    backoff = List.copyOf(Objects.requireNonNull(backoff, "backoff"));
    if (backoff.isEmpty()) {
      throw new IllegalArgumentException("backoff must not be empty");
    }
    requirePositive("heartbeatInterval", heartbeatInterval);
    requirePositive("heartbeatTimeout", heartbeatTimeout);
  }

  /**
   * Five attempts, backoff 1, 2, 4, 8, 16 seconds, 5 second checks and a 30 second timeout.
   *
   * @return default policy
   */
  public static ReconnectPolicy defaults() {
    return new ReconnectPolicy(
        5,
        List.of(Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(4), Duration.ofSeconds(8),
            Duration.ofSeconds(16)),
        Duration.ofSeconds(5),
        Duration.ofSeconds(30));
  }

  /**
   * Returns the wait before an attempt. The first attempt is immediate.
   *
   * @param attempt 1-based attempt number
   * @return zero for the first attempt, otherwise the matching backoff entry capped at the last one
   */
  public Duration delayBeforeAttempt(int attempt) {
    if (attempt <= 1) {
      return Duration.ZERO;
    }
    return backoff.get(Math.min(attempt - 2, backoff.size() - 1));
  }

  private static void requirePositive(String name, Duration value) {
    Objects.requireNonNull(value, name);
    if (value.isZero() || value.isNegative()) {
      throw new IllegalArgumentException(name + " must be positive (was " + value + ")");
    }
  }
}
