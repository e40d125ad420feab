package io.draftops.draftline.application.port;

import io.draftops.draftline.application.resilience.ConnectionState;
import io.draftops.draftline.application.resilience.DisconnectRecord;
import io.draftops.draftline.application.resilience.ResyncReport;

/**
 * Observer of connection lifecycle transitions. Methods run on the heartbeat, recovery or caller thread.
 *
 * @since 0.1.0
 */
public interface ResilienceListener {

  /**
   * @param previous state before the transition
   * @param current state after the transition
   */
  default void onStateChanged(ConnectionState previous, ConnectionState current) {}

  /**
   * @param record state captured when the disconnection was detected
   */
  default void onDisconnected(DisconnectRecord record) {}

  /**
   * @param attempt 1-based attempt number
   * @param delayMillis wait applied before the attempt
   */
  default void onReconnectAttempt(int attempt, long delayMillis) {}

  /**
   * @param report resynchronization outcome after a successful reconnect
   */
  default void onReconnected(ResyncReport report) {}

  /**
   * Terminal failure; the manager stays in {@link ConnectionState#FAILED}.
   *
   * @param record disconnection that could not be recovered
   * @param attempts number of attempts made
   */
  default void onRecoveryFailed(DisconnectRecord record, int attempts) {}
}
