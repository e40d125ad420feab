package io.draftops.draftline.application.resilience;

/**
 * Lifecycle of the draft transport connection.
 * <p>{@code DISCONNECTED -> CONNECTING -> CONNECTED <-> RECONNECTING -> FAILED}; {@link #FAILED} is terminal.</p>
 *
 * @since 0.1.0
 */
public enum ConnectionState {
  DISCONNECTED,
  CONNECTING,
  CONNECTED,
  RECONNECTING,
  FAILED
}
