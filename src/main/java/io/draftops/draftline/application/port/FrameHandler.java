package io.draftops.draftline.application.port;

import io.draftops.draftline.domain.net.TransportFrame;

/**
 * Receives frames from a {@link DraftTransport}.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface FrameHandler {
  /**
   * Handles one frame. Called on the transport's thread; implementations must not block for long.
   *
   * @param frame observed frame
   */
  void onFrame(TransportFrame frame);

  /**
   * Notified when the transport loses its connection on its own.
   *
   * @param reason human readable cause
   */
  default void onClosed(String reason) {}
}
