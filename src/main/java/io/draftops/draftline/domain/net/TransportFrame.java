package io.draftops.draftline.domain.net;

import java.util.Objects;

/**
 * One text frame observed on the draft transport. Carries no parsed meaning.
 *
 * @param direction inbound or outbound
 * @param payload frame text; never {@code null}
 * @param timestampMillis epoch millis when the transport observed the frame
 * @since 0.1.0
 */
public record TransportFrame(FrameDirection direction, String payload, long timestampMillis) {

  public TransportFrame {
    Objects.requireNonNull(direction, "direction");
    Objects.requireNonNull(payload, "payload");
  }

  /**
   * Creates an inbound frame.
   *
   * @param payload frame text
   * @param timestampMillis observation time
   * @return received frame
   */
  public static TransportFrame received(String payload, long timestampMillis) {
    return new TransportFrame(FrameDirection.RECEIVED, payload, timestampMillis);
  }

  /**
   * Creates an outbound frame.
   *
   * @param payload frame text
   * @param timestampMillis observation time
   * @return sent frame
   */
  public static TransportFrame sent(String payload, long timestampMillis) {
    return new TransportFrame(FrameDirection.SENT, payload, timestampMillis);
  }

  /**
   * @return {@code true} when the frame came from the server
   */
  public boolean inbound() {
    return direction == FrameDirection.RECEIVED;
  }
}
