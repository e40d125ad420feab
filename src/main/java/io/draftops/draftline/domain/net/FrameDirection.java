package io.draftops.draftline.domain.net;

/**
 * Direction of a frame relative to this process.
 *
 * @since 0.1.0
 */
public enum FrameDirection {
  /** Frame received from the draft server. */
  RECEIVED,
  /** Frame sent by this client. */
  SENT
}
