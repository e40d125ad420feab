package io.draftops.draftline.domain.protocol;

/**
 * Raised when a frame names a recognised command but its arguments are malformed.
 * <p>Never fatal: callers count the failure and skip the frame.</p>
 *
 * @since 0.1.0
 */
public final class ProtocolParseException extends Exception {
  private static final long serialVersionUID = 1L;

  private final DraftEventType command;
  private final String frame;

  /**
   * Creates a parse exception.
   *
   * @param command command whose grammar was violated
   * @param frame offending frame text
   * @param message description of the violation
   */
  public ProtocolParseException(DraftEventType command, String frame, String message) {
    super(message);
    this.command = command;
    this.frame = frame;
  }

  /**
   * Creates a parse exception wrapping a lower-level failure.
   *
   * @param command command whose grammar was violated
   * @param frame offending frame text
   * @param message description of the violation
   * @param cause underlying failure, typically a {@link NumberFormatException}
   */
  public ProtocolParseException(DraftEventType command, String frame, String message, Throwable cause) {
    super(message, cause);
    this.command = command;
    this.frame = frame;
  }

  /**
   * @return command whose grammar was violated
   */
  public DraftEventType command() {
    return command;
  }

  /**
   * @return offending frame text
   */
  public String frame() {
    return frame;
  }
}
