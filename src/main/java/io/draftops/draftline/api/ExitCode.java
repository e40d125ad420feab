package io.draftops.draftline.api;

/**
 * Process exit statuses returned by the {@code draftline} commands.
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Replay finished and the final state validated. */
  SUCCESS(0),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** A capture, pool or player file could not be read. */
  IO_ERROR(3),
  /** The YAML configuration was missing or malformed. */
  CONFIG_ERROR(4),
  /** The engine failed, timed out or ended with an inconsistent state. */
  RUNTIME_FAILURE(5),
  /** Interrupted (for example SIGINT). */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * @return numeric status handed to {@link System#exit(int)}
   */
  public int code() {
    return code;
  }
}
