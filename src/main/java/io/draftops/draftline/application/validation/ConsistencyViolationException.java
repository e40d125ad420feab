package io.draftops.draftline.application.validation;

import io.draftops.draftline.domain.draft.ValidationResult;
import java.util.Objects;

/**
 * Raised when the draft state is inconsistent and no retained snapshot validates cleanly.
 * The store must be considered unusable once this is thrown.
 *
 * @since 0.1.0
 */
public final class ConsistencyViolationException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final transient ValidationResult result;
  private final int snapshotsInspected;

  /**
   * @param result failing validation of the live state
   * @param snapshotsInspected number of snapshots that were tried
   */
  public ConsistencyViolationException(ValidationResult result, int snapshotsInspected) {
    super("Draft state inconsistent and no clean snapshot among " + snapshotsInspected + ": "
        + Objects.requireNonNull(result, "result").errors());
    this.result = result;
    this.snapshotsInspected = snapshotsInspected;
  }

  public ValidationResult result() {
    return result;
  }

  public int snapshotsInspected() {
    return snapshotsInspected;
  }
}
