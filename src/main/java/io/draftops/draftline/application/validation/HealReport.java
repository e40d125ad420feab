package io.draftops.draftline.application.validation;

import io.draftops.draftline.domain.draft.ValidationResult;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of {@link ConsistencyValidator#validateAndHeal()}.
 *
 * @param original validation of the live state before any rollback
 * @param restoredIndex snapshot index that was restored, or {@code null} when no rollback was needed
 * @param snapshotsInspected snapshots validated while searching for a clean one
 * @since 0.1.0
 */
public record HealReport(ValidationResult original, Integer restoredIndex, int snapshotsInspected) {

  public HealReport {
    Objects.requireNonNull(original, "original");
  }

  static HealReport healthy(ValidationResult result) {
    return new HealReport(result, null, 0);
  }

  /**
   * @return {@code true} when the store was rolled back
   */
  public boolean rolledBack() {
    return restoredIndex != null;
  }

  public Optional<Integer> restored() {
    return Optional.ofNullable(restoredIndex);
  }
}
