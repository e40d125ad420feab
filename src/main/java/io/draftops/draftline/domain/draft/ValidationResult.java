package io.draftops.draftline.domain.draft;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of a consistency check. Valid exactly when {@link #errors()} is empty.
 *
 * @param valid {@code true} when no errors were found
 * @param errors hard failures signalling corruption
 * @param warnings conditions that may resolve on their own (e.g., lagging position assignment)
 * @param suggestions operator hints that never affect validity
 * @since 0.1.0
 */
public record ValidationResult(boolean valid, List<String> errors, List<String> warnings, List<String> suggestions) {

  /**
   * Copies all message lists.
   */
  public ValidationResult {
    errors = List.copyOf(errors);
    warnings = List.copyOf(warnings);
    suggestions = List.copyOf(suggestions);
  }

  /**
   * Builds a result whose validity is derived from the error list.
   *
   * @param errors hard failures
   * @param warnings soft findings
   * @param suggestions hints
   * @return validation result
   */
  public static ValidationResult of(List<String> errors, List<String> warnings, List<String> suggestions) {
    return new ValidationResult(errors.isEmpty(), errors, warnings, suggestions);
  }

  /**
   * Returns a copy with extra warnings appended.
   *
   * @param extra warnings to add
   * @return new result with the same validity
   */
  public ValidationResult withWarnings(List<String> extra) {
    List<String> merged = new ArrayList<>(warnings);
    merged.addAll(extra);
    return new ValidationResult(valid, errors, merged, suggestions);
  }
}
