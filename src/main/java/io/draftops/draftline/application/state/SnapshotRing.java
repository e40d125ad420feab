package io.draftops.draftline.application.state;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Bounded ring of snapshots. Pushing into a full ring evicts the oldest entry.
 * <p>Indexes follow the store's convention: {@code 0} is the oldest retained entry, {@code size - 1} the
 * newest, and negative indexes count back from the newest ({@code -1} is the newest, {@code -size} the
 * oldest).</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; guarded by the owning store's lock.</p>
 *
 * @param <T> retained element type
 * @since 0.1.0
 */
final class SnapshotRing<T> {
  private final int capacity;
  private final List<T> entries;

  SnapshotRing(int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be positive (was " + capacity + ")");
    }
    this.capacity = capacity;
    this.entries = new ArrayList<>(capacity);
  }

  void push(T element) {
    if (entries.size() == capacity) {
      entries.remove(0);
    }
    entries.add(element);
  }

  Optional<T> get(int index) {
    int position = normalize(index);
    if (position < 0) {
      return Optional.empty();
    }
    return Optional.of(entries.get(position));
  }

  /**
   * Drops every entry newer than {@code index}; the entry at {@code index} is kept.
   *
   * @return {@code false} when the index is out of range
   */
  boolean truncateAfter(int index) {
    int position = normalize(index);
    if (position < 0) {
      return false;
    }
    entries.subList(position + 1, entries.size()).clear();
    return true;
  }

  /** Converts a signed index to an offset from the oldest entry, or {@code -1} when out of range. */
  int normalize(int index) {
    int size = entries.size();
    if (index >= size || index < -size) {
      return -1;
    }
    return index < 0 ? size + index : index;
  }

  int size() {
    return entries.size();
  }
}
