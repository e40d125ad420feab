package io.draftops.draftline.application.port;

import io.draftops.draftline.application.resolution.ResolvedPlayer;
import java.util.Collection;
import java.util.Map;

/**
 * <strong>What:</strong> Port resolving vendor player ids to display names and roster positions.
 * <p><strong>Why:</strong> Draft frames only carry opaque ids; resolution may be slow or remote and must stay
 * off the writer thread.</p>
 * <p><strong>Role:</strong> Driven port called in batches by the player resolution worker.</p>
 * <p><strong>Thread-safety:</strong> Called from a single resolution thread.</p>
 *
 * @since 0.1.0
 */
public interface PlayerDirectory {
  /**
   * Resolves a batch of ids.
   *
   * @param playerIds ids to resolve; never empty
   * @return resolved players keyed by id; ids that could not be found are simply absent
   * @throws Exception when the lookup fails as a whole
   */
  Map<String, ResolvedPlayer> resolveAll(Collection<String> playerIds) throws Exception;
}
