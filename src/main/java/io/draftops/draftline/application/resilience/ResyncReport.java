package io.draftops.draftline.application.resilience;

/**
 * Comparison of draft progress before and after a reconnect. Backfilling missed picks is left to the caller.
 *
 * @param pickBefore pick number recorded at disconnection
 * @param pickAfter pick number observed after reconnecting
 * @param missedPicks {@code max(0, pickAfter - pickBefore)}
 * @param messagesSinceDisconnect inbound frames received between disconnection and resynchronization
 * @param downtimeMillis time between disconnection and resynchronization
 * @since 0.1.0
 */
public record ResyncReport(
    int pickBefore, int pickAfter, int missedPicks, long messagesSinceDisconnect, long downtimeMillis) {

  /**
   * @return {@code true} when picks happened while disconnected
   */
  public boolean missedAny() {
    return missedPicks > 0;
  }
}
