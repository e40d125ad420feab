package io.draftops.draftline.application.pipeline;

import io.draftops.draftline.domain.protocol.DraftEventType;
import java.util.Map;

/**
 * Point-in-time counters of the event processor.
 *
 * @param totalMessages frames handed to the processor
 * @param messagesByType successfully parsed frames per command
 * @param parseErrors frames rejected by the parser
 * @param stateErrors frames whose state update was rejected or failed
 * @since 0.1.0
 */
public record ProcessingStats(
    long totalMessages, Map<DraftEventType, Long> messagesByType, long parseErrors, long stateErrors) {

  public ProcessingStats {
    messagesByType = Map.copyOf(messagesByType);
  }

  /**
   * Returns the fraction of frames processed without error.
   *
   * @return {@code (total - parseErrors - stateErrors) / total}, or {@code 1.0} before any frame
   */
  public double successRate() {
    if (totalMessages == 0) {
      return 1.0;
    }
    return (double) (totalMessages - parseErrors - stateErrors) / totalMessages;
  }

  /**
   * @param type command
   * @return number of parsed frames of that command
   */
  public long count(DraftEventType type) {
    return messagesByType.getOrDefault(type, 0L);
  }
}
