package io.draftops.draftline.domain.protocol;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * <strong>What:</strong> Decodes single text frames of the draft wire protocol into {@link DraftEvent}s.
 * <p><strong>Why:</strong> Keeps the vendor grammar in one place so state handling never sees raw text.</p>
 * <p><strong>Role:</strong> Domain service invoked by the single writer thread before events reach the store.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Tokenize on whitespace and match the command case-insensitively.</li>
 *   <li>Validate arity and numeric fields for draft commands.</li>
 *   <li>Map unrecognised or blank frames to {@link DraftEventType#UNKNOWN} without failing.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 *
 * @implNote Trailing tokens beyond a command's grammar are ignored because the vendor appends fields.
 * @since 0.1.0
 */
public final class DraftProtocolParser {
  private static final String[] NO_TOKENS = new String[0];

  /**
   * Parses one frame.
   *
   * @param frame raw frame text; {@code null} or blank yields an {@link DraftEventType#UNKNOWN} event
   * @return decoded event
   * @throws ProtocolParseException when a recognised command has too few tokens or a malformed numeric
   *         or boolean field
   */
  public DraftEvent parse(String frame) throws ProtocolParseException {
    String raw = frame == null ? "" : frame;
    String[] tokens = tokenize(raw);
    DraftEventType type = tokens.length == 0 ? DraftEventType.UNKNOWN : DraftEventType.fromCommand(tokens[0]);
    return switch (type) {
      case SELECTED -> parseSelected(tokens, raw);
      case SELECTING -> parseSelecting(tokens, raw);
      case CLOCK -> parseClock(tokens, raw);
      case AUTODRAFT -> parseAutodraft(tokens, raw);
      case TOKEN, JOINED, LEFT, PING, PONG -> DraftEvent.Builder.create(type, raw)
          .arguments(tail(tokens))
          .build();
      case UNKNOWN -> DraftEvent.Builder.create(DraftEventType.UNKNOWN, raw)
          .arguments(Arrays.asList(tokens))
          .build();
    };
  }

  private static DraftEvent parseSelected(String[] tokens, String raw) throws ProtocolParseException {
    requireArity(DraftEventType.SELECTED, tokens, 4, raw);
    DraftEvent.Builder builder = DraftEvent.Builder.create(DraftEventType.SELECTED, raw)
        .teamId(parseInt(DraftEventType.SELECTED, "teamId", tokens[1], raw))
        .playerId(tokens[2])
        .pickNumber(parseInt(DraftEventType.SELECTED, "pickSequence", tokens[3], raw));
    if (tokens.length > 4) {
      builder.memberId(tokens[4]);
    }
    return builder.build();
  }

  private static DraftEvent parseSelecting(String[] tokens, String raw) throws ProtocolParseException {
    requireArity(DraftEventType.SELECTING, tokens, 3, raw);
    return DraftEvent.Builder.create(DraftEventType.SELECTING, raw)
        .teamId(parseInt(DraftEventType.SELECTING, "teamId", tokens[1], raw))
        .millis(parseLong(DraftEventType.SELECTING, "timeLimitMs", tokens[2], raw))
        .build();
  }

  private static DraftEvent parseClock(String[] tokens, String raw) throws ProtocolParseException {
    requireArity(DraftEventType.CLOCK, tokens, 3, raw);
    DraftEvent.Builder builder = DraftEvent.Builder.create(DraftEventType.CLOCK, raw)
        .teamId(parseInt(DraftEventType.CLOCK, "teamId", tokens[1], raw))
        .millis(parseLong(DraftEventType.CLOCK, "timeRemainingMs", tokens[2], raw));
    if (tokens.length > 3) {
      builder.round(parseInt(DraftEventType.CLOCK, "round", tokens[3], raw));
    }
    return builder.build();
  }

  private static DraftEvent parseAutodraft(String[] tokens, String raw) throws ProtocolParseException {
    requireArity(DraftEventType.AUTODRAFT, tokens, 3, raw);
    String flag = tokens[2].toLowerCase(Locale.ROOT);
    boolean enabled;
    if ("true".equals(flag)) {
      enabled = true;
    } else if ("false".equals(flag)) {
      enabled = false;
    } else {
      throw new ProtocolParseException(DraftEventType.AUTODRAFT, raw,
          "AUTODRAFT flag must be true or false (was '" + tokens[2] + "')");
    }
    return DraftEvent.Builder.create(DraftEventType.AUTODRAFT, raw)
        .teamId(parseInt(DraftEventType.AUTODRAFT, "teamId", tokens[1], raw))
        .enabled(enabled)
        .build();
  }

  private static void requireArity(DraftEventType type, String[] tokens, int required, String raw)
      throws ProtocolParseException {
    if (tokens.length < required) {
      throw new ProtocolParseException(type, raw,
          type + " expects at least " + (required - 1) + " arguments (got " + (tokens.length - 1) + ")");
    }
  }

  private static int parseInt(DraftEventType type, String field, String token, String raw)
      throws ProtocolParseException {
    long value = parseLong(type, field, token, raw);
    if (value > Integer.MAX_VALUE) {
      throw new ProtocolParseException(type, raw, field + " out of range: '" + token + "'");
    }
    return (int) value;
  }

  private static long parseLong(DraftEventType type, String field, String token, String raw)
      throws ProtocolParseException {
    long value;
    try {
      value = Long.parseLong(token);
    } catch (NumberFormatException ex) {
      throw new ProtocolParseException(type, raw, field + " is not numeric: '" + token + "'", ex);
    }
    if (value < 0) {
      throw new ProtocolParseException(type, raw, field + " must be non-negative: '" + token + "'");
    }
    return value;
  }

  private static String[] tokenize(String raw) {
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      return NO_TOKENS;
    }
    return trimmed.split("\\s+");
  }

  private static List<String> tail(String[] tokens) {
    if (tokens.length <= 1) {
      return List.of();
    }
    return Arrays.asList(tokens).subList(1, tokens.length);
  }
}
