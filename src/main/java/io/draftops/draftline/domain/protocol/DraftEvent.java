package io.draftops.draftline.domain.protocol;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable event decoded from one protocol frame.
 * <p>Fields are populated according to {@link #type()}; fields that do not apply to a type hold their
 * defaults ({@code -1}, {@code null} or an empty list).</p>
 *
 * @since 0.1.0
 */
public final class DraftEvent {
  private final DraftEventType type;
  private final int teamId;
  private final String playerId;
  private final int pickNumber;
  private final String memberId;
  private final long millis;
  private final Integer round;
  private final boolean enabled;
  private final List<String> arguments;
  private final String raw;

  private DraftEvent(Builder builder) {
    this.type = Objects.requireNonNull(builder.type, "type");
    this.teamId = builder.teamId;
    this.playerId = builder.playerId;
    this.pickNumber = builder.pickNumber;
    this.memberId = builder.memberId;
    this.millis = builder.millis;
    this.round = builder.round;
    this.enabled = builder.enabled;
    this.arguments = List.copyOf(builder.arguments);
    this.raw = Objects.requireNonNullElse(builder.raw, "");
  }

  /**
   * @return event type
   */
  public DraftEventType type() {
    return type;
  }

  /**
   * @return team identifier for SELECTED, SELECTING, CLOCK and AUTODRAFT; {@code -1} otherwise
   */
  public int teamId() {
    return teamId;
  }

  /**
   * @return selected player id (SELECTED only)
   */
  public String playerId() {
    return playerId;
  }

  /**
   * @return pick sequence carried by SELECTED, interpreted as the overall pick number; {@code -1} otherwise
   */
  public int pickNumber() {
    return pickNumber;
  }

  /**
   * @return optional member id of the user that made a SELECTED pick
   */
  public Optional<String> memberId() {
    return Optional.ofNullable(memberId);
  }

  /**
   * @return time limit (SELECTING) or time remaining (CLOCK) in milliseconds; {@code -1} otherwise
   */
  public long millis() {
    return millis;
  }

  /**
   * @return optional round number carried by CLOCK
   */
  public Optional<Integer> round() {
    return Optional.ofNullable(round);
  }

  /**
   * @return autodraft flag (AUTODRAFT only)
   */
  public boolean enabled() {
    return enabled;
  }

  /**
   * @return payload tokens following the command for session messages
   */
  public List<String> arguments() {
    return arguments;
  }

  /**
   * @return original frame text
   */
  public String raw() {
    return raw;
  }

  @Override
  public String toString() {
    return "DraftEvent{type=" + type
        + ", teamId=" + teamId
        + (playerId != null ? ", playerId=" + playerId : "")
        + (pickNumber >= 0 ? ", pickNumber=" + pickNumber : "")
        + (millis >= 0 ? ", millis=" + millis : "")
        + '}';
  }

  /** Builder for {@link DraftEvent}. */
  public static final class Builder {
    private final DraftEventType type;
    private final String raw;
    private int teamId = -1;
    private String playerId;
    private int pickNumber = -1;
    private String memberId;
    private long millis = -1L;
    private Integer round;
    private boolean enabled;
    private List<String> arguments = List.of();

    private Builder(DraftEventType type, String raw) {
      this.type = Objects.requireNonNull(type, "type");
      this.raw = raw;
    }

    /**
     * Creates a builder.
     *
     * @param type event type
     * @param raw original frame text
     * @return builder instance
     */
    public static Builder create(DraftEventType type, String raw) {
      return new Builder(type, raw);
    }

    public Builder teamId(int teamId) {
      this.teamId = teamId;
      return this;
    }

    public Builder playerId(String playerId) {
      this.playerId = playerId;
      return this;
    }

    public Builder pickNumber(int pickNumber) {
      this.pickNumber = pickNumber;
      return this;
    }

    public Builder memberId(String memberId) {
      this.memberId = memberId;
      return this;
    }

    public Builder millis(long millis) {
      this.millis = millis;
      return this;
    }

    public Builder round(Integer round) {
      this.round = round;
      return this;
    }

    public Builder enabled(boolean enabled) {
      this.enabled = enabled;
      return this;
    }

    /**
     * Sets the trailing payload tokens.
     *
     * @param arguments tokens (defensively copied)
     * @return this builder
     */
    public Builder arguments(List<String> arguments) {
      this.arguments = Objects.requireNonNullElse(arguments, List.of());
      return this;
    }

    /**
     * Builds the immutable event.
     *
     * @return event instance
     */
    public DraftEvent build() {
      return new DraftEvent(this);
    }
  }
}
