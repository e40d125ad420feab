package io.draftops.draftline.application.port;

/**
 * <strong>What:</strong> Port for the connection that supplies raw draft frames.
 * <p><strong>Why:</strong> Isolates the engine from how frames are obtained (live socket, capture replay).</p>
 * <p><strong>Role:</strong> Driven port owned by the connection resilience manager.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Open and close the connection to a draft room.</li>
 *   <li>Attempt a lightweight session refresh before a full reconnect.</li>
 *   <li>Deliver every observed frame to the registered {@link FrameHandler} without parsing it.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations may deliver frames on their own thread; lifecycle methods
 * are called from the recovery thread or the caller of {@code start}.</p>
 *
 * @since 0.1.0
 */
public interface DraftTransport extends AutoCloseable {
  /**
   * Registers the handler that receives frames and closure notifications.
   *
   * @param handler downstream handler; replaces any previous one
   */
  void setFrameHandler(FrameHandler handler);

  /**
   * Opens the connection.
   *
   * @param target transport specific address (URL, capture path)
   * @return {@code true} when connected
   * @throws Exception when the transport fails in a way it cannot express as {@code false}
   */
  boolean connect(String target) throws Exception;

  /**
   * Attempts to restore the current session without a full reconnect.
   *
   * @return {@code true} when the session is usable again
   * @throws Exception when the refresh fails unexpectedly
   */
  boolean refreshSession() throws Exception;

  /**
   * Closes the connection. Safe to call repeatedly.
   */
  @Override
  void close();
}
