package io.draftops.draftline.infrastructure.transport;

import io.draftops.draftline.application.port.ClockPort;
import io.draftops.draftline.application.port.DraftTransport;
import io.draftops.draftline.application.port.FrameHandler;
import io.draftops.draftline.domain.net.FrameDirection;
import io.draftops.draftline.domain.net.TransportFrame;
import io.draftops.draftline.logging.Logs;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link DraftTransport} that replays a recorded capture file.
 * <p>Each line is either {@code RECV<TAB>frame}, {@code SENT<TAB>frame} or a bare frame (treated as received).
 * Blank lines and lines starting with {@code #} are skipped, except {@code #DISCONNECT [reason]}, which
 * simulates a dropped connection. Reconnecting to the same target resumes after the last delivered line.</p>
 * <p>Frames are delivered on a daemon thread named {@code draftline-replay}.</p>
 *
 * @since 0.1.0
 */
public final class CaptureReplayTransport implements DraftTransport {
  private static final Logger log = LoggerFactory.getLogger(CaptureReplayTransport.class);
  private static final String DISCONNECT_DIRECTIVE = "#DISCONNECT";
  private static final long JOIN_TIMEOUT_MILLIS = 2_000L;

  private final ClockPort clock;
  private final Duration frameDelay;
  private final AtomicInteger position = new AtomicInteger();
  private final Object finishedMonitor = new Object();

  private volatile FrameHandler handler = frame -> {};
  private volatile List<Entry> entries = List.of();
  private String loadedTarget;
  private Thread replayThread;

  /**
   * @param clock timestamps delivered frames
   * @param frameDelay pause between frames; zero replays as fast as possible
   */
  public CaptureReplayTransport(ClockPort clock, Duration frameDelay) {
    this.clock = Objects.requireNonNull(clock, "clock");
    this.frameDelay = Objects.requireNonNull(frameDelay, "frameDelay");
  }

  @Override
  public void setFrameHandler(FrameHandler handler) {
    this.handler = Objects.requireNonNull(handler, "handler");
  }

  /**
   * Loads {@code target} (a capture path) on first use and starts delivering frames.
   *
   * @param target capture file path
   * @return {@code true} once the replay thread runs
   * @throws IOException when the capture cannot be read
   */
  @Override
  public synchronized boolean connect(String target) throws IOException {
    Objects.requireNonNull(target, "target");
    if (replayThread != null && replayThread.isAlive()) {
      return true;
    }
    if (!target.equals(loadedTarget)) {
      entries = load(Path.of(target));
      loadedTarget = target;
      position.set(0);
      log.info("Loaded {} capture lines from {}", entries.size(), target);
    }
    Thread thread = new Thread(this::replay, "draftline-replay");
    thread.setDaemon(true);
    replayThread = thread;
    thread.start();
    return true;
  }

  /**
   * Replay cannot refresh a session in place.
   *
   * @return always {@code false}
   */
  @Override
  public boolean refreshSession() {
    return false;
  }

  @Override
  public synchronized void close() {
    Thread thread = replayThread;
    replayThread = null;
    if (thread == null || thread == Thread.currentThread()) {
      return;
    }
    thread.interrupt();
    try {
      thread.join(JOIN_TIMEOUT_MILLIS);
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
    }
  }

  /**
   * Waits until every capture line has been delivered.
   *
   * @param timeout maximum wait
   * @return {@code true} when the capture is exhausted
   * @throws InterruptedException when interrupted
   */
  public boolean awaitExhausted(Duration timeout) throws InterruptedException {
    long deadline = System.nanoTime() + timeout.toNanos();
    synchronized (finishedMonitor) {
      while (!exhausted()) {
        long remainingMillis = Duration.ofNanos(deadline - System.nanoTime()).toMillis();
        if (remainingMillis <= 0) {
          return false;
        }
        finishedMonitor.wait(remainingMillis);
      }
    }
    return true;
  }

  /**
   * @return {@code true} when every loaded line has been consumed
   */
  public boolean exhausted() {
    return loadedTarget != null && position.get() >= entries.size();
  }

  private void replay() {
    List<Entry> lines = entries;
    try {
      while (!Thread.currentThread().isInterrupted()) {
        int index = position.get();
        if (index >= lines.size()) {
          break;
        }
        Entry entry = lines.get(index);
        if (entry.disconnect()) {
          position.set(index + 1);
          log.info("Capture requests disconnect at entry {}: {}", index + 1, entry.payload());
          handler.onClosed(entry.payload());
          return;
        }
        try {
          handler.onFrame(new TransportFrame(entry.direction(), entry.payload(), clock.nowMillis()));
        } catch (RuntimeException ex) {
          log.warn("Frame handler failed on {}", Logs.truncate(entry.payload(), 128), ex);
        }
        position.set(index + 1);
        if (!frameDelay.isZero()) {
          Thread.sleep(frameDelay.toMillis());
        }
      }
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
    } finally {
      synchronized (finishedMonitor) {
        finishedMonitor.notifyAll();
      }
    }
  }

  static List<Entry> load(Path capture) throws IOException {
    List<Entry> result = new ArrayList<>();
    for (String line : Files.readAllLines(capture, StandardCharsets.UTF_8)) {
      String trimmed = line.strip();
      if (trimmed.isEmpty()) {
        continue;
      }
      if (trimmed.toUpperCase(Locale.ROOT).startsWith(DISCONNECT_DIRECTIVE)) {
        String reason = trimmed.substring(DISCONNECT_DIRECTIVE.length()).strip();
        result.add(new Entry(FrameDirection.RECEIVED, reason.isEmpty() ? "capture disconnect" : reason, true));
        continue;
      }
      if (trimmed.startsWith("#")) {
        continue;
      }
      int tab = trimmed.indexOf('\t');
      if (tab > 0) {
        String marker = trimmed.substring(0, tab).toUpperCase(Locale.ROOT);
        String payload = trimmed.substring(tab + 1);
        if ("RECV".equals(marker)) {
          result.add(new Entry(FrameDirection.RECEIVED, payload, false));
          continue;
        }
        if ("SENT".equals(marker)) {
          result.add(new Entry(FrameDirection.SENT, payload, false));
          continue;
        }
      }
      result.add(new Entry(FrameDirection.RECEIVED, trimmed, false));
    }
    return result;
  }

  record Entry(FrameDirection direction, String payload, boolean disconnect) {}
}
