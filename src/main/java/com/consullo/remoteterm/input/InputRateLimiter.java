package com.consullo.remoteterm.input;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.LongSupplier;
import org.apache.commons.lang3.Validate;

/**
 * Sliding one-second window limiting how many input requests a session accepts.
 *
 * @since 1.0
 */
public final class InputRateLimiter {

  public static final int DEFAULT_PER_SECOND = 100;

  private static final long WINDOW_NANOS = 1_000_000_000L;

  private final int limitPerSecond;
  private final LongSupplier nanoClock;
  private final Map<String, Deque<Long>> windows = new ConcurrentHashMap<>();

  public InputRateLimiter(int limitPerSecond) {
    this(limitPerSecond, System::nanoTime);
  }

  /**
   * Creates a limiter with an explicit clock.
   *
   * @param limitPerSecond accepted inputs per session per second
   * @param nanoClock monotonic clock in nanoseconds
   */
  public InputRateLimiter(int limitPerSecond, LongSupplier nanoClock) {
    Validate.isTrue(limitPerSecond > 0, "limitPerSecond must be positive");
    Validate.notNull(nanoClock, "nanoClock must not be null");
    this.limitPerSecond = limitPerSecond;
    this.nanoClock = nanoClock;
  }

  /**
   * Records an input attempt for the session.
   *
   * @param sessionId session id
   * @return true if the attempt exceeds the limit and must be rejected
   */
  public boolean isLimited(String sessionId) {
    Deque<Long> window = windows.computeIfAbsent(sessionId, k -> new ArrayDeque<>());
    long now = nanoClock.getAsLong();
    synchronized (window) {
      while (!window.isEmpty() && now - window.peekFirst() >= WINDOW_NANOS) {
        window.removeFirst();
      }
      if (window.size() >= limitPerSecond) {
        return true;
      }
      window.addLast(now);
      return false;
    }
  }

  public void reset(String sessionId) {
    windows.remove(sessionId);
  }
}
