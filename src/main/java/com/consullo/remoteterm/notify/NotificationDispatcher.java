package com.consullo.remoteterm.notify;

import com.consullo.remoteterm.core.events.DeviceTransport;
import com.consullo.remoteterm.core.events.TerminalEventCodec;
import com.consullo.remoteterm.core.events.TerminalNotification;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.LongSupplier;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns one session's pattern matches into broadcast notifications, at most one per category per cooldown period.
 *
 * <p>
 * The cooldown decision is made synchronously so duplicates are suppressed exactly; the broadcast itself runs on the
 * supplied executor and its failures are only logged.
 * </p>
 *
 * @since 1.0
 */
public final class NotificationDispatcher {

  private static final Logger LOGGER = LoggerFactory.getLogger(NotificationDispatcher.class);

  private final String sessionId;
  private final long cooldownMillis;
  private final DeviceTransport transport;
  private final TerminalEventCodec codec;
  private final Executor broadcastExecutor;
  private final LongSupplier clockMillis;

  private final Map<NotificationCategory, Long> lastEmitted = new EnumMap<>(NotificationCategory.class);

  /**
   * Creates a dispatcher for one session.
   *
   * @param sessionId session the matches come from
   * @param config notification configuration (cooldown)
   * @param transport broadcast collaborator
   * @param codec event serializer
   * @param broadcastExecutor where broadcasts run
   * @param clockMillis wall clock in epoch milliseconds
   */
  public NotificationDispatcher(
      String sessionId,
      NotificationConfig config,
      DeviceTransport transport,
      TerminalEventCodec codec,
      Executor broadcastExecutor,
      LongSupplier clockMillis) {
    Validate.notBlank(sessionId, "sessionId must not be blank");
    Validate.notNull(config, "config must not be null");
    Validate.notNull(transport, "transport must not be null");
    Validate.notNull(codec, "codec must not be null");
    Validate.notNull(broadcastExecutor, "broadcastExecutor must not be null");
    Validate.notNull(clockMillis, "clockMillis must not be null");
    this.sessionId = sessionId;
    this.cooldownMillis = config.cooldownMillis();
    this.transport = transport;
    this.codec = codec;
    this.broadcastExecutor = broadcastExecutor;
    this.clockMillis = clockMillis;
  }

  /**
   * Broadcasts a notification for the match unless its category is cooling down.
   *
   * @param displayName session display name used in the title, falls back to the session id
   * @param match pattern match
   * @return true if a notification was emitted
   */
  public boolean maybeNotify(String displayName, MatchResult match) {
    Validate.notNull(match, "match must not be null");
    long now = clockMillis.getAsLong();

    synchronized (lastEmitted) {
      Long last = lastEmitted.get(match.category());
      if (last != null && now - last < cooldownMillis) {
        LOGGER.debug("Notification suppressed (cooldown): session={}, category={}, pattern={}",
            sessionId, match.category().wireName(), match.pattern());
        return false;
      }
      lastEmitted.put(match.category(), now);
    }

    String name = displayName == null || displayName.isBlank() ? sessionId : displayName;
    TerminalNotification event = new TerminalNotification(
        sessionId,
        match.category().wireName(),
        match.pattern(),
        name + ": " + match.category().title(),
        match.snippet(),
        now);

    try {
      broadcastExecutor.execute(() -> broadcast(event));
    } catch (RejectedExecutionException e) {
      LOGGER.warn("Notification for session {} dropped: executor rejected it", sessionId);
    }
    return true;
  }

  private void broadcast(TerminalNotification event) {
    try {
      transport.broadcast(codec.encode(event));
      LOGGER.info("Notification sent: session={}, category={}, snippet={}",
          sessionId, event.category(), event.snippet());
    } catch (Exception e) {
      LOGGER.warn("Failed to broadcast notification for session {}: {}", sessionId, e.getMessage(), e);
    }
  }

  /**
   * Milliseconds until the category may notify again.
   *
   * @param category category
   * @return remaining cooldown, 0 if not cooling down
   */
  public long cooldownRemainingMillis(NotificationCategory category) {
    synchronized (lastEmitted) {
      Long last = lastEmitted.get(category);
      if (last == null) {
        return 0L;
      }
      return Math.max(0L, cooldownMillis - (clockMillis.getAsLong() - last));
    }
  }

  public void clear() {
    synchronized (lastEmitted) {
      lastEmitted.clear();
    }
    LOGGER.debug("Cleared cooldown state for session {}", sessionId);
  }
}
