package com.consullo.remoteterm.core.events;

/**
 * The device no longer receives output for the session.
 *
 * @param sessionId session id
 * @param reason {@link #USER_REQUEST} or {@link #SESSION_KILLED}
 * @since 1.0
 */
public record TerminalDetached(String sessionId, String reason) implements TerminalEvent {

  public static final String USER_REQUEST = "user_request";
  public static final String SESSION_KILLED = "session_killed";
}
