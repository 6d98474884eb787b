package com.consullo.remoteterm.core;

/**
 * What the session directory knows about a session.
 *
 * @param multiplexerName name of the session inside the terminal multiplexer
 * @param status lifecycle status
 * @param displayName user-facing name (may be null)
 * @since 1.0
 */
public record SessionInfo(String multiplexerName, SessionStatus status, String displayName) {

  public SessionInfo {
    if (multiplexerName == null || status == null) {
      throw new IllegalArgumentException("multiplexerName/status must not be null.");
    }
  }
}
