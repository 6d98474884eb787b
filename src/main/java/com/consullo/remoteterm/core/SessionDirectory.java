package com.consullo.remoteterm.core;

import java.util.Optional;

/**
 * Resolves session ids. Creating, renaming and killing sessions happen elsewhere.
 *
 * @since 1.0
 */
public interface SessionDirectory {

  /**
   * Looks up a session.
   *
   * @param sessionId session id
   * @return session info, empty if unknown
   */
  Optional<SessionInfo> lookup(String sessionId);
}
