package com.consullo.remoteterm.core.events;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Event sent from the engine to remote devices. The transport wraps it in its own envelope.
 *
 * @since 1.0
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = TerminalOutput.class, name = "output"),
    @JsonSubTypes.Type(value = OutputSkipped.class, name = "skipped"),
    @JsonSubTypes.Type(value = TerminalAttached.class, name = "attached"),
    @JsonSubTypes.Type(value = TerminalDetached.class, name = "detached"),
    @JsonSubTypes.Type(value = TerminalError.class, name = "error"),
    @JsonSubTypes.Type(value = TerminalNotification.class, name = "notification")
})
public interface TerminalEvent {

  /**
   * Session the event belongs to.
   *
   * @return session id
   */
  String sessionId();
}
