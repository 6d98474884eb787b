package com.consullo.remoteterm.command;

import com.consullo.remoteterm.core.TerminalInput;
import java.util.OptionalLong;
import org.apache.commons.lang3.Validate;

/**
 * A request from a device, already decoded from the transport.
 *
 * @since 1.0
 */
public interface TerminalCommand {

  String sessionId();

  CommandType type();

  /**
   * Start streaming a session.
   *
   * @param sessionId session id
   * @param lastSeenSequence last sequence the device already has; absent for live output only, -1 for the whole
   * buffer
   */
  record Attach(String sessionId, OptionalLong lastSeenSequence) implements TerminalCommand {

    public Attach {
      Validate.notNull(lastSeenSequence, "lastSeenSequence must not be null");
    }

    public static Attach live(String sessionId) {
      return new Attach(sessionId, OptionalLong.empty());
    }

    public static Attach resume(String sessionId, long lastSeenSequence) {
      return new Attach(sessionId, OptionalLong.of(lastSeenSequence));
    }

    @Override
    public CommandType type() {
      return CommandType.ATTACH;
    }
  }

  record Detach(String sessionId) implements TerminalCommand {

    @Override
    public CommandType type() {
      return CommandType.DETACH;
    }
  }

  record Input(String sessionId, TerminalInput input) implements TerminalCommand {

    public Input {
      Validate.notNull(input, "input must not be null");
    }

    @Override
    public CommandType type() {
      return CommandType.INPUT;
    }
  }

  record Resize(String sessionId, int cols, int rows) implements TerminalCommand {

    @Override
    public CommandType type() {
      return CommandType.RESIZE;
    }
  }
}
