package com.consullo.remoteterm.command;

/**
 * Executes one kind of {@link TerminalCommand} on behalf of a device.
 *
 * @since 1.0
 */
@FunctionalInterface
public interface CommandHandler {

  void handle(String deviceId, TerminalCommand command) throws Exception;
}
