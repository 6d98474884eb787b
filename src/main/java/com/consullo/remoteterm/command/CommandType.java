package com.consullo.remoteterm.command;

/**
 * Kinds of request a device can send about a terminal session.
 *
 * @since 1.0
 */
public enum CommandType {
  ATTACH,
  DETACH,
  INPUT,
  RESIZE
}
