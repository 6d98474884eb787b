package com.consullo.remoteterm.core.events;

/**
 * A request from the device was rejected or failed.
 *
 * @param sessionId session id the request referred to (may be malformed)
 * @param code machine-readable error code
 * @param message human-readable description
 * @since 1.0
 */
public record TerminalError(String sessionId, String code, String message) implements TerminalEvent {

  public static final String SESSION_NOT_FOUND = "SESSION_NOT_FOUND";
  public static final String SESSION_KILLING = "SESSION_KILLING";
  public static final String NOT_ATTACHED = "NOT_ATTACHED";
  public static final String PIPE_ERROR = "PIPE_ERROR";
  public static final String RESIZE_FAILED = "RESIZE_FAILED";
  public static final String HANDLER_TIMEOUT = "HANDLER_TIMEOUT";
  public static final String HANDLER_FAILED = "HANDLER_FAILED";
}
