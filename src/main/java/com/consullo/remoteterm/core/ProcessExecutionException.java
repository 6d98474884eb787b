package com.consullo.remoteterm.core;

/**
 * A multiplexer command failed.
 *
 * @since 1.0
 */
public class ProcessExecutionException extends Exception {

  private static final long serialVersionUID = 1L;

  public ProcessExecutionException(String message) {
    super(message);
  }

  public ProcessExecutionException(String message, Throwable cause) {
    super(message, cause);
  }
}
