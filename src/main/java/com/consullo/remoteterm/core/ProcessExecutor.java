package com.consullo.remoteterm.core;

/**
 * Drives the terminal multiplexer that hosts the sessions.
 *
 * @since 1.0
 */
public interface ProcessExecutor {

  /**
   * Types raw bytes into the session as if entered on its keyboard.
   *
   * @param multiplexerName session name inside the multiplexer
   * @param keys raw bytes, sent literally; implementations that type text may reject bytes they cannot represent
   * @throws ProcessExecutionException if the multiplexer rejects the command or cannot represent {@code keys}
   */
  void sendKeys(String multiplexerName, byte[] keys) throws ProcessExecutionException;

  /**
   * Resizes the session's window.
   *
   * @param multiplexerName session name inside the multiplexer
   * @param cols columns
   * @param rows rows
   * @throws ProcessExecutionException if the multiplexer rejects the command
   */
  void resize(String multiplexerName, int cols, int rows) throws ProcessExecutionException;
}
