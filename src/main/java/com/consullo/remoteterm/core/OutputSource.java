package com.consullo.remoteterm.core;

/**
 * Capture mechanism (e.g. a multiplexer output-pipe hook) that delivers terminal output to a registered listener.
 *
 * @since 1.0
 */
public interface OutputSource {

  /**
   * Registers the listener that receives every captured chunk.
   *
   * @param listener output listener
   */
  void register(OutputListener listener);
}
