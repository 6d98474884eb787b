package com.consullo.remoteterm.core;

/**
 * Receives raw terminal output from the capture mechanism. Calls for one session arrive in order; calls for
 * different sessions may interleave or arrive on different threads.
 *
 * @since 1.0
 */
@FunctionalInterface
public interface OutputListener {

  void onOutput(String sessionId, byte[] data);
}
