package com.consullo.remoteterm.tmux;

import java.io.IOException;
import java.util.List;

/**
 * Runs an external command to completion.
 *
 * @since 1.0
 */
@FunctionalInterface
public interface CommandRunner {

  /**
   * Output of a finished command.
   *
   * @param exitCode process exit code
   * @param stdout standard output, UTF-8
   * @param stderr standard error, UTF-8
   */
  record Result(int exitCode, String stdout, String stderr) {
  }

  /**
   * Runs the command and waits for it to exit.
   *
   * @param command program and arguments
   * @return exit code and captured output
   * @throws IOException if the process cannot be started or does not finish in time
   * @throws InterruptedException if interrupted while waiting
   */
  Result run(List<String> command) throws IOException, InterruptedException;
}
