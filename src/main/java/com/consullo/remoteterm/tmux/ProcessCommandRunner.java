package com.consullo.remoteterm.tmux;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link CommandRunner} backed by {@link ProcessBuilder}.
 *
 * @since 1.0
 */
public final class ProcessCommandRunner implements CommandRunner {

  private static final Logger LOGGER = LoggerFactory.getLogger(ProcessCommandRunner.class);

  private final long timeoutMillis;

  /**
   * @param timeoutMillis how long to wait for the process before killing it
   */
  public ProcessCommandRunner(long timeoutMillis) {
    Validate.isTrue(timeoutMillis > 0, "timeoutMillis must be positive");
    this.timeoutMillis = timeoutMillis;
  }

  @Override
  public Result run(List<String> command) throws IOException, InterruptedException {
    Validate.notEmpty(command, "command must not be empty");

    Process process = new ProcessBuilder(command).start();
    process.getOutputStream().close();

    CompletableFuture<String> stdout = readAsync(process.getInputStream());
    CompletableFuture<String> stderr = readAsync(process.getErrorStream());

    if (!process.waitFor(timeoutMillis, TimeUnit.MILLISECONDS)) {
      process.destroyForcibly();
      throw new IOException("Command timed out after " + timeoutMillis + " ms: " + command.get(0));
    }

    try {
      return new Result(process.exitValue(), stdout.get(), stderr.get());
    } catch (ExecutionException e) {
      throw new IOException("Failed reading command output", e.getCause());
    }
  }

  private static CompletableFuture<String> readAsync(InputStream in) {
    return CompletableFuture.supplyAsync(() -> {
      try (InputStream stream = in) {
        return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
      } catch (IOException e) {
        LOGGER.debug("Reading process stream failed: {}", e.getMessage());
        throw new IllegalStateException(e);
      }
    });
  }
}
