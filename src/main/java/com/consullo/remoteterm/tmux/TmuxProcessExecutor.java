package com.consullo.remoteterm.tmux;

import com.consullo.remoteterm.core.EngineConfig;
import com.consullo.remoteterm.core.ProcessExecutionException;
import com.consullo.remoteterm.core.ProcessExecutor;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ProcessExecutor} that drives tmux through its command line.
 *
 * <p>
 * Input is typed with {@code send-keys -l} so it is delivered literally and never interpreted as key names or shell
 * syntax. The tmux version is checked once, on first use.
 * </p>
 *
 * @since 1.0
 */
public final class TmuxProcessExecutor implements ProcessExecutor {

  private static final Logger LOGGER = LoggerFactory.getLogger(TmuxProcessExecutor.class);

  static final int MIN_MAJOR = 2;
  static final int MIN_MINOR = 1;

  private static final Pattern VERSION = Pattern.compile("(\\d+)\\.(\\d+)");
  private static final long DEFAULT_COMMAND_TIMEOUT_MILLIS = 5_000L;

  private final CommandRunner runner;
  private final String tmuxPath;
  private final String socketPath;

  private volatile boolean verified;

  /**
   * Creates an executor for the tmux binary and socket named in the configuration.
   *
   * @param config engine configuration
   */
  public TmuxProcessExecutor(EngineConfig config) {
    this(new ProcessCommandRunner(DEFAULT_COMMAND_TIMEOUT_MILLIS), config.tmuxPath(), config.tmuxSocketPath());
  }

  /**
   * @param runner runs tmux commands
   * @param tmuxPath tmux binary
   * @param socketPath socket of an isolated tmux server, or null for the default server
   */
  public TmuxProcessExecutor(CommandRunner runner, String tmuxPath, String socketPath) {
    Validate.notNull(runner, "runner must not be null");
    Validate.notBlank(tmuxPath, "tmuxPath must not be blank");
    this.runner = runner;
    this.tmuxPath = tmuxPath;
    this.socketPath = socketPath;
  }

  @Override
  public void sendKeys(String multiplexerName, byte[] keys) throws ProcessExecutionException {
    Validate.notBlank(multiplexerName, "multiplexerName must not be blank");
    Validate.notNull(keys, "keys must not be null");
    String text = decodeStrict(keys);
    verify();
    run("send-keys", "-t", multiplexerName, "-l", text);
  }

  @Override
  public void resize(String multiplexerName, int cols, int rows) throws ProcessExecutionException {
    Validate.notBlank(multiplexerName, "multiplexerName must not be blank");
    verify();
    run("resize-window", "-t", multiplexerName, "-x", Integer.toString(cols), "-y", Integer.toString(rows));
  }

  // send-keys -l types text, so a malformed byte would reach the pane as U+FFFD.
  private static String decodeStrict(byte[] keys) throws ProcessExecutionException {
    try {
      return StandardCharsets.UTF_8.newDecoder()
          .onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT)
          .decode(ByteBuffer.wrap(keys))
          .toString();
    } catch (CharacterCodingException e) {
      throw new ProcessExecutionException("Input is not valid UTF-8", e);
    }
  }

  /**
   * Checks that tmux is installed and recent enough. Only the first successful check runs tmux.
   *
   * @throws ProcessExecutionException if tmux is missing, its version is unreadable, or it is older than 2.1
   */
  public void verify() throws ProcessExecutionException {
    if (verified) {
      return;
    }
    String output = run("-V").strip();
    Matcher m = VERSION.matcher(output);
    if (!m.find()) {
      throw new ProcessExecutionException("Could not parse tmux version from: " + output);
    }
    int major = Integer.parseInt(m.group(1));
    int minor = Integer.parseInt(m.group(2));
    if (major < MIN_MAJOR || (major == MIN_MAJOR && minor < MIN_MINOR)) {
      throw new ProcessExecutionException(
          "tmux " + major + "." + minor + " is too old. Minimum required: " + MIN_MAJOR + "." + MIN_MINOR);
    }
    LOGGER.info("Using tmux {}.{} at {}", major, minor, tmuxPath);
    verified = true;
  }

  private String run(String... args) throws ProcessExecutionException {
    List<String> command = new ArrayList<>(args.length + 3);
    command.add(tmuxPath);
    if (socketPath != null && !socketPath.isBlank()) {
      command.add("-S");
      command.add(socketPath);
    }
    command.addAll(List.of(args));

    CommandRunner.Result result;
    try {
      result = runner.run(command);
    } catch (IOException e) {
      throw new ProcessExecutionException("tmux " + args[0] + " failed: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ProcessExecutionException("Interrupted running tmux " + args[0], e);
    }

    if (result.exitCode() != 0) {
      LOGGER.debug("tmux {} exited with {}: {}", args[0], result.exitCode(), result.stderr().strip());
      throw new ProcessExecutionException("Command failed: " + result.stderr().strip());
    }
    return result.stdout();
  }
}
