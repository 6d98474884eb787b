package com.consullo.remoteterm.command;

import com.consullo.remoteterm.core.TerminalManager;
import com.consullo.remoteterm.core.events.TerminalError;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dispatches device commands to the {@link TerminalManager}.
 *
 * <p>
 * Handlers are looked up by {@link CommandType} in a table built once at construction. Each command runs on the
 * router's executor and the caller waits at most the handler budget; a timeout or failure is reported to the device
 * as a {@link TerminalError}.
 * </p>
 *
 * @since 1.0
 */
public final class CommandRouter {

  private static final Logger LOGGER = LoggerFactory.getLogger(CommandRouter.class);

  private final TerminalManager manager;
  private final ExecutorService executor;
  private final long budgetMillis;
  private final Map<CommandType, CommandHandler> handlers = new EnumMap<>(CommandType.class);

  /**
   * Creates a router with the standard handler table.
   *
   * @param manager terminal manager the commands act on
   * @param executor where handlers run
   * @param budgetMillis how long {@link #route} waits for a handler
   */
  public CommandRouter(TerminalManager manager, ExecutorService executor, long budgetMillis) {
    this(manager, executor, budgetMillis, standardHandlers(manager));
  }

  /**
   * Creates a router with an explicit handler table. Types missing from the table are ignored.
   *
   * @param manager terminal manager, used to report errors
   * @param executor where handlers run
   * @param budgetMillis how long {@link #route} waits for a handler
   * @param handlers handler per command type
   */
  public CommandRouter(TerminalManager manager, ExecutorService executor, long budgetMillis,
      Map<CommandType, CommandHandler> handlers) {
    Validate.notNull(manager, "manager must not be null");
    Validate.notNull(executor, "executor must not be null");
    Validate.isTrue(budgetMillis > 0, "budgetMillis must be positive");
    Validate.notNull(handlers, "handlers must not be null");
    this.manager = manager;
    this.executor = executor;
    this.budgetMillis = budgetMillis;
    this.handlers.putAll(handlers);
  }

  private static Map<CommandType, CommandHandler> standardHandlers(TerminalManager manager) {
    Validate.notNull(manager, "manager must not be null");
    Map<CommandType, CommandHandler> table = new EnumMap<>(CommandType.class);
    table.put(CommandType.ATTACH, (deviceId, command) -> {
      TerminalCommand.Attach attach = (TerminalCommand.Attach) command;
      manager.attach(attach.sessionId(), deviceId, attach.lastSeenSequence());
    });
    table.put(CommandType.DETACH, (deviceId, command) -> manager.detach(command.sessionId(), deviceId));
    table.put(CommandType.INPUT, (deviceId, command) -> {
      TerminalCommand.Input input = (TerminalCommand.Input) command;
      manager.handleInput(input.sessionId(), deviceId, input.input());
    });
    table.put(CommandType.RESIZE, (deviceId, command) -> {
      TerminalCommand.Resize resize = (TerminalCommand.Resize) command;
      manager.handleResize(resize.sessionId(), deviceId, resize.cols(), resize.rows());
    });
    return table;
  }

  /**
   * Runs the command's handler and waits for it within the handler budget.
   *
   * @param deviceId originating device
   * @param command decoded command
   * @return true if the handler completed normally
   */
  public boolean route(String deviceId, TerminalCommand command) {
    Validate.notBlank(deviceId, "deviceId must not be blank");
    Validate.notNull(command, "command must not be null");

    CommandHandler handler = handlers.get(command.type());
    if (handler == null) {
      LOGGER.warn("No handler for command type {} from device {}", command.type(), deviceId);
      return false;
    }

    Future<?> future;
    try {
      future = executor.submit(() -> {
        handler.handle(deviceId, command);
        return null;
      });
    } catch (RejectedExecutionException e) {
      LOGGER.error("Command {} from device {} rejected by executor", command.type(), deviceId);
      manager.sendError(deviceId, command.sessionId(), TerminalError.HANDLER_FAILED, "Server is shutting down");
      return false;
    }

    try {
      future.get(budgetMillis, TimeUnit.MILLISECONDS);
      return true;
    } catch (TimeoutException e) {
      future.cancel(true);
      LOGGER.error("Command {} from device {} timed out after {} ms", command.type(), deviceId, budgetMillis);
      manager.sendError(deviceId, command.sessionId(), TerminalError.HANDLER_TIMEOUT,
          "Request timed out after " + budgetMillis + " ms");
      return false;
    } catch (ExecutionException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      LOGGER.error("Command {} from device {} failed: {}", command.type(), deviceId, cause.getMessage(), cause);
      manager.sendError(deviceId, command.sessionId(), TerminalError.HANDLER_FAILED,
          "Request failed: " + cause.getMessage());
      return false;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      future.cancel(true);
      LOGGER.warn("Interrupted while waiting for command {} from device {}", command.type(), deviceId);
      return false;
    }
  }
}
