package com.consullo.remoteterm.core;

import com.consullo.remoteterm.buffer.ReplayBuffer;
import com.consullo.remoteterm.input.InputRateLimiter;
import com.consullo.remoteterm.notify.NotificationConfig;
import org.apache.commons.lang3.Validate;

/**
 * Engine settings.
 *
 * @param replayBufferBytes byte budget of each session's replay buffer
 * @param outboxCapacity events queued per attached device before output is dropped
 * @param handlerBudgetMillis time a device command handler may run before it is abandoned
 * @param inputRateLimitPerSecond input requests accepted per session per second
 * @param tmuxPath tmux binary
 * @param tmuxSocketPath tmux socket for an isolated server, or null for the default server
 * @param notifications notification detection settings
 * @since 1.0
 */
public record EngineConfig(
    long replayBufferBytes,
    int outboxCapacity,
    long handlerBudgetMillis,
    int inputRateLimitPerSecond,
    String tmuxPath,
    String tmuxSocketPath,
    NotificationConfig notifications) {

  public static final long DEFAULT_REPLAY_BUFFER_BYTES = ReplayBuffer.DEFAULT_MAX_BYTES;
  public static final int DEFAULT_OUTBOX_CAPACITY = 256;
  public static final long DEFAULT_HANDLER_BUDGET_MILLIS = 5_000L;
  public static final String DEFAULT_TMUX_PATH = "tmux";

  public EngineConfig {
    Validate.isTrue(replayBufferBytes > 0, "replayBufferBytes must be positive");
    Validate.isTrue(outboxCapacity > 1, "outboxCapacity must be greater than 1");
    Validate.isTrue(handlerBudgetMillis > 0, "handlerBudgetMillis must be positive");
    Validate.isTrue(inputRateLimitPerSecond > 0, "inputRateLimitPerSecond must be positive");
    Validate.notBlank(tmuxPath, "tmuxPath must not be blank");
    Validate.notNull(notifications, "notifications must not be null");
  }

  public static EngineConfig defaults() {
    return new EngineConfig(
        DEFAULT_REPLAY_BUFFER_BYTES,
        DEFAULT_OUTBOX_CAPACITY,
        DEFAULT_HANDLER_BUDGET_MILLIS,
        InputRateLimiter.DEFAULT_PER_SECOND,
        DEFAULT_TMUX_PATH,
        null,
        NotificationConfig.defaults());
  }

  public EngineConfig withReplayBufferBytes(long bytes) {
    return new EngineConfig(bytes, outboxCapacity, handlerBudgetMillis, inputRateLimitPerSecond, tmuxPath,
        tmuxSocketPath, notifications);
  }

  public EngineConfig withOutboxCapacity(int capacity) {
    return new EngineConfig(replayBufferBytes, capacity, handlerBudgetMillis, inputRateLimitPerSecond, tmuxPath,
        tmuxSocketPath, notifications);
  }

  public EngineConfig withNotifications(NotificationConfig config) {
    return new EngineConfig(replayBufferBytes, outboxCapacity, handlerBudgetMillis, inputRateLimitPerSecond, tmuxPath,
        tmuxSocketPath, config);
  }
}
