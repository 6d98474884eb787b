package com.consullo.remoteterm.core;

import com.consullo.remoteterm.buffer.OutputChunk;
import com.consullo.remoteterm.buffer.ReplayBuffer;
import com.consullo.remoteterm.buffer.ReplaySlice;
import com.consullo.remoteterm.core.events.DeviceTransport;
import com.consullo.remoteterm.core.events.OutputSkipped;
import com.consullo.remoteterm.core.events.TerminalAttached;
import com.consullo.remoteterm.core.events.TerminalDetached;
import com.consullo.remoteterm.core.events.TerminalError;
import com.consullo.remoteterm.core.events.TerminalEvent;
import com.consullo.remoteterm.core.events.TerminalEventCodec;
import com.consullo.remoteterm.core.events.TerminalOutput;
import com.consullo.remoteterm.input.InputRateLimiter;
import com.consullo.remoteterm.input.InputValidator;
import com.consullo.remoteterm.input.KeyEncoder;
import com.consullo.remoteterm.input.ValidationError;
import com.consullo.remoteterm.notify.MatchResult;
import com.consullo.remoteterm.notify.NotificationDispatcher;
import com.consullo.remoteterm.notify.PatternMatcher;
import com.consullo.remoteterm.notify.PatternSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.LongSupplier;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Streams terminal sessions to attached remote devices.
 *
 * <p>
 * Per session the manager owns a {@link ReplayBuffer}, the set of attached devices (one {@link DeviceOutbox} each),
 * a {@link PatternMatcher} and a {@link NotificationDispatcher}. State is created on the first attach or the first
 * output for a session the directory knows, and dropped when {@link #onSessionKilled(String)} is called.
 * </p>
 *
 * <p>
 * Flow:
 * <ul>
 * <li>Output: append to the buffer, fan out to every attached device, feed the matcher.</li>
 * <li>Attach: acknowledge, then replay everything after the device's last-seen sequence, preceded by
 * {@link OutputSkipped} when part of it was evicted.</li>
 * <li>Input: validate, encode logical keys, forward to the {@link ProcessExecutor}.</li>
 * </ul>
 * </p>
 *
 * <p>
 * Thread-safety: output may arrive on a capture thread while requests are handled elsewhere. Append, fan-out and
 * attach-replay for a session run under that session's monitor, so a device never sees a chunk twice or out of
 * order. Sends to devices happen on the delivery executor, never under a lock.
 * </p>
 *
 * @since 1.0
 */
public final class TerminalManager implements OutputListener, AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(TerminalManager.class);

  private final EngineConfig config;
  private final SessionDirectory directory;
  private final ProcessExecutor processExecutor;
  private final DeviceTransport transport;
  private final TerminalEventCodec codec;
  private final Executor deliveryExecutor;
  private final ExecutorService ownedExecutor;
  private final LongSupplier clockMillis;
  private final PatternSet patterns;
  private final InputRateLimiter rateLimiter;

  private final Map<String, SessionState> sessions = new ConcurrentHashMap<>();

  /**
   * Creates a manager with its own daemon delivery threads.
   *
   * @param config engine configuration
   * @param directory session directory
   * @param processExecutor multiplexer command executor
   * @param transport device transport
   * @return manager; call {@link #shutdown()} to release its threads
   */
  public static TerminalManager create(EngineConfig config, SessionDirectory directory,
      ProcessExecutor processExecutor, DeviceTransport transport) {
    ExecutorService executor = Executors.newCachedThreadPool(new DeliveryThreadFactory());
    return new TerminalManager(config, directory, processExecutor, transport, new TerminalEventCodec(), executor,
        executor, System::currentTimeMillis);
  }

  /**
   * Creates a manager that delivers on a caller-supplied executor.
   *
   * @param config engine configuration
   * @param directory session directory
   * @param processExecutor multiplexer command executor
   * @param transport device transport
   * @param codec event serializer
   * @param deliveryExecutor runs device sends and notification broadcasts
   * @param clockMillis wall clock in epoch milliseconds
   */
  public TerminalManager(EngineConfig config, SessionDirectory directory, ProcessExecutor processExecutor,
      DeviceTransport transport, TerminalEventCodec codec, Executor deliveryExecutor, LongSupplier clockMillis) {
    this(config, directory, processExecutor, transport, codec, deliveryExecutor, null, clockMillis);
  }

  private TerminalManager(EngineConfig config, SessionDirectory directory, ProcessExecutor processExecutor,
      DeviceTransport transport, TerminalEventCodec codec, Executor deliveryExecutor, ExecutorService ownedExecutor,
      LongSupplier clockMillis) {
    Validate.notNull(config, "config must not be null");
    Validate.notNull(directory, "directory must not be null");
    Validate.notNull(processExecutor, "processExecutor must not be null");
    Validate.notNull(transport, "transport must not be null");
    Validate.notNull(codec, "codec must not be null");
    Validate.notNull(deliveryExecutor, "deliveryExecutor must not be null");
    Validate.notNull(clockMillis, "clockMillis must not be null");
    this.config = config;
    this.directory = directory;
    this.processExecutor = processExecutor;
    this.transport = transport;
    this.codec = codec;
    this.deliveryExecutor = deliveryExecutor;
    this.ownedExecutor = ownedExecutor;
    this.clockMillis = clockMillis;
    this.patterns = PatternSet.compile(config.notifications());
    this.rateLimiter = new InputRateLimiter(config.inputRateLimitPerSecond());
  }

  /**
   * Registers this manager as the output source's listener.
   *
   * @param source capture mechanism
   */
  public void bind(OutputSource source) {
    Validate.notNull(source, "source must not be null");
    source.register(this);
  }

  /**
   * Attaches a device without replay; it receives live output from now on.
   *
   * @param sessionId session id
   * @param deviceId device id
   */
  public void attach(String sessionId, String deviceId) {
    attach(sessionId, deviceId, OptionalLong.empty());
  }

  /**
   * Attaches a device to a session's live output.
   *
   * @param sessionId session id
   * @param deviceId device id
   * @param lastSeenSequence last sequence the device already has; when present everything after it that is still
   * buffered is replayed. {@code -1} replays the whole buffer.
   */
  public void attach(String sessionId, String deviceId, OptionalLong lastSeenSequence) {
    Validate.notBlank(deviceId, "deviceId must not be blank");
    Validate.notNull(lastSeenSequence, "lastSeenSequence must not be null");

    Optional<ValidationError> invalid = InputValidator.validateSessionId(sessionId);
    if (invalid.isPresent()) {
      sendError(deviceId, sessionId, invalid.get().code(), invalid.get().message());
      return;
    }

    Optional<SessionInfo> info = directory.lookup(sessionId);
    if (info.isEmpty()) {
      sendError(deviceId, sessionId, TerminalError.SESSION_NOT_FOUND, "Session not found");
      return;
    }
    if (info.get().status() == SessionStatus.KILLING) {
      sendError(deviceId, sessionId, TerminalError.SESSION_KILLING, "Session is being killed");
      return;
    }

    SessionState state = sessions.computeIfAbsent(sessionId, id -> newSessionState(id, info.get()));

    int replayed = 0;
    synchronized (state) {
      DeviceOutbox outbox = state.attachments().get(deviceId);
      if (outbox == null) {
        outbox = new DeviceOutbox(sessionId, deviceId, config.outboxCapacity(), transport, codec, deliveryExecutor);
        state.attachments().put(deviceId, outbox);
      }

      ReplayBuffer buffer = state.buffer();
      enqueue(outbox, new TerminalAttached(sessionId, buffer.startSequence(), buffer.currentSequence()));

      if (lastSeenSequence.isPresent()) {
        long lastSeen = lastSeenSequence.getAsLong();
        // A device may claim more than was ever produced; it has nothing to catch up on.
        long from = lastSeen < buffer.currentSequence() ? Math.max(0L, lastSeen + 1) : buffer.currentSequence();
        ReplaySlice slice = buffer.getFrom(from);
        List<OutputChunk> chunks = slice.chunks();
        if (slice.hasGap()) {
          long gapFrom = slice.gapFrom().getAsLong();
          long gapTo = chunks.get(0).sequence() - 1;
          LOGGER.info("Device {} missed evicted output {}..{} of session {}", deviceId, gapFrom, gapTo, sessionId);
          enqueue(outbox, new OutputSkipped(sessionId, gapFrom, gapTo));
        }
        for (OutputChunk chunk : chunks) {
          enqueue(outbox, new TerminalOutput(sessionId, chunk.sequence(), chunk.data()));
        }
        replayed = chunks.size();
      }
    }

    LOGGER.info("Device {} attached to session {} ({} chunks replayed)", deviceId, sessionId, replayed);
  }

  /**
   * Detaches a device. Buffer and matcher state are kept for a later reconnect.
   *
   * @param sessionId session id
   * @param deviceId device id
   */
  public void detach(String sessionId, String deviceId) {
    Validate.notBlank(deviceId, "deviceId must not be blank");
    TerminalDetached detached = new TerminalDetached(sessionId, TerminalDetached.USER_REQUEST);

    SessionState state = sessionId != null ? sessions.get(sessionId) : null;
    DeviceOutbox outbox = null;
    if (state != null) {
      synchronized (state) {
        outbox = state.detach(deviceId);
        if (outbox != null) {
          enqueue(outbox, detached);
          outbox.close();
        }
      }
    }

    if (outbox == null) {
      sendDirect(deviceId, detached);
    } else {
      LOGGER.info("Device {} detached from session {}", deviceId, sessionId);
    }
  }

  /**
   * Forwards device input to the session.
   *
   * @param sessionId session id
   * @param deviceId originating device; errors are reported to it only
   * @param input raw bytes or a logical key
   */
  public void handleInput(String sessionId, String deviceId, TerminalInput input) {
    Validate.notBlank(deviceId, "deviceId must not be blank");
    Validate.notNull(input, "input must not be null");

    Optional<ValidationError> invalid = InputValidator.validateSessionId(sessionId);
    if (invalid.isPresent()) {
      sendError(deviceId, sessionId, invalid.get().code(), invalid.get().message());
      return;
    }

    SessionState state = sessions.get(sessionId);
    if (state == null || !state.isAttached(deviceId)) {
      sendError(deviceId, sessionId, TerminalError.NOT_ATTACHED, "Not attached to session");
      return;
    }

    Optional<SessionInfo> info = directory.lookup(sessionId);
    if (info.isEmpty()) {
      sendError(deviceId, sessionId, TerminalError.SESSION_NOT_FOUND, "Session not found");
      return;
    }

    if (rateLimiter.isLimited(sessionId)) {
      sendError(deviceId, sessionId, ValidationError.RATE_LIMITED, "Too many inputs, slow down");
      return;
    }

    byte[] bytes;
    if (input.isKey()) {
      bytes = KeyEncoder.encode(input.key(), input.modifiers());
      if (bytes.length == 0) {
        LOGGER.warn("Ignoring unknown key {} from device {}", input.key(), deviceId);
        return;
      }
    } else {
      invalid = InputValidator.validateInput(input.data());
      if (invalid.isPresent()) {
        sendError(deviceId, sessionId, invalid.get().code(), invalid.get().message());
        return;
      }
      bytes = input.data();
      if (bytes.length == 0) {
        return;
      }
    }

    try {
      processExecutor.sendKeys(info.get().multiplexerName(), bytes);
    } catch (ProcessExecutionException e) {
      LOGGER.error("Failed to send keys to session {}: {}", sessionId, e.getMessage(), e);
      sendError(deviceId, sessionId, TerminalError.PIPE_ERROR, "Input failed: " + e.getMessage());
    }
  }

  /**
   * Resizes the session's window.
   *
   * @param sessionId session id
   * @param deviceId originating device; errors are reported to it only
   * @param cols columns
   * @param rows rows
   */
  public void handleResize(String sessionId, String deviceId, int cols, int rows) {
    Validate.notBlank(deviceId, "deviceId must not be blank");

    Optional<SessionInfo> info = sessionId != null ? directory.lookup(sessionId) : Optional.empty();
    if (info.isEmpty()) {
      sendError(deviceId, sessionId, TerminalError.SESSION_NOT_FOUND, "Session not found");
      return;
    }

    try {
      processExecutor.resize(info.get().multiplexerName(), cols, rows);
    } catch (ProcessExecutionException e) {
      LOGGER.error("Failed to resize session {} to {}x{}: {}", sessionId, cols, rows, e.getMessage(), e);
      sendError(deviceId, sessionId, TerminalError.RESIZE_FAILED, "Resize failed: " + e.getMessage());
    }
  }

  /**
   * Receives captured output: buffers it, fans it out and scans it for notifications.
   *
   * @param sessionId session id
   * @param data raw output bytes
   */
  @Override
  public void onOutput(String sessionId, byte[] data) {
    if (sessionId == null || data == null || data.length == 0) {
      return;
    }

    SessionState state = sessions.get(sessionId);
    if (state == null) {
      state = stateForUnseenSession(sessionId);
      if (state == null) {
        return;
      }
    }

    synchronized (state) {
      if (sessions.get(sessionId) != state) {
        return;
      }
      long sequence = state.buffer().append(data);
      if (!state.attachments().isEmpty()) {
        TerminalOutput event = new TerminalOutput(sessionId, sequence, data);
        byte[] payload = codec.encode(event);
        for (DeviceOutbox outbox : state.attachments().values()) {
          outbox.offer(event, payload);
        }
      }
    }

    scanForNotifications(state, data);
  }

  /**
   * Tears down a session that was killed: attached devices are told, and all buffered and matcher state is
   * dropped. Later calls for the id behave as for an unknown session.
   *
   * @param sessionId session id
   */
  public void onSessionKilled(String sessionId) {
    if (sessionId == null) {
      return;
    }
    rateLimiter.reset(sessionId);
    SessionState state = sessions.remove(sessionId);
    if (state == null) {
      return;
    }

    int notified;
    synchronized (state) {
      List<DeviceOutbox> outboxes = state.detachAll();
      TerminalDetached detached = new TerminalDetached(sessionId, TerminalDetached.SESSION_KILLED);
      for (DeviceOutbox outbox : outboxes) {
        enqueue(outbox, detached);
        outbox.close();
      }
      notified = outboxes.size();
      state.buffer().clear();
    }
    state.matcher().reset();
    state.dispatcher().clear();

    LOGGER.info("Session {} torn down, {} devices notified", sessionId, notified);
  }

  /**
   * Drops a device whose connection closed from every session. Buffers are kept.
   *
   * @param deviceId device id
   */
  public void onConnectionClosed(String deviceId) {
    if (deviceId == null) {
      return;
    }
    for (SessionState state : sessions.values()) {
      synchronized (state) {
        DeviceOutbox outbox = state.detach(deviceId);
        if (outbox != null) {
          outbox.close();
          LOGGER.debug("Connection {} closed, detached from session {}", deviceId, state.sessionId());
        }
      }
    }
  }

  /**
   * Drops all session state and stops owned delivery threads.
   */
  public void shutdown() {
    for (SessionState state : sessions.values()) {
      synchronized (state) {
        for (DeviceOutbox outbox : state.detachAll()) {
          outbox.close();
        }
        state.buffer().clear();
      }
    }
    sessions.clear();
    if (ownedExecutor != null) {
      ownedExecutor.shutdown();
    }
    LOGGER.info("Terminal manager shut down");
  }

  @Override
  public void close() {
    shutdown();
  }

  public int attachmentCount(String sessionId) {
    SessionState state = sessionId != null ? sessions.get(sessionId) : null;
    return state != null ? state.attachmentCount() : 0;
  }

  public boolean isSessionAttached(String sessionId) {
    return attachmentCount(sessionId) > 0;
  }

  /**
   * Finds a session the device is attached to.
   *
   * @param deviceId device id
   * @return session id, empty if the device is not attached anywhere
   */
  public Optional<String> attachedSession(String deviceId) {
    for (SessionState state : sessions.values()) {
      if (state.isAttached(deviceId)) {
        return Optional.of(state.sessionId());
      }
    }
    return Optional.empty();
  }

  public boolean hasSession(String sessionId) {
    return sessionId != null && sessions.containsKey(sessionId);
  }

  /**
   * The session's replay buffer, for inspection.
   *
   * @param sessionId session id
   * @return buffer, empty if the session has no state
   */
  public Optional<ReplayBuffer> replayBuffer(String sessionId) {
    SessionState state = sessionId != null ? sessions.get(sessionId) : null;
    return state != null ? Optional.of(state.buffer()) : Optional.empty();
  }

  private SessionState stateForUnseenSession(String sessionId) {
    Optional<SessionInfo> info = directory.lookup(sessionId);
    if (info.isEmpty() || info.get().status() == SessionStatus.KILLING) {
      LOGGER.debug("Ignoring output for unknown or dying session {}", sessionId);
      return null;
    }
    return sessions.computeIfAbsent(sessionId, id -> newSessionState(id, info.get()));
  }

  private SessionState newSessionState(String sessionId, SessionInfo info) {
    NotificationDispatcher dispatcher = new NotificationDispatcher(sessionId, config.notifications(), transport, codec,
        deliveryExecutor, clockMillis);
    LOGGER.info("Tracking session {} ({})", sessionId, info.multiplexerName());
    return new SessionState(sessionId, info.displayName(), new ReplayBuffer(config.replayBufferBytes()),
        new PatternMatcher(patterns), dispatcher);
  }

  private void scanForNotifications(SessionState state, byte[] data) {
    if (sessions.get(state.sessionId()) != state) {
      return;
    }
    try {
      for (MatchResult match : state.matcher().processChunk(data)) {
        state.dispatcher().maybeNotify(state.displayName(), match);
      }
    } catch (RuntimeException e) {
      LOGGER.warn("Notification scan failed for session {}: {}", state.sessionId(), e.getMessage(), e);
    }
  }

  private void enqueue(DeviceOutbox outbox, TerminalEvent event) {
    outbox.offerUnbounded(event, codec.encode(event));
  }

  /**
   * Sends a {@link TerminalError} to one device.
   *
   * @param deviceId device id
   * @param sessionId session the failed request referred to
   * @param code error code
   * @param message description
   */
  public void sendError(String deviceId, String sessionId, String code, String message) {
    LOGGER.debug("Reporting {} to device {} for session {}: {}", code, deviceId, sessionId, message);
    sendDirect(deviceId, new TerminalError(sessionId, code, message));
  }

  private void sendDirect(String deviceId, TerminalEvent event) {
    byte[] payload = codec.encode(event);
    try {
      deliveryExecutor.execute(() -> {
        try {
          transport.send(deviceId, payload);
        } catch (Exception e) {
          LOGGER.warn("Send to device {} failed: {}", deviceId, e.getMessage());
        }
      });
    } catch (RejectedExecutionException e) {
      LOGGER.warn("Delivery executor rejected {} for device {}", event.getClass().getSimpleName(), deviceId);
    }
  }

  private static final class DeliveryThreadFactory implements ThreadFactory {

    private final AtomicInteger counter = new AtomicInteger();

    @Override
    public Thread newThread(Runnable r) {
      Thread t = new Thread(r, "TerminalDelivery-" + counter.incrementAndGet());
      t.setDaemon(true);
      return t;
    }
  }
}
