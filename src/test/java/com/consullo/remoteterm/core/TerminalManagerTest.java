package com.consullo.remoteterm.core;

import com.consullo.remoteterm.core.events.DeviceTransport;
import com.consullo.remoteterm.core.events.OutputSkipped;
import com.consullo.remoteterm.core.events.TerminalAttached;
import com.consullo.remoteterm.core.events.TerminalDetached;
import com.consullo.remoteterm.core.events.TerminalError;
import com.consullo.remoteterm.core.events.TerminalEvent;
import com.consullo.remoteterm.core.events.TerminalEventCodec;
import com.consullo.remoteterm.core.events.TerminalNotification;
import com.consullo.remoteterm.core.events.TerminalOutput;
import com.consullo.remoteterm.input.KeyEncoder;
import com.consullo.remoteterm.input.KeyType;
import com.consullo.remoteterm.input.ValidationError;
import com.consullo.remoteterm.notify.NotificationConfig;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;
import java.util.stream.LongStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Tests for attach, replay, input forwarding and teardown, mostly driven synchronously through a direct executor.
 *
 * @since 1.0
 */
public class TerminalManagerTest {

  private static final String SESSION = "abcdef123456";
  private static final String TMUX_NAME = "build-1";
  private static final String DEVICE = "phone";

  private final TerminalEventCodec codec = new TerminalEventCodec();
  private final Map<String, SessionInfo> sessions = new HashMap<>();
  private final AtomicLong clock = new AtomicLong(10_000L);

  private RecordingTransport transport;
  private ProcessExecutor processExecutor;
  private TerminalManager manager;

  @BeforeEach
  void setUp() {
    sessions.put(SESSION, new SessionInfo(TMUX_NAME, SessionStatus.ACTIVE, "build"));
    transport = new RecordingTransport();
    processExecutor = mock(ProcessExecutor.class);
    manager = newManager(EngineConfig.defaults());
  }

  private TerminalManager newManager(EngineConfig config) {
    return new TerminalManager(config, id -> Optional.ofNullable(sessions.get(id)), processExecutor, transport,
        codec, Runnable::run, clock::get);
  }

  private static byte[] utf8(String s) {
    return s.getBytes(StandardCharsets.UTF_8);
  }

  private static List<Long> outputSequences(List<TerminalEvent> events) {
    final List<Long> out = new ArrayList<>();
    for (TerminalEvent e : events) {
      if (e instanceof TerminalOutput output) {
        out.add(output.sequence());
      }
    }
    return out;
  }

  @Test
  @DisplayName("Should report an unknown session and create no state")
  void attach_UnknownSession_ReportsNotFound() {
    manager.attach("zzzzzz999999", DEVICE);

    assertThat(transport.events(DEVICE)).singleElement()
        .isEqualTo(new TerminalError("zzzzzz999999", TerminalError.SESSION_NOT_FOUND, "Session not found"));
    assertThat(manager.hasSession("zzzzzz999999")).isFalse();
  }

  @Test
  @DisplayName("Should reject a malformed session id")
  void attach_InvalidSessionId_ReportsValidationError() {
    manager.attach("../../etc", DEVICE);

    assertThat(transport.events(DEVICE)).singleElement()
        .extracting(e -> ((TerminalError) e).code()).isEqualTo(ValidationError.INVALID_SESSION_ID);
  }

  @Test
  @DisplayName("Should refuse to attach to a session that is being killed")
  void attach_KillingSession_ReportsKilling() {
    sessions.put(SESSION, new SessionInfo(TMUX_NAME, SessionStatus.KILLING, null));

    manager.attach(SESSION, DEVICE);

    assertThat(transport.events(DEVICE)).singleElement()
        .extracting(e -> ((TerminalError) e).code()).isEqualTo(TerminalError.SESSION_KILLING);
    assertThat(manager.hasSession(SESSION)).isFalse();
  }

  @Test
  @DisplayName("Should acknowledge the attach and stream live output")
  void attach_ThenOutput_DeliversLiveOutput() {
    manager.attach(SESSION, DEVICE);
    manager.onOutput(SESSION, utf8("hello"));

    final List<TerminalEvent> events = transport.events(DEVICE);
    assertThat(events).hasSize(2);
    assertThat(events.get(0)).isEqualTo(new TerminalAttached(SESSION, 0L, 0L));
    assertThat(((TerminalOutput) events.get(1)).sequence()).isZero();
    assertThat(((TerminalOutput) events.get(1)).data()).isEqualTo(utf8("hello"));
    assertThat(manager.isSessionAttached(SESSION)).isTrue();
    assertThat(manager.attachedSession(DEVICE)).contains(SESSION);
  }

  @Test
  @DisplayName("Should replay only unseen chunks to a device that reattaches")
  void attach_ReattachWithLastSeen_ReplaysRemainderWithoutGap() {
    manager.attach(SESSION, DEVICE);
    manager.onOutput(SESSION, utf8("one"));
    manager.onOutput(SESSION, utf8("two"));
    manager.onOutput(SESSION, utf8("three"));
    manager.detach(SESSION, DEVICE);
    transport.clear();

    manager.attach(SESSION, DEVICE, OptionalLong.of(1L));

    final List<TerminalEvent> events = transport.events(DEVICE);
    assertThat(events.get(0)).isEqualTo(new TerminalAttached(SESSION, 0L, 3L));
    assertThat(events).noneMatch(e -> e instanceof OutputSkipped);
    assertThat(outputSequences(events)).containsExactly(2L);
    assertThat(((TerminalOutput) events.get(1)).data()).isEqualTo(utf8("three"));
  }

  @Test
  @DisplayName("Should signal a gap before replay when unseen output was evicted")
  void attach_EvictedSinceLastSeen_SendsSkippedThenRetained() {
    manager = newManager(EngineConfig.defaults().withReplayBufferBytes(10));
    for (int i = 0; i < 5; i++) {
      manager.onOutput(SESSION, utf8("chunk" + i));
    }

    manager.attach(SESSION, DEVICE, OptionalLong.of(0L));

    final List<TerminalEvent> events = transport.events(DEVICE);
    assertThat(events).hasSize(3);
    assertThat(events.get(0)).isEqualTo(new TerminalAttached(SESSION, 4L, 5L));
    assertThat(events.get(1)).isEqualTo(new OutputSkipped(SESSION, 1L, 3L));
    assertThat(outputSequences(events)).containsExactly(4L);
  }

  @Test
  @DisplayName("Should replay the whole buffer for last-seen -1")
  void attach_LastSeenMinusOne_ReplaysEverything() {
    manager.onOutput(SESSION, utf8("a"));
    manager.onOutput(SESSION, utf8("b"));

    manager.attach(SESSION, DEVICE, OptionalLong.of(-1L));

    assertThat(outputSequences(transport.events(DEVICE))).containsExactly(0L, 1L);
  }

  @Test
  @DisplayName("Should replay nothing to a device whose last-seen is beyond the buffer")
  void attach_LastSeenMaxValue_ReplaysNothing() {
    manager.onOutput(SESSION, utf8("a"));
    manager.onOutput(SESSION, utf8("b"));

    manager.attach(SESSION, DEVICE, OptionalLong.of(Long.MAX_VALUE));

    assertThat(transport.events(DEVICE)).containsExactly(new TerminalAttached(SESSION, 0L, 2L));
  }

  @Test
  @Timeout(30)
  @DisplayName("Should deliver every chunk after last-seen exactly once while output races the attach")
  void attach_ConcurrentOutput_NoLossNoDuplicates() throws Exception {
    final ExecutorService delivery = Executors.newSingleThreadExecutor();
    final TerminalManager racing = new TerminalManager(EngineConfig.defaults().withOutboxCapacity(100_000),
        id -> Optional.ofNullable(sessions.get(id)), processExecutor, transport, codec, delivery, clock::get);
    final int total = 3_000;
    final long lastSeen = 4L;
    for (int i = 0; i <= lastSeen; i++) {
      racing.onOutput(SESSION, utf8("x"));
    }

    final CountDownLatch capturing = new CountDownLatch(1);
    final Thread capture = new Thread(() -> {
      for (long i = lastSeen + 1; i < total; i++) {
        racing.onOutput(SESSION, utf8("x"));
        if (i == 100L) {
          capturing.countDown();
        }
      }
    }, "TerminalManagerTest-capture");
    capture.start();
    capturing.await();

    racing.attach(SESSION, DEVICE, OptionalLong.of(lastSeen));
    capture.join();
    delivery.shutdown();
    assertThat(delivery.awaitTermination(20, TimeUnit.SECONDS)).isTrue();

    final List<TerminalEvent> events = transport.events(DEVICE);
    assertThat(events.get(0)).isInstanceOf(TerminalAttached.class);
    assertThat(events).noneMatch(e -> e instanceof OutputSkipped);
    assertThat(outputSequences(events))
        .containsExactlyElementsOf(LongStream.range(lastSeen + 1, total).boxed().collect(Collectors.toList()));
  }

  @Test
  @DisplayName("Should keep the buffer after the last device detaches")
  void detach_LastDevice_BufferRetained() {
    manager.attach(SESSION, DEVICE);
    manager.onOutput(SESSION, utf8("x"));

    manager.detach(SESSION, DEVICE);

    assertThat(transport.events(DEVICE)).last()
        .isEqualTo(new TerminalDetached(SESSION, TerminalDetached.USER_REQUEST));
    assertThat(manager.attachmentCount(SESSION)).isZero();
    assertThat(manager.replayBuffer(SESSION)).get().extracting(b -> b.chunkCount()).isEqualTo(1);

    manager.onOutput(SESSION, utf8("y"));
    assertThat(outputSequences(transport.events(DEVICE))).containsExactly(0L);
  }

  @Test
  @DisplayName("Should confirm a detach even when the device was not attached")
  void detach_NotAttached_ConfirmsDirectly() {
    manager.detach(SESSION, DEVICE);

    assertThat(transport.events(DEVICE)).containsExactly(
        new TerminalDetached(SESSION, TerminalDetached.USER_REQUEST));
  }

  @Test
  @DisplayName("Should forward raw bytes to the multiplexer")
  void handleInput_RawBytes_SentToMultiplexer() throws Exception {
    manager.attach(SESSION, DEVICE);

    manager.handleInput(SESSION, DEVICE, TerminalInput.data(utf8("ls -la\r")));

    verify(processExecutor).sendKeys(TMUX_NAME, utf8("ls -la\r"));
  }

  @Test
  @DisplayName("Should encode logical keys before forwarding")
  void handleInput_LogicalKey_EncodedAndSent() throws Exception {
    manager.attach(SESSION, DEVICE);

    manager.handleInput(SESSION, DEVICE, TerminalInput.key(KeyType.UP, KeyEncoder.CTRL));

    verify(processExecutor).sendKeys(TMUX_NAME, utf8("\u001b[1;5A"));
  }

  @Test
  @DisplayName("Should ignore an unknown key without reporting an error")
  void handleInput_UnknownKey_NoOp() throws Exception {
    manager.attach(SESSION, DEVICE);
    transport.clear();

    manager.handleInput(SESSION, DEVICE, TerminalInput.key(KeyType.UNKNOWN, 0));

    verify(processExecutor, never()).sendKeys(anyString(), any());
    assertThat(transport.events(DEVICE)).isEmpty();
  }

  @Test
  @DisplayName("Should reject input from a device that is not attached")
  void handleInput_NotAttached_ReportsNotAttached() throws Exception {
    manager.handleInput(SESSION, DEVICE, TerminalInput.data(utf8("x")));

    assertThat(transport.events(DEVICE)).singleElement()
        .extracting(e -> ((TerminalError) e).code()).isEqualTo(TerminalError.NOT_ATTACHED);
    verify(processExecutor, never()).sendKeys(anyString(), any());
  }

  @Test
  @DisplayName("Should reject oversized input to the originating device only")
  void handleInput_TooLarge_ReportsToSenderOnly() throws Exception {
    manager.attach(SESSION, DEVICE);
    manager.attach(SESSION, "tablet");
    transport.clear();

    manager.handleInput(SESSION, DEVICE, TerminalInput.data(new byte[65_537]));

    assertThat(transport.events(DEVICE)).singleElement()
        .extracting(e -> ((TerminalError) e).code()).isEqualTo(ValidationError.INPUT_TOO_LARGE);
    assertThat(transport.events("tablet")).isEmpty();
    verify(processExecutor, never()).sendKeys(anyString(), any());
  }

  @Test
  @DisplayName("Should report a pipe error when the multiplexer rejects input")
  void handleInput_ExecutorFails_ReportsPipeError() throws Exception {
    doThrow(new ProcessExecutionException("no server running")).when(processExecutor).sendKeys(anyString(), any());
    manager.attach(SESSION, DEVICE);
    transport.clear();

    manager.handleInput(SESSION, DEVICE, TerminalInput.data(utf8("x")));

    assertThat(transport.events(DEVICE)).singleElement()
        .extracting(e -> ((TerminalError) e).code()).isEqualTo(TerminalError.PIPE_ERROR);
  }

  @Test
  @DisplayName("Should rate limit input per session")
  void handleInput_OverRateLimit_ReportsRateLimited() throws Exception {
    final EngineConfig d = EngineConfig.defaults();
    manager = newManager(new EngineConfig(d.replayBufferBytes(), d.outboxCapacity(), d.handlerBudgetMillis(), 2,
        d.tmuxPath(), null, d.notifications()));
    manager.attach(SESSION, DEVICE);
    transport.clear();

    for (int i = 0; i < 3; i++) {
      manager.handleInput(SESSION, DEVICE, TerminalInput.data(utf8("x")));
    }

    verify(processExecutor, times(2)).sendKeys(TMUX_NAME, utf8("x"));
    assertThat(transport.events(DEVICE)).singleElement()
        .extracting(e -> ((TerminalError) e).code()).isEqualTo(ValidationError.RATE_LIMITED);
  }

  @Test
  @DisplayName("Should forward resize requests and report failures")
  void handleResize_ExecutorFails_ReportsResizeFailed() throws Exception {
    manager.handleResize(SESSION, DEVICE, 120, 40);
    verify(processExecutor).resize(TMUX_NAME, 120, 40);

    doThrow(new ProcessExecutionException("can't find session")).when(processExecutor)
        .resize(anyString(), anyInt(), anyInt());
    manager.handleResize(SESSION, DEVICE, 0, 0);

    assertThat(transport.events(DEVICE)).singleElement()
        .extracting(e -> ((TerminalError) e).code()).isEqualTo(TerminalError.RESIZE_FAILED);
  }

  @Test
  @DisplayName("Should report a resize for an unknown session")
  void handleResize_UnknownSession_ReportsNotFound() throws Exception {
    manager.handleResize("zzzzzz999999", DEVICE, 80, 24);

    verify(processExecutor, never()).resize(anyString(), anyInt(), anyInt());
    assertThat(transport.events(DEVICE)).singleElement()
        .extracting(e -> ((TerminalError) e).code()).isEqualTo(TerminalError.SESSION_NOT_FOUND);
  }

  @Test
  @DisplayName("Should ignore output for sessions the directory does not know")
  void onOutput_UnknownSession_Ignored() {
    manager.onOutput("zzzzzz999999", utf8("x"));

    assertThat(manager.hasSession("zzzzzz999999")).isFalse();
  }

  @Test
  @DisplayName("Should buffer output for a known session before anyone attaches")
  void onOutput_KnownSessionNoAttachments_Buffered() {
    manager.onOutput(SESSION, utf8("early"));

    assertThat(manager.hasSession(SESSION)).isTrue();
    assertThat(manager.replayBuffer(SESSION)).get().extracting(b -> b.chunkCount()).isEqualTo(1);
  }

  @Test
  @DisplayName("Should keep delivering to healthy devices when one device's send fails")
  void onOutput_OneDeviceFails_OthersStillReceive() {
    transport.failFor("broken");
    manager.attach(SESSION, "broken");
    manager.attach(SESSION, DEVICE);

    manager.onOutput(SESSION, utf8("a"));
    manager.onOutput(SESSION, utf8("b"));

    assertThat(outputSequences(transport.events(DEVICE))).containsExactly(0L, 1L);
  }

  @Test
  @DisplayName("Should broadcast one notification per category within the cooldown")
  void onOutput_ErrorOutput_BroadcastsNotificationOnce() throws Exception {
    manager.onOutput(SESSION, utf8("Error: disk full\n"));
    manager.onOutput(SESSION, utf8("Error: disk still full\n"));

    assertThat(transport.broadcasts()).hasSize(1);
    final TerminalNotification notification = (TerminalNotification) transport.broadcasts().get(0);
    assertThat(notification.category()).isEqualTo("error");
    assertThat(notification.title()).isEqualTo("build: Error detected");
    assertThat(notification.timestamp()).isEqualTo(10_000L);
  }

  @Test
  @DisplayName("Should detect nothing when notification patterns are empty")
  void onOutput_NoPatterns_NoBroadcast() {
    manager = newManager(EngineConfig.defaults().withNotifications(
        new NotificationConfig(List.of(), List.of(), List.of(), 5.0, 100L, 500, 25, 60)));

    manager.onOutput(SESSION, utf8("Error: x\n$ "));

    assertThat(transport.broadcasts()).isEmpty();
  }

  @Test
  @DisplayName("Should notify devices and drop all state when the session is killed")
  void onSessionKilled_AttachedDevices_NotifiedAndStateCleared() throws Exception {
    manager.attach(SESSION, DEVICE);
    manager.onOutput(SESSION, utf8("x"));

    manager.onSessionKilled(SESSION);

    assertThat(transport.events(DEVICE)).last()
        .isEqualTo(new TerminalDetached(SESSION, TerminalDetached.SESSION_KILLED));
    assertThat(manager.hasSession(SESSION)).isFalse();
    assertThat(manager.replayBuffer(SESSION)).isEmpty();

    transport.clear();
    manager.handleInput(SESSION, DEVICE, TerminalInput.data(utf8("x")));
    assertThat(transport.events(DEVICE)).singleElement()
        .extracting(e -> ((TerminalError) e).code()).isEqualTo(TerminalError.NOT_ATTACHED);
    verify(processExecutor, never()).sendKeys(anyString(), any());
  }

  @Test
  @DisplayName("Should start fresh numbering when a killed session id becomes active again")
  void onSessionKilled_ThenNewOutput_FreshBuffer() {
    manager.onOutput(SESSION, utf8("old"));
    manager.onSessionKilled(SESSION);

    manager.onOutput(SESSION, utf8("new"));

    assertThat(manager.replayBuffer(SESSION)).get().extracting(b -> b.startSequence()).isEqualTo(0L);
  }

  @Test
  @DisplayName("Should detach a closed connection from every session and keep buffers")
  void onConnectionClosed_AttachedDevice_DetachedEverywhere() {
    sessions.put("zyxwvu654321", new SessionInfo("other", SessionStatus.ACTIVE, null));
    manager.attach(SESSION, DEVICE);
    manager.attach("zyxwvu654321", DEVICE);
    manager.onOutput(SESSION, utf8("x"));

    manager.onConnectionClosed(DEVICE);

    assertThat(manager.attachmentCount(SESSION)).isZero();
    assertThat(manager.attachmentCount("zyxwvu654321")).isZero();
    assertThat(manager.attachedSession(DEVICE)).isEmpty();
    assertThat(manager.replayBuffer(SESSION)).get().extracting(b -> b.chunkCount()).isEqualTo(1);
  }

  @Test
  @DisplayName("Should register itself with the output source")
  void bind_OutputSource_RegistersManager() {
    final OutputSource source = mock(OutputSource.class);

    manager.bind(source);

    verify(source).register(manager);
  }

  @Test
  @DisplayName("Should drop every session on shutdown")
  void shutdown_WithSessions_ClearsState() {
    manager.attach(SESSION, DEVICE);

    manager.close();

    assertThat(manager.hasSession(SESSION)).isFalse();
    assertThat(manager.attachmentCount(SESSION)).isZero();
  }

  @Test
  @DisplayName("Should deliver on its own threads when created without an executor")
  void create_OwnExecutor_DeliversAsynchronously() throws Exception {
    final DeviceTransport async = mock(DeviceTransport.class);
    final TerminalManager owned = TerminalManager.create(EngineConfig.defaults(),
        id -> Optional.ofNullable(sessions.get(id)), processExecutor, async);
    try {
      owned.attach(SESSION, DEVICE);
      verify(async, timeout(2_000L)).send(eq(DEVICE), any());
    } finally {
      owned.shutdown();
    }
  }

  /**
   * Transport that decodes and records everything sent, per device.
   */
  private final class RecordingTransport implements DeviceTransport {

    private final Map<String, List<TerminalEvent>> sent = new HashMap<>();
    private final List<TerminalEvent> broadcast = new ArrayList<>();
    private final List<String> failing = new ArrayList<>();

    @Override
    public synchronized void send(String deviceId, byte[] payload) throws Exception {
      if (failing.contains(deviceId)) {
        throw new IOException("connection reset");
      }
      sent.computeIfAbsent(deviceId, k -> new ArrayList<>()).add(codec.decode(payload));
    }

    @Override
    public synchronized void broadcast(byte[] payload) throws Exception {
      broadcast.add(codec.decode(payload));
    }

    synchronized List<TerminalEvent> events(String deviceId) {
      return new ArrayList<>(sent.getOrDefault(deviceId, List.of()));
    }

    synchronized List<TerminalEvent> broadcasts() {
      return new ArrayList<>(broadcast);
    }

    synchronized void failFor(String deviceId) {
      failing.add(deviceId);
    }

    synchronized void clear() {
      sent.clear();
      broadcast.clear();
    }
  }
}
