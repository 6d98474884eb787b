package com.consullo.remoteterm.core;

import com.consullo.remoteterm.core.events.DeviceTransport;
import com.consullo.remoteterm.core.events.OutputSkipped;
import com.consullo.remoteterm.core.events.TerminalDetached;
import com.consullo.remoteterm.core.events.TerminalEvent;
import com.consullo.remoteterm.core.events.TerminalEventCodec;
import com.consullo.remoteterm.core.events.TerminalOutput;
import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.Executor;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for per-device queueing and overflow handling.
 *
 * @since 1.0
 */
public class DeviceOutboxTest {

  private static final String SESSION = "abcdef123456";

  private final TerminalEventCodec codec = new TerminalEventCodec();
  private final ManualExecutor executor = new ManualExecutor();
  private final List<TerminalEvent> delivered = new ArrayList<>();

  private final DeviceTransport transport = new DeviceTransport() {
    @Override
    public void send(String deviceId, byte[] payload) throws Exception {
      delivered.add(codec.decode(payload));
    }

    @Override
    public void broadcast(byte[] payload) {
    }
  };

  private boolean offerOutput(DeviceOutbox outbox, long sequence) {
    final TerminalOutput event = new TerminalOutput(SESSION, sequence, new byte[]{(byte) sequence});
    return outbox.offer(event, codec.encode(event));
  }

  @Test
  @DisplayName("Should deliver queued events in order")
  void offer_WithinCapacity_DeliversInOrder() {
    final DeviceOutbox outbox = new DeviceOutbox(SESSION, "dev1", 8, transport, codec, executor);

    offerOutput(outbox, 0);
    offerOutput(outbox, 1);
    offerOutput(outbox, 2);
    executor.runAll();

    assertThat(delivered).extracting(e -> ((TerminalOutput) e).sequence()).containsExactly(0L, 1L, 2L);
    assertThat(outbox.queued()).isZero();
  }

  @Test
  @DisplayName("Should drop output when full and report the dropped range once drained")
  void offer_Overflow_ReportsSkippedRange() {
    final DeviceOutbox outbox = new DeviceOutbox(SESSION, "dev1", 2, transport, codec, executor);

    assertThat(offerOutput(outbox, 0)).isTrue();
    assertThat(offerOutput(outbox, 1)).isTrue();
    assertThat(offerOutput(outbox, 2)).isFalse();
    assertThat(offerOutput(outbox, 3)).isFalse();
    executor.runAll();

    assertThat(offerOutput(outbox, 4)).isTrue();
    executor.runAll();

    assertThat(delivered).hasSize(4);
    assertThat(delivered.get(2)).isEqualTo(new OutputSkipped(SESSION, 2L, 3L));
    assertThat(((TerminalOutput) delivered.get(3)).sequence()).isEqualTo(4L);
  }

  @Test
  @DisplayName("Should accept unbounded offers past capacity")
  void offerUnbounded_PastCapacity_AllQueued() {
    final DeviceOutbox outbox = new DeviceOutbox(SESSION, "dev1", 2, transport, codec, executor);

    for (int i = 0; i < 5; i++) {
      final TerminalOutput event = new TerminalOutput(SESSION, i, new byte[0]);
      assertThat(outbox.offerUnbounded(event, codec.encode(event))).isTrue();
    }

    assertThat(outbox.queued()).isEqualTo(5);
    executor.runAll();
    assertThat(delivered).hasSize(5);
  }

  @Test
  @DisplayName("Should deliver already queued events after close but accept nothing new")
  void close_WithQueuedEvents_DrainsThenRejects() {
    final DeviceOutbox outbox = new DeviceOutbox(SESSION, "dev1", 8, transport, codec, executor);
    final TerminalDetached farewell = new TerminalDetached(SESSION, TerminalDetached.USER_REQUEST);
    outbox.offerUnbounded(farewell, codec.encode(farewell));

    outbox.close();

    assertThat(outbox.isClosed()).isTrue();
    assertThat(offerOutput(outbox, 0)).isFalse();
    executor.runAll();
    assertThat(delivered).containsExactly(farewell);
  }

  @Test
  @DisplayName("Should keep draining after a send failure")
  void drain_SendFails_ContinuesWithNext() {
    final List<byte[]> sent = new ArrayList<>();
    final DeviceTransport flaky = new DeviceTransport() {
      private int calls;

      @Override
      public void send(String deviceId, byte[] payload) throws Exception {
        if (calls++ == 0) {
          throw new IOException("broken pipe");
        }
        sent.add(payload);
      }

      @Override
      public void broadcast(byte[] payload) {
      }
    };
    final DeviceOutbox outbox = new DeviceOutbox(SESSION, "dev1", 8, flaky, codec, executor);

    offerOutput(outbox, 0);
    offerOutput(outbox, 1);
    executor.runAll();

    assertThat(sent).hasSize(1);
  }

  /**
   * Executor that runs tasks only when asked.
   */
  private static final class ManualExecutor implements Executor {

    private final Deque<Runnable> tasks = new ArrayDeque<>();

    @Override
    public void execute(Runnable command) {
      tasks.addLast(command);
    }

    void runAll() {
      Runnable next;
      while ((next = tasks.pollFirst()) != null) {
        next.run();
      }
    }
  }
}
