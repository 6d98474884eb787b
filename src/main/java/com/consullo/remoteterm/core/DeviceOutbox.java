package com.consullo.remoteterm.core;

import com.consullo.remoteterm.core.events.DeviceTransport;
import com.consullo.remoteterm.core.events.OutputSkipped;
import com.consullo.remoteterm.core.events.TerminalEvent;
import com.consullo.remoteterm.core.events.TerminalEventCodec;
import com.consullo.remoteterm.core.events.TerminalOutput;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded, ordered delivery queue for one device attached to one session.
 *
 * <p>
 * Events are sent one at a time on the shared delivery executor, so a slow device only backs up its own queue. When
 * the queue is full, output is dropped and the dropped range is remembered; once there is room again an
 * {@link OutputSkipped} for that range is queued ahead of further output so the device can resynchronize.
 * </p>
 */
final class DeviceOutbox {

  private static final Logger LOGGER = LoggerFactory.getLogger(DeviceOutbox.class);

  private static final long NONE = -1L;

  private record Pending(TerminalEvent event, byte[] payload) {
  }

  private final String sessionId;
  private final String deviceId;
  private final int capacity;
  private final DeviceTransport transport;
  private final TerminalEventCodec codec;
  private final Executor executor;

  private final Object lock = new Object();
  private final Deque<Pending> queue = new ArrayDeque<>();

  private boolean draining;
  private boolean closed;
  private long droppedFrom = NONE;
  private long droppedTo = NONE;

  DeviceOutbox(String sessionId, String deviceId, int capacity, DeviceTransport transport, TerminalEventCodec codec,
      Executor executor) {
    this.sessionId = sessionId;
    this.deviceId = deviceId;
    this.capacity = capacity;
    this.transport = transport;
    this.codec = codec;
    this.executor = executor;
  }

  /**
   * Queues an event for delivery, subject to the capacity limit.
   *
   * @param event event
   * @param payload serialized form of {@code event}
   * @return true if queued, false if dropped
   */
  boolean offer(TerminalEvent event, byte[] payload) {
    boolean schedule;
    synchronized (lock) {
      if (closed) {
        return false;
      }

      if (droppedFrom != NONE) {
        if (queue.size() + 2 <= capacity) {
          OutputSkipped skipped = new OutputSkipped(sessionId, droppedFrom, droppedTo);
          queue.addLast(new Pending(skipped, codec.encode(skipped)));
          LOGGER.info("Device {} caught up on session {}, skipped sequences {}..{}",
              deviceId, sessionId, droppedFrom, droppedTo);
          droppedFrom = NONE;
          droppedTo = NONE;
        } else {
          return drop(event);
        }
      } else if (queue.size() >= capacity) {
        return drop(event);
      }

      schedule = enqueue(event, payload);
    }

    if (schedule) {
      scheduleDrain();
    }
    return true;
  }

  /**
   * Queues an event regardless of capacity. Used for attach acknowledgements, replay and farewells, which are
   * bounded by the replay buffer rather than by output rate.
   *
   * @param event event
   * @param payload serialized form of {@code event}
   * @return true if queued, false if the outbox is closed
   */
  boolean offerUnbounded(TerminalEvent event, byte[] payload) {
    boolean schedule;
    synchronized (lock) {
      if (closed) {
        return false;
      }
      schedule = enqueue(event, payload);
    }

    if (schedule) {
      scheduleDrain();
    }
    return true;
  }

  private boolean enqueue(TerminalEvent event, byte[] payload) {
    queue.addLast(new Pending(event, payload));
    boolean schedule = !draining;
    draining = true;
    return schedule;
  }

  /**
   * Stops accepting events. Events already queued are still delivered.
   */
  void close() {
    synchronized (lock) {
      closed = true;
    }
  }

  int queued() {
    synchronized (lock) {
      return queue.size();
    }
  }

  boolean isClosed() {
    synchronized (lock) {
      return closed;
    }
  }

  private boolean drop(TerminalEvent event) {
    if (event instanceof TerminalOutput output) {
      if (droppedFrom == NONE) {
        droppedFrom = output.sequence();
        LOGGER.warn("Outbox full for device {} on session {}, dropping output from sequence {}",
            deviceId, sessionId, droppedFrom);
      }
      droppedTo = output.sequence();
    } else {
      LOGGER.warn("Outbox full for device {} on session {}, dropping {}",
          deviceId, sessionId, event.getClass().getSimpleName());
    }
    return false;
  }

  private void scheduleDrain() {
    try {
      executor.execute(this::drain);
    } catch (RejectedExecutionException e) {
      LOGGER.warn("Delivery executor rejected drain for device {}", deviceId);
      synchronized (lock) {
        draining = false;
      }
    }
  }

  private void drain() {
    while (true) {
      Pending next;
      synchronized (lock) {
        next = queue.pollFirst();
        if (next == null) {
          draining = false;
          return;
        }
      }
      try {
        transport.send(deviceId, next.payload());
      } catch (Exception e) {
        LOGGER.warn("Send to device {} failed for session {}: {}", deviceId, sessionId, e.getMessage());
      }
    }
  }
}
