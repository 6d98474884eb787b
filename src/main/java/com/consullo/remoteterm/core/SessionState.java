package com.consullo.remoteterm.core;

import com.consullo.remoteterm.buffer.ReplayBuffer;
import com.consullo.remoteterm.notify.NotificationDispatcher;
import com.consullo.remoteterm.notify.PatternMatcher;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything the manager keeps for one active session. Attachments are guarded by the instance monitor, which is
 * also held while output is appended and fanned out so replay and live output never interleave.
 */
final class SessionState {

  private final String sessionId;
  private final String displayName;
  private final ReplayBuffer buffer;
  private final PatternMatcher matcher;
  private final NotificationDispatcher dispatcher;
  private final Map<String, DeviceOutbox> attachments = new LinkedHashMap<>();

  SessionState(String sessionId, String displayName, ReplayBuffer buffer, PatternMatcher matcher,
      NotificationDispatcher dispatcher) {
    this.sessionId = sessionId;
    this.displayName = displayName;
    this.buffer = buffer;
    this.matcher = matcher;
    this.dispatcher = dispatcher;
  }

  String sessionId() {
    return sessionId;
  }

  String displayName() {
    return displayName;
  }

  ReplayBuffer buffer() {
    return buffer;
  }

  PatternMatcher matcher() {
    return matcher;
  }

  NotificationDispatcher dispatcher() {
    return dispatcher;
  }

  /** Callers must hold the instance monitor. */
  Map<String, DeviceOutbox> attachments() {
    return attachments;
  }

  synchronized boolean isAttached(String deviceId) {
    return attachments.containsKey(deviceId);
  }

  synchronized int attachmentCount() {
    return attachments.size();
  }

  /** Callers must hold the instance monitor. The returned outbox is still open. */
  DeviceOutbox detach(String deviceId) {
    return attachments.remove(deviceId);
  }

  /** Callers must hold the instance monitor. The returned outboxes are still open. */
  List<DeviceOutbox> detachAll() {
    List<DeviceOutbox> out = new ArrayList<>(attachments.values());
    attachments.clear();
    return out;
  }
}
