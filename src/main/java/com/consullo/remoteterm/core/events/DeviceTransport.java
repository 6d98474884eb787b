package com.consullo.remoteterm.core.events;

/**
 * Delivery of serialized events to remote devices. Connection handling and encryption live behind this interface.
 *
 * <p>Both operations are best effort. Implementations may throw; callers log the failure and move on.</p>
 *
 * @since 1.0
 */
public interface DeviceTransport {

  /**
   * Sends a serialized event to one device.
   *
   * @param deviceId target device
   * @param payload serialized event
   * @throws Exception if delivery fails
   */
  void send(String deviceId, byte[] payload) throws Exception;

  /**
   * Sends a serialized event to every connected device.
   *
   * @param payload serialized event
   * @throws Exception if delivery fails
   */
  void broadcast(byte[] payload) throws Exception;
}
