package com.consullo.remoteterm.core;

import com.consullo.remoteterm.input.KeyType;

/**
 * Input from a device: either raw bytes or a logical key with modifiers.
 *
 * @param data raw bytes, null for a key press
 * @param key logical key, null for raw bytes
 * @param modifiers modifier bitmask for {@code key}
 * @since 1.0
 */
public record TerminalInput(byte[] data, KeyType key, int modifiers) {

  public TerminalInput {
    if ((data == null) == (key == null)) {
      throw new IllegalArgumentException("exactly one of data/key must be set.");
    }
  }

  public static TerminalInput data(byte[] data) {
    return new TerminalInput(data, null, 0);
  }

  public static TerminalInput key(KeyType key, int modifiers) {
    return new TerminalInput(null, key, modifiers);
  }

  public boolean isKey() {
    return key != null;
  }
}
