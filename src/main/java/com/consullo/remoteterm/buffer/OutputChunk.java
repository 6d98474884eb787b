package com.consullo.remoteterm.buffer;

import java.util.Arrays;

/**
 * One delivery of terminal output bytes, stamped with the sequence number the replay buffer assigned to it.
 *
 * <p>The byte array is copied on construction and on access so a chunk cannot be mutated once buffered.
 *
 * @param sequence sequence number, strictly increasing within a session's lifetime
 * @param data raw output bytes
 * @since 1.0
 */
public record OutputChunk(long sequence, byte[] data) {

  public OutputChunk {
    if (data == null) {
      throw new IllegalArgumentException("data must not be null.");
    }
    if (sequence < 0) {
      throw new IllegalArgumentException("sequence must not be negative.");
    }
    data = data.clone();
  }

  @Override
  public byte[] data() {
    return data.clone();
  }

  /**
   * Returns the number of bytes in this chunk without copying.
   *
   * @return byte count
   */
  public int size() {
    return data.length;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof OutputChunk other)) {
      return false;
    }
    return sequence == other.sequence && Arrays.equals(data, other.data);
  }

  @Override
  public int hashCode() {
    return 31 * Long.hashCode(sequence) + Arrays.hashCode(data);
  }

  @Override
  public String toString() {
    return "OutputChunk[sequence=" + sequence + ", size=" + data.length + "]";
  }
}
