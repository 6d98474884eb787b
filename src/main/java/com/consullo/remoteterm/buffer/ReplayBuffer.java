package com.consullo.remoteterm.buffer;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.OptionalLong;
import org.apache.commons.lang3.Validate;

/**
 * Bounded, sequence-numbered store of terminal output used to replay missed output to reconnecting devices.
 *
 * <p>
 * Each appended chunk gets the next sequence number. When the total byte size exceeds the configured budget the
 * oldest chunks are evicted, except that the most recently appended chunk is always kept even if it alone exceeds
 * the budget.
 * </p>
 *
 * <p>
 * All operations are guarded by a single lock held only for the bookkeeping itself; output arrives on the capture
 * thread while replay queries come from request handling.
 * </p>
 *
 * @since 1.0
 */
public final class ReplayBuffer {

  /** Default budget used by the daemon: 100 KiB. */
  public static final int DEFAULT_MAX_BYTES = 100 * 1024;

  private final Object lock = new Object();
  private final Deque<OutputChunk> chunks = new ArrayDeque<>();
  private final long maxBytes;

  private long sizeBytes;
  private long nextSequence;

  public ReplayBuffer() {
    this(DEFAULT_MAX_BYTES);
  }

  /**
   * Creates an empty buffer.
   *
   * @param maxBytes byte budget, must be positive
   */
  public ReplayBuffer(long maxBytes) {
    Validate.isTrue(maxBytes > 0, "maxBytes must be positive");
    this.maxBytes = maxBytes;
  }

  /**
   * Stores a chunk and returns the sequence number assigned to it.
   *
   * @param data output bytes
   * @return assigned sequence
   */
  public long append(byte[] data) {
    Validate.notNull(data, "data must not be null");
    synchronized (lock) {
      long sequence = nextSequence++;
      chunks.addLast(new OutputChunk(sequence, data));
      sizeBytes += data.length;

      while (sizeBytes > maxBytes && chunks.size() > 1) {
        OutputChunk evicted = chunks.removeFirst();
        sizeBytes -= evicted.size();
      }
      return sequence;
    }
  }

  /**
   * Returns every retained chunk whose sequence is at or after {@code fromSequence}.
   *
   * <p>
   * If {@code fromSequence} precedes the oldest retained chunk, the range was partially evicted: all retained chunks
   * are returned and {@link ReplaySlice#gapFrom()} holds {@code fromSequence}.
   * </p>
   *
   * @param fromSequence first sequence the caller has not seen
   * @return chunks plus optional gap marker
   */
  public ReplaySlice getFrom(long fromSequence) {
    synchronized (lock) {
      if (chunks.isEmpty()) {
        return ReplaySlice.empty();
      }

      long oldest = chunks.peekFirst().sequence();
      if (fromSequence < oldest) {
        return new ReplaySlice(new ArrayList<>(chunks), OptionalLong.of(fromSequence));
      }

      List<OutputChunk> out = new ArrayList<>();
      for (OutputChunk chunk : chunks) {
        if (chunk.sequence() >= fromSequence) {
          out.add(chunk);
        }
      }
      return new ReplaySlice(out, OptionalLong.empty());
    }
  }

  /**
   * Drops all chunks. Sequence numbering continues; a new session starts with a new buffer.
   */
  public void clear() {
    synchronized (lock) {
      chunks.clear();
      sizeBytes = 0;
    }
  }

  /**
   * Oldest retained sequence, or the next sequence to be assigned when empty.
   *
   * @return start sequence
   */
  public long startSequence() {
    synchronized (lock) {
      OutputChunk first = chunks.peekFirst();
      return first != null ? first.sequence() : nextSequence;
    }
  }

  /**
   * Next sequence number to be assigned.
   *
   * @return current sequence
   */
  public long currentSequence() {
    synchronized (lock) {
      return nextSequence;
    }
  }

  public long sizeBytes() {
    synchronized (lock) {
      return sizeBytes;
    }
  }

  public int chunkCount() {
    synchronized (lock) {
      return chunks.size();
    }
  }

  public long maxBytes() {
    return maxBytes;
  }
}
