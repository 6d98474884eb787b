package com.consullo.remoteterm.buffer;

import java.util.List;
import java.util.OptionalLong;

/**
 * Result of a replay query against a {@link ReplayBuffer}.
 *
 * @param chunks chunks to replay, in sequence order
 * @param gapFrom present when the requested sequence was already evicted; holds the requested sequence so the
 * caller can tell the remote end that everything from there up to the first returned chunk is lost
 * @since 1.0
 */
public record ReplaySlice(List<OutputChunk> chunks, OptionalLong gapFrom) {

  private static final ReplaySlice EMPTY = new ReplaySlice(List.of(), OptionalLong.empty());

  public ReplaySlice {
    if (chunks == null || gapFrom == null) {
      throw new IllegalArgumentException("chunks/gapFrom must not be null.");
    }
    chunks = List.copyOf(chunks);
  }

  public static ReplaySlice empty() {
    return EMPTY;
  }

  public boolean hasGap() {
    return gapFrom.isPresent();
  }
}
