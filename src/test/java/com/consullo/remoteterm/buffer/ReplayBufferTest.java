package com.consullo.remoteterm.buffer;

import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for sequence assignment, eviction and replay queries.
 *
 * @since 1.0
 */
public class ReplayBufferTest {

  private static byte[] bytes(int n) {
    return new byte[n];
  }

  @Test
  @DisplayName("Should assign consecutive sequence numbers starting at zero")
  void append_MultipleChunks_AssignsConsecutiveSequences() {
    final ReplayBuffer buffer = new ReplayBuffer(1024);

    assertThat(buffer.append("a".getBytes(StandardCharsets.UTF_8))).isEqualTo(0L);
    assertThat(buffer.append("b".getBytes(StandardCharsets.UTF_8))).isEqualTo(1L);
    assertThat(buffer.append("c".getBytes(StandardCharsets.UTF_8))).isEqualTo(2L);
    assertThat(buffer.currentSequence()).isEqualTo(3L);
    assertThat(buffer.startSequence()).isEqualTo(0L);
  }

  @Test
  @DisplayName("Should evict oldest chunks once the byte budget is exceeded")
  void append_OverBudget_EvictsOldest() {
    final ReplayBuffer buffer = new ReplayBuffer(100);
    for (int i = 0; i < 5; i++) {
      buffer.append(bytes(30));
    }

    assertThat(buffer.sizeBytes()).isLessThanOrEqualTo(100L);
    assertThat(buffer.chunkCount()).isEqualTo(3);
    assertThat(buffer.startSequence()).isEqualTo(2L);
  }

  @Test
  @DisplayName("Should keep a single chunk larger than the whole budget")
  void append_ChunkLargerThanBudget_KeepsNewestChunk() {
    final ReplayBuffer buffer = new ReplayBuffer(100);
    buffer.append(bytes(10));
    final long seq = buffer.append(bytes(500));

    assertThat(buffer.chunkCount()).isEqualTo(1);
    assertThat(buffer.sizeBytes()).isEqualTo(500L);
    assertThat(buffer.getFrom(seq).chunks()).extracting(OutputChunk::sequence).containsExactly(seq);
  }

  @Test
  @DisplayName("Should return retained chunks from the requested sequence without a gap")
  void getFrom_RetainedSequence_ReturnsSuffix() {
    final ReplayBuffer buffer = new ReplayBuffer(1024);
    for (int i = 0; i < 4; i++) {
      buffer.append(new byte[]{(byte) i});
    }

    final ReplaySlice slice = buffer.getFrom(2);

    assertThat(slice.hasGap()).isFalse();
    assertThat(slice.chunks()).extracting(OutputChunk::sequence).containsExactly(2L, 3L);
    assertThat(slice.chunks().get(0).data()).containsExactly((byte) 2);
  }

  @Test
  @DisplayName("Should report a gap when the requested sequence was evicted")
  void getFrom_EvictedSequence_ReportsGap() {
    final ReplayBuffer buffer = new ReplayBuffer(50);
    for (int i = 0; i < 5; i++) {
      buffer.append(bytes(20));
    }

    final ReplaySlice slice = buffer.getFrom(1);

    assertThat(slice.hasGap()).isTrue();
    assertThat(slice.gapFrom().getAsLong()).isEqualTo(1L);
    assertThat(slice.chunks()).extracting(OutputChunk::sequence).containsExactly(3L, 4L);
  }

  @Test
  @DisplayName("Should return nothing when the device is already up to date")
  void getFrom_FutureSequence_ReturnsEmpty() {
    final ReplayBuffer buffer = new ReplayBuffer(1024);
    buffer.append(bytes(5));

    final ReplaySlice slice = buffer.getFrom(1);

    assertThat(slice.chunks()).isEmpty();
    assertThat(slice.hasGap()).isFalse();
  }

  @Test
  @DisplayName("Should keep sequence numbering after clear")
  void clear_ThenAppend_ContinuesSequence() {
    final ReplayBuffer buffer = new ReplayBuffer(1024);
    buffer.append(bytes(5));
    buffer.append(bytes(5));

    buffer.clear();

    assertThat(buffer.chunkCount()).isZero();
    assertThat(buffer.sizeBytes()).isZero();
    assertThat(buffer.getFrom(0).chunks()).isEmpty();
    assertThat(buffer.append(bytes(1))).isEqualTo(2L);
  }

  @Test
  @DisplayName("Should not let callers mutate buffered data")
  void append_MutateSourceArray_BufferUnchanged() {
    final ReplayBuffer buffer = new ReplayBuffer(1024);
    final byte[] data = {1, 2, 3};
    buffer.append(data);
    data[0] = 9;

    final List<OutputChunk> chunks = buffer.getFrom(0).chunks();
    chunks.get(0).data()[1] = 9;

    assertThat(buffer.getFrom(0).chunks().get(0).data()).containsExactly(1, 2, 3);
  }

  @Test
  @DisplayName("Should default to a 100 KiB budget")
  void constructor_NoArguments_DefaultBudget() {
    assertThat(new ReplayBuffer().maxBytes()).isEqualTo(100L * 1024L);
  }

  @Test
  @DisplayName("Should reject a non-positive budget")
  void constructor_ZeroBudget_Throws() {
    assertThatThrownBy(() -> new ReplayBuffer(0)).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  @Timeout(30)
  @DisplayName("Should return contiguous increasing slices while another thread appends")
  void getFrom_ConcurrentAppends_SlicesContiguous() throws InterruptedException {
    final ReplayBuffer buffer = new ReplayBuffer(1000);
    final int appends = 20_000;
    final Thread writer = new Thread(() -> {
      for (int i = 0; i < appends; i++) {
        buffer.append(bytes(10));
      }
    }, "ReplayBufferTest-writer");
    writer.start();

    long from = 0L;
    int slices = 0;
    while (writer.isAlive() || from < appends) {
      final ReplaySlice slice = buffer.getFrom(from);
      final List<OutputChunk> chunks = slice.chunks();
      for (int i = 1; i < chunks.size(); i++) {
        assertThat(chunks.get(i).sequence()).isEqualTo(chunks.get(i - 1).sequence() + 1);
      }
      if (!chunks.isEmpty()) {
        if (slice.hasGap()) {
          assertThat(slice.gapFrom().getAsLong()).isEqualTo(from).isLessThan(chunks.get(0).sequence());
        } else {
          assertThat(chunks.get(0).sequence()).isEqualTo(from);
        }
        from = chunks.get(chunks.size() - 1).sequence() + 1;
      }
      slices++;
    }
    writer.join();

    assertThat(slices).isPositive();
    assertThat(buffer.currentSequence()).isEqualTo(appends);
    assertThat(buffer.sizeBytes()).isLessThanOrEqualTo(1000L);
  }
}
