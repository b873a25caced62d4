package com.codeheadsystems.kinesis.store;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.kinesis.model.ShardRecord;
import com.codeheadsystems.kinesis.model.ShardSlice;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Collectors;
import java.util.stream.LongStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ShardTest {

  private static final Instant NOW = Instant.parse("2025-01-01T00:00:00Z");

  private Shard shard;

  @BeforeEach
  void setup() {
    shard = new Shard(Shard.shardIdFor(0), BigInteger.ZERO, BigInteger.TEN);
  }

  private ShardRecord append(final String partitionKey) {
    return shard.append(partitionKey, Optional.empty(), partitionKey.getBytes(StandardCharsets.UTF_8), NOW);
  }

  @Test
  void shardIdFor() {
    assertThat(Shard.shardIdFor(0)).isEqualTo("shardId-000000000000");
    assertThat(Shard.shardIdFor(12)).isEqualTo("shardId-000000000012");
  }

  @Test
  void append_sequenceNumbersStartAtOneAndIncrease() {
    assertThat(append("a").sequenceNumber()).isEqualTo(1L);
    assertThat(append("b").sequenceNumber()).isEqualTo(2L);
    assertThat(append("c").sequenceNumberString()).isEqualTo("3");
    assertThat(shard.size()).isEqualTo(3);
    assertThat(shard.latestSequenceNumber()).contains(3L);
  }

  @Test
  void latestSequenceNumber_empty() {
    assertThat(shard.latestSequenceNumber()).isEmpty();
  }

  @Test
  void ownsHashKey_inclusiveBounds() {
    assertThat(shard.ownsHashKey(BigInteger.ZERO)).isTrue();
    assertThat(shard.ownsHashKey(BigInteger.TEN)).isTrue();
    assertThat(shard.ownsHashKey(BigInteger.valueOf(11))).isFalse();
  }

  @Test
  void indexOf() {
    append("a");
    append("b");
    append("c");

    assertThat(shard.indexOf(1L)).hasValue(0);
    assertThat(shard.indexOf(3L)).hasValue(2);
    assertThat(shard.indexOf(4L)).isEmpty();
    assertThat(shard.indexOf(0L)).isEmpty();
  }

  @Test
  void read_limitAndRemaining() {
    for (int i = 0; i < 5; i++) {
      append(String.valueOf(i));
    }

    final ShardSlice slice = shard.read(1, 3);

    assertThat(slice.records()).extracting(ShardRecord::sequenceNumber).containsExactly(2L, 3L, 4L);
    assertThat(slice.remaining()).isEqualTo(1);
  }

  @Test
  void read_pastTheEnd_isEmpty() {
    append("a");

    final ShardSlice slice = shard.read(5, Integer.MAX_VALUE);

    assertThat(slice.records()).isEmpty();
    assertThat(slice.remaining()).isZero();
  }

  @Test
  void read_isNotAffectedByLaterAppends() {
    append("a");
    final ShardSlice slice = shard.read(0, Integer.MAX_VALUE);
    append("b");

    assertThat(slice.records()).hasSize(1);
  }

  @Test
  void append_concurrentWriters_uniqueGapFreeSequenceNumbers() throws Exception {
    final int threads = 8;
    final int perThread = 250;
    final ExecutorService executor = Executors.newFixedThreadPool(threads);
    try {
      final List<Callable<List<Long>>> tasks = new ArrayList<>();
      for (int t = 0; t < threads; t++) {
        final String key = "writer-" + t;
        tasks.add(() -> {
          final List<Long> assigned = new ArrayList<>();
          for (int i = 0; i < perThread; i++) {
            assigned.add(append(key).sequenceNumber());
          }
          return assigned;
        });
      }
      final List<Long> all = new ArrayList<>();
      for (Future<List<Long>> future : executor.invokeAll(tasks)) {
        final List<Long> assigned = future.get();
        assertThat(assigned).isSorted();
        all.addAll(assigned);
      }

      assertThat(all).containsExactlyInAnyOrderElementsOf(
          LongStream.rangeClosed(1, (long) threads * perThread).boxed().collect(Collectors.toList()));
      assertThat(shard.read(0, Integer.MAX_VALUE).records())
          .extracting(ShardRecord::sequenceNumber)
          .isSorted()
          .hasSize(threads * perThread);
    } finally {
      executor.shutdownNow();
    }
  }
}
