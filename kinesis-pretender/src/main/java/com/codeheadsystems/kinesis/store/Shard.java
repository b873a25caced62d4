package com.codeheadsystems.kinesis.store;

import com.codeheadsystems.kinesis.model.ImmutableShardRecord;
import com.codeheadsystems.kinesis.model.ImmutableShardSlice;
import com.codeheadsystems.kinesis.model.ShardRecord;
import com.codeheadsystems.kinesis.model.ShardSlice;
import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An ordered, append-only sequence of records. The shard owns sequence number assignment.
 * Appends hold the write lock; every read holds the read lock, so a reader always sees a prefix of
 * the append order.
 */
public class Shard {

  private static final Logger log = LoggerFactory.getLogger(Shard.class);

  /**
   * Sequence number given to the first record of every shard.
   */
  public static final long FIRST_SEQUENCE_NUMBER = 1L;

  private final String shardId;
  private final BigInteger startingHashKey;
  private final BigInteger endingHashKey;
  private final List<ShardRecord> records;
  private final ReadWriteLock readWriteLock;
  private long nextSequenceNumber;

  /**
   * Instantiates a new Shard.
   *
   * @param shardId         the shard id
   * @param startingHashKey the first hash key owned by the shard
   * @param endingHashKey   the last hash key owned by the shard, inclusive
   */
  public Shard(final String shardId,
               final BigInteger startingHashKey,
               final BigInteger endingHashKey) {
    this.shardId = shardId;
    this.startingHashKey = startingHashKey;
    this.endingHashKey = endingHashKey;
    this.records = new ArrayList<>();
    this.readWriteLock = new ReentrantReadWriteLock();
    this.nextSequenceNumber = FIRST_SEQUENCE_NUMBER;
  }

  /**
   * Shard id for the shard at the given creation index.
   *
   * @param index the index
   * @return the shard id
   */
  public static String shardIdFor(final int index) {
    return String.format("shardId-%012d", index);
  }

  /**
   * The shard id, shardId- followed by the zero padded creation index.
   *
   * @return the shard id
   */
  public String shardId() {
    return shardId;
  }

  /**
   * First hash key owned by the shard.
   *
   * @return the starting hash key
   */
  public BigInteger startingHashKey() {
    return startingHashKey;
  }

  /**
   * Last hash key owned by the shard, inclusive.
   *
   * @return the ending hash key
   */
  public BigInteger endingHashKey() {
    return endingHashKey;
  }

  /**
   * Checks whether the hash key falls into this shard's range.
   *
   * @param hashKey the hash key
   * @return true if owned
   */
  public boolean ownsHashKey(final BigInteger hashKey) {
    return startingHashKey.compareTo(hashKey) <= 0 && endingHashKey.compareTo(hashKey) >= 0;
  }

  /**
   * Appends a record, assigning it the next sequence number.
   *
   * @param partitionKey    the partition key
   * @param explicitHashKey the explicit hash key
   * @param data            the data
   * @param arrival         the arrival time
   * @return the stored record
   */
  public ShardRecord append(final String partitionKey,
                            final Optional<String> explicitHashKey,
                            final byte[] data,
                            final Instant arrival) {
    readWriteLock.writeLock().lock();
    try {
      final ShardRecord record = ImmutableShardRecord.builder()
          .sequenceNumber(nextSequenceNumber++)
          .partitionKey(partitionKey)
          .explicitHashKey(explicitHashKey)
          .data(data)
          .approximateArrivalTimestamp(arrival)
          .build();
      records.add(record);
      log.trace("append({}) -> {}", shardId, record.sequenceNumber());
      return record;
    } finally {
      readWriteLock.writeLock().unlock();
    }
  }

  /**
   * Number of records appended so far.
   *
   * @return the size
   */
  public int size() {
    readWriteLock.readLock().lock();
    try {
      return records.size();
    } finally {
      readWriteLock.readLock().unlock();
    }
  }

  /**
   * The sequence number of the most recent record, if any.
   *
   * @return the latest sequence number
   */
  public Optional<Long> latestSequenceNumber() {
    readWriteLock.readLock().lock();
    try {
      return records.isEmpty()
          ? Optional.empty()
          : Optional.of(records.get(records.size() - 1).sequenceNumber());
    } finally {
      readWriteLock.readLock().unlock();
    }
  }

  /**
   * Finds the index of the record carrying the sequence number.
   *
   * @param sequenceNumber the sequence number
   * @return the index, or empty if no such record exists
   */
  public OptionalInt indexOf(final long sequenceNumber) {
    readWriteLock.readLock().lock();
    try {
      int low = 0;
      int high = records.size() - 1;
      while (low <= high) {
        final int mid = (low + high) >>> 1;
        final long midSequence = records.get(mid).sequenceNumber();
        if (midSequence < sequenceNumber) {
          low = mid + 1;
        } else if (midSequence > sequenceNumber) {
          high = mid - 1;
        } else {
          return OptionalInt.of(mid);
        }
      }
      return OptionalInt.empty();
    } finally {
      readWriteLock.readLock().unlock();
    }
  }

  /**
   * Reads up to limit records starting at the index. An index at or past the end yields no records.
   *
   * @param fromIndex the first index to read
   * @param limit     the maximum number of records
   * @return the slice
   */
  public ShardSlice read(final long fromIndex, final int limit) {
    readWriteLock.readLock().lock();
    try {
      final int size = records.size();
      final int start = (int) Math.min(Math.max(fromIndex, 0L), size);
      final int end = (int) Math.min((long) start + limit, size);
      return ImmutableShardSlice.builder()
          .records(new ArrayList<>(records.subList(start, end)))
          .remaining(size - end)
          .build();
    } finally {
      readWriteLock.readLock().unlock();
    }
  }

  @Override
  public String toString() {
    return "Shard{" + shardId + "}";
  }
}
