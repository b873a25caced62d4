package com.codeheadsystems.kinesis.model;

import java.time.Instant;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * Immutable model representing a record appended to a shard.
 */
@Value.Immutable
public interface ShardRecord {

  /**
   * Per shard sequence number, starting at 1.
   *
   * @return the sequence number
   */
  long sequenceNumber();

  /**
   * Partition key supplied by the producer.
   *
   * @return the partition key
   */
  String partitionKey();

  /**
   * Explicit hash key supplied by the producer, if any.
   *
   * @return the explicit hash key
   */
  Optional<String> explicitHashKey();

  /**
   * The payload.
   *
   * @return the data
   */
  byte[] data();

  /**
   * When the record was appended.
   *
   * @return the approximate arrival timestamp
   */
  Instant approximateArrivalTimestamp();

  /**
   * Sequence number as it appears on the wire.
   *
   * @return the sequence number string
   */
  @Value.Derived
  default String sequenceNumberString() {
    return Long.toString(sequenceNumber());
  }
}
