package com.codeheadsystems.kinesis.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.util.Optional;
import org.immutables.value.Value;
import software.amazon.awssdk.services.kinesis.model.ShardIteratorType;

/**
 * Internal model for shard iterator information.
 * Used for encoding/decoding shard iterator strings. The position is resolved against the shard
 * when records are read, not when the iterator is issued.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableShardIterator.class)
@JsonDeserialize(as = ImmutableShardIterator.class)
public interface ShardIterator {

  /**
   * The stream name.
   *
   * @return the stream name
   */
  String streamName();

  /**
   * The incarnation of the stream the iterator was issued against. A stream deleted and created
   * again under the same name has a different incarnation.
   *
   * @return the stream incarnation
   */
  long streamIncarnation();

  /**
   * The shard ID.
   *
   * @return the shard id
   */
  String shardId();

  /**
   * The shard iterator type.
   *
   * @return the type
   */
  ShardIteratorType type();

  /**
   * Anchor for AT_SEQUENCE_NUMBER and AFTER_SEQUENCE_NUMBER iterators.
   *
   * @return the sequence number
   */
  Optional<String> sequenceNumber();

  /**
   * Record index captured when a LATEST iterator was issued.
   *
   * @return the position
   */
  Optional<Long> position();
}
