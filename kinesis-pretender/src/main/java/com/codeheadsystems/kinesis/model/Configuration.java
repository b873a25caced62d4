package com.codeheadsystems.kinesis.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

/**
 * The interface Kinesis pretender configuration.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableConfiguration.class)
@JsonDeserialize(builder = ImmutableConfiguration.Builder.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface Configuration {

  /**
   * The ARN partition.
   *
   * @return the partition
   */
  @Value.Default
  default String partition() {
    return "aws";
  }

  /**
   * The region placed into stream ARNs.
   *
   * @return the region
   */
  @Value.Default
  default String region() {
    return "us-east-1";
  }

  /**
   * The account id placed into stream ARNs.
   *
   * @return the account id
   */
  @Value.Default
  default String accountId() {
    return "123456789012";
  }

  /**
   * Largest limit a GetRecords call may ask for.
   *
   * @return the max limit
   */
  @Value.Default
  default int maxGetRecordsLimit() {
    return 10000;
  }

  /**
   * Largest shard count a stream may be created with.
   *
   * @return the max shard count
   */
  @Value.Default
  default int maxShardCount() {
    return 500;
  }

  /**
   * Check.
   */
  @Value.Check
  default void check() {
    if (maxGetRecordsLimit() < 1) {
      throw new IllegalStateException("maxGetRecordsLimit must be positive: " + maxGetRecordsLimit());
    }
    if (maxShardCount() < 1) {
      throw new IllegalStateException("maxShardCount must be positive: " + maxShardCount());
    }
  }

}
