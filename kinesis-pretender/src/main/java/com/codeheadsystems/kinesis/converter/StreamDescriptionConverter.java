package com.codeheadsystems.kinesis.converter;

import com.codeheadsystems.kinesis.store.Shard;
import com.codeheadsystems.kinesis.store.Stream;
import java.util.List;
import java.util.stream.Collectors;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.kinesis.model.EncryptionType;
import software.amazon.awssdk.services.kinesis.model.HashKeyRange;
import software.amazon.awssdk.services.kinesis.model.SequenceNumberRange;
import software.amazon.awssdk.services.kinesis.model.StreamDescription;
import software.amazon.awssdk.services.kinesis.model.StreamDescriptionSummary;
import software.amazon.awssdk.services.kinesis.model.StreamSummary;

/**
 * Converts streams and shards from the store into their AWS SDK descriptions.
 */
@Singleton
public class StreamDescriptionConverter {

  /**
   * Retention reported for every stream. Records are never expired.
   */
  public static final int RETENTION_PERIOD_HOURS = 24;

  private static final Logger log = LoggerFactory.getLogger(StreamDescriptionConverter.class);

  /**
   * Instantiates a new Stream description converter.
   */
  @Inject
  public StreamDescriptionConverter() {
    log.info("StreamDescriptionConverter()");
  }

  /**
   * Describes a stream with the given page of its shards.
   *
   * @param stream        the stream
   * @param shards        the shards to include
   * @param hasMoreShards whether shards were left out after the page
   * @return the stream description
   */
  public StreamDescription toStreamDescription(final Stream stream,
                                               final List<Shard> shards,
                                               final boolean hasMoreShards) {
    log.trace("toStreamDescription({}, {}, {})", stream, shards, hasMoreShards);
    return StreamDescription.builder()
        .streamName(stream.name())
        .streamARN(stream.arn())
        .streamStatus(stream.status())
        .streamCreationTimestamp(stream.creationTimestamp())
        .retentionPeriodHours(RETENTION_PERIOD_HOURS)
        .encryptionType(EncryptionType.NONE)
        .shards(toShards(shards))
        .hasMoreShards(hasMoreShards)
        .build();
  }

  /**
   * Summarizes a stream.
   *
   * @param stream the stream
   * @return the summary
   */
  public StreamDescriptionSummary toStreamDescriptionSummary(final Stream stream) {
    log.trace("toStreamDescriptionSummary({})", stream);
    return StreamDescriptionSummary.builder()
        .streamName(stream.name())
        .streamARN(stream.arn())
        .streamStatus(stream.status())
        .streamCreationTimestamp(stream.creationTimestamp())
        .retentionPeriodHours(RETENTION_PERIOD_HOURS)
        .encryptionType(EncryptionType.NONE)
        .openShardCount(stream.shards().size())
        .consumerCount(0)
        .build();
  }

  /**
   * Stream summary as listed by ListStreams.
   *
   * @param stream the stream
   * @return the summary
   */
  public StreamSummary toStreamSummary(final Stream stream) {
    return StreamSummary.builder()
        .streamName(stream.name())
        .streamARN(stream.arn())
        .streamStatus(stream.status())
        .streamCreationTimestamp(stream.creationTimestamp())
        .build();
  }

  /**
   * Converts shards.
   *
   * @param shards the shards
   * @return the sdk shards
   */
  public List<software.amazon.awssdk.services.kinesis.model.Shard> toShards(final List<Shard> shards) {
    return shards.stream().map(this::toShard).collect(Collectors.toList());
  }

  /**
   * Converts a shard. Shards are never closed, so the sequence number range has no end.
   *
   * @param shard the shard
   * @return the sdk shard
   */
  public software.amazon.awssdk.services.kinesis.model.Shard toShard(final Shard shard) {
    return software.amazon.awssdk.services.kinesis.model.Shard.builder()
        .shardId(shard.shardId())
        .hashKeyRange(HashKeyRange.builder()
            .startingHashKey(shard.startingHashKey().toString())
            .endingHashKey(shard.endingHashKey().toString())
            .build())
        .sequenceNumberRange(SequenceNumberRange.builder()
            .startingSequenceNumber(String.valueOf(Shard.FIRST_SEQUENCE_NUMBER))
            .build())
        .build();
  }
}
