package com.codeheadsystems.kinesis.helper;

import com.codeheadsystems.kinesis.store.Shard;
import com.codeheadsystems.kinesis.store.Stream;
import com.codeheadsystems.kinesis.store.StreamRegistry;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.kinesis.model.InvalidArgumentException;
import software.amazon.awssdk.services.kinesis.model.ResourceNotFoundException;

/**
 * Resolves the stream a request addresses, by name or by ARN, and the shards within it.
 */
@Singleton
public class StreamLookupHelper {

  private static final Logger log = LoggerFactory.getLogger(StreamLookupHelper.class);

  private final StreamRegistry streamRegistry;

  /**
   * Instantiates a new Stream lookup helper.
   *
   * @param streamRegistry the stream registry
   */
  @Inject
  public StreamLookupHelper(final StreamRegistry streamRegistry) {
    log.info("StreamLookupHelper({})", streamRegistry);
    this.streamRegistry = streamRegistry;
  }

  /**
   * Picks the stream name out of a request. When only an ARN is given the name is its last
   * segment, arn:aws:kinesis:region:account:name or arn:aws:kinesis:region:account:stream/name.
   *
   * @param streamName the stream name, may be null
   * @param streamArn  the stream ARN, may be null
   * @return the stream name
   */
  public String streamName(final String streamName, final String streamArn) {
    if (streamName != null && !streamName.isEmpty()) {
      return streamName;
    }
    if (streamArn != null && streamArn.startsWith("arn:")) {
      final String resource = streamArn.substring(streamArn.lastIndexOf(':') + 1);
      final String name = resource.startsWith("stream/") ? resource.substring("stream/".length()) : resource;
      if (!name.isEmpty()) {
        return name;
      }
    }
    throw InvalidArgumentException.builder()
        .message("Either StreamName or a valid StreamARN is required")
        .build();
  }

  /**
   * Gets the stream a request addresses. When an ARN is given it must be the stream's own ARN, so
   * an ARN from another region or account does not resolve to a local stream of the same name.
   *
   * @param streamName the stream name, may be null
   * @param streamArn  the stream ARN, may be null
   * @return the stream
   */
  public Stream getStream(final String streamName, final String streamArn) {
    final String name = streamName(streamName, streamArn);
    return streamRegistry.getStream(name)
        .filter(stream -> streamArn == null || streamArn.isEmpty() || isArnOf(stream, streamArn))
        .orElseThrow(() -> ResourceNotFoundException.builder()
            .message("Stream " + (streamArn == null || streamArn.isEmpty() ? name : streamArn) + " not found")
            .build());
  }

  /**
   * Gets a shard of the stream.
   *
   * @param stream  the stream
   * @param shardId the shard id
   * @return the shard
   */
  public Shard getShard(final Stream stream, final String shardId) {
    return stream.shard(shardId)
        .orElseThrow(() -> ResourceNotFoundException.builder()
            .message("Shard " + shardId + " in stream " + stream.name() + " not found")
            .build());
  }

  private boolean isArnOf(final Stream stream, final String streamArn) {
    final boolean matches = streamArn.replace(":stream/", ":").equals(stream.arn());
    if (!matches) {
      log.warn("ARN {} does not address stream {}", streamArn, stream.arn());
    }
    return matches;
  }
}
