package com.codeheadsystems.kinesis.manager;

import com.codeheadsystems.kinesis.converter.StreamDescriptionConverter;
import com.codeheadsystems.kinesis.helper.StreamLookupHelper;
import com.codeheadsystems.kinesis.model.Configuration;
import com.codeheadsystems.kinesis.store.Shard;
import com.codeheadsystems.kinesis.store.Stream;
import com.codeheadsystems.kinesis.store.StreamRegistry;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.kinesis.model.AddTagsToStreamRequest;
import software.amazon.awssdk.services.kinesis.model.AddTagsToStreamResponse;
import software.amazon.awssdk.services.kinesis.model.CreateStreamRequest;
import software.amazon.awssdk.services.kinesis.model.CreateStreamResponse;
import software.amazon.awssdk.services.kinesis.model.DeleteStreamRequest;
import software.amazon.awssdk.services.kinesis.model.DeleteStreamResponse;
import software.amazon.awssdk.services.kinesis.model.DescribeStreamRequest;
import software.amazon.awssdk.services.kinesis.model.DescribeStreamResponse;
import software.amazon.awssdk.services.kinesis.model.DescribeStreamSummaryRequest;
import software.amazon.awssdk.services.kinesis.model.DescribeStreamSummaryResponse;
import software.amazon.awssdk.services.kinesis.model.InvalidArgumentException;
import software.amazon.awssdk.services.kinesis.model.ListShardsRequest;
import software.amazon.awssdk.services.kinesis.model.ListShardsResponse;
import software.amazon.awssdk.services.kinesis.model.ListStreamsRequest;
import software.amazon.awssdk.services.kinesis.model.ListStreamsResponse;
import software.amazon.awssdk.services.kinesis.model.ListTagsForStreamRequest;
import software.amazon.awssdk.services.kinesis.model.ListTagsForStreamResponse;
import software.amazon.awssdk.services.kinesis.model.RemoveTagsFromStreamRequest;
import software.amazon.awssdk.services.kinesis.model.RemoveTagsFromStreamResponse;
import software.amazon.awssdk.services.kinesis.model.ResourceInUseException;
import software.amazon.awssdk.services.kinesis.model.ResourceNotFoundException;
import software.amazon.awssdk.services.kinesis.model.Tag;

/**
 * Manager for the stream control plane: creating, describing, listing, deleting and tagging.
 */
@Singleton
public class StreamManager {

  private static final Logger log = LoggerFactory.getLogger(StreamManager.class);
  private static final Pattern STREAM_NAME = Pattern.compile("[a-zA-Z0-9_.-]{1,128}");
  private static final int DEFAULT_SHARD_COUNT = 1;
  private static final int MAX_TAGS_PER_CALL = 50;

  private final StreamRegistry streamRegistry;
  private final StreamLookupHelper streamLookupHelper;
  private final StreamDescriptionConverter streamDescriptionConverter;
  private final Configuration configuration;
  private final Clock clock;

  /**
   * Instantiates a new Stream manager.
   *
   * @param streamRegistry             the stream registry
   * @param streamLookupHelper         the stream lookup helper
   * @param streamDescriptionConverter the stream description converter
   * @param configuration              the configuration
   * @param clock                      the clock
   */
  @Inject
  public StreamManager(final StreamRegistry streamRegistry,
                       final StreamLookupHelper streamLookupHelper,
                       final StreamDescriptionConverter streamDescriptionConverter,
                       final Configuration configuration,
                       final Clock clock) {
    log.info("StreamManager({}, {}, {}, {}, {})",
        streamRegistry, streamLookupHelper, streamDescriptionConverter, configuration, clock);
    this.streamRegistry = streamRegistry;
    this.streamLookupHelper = streamLookupHelper;
    this.streamDescriptionConverter = streamDescriptionConverter;
    this.configuration = configuration;
    this.clock = clock;
  }

  /**
   * Creates a stream. The stream is ACTIVE when this returns.
   *
   * @param request the create stream request
   * @return the create stream response
   */
  public CreateStreamResponse createStream(final CreateStreamRequest request) {
    log.trace("createStream({})", request);
    final String name = request.streamName();
    if (name == null || !STREAM_NAME.matcher(name).matches()) {
      throw InvalidArgumentException.builder()
          .message("Invalid stream name: " + name)
          .build();
    }
    final int shardCount = request.shardCount() == null ? DEFAULT_SHARD_COUNT : request.shardCount();
    if (shardCount < 1 || shardCount > configuration.maxShardCount()) {
      throw InvalidArgumentException.builder()
          .message("ShardCount must be between 1 and " + configuration.maxShardCount() + ": " + shardCount)
          .build();
    }
    streamRegistry.createStream(name, arnFor(name), shardCount, clock.instant())
        .orElseThrow(() -> ResourceInUseException.builder()
            .message("Stream " + name + " already exists")
            .build());
    return CreateStreamResponse.builder().build();
  }

  /**
   * Describes a stream, one page of shards at a time.
   *
   * @param request the describe stream request
   * @return the describe stream response
   */
  public DescribeStreamResponse describeStream(final DescribeStreamRequest request) {
    log.trace("describeStream({})", request);
    final Stream stream = streamLookupHelper.getStream(request.streamName(), request.streamARN());
    final List<Shard> shards = shardsAfter(stream, request.exclusiveStartShardId());
    final int limit = pageSize(request.limit(), shards.size());
    return DescribeStreamResponse.builder()
        .streamDescription(streamDescriptionConverter.toStreamDescription(
            stream, shards.subList(0, limit), limit < shards.size()))
        .build();
  }

  /**
   * Summarizes a stream.
   *
   * @param request the request
   * @return the response
   */
  public DescribeStreamSummaryResponse describeStreamSummary(final DescribeStreamSummaryRequest request) {
    log.trace("describeStreamSummary({})", request);
    final Stream stream = streamLookupHelper.getStream(request.streamName(), request.streamARN());
    return DescribeStreamSummaryResponse.builder()
        .streamDescriptionSummary(streamDescriptionConverter.toStreamDescriptionSummary(stream))
        .build();
  }

  /**
   * Lists stream names in creation order. Paging resumes after the position of the named stream,
   * even if it has been deleted since.
   *
   * @param request the list streams request
   * @return the list streams response
   */
  public ListStreamsResponse listStreams(final ListStreamsRequest request) {
    log.trace("listStreams({})", request);
    final List<Stream> streams = streamRegistry.listStreams(request.exclusiveStartStreamName());
    final int limit = pageSize(request.limit(), streams.size());
    final List<Stream> page = streams.subList(0, limit);
    return ListStreamsResponse.builder()
        .streamNames(page.stream().map(Stream::name).collect(Collectors.toList()))
        .streamSummaries(page.stream()
            .map(streamDescriptionConverter::toStreamSummary)
            .collect(Collectors.toList()))
        .hasMoreStreams(limit < streams.size())
        .build();
  }

  /**
   * Deletes a stream with all its shards and records.
   *
   * @param request the delete stream request
   * @return the delete stream response
   */
  public DeleteStreamResponse deleteStream(final DeleteStreamRequest request) {
    log.trace("deleteStream({})", request);
    final String name = streamLookupHelper.getStream(request.streamName(), request.streamARN()).name();
    streamRegistry.deleteStream(name)
        .orElseThrow(() -> ResourceNotFoundException.builder()
            .message("Stream " + name + " not found")
            .build());
    return DeleteStreamResponse.builder().build();
  }

  /**
   * Lists the shards of a stream.
   *
   * @param request the request
   * @return the response
   */
  public ListShardsResponse listShards(final ListShardsRequest request) {
    log.trace("listShards({})", request);
    final Stream stream = streamLookupHelper.getStream(request.streamName(), request.streamARN());
    final List<Shard> shards = shardsAfter(stream, request.exclusiveStartShardId());
    final int limit = pageSize(request.maxResults(), shards.size());
    return ListShardsResponse.builder()
        .shards(streamDescriptionConverter.toShards(shards.subList(0, limit)))
        .build();
  }

  /**
   * Adds or overwrites tags on a stream.
   *
   * @param request the request
   * @return the response
   */
  public AddTagsToStreamResponse addTagsToStream(final AddTagsToStreamRequest request) {
    log.trace("addTagsToStream({})", request);
    final Stream stream = streamLookupHelper.getStream(request.streamName(), request.streamARN());
    final Map<String, String> tags = request.tags();
    if (tags == null || tags.isEmpty() || tags.size() > MAX_TAGS_PER_CALL) {
      throw InvalidArgumentException.builder()
          .message("Between 1 and " + MAX_TAGS_PER_CALL + " tags must be given")
          .build();
    }
    stream.putTags(tags);
    return AddTagsToStreamResponse.builder().build();
  }

  /**
   * Lists tags sorted by key.
   *
   * @param request the request
   * @return the response
   */
  public ListTagsForStreamResponse listTagsForStream(final ListTagsForStreamRequest request) {
    log.trace("listTagsForStream({})", request);
    final Stream stream = streamLookupHelper.getStream(request.streamName(), request.streamARN());
    final List<Tag> tags = new ArrayList<>();
    final String exclusiveStart = request.exclusiveStartTagKey();
    stream.tags().forEach((key, value) -> {
      if (exclusiveStart == null || key.compareTo(exclusiveStart) > 0) {
        tags.add(Tag.builder().key(key).value(value).build());
      }
    });
    final int limit = pageSize(request.limit(), tags.size());
    return ListTagsForStreamResponse.builder()
        .tags(tags.subList(0, limit))
        .hasMoreTags(limit < tags.size())
        .build();
  }

  /**
   * Removes tags from a stream.
   *
   * @param request the request
   * @return the response
   */
  public RemoveTagsFromStreamResponse removeTagsFromStream(final RemoveTagsFromStreamRequest request) {
    log.trace("removeTagsFromStream({})", request);
    final Stream stream = streamLookupHelper.getStream(request.streamName(), request.streamARN());
    if (request.tagKeys() == null || request.tagKeys().isEmpty()) {
      throw InvalidArgumentException.builder()
          .message("At least one tag key must be given")
          .build();
    }
    stream.removeTags(request.tagKeys());
    return RemoveTagsFromStreamResponse.builder().build();
  }

  /**
   * The ARN of a stream: arn:partition:kinesis:region:account:name.
   *
   * @param streamName the stream name
   * @return the arn
   */
  public String arnFor(final String streamName) {
    return String.join(":", "arn", configuration.partition(), "kinesis",
        configuration.region(), configuration.accountId(), streamName);
  }

  private List<Shard> shardsAfter(final Stream stream, final String exclusiveStartShardId) {
    if (exclusiveStartShardId == null) {
      return stream.shards();
    }
    // shard ids are zero padded, so they sort in creation order
    return stream.shards().stream()
        .filter(shard -> shard.shardId().compareTo(exclusiveStartShardId) > 0)
        .collect(Collectors.toList());
  }

  private int pageSize(final Integer requested, final int available) {
    if (requested == null) {
      return available;
    }
    if (requested < 1) {
      throw InvalidArgumentException.builder()
          .message("Limit must be positive: " + requested)
          .build();
    }
    return Math.min(requested, available);
  }
}
