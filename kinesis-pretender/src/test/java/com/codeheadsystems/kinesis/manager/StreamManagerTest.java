package com.codeheadsystems.kinesis.manager;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.codeheadsystems.kinesis.converter.StreamDescriptionConverter;
import com.codeheadsystems.kinesis.helper.StreamLookupHelper;
import com.codeheadsystems.kinesis.model.ImmutableConfiguration;
import com.codeheadsystems.kinesis.store.Shard;
import com.codeheadsystems.kinesis.store.Stream;
import com.codeheadsystems.kinesis.store.StreamRegistry;
import com.codeheadsystems.kinesis.util.HashKeyCalculator;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.services.kinesis.model.AddTagsToStreamRequest;
import software.amazon.awssdk.services.kinesis.model.CreateStreamRequest;
import software.amazon.awssdk.services.kinesis.model.DeleteStreamRequest;
import software.amazon.awssdk.services.kinesis.model.DescribeStreamRequest;
import software.amazon.awssdk.services.kinesis.model.DescribeStreamResponse;
import software.amazon.awssdk.services.kinesis.model.InvalidArgumentException;
import software.amazon.awssdk.services.kinesis.model.ListShardsRequest;
import software.amazon.awssdk.services.kinesis.model.ListShardsResponse;
import software.amazon.awssdk.services.kinesis.model.ListStreamsRequest;
import software.amazon.awssdk.services.kinesis.model.ListStreamsResponse;
import software.amazon.awssdk.services.kinesis.model.ListTagsForStreamRequest;
import software.amazon.awssdk.services.kinesis.model.ListTagsForStreamResponse;
import software.amazon.awssdk.services.kinesis.model.RemoveTagsFromStreamRequest;
import software.amazon.awssdk.services.kinesis.model.ResourceInUseException;
import software.amazon.awssdk.services.kinesis.model.ResourceNotFoundException;
import software.amazon.awssdk.services.kinesis.model.Tag;

@ExtendWith(MockitoExtension.class)
class StreamManagerTest {

  private static final String STREAM_NAME = "my_stream";
  private static final String STREAM_ARN = "arn:aws:kinesis:us-west-2:123456789012:my_stream";
  private static final Instant NOW = Instant.parse("2025-01-01T00:00:00Z");

  @Mock
  private StreamRegistry streamRegistry;

  @Mock
  private StreamLookupHelper streamLookupHelper;

  private StreamManager manager;
  private Stream stream;

  @BeforeEach
  void setup() {
    manager = new StreamManager(streamRegistry, streamLookupHelper, new StreamDescriptionConverter(),
        ImmutableConfiguration.builder().region("us-west-2").build(),
        Clock.fixed(NOW, ZoneOffset.UTC));
    final HashKeyCalculator calculator = new HashKeyCalculator();
    stream = new Stream(STREAM_NAME, STREAM_ARN, 1L, NOW, List.of(
        new Shard(Shard.shardIdFor(0), calculator.startingHashKey(0, 3), calculator.endingHashKey(0, 3)),
        new Shard(Shard.shardIdFor(1), calculator.startingHashKey(1, 3), calculator.endingHashKey(1, 3)),
        new Shard(Shard.shardIdFor(2), calculator.startingHashKey(2, 3), calculator.endingHashKey(2, 3))));
  }

  @Test
  void arnFor() {
    assertThat(manager.arnFor(STREAM_NAME)).isEqualTo(STREAM_ARN);
  }

  @Test
  void createStream_success() {
    when(streamRegistry.createStream(STREAM_NAME, STREAM_ARN, 2, NOW)).thenReturn(Optional.of(stream));

    manager.createStream(CreateStreamRequest.builder().streamName(STREAM_NAME).shardCount(2).build());

    verify(streamRegistry).createStream(STREAM_NAME, STREAM_ARN, 2, NOW);
  }

  @Test
  void createStream_defaultShardCount() {
    when(streamRegistry.createStream(STREAM_NAME, STREAM_ARN, 1, NOW)).thenReturn(Optional.of(stream));

    manager.createStream(CreateStreamRequest.builder().streamName(STREAM_NAME).build());

    verify(streamRegistry).createStream(STREAM_NAME, STREAM_ARN, 1, NOW);
  }

  @Test
  void createStream_duplicate() {
    when(streamRegistry.createStream(anyString(), anyString(), anyInt(), any())).thenReturn(Optional.empty());

    assertThatExceptionOfType(ResourceInUseException.class)
        .isThrownBy(() -> manager.createStream(
            CreateStreamRequest.builder().streamName(STREAM_NAME).shardCount(1).build()))
        .withMessageContaining("already exists");
  }

  @Test
  void createStream_zeroShards() {
    assertThatExceptionOfType(InvalidArgumentException.class)
        .isThrownBy(() -> manager.createStream(
            CreateStreamRequest.builder().streamName(STREAM_NAME).shardCount(0).build()));
    verifyNoInteractions(streamRegistry);
  }

  @Test
  void createStream_tooManyShards() {
    assertThatExceptionOfType(InvalidArgumentException.class)
        .isThrownBy(() -> manager.createStream(
            CreateStreamRequest.builder().streamName(STREAM_NAME).shardCount(501).build()))
        .withMessageContaining("500");
    assertThatExceptionOfType(InvalidArgumentException.class)
        .isThrownBy(() -> manager.createStream(
            CreateStreamRequest.builder().streamName(STREAM_NAME).shardCount(Integer.MAX_VALUE).build()));
    verifyNoInteractions(streamRegistry);
  }

  @Test
  void createStream_configuredShardLimit() {
    final StreamManager limited = new StreamManager(streamRegistry, streamLookupHelper,
        new StreamDescriptionConverter(), ImmutableConfiguration.builder().maxShardCount(2).build(),
        Clock.fixed(NOW, ZoneOffset.UTC));

    assertThatExceptionOfType(InvalidArgumentException.class)
        .isThrownBy(() -> limited.createStream(
            CreateStreamRequest.builder().streamName(STREAM_NAME).shardCount(3).build()));
    verifyNoInteractions(streamRegistry);
  }

  @Test
  void createStream_badName() {
    assertThatExceptionOfType(InvalidArgumentException.class)
        .isThrownBy(() -> manager.createStream(
            CreateStreamRequest.builder().streamName("no spaces allowed").shardCount(1).build()));
    assertThatExceptionOfType(InvalidArgumentException.class)
        .isThrownBy(() -> manager.createStream(CreateStreamRequest.builder().shardCount(1).build()));
    verifyNoInteractions(streamRegistry);
  }

  @Test
  void describeStream_allShards() {
    when(streamLookupHelper.getStream(STREAM_NAME, null)).thenReturn(stream);

    final DescribeStreamResponse response = manager.describeStream(
        DescribeStreamRequest.builder().streamName(STREAM_NAME).build());

    assertThat(response.streamDescription().streamName()).isEqualTo(STREAM_NAME);
    assertThat(response.streamDescription().streamARN()).isEqualTo(STREAM_ARN);
    assertThat(response.streamDescription().shards()).hasSize(3);
    assertThat(response.streamDescription().hasMoreShards()).isFalse();
  }

  @Test
  void describeStream_paged() {
    when(streamLookupHelper.getStream(STREAM_NAME, null)).thenReturn(stream);

    final DescribeStreamResponse first = manager.describeStream(
        DescribeStreamRequest.builder().streamName(STREAM_NAME).limit(2).build());
    final DescribeStreamResponse second = manager.describeStream(
        DescribeStreamRequest.builder().streamName(STREAM_NAME).limit(2)
            .exclusiveStartShardId(first.streamDescription().shards().get(1).shardId()).build());

    assertThat(first.streamDescription().shards()).hasSize(2);
    assertThat(first.streamDescription().hasMoreShards()).isTrue();
    assertThat(second.streamDescription().shards()).hasSize(1);
    assertThat(second.streamDescription().shards().get(0).shardId()).isEqualTo("shardId-000000000002");
    assertThat(second.streamDescription().hasMoreShards()).isFalse();
  }

  @Test
  void describeStream_notFound() {
    when(streamLookupHelper.getStream("not-a-stream", null))
        .thenThrow(ResourceNotFoundException.builder().message("Stream not-a-stream not found").build());

    assertThatExceptionOfType(ResourceNotFoundException.class)
        .isThrownBy(() -> manager.describeStream(
            DescribeStreamRequest.builder().streamName("not-a-stream").build()));
  }

  private Stream namedStream(final String name, final long incarnation) {
    return new Stream(name, manager.arnFor(name), incarnation, NOW,
        List.of(new Shard(Shard.shardIdFor(0), HashKeyCalculator.MIN_HASH_KEY, HashKeyCalculator.MAX_HASH_KEY)));
  }

  @Test
  void listStreams_paged() {
    final Stream a = namedStream("a", 1L);
    final Stream b = namedStream("b", 2L);
    final Stream c = namedStream("c", 3L);
    when(streamRegistry.listStreams(null)).thenReturn(List.of(a, b, c));
    when(streamRegistry.listStreams("b")).thenReturn(List.of(c));

    final ListStreamsResponse first = manager.listStreams(ListStreamsRequest.builder().limit(2).build());
    final ListStreamsResponse second = manager.listStreams(
        ListStreamsRequest.builder().exclusiveStartStreamName("b").build());

    assertThat(first.streamNames()).containsExactly("a", "b");
    assertThat(first.hasMoreStreams()).isTrue();
    assertThat(first.streamSummaries()).hasSize(2);
    assertThat(second.streamNames()).containsExactly("c");
    assertThat(second.hasMoreStreams()).isFalse();
  }

  @Test
  void listStreams_badLimit() {
    when(streamRegistry.listStreams(null)).thenReturn(List.of());

    assertThatExceptionOfType(InvalidArgumentException.class)
        .isThrownBy(() -> manager.listStreams(ListStreamsRequest.builder().limit(0).build()));
  }

  @Test
  void deleteStream_success() {
    when(streamLookupHelper.getStream(STREAM_NAME, null)).thenReturn(stream);
    when(streamRegistry.deleteStream(STREAM_NAME)).thenReturn(Optional.of(stream));

    manager.deleteStream(DeleteStreamRequest.builder().streamName(STREAM_NAME).build());

    verify(streamRegistry).deleteStream(STREAM_NAME);
  }

  @Test
  void deleteStream_notFound() {
    when(streamLookupHelper.getStream("not-a-stream", null))
        .thenThrow(ResourceNotFoundException.builder().message("Stream not-a-stream not found").build());

    assertThatExceptionOfType(ResourceNotFoundException.class)
        .isThrownBy(() -> manager.deleteStream(DeleteStreamRequest.builder().streamName("not-a-stream").build()));
    verifyNoInteractions(streamRegistry);
  }

  @Test
  void deleteStream_goneBeforeRemoval() {
    when(streamLookupHelper.getStream(STREAM_NAME, null)).thenReturn(stream);
    when(streamRegistry.deleteStream(STREAM_NAME)).thenReturn(Optional.empty());

    assertThatExceptionOfType(ResourceNotFoundException.class)
        .isThrownBy(() -> manager.deleteStream(DeleteStreamRequest.builder().streamName(STREAM_NAME).build()));
  }

  @Test
  void listShards_maxResults() {
    when(streamLookupHelper.getStream(STREAM_NAME, null)).thenReturn(stream);

    final ListShardsResponse response = manager.listShards(
        ListShardsRequest.builder().streamName(STREAM_NAME).exclusiveStartShardId(Shard.shardIdFor(0))
            .maxResults(1).build());

    assertThat(response.shards()).hasSize(1);
    assertThat(response.shards().get(0).shardId()).isEqualTo(Shard.shardIdFor(1));
  }

  @Test
  void listShards_resumesAfterShardIdNotInStream() {
    when(streamLookupHelper.getStream(STREAM_NAME, null)).thenReturn(stream);

    final ListShardsResponse response = manager.listShards(
        ListShardsRequest.builder().streamName(STREAM_NAME).exclusiveStartShardId("shardId-000000000001a").build());

    assertThat(response.shards()).extracting(software.amazon.awssdk.services.kinesis.model.Shard::shardId)
        .containsExactly(Shard.shardIdFor(2));
  }

  @Test
  void describeStream_afterLastShard() {
    when(streamLookupHelper.getStream(STREAM_NAME, null)).thenReturn(stream);

    final DescribeStreamResponse response = manager.describeStream(DescribeStreamRequest.builder()
        .streamName(STREAM_NAME).exclusiveStartShardId("shardId-000000000009").build());

    assertThat(response.streamDescription().shards()).isEmpty();
    assertThat(response.streamDescription().hasMoreShards()).isFalse();
  }

  @Test
  void tags_addListRemove() {
    when(streamLookupHelper.getStream(eq(STREAM_NAME), any())).thenReturn(stream);

    manager.addTagsToStream(AddTagsToStreamRequest.builder().streamName(STREAM_NAME)
        .tags(Map.of("team", "data", "env", "test", "cost", "1")).build());
    manager.removeTagsFromStream(RemoveTagsFromStreamRequest.builder().streamName(STREAM_NAME)
        .tagKeys("cost").build());
    final ListTagsForStreamResponse first = manager.listTagsForStream(
        ListTagsForStreamRequest.builder().streamName(STREAM_NAME).limit(1).build());
    final ListTagsForStreamResponse second = manager.listTagsForStream(
        ListTagsForStreamRequest.builder().streamName(STREAM_NAME).exclusiveStartTagKey("env").build());

    assertThat(first.tags()).extracting(Tag::key).containsExactly("env");
    assertThat(first.hasMoreTags()).isTrue();
    assertThat(second.tags()).containsExactly(Tag.builder().key("team").value("data").build());
    assertThat(second.hasMoreTags()).isFalse();
  }

  @Test
  void addTagsToStream_empty() {
    when(streamLookupHelper.getStream(STREAM_NAME, null)).thenReturn(stream);

    assertThatExceptionOfType(InvalidArgumentException.class)
        .isThrownBy(() -> manager.addTagsToStream(
            AddTagsToStreamRequest.builder().streamName(STREAM_NAME).build()));
  }
}
