package com.codeheadsystems.kinesis;

import com.codeheadsystems.kinesis.manager.RecordManager;
import com.codeheadsystems.kinesis.manager.ShardIteratorManager;
import com.codeheadsystems.kinesis.manager.StreamManager;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.kinesis.KinesisClient;
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
import software.amazon.awssdk.services.kinesis.model.GetRecordsRequest;
import software.amazon.awssdk.services.kinesis.model.GetRecordsResponse;
import software.amazon.awssdk.services.kinesis.model.GetShardIteratorRequest;
import software.amazon.awssdk.services.kinesis.model.GetShardIteratorResponse;
import software.amazon.awssdk.services.kinesis.model.ListShardsRequest;
import software.amazon.awssdk.services.kinesis.model.ListShardsResponse;
import software.amazon.awssdk.services.kinesis.model.ListStreamsRequest;
import software.amazon.awssdk.services.kinesis.model.ListStreamsResponse;
import software.amazon.awssdk.services.kinesis.model.ListTagsForStreamRequest;
import software.amazon.awssdk.services.kinesis.model.ListTagsForStreamResponse;
import software.amazon.awssdk.services.kinesis.model.PutRecordRequest;
import software.amazon.awssdk.services.kinesis.model.PutRecordResponse;
import software.amazon.awssdk.services.kinesis.model.PutRecordsRequest;
import software.amazon.awssdk.services.kinesis.model.PutRecordsResponse;
import software.amazon.awssdk.services.kinesis.model.RemoveTagsFromStreamRequest;
import software.amazon.awssdk.services.kinesis.model.RemoveTagsFromStreamResponse;

/**
 * Pretender implementation of the Kinesis client, backed by in-memory streams.
 * Operations not listed here fall through to the SDK defaults and throw UnsupportedOperationException.
 */
@Singleton
public class KinesisPretenderClient implements KinesisClient {

  private static final Logger log = LoggerFactory.getLogger(KinesisPretenderClient.class);

  private static final String SERVICE_NAME = "kinesis";
  private final StreamManager streamManager;
  private final RecordManager recordManager;
  private final ShardIteratorManager shardIteratorManager;

  /**
   * Instantiates a new Kinesis pretender client.
   *
   * @param streamManager        the stream manager
   * @param recordManager        the record manager
   * @param shardIteratorManager the shard iterator manager
   */
  @Inject
  public KinesisPretenderClient(final StreamManager streamManager,
                                final RecordManager recordManager,
                                final ShardIteratorManager shardIteratorManager) {
    log.info("KinesisPretenderClient({},{},{})", streamManager, recordManager, shardIteratorManager);
    this.streamManager = streamManager;
    this.recordManager = recordManager;
    this.shardIteratorManager = shardIteratorManager;
  }

  @Override
  public String serviceName() {
    return SERVICE_NAME;
  }

  @Override
  public void close() {
    log.debug("close() called - no-op for pretender client");
  }

  @Override
  public CreateStreamResponse createStream(final CreateStreamRequest createStreamRequest) throws AwsServiceException, SdkClientException {
    return streamManager.createStream(createStreamRequest);
  }

  @Override
  public DescribeStreamResponse describeStream(final DescribeStreamRequest describeStreamRequest) throws AwsServiceException, SdkClientException {
    return streamManager.describeStream(describeStreamRequest);
  }

  @Override
  public DescribeStreamSummaryResponse describeStreamSummary(final DescribeStreamSummaryRequest describeStreamSummaryRequest) throws AwsServiceException, SdkClientException {
    return streamManager.describeStreamSummary(describeStreamSummaryRequest);
  }

  @Override
  public ListStreamsResponse listStreams(final ListStreamsRequest listStreamsRequest) throws AwsServiceException, SdkClientException {
    return streamManager.listStreams(listStreamsRequest);
  }

  @Override
  public DeleteStreamResponse deleteStream(final DeleteStreamRequest deleteStreamRequest) throws AwsServiceException, SdkClientException {
    return streamManager.deleteStream(deleteStreamRequest);
  }

  @Override
  public ListShardsResponse listShards(final ListShardsRequest listShardsRequest) throws AwsServiceException, SdkClientException {
    return streamManager.listShards(listShardsRequest);
  }

  @Override
  public AddTagsToStreamResponse addTagsToStream(final AddTagsToStreamRequest addTagsToStreamRequest) throws AwsServiceException, SdkClientException {
    return streamManager.addTagsToStream(addTagsToStreamRequest);
  }

  @Override
  public ListTagsForStreamResponse listTagsForStream(final ListTagsForStreamRequest listTagsForStreamRequest) throws AwsServiceException, SdkClientException {
    return streamManager.listTagsForStream(listTagsForStreamRequest);
  }

  @Override
  public RemoveTagsFromStreamResponse removeTagsFromStream(final RemoveTagsFromStreamRequest removeTagsFromStreamRequest) throws AwsServiceException, SdkClientException {
    return streamManager.removeTagsFromStream(removeTagsFromStreamRequest);
  }

  @Override
  public PutRecordResponse putRecord(final PutRecordRequest putRecordRequest) throws AwsServiceException, SdkClientException {
    return recordManager.putRecord(putRecordRequest);
  }

  @Override
  public PutRecordsResponse putRecords(final PutRecordsRequest putRecordsRequest) throws AwsServiceException, SdkClientException {
    return recordManager.putRecords(putRecordsRequest);
  }

  @Override
  public GetShardIteratorResponse getShardIterator(final GetShardIteratorRequest getShardIteratorRequest) throws AwsServiceException, SdkClientException {
    return shardIteratorManager.getShardIterator(getShardIteratorRequest);
  }

  @Override
  public GetRecordsResponse getRecords(final GetRecordsRequest getRecordsRequest) throws AwsServiceException, SdkClientException {
    return shardIteratorManager.getRecords(getRecordsRequest);
  }
}
