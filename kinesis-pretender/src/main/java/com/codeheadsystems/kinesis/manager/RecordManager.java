package com.codeheadsystems.kinesis.manager;

import com.codeheadsystems.kinesis.helper.StreamLookupHelper;
import com.codeheadsystems.kinesis.model.ShardRecord;
import com.codeheadsystems.kinesis.store.Shard;
import com.codeheadsystems.kinesis.store.Stream;
import com.codeheadsystems.kinesis.util.HashKeyCalculator;
import java.math.BigInteger;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.services.kinesis.model.EncryptionType;
import software.amazon.awssdk.services.kinesis.model.InvalidArgumentException;
import software.amazon.awssdk.services.kinesis.model.PutRecordRequest;
import software.amazon.awssdk.services.kinesis.model.PutRecordResponse;
import software.amazon.awssdk.services.kinesis.model.PutRecordsRequest;
import software.amazon.awssdk.services.kinesis.model.PutRecordsRequestEntry;
import software.amazon.awssdk.services.kinesis.model.PutRecordsResponse;
import software.amazon.awssdk.services.kinesis.model.PutRecordsResultEntry;

/**
 * Manager for appending records. Routes each record to the shard owning its hash key.
 */
@Singleton
public class RecordManager {

  private static final Logger log = LoggerFactory.getLogger(RecordManager.class);
  private static final int MAX_PARTITION_KEY_LENGTH = 256;
  private static final int MAX_DATA_SIZE = 1024 * 1024;
  private static final int MAX_PUT_RECORDS_ENTRIES = 500;

  private final StreamLookupHelper streamLookupHelper;
  private final HashKeyCalculator hashKeyCalculator;
  private final Clock clock;

  /**
   * Instantiates a new Record manager.
   *
   * @param streamLookupHelper the stream lookup helper
   * @param hashKeyCalculator  the hash key calculator
   * @param clock              the clock
   */
  @Inject
  public RecordManager(final StreamLookupHelper streamLookupHelper,
                       final HashKeyCalculator hashKeyCalculator,
                       final Clock clock) {
    log.info("RecordManager({}, {}, {})", streamLookupHelper, hashKeyCalculator, clock);
    this.streamLookupHelper = streamLookupHelper;
    this.hashKeyCalculator = hashKeyCalculator;
    this.clock = clock;
  }

  /**
   * Appends a single record.
   *
   * @param request the put record request
   * @return the shard and sequence number assigned
   */
  public PutRecordResponse putRecord(final PutRecordRequest request) {
    log.trace("putRecord({})", request);
    final Stream stream = streamLookupHelper.getStream(request.streamName(), request.streamARN());
    final BigInteger hashKey = validate(request.partitionKey(), request.explicitHashKey(), request.data());
    final Shard shard = stream.shardForHashKey(hashKey);
    final ShardRecord record = shard.append(request.partitionKey(),
        Optional.ofNullable(request.explicitHashKey()), request.data().asByteArray(), clock.instant());
    log.debug("Put record {} into {}/{}", record.sequenceNumber(), stream.name(), shard.shardId());
    return PutRecordResponse.builder()
        .shardId(shard.shardId())
        .sequenceNumber(record.sequenceNumberString())
        .encryptionType(EncryptionType.NONE)
        .build();
  }

  /**
   * Appends a batch of records in request order. The whole batch is validated before any record
   * is appended, so an invalid entry rejects the request without partial writes.
   *
   * @param request the put records request
   * @return one result entry per request entry
   */
  public PutRecordsResponse putRecords(final PutRecordsRequest request) {
    log.trace("putRecords({})", request);
    final Stream stream = streamLookupHelper.getStream(request.streamName(), request.streamARN());
    final List<PutRecordsRequestEntry> entries = request.records();
    if (entries == null || entries.isEmpty() || entries.size() > MAX_PUT_RECORDS_ENTRIES) {
      throw InvalidArgumentException.builder()
          .message("Between 1 and " + MAX_PUT_RECORDS_ENTRIES + " records must be given")
          .build();
    }
    final List<BigInteger> hashKeys = new ArrayList<>(entries.size());
    for (PutRecordsRequestEntry entry : entries) {
      hashKeys.add(validate(entry.partitionKey(), entry.explicitHashKey(), entry.data()));
    }
    final List<PutRecordsResultEntry> results = new ArrayList<>(entries.size());
    for (int i = 0; i < entries.size(); i++) {
      final PutRecordsRequestEntry entry = entries.get(i);
      final Shard shard = stream.shardForHashKey(hashKeys.get(i));
      final ShardRecord record = shard.append(entry.partitionKey(),
          Optional.ofNullable(entry.explicitHashKey()), entry.data().asByteArray(), clock.instant());
      results.add(PutRecordsResultEntry.builder()
          .shardId(shard.shardId())
          .sequenceNumber(record.sequenceNumberString())
          .build());
    }
    log.debug("Put {} records into {}", results.size(), stream.name());
    return PutRecordsResponse.builder()
        .failedRecordCount(0)
        .records(results)
        .encryptionType(EncryptionType.NONE)
        .build();
  }

  private BigInteger validate(final String partitionKey,
                              final String explicitHashKey,
                              final SdkBytes data) {
    if (partitionKey == null || partitionKey.isEmpty() || partitionKey.length() > MAX_PARTITION_KEY_LENGTH) {
      throw InvalidArgumentException.builder()
          .message("PartitionKey must be between 1 and " + MAX_PARTITION_KEY_LENGTH + " characters")
          .build();
    }
    if (data == null) {
      throw InvalidArgumentException.builder().message("Data is required").build();
    }
    if (data.asByteArrayUnsafe().length > MAX_DATA_SIZE) {
      throw InvalidArgumentException.builder()
          .message("Data exceeds " + MAX_DATA_SIZE + " bytes")
          .build();
    }
    if (explicitHashKey == null) {
      return hashKeyCalculator.hashKeyFor(partitionKey);
    }
    return hashKeyCalculator.parseExplicitHashKey(explicitHashKey)
        .orElseThrow(() -> InvalidArgumentException.builder()
            .message("Invalid ExplicitHashKey: " + explicitHashKey)
            .build());
  }
}
