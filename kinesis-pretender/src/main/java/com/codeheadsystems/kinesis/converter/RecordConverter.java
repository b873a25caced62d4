package com.codeheadsystems.kinesis.converter;

import com.codeheadsystems.kinesis.model.ShardRecord;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.services.kinesis.model.EncryptionType;
import software.amazon.awssdk.services.kinesis.model.Record;

/**
 * Converter for transforming stored shard records to AWS SDK Record objects.
 */
@Singleton
public class RecordConverter {

  private static final Logger log = LoggerFactory.getLogger(RecordConverter.class);

  /**
   * Instantiates a new Record converter.
   */
  @Inject
  public RecordConverter() {
    log.info("RecordConverter()");
  }

  /**
   * Converts a ShardRecord to an AWS SDK Record.
   *
   * @param shardRecord the shard record
   * @return the AWS SDK Record
   */
  public Record toRecord(final ShardRecord shardRecord) {
    log.trace("toRecord({})", shardRecord);
    return Record.builder()
        .sequenceNumber(shardRecord.sequenceNumberString())
        .partitionKey(shardRecord.partitionKey())
        .data(SdkBytes.fromByteArray(shardRecord.data()))
        .approximateArrivalTimestamp(shardRecord.approximateArrivalTimestamp())
        .encryptionType(EncryptionType.NONE)
        .build();
  }
}
