package com.codeheadsystems.kinesis.manager;

import com.codeheadsystems.kinesis.converter.RecordConverter;
import com.codeheadsystems.kinesis.converter.ShardIteratorCodec;
import com.codeheadsystems.kinesis.helper.StreamLookupHelper;
import com.codeheadsystems.kinesis.model.Configuration;
import com.codeheadsystems.kinesis.model.ImmutableShardIterator;
import com.codeheadsystems.kinesis.model.ShardIterator;
import com.codeheadsystems.kinesis.model.ShardRecord;
import com.codeheadsystems.kinesis.model.ShardSlice;
import com.codeheadsystems.kinesis.store.Shard;
import com.codeheadsystems.kinesis.store.Stream;
import com.codeheadsystems.kinesis.store.StreamRegistry;
import java.time.Clock;
import java.util.List;
import java.util.OptionalInt;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.kinesis.model.GetRecordsRequest;
import software.amazon.awssdk.services.kinesis.model.GetRecordsResponse;
import software.amazon.awssdk.services.kinesis.model.GetShardIteratorRequest;
import software.amazon.awssdk.services.kinesis.model.GetShardIteratorResponse;
import software.amazon.awssdk.services.kinesis.model.InvalidArgumentException;
import software.amazon.awssdk.services.kinesis.model.ResourceNotFoundException;
import software.amazon.awssdk.services.kinesis.model.ShardIteratorType;

/**
 * Manager for reading streams: issues shard iterators and resolves them when records are read.
 */
@Singleton
public class ShardIteratorManager {

  private static final Logger log = LoggerFactory.getLogger(ShardIteratorManager.class);
  private static final Pattern SEQUENCE_NUMBER = Pattern.compile("[0-9]+");

  private final StreamRegistry streamRegistry;
  private final StreamLookupHelper streamLookupHelper;
  private final ShardIteratorCodec shardIteratorCodec;
  private final RecordConverter recordConverter;
  private final Configuration configuration;
  private final Clock clock;

  /**
   * Instantiates a new Shard iterator manager.
   *
   * @param streamRegistry     the stream registry
   * @param streamLookupHelper the stream lookup helper
   * @param shardIteratorCodec the shard iterator codec
   * @param recordConverter    the record converter
   * @param configuration      the configuration
   * @param clock              the clock
   */
  @Inject
  public ShardIteratorManager(final StreamRegistry streamRegistry,
                              final StreamLookupHelper streamLookupHelper,
                              final ShardIteratorCodec shardIteratorCodec,
                              final RecordConverter recordConverter,
                              final Configuration configuration,
                              final Clock clock) {
    log.info("ShardIteratorManager({}, {}, {}, {}, {}, {})",
        streamRegistry, streamLookupHelper, shardIteratorCodec, recordConverter, configuration, clock);
    this.streamRegistry = streamRegistry;
    this.streamLookupHelper = streamLookupHelper;
    this.shardIteratorCodec = shardIteratorCodec;
    this.recordConverter = recordConverter;
    this.configuration = configuration;
    this.clock = clock;
  }

  /**
   * Gets a shard iterator for reading records.
   *
   * @param request the get shard iterator request
   * @return the get shard iterator response
   */
  public GetShardIteratorResponse getShardIterator(final GetShardIteratorRequest request) {
    log.trace("getShardIterator({})", request);

    final Stream stream = streamLookupHelper.getStream(request.streamName(), request.streamARN());
    final Shard shard = streamLookupHelper.getShard(stream, request.shardId());
    final ShardIteratorType type = request.shardIteratorType();

    final ImmutableShardIterator.Builder builder = ImmutableShardIterator.builder()
        .streamName(stream.name())
        .streamIncarnation(stream.incarnation())
        .shardId(shard.shardId())
        .type(supportedType(type, request.shardIteratorTypeAsString()));

    switch (type) {
      case AT_SEQUENCE_NUMBER, AFTER_SEQUENCE_NUMBER -> {
        final long sequenceNumber = parseSequenceNumber(type, request.startingSequenceNumber());
        if (shard.indexOf(sequenceNumber).isEmpty()) {
          throw InvalidArgumentException.builder()
              .message("Sequence number " + sequenceNumber + " not found in " + shard.shardId())
              .build();
        }
        builder.sequenceNumber(request.startingSequenceNumber());
      }
      case LATEST -> builder.position((long) shard.size()); // anchored now, not when read
      default -> {
        // TRIM_HORIZON needs no anchor
      }
    }

    return GetShardIteratorResponse.builder()
        .shardIterator(shardIteratorCodec.encode(builder.build()))
        .build();
  }

  /**
   * Gets records from a shard iterator. The next iterator is always returned, even when the shard
   * has nothing more to read.
   *
   * @param request the get records request
   * @return the get records response
   */
  public GetRecordsResponse getRecords(final GetRecordsRequest request) {
    log.trace("getRecords({})", request);

    final int limit = limit(request.limit());
    final ShardIterator iterator = shardIteratorCodec.decode(request.shardIterator());
    final Stream stream = streamRegistry.getStream(iterator.streamName())
        .filter(s -> s.incarnation() == iterator.streamIncarnation())
        .orElseThrow(() -> ResourceNotFoundException.builder()
            .message("Stream " + iterator.streamName() + " not found")
            .build());
    final Shard shard = streamLookupHelper.getShard(stream, iterator.shardId());

    final ShardSlice slice = shard.read(startIndex(iterator, shard), limit);
    final List<ShardRecord> shardRecords = slice.records();

    final ShardIterator next;
    final long millisBehindLatest;
    if (shardRecords.isEmpty()) {
      next = iterator;
      millisBehindLatest = 0L;
    } else {
      final ShardRecord last = shardRecords.get(shardRecords.size() - 1);
      next = ImmutableShardIterator.builder()
          .streamName(iterator.streamName())
          .streamIncarnation(iterator.streamIncarnation())
          .shardId(iterator.shardId())
          .type(ShardIteratorType.AFTER_SEQUENCE_NUMBER)
          .sequenceNumber(last.sequenceNumberString())
          .build();
      millisBehindLatest = slice.remaining() == 0
          ? 0L
          : Math.max(0L, clock.millis() - last.approximateArrivalTimestamp().toEpochMilli());
    }
    log.debug("Read {} records from {}/{}, {} remaining",
        shardRecords.size(), stream.name(), shard.shardId(), slice.remaining());

    return GetRecordsResponse.builder()
        .records(shardRecords.stream().map(recordConverter::toRecord).collect(Collectors.toList()))
        .nextShardIterator(shardIteratorCodec.encode(next))
        .millisBehindLatest(millisBehindLatest)
        .build();
  }

  /**
   * Resolves an iterator to the index of the next record to read, against the shard as it is now.
   *
   * @param iterator the iterator
   * @param shard    the shard
   * @return the index
   */
  long startIndex(final ShardIterator iterator, final Shard shard) {
    return switch (iterator.type()) {
      case TRIM_HORIZON -> 0L;
      case LATEST -> iterator.position()
          .orElseThrow(() -> invalidIterator("LATEST iterator without a position"));
      case AT_SEQUENCE_NUMBER -> indexOfAnchor(iterator, shard);
      case AFTER_SEQUENCE_NUMBER -> indexOfAnchor(iterator, shard) + 1L;
      default -> throw invalidIterator("Unsupported iterator type " + iterator.type());
    };
  }

  private long indexOfAnchor(final ShardIterator iterator, final Shard shard) {
    final String anchor = iterator.sequenceNumber()
        .orElseThrow(() -> invalidIterator(iterator.type() + " iterator without a sequence number"));
    final OptionalInt index = shard.indexOf(parseSequenceNumber(iterator.type(), anchor));
    if (index.isEmpty()) {
      throw invalidIterator("Sequence number " + anchor + " not found in " + shard.shardId());
    }
    return index.getAsInt();
  }

  private ShardIteratorType supportedType(final ShardIteratorType type, final String typeAsString) {
    if (type == null
        || type == ShardIteratorType.UNKNOWN_TO_SDK_VERSION
        || type == ShardIteratorType.AT_TIMESTAMP) {
      log.warn("Rejecting shard iterator type {}", typeAsString);
      throw InvalidArgumentException.builder()
          .message("Unsupported shard iterator type: " + typeAsString)
          .build();
    }
    return type;
  }

  private long parseSequenceNumber(final ShardIteratorType type, final String sequenceNumber) {
    if (sequenceNumber == null || sequenceNumber.isEmpty()) {
      throw InvalidArgumentException.builder()
          .message("StartingSequenceNumber is required for " + type)
          .build();
    }
    if (!SEQUENCE_NUMBER.matcher(sequenceNumber).matches()) {
      throw InvalidArgumentException.builder()
          .message("Malformed sequence number: " + sequenceNumber)
          .build();
    }
    try {
      return Long.parseLong(sequenceNumber);
    } catch (NumberFormatException e) {
      throw InvalidArgumentException.builder()
          .message("Sequence number out of range: " + sequenceNumber)
          .cause(e)
          .build();
    }
  }

  private int limit(final Integer requested) {
    if (requested == null) {
      return Integer.MAX_VALUE;
    }
    if (requested < 1 || requested > configuration.maxGetRecordsLimit()) {
      throw InvalidArgumentException.builder()
          .message("Limit must be between 1 and " + configuration.maxGetRecordsLimit() + ": " + requested)
          .build();
    }
    return requested;
  }

  private InvalidArgumentException invalidIterator(final String message) {
    return InvalidArgumentException.builder().message("Invalid shard iterator: " + message).build();
  }
}
