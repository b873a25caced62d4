package com.codeheadsystems.kinesis.store;

import com.codeheadsystems.kinesis.util.HashKeyCalculator;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Collectors;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Table of streams keyed by name. Names are listed in the order the streams were created.
 */
@Singleton
public class StreamRegistry {

  private static final Logger log = LoggerFactory.getLogger(StreamRegistry.class);

  private final HashKeyCalculator hashKeyCalculator;
  private final Map<String, Stream> streams;
  private final Map<String, Long> lastIncarnations;
  private final ReadWriteLock readWriteLock;
  private final AtomicLong incarnations;

  /**
   * Instantiates a new Stream registry.
   *
   * @param hashKeyCalculator the hash key calculator
   */
  @Inject
  public StreamRegistry(final HashKeyCalculator hashKeyCalculator) {
    log.info("StreamRegistry({})", hashKeyCalculator);
    this.hashKeyCalculator = hashKeyCalculator;
    this.streams = new LinkedHashMap<>();
    this.lastIncarnations = new HashMap<>();
    this.readWriteLock = new ReentrantReadWriteLock();
    this.incarnations = new AtomicLong();
  }

  /**
   * Creates a stream with its shards, unless the name is taken.
   *
   * @param name              the name
   * @param arn               the arn
   * @param shardCount        the shard count
   * @param creationTimestamp the creation timestamp
   * @return the new stream, or empty if a stream with the name already exists
   */
  public Optional<Stream> createStream(final String name,
                                       final String arn,
                                       final int shardCount,
                                       final Instant creationTimestamp) {
    log.trace("createStream({}, {}, {})", name, arn, shardCount);
    readWriteLock.writeLock().lock();
    try {
      if (streams.containsKey(name)) {
        log.warn("Stream already exists: {}", name);
        return Optional.empty();
      }
      final List<Shard> shards = new ArrayList<>(shardCount);
      for (int index = 0; index < shardCount; index++) {
        shards.add(new Shard(Shard.shardIdFor(index),
            hashKeyCalculator.startingHashKey(index, shardCount),
            hashKeyCalculator.endingHashKey(index, shardCount)));
      }
      final Stream stream = new Stream(name, arn, incarnations.incrementAndGet(), creationTimestamp, shards);
      stream.markActive();
      streams.put(name, stream);
      lastIncarnations.put(name, stream.incarnation());
      log.info("Created stream {} with {} shards", name, shardCount);
      return Optional.of(stream);
    } finally {
      readWriteLock.writeLock().unlock();
    }
  }

  /**
   * Gets a stream.
   *
   * @param name the name
   * @return the stream
   */
  public Optional<Stream> getStream(final String name) {
    log.trace("getStream({})", name);
    readWriteLock.readLock().lock();
    try {
      return Optional.ofNullable(streams.get(name));
    } finally {
      readWriteLock.readLock().unlock();
    }
  }

  /**
   * Streams in creation order, resuming after the named stream. The position of a name is the
   * last incarnation created under it, so paging continues correctly when that stream has since
   * been deleted. A name never created lists from the beginning.
   *
   * @param exclusiveStartStreamName the name to resume after, may be null
   * @return the streams
   */
  public List<Stream> listStreams(final String exclusiveStartStreamName) {
    log.trace("listStreams({})", exclusiveStartStreamName);
    readWriteLock.readLock().lock();
    try {
      final long after = exclusiveStartStreamName == null
          ? 0L
          : lastIncarnations.getOrDefault(exclusiveStartStreamName, 0L);
      return streams.values().stream()
          .filter(stream -> stream.incarnation() > after)
          .collect(Collectors.toList());
    } finally {
      readWriteLock.readLock().unlock();
    }
  }

  /**
   * Deletes a stream and everything in it.
   *
   * @param name the name
   * @return the deleted stream, or empty if there was none
   */
  public Optional<Stream> deleteStream(final String name) {
    log.trace("deleteStream({})", name);
    readWriteLock.writeLock().lock();
    try {
      final Stream stream = streams.remove(name);
      if (stream == null) {
        return Optional.empty();
      }
      stream.markDeleting();
      log.info("Deleted stream {}", name);
      return Optional.of(stream);
    } finally {
      readWriteLock.writeLock().unlock();
    }
  }
}
