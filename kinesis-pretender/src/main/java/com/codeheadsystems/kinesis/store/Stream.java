package com.codeheadsystems.kinesis.store;

import java.math.BigInteger;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import software.amazon.awssdk.services.kinesis.model.StreamStatus;

/**
 * A named collection of shards. The shard list is fixed when the stream is created.
 */
public class Stream {

  private final String name;
  private final String arn;
  private final long incarnation;
  private final Instant creationTimestamp;
  private final List<Shard> shards;
  private final SortedMap<String, String> tags;
  private volatile StreamStatus status;

  /**
   * Instantiates a new Stream in the CREATING state.
   *
   * @param name              the name
   * @param arn               the arn
   * @param incarnation       the incarnation
   * @param creationTimestamp the creation timestamp
   * @param shards            the shards
   */
  public Stream(final String name,
                final String arn,
                final long incarnation,
                final Instant creationTimestamp,
                final List<Shard> shards) {
    if (shards.isEmpty()) {
      throw new IllegalArgumentException("A stream needs at least one shard: " + name);
    }
    this.name = name;
    this.arn = arn;
    this.incarnation = incarnation;
    this.creationTimestamp = creationTimestamp;
    this.shards = List.copyOf(shards);
    this.tags = new TreeMap<>();
    this.status = StreamStatus.CREATING;
  }

  /**
   * Name.
   *
   * @return the name
   */
  public String name() {
    return name;
  }

  /**
   * The stream ARN.
   *
   * @return the arn
   */
  public String arn() {
    return arn;
  }

  /**
   * Registry-wide creation counter. A stream recreated under the same name gets a new one.
   *
   * @return the incarnation
   */
  public long incarnation() {
    return incarnation;
  }

  /**
   * Creation timestamp.
   *
   * @return the creation timestamp
   */
  public Instant creationTimestamp() {
    return creationTimestamp;
  }

  /**
   * Current status.
   *
   * @return the status
   */
  public StreamStatus status() {
    return status;
  }

  /**
   * Shards in creation order.
   *
   * @return the shards
   */
  public List<Shard> shards() {
    return shards;
  }

  /**
   * Finds a shard by id.
   *
   * @param shardId the shard id
   * @return the shard
   */
  public Optional<Shard> shard(final String shardId) {
    return shards.stream().filter(s -> s.shardId().equals(shardId)).findFirst();
  }

  /**
   * The shard owning the hash key. The shard ranges cover the whole key space, so every valid
   * hash key has an owner.
   *
   * @param hashKey the hash key
   * @return the shard
   */
  public Shard shardForHashKey(final BigInteger hashKey) {
    return shards.stream()
        .filter(s -> s.ownsHashKey(hashKey))
        .findFirst()
        .orElseThrow(() -> new IllegalStateException("No shard of " + name + " owns hash key " + hashKey));
  }

  void markActive() {
    status = StreamStatus.ACTIVE;
  }

  void markDeleting() {
    status = StreamStatus.DELETING;
  }

  /**
   * Adds or overwrites tags.
   *
   * @param newTags the tags
   */
  public synchronized void putTags(final Map<String, String> newTags) {
    tags.putAll(newTags);
  }

  /**
   * Removes tags. Unknown keys are ignored.
   *
   * @param keys the keys
   */
  public synchronized void removeTags(final Collection<String> keys) {
    keys.forEach(tags::remove);
  }

  /**
   * Snapshot of the tags, sorted by key.
   *
   * @return the tags
   */
  public synchronized SortedMap<String, String> tags() {
    return new TreeMap<>(tags);
  }

  @Override
  public String toString() {
    return "Stream{" + name + ", " + status + ", shards=" + shards.size() + "}";
  }
}
