/*
 * Copyright (c) 2025. Ned Wolpert
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.codeheadsystems.kinesis.util;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Optional;
import java.util.regex.Pattern;
import javax.inject.Inject;
import javax.inject.Singleton;

/**
 * Computes the 128-bit hash keys used to route records to shards.
 *
 * <p>Routing follows the Kinesis model:
 * <ul>
 *   <li><strong>Hash key space:</strong> 0 through 2^128 - 1, split evenly between the shards of a
 *   stream. The last shard absorbs the remainder.</li>
 *   <li><strong>Record hash key:</strong> the MD5 digest of the UTF-8 partition key read as an
 *   unsigned integer, unless the producer supplies an explicit hash key.</li>
 * </ul>
 */
@Singleton
public class HashKeyCalculator {

  /**
   * The smallest hash key.
   */
  public static final BigInteger MIN_HASH_KEY = BigInteger.ZERO;

  /**
   * The largest hash key, 2^128 - 1.
   */
  public static final BigInteger MAX_HASH_KEY = BigInteger.TWO.pow(128).subtract(BigInteger.ONE);

  private static final BigInteger KEY_SPACE = MAX_HASH_KEY.add(BigInteger.ONE);
  private static final Pattern DECIMAL = Pattern.compile("[0-9]+");

  /**
   * Instantiates a new Hash key calculator.
   */
  @Inject
  public HashKeyCalculator() {
    // Stateless
  }

  /**
   * Hash key for a partition key.
   *
   * @param partitionKey the partition key
   * @return the hash key
   */
  public BigInteger hashKeyFor(final String partitionKey) {
    return new BigInteger(1, md5(partitionKey.getBytes(StandardCharsets.UTF_8)));
  }

  /**
   * Parses an explicit hash key.
   *
   * @param explicitHashKey the decimal hash key
   * @return the hash key, or empty if it is not a decimal within the hash key space
   */
  public Optional<BigInteger> parseExplicitHashKey(final String explicitHashKey) {
    if (explicitHashKey == null || !DECIMAL.matcher(explicitHashKey).matches()) {
      return Optional.empty();
    }
    final BigInteger hashKey = new BigInteger(explicitHashKey);
    if (hashKey.compareTo(MAX_HASH_KEY) > 0) {
      return Optional.empty();
    }
    return Optional.of(hashKey);
  }

  /**
   * First hash key owned by a shard.
   *
   * @param shardIndex the index of the shard in its stream
   * @param shardCount the number of shards in the stream
   * @return the starting hash key
   */
  public BigInteger startingHashKey(final int shardIndex, final int shardCount) {
    checkIndex(shardIndex, shardCount);
    return width(shardCount).multiply(BigInteger.valueOf(shardIndex));
  }

  /**
   * Last hash key owned by a shard, inclusive.
   *
   * @param shardIndex the index of the shard in its stream
   * @param shardCount the number of shards in the stream
   * @return the ending hash key
   */
  public BigInteger endingHashKey(final int shardIndex, final int shardCount) {
    checkIndex(shardIndex, shardCount);
    if (shardIndex == shardCount - 1) {
      return MAX_HASH_KEY;
    }
    return startingHashKey(shardIndex + 1, shardCount).subtract(BigInteger.ONE);
  }

  private BigInteger width(final int shardCount) {
    return KEY_SPACE.divide(BigInteger.valueOf(shardCount));
  }

  private void checkIndex(final int shardIndex, final int shardCount) {
    if (shardCount < 1 || shardIndex < 0 || shardIndex >= shardCount) {
      throw new IllegalArgumentException("Invalid shard index " + shardIndex + " of " + shardCount);
    }
  }

  private static byte[] md5(final byte[] data) {
    try {
      return MessageDigest.getInstance("MD5").digest(data);
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("MD5 not available", e);
    }
  }
}
