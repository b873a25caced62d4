package com.codeheadsystems.kinesis.converter;

import com.codeheadsystems.kinesis.model.ImmutableShardIterator;
import com.codeheadsystems.kinesis.model.ShardIterator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.kinesis.model.InvalidArgumentException;

/**
 * Codec for encoding/decoding shard iterators to/from Base64 strings.
 * Shard iterators are JSON objects encoded as Base64 so callers treat them as opaque tokens.
 */
@Singleton
public class ShardIteratorCodec {

  private static final Logger log = LoggerFactory.getLogger(ShardIteratorCodec.class);

  private final ObjectMapper objectMapper;

  /**
   * Instantiates a new Shard iterator codec.
   *
   * @param objectMapper the object mapper
   */
  @Inject
  public ShardIteratorCodec(final ObjectMapper objectMapper) {
    log.info("ShardIteratorCodec({})", objectMapper);
    this.objectMapper = objectMapper;
  }

  /**
   * Encodes a shard iterator to a Base64 string.
   *
   * @param iterator the iterator
   * @return the encoded string
   */
  public String encode(final ShardIterator iterator) {
    log.trace("encode({})", iterator);
    try {
      final String json = objectMapper.writeValueAsString(iterator);
      final String encoded = Base64.getUrlEncoder().encodeToString(json.getBytes(StandardCharsets.UTF_8));
      log.debug("Encoded shard iterator: {} -> {}", iterator, encoded);
      return encoded;
    } catch (JsonProcessingException e) {
      log.error("Failed to encode shard iterator: {}", iterator, e);
      throw new IllegalArgumentException("Failed to encode shard iterator", e);
    }
  }

  /**
   * Decodes a Base64 string to a shard iterator.
   *
   * @param encoded the encoded string
   * @return the shard iterator
   * @throws InvalidArgumentException if the string is not an iterator this codec produced
   */
  public ShardIterator decode(final String encoded) {
    log.trace("decode({})", encoded);
    if (encoded == null || encoded.isBlank()) {
      throw InvalidArgumentException.builder().message("Shard iterator is required").build();
    }
    try {
      final byte[] decoded = Base64.getUrlDecoder().decode(encoded);
      final String json = new String(decoded, StandardCharsets.UTF_8);
      final ShardIterator iterator = objectMapper.readValue(json, ImmutableShardIterator.class);
      log.debug("Decoded shard iterator: {} -> {}", encoded, iterator);
      return iterator;
    } catch (IllegalArgumentException | IllegalStateException | JsonProcessingException e) {
      log.warn("Failed to decode shard iterator: {}", encoded, e);
      throw InvalidArgumentException.builder()
          .message("Invalid shard iterator: " + encoded)
          .cause(e)
          .build();
    }
  }
}
