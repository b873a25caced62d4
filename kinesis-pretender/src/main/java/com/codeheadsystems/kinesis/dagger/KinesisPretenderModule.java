package com.codeheadsystems.kinesis.dagger;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import dagger.Module;
import dagger.Provides;
import javax.inject.Singleton;

/**
 * The type Kinesis pretender module.
 */
@Module
public class KinesisPretenderModule {

  /**
   * Instantiates a new Kinesis pretender module.
   */
  public KinesisPretenderModule() {
    // Default constructor
  }

  /**
   * Object mapper for shard iterator serialization.
   *
   * @return the object mapper
   */
  @Provides
  @Singleton
  public ObjectMapper objectMapper() {
    return new ObjectMapper().registerModule(new Jdk8Module());
  }
}
