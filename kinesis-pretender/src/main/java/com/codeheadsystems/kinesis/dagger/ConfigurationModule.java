package com.codeheadsystems.kinesis.dagger;

import com.codeheadsystems.kinesis.model.Configuration;
import com.codeheadsystems.kinesis.model.ImmutableConfiguration;
import dagger.Module;
import dagger.Provides;
import javax.inject.Singleton;

/**
 * The type Configuration module.
 */
@Module
public class ConfigurationModule {

  private final Configuration configuration;

  /**
   * Instantiates a new Configuration module with the default configuration.
   */
  public ConfigurationModule() {
    this(ImmutableConfiguration.builder().build());
  }

  /**
   * Instantiates a new Configuration module.
   *
   * @param configuration the configuration
   */
  public ConfigurationModule(final Configuration configuration) {
    this.configuration = configuration;
  }

  /**
   * Configuration configuration.
   *
   * @return the configuration
   */
  @Provides
  @Singleton
  public Configuration configuration() {
    return configuration;
  }
}
