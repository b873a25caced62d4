package com.codeheadsystems.kinesis.dagger;

import com.codeheadsystems.kinesis.KinesisPretenderClient;
import com.codeheadsystems.kinesis.model.Configuration;
import com.codeheadsystems.kinesis.store.StreamRegistry;
import dagger.Component;
import javax.inject.Singleton;

/**
 * The interface Kinesis pretender component. Each instance owns its own set of streams.
 */
@Singleton
@Component(modules = {KinesisPretenderModule.class, ConfigurationModule.class, CommonModule.class})
public interface KinesisPretenderComponent {

  /**
   * Instance with the default configuration.
   *
   * @return the kinesis pretender component
   */
  static KinesisPretenderComponent instance() {
    return DaggerKinesisPretenderComponent.create();
  }

  /**
   * Instance kinesis pretender component.
   *
   * @param configuration the configuration
   * @return the kinesis pretender component
   */
  static KinesisPretenderComponent instance(final Configuration configuration) {
    return DaggerKinesisPretenderComponent.builder().configurationModule(new ConfigurationModule(configuration)).build();
  }

  /**
   * Kinesis pretender client.
   *
   * @return the kinesis pretender client
   */
  KinesisPretenderClient kinesisPretenderClient();

  /**
   * The stream registry backing the client.
   *
   * @return the stream registry
   */
  StreamRegistry streamRegistry();
}
