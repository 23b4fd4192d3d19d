package io.cubebloc.rabbitmq;

import static io.cubebloc.rabbitmq.ConfigKeys.CLOSE_TIMEOUT;
import static io.cubebloc.rabbitmq.ConfigKeys.DEFAULT_PROFILE;
import static io.cubebloc.rabbitmq.ConfigKeys.PUBLISHER_USE_MDC;

import com.google.common.util.concurrent.ListeningExecutorService;
import io.cubebloc.rabbitmq.channel.ChannelCache;
import io.cubebloc.rabbitmq.connection.BrokerConnector;
import io.cubebloc.rabbitmq.connection.ConnectionCache;
import io.cubebloc.rabbitmq.send.JacksonPayloadConverter;
import io.cubebloc.rabbitmq.send.PayloadConverter;
import java.util.Properties;
import javax.annotation.Nullable;

/**
 * Configures a {@link QueueClient} sharing caches and executor of the {@link QueueClientFactory} it was created by.
 */
public class QueueClientBuilder {

  private final BrokerProfiles profiles;
  private final BrokerConnector connector;
  private final ConnectionCache connections;
  private final ChannelCache channels;
  private final ListeningExecutorService executor;

  private String profile = DEFAULT_PROFILE;
  @Nullable
  private String queueName;
  private PayloadConverter payloadConverter = JacksonPayloadConverter.INSTANCE;
  private boolean useMDC;
  @Nullable
  private Integer closeTimeout;

  QueueClientBuilder(BrokerProfiles profiles,
                     Properties properties,
                     BrokerConnector connector,
                     ConnectionCache connections,
                     ChannelCache channels,
                     ListeningExecutorService executor) {
    this.profiles = profiles;
    this.connector = connector;
    this.connections = connections;
    this.channels = channels;
    this.executor = executor;
    PropertiesHelper props = new PropertiesHelper(properties);
    useMDC = props.getBoolean(PUBLISHER_USE_MDC, false);
    closeTimeout = props.getInteger(CLOSE_TIMEOUT);
  }

  public QueueClientBuilder forQueue(@Nullable String queueName) {
    this.queueName = queueName;
    return this;
  }

  public QueueClientBuilder withProfile(String profile) {
    if (!profiles.contains(profile)) {
      throw new ConfigException("No RabbitMQ profile '" + profile + "'");
    }
    this.profile = profile;
    return this;
  }

  public QueueClientBuilder withPayloadConverter(PayloadConverter payloadConverter) {
    this.payloadConverter = payloadConverter;
    return this;
  }

  public QueueClientBuilder setUseMDC(boolean useMDC) {
    this.useMDC = useMDC;
    return this;
  }

  public QueueClientBuilder setCloseTimeout(@Nullable Integer closeTimeoutMs) {
    this.closeTimeout = closeTimeoutMs;
    return this;
  }

  public QueueClient build() {
    return new QueueClient(profiles, profile, queueName, connector, connections, channels, executor, payloadConverter, useMDC, closeTimeout);
  }
}
