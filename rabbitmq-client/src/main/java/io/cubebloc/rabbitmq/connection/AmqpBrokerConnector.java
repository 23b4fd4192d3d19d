package io.cubebloc.rabbitmq.connection;

import static io.cubebloc.rabbitmq.ConfigKeys.AUTOMATIC_RECOVERY;
import static io.cubebloc.rabbitmq.ConfigKeys.CONNECTION_TIMEOUT_MS;
import static io.cubebloc.rabbitmq.ConfigKeys.HEARTBIT_SEC;
import static io.cubebloc.rabbitmq.ConfigKeys.TOPOLOGY_RECOVERY;

import com.google.common.net.InetAddresses;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.client.SocketConfigurator;
import com.rabbitmq.client.SocketConfigurators;
import io.cubebloc.rabbitmq.ConfigException;
import io.cubebloc.rabbitmq.PropertiesHelper;
import java.io.IOException;
import java.net.URISyntaxException;
import java.security.GeneralSecurityException;
import java.util.Collections;
import java.util.Properties;
import java.util.concurrent.TimeoutException;
import javax.annotation.Nullable;
import javax.net.ssl.SNIHostName;
import javax.net.ssl.SSLParameters;
import javax.net.ssl.SSLSocket;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link BrokerConnector} on top of amqp-client {@link ConnectionFactory}. A new factory is configured per connect call from the url
 * and the tuning options in {@link io.cubebloc.rabbitmq.ConfigKeys}.
 */
public class AmqpBrokerConnector implements BrokerConnector {
  private static final Logger LOGGER = LoggerFactory.getLogger(AmqpBrokerConnector.class);

  private final PropertiesHelper properties;

  public AmqpBrokerConnector(Properties properties) {
    this.properties = new PropertiesHelper(properties);
  }

  public AmqpBrokerConnector() {
    this(new Properties());
  }

  @Override
  public Connection connect(String url, @Nullable String serverName) throws IOException, TimeoutException {
    ConnectionFactory factory = createConnectionFactory(url, serverName);
    LOGGER.debug("Opening connection to {}:{}{}", factory.getHost(), factory.getPort(), factory.getVirtualHost());
    return factory.newConnection();
  }

  ConnectionFactory createConnectionFactory(String url, @Nullable String serverName) {
    ConnectionFactory factory = new ConnectionFactory();
    try {
      factory.setUri(url);
    } catch (URISyntaxException | GeneralSecurityException | IllegalArgumentException e) {
      throw new ConfigException("Invalid RabbitMQ url", e);
    }
    factory.setAutomaticRecoveryEnabled(properties.getBoolean(AUTOMATIC_RECOVERY, false));
    factory.setTopologyRecoveryEnabled(properties.getBoolean(TOPOLOGY_RECOVERY, false));

    Integer connectionTimeout = properties.getInteger(CONNECTION_TIMEOUT_MS);
    if (connectionTimeout != null) {
      factory.setConnectionTimeout(connectionTimeout);
    }
    Integer heartbeat = properties.getInteger(HEARTBIT_SEC);
    if (heartbeat != null) {
      factory.setRequestedHeartbeat(heartbeat);
    }

    if (factory.isSSL() && isIndicatable(serverName)) {
      factory.setSocketConfigurator(SocketConfigurators.defaultConfigurator().andThen(serverNameIndication(serverName)));
    }
    return factory;
  }

  /**
   * SNI carries DNS names only, ip literals are not sent.
   */
  static boolean isIndicatable(@Nullable String serverName) {
    return serverName != null && !serverName.isEmpty() && !InetAddresses.isUriInetAddress(serverName);
  }

  static SocketConfigurator serverNameIndication(String serverName) {
    SNIHostName hostName = new SNIHostName(serverName);
    return socket -> {
      if (socket instanceof SSLSocket) {
        SSLSocket sslSocket = (SSLSocket) socket;
        SSLParameters parameters = sslSocket.getSSLParameters();
        parameters.setServerNames(Collections.singletonList(hostName));
        sslSocket.setSSLParameters(parameters);
      }
    };
  }
}
