package io.cubebloc.rabbitmq;

import static io.cubebloc.rabbitmq.ConfigKeys.CLIENT_THREADPOOL;
import static io.cubebloc.rabbitmq.ConfigKeys.QUEUE;

import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.cubebloc.rabbitmq.channel.ChannelCache;
import io.cubebloc.rabbitmq.connection.AmqpBrokerConnector;
import io.cubebloc.rabbitmq.connection.BrokerConnector;
import io.cubebloc.rabbitmq.connection.ConnectionCache;
import java.util.Properties;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>
 * Creates {@link QueueClient}s. All clients of one factory share the connection cache, the channel cache and the executor, so clients
 * of the same profile share one connection and clients of the same queue on the same profile share one channel.
 * </p>
 * <p>
 * See {@link ConfigKeys} constants for configuration options.
 * </p>
 */
public class QueueClientFactory implements AutoCloseable {
  private static final Logger LOGGER = LoggerFactory.getLogger(QueueClientFactory.class);

  private static final long IDLE_THREAD_KEEP_ALIVE_SEC = 60;

  private final BrokerProfiles profiles;
  private final PropertiesHelper properties;
  private final BrokerConnector connector;
  private final ListeningExecutorService executor;
  private final boolean ownsExecutor;
  private final ConnectionCache connections = new ConnectionCache();
  private final ChannelCache channels = new ChannelCache();

  public QueueClientFactory(Properties properties) {
    this(BrokerProfiles.fromProperties(properties), properties);
  }

  public QueueClientFactory(BrokerProfiles profiles, Properties properties) {
    this(profiles, properties, new AmqpBrokerConnector(properties), null);
  }

  /**
   * @param executor runs blocking broker calls, a daemon threadpool owned by the factory is created if null
   */
  public QueueClientFactory(BrokerProfiles profiles,
                            Properties properties,
                            BrokerConnector connector,
                            @Nullable
                            ListeningExecutorService executor) {
    this.profiles = profiles;
    this.properties = new PropertiesHelper(properties);
    this.connector = connector;
    this.ownsExecutor = executor == null;
    this.executor = executor != null ? executor : createExecutor(this.properties.getInteger(CLIENT_THREADPOOL, 0));
  }

  /**
   * Client of the default profile for the queue set by {@link ConfigKeys#QUEUE}, if any.
   */
  public QueueClient createClient() {
    return createClient(properties.getString(QUEUE));
  }

  /**
   * Client of the default profile.
   */
  public QueueClient createClient(@Nullable String queueName) {
    return createClientBuilder().forQueue(queueName).build();
  }

  public QueueClientBuilder createClientBuilder() {
    return new QueueClientBuilder(profiles, properties.getProperties(), connector, connections, channels, executor);
  }

  public BrokerProfiles getProfiles() {
    return profiles;
  }

  ConnectionCache getConnectionCache() {
    return connections;
  }

  ChannelCache getChannelCache() {
    return channels;
  }

  /**
   * Stops own executor. Connections are not closed here, use {@link QueueClient#closeConnection()}.
   */
  @Override
  public void close() {
    if (ownsExecutor) {
      LOGGER.debug("Shutting down client executor");
      executor.shutdown();
    }
  }

  static ListeningExecutorService createExecutor(int maxThreads) {
    ThreadFactory threadFactory = new ThreadFactoryBuilder().setNameFormat("rabbitmq-queue-client-%d").setDaemon(true).build();
    ExecutorService executor;
    if (maxThreads > 0) {
      ThreadPoolExecutor pool = new ThreadPoolExecutor(
          maxThreads, maxThreads, IDLE_THREAD_KEEP_ALIVE_SEC, TimeUnit.SECONDS, new LinkedBlockingQueue<>(), threadFactory);
      pool.allowCoreThreadTimeOut(true);
      executor = pool;
    } else {
      executor = Executors.newCachedThreadPool(threadFactory);
    }
    return MoreExecutors.listeningDecorator(executor);
  }
}
