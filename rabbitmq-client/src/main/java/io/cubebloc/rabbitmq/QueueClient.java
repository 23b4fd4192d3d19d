package io.cubebloc.rabbitmq;

import static com.google.common.util.concurrent.MoreExecutors.directExecutor;
import static io.cubebloc.rabbitmq.ConfigException.NO_CHANNEL;
import static io.cubebloc.rabbitmq.ConfigException.NO_CONNECTION;
import static io.cubebloc.rabbitmq.ConfigException.NO_QUEUE;

import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import io.cubebloc.rabbitmq.channel.ChannelCache;
import io.cubebloc.rabbitmq.connection.BrokerConnector;
import io.cubebloc.rabbitmq.connection.ConnectionCache;
import io.cubebloc.rabbitmq.send.MDCHeaders;
import io.cubebloc.rabbitmq.send.PayloadConverter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.RejectedExecutionException;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>
 * Publishes to a single queue through a connection and a channel shared with other clients of the same caches.
 * </p>
 * <p>
 * Lifecycle: {@link #connect()}, then {@link #createChannel()}, then data operations. A channel killed by the broker is evicted and
 * {@link #createChannel()} has to be called again to rebuild it and re-assert the queue. See {@link State}.
 * </p>
 * <p>
 * Blocking broker calls run on the client executor, asynchronous operations report their failures through the returned future.
 * </p>
 */
public class QueueClient {
  private static final Logger LOGGER = LoggerFactory.getLogger(QueueClient.class);

  static final String GROUP_BY_HEADER = "groupBy";
  private static final String DEFAULT_EXCHANGE = "";

  public enum State {
    UNCONNECTED,
    CONNECTION_PENDING,
    CONNECTED,
    /** channel is being opened, or was killed and waits for {@link #createChannel()} to rebuild it */
    CHANNEL_PENDING,
    CHANNEL_READY,
    /** {@link #closeConnection()} was called */
    CONNECTION_CLOSED,
    /** {@link #destroy()} deleted the queue, connection is left as is */
    QUEUE_DESTROYED
  }

  private final BrokerProfiles profiles;
  private final String profile;
  @Nullable
  private final String queueName;
  private final BrokerConnector connector;
  private final ConnectionCache connections;
  private final ChannelCache channels;
  private final ListeningExecutorService executor;
  private final PayloadConverter payloadConverter;
  private final boolean useMDC;
  @Nullable
  private final Integer closeTimeout;

  @Nullable
  private volatile State terminalState;

  QueueClient(BrokerProfiles profiles,
              String profile,
              @Nullable
              String queueName,
              BrokerConnector connector,
              ConnectionCache connections,
              ChannelCache channels,
              ListeningExecutorService executor,
              PayloadConverter payloadConverter,
              boolean useMDC,
              @Nullable
              Integer closeTimeout) {
    this.profiles = profiles;
    this.profile = profile;
    this.queueName = queueName;
    this.connector = connector;
    this.connections = connections;
    this.channels = channels;
    this.executor = executor;
    this.payloadConverter = payloadConverter;
    this.useMDC = useMDC;
    this.closeTimeout = closeTimeout;
  }

  /**
   * Opens the profile connection, or joins the one already cached or being opened.
   */
  public ListenableFuture<Connection> connect() {
    String url;
    String serverName;
    try {
      url = profiles.getUrl(profile);
      serverName = profiles.getHost(profile);
    } catch (ConfigException e) {
      return Futures.immediateFailedFuture(e);
    }
    terminalState = null;
    return connections.connect(profile, () -> connector.connect(url, serverName), executor);
  }

  /**
   * Opens the queue channel on the cached connection and asserts the queue, or joins the channel already cached.
   *
   * @return future failed with {@link ConfigException} if there is no cached connection or no queue name
   */
  public ListenableFuture<Channel> createChannel() {
    ListenableFuture<Connection> connection = connections.get(profile);
    if (connection == null) {
      return Futures.immediateFailedFuture(new ConfigException(NO_CONNECTION));
    }
    if (queueName == null) {
      return Futures.immediateFailedFuture(new ConfigException(NO_QUEUE));
    }
    return channels.createChannel(profile, queueName, connection, executor);
  }

  public Optional<Channel> getChannel() {
    if (queueName == null) {
      return Optional.empty();
    }
    return channels.getChannel(profile, queueName);
  }

  /**
   * Publishes {@code data} to the queue without headers.
   *
   * @return true if the client accepted the message for transmission, this is not a broker acknowledgement
   */
  public boolean insert(Object data) {
    return publish(data, null);
  }

  /**
   * Same as {@link #insert(Object)}, message carries {@code groupBy} header so consumers can partition by {@code key}.
   */
  public boolean insertWithGroupBy(String key, Object data) {
    return publish(data, Collections.<String, Object>singletonMap(GROUP_BY_HEADER, key));
  }

  /**
   * Removes all messages from the queue, the queue itself stays.
   */
  public ListenableFuture<AMQP.Queue.PurgeOk> purge() {
    Channel channel;
    try {
      channel = requireChannel();
    } catch (ConfigException e) {
      return Futures.immediateFailedFuture(e);
    }
    return submit(() -> channel.queuePurge(queueName));
  }

  /**
   * Deletes the queue from the broker. Cached connection and channel are left as is, use {@link #closeConnection()} to release them.
   */
  public ListenableFuture<AMQP.Queue.DeleteOk> destroy() {
    Channel channel;
    try {
      channel = requireChannel();
    } catch (ConfigException e) {
      return Futures.immediateFailedFuture(e);
    }
    ListenableFuture<AMQP.Queue.DeleteOk> deleted = submit(() -> channel.queueDelete(queueName));
    return Futures.transform(deleted, deleteOk -> {
      LOGGER.info("Queue '{}' deleted", queueName);
      terminalState = State.QUEUE_DESTROYED;
      return deleteOk;
    }, directExecutor());
  }

  /**
   * Closes the cached profile connection, if any. Channel of the queue is evicted along with it.
   */
  public ListenableFuture<Void> closeConnection() {
    if (queueName != null) {
      channels.discard(profile, queueName);
    }
    ListenableFuture<Void> closed = connections.close(profile, closeTimeout, executor);
    return Futures.transform(closed, ignored -> {
      terminalState = State.CONNECTION_CLOSED;
      return null;
    }, directExecutor());
  }

  /**
   * Evicts and closes the queue channel without shutting down the connection.
   */
  public ListenableFuture<Void> closeChannel() {
    if (queueName == null) {
      return Futures.immediateVoidFuture();
    }
    return channels.close(profile, queueName, executor);
  }

  public State getState() {
    State terminal = terminalState;
    if (terminal != null) {
      return terminal;
    }
    ListenableFuture<Connection> connection = connections.get(profile);
    if (connection == null) {
      return State.UNCONNECTED;
    }
    if (!connection.isDone()) {
      return State.CONNECTION_PENDING;
    }
    if (queueName == null) {
      return State.CONNECTED;
    }
    if (!channels.contains(profile, queueName)) {
      return channels.isLost(profile, queueName) ? State.CHANNEL_PENDING : State.CONNECTED;
    }
    return channels.isReady(profile, queueName) ? State.CHANNEL_READY : State.CHANNEL_PENDING;
  }

  public String getProfile() {
    return profile;
  }

  @Nullable
  public String getQueueName() {
    return queueName;
  }

  private boolean publish(Object data, @Nullable Map<String, Object> headers) {
    Channel channel = requireChannel();
    byte[] payload = payloadConverter.toBytes(data);
    Map<String, Object> allHeaders = useMDC ? MDCHeaders.withContext(headers) : headers;
    AMQP.BasicProperties properties = allHeaders == null ? null : new AMQP.BasicProperties.Builder().headers(allHeaders).build();
    try {
      channel.basicPublish(DEFAULT_EXCHANGE, queueName, properties, payload);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to publish to queue '" + queueName + "'", e);
    }
    return true;
  }

  private <T> ListenableFuture<T> submit(Callable<T> task) {
    try {
      return executor.submit(task);
    } catch (RejectedExecutionException e) {
      LOGGER.warn("Client executor rejected operation on queue '{}'", queueName, e);
      return Futures.immediateFailedFuture(e);
    }
  }

  private Channel requireChannel() {
    if (queueName == null) {
      throw new ConfigException(NO_QUEUE);
    }
    return channels.getChannel(profile, queueName).orElseThrow(() -> new ConfigException(NO_CHANNEL));
  }

  @Override
  public String toString() {
    return "QueueClient{profile=" + profile + ", queueName=" + queueName + '}';
  }
}
