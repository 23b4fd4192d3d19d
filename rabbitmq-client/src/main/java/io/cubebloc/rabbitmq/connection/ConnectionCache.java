package io.cubebloc.rabbitmq.connection;

import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.SettableFuture;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ShutdownSignalException;
import io.cubebloc.rabbitmq.BrokerConnectException;
import io.cubebloc.rabbitmq.ConfigException;
import java.io.IOException;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>
 * Maintains single connection per profile key. The entry is installed before the connection is opened, so concurrent callers share
 * one connect call and converge on the same connection.
 * </p>
 * <p>
 * Entries are evicted when connecting fails and when the connection shuts down, next {@link #connect} opens a fresh one.
 * </p>
 */
public class ConnectionCache {
  private static final Logger LOGGER = LoggerFactory.getLogger(ConnectionCache.class);

  private final ConcurrentMap<String, ListenableFuture<Connection>> connections = new ConcurrentHashMap<>();

  /**
   * @param opener called on {@code executor} only if no connection is cached for {@code key}
   */
  public ListenableFuture<Connection> connect(String key, Callable<Connection> opener, Executor executor) {
    ListenableFuture<Connection> cached = connections.get(key);
    if (cached != null) {
      LOGGER.debug("Reusing connection '{}'", key);
      return cached;
    }
    SettableFuture<Connection> pending = SettableFuture.create();
    cached = connections.putIfAbsent(key, pending);
    if (cached != null) {
      LOGGER.debug("Reusing connection '{}'", key);
      return cached;
    }
    LOGGER.debug("Opening connection '{}'", key);
    try {
      executor.execute(() -> open(key, pending, opener));
    } catch (RejectedExecutionException e) {
      fail(key, pending, e);
    }
    return pending;
  }

  @Nullable
  public ListenableFuture<Connection> get(String key) {
    return connections.get(key);
  }

  public boolean contains(String key) {
    return connections.containsKey(key);
  }

  /**
   * Waits for the cached connection, evicts it and closes it. Does nothing if no connection is cached for {@code key}, or if it was
   * evicted by a concurrent close or by its shutdown in the meantime.
   *
   * @param closeTimeout see {@link Connection#close(int)}, waits forever if null
   */
  public ListenableFuture<Void> close(String key, @Nullable Integer closeTimeout, Executor executor) {
    ListenableFuture<Connection> cached = connections.get(key);
    if (cached == null) {
      return Futures.immediateVoidFuture();
    }
    return Futures.transformAsync(cached, connection -> {
      // only the caller that evicted the connection closes it
      if (connections.remove(key, cached)) {
        closeConnection(key, connection, closeTimeout);
      } else {
        LOGGER.debug("Connection '{}' is already evicted, not closing", key);
      }
      return Futures.immediateVoidFuture();
    }, executor);
  }

  private void open(String key, SettableFuture<Connection> pending, Callable<Connection> opener) {
    Connection connection;
    try {
      connection = opener.call();
    } catch (Exception e) {
      fail(key, pending, e);
      return;
    }
    connection.addShutdownListener(cause -> onShutdown(key, pending, cause));
    pending.set(connection);
  }

  private void fail(String key, SettableFuture<Connection> pending, Exception cause) {
    connections.remove(key, pending);
    LOGGER.warn("Failed to open connection '{}'", key, cause);
    pending.setException(cause instanceof ConfigException ? cause : new BrokerConnectException(key, cause));
  }

  private void onShutdown(String key, ListenableFuture<Connection> entry, ShutdownSignalException cause) {
    boolean evicted = connections.remove(key, entry);
    String description = "connection '" + key + "' shutdown, reason: " + cause.getReason() + ", evicted: " + evicted;
    if (cause.isInitiatedByApplication()) {
      LOGGER.info(description);
    } else {
      LOGGER.warn(description, cause);
    }
  }

  private static void closeConnection(String key, Connection connection, @Nullable Integer closeTimeout) throws IOException {
    if (!connection.isOpen()) {
      LOGGER.warn("Connection '{}' is already closed, ignoring", key);
      return;
    }
    LOGGER.debug("Closing connection '{}'", key);
    if (closeTimeout != null) {
      connection.close(closeTimeout);
      return;
    }
    connection.close();
  }

  @Override
  public String toString() {
    return "ConnectionCache" + connections.keySet();
  }
}
