package io.cubebloc.rabbitmq.channel;

import static com.google.common.util.concurrent.MoreExecutors.directExecutor;

import com.google.common.util.concurrent.FutureCallback;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import java.io.IOException;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>
 * Maintains single channel per queue name and broker profile, lazily opened on top of the profile connection. The entry is installed
 * before the channel is opened, so concurrent callers share one channel and one queue assertion.
 * </p>
 * <p>
 * Every cached channel is watched by a {@link DeadChannelMonitor}. Eviction removes the channel and the assertion memo in one step.
 * </p>
 */
public class ChannelCache {
  private static final Logger LOGGER = LoggerFactory.getLogger(ChannelCache.class);

  private final ConcurrentMap<ChannelKey, ChannelEntry> channels = new ConcurrentHashMap<>();
  // channels that died and were not rebuilt or released since, only changed together with the map entry
  private final Set<ChannelKey> lost = ConcurrentHashMap.newKeySet();
  private final QueueAsserter asserter = new QueueAsserter();

  /**
   * @param connection connection of {@code profile}, the channel is opened on it only if none is cached for the pair
   * @return future completed once the channel is open and the queue is asserted on it
   */
  public ListenableFuture<Channel> createChannel(String profile,
                                                 String queueName,
                                                 ListenableFuture<Connection> connection,
                                                 Executor executor) {
    ChannelKey key = new ChannelKey(profile, queueName);
    AtomicBoolean installed = new AtomicBoolean();
    ChannelEntry entry = channels.computeIfAbsent(key, absent -> {
      lost.remove(absent);
      installed.set(true);
      return new ChannelEntry(absent);
    });
    if (installed.get()) {
      open(entry, connection, executor);
    } else {
      LOGGER.debug("Reusing channel of {}", key);
    }
    return Futures.transformAsync(entry.getChannel(), channel -> asserter.assertQueue(entry, channel, executor), directExecutor());
  }

  /**
   * @return cached open channel, empty if there is none or it is still being opened
   */
  public Optional<Channel> getChannel(String profile, String queueName) {
    ChannelEntry entry = channels.get(new ChannelKey(profile, queueName));
    return entry == null ? Optional.empty() : Optional.ofNullable(entry.getResolvedChannel());
  }

  public boolean contains(String profile, String queueName) {
    return channels.containsKey(new ChannelKey(profile, queueName));
  }

  public boolean isAsserted(String profile, String queueName) {
    ChannelEntry entry = channels.get(new ChannelKey(profile, queueName));
    return entry != null && entry.isAsserted();
  }

  public boolean isReady(String profile, String queueName) {
    ChannelEntry entry = channels.get(new ChannelKey(profile, queueName));
    return entry != null && entry.isReady();
  }

  /**
   * @return true if the channel was killed and has to be rebuilt by {@link #createChannel}
   */
  public boolean isLost(String profile, String queueName) {
    ChannelKey key = new ChannelKey(profile, queueName);
    return lost.contains(key) && !channels.containsKey(key);
  }

  /**
   * Evicts the channel without closing it. Its shutdown will not be reported anymore.
   */
  public void discard(String profile, String queueName) {
    ChannelEntry entry = detach(new ChannelKey(profile, queueName));
    if (entry != null) {
      LOGGER.debug("Discarding channel of {}", entry.getKey());
      entry.getChannel().addListener(() -> cancelMonitor(entry), directExecutor());
    }
  }

  /**
   * Evicts the channel and closes it. Does nothing if no channel is cached.
   */
  public ListenableFuture<Void> close(String profile, String queueName, Executor executor) {
    ChannelEntry entry = detach(new ChannelKey(profile, queueName));
    if (entry == null) {
      return Futures.immediateVoidFuture();
    }
    return Futures.transformAsync(entry.getChannel(), channel -> {
      cancelMonitor(entry);
      closeChannel(entry.getKey(), channel);
      return Futures.immediateVoidFuture();
    }, executor);
  }

  /**
   * Removes {@code entry} if it is still the cached one and marks its channel as lost.
   */
  boolean evict(ChannelEntry entry) {
    return remove(entry, true);
  }

  private boolean remove(ChannelEntry entry, boolean markLost) {
    AtomicBoolean removed = new AtomicBoolean();
    channels.computeIfPresent(entry.getKey(), (key, current) -> {
      if (current != entry) {
        return current;
      }
      if (markLost) {
        lost.add(key);
      } else {
        lost.remove(key);
      }
      removed.set(true);
      return null;
    });
    return removed.get();
  }

  @Nullable
  private ChannelEntry detach(ChannelKey key) {
    AtomicReference<ChannelEntry> detached = new AtomicReference<>();
    channels.compute(key, (ignored, current) -> {
      lost.remove(key);
      detached.set(current);
      return null;
    });
    return detached.get();
  }

  private void open(ChannelEntry entry, ListenableFuture<Connection> connection, Executor executor) {
    ChannelKey key = entry.getKey();
    LOGGER.debug("Opening channel of {}", key);
    ListenableFuture<Channel> opened = Futures.transformAsync(
        connection, established -> Futures.immediateFuture(openChannel(entry, established)), executor);
    Futures.addCallback(opened, new FutureCallback<Channel>() {
      @Override
      public void onSuccess(Channel channel) {
        entry.resolve(channel);
      }

      @Override
      public void onFailure(Throwable t) {
        remove(entry, false);
        LOGGER.warn("Failed to open channel of {}", key, t);
        entry.getChannel().setException(t);
      }
    }, directExecutor());
  }

  private Channel openChannel(ChannelEntry entry, Connection connection) throws IOException {
    Channel channel = connection.createChannel();
    if (channel == null) {
      throw new IOException("No free channel number on " + connection);
    }
    // watch before anyone can see the channel
    entry.setMonitor(DeadChannelMonitor.watch(this, entry, channel));
    return channel;
  }

  private static void cancelMonitor(ChannelEntry entry) {
    DeadChannelMonitor monitor = entry.getMonitor();
    if (monitor != null) {
      monitor.cancel();
    }
  }

  private static void closeChannel(ChannelKey key, Channel channel) throws IOException, TimeoutException {
    if (!channel.isOpen()) {
      LOGGER.warn("Channel of {} is already closed, ignoring", key);
      return;
    }
    LOGGER.debug("Closing channel of {}", key);
    channel.close();
  }

  @Override
  public String toString() {
    return "ChannelCache" + channels.keySet();
  }
}
