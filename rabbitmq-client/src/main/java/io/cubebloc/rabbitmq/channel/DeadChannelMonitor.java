package io.cubebloc.rabbitmq.channel;

import com.rabbitmq.client.Channel;
import com.rabbitmq.client.ShutdownListener;
import com.rabbitmq.client.ShutdownSignalException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>
 * Subscription to the shutdown signal of one cached channel. When the channel dies, its entry is evicted from the cache together
 * with the queue assertion memo, so next {@link ChannelCache#createChannel} builds a new channel and asserts the queue again.
 * </p>
 * <p>
 * A signal coming from a channel that is no longer cached does not touch the newer entry of the same queue.
 * </p>
 */
public class DeadChannelMonitor implements ShutdownListener {
  private static final Logger LOGGER = LoggerFactory.getLogger(DeadChannelMonitor.class);

  private final ChannelCache cache;
  private final ChannelEntry entry;
  private final Channel channel;
  private final AtomicBoolean cancelled = new AtomicBoolean();

  private DeadChannelMonitor(ChannelCache cache, ChannelEntry entry, Channel channel) {
    this.cache = cache;
    this.entry = entry;
    this.channel = channel;
  }

  static DeadChannelMonitor watch(ChannelCache cache, ChannelEntry entry, Channel channel) {
    DeadChannelMonitor monitor = new DeadChannelMonitor(cache, entry, channel);
    channel.addShutdownListener(monitor);
    return monitor;
  }

  @Override
  public void shutdownCompleted(ShutdownSignalException cause) {
    if (cancelled.get()) {
      return;
    }
    boolean evicted = cache.evict(entry);
    String description = "channel of " + entry.getKey() + " shutdown, reason: " + cause.getReason() + ", evicted: " + evicted;
    if (cause.isInitiatedByApplication()) {
      LOGGER.info(description);
    } else {
      LOGGER.warn(description);
    }
  }

  /**
   * Stops watching the channel. Does nothing if already cancelled.
   */
  public void cancel() {
    if (cancelled.compareAndSet(false, true)) {
      channel.removeShutdownListener(this);
    }
  }

  public boolean isCancelled() {
    return cancelled.get();
  }

  Channel getChannel() {
    return channel;
  }
}
