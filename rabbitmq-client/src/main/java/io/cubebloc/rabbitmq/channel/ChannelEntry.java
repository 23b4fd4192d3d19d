package io.cubebloc.rabbitmq.channel;

import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.SettableFuture;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import java.util.concurrent.atomic.AtomicReference;
import javax.annotation.Nullable;

/**
 * Cached channel of one queue together with its assertion memo. Both live and die with the entry.
 */
final class ChannelEntry {
  private final ChannelKey key;
  private final SettableFuture<Channel> channel = SettableFuture.create();
  private final AtomicReference<ListenableFuture<AMQP.Queue.DeclareOk>> assertion = new AtomicReference<>();
  // set once before the channel future is resolved
  private volatile DeadChannelMonitor monitor;
  private volatile Channel resolved;

  ChannelEntry(ChannelKey key) {
    this.key = key;
  }

  ChannelKey getKey() {
    return key;
  }

  String getQueueName() {
    return key.getQueueName();
  }

  SettableFuture<Channel> getChannel() {
    return channel;
  }

  void resolve(Channel opened) {
    resolved = opened;
    channel.set(opened);
  }

  @Nullable
  Channel getResolvedChannel() {
    return resolved;
  }

  /**
   * @return previously memoized assertion, or null if {@code pending} became the memo
   */
  @Nullable
  ListenableFuture<AMQP.Queue.DeclareOk> memoizeAssertion(ListenableFuture<AMQP.Queue.DeclareOk> pending) {
    if (assertion.compareAndSet(null, pending)) {
      return null;
    }
    return assertion.get();
  }

  void forgetAssertion(ListenableFuture<AMQP.Queue.DeclareOk> failed) {
    assertion.compareAndSet(failed, null);
  }

  boolean isAsserted() {
    return assertion.get() != null;
  }

  boolean isReady() {
    ListenableFuture<AMQP.Queue.DeclareOk> asserted = assertion.get();
    return channel.isDone() && asserted != null && asserted.isDone();
  }

  void setMonitor(DeadChannelMonitor monitor) {
    this.monitor = monitor;
  }

  @Nullable
  DeadChannelMonitor getMonitor() {
    return monitor;
  }

  @Override
  public String toString() {
    return "ChannelEntry{" + key + ", asserted=" + isAsserted() + '}';
  }
}
