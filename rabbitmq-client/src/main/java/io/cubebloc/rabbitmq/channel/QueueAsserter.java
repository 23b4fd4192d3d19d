package io.cubebloc.rabbitmq.channel;

import static com.google.common.util.concurrent.MoreExecutors.directExecutor;

import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.SettableFuture;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Declares the queue of a channel entry at most once per entry. Queues are declared non-durable, non-exclusive and not auto-deleted.
 */
class QueueAsserter {
  private static final Logger LOGGER = LoggerFactory.getLogger(QueueAsserter.class);

  static final boolean DURABLE = false;

  ListenableFuture<Channel> assertQueue(ChannelEntry entry, Channel channel, Executor executor) {
    SettableFuture<AMQP.Queue.DeclareOk> pending = SettableFuture.create();
    ListenableFuture<AMQP.Queue.DeclareOk> memo = entry.memoizeAssertion(pending);
    if (memo != null) {
      LOGGER.debug("Queue '{}' is already asserted", entry.getQueueName());
      return Futures.transform(memo, declareOk -> channel, directExecutor());
    }
    try {
      executor.execute(() -> declare(entry, channel, pending));
    } catch (RejectedExecutionException e) {
      entry.forgetAssertion(pending);
      pending.setException(e);
    }
    return Futures.transform(pending, declareOk -> channel, directExecutor());
  }

  private static void declare(ChannelEntry entry, Channel channel, SettableFuture<AMQP.Queue.DeclareOk> pending) {
    String queueName = entry.getQueueName();
    try {
      LOGGER.debug("Asserting queue '{}'", queueName);
      pending.set(channel.queueDeclare(queueName, DURABLE, false, false, null));
    } catch (Exception e) {
      // let next createChannel retry the declaration
      entry.forgetAssertion(pending);
      LOGGER.warn("Failed to assert queue '{}'", queueName, e);
      pending.setException(e);
    }
  }
}
