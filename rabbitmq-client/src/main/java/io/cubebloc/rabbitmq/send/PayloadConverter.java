package io.cubebloc.rabbitmq.send;

/**
 * Turns data passed to {@link io.cubebloc.rabbitmq.QueueClient#insert(Object)} into message body.
 */
public interface PayloadConverter {

  byte[] toBytes(Object data);
}
