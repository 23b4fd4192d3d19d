package io.cubebloc.rabbitmq;

public class BrokerConnectException extends RuntimeException {

  public BrokerConnectException(String profile, Throwable cause) {
    super("Can't connect to RabbitMQ using profile '" + profile + "'", cause);
  }
}
