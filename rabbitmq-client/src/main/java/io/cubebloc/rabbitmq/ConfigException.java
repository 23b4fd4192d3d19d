package io.cubebloc.rabbitmq;

/**
 * Client is misconfigured or an operation was called before its prerequisites were set up.
 */
public class ConfigException extends RuntimeException {

  public static final String NO_CONNECTION = "No RabbitMQ connection";
  public static final String NO_QUEUE = "No RabbitMQ queue";
  public static final String NO_CHANNEL = "No RabbitMQ channel";

  public ConfigException(String message, Throwable cause) {
    super(message, cause);
  }

  public ConfigException(String message) {
    super(message);
  }
}
