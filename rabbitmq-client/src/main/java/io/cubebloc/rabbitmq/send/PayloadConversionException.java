package io.cubebloc.rabbitmq.send;

public class PayloadConversionException extends RuntimeException {

  public PayloadConversionException(Object data, Throwable cause) {
    super("Failed to convert payload of type " + (data == null ? "null" : data.getClass().getName()), cause);
  }
}
