package io.cubebloc.rabbitmq.send;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.cubebloc.rabbitmq.util.ObjectMapperHolder;

/**
 * Writes data as UTF-8 JSON.
 */
public class JacksonPayloadConverter implements PayloadConverter {

  public static final JacksonPayloadConverter INSTANCE = new JacksonPayloadConverter(ObjectMapperHolder.get());

  private final ObjectMapper mapper;

  public JacksonPayloadConverter(ObjectMapper mapper) {
    this.mapper = mapper;
  }

  @Override
  public byte[] toBytes(Object data) {
    try {
      return mapper.writeValueAsBytes(data);
    } catch (JsonProcessingException e) {
      throw new PayloadConversionException(data, e);
    }
  }
}
