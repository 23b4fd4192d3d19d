package io.cubebloc.rabbitmq.util;

import com.fasterxml.jackson.databind.AnnotationIntrospector;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.introspect.AnnotationIntrospectorPair;
import com.fasterxml.jackson.databind.introspect.JacksonAnnotationIntrospector;
import com.fasterxml.jackson.databind.type.TypeFactory;
import com.fasterxml.jackson.module.jaxb.JaxbAnnotationIntrospector;

/**
 * Shared mapper for message payloads. Understands both Jackson and JAXB annotations, Jackson ones win.
 */
public final class ObjectMapperHolder {

  private static final ObjectMapper MAPPER = createMapper();

  private ObjectMapperHolder() {
  }

  public static ObjectMapper get() {
    return MAPPER;
  }

  private static ObjectMapper createMapper() {
    ObjectMapper mapper = new ObjectMapper();
    AnnotationIntrospector jacksonNative = new JacksonAnnotationIntrospector();
    AnnotationIntrospector jaxb = new JaxbAnnotationIntrospector(TypeFactory.defaultInstance());
    mapper.setAnnotationIntrospector(new AnnotationIntrospectorPair(jacksonNative, jaxb));
    mapper.disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
    return mapper;
  }
}
