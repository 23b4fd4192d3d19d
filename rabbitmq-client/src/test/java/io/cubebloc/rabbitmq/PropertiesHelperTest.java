package io.cubebloc.rabbitmq;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Properties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class PropertiesHelperTest {
  private Properties properties;
  private PropertiesHelper helper;

  @BeforeEach
  public void setUp() {
    properties = new Properties();
    helper = new PropertiesHelper(properties);
  }

  @Test
  public void integerFallsBackToDefault() {
    assertNull(helper.getInteger("missing"));
    assertEquals(Integer.valueOf(3), helper.getInteger("missing", 3));

    properties.setProperty("threads", " 12 ");
    assertEquals(Integer.valueOf(12), helper.getInteger("threads", 3));
  }

  @Test
  public void nonNumericIntegerIsRejected() {
    properties.setProperty("threads", "many");

    ConfigException exception = assertThrows(ConfigException.class, () -> helper.getInteger("threads"));
    assertTrue(exception.getMessage().contains("threads"));
  }

  @Test
  public void booleanFallsBackToDefault() {
    assertFalse(helper.getBoolean("flag", false));

    properties.setProperty("flag", "true");
    assertTrue(helper.getBoolean("flag", false));
  }

  @Test
  public void notNullStringIsTrimmedAndRequired() {
    assertThrows(ConfigException.class, () -> helper.getNotNullString("queue"));

    properties.setProperty("queue", " events ");
    assertEquals("events", helper.getNotNullString("queue"));
  }
}
