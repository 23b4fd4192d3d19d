package io.cubebloc.rabbitmq;

import java.util.Properties;
import java.util.function.Function;

public class PropertiesHelper {

  private final Properties properties;

  public PropertiesHelper(Properties properties) {
    this.properties = properties;
  }

  public Properties getProperties() {
    return properties;
  }

  public String getNotNullString(String name) {
    String value = properties.getProperty(name);
    if (value == null || value.trim().isEmpty()) {
      throw new ConfigException("Property '" + name + "' must be set and not empty");
    }
    return value.trim();
  }

  public String getString(String name) {
    return properties.getProperty(name);
  }

  public Integer getInteger(String name) {
    return getInteger(name, null);
  }

  public Integer getInteger(String name, Integer defaultValue) {
    return parseNumber(name, Integer::valueOf, defaultValue);
  }

  public Boolean getBoolean(String name, Boolean defaultValue) {
    String value = getString(name);
    return value == null ? defaultValue : Boolean.valueOf(value.trim());
  }

  private <T> T parseNumber(String name, Function<String, T> parser, T defaultValue) {
    String value = getString(name);
    if (value == null || value.trim().isEmpty()) {
      return defaultValue;
    }
    try {
      return parser.apply(value.trim());
    } catch (NumberFormatException e) {
      throw new ConfigException("Property '" + name + "' is not a number: " + value, e);
    }
  }
}
