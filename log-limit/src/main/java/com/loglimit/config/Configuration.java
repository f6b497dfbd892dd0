package com.loglimit.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Base class for configuration beans. Subclasses validate themselves in {@link #verifyAndInit()};
 * their JSON form doubles as {@code toString}, {@code equals} and {@code hashCode}.
 */
public abstract class Configuration {
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  /**
   * @param condition condition that must hold.
   * @param message   reason reported when it does not.
   * @throws ConfigurationException if {@code condition} is false.
   */
  protected void ensure(boolean condition, String message) throws ConfigurationException {
    if (!condition) {
      throw new ConfigurationException(message);
    }
  }

  /**
   * Validates the configuration and derives any values computed from it.
   *
   * @throws ConfigurationException if the configuration is invalid.
   */
  public abstract void verifyAndInit() throws ConfigurationException;

  public String toJson() {
    try {
      return OBJECT_MAPPER.writeValueAsString(this);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Unable to serialize " + getClass().getSimpleName(), e);
    }
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + toJson();
  }

  @Override
  public int hashCode() {
    return toJson().hashCode();
  }

  @Override
  public boolean equals(Object other) {
    return other != null && getClass().equals(other.getClass()) &&
        toJson().equals(((Configuration) other).toJson());
  }
}
