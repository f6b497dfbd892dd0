package com.loglimit.config;

/**
 * Thrown when a configuration does not pass validation.
 */
public class ConfigurationException extends Exception {
  public ConfigurationException(String message) {
    super(message);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
