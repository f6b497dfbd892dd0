package com.loglimit.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.Properties;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * Wrapper class to simplify typed access to a .properties file, with defaults and clamping.
 */
public class LimiterProperties extends Properties {
  private static final Logger logger =
      Logger.getLogger(LimiterProperties.class.getCanonicalName());

  public LimiterProperties(String fileName) throws IOException {
    try (InputStream input = Files.newInputStream(Paths.get(fileName))) {
      this.load(input);
    }
  }

  public LimiterProperties() {}

  /**
   * Loads a classpath resource.
   *
   * @param resource resource name, relative to the classpath root.
   * @return loaded properties, or {@code null} if there is no such resource.
   * @throws IOException if the resource exists but cannot be read.
   */
  @Nullable
  public static LimiterProperties fromClasspath(String resource) throws IOException {
    ClassLoader classLoader = Thread.currentThread().getContextClassLoader();
    if (classLoader == null) {
      classLoader = LimiterProperties.class.getClassLoader();
    }
    try (InputStream input = classLoader.getResourceAsStream(resource)) {
      if (input == null) return null;
      LimiterProperties properties = new LimiterProperties();
      properties.load(input);
      return properties;
    }
  }

  public Number getNumber(String key, Number defaultValue) {
    return getNumber(key, defaultValue, null, null);
  }

  public Number getNumber(
      String key,
      @Nullable Number defaultValue,
      @Nullable Number clampMinValue,
      @Nullable Number clampMaxValue) {
    String property = this.getProperty(key);
    if (property == null && defaultValue == null) return null;
    double d;
    try {
      d = property == null ? defaultValue.doubleValue() : Double.parseDouble(property.trim());
    } catch (NumberFormatException e) {
      throw new NumberFormatException(
          "Config setting \"" + key + "\": invalid number format \"" + property + "\"");
    }
    if (clampMinValue != null && d < clampMinValue.doubleValue()) {
      logger.warning(key + " (" + d + ") is less than " + clampMinValue +
          ", will default to " + clampMinValue);
      return clampMinValue;
    }
    if (clampMaxValue != null && d > clampMaxValue.doubleValue()) {
      logger.warning(key + " (" + d + ") is greater than " + clampMaxValue +
          ", will default to " + clampMaxValue);
      return clampMaxValue;
    }
    return d;
  }

  public String getString(String key, String defaultValue) {
    String s = this.getProperty(key, defaultValue);
    return s == null ? null : s.trim();
  }

  public Boolean getBoolean(String key, Boolean defaultValue) {
    return Boolean.parseBoolean(this.getProperty(key, String.valueOf(defaultValue)).trim());
  }
}
