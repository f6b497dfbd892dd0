package com.loglimit.config;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;

import java.io.IOException;
import java.time.Duration;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * Settings shared by all rate-limiting loggers: whether (and at which level) suppression is
 * announced, and the threshold and period used when a call site does not specify its own.
 */
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
    getterVisibility = JsonAutoDetect.Visibility.NONE,
    isGetterVisibility = JsonAutoDetect.Visibility.NONE)
public class RateLimitingConfig extends Configuration {
  private static final Logger logger =
      Logger.getLogger(RateLimitingConfig.class.getCanonicalName());

  /** System property naming a .properties file to read the default configuration from. */
  public static final String CONFIG_FILE_PROPERTY = "loglimit.config";
  /** Classpath resource read when {@link #CONFIG_FILE_PROPERTY} is not set. */
  public static final String CONFIG_RESOURCE = "log-limit.properties";

  public static final boolean DEFAULT_WARNING_MESSAGES = true;
  public static final String DEFAULT_WARNING_LEVEL = "WARNING";
  public static final int DEFAULT_THRESHOLD = 10;
  public static final long DEFAULT_PERIOD_MILLIS = 1000;

  private boolean warningMessages = DEFAULT_WARNING_MESSAGES;
  private String warningLevel = DEFAULT_WARNING_LEVEL;
  private int defaultThreshold = DEFAULT_THRESHOLD;
  private long defaultPeriodMillis = DEFAULT_PERIOD_MILLIS;

  @JsonIgnore
  private Level parsedWarningLevel = Level.WARNING;

  /**
   * Creates a configuration holding the built-in defaults.
   */
  public RateLimitingConfig() {
  }

  /**
   * Reads and validates a configuration.
   *
   * @param properties source properties. Missing keys keep their defaults.
   * @return validated configuration.
   * @throws ConfigurationException if a value is malformed or out of range.
   */
  public static RateLimitingConfig fromProperties(LimiterProperties properties)
      throws ConfigurationException {
    RateLimitingConfig config = new RateLimitingConfig();
    try {
      config.warningMessages = properties.getBoolean("warningMessages", DEFAULT_WARNING_MESSAGES);
      config.warningLevel = properties.getString("warningLevel", DEFAULT_WARNING_LEVEL);
      config.defaultThreshold = properties.getNumber("defaultThreshold", DEFAULT_THRESHOLD, 0,
          Integer.MAX_VALUE).intValue();
      config.defaultPeriodMillis = properties.getNumber("defaultPeriodMillis",
          DEFAULT_PERIOD_MILLIS, 0, null).longValue();
    } catch (NumberFormatException e) {
      throw new ConfigurationException(e.getMessage(), e);
    }
    config.verifyAndInit();
    return config;
  }

  /**
   * @return a copy of the process-wide configuration, resolved on first use. Changing the copy
   *         does not affect other callers.
   */
  public static RateLimitingConfig getDefault() {
    return DefaultHolder.INSTANCE.copy();
  }

  /**
   * Resolves a configuration from {@code fileName} if given, otherwise from the
   * {@link #CONFIG_RESOURCE} classpath resource if present. Anything that cannot be read or
   * validated falls back to the built-in defaults.
   */
  @VisibleForTesting
  static RateLimitingConfig resolve(@Nullable String fileName) {
    try {
      LimiterProperties properties = fileName == null ?
          LimiterProperties.fromClasspath(CONFIG_RESOURCE) :
          new LimiterProperties(fileName);
      if (properties == null) {
        return new RateLimitingConfig();
      }
      RateLimitingConfig config = fromProperties(properties);
      logger.fine(() -> "Loaded rate-limited logging configuration: " + config);
      return config;
    } catch (IOException | ConfigurationException e) {
      logger.warning("Unable to load rate-limited logging configuration from " +
          (fileName == null ? "classpath resource " + CONFIG_RESOURCE : fileName) + " (" +
          e.getMessage() + "), using defaults");
      return new RateLimitingConfig();
    }
  }

  @Override
  public void verifyAndInit() throws ConfigurationException {
    ensure(defaultThreshold >= 0, "defaultThreshold should not be negative");
    ensure(defaultPeriodMillis >= 0, "defaultPeriodMillis should not be negative");
    ensure(warningLevel != null && !warningLevel.isEmpty(), "warningLevel is required");
    try {
      parsedWarningLevel = Level.parse(warningLevel);
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException("Unknown warningLevel: " + warningLevel, e);
    }
  }

  public boolean isWarningMessages() {
    return warningMessages;
  }

  public RateLimitingConfig setWarningMessages(boolean warningMessages) {
    this.warningMessages = warningMessages;
    return this;
  }

  public Level getWarningLevel() {
    return parsedWarningLevel;
  }

  public RateLimitingConfig setWarningLevel(Level warningLevel) {
    Preconditions.checkNotNull(warningLevel, "Warning level should not be null!");
    this.warningLevel = warningLevel.getName();
    this.parsedWarningLevel = warningLevel;
    return this;
  }

  public int getDefaultThreshold() {
    return defaultThreshold;
  }

  public RateLimitingConfig setDefaultThreshold(int defaultThreshold) {
    Preconditions.checkArgument(defaultThreshold >= 0, "Threshold should not be negative!");
    this.defaultThreshold = defaultThreshold;
    return this;
  }

  public Duration getDefaultPeriod() {
    return Duration.ofMillis(defaultPeriodMillis);
  }

  public RateLimitingConfig setDefaultPeriod(Duration defaultPeriod) {
    Preconditions.checkArgument(!defaultPeriod.isNegative(), "Period should not be negative!");
    this.defaultPeriodMillis = defaultPeriod.toMillis();
    return this;
  }

  private RateLimitingConfig copy() {
    RateLimitingConfig copy = new RateLimitingConfig();
    copy.warningMessages = warningMessages;
    copy.warningLevel = warningLevel;
    copy.parsedWarningLevel = parsedWarningLevel;
    copy.defaultThreshold = defaultThreshold;
    copy.defaultPeriodMillis = defaultPeriodMillis;
    return copy;
  }

  private static final class DefaultHolder {
    private static final RateLimitingConfig INSTANCE =
        resolve(System.getProperty(CONFIG_FILE_PROPERTY));
  }
}
