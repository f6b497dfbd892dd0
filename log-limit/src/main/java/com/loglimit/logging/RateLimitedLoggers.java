package com.loglimit.logging;

import com.loglimit.config.RateLimitingConfig;

import java.time.Duration;
import java.util.logging.Logger;

/**
 * Factory methods for rate-limiting loggers. Variants without a threshold and period take them
 * from {@link RateLimitingConfig#getDefault()}.
 */
public final class RateLimitedLoggers {

  private RateLimitedLoggers() {
  }

  public static RateLimitingLogger perThread(Logger delegate) {
    RateLimitingConfig config = RateLimitingConfig.getDefault();
    return perThread(delegate, config.getDefaultThreshold(), config.getDefaultPeriod());
  }

  public static RateLimitingLogger perThread(Logger delegate, long threshold, Duration period) {
    return new ThreadLocalRateLimitingLogger(delegate, threshold, period);
  }

  public static RateLimitingLogger shared(Logger delegate) {
    RateLimitingConfig config = RateLimitingConfig.getDefault();
    return shared(delegate, null, config.getDefaultThreshold(), config.getDefaultPeriod());
  }

  public static RateLimitingLogger shared(Logger delegate, String context) {
    RateLimitingConfig config = RateLimitingConfig.getDefault();
    return shared(delegate, context, config.getDefaultThreshold(), config.getDefaultPeriod());
  }

  public static RateLimitingLogger shared(Logger delegate, String context, long threshold,
                                          Duration period) {
    return new SharedRateLimitingLogger(delegate, context, threshold, period);
  }
}
