package com.loglimit.logging;

import com.google.common.base.Ticker;
import com.loglimit.config.RateLimitingConfig;
import com.loglimit.limiter.ThreadLocalCallSiteLimiter;

import java.time.Duration;
import java.util.logging.Logger;

/**
 * A rate-limiting logger that keeps a separate budget for every thread writing through it.
 * Never blocks.
 */
public class ThreadLocalRateLimitingLogger extends RateLimitingLogger {

  /**
   * @param delegate  Delegate logger.
   * @param threshold Messages allowed per period, per thread.
   * @param period    Window length.
   */
  public ThreadLocalRateLimitingLogger(Logger delegate, long threshold, Duration period) {
    this(delegate, threshold, period, Ticker.systemTicker(), RateLimitingConfig.getDefault());
  }

  /**
   * @param delegate  Delegate logger.
   * @param threshold Messages allowed per period, per thread.
   * @param period    Window length.
   * @param ticker    Time source for windows.
   * @param config    Warning settings.
   */
  public ThreadLocalRateLimitingLogger(Logger delegate, long threshold, Duration period,
                                       Ticker ticker, RateLimitingConfig config) {
    super(delegate, new ThreadLocalCallSiteLimiter(threshold, period), ticker, config);
  }
}
