package com.loglimit.logging;

import com.google.common.base.Ticker;
import com.loglimit.config.RateLimitingConfig;
import com.loglimit.limiter.CallSiteLimiters;
import com.loglimit.limiter.SharedCallSiteLimiter;

import java.time.Duration;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * A rate-limiting logger that can be shared between multiple threads. Loggers created with the
 * same context key also share one budget, for the lifetime of the process.
 */
public class SharedRateLimitingLogger extends RateLimitingLogger {

  /**
   * @param delegate  Delegate logger.
   * @param threshold Messages allowed per period.
   * @param period    Window length.
   */
  public SharedRateLimitingLogger(Logger delegate, long threshold, Duration period) {
    this(delegate, null, threshold, period);
  }

  /**
   * @param delegate  Delegate logger.
   * @param context   Shared context key.
   * @param threshold Messages allowed per period. Ignored if the context is already registered.
   * @param period    Window length. Ignored if the context is already registered.
   */
  public SharedRateLimitingLogger(Logger delegate, @Nullable String context, long threshold,
                                  Duration period) {
    this(delegate, context, threshold, period, Ticker.systemTicker(),
        RateLimitingConfig.getDefault());
  }

  /**
   * @param delegate  Delegate logger.
   * @param context   Shared context key, or {@code null} for a budget owned by this logger.
   * @param threshold Messages allowed per period.
   * @param period    Window length.
   * @param ticker    Time source for windows.
   * @param config    Warning settings.
   */
  public SharedRateLimitingLogger(Logger delegate, @Nullable String context, long threshold,
                                  Duration period, Ticker ticker, RateLimitingConfig config) {
    super(delegate, context == null ?
        new SharedCallSiteLimiter(threshold, period) :
        CallSiteLimiters.shared(context, threshold, period), ticker, config);
  }
}
