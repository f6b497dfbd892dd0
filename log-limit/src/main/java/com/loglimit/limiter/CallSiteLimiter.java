package com.loglimit.limiter;

import java.time.Duration;

/**
 * Rate-limiting state of one log statement.
 */
public interface CallSiteLimiter {

  /**
   * Registers a call at this call site.
   *
   * @param nowNanos ticker value of the call.
   * @return what to do with the call.
   */
  Decision acquire(long nowNanos);

  /**
   * @return messages allowed per window.
   */
  long getThreshold();

  /**
   * @return window length.
   */
  Duration getPeriod();
}
