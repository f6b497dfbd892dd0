package com.loglimit.limiter;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide table of shared call site limiters, keyed by call site identity.
 */
public final class CallSiteLimiters {
  private static final Map<String, SharedCallSiteLimiter> SHARED_CACHE = new ConcurrentHashMap<>();

  private CallSiteLimiters() {
  }

  /**
   * Returns the shared limiter registered under {@code key}, creating it on first use. The
   * threshold and period of the first registration win; later registrations under the same key
   * get the existing limiter unchanged.
   *
   * @param key       call site identity.
   * @param threshold messages allowed per window.
   * @param period    window length.
   * @return shared limiter for the call site.
   */
  public static SharedCallSiteLimiter shared(String key, long threshold, Duration period) {
    Preconditions.checkNotNull(key, "Call site key should not be null!");
    return SHARED_CACHE.computeIfAbsent(key, x -> new SharedCallSiteLimiter(threshold, period));
  }

  /**
   * @return a new limiter whose windows are kept per thread.
   */
  public static ThreadLocalCallSiteLimiter perThread(long threshold, Duration period) {
    return new ThreadLocalCallSiteLimiter(threshold, period);
  }

  @VisibleForTesting
  static void clear() {
    SHARED_CACHE.clear();
  }
}
