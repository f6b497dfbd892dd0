package com.loglimit.limiter;

import com.google.common.base.Preconditions;

import java.time.Duration;

/**
 * Call site limiter that gives every thread its own window and budget. Threads never block or
 * affect each other: {@code N} threads reaching the same statement may write up to
 * {@code N * threshold} messages per period between them.
 */
public class ThreadLocalCallSiteLimiter implements CallSiteLimiter {
  private final long threshold;
  private final Duration period;
  private final long periodNanos;
  private final ThreadLocal<CallSiteState> state = ThreadLocal.withInitial(CallSiteState::new);

  /**
   * @param threshold messages allowed per window, per thread.
   * @param period    window length.
   */
  public ThreadLocalCallSiteLimiter(long threshold, Duration period) {
    Preconditions.checkArgument(threshold >= 0, "Threshold should not be negative!");
    Preconditions.checkArgument(!period.isNegative(), "Period should not be negative!");
    this.threshold = threshold;
    this.period = period;
    this.periodNanos = WindowPolicy.toNanosSaturated(period);
  }

  @Override
  public Decision acquire(long nowNanos) {
    return WindowPolicy.advance(state.get(), nowNanos, threshold, periodNanos);
  }

  @Override
  public long getThreshold() {
    return threshold;
  }

  @Override
  public Duration getPeriod() {
    return period;
  }
}
