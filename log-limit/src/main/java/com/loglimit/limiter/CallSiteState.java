package com.loglimit.limiter;

/**
 * Mutable window bookkeeping for a single call site. Instances are not thread-safe: each one is
 * owned by exactly one thread, or only touched while holding the owner's transition lock.
 */
public class CallSiteState {
  private long count;
  private long windowStartNanos;
  private boolean started;
  private long suppressed;

  /**
   * Creates the state of a call site that has not been reached yet.
   */
  public CallSiteState() {
  }

  CallSiteState(long count, long windowStartNanos, long suppressed) {
    this.count = count;
    this.windowStartNanos = windowStartNanos;
    this.started = true;
    this.suppressed = suppressed;
  }

  /**
   * @return emissions made in the current window.
   */
  public long getCount() {
    return count;
  }

  /**
   * @return ticker value at which the current window started. Meaningless until {@link #isStarted()}.
   */
  public long getWindowStartNanos() {
    return windowStartNanos;
  }

  /**
   * @return whether any call has reached this call site yet.
   */
  public boolean isStarted() {
    return started;
  }

  /**
   * @return calls dropped in the current window.
   */
  public long getSuppressed() {
    return suppressed;
  }

  void startWindow(long nowNanos) {
    this.count = 1;
    this.windowStartNanos = nowNanos;
    this.started = true;
    this.suppressed = 0;
  }

  void incrementCount() {
    count++;
  }

  void incrementSuppressed() {
    suppressed++;
  }

  @Override
  public String toString() {
    return "CallSiteState{count=" + count + ", windowStartNanos=" +
        (started ? String.valueOf(windowStartNanos) : "none") + ", suppressed=" + suppressed + "}";
  }
}
