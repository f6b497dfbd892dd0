package com.loglimit.limiter;

import java.time.Duration;

/**
 * Decides what happens to one call at a rate-limited call site and moves the call site's state on
 * accordingly.
 *
 * <p>Each window opens on the first call after the previous one elapsed and is anchored to that
 * call's timestamp. Up to {@code threshold} calls are written in a window; the call that reaches
 * the threshold also announces that suppression is starting, and every later call in the window is
 * dropped and tallied. The first call of the next window reports the tally before it is written.
 * Because windows are anchored to calls rather than to a fixed grid, any interval no longer than
 * {@code period} sees at most {@code 2 * threshold} messages.
 */
public final class WindowPolicy {

  private WindowPolicy() {
  }

  /**
   * Applies one call to {@code state}.
   *
   * @param state       state of the call site, updated in place.
   * @param nowNanos    ticker value of the call.
   * @param threshold   messages allowed per window.
   * @param periodNanos window length.
   * @return what to do with the call.
   */
  public static Decision advance(CallSiteState state, long nowNanos, long threshold,
                                 long periodNanos) {
    if (!state.isStarted()) {
      state.startWindow(nowNanos);
      return announceIfExhausted(Decision.emit(), threshold, periodNanos);
    }
    long elapsed = elapsedNanos(state.getWindowStartNanos(), nowNanos);
    if (isElapsed(state.getWindowStartNanos(), nowNanos, periodNanos)) {
      long suppressed = state.getSuppressed();
      state.startWindow(nowNanos);
      Decision decision = suppressed > 0 ?
          Decision.warnResumeThenEmit(suppressed, elapsed) :
          Decision.resumeThenEmit();
      return announceIfExhausted(decision, threshold, periodNanos);
    }
    if (state.getCount() < threshold) {
      state.incrementCount();
      return state.getCount() == threshold ?
          Decision.emitAndWarnSuppressionStart(periodNanos - elapsed) :
          Decision.emit();
    }
    state.incrementSuppressed();
    return Decision.suppress();
  }

  /**
   * Time since {@code windowStartNanos}, clamped to zero if the clock went backwards.
   */
  public static long elapsedNanos(long windowStartNanos, long nowNanos) {
    return Math.max(0, nowNanos - windowStartNanos);
  }

  /**
   * Returns whether a window that started at {@code windowStartNanos} is over at {@code nowNanos}.
   * A timestamp older than the window start never ends the window, even a zero-length one.
   */
  public static boolean isElapsed(long windowStartNanos, long nowNanos, long periodNanos) {
    long delta = nowNanos - windowStartNanos;
    return delta >= 0 && delta >= periodNanos;
  }

  /**
   * Converts a window length to nanoseconds. Periods too long for a {@code long} count of
   * nanoseconds (about 292 years) become {@link Long#MAX_VALUE}, i.e. a window that never ends.
   */
  public static long toNanosSaturated(Duration period) {
    try {
      return period.toNanos();
    } catch (ArithmeticException e) {
      return Long.MAX_VALUE;
    }
  }

  // a new window already holds one message
  private static Decision announceIfExhausted(Decision decision, long threshold,
                                              long periodNanos) {
    return threshold <= 1 ? decision.withSuppressionStart(periodNanos) : decision;
  }
}
