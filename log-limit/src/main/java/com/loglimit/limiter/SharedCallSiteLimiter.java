package com.loglimit.limiter;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;

import javax.annotation.Nullable;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Call site limiter whose window and budget are shared by every thread reaching the statement.
 *
 * <p>Calls inside a window that still has budget only compare-and-increment the message count.
 * The two boundary transitions, opening a new window and using up the budget, are made under a
 * per-call-site lock and re-checked once the lock is held, so that racing threads produce exactly
 * one reset and one announcement of each kind per window. A thread that loses a reset race is
 * counted against the window that won.
 */
public class SharedCallSiteLimiter implements CallSiteLimiter {
  private static final Logger logger = Logger.getLogger(
      SharedCallSiteLimiter.class.getCanonicalName());

  private final long threshold;
  private final Duration period;
  private final long periodNanos;

  private final AtomicLong count = new AtomicLong();
  private final AtomicLong suppressed = new AtomicLong();
  private final ReentrantLock transitionLock = new ReentrantLock();
  @Nullable
  private volatile Window window = null;

  // guarded by transitionLock
  @Nullable
  private Window announcedWindow = null;
  private boolean transitionInProgress = false;

  /**
   * @param threshold messages allowed per window.
   * @param period    window length.
   */
  public SharedCallSiteLimiter(long threshold, Duration period) {
    Preconditions.checkArgument(threshold >= 0, "Threshold should not be negative!");
    Preconditions.checkArgument(!period.isNegative(), "Period should not be negative!");
    this.threshold = threshold;
    this.period = period;
    this.periodNanos = WindowPolicy.toNanosSaturated(period);
  }

  @Override
  public Decision acquire(long nowNanos) {
    while (true) {
      Window current = window;
      if (current == null || WindowPolicy.isElapsed(current.startNanos, nowNanos, periodNanos)) {
        Decision decision = startWindow(current, nowNanos);
        if (decision != null) {
          return decision;
        }
        continue;
      }
      long seen = count.get();
      if (seen < threshold) {
        if (!count.compareAndSet(seen, seen + 1)) {
          continue;
        }
        return seen + 1 < threshold ? Decision.emit() : exhaustWindow(current, nowNanos);
      }
      suppressed.incrementAndGet();
      return Decision.suppress();
    }
  }

  /**
   * Opens a new window unless another thread already replaced {@code expected} with a window that
   * is still running.
   *
   * @return the decision for the call opening the window, or {@code null} if the call should be
   *         re-evaluated against the window another thread opened.
   */
  @Nullable
  private Decision startWindow(@Nullable Window expected, long nowNanos) {
    transitionLock.lock();
    try {
      if (recoverInterruptedTransition(nowNanos)) {
        return Decision.emit();
      }
      Window current = window;
      if (current != expected && current != null &&
          !WindowPolicy.isElapsed(current.startNanos, nowNanos, periodNanos)) {
        return null;
      }
      transitionInProgress = true;
      CallSiteState state = current == null ?
          new CallSiteState() :
          new CallSiteState(count.get(), current.startNanos, suppressed.getAndSet(0));
      Decision decision = WindowPolicy.advance(state, nowNanos, threshold, periodNanos);
      count.set(state.getCount());
      Window opened = new Window(state.getWindowStartNanos());
      window = opened;
      announcedWindow = decision.isSuppressionStart() ? opened : null;
      transitionInProgress = false;
      return decision;
    } finally {
      transitionLock.unlock();
    }
  }

  /**
   * Announces the start of suppression for the current window, unless it has been announced
   * already. If the window was replaced after {@code observed} was read, the increment may have
   * used up the old window's budget, so the announcement is only made when the current window has
   * no budget left either.
   */
  private Decision exhaustWindow(Window observed, long nowNanos) {
    transitionLock.lock();
    try {
      if (recoverInterruptedTransition(nowNanos)) {
        return Decision.emit();
      }
      Window current = window;
      if (current == null || current == announcedWindow ||
          (current != observed && count.get() < threshold)) {
        return Decision.emit();
      }
      transitionInProgress = true;
      CallSiteState state = new CallSiteState(threshold - 1, current.startNanos, 0);
      Decision decision = WindowPolicy.advance(state, nowNanos, threshold, periodNanos);
      announcedWindow = current;
      transitionInProgress = false;
      return decision;
    } finally {
      transitionLock.unlock();
    }
  }

  /**
   * Must be called with the transition lock held. If the previous holder left a transition
   * half-applied, starts a fresh window at {@code nowNanos} holding the current call.
   *
   * @return whether the state had to be repaired.
   */
  private boolean recoverInterruptedTransition(long nowNanos) {
    if (!transitionInProgress) {
      return false;
    }
    logger.log(Level.WARNING, "Rate limiter state was left inconsistent by an interrupted " +
        "window transition, starting a new window");
    suppressed.set(0);
    count.set(1);
    window = new Window(nowNanos);
    announcedWindow = null;
    transitionInProgress = false;
    return true;
  }

  @VisibleForTesting
  void interruptTransition() {
    transitionLock.lock();
    try {
      transitionInProgress = true;
    } finally {
      transitionLock.unlock();
    }
  }

  @VisibleForTesting
  ReentrantLock getTransitionLock() {
    return transitionLock;
  }

  @VisibleForTesting
  long getCount() {
    return count.get();
  }

  @VisibleForTesting
  long getSuppressed() {
    return suppressed.get();
  }

  @Override
  public long getThreshold() {
    return threshold;
  }

  @Override
  public Duration getPeriod() {
    return period;
  }

  /**
   * A window's start. Identity tells windows apart, so that two windows opened at the same
   * nanosecond are still distinct.
   */
  private static final class Window {
    private final long startNanos;

    private Window(long startNanos) {
      this.startNanos = startNanos;
    }
  }
}
