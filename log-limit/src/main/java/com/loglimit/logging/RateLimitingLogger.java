package com.loglimit.logging;

import com.google.common.base.Preconditions;
import com.google.common.base.Ticker;
import com.loglimit.common.DelegatingLogger;
import com.loglimit.common.Durations;
import com.loglimit.config.RateLimitingConfig;
import com.loglimit.limiter.CallSiteLimiter;
import com.loglimit.limiter.Decision;
import com.yammer.metrics.Metrics;
import com.yammer.metrics.core.Counter;
import com.yammer.metrics.core.MetricName;

import java.util.Locale;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * A logger that guards a single log statement: every message written through it counts against
 * one call site's budget of {@code threshold} messages per {@code period}. Messages over budget
 * are dropped; the delegate is told when dropping starts and, once the window has passed, how many
 * messages were dropped.
 *
 * <p>Keep one instance per statement, typically in a {@code static final} field next to it.
 * Messages at levels the delegate does not log are discarded without using up the budget.
 */
public abstract class RateLimitingLogger extends DelegatingLogger {
  static final String SUPPRESSION_START_TEMPLATE =
      "Hit logging threshold! Starting to ignore the previous log for %s";
  static final String RESUME_TEMPLATE =
      "Ignored %d logs since %s ago. Starting to log again...";

  private final CallSiteLimiter limiter;
  private final Ticker ticker;
  private final RateLimitingConfig config;
  private final Counter emitted;
  private final Counter suppressed;

  /**
   * @param delegate Delegate logger.
   * @param limiter  Call site state.
   * @param ticker   Time source for windows.
   * @param config   Warning settings.
   */
  protected RateLimitingLogger(Logger delegate, CallSiteLimiter limiter, Ticker ticker,
                               RateLimitingConfig config) {
    super(Preconditions.checkNotNull(delegate, "Delegate logger should not be null!"));
    this.limiter = Preconditions.checkNotNull(limiter);
    this.ticker = Preconditions.checkNotNull(ticker);
    this.config = Preconditions.checkNotNull(config);
    this.emitted = Metrics.newCounter(new MetricName("limited-logging", delegate.getName(),
        "emitted"));
    this.suppressed = Metrics.newCounter(new MetricName("limited-logging", delegate.getName(),
        "suppressed"));
  }

  /**
   * @param level   log level.
   * @param message string to write to log.
   */
  @Override
  public void log(Level level, String message) {
    if (admit(level)) {
      write(new LogRecord(level, message));
    }
  }

  /**
   * @param level           Log level.
   * @param messageSupplier A function, which when called, produces the desired log message.
   *                        Not called when the message is dropped.
   */
  @Override
  public void log(Level level, Supplier<String> messageSupplier) {
    if (admit(level)) {
      write(new LogRecord(level, messageSupplier.get()));
    }
  }

  @Override
  public void log(Level level, String message, Throwable thrown) {
    if (admit(level)) {
      LogRecord logRecord = new LogRecord(level, message);
      logRecord.setThrown(thrown);
      write(logRecord);
    }
  }

  @Override
  public void log(Level level, Throwable thrown, Supplier<String> messageSupplier) {
    if (admit(level)) {
      LogRecord logRecord = new LogRecord(level, messageSupplier.get());
      logRecord.setThrown(thrown);
      write(logRecord);
    }
  }

  @Override
  public void log(Level level, String message, Object param) {
    log(level, message, new Object[] {param});
  }

  @Override
  public void log(Level level, String message, Object[] params) {
    if (admit(level)) {
      LogRecord logRecord = new LogRecord(level, message);
      logRecord.setParameters(params);
      write(logRecord);
    }
  }

  /**
   * Records built by the inherited {@code logp}, {@code logrb}, {@code entering},
   * {@code exiting} and {@code throwing} methods end up here and count against the same budget.
   *
   * @param logRecord log record to write to log.
   */
  @Override
  public void log(LogRecord logRecord) {
    if (admit(logRecord.getLevel())) {
      super.log(logRecord);
    }
  }

  /**
   * @return the call site this logger guards.
   */
  public CallSiteLimiter getLimiter() {
    return limiter;
  }

  /**
   * Consults the call site and writes the announcements that go before the message.
   *
   * @return whether the message itself should be written.
   */
  private boolean admit(Level level) {
    if (!isLoggable(level)) {
      return false;
    }
    Decision decision = limiter.acquire(ticker.read());
    if (decision.isResumeSummary()) {
      announce(String.format(Locale.ROOT, RESUME_TEMPLATE, decision.getSuppressedCount(),
          Durations.format(decision.getElapsedNanos())));
    }
    if (decision.isSuppressionStart()) {
      announce(String.format(Locale.ROOT, SUPPRESSION_START_TEMPLATE,
          Durations.format(decision.getRemainingNanos())));
    }
    if (decision.isEmit()) {
      emitted.inc();
      return true;
    }
    suppressed.inc();
    return false;
  }

  private void announce(String message) {
    if (config.isWarningMessages()) {
      write(new LogRecord(config.getWarningLevel(), message));
    }
  }
}
