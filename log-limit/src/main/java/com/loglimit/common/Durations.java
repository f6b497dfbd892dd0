package com.loglimit.common;

import java.util.Locale;
import java.util.concurrent.TimeUnit;

import static java.util.concurrent.TimeUnit.DAYS;
import static java.util.concurrent.TimeUnit.HOURS;
import static java.util.concurrent.TimeUnit.MICROSECONDS;
import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static java.util.concurrent.TimeUnit.MINUTES;
import static java.util.concurrent.TimeUnit.NANOSECONDS;
import static java.util.concurrent.TimeUnit.SECONDS;

/**
 * Human-readable rendering of nanosecond durations for log messages.
 */
public final class Durations {

  private Durations() {
  }

  /**
   * Formats a duration using the largest unit that keeps the value at or above 1, with four
   * significant digits, e.g. {@code "4.900 ms"} or {@code "2.000 s"}.
   *
   * @param nanos duration in nanoseconds. Negative values are rendered as zero.
   * @return formatted duration.
   */
  public static String format(long nanos) {
    long value = Math.max(0, nanos);
    TimeUnit unit = chooseUnit(value);
    double amount = (double) value / NANOSECONDS.convert(1, unit);
    return String.format(Locale.ROOT, "%.4g %s", amount, abbreviate(unit));
  }

  private static TimeUnit chooseUnit(long nanos) {
    if (DAYS.convert(nanos, NANOSECONDS) > 0) return DAYS;
    if (HOURS.convert(nanos, NANOSECONDS) > 0) return HOURS;
    if (MINUTES.convert(nanos, NANOSECONDS) > 0) return MINUTES;
    if (SECONDS.convert(nanos, NANOSECONDS) > 0) return SECONDS;
    if (MILLISECONDS.convert(nanos, NANOSECONDS) > 0) return MILLISECONDS;
    if (MICROSECONDS.convert(nanos, NANOSECONDS) > 0) return MICROSECONDS;
    return NANOSECONDS;
  }

  private static String abbreviate(TimeUnit unit) {
    switch (unit) {
      case NANOSECONDS:
        return "ns";
      case MICROSECONDS:
        return "\u03bcs";
      case MILLISECONDS:
        return "ms";
      case SECONDS:
        return "s";
      case MINUTES:
        return "min";
      case HOURS:
        return "h";
      case DAYS:
        return "d";
      default:
        throw new AssertionError();
    }
  }
}
