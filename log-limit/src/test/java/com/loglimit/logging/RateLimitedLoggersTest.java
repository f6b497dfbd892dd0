package com.loglimit.logging;

import org.junit.Test;

import java.time.Duration;
import java.util.logging.Logger;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class RateLimitedLoggersTest {
  private final Logger delegate = Logger.getLogger(RateLimitedLoggersTest.class.getCanonicalName());

  @Test
  public void testDefaultsComeFromConfiguration() {
    RateLimitingLogger perThread = RateLimitedLoggers.perThread(delegate);
    assertTrue(perThread instanceof ThreadLocalRateLimitingLogger);
    assertEquals(25, perThread.getLimiter().getThreshold());
    assertEquals(Duration.ofMillis(500), perThread.getLimiter().getPeriod());

    RateLimitingLogger shared = RateLimitedLoggers.shared(delegate);
    assertTrue(shared instanceof SharedRateLimitingLogger);
    assertEquals(25, shared.getLimiter().getThreshold());
  }

  @Test
  public void testSharedContext() {
    RateLimitingLogger first = RateLimitedLoggers.shared(delegate, "RateLimitedLoggersTest.context");
    RateLimitingLogger second = RateLimitedLoggers.shared(delegate,
        "RateLimitedLoggersTest.context", 1, Duration.ofSeconds(1));
    assertSame(first.getLimiter(), second.getLimiter());
    assertEquals(25, second.getLimiter().getThreshold());
  }

  @Test
  public void testExplicitLimits() {
    RateLimitingLogger logger = RateLimitedLoggers.perThread(delegate, 4, Duration.ofMinutes(1));
    assertEquals(4, logger.getLimiter().getThreshold());
    assertEquals(Duration.ofMinutes(1), logger.getLimiter().getPeriod());
  }
}
