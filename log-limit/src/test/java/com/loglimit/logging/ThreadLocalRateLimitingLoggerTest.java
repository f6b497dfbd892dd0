package com.loglimit.logging;

import com.loglimit.common.CapturingHandler;
import com.loglimit.common.ManualTicker;
import com.loglimit.config.RateLimitingConfig;
import org.junit.Before;
import org.junit.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

import static org.junit.Assert.assertEquals;

public class ThreadLocalRateLimitingLoggerTest {
  private static final AtomicInteger LOGGER_IDS = new AtomicInteger();

  private Logger delegate;
  private CapturingHandler handler;
  private ManualTicker ticker;

  @Before
  public void setUp() {
    delegate = Logger.getLogger("ThreadLocalRateLimitingLoggerTest." +
        LOGGER_IDS.incrementAndGet());
    handler = CapturingHandler.attachTo(delegate);
    ticker = new ManualTicker();
  }

  @Test
  public void testLoggerLimitsCorrectly() {
    Logger logger = new ThreadLocalRateLimitingLogger(delegate, 2, Duration.ofMillis(50), ticker,
        new RateLimitingConfig());
    for (int i = 0; i < 11; i++) {
      logger.info("Logging on repeat");
      ticker.advance(11, TimeUnit.MILLISECONDS);
    }
    // 0 and 11 are written, 22-44 dropped, 55 and 66 written, 77-99 dropped, 110 written
    assertEquals(5, handler.getMessages(Level.INFO).size());
    List<String> warnings = handler.getMessages(Level.WARNING);
    assertEquals(4, warnings.size());
    List<String> ignored = warnings.stream().filter(w -> w.startsWith("Ignored")).
        collect(Collectors.toList());
    assertEquals(2, ignored.size());
    assertEquals("3", ignored.get(0).split(" ")[1]);
    assertEquals("3", ignored.get(1).split(" ")[1]);
    assertEquals("Ignored 3 logs since 55.00 ms ago. Starting to log again...", ignored.get(0));
  }

  @Test
  public void testThreadsDoNotShareBudget() throws Exception {
    Logger logger = new ThreadLocalRateLimitingLogger(delegate, 3, Duration.ofSeconds(1), ticker,
        new RateLimitingConfig());
    Runnable spam = () -> {
      for (int i = 0; i < 100; i++) {
        logger.warning("spam");
      }
    };
    Thread first = new Thread(spam);
    Thread second = new Thread(spam);
    first.start();
    second.start();
    first.join();
    second.join();
    spam.run();
    assertEquals(9, handler.getMessages().stream().filter("spam"::equals).count());
    assertEquals(3, handler.getMessages().stream().filter(m -> m.startsWith("Hit")).count());
  }
}
