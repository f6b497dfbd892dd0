package com.loglimit.logging;

import com.loglimit.common.CapturingHandler;
import com.loglimit.common.ManualTicker;
import com.loglimit.config.RateLimitingConfig;
import org.junit.Before;
import org.junit.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class SharedRateLimitingLoggerTest {
  private static final AtomicInteger LOGGER_IDS = new AtomicInteger();

  private Logger delegate;
  private CapturingHandler handler;
  private ManualTicker ticker;

  @Before
  public void setUp() {
    delegate = Logger.getLogger("SharedRateLimitingLoggerTest." + LOGGER_IDS.incrementAndGet());
    handler = CapturingHandler.attachTo(delegate);
    ticker = new ManualTicker();
  }

  @Test
  public void testLoggerLimitsCorrectly() {
    Logger logger = new SharedRateLimitingLogger(delegate, null, 2, Duration.ofMillis(50), ticker,
        new RateLimitingConfig());
    for (int i = 0; i < 11; i++) {
      logger.info("Logging on repeat");
      ticker.advance(11, TimeUnit.MILLISECONDS);
    }
    assertEquals(5, handler.getMessages(Level.INFO).size());
    assertEquals(4, handler.getMessages(Level.WARNING).size());
    assertEquals(2, handler.getMessages(Level.WARNING).stream().
        filter(w -> w.equals("Ignored 3 logs since 55.00 ms ago. Starting to log again...")).
        count());
  }

  @Test
  public void testLogpIsLimited() {
    Logger logger = new SharedRateLimitingLogger(delegate, null, 2, Duration.ofSeconds(10), ticker,
        new RateLimitingConfig());
    for (int i = 0; i < 100; i++) {
      logger.logp(Level.INFO, "com.example.Poller", "poll", "poll failed");
    }
    assertEquals(3, handler.getRecords().size());
    assertEquals(2, handler.getMessages(Level.INFO).size());
    assertEquals(1, handler.getMessages(Level.WARNING).size());
  }

  @Test
  public void testLoggersWithTheSameContextShareBudget() {
    String context = "shared-context-" + LOGGER_IDS.incrementAndGet();
    Logger first = new SharedRateLimitingLogger(delegate, context, 3, Duration.ofSeconds(1),
        ticker, new RateLimitingConfig());
    Logger second = new SharedRateLimitingLogger(delegate, context, 3, Duration.ofSeconds(1),
        ticker, new RateLimitingConfig());
    Logger own = new SharedRateLimitingLogger(delegate, null, 3, Duration.ofSeconds(1), ticker,
        new RateLimitingConfig());
    for (int i = 0; i < 5; i++) {
      first.info("first");
      second.info("second");
      own.info("own");
    }
    assertEquals(2, handler.getMessages().stream().filter("first"::equals).count());
    assertEquals(1, handler.getMessages().stream().filter("second"::equals).count());
    assertEquals(3, handler.getMessages().stream().filter("own"::equals).count());
  }

  @Test
  public void testNoDoubleWarningsUnderContention() throws Exception {
    int threads = 8;
    Logger logger = new SharedRateLimitingLogger(delegate, null, 10, Duration.ofSeconds(1), ticker,
        new RateLimitingConfig());
    ExecutorService executor = Executors.newFixedThreadPool(threads);
    try {
      spam(executor, logger, threads, 200);
      assertEquals(10, handler.getMessages(Level.INFO).size());
      assertEquals(1, handler.getMessages(Level.WARNING).size());
      assertTrue(handler.getMessages(Level.WARNING).get(0).startsWith("Hit logging threshold!"));

      handler.clear();
      ticker.advance(1, TimeUnit.SECONDS);
      spam(executor, logger, threads, 200);
      assertEquals(10, handler.getMessages(Level.INFO).size());
      assertEquals(1, handler.getMessages(Level.WARNING).stream().
          filter(w -> w.equals("Ignored 1590 logs since 1.000 s ago. Starting to log again...")).
          count());
      assertEquals(1, handler.getMessages(Level.WARNING).stream().
          filter(w -> w.startsWith("Hit logging threshold!")).count());
    } finally {
      executor.shutdownNow();
    }
  }

  private static void spam(ExecutorService executor, Logger logger, int threads, int calls)
      throws Exception {
    CountDownLatch start = new CountDownLatch(1);
    List<Future<?>> futures = new ArrayList<>();
    for (int i = 0; i < threads; i++) {
      futures.add(executor.submit(() -> {
        start.await();
        for (int j = 0; j < calls; j++) {
          logger.info("spam");
        }
        return null;
      }));
    }
    start.countDown();
    for (Future<?> future : futures) {
      future.get(30, TimeUnit.SECONDS);
    }
  }
}
