package com.loglimit.common;

import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * Base class for loggers that decide whether and what to write, and leave the writing itself to
 * another {@link Logger}.
 */
public abstract class DelegatingLogger extends Logger {
  private static final StackWalker STACK_WALKER = StackWalker.getInstance();

  protected final Logger delegate;

  /**
   * @param delegate     Delegate logger.
   */
  public DelegatingLogger(Logger delegate) {
    super(delegate.getName(), null);
    this.delegate = delegate;
  }

  /**
   * @param level   log level.
   * @param message string to write to log.
   */
  @Override
  public abstract void log(Level level, String message);

  @Override
  public boolean isLoggable(Level level) {
    return delegate.isLoggable(level);
  }

  /**
   * Forwards a record built elsewhere, e.g. by {@link #logp} or {@link #throwing}. An explicit
   * source set by the caller is kept.
   *
   * @param logRecord log record to write to log.
   */
  @Override
  public void log(LogRecord logRecord) {
    // resolved here, while java.util.logging.Logger frames of the original call are on the stack
    if (logRecord.getSourceClassName() == null) {
      inferCaller(logRecord);
    }
    forward(logRecord);
  }

  /**
   * Writes a record built by this logger.
   *
   * @param logRecord log record to write to log.
   */
  protected void write(LogRecord logRecord) {
    inferCaller(logRecord);
    forward(logRecord);
  }

  private void forward(LogRecord logRecord) {
    logRecord.setLoggerName(delegate.getName());
    delegate.log(logRecord);
  }

  /**
   * Points the record at the first frame outside of the logger classes, so that the delegate
   * reports the code that wrote the statement rather than this wrapper.
   */
  private static void inferCaller(LogRecord logRecord) {
    STACK_WALKER.walk(frames -> frames.
        dropWhile(frame -> !isLoggerFrame(frame.getClassName())).
        dropWhile(frame -> isLoggerFrame(frame.getClassName())).
        findFirst()).
        ifPresent(frame -> {
          logRecord.setSourceClassName(frame.getClassName());
          logRecord.setSourceMethodName(frame.getMethodName());
        });
  }

  private static boolean isLoggerFrame(String className) {
    return className.endsWith("Logger") || className.startsWith("java.lang.reflect.") ||
        className.startsWith("jdk.internal.reflect.");
  }
}
