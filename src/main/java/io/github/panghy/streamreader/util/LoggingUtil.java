package io.github.panghy.streamreader.util;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Logging helpers over java.util.logging that check the level first and attribute
 * the record to the calling class and method rather than to this helper.
 */
public final class LoggingUtil {

  private LoggingUtil() {
    // Utility class should not be instantiated
  }

  /**
   * Finds the first stack frame outside LoggingUtil.
   */
  private static StackTraceElement getCaller() {
    StackTraceElement[] stack = Thread.currentThread().getStackTrace();
    // Skip: 0=getStackTrace, 1=getCaller, 2=log method
    for (int i = 3; i < stack.length; i++) {
      StackTraceElement element = stack[i];
      if (!element.getClassName().equals(LoggingUtil.class.getName())) {
        return element;
      }
    }
    return stack[stack.length - 1];
  }

  /**
   * Logs a message at the given level if the logger's level permits it.
   *
   * @param logger  The logger to use
   * @param level   The level to log at
   * @param message The message to log
   */
  public static void log(Logger logger, Level level, String message) {
    if (logger.isLoggable(level)) {
      StackTraceElement caller = getCaller();
      logger.logp(level, caller.getClassName(), caller.getMethodName(), message);
    }
  }

  /**
   * Logs a debug message if the logger's level permits it.
   *
   * @param logger  The logger to use
   * @param message The message to log
   */
  public static void debug(Logger logger, String message) {
    log(logger, Level.FINE, message);
  }

  /**
   * Logs an info message if the logger's level permits it.
   *
   * @param logger  The logger to use
   * @param message The message to log
   */
  public static void info(Logger logger, String message) {
    log(logger, Level.INFO, message);
  }

  /**
   * Logs an exception at the warning level with full stack trace.
   *
   * @param logger    The logger to use
   * @param message   The message to log
   * @param throwable The exception to log
   */
  public static void warn(Logger logger, String message, Throwable throwable) {
    if (logger.isLoggable(Level.WARNING)) {
      StackTraceElement caller = getCaller();
      logger.logp(Level.WARNING, caller.getClassName(), caller.getMethodName(), message, throwable);
    }
  }
}
