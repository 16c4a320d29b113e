package io.github.panghy.streamreader.core;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Signals that a stream has ended normally and no buffered bytes remain.
 *
 * <p>Use {@link #isEndOfStream(Throwable)} rather than an {@code instanceof} check
 * on exceptions obtained from a {@link java.util.concurrent.CompletableFuture},
 * since those arrive wrapped.</p>
 */
public class EndOfStreamException extends StreamClosedException {

  public static final String MESSAGE = "End-Of-Stream";

  private final int bytesRead;

  /**
   * Creates an end-of-stream marker for a read that delivered nothing.
   */
  public EndOfStreamException() {
    this(0);
  }

  /**
   * Creates an end-of-stream marker for a read that ended after delivering
   * {@code bytesRead} bytes.
   *
   * @param bytesRead The number of bytes delivered before the end was reached
   */
  public EndOfStreamException(int bytesRead) {
    super(MESSAGE);
    this.bytesRead = bytesRead;
  }

  /**
   * @return the number of bytes copied into the caller's buffer before the end was reached
   */
  public int getBytesRead() {
    return bytesRead;
  }

  /**
   * Checks whether the given throwable, or the cause it wraps, marks a normal end of stream.
   *
   * @param throwable The throwable to inspect, may be null
   * @return true if it is (or wraps) an {@link EndOfStreamException}
   */
  public static boolean isEndOfStream(Throwable throwable) {
    Throwable t = throwable;
    while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
      t = t.getCause();
    }
    return t instanceof EndOfStreamException;
  }
}
