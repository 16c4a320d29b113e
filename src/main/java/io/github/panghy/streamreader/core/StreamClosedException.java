package io.github.panghy.streamreader.core;

/**
 * Thrown when data is requested from a stream that has been closed.
 * A stream closed without an explicit end or error (an abrupt closure) fails
 * pending and subsequent reads with this exception.
 */
public class StreamClosedException extends RuntimeException {

  /**
   * Creates a new StreamClosedException with a default message.
   */
  public StreamClosedException() {
    super("Stream closed");
  }

  /**
   * Creates a new StreamClosedException with a custom message.
   *
   * @param message The exception message
   */
  public StreamClosedException(String message) {
    super(message);
  }

  /**
   * Creates a new StreamClosedException with a custom message and cause.
   *
   * @param message The exception message
   * @param cause   The underlying cause of this exception
   */
  public StreamClosedException(String message, Throwable cause) {
    super(message, cause);
  }
}
