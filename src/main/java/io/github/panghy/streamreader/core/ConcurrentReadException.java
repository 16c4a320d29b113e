package io.github.panghy.streamreader.core;

/**
 * Thrown when a read is issued against a source while another read on the same
 * reader is still waiting for data. This is a usage error and is never recovered from.
 */
public class ConcurrentReadException extends IllegalStateException {

  /**
   * Creates a new ConcurrentReadException.
   *
   * @param message The detail message
   */
  public ConcurrentReadException(String message) {
    super(message);
  }
}
