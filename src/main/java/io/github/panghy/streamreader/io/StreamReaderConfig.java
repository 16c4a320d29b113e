package io.github.panghy.streamreader.io;

/**
 * Configuration options for a {@link StreamReader}.
 */
public class StreamReaderConfig {

  /** The default size of the scratch buffer used by skip(). */
  private static final int DEFAULT_SKIP_BUFFER_SIZE = 4096;

  /** Chunk size used when skip() has to pull bytes from the source. */
  private final int skipBufferSize;

  /** Whether read and peek calls are logged at INFO instead of FINE. */
  private final boolean debugLogging;

  /** The default reader configuration. */
  public static final StreamReaderConfig DEFAULT = new StreamReaderConfig(DEFAULT_SKIP_BUFFER_SIZE, false);

  /**
   * Creates a new reader configuration.
   *
   * @param skipBufferSize The chunk size used when skipping bytes from the source
   * @param debugLogging   Whether to log every read and peek at INFO
   */
  public StreamReaderConfig(int skipBufferSize, boolean debugLogging) {
    if (skipBufferSize < 1) {
      throw new IllegalArgumentException("Skip buffer size must be at least 1");
    }
    this.skipBufferSize = skipBufferSize;
    this.debugLogging = debugLogging;
  }

  /**
   * Gets the chunk size used when skipping bytes from the source.
   *
   * @return The skip buffer size in bytes
   */
  public int getSkipBufferSize() {
    return skipBufferSize;
  }

  /**
   * Gets whether debug logging is enabled.
   *
   * @return True if debug logging is enabled, false otherwise
   */
  public boolean isDebugLogging() {
    return debugLogging;
  }

  /**
   * Creates a new builder for reader configuration.
   *
   * @return A new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Builder for reader configuration.
   */
  public static class Builder {
    private int skipBufferSize = DEFAULT_SKIP_BUFFER_SIZE;
    private boolean debugLogging = false;

    /**
     * Sets the chunk size used when skipping bytes from the source.
     *
     * @param skipBufferSize The skip buffer size in bytes
     * @return This builder
     */
    public Builder skipBufferSize(int skipBufferSize) {
      this.skipBufferSize = skipBufferSize;
      return this;
    }

    /**
     * Sets whether to enable debug logging.
     *
     * @param debugLogging True if debug logging should be enabled
     * @return This builder
     */
    public Builder debugLogging(boolean debugLogging) {
      this.debugLogging = debugLogging;
      return this;
    }

    /**
     * Builds a new reader configuration.
     *
     * @return A new configuration
     */
    public StreamReaderConfig build() {
      return new StreamReaderConfig(skipBufferSize, debugLogging);
    }
  }
}
