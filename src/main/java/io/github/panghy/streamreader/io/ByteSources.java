package io.github.panghy.streamreader.io;

import io.github.panghy.streamreader.core.FlowStream;
import io.github.panghy.streamreader.core.StreamClosedException;

import java.nio.ByteBuffer;
import java.util.logging.Logger;

import static io.github.panghy.streamreader.util.LoggingUtil.debug;

/**
 * Factory methods for {@link ByteSource}s.
 */
public final class ByteSources {

  private static final Logger LOGGER = Logger.getLogger(ByteSources.class.getName());

  private ByteSources() {
    // Utility class should not be instantiated
  }

  /**
   * Creates a source holding the given chunks, already ended.
   *
   * @param chunks The bytes to serve, in order
   * @return An ended source that serves exactly those bytes
   */
  public static BufferedByteSource of(byte[]... chunks) {
    BufferedByteSource source = new BufferedByteSource();
    for (byte[] chunk : chunks) {
      source.write(chunk);
    }
    source.end();
    return source;
  }

  /**
   * Creates a source fed by a stream of byte chunks, such as the receive stream of a
   * connection. Each chunk is written as it arrives. A normal close of the stream
   * ends the source; closing it with any other exception fails the source with that
   * exception.
   *
   * @param stream The stream to drain
   * @return A source that serves the stream's bytes
   */
  public static BufferedByteSource fromStream(FlowStream<ByteBuffer> stream) {
    BufferedByteSource source = new BufferedByteSource();
    stream.forEach(source::write).whenComplete((ignored, exception) -> {
      if (exception == null || exception instanceof StreamClosedException) {
        debug(LOGGER, "Chunk stream closed, ending source");
        source.end();
      } else {
        debug(LOGGER, "Chunk stream failed: " + exception);
        source.fail(exception);
      }
    });
    return source;
  }
}
