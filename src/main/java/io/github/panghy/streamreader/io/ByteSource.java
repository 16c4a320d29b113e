package io.github.panghy.streamreader.io;

import io.github.panghy.streamreader.core.FlowFuture;

import java.nio.ByteBuffer;

/**
 * A push-style producer of bytes: data is buffered inside the source as it arrives,
 * and consumers are told through one-shot signals when it is worth trying again.
 *
 * <p>A {@link StreamReader} holds a reference to a source for its whole lifetime but
 * never closes it; the source's owner does.</p>
 *
 * <p>Signals are plain {@link FlowFuture}s. {@link #readable()} hands out a fresh
 * future per call, so a consumer that still finds nothing after a wake-up simply asks
 * again. The three termination futures are created once; each completes at most once.</p>
 *
 * @see BufferedByteSource
 */
public interface ByteSource {

  /**
   * Attempts to take bytes that are already buffered, without waiting.
   *
   * <p>Returns a chunk of exactly {@code maxLength} bytes if that many are buffered.
   * Once the producer has finished, returns whatever remains even if it is fewer
   * than {@code maxLength}. Otherwise returns {@code null}.</p>
   *
   * @param maxLength The number of bytes wanted (must be positive)
   * @return A buffer positioned at the first byte, or null if nothing can be delivered now
   */
  ByteBuffer tryRead(int maxLength);

  /**
   * Returns a future that completes the next time new data arrives or the source
   * terminates. Each call returns a future for the next such event only.
   *
   * @return A single-shot readiness future
   */
  FlowFuture<Void> readable();

  /**
   * Returns a future that completes once the producer has ended normally and every
   * buffered byte has been taken.
   *
   * @return The end signal
   */
  FlowFuture<Void> onEnd();

  /**
   * Returns a future that completes exceptionally, with the source's error, if the
   * source fails. It never completes normally.
   *
   * @return The error signal
   */
  FlowFuture<Void> onError();

  /**
   * Returns a future that completes when the source is released, whether after an
   * end, after an error, or abruptly.
   *
   * @return The close signal
   */
  FlowFuture<Void> onClose();
}
