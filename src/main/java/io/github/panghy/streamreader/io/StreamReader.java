package io.github.panghy.streamreader.io;

import io.github.panghy.streamreader.core.ConcurrentReadException;
import io.github.panghy.streamreader.core.EndOfStreamException;
import io.github.panghy.streamreader.core.FlowFuture;
import io.github.panghy.streamreader.core.FlowPromise;
import io.github.panghy.streamreader.core.StreamClosedException;

import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.logging.Level;
import java.util.logging.Logger;

import static io.github.panghy.streamreader.util.LoggingUtil.debug;
import static io.github.panghy.streamreader.util.LoggingUtil.log;
import static io.github.panghy.streamreader.util.LoggingUtil.warn;

/**
 * Turns a push-style {@link ByteSource} into a pull-style reader with look-ahead.
 *
 * <p>{@link #read(byte[], int, int)} asks for up to {@code length} bytes and returns a
 * future for the number of bytes copied. {@link #peek(byte[], int, int)} does the same
 * but keeps the bytes, so the next read or peek returns them again. Peeked bytes are
 * held in a {@link PeekBuffer} and always served before anything new is pulled from
 * the source, so bytes are delivered in exactly the order the source produced them.</p>
 *
 * <p>At most one request to the source is outstanding at a time. When the source has
 * nothing to give, the request is parked and the reader waits on
 * {@link ByteSource#readable()}, trying again on each wake-up until data arrives or
 * the source terminates. Issuing another read while one is parked is a usage error
 * and throws {@link ConcurrentReadException}.</p>
 *
 * <p>The source's end, error and close signals all lead to one terminal state. A
 * parked request is failed with {@link EndOfStreamException} after a normal end, with
 * the source's own error after a failure, or with {@link StreamClosedException} after
 * an abrupt close. Once terminated, reads are still served from the peek buffer; when
 * it is empty they fail with the same error.</p>
 *
 * <p>A read returns fewer bytes than requested only when the stream ends part way
 * through it. Such a short read is a successful result; use
 * {@link #readFully(byte[], int, int)} to treat it as a failure instead.</p>
 *
 * <p>Usage example:</p>
 * <pre>{@code
 * StreamReader reader = new StreamReader(source);
 * byte[] header = new byte[4];
 * reader.peek(header, 0, 4)
 *     .flatMap(n -> isMagic(header) ? reader.skip(4) : FlowFuture.completed(0L))
 *     .flatMap(skipped -> reader.readFully(body, 0, body.length));
 * }</pre>
 *
 * <p>This class is not thread-safe. Only one caller may use a reader, and it must do so
 * on the thread that delivers the source's signals.</p>
 *
 * @see ByteSource
 * @see BufferedByteSource
 */
public class StreamReader {

  private static final Logger LOGGER = Logger.getLogger(StreamReader.class.getName());

  private final ByteSource source;
  private final StreamReaderConfig config;
  private final PeekBuffer peekBuffer = new PeekBuffer();

  // The single outstanding request to the source, or null
  private ReadRequest request;
  private boolean endOfStream;
  private Throwable terminationError;

  /**
   * Creates a reader over the given source with the default configuration.
   *
   * @param source The source to read from; it is not closed by this reader
   */
  public StreamReader(ByteSource source) {
    this(source, StreamReaderConfig.DEFAULT);
  }

  /**
   * Creates a reader over the given source.
   *
   * @param source The source to read from; it is not closed by this reader
   * @param config The reader configuration
   */
  public StreamReader(ByteSource source, StreamReaderConfig config) {
    this.source = Objects.requireNonNull(source, "source");
    this.config = Objects.requireNonNull(config, "config");

    source.onEnd().whenComplete((ignored, exception) ->
        terminate(exception != null ? exception : new EndOfStreamException()));
    source.onError().whenComplete((ignored, exception) ->
        terminate(exception != null ? exception : new StreamClosedException("Stream failed")));
    source.onClose().whenComplete((ignored, exception) ->
        terminate(exception != null ? exception : new StreamClosedException()));
  }

  /**
   * Reads up to {@code buffer.length} bytes into {@code buffer}.
   *
   * @param buffer The destination array
   * @return A future for the number of bytes read
   * @see #read(byte[], int, int)
   */
  public FlowFuture<Integer> read(byte[] buffer) {
    return read(buffer, 0, buffer.length);
  }

  /**
   * Reads up to {@code length} bytes into {@code buffer} starting at {@code offset}.
   *
   * <p>Bytes held from earlier peeks are used first. If more are needed and the source
   * has not terminated, they are requested from the source. A zero-length read
   * completes with 0 without touching either.</p>
   *
   * @param buffer The destination array
   * @param offset Where in {@code buffer} to start writing
   * @param length The maximum number of bytes to read
   * @return A future for the number of bytes read, which is less than {@code length}
   *     only if the stream ended during this read. It fails with
   *     {@link EndOfStreamException} if the stream had already ended and nothing was
   *     buffered, or with the source's error if it failed.
   * @throws ConcurrentReadException if another read is still waiting on the source
   */
  public FlowFuture<Integer> read(byte[] buffer, int offset, int length) {
    checkBounds(buffer, offset, length);
    logCall("read", offset, length);
    if (length == 0) {
      return FlowFuture.completed(0);
    }
    if (peekBuffer.isEmpty() && endOfStream) {
      return FlowFuture.failed(terminationError);
    }

    int fromBuffer = peekBuffer.take(buffer, offset, length);
    int remaining = length - fromBuffer;
    if (remaining == 0 || endOfStream) {
      return FlowFuture.completed(fromBuffer);
    }

    FlowFuture<Integer> fromSource = readFromSource(buffer, offset + fromBuffer, remaining);
    if (fromBuffer == 0) {
      return fromSource;
    }
    // Bytes already taken from the peek buffer survive an end of stream
    FlowFuture<Integer> result = new FlowFuture<>();
    fromSource.whenComplete((n, exception) -> {
      if (exception == null) {
        result.getPromise().complete(fromBuffer + n);
      } else if (EndOfStreamException.isEndOfStream(exception)) {
        result.getPromise().complete(fromBuffer);
      } else {
        result.getPromise().completeExceptionally(exception);
      }
    });
    return result;
  }

  /**
   * Peeks up to {@code buffer.length} bytes into {@code buffer}.
   *
   * @param buffer The destination array
   * @return A future for the number of bytes peeked
   * @see #peek(byte[], int, int)
   */
  public FlowFuture<Integer> peek(byte[] buffer) {
    return peek(buffer, 0, buffer.length);
  }

  /**
   * Reads like {@link #read(byte[], int, int)} without consuming: the bytes copied into
   * {@code buffer} are kept and returned again by the next read or peek. Peeking more
   * than a previous peek returns the earlier bytes followed by new ones.
   *
   * @param buffer The destination array
   * @param offset Where in {@code buffer} to start writing
   * @param length The maximum number of bytes to peek
   * @return A future for the number of bytes peeked, with the same failures as read
   * @throws ConcurrentReadException if another read is still waiting on the source
   */
  public FlowFuture<Integer> peek(byte[] buffer, int offset, int length) {
    return read(buffer, offset, length).map(bytesRead -> {
      if (bytesRead > 0) {
        peekBuffer.unread(ByteBuffer.wrap(Arrays.copyOfRange(buffer, offset, offset + bytesRead)));
      }
      return bytesRead;
    });
  }

  /**
   * Reads exactly {@code length} bytes, issuing as many reads as needed.
   *
   * @param buffer The destination array
   * @param offset Where in {@code buffer} to start writing
   * @param length The number of bytes to read
   * @return A future for {@code length}. If the stream ends first it fails with an
   *     {@link EndOfStreamException} whose {@link EndOfStreamException#getBytesRead()}
   *     tells how many bytes were copied.
   */
  public FlowFuture<Integer> readFully(byte[] buffer, int offset, int length) {
    checkBounds(buffer, offset, length);
    FlowFuture<Integer> result = new FlowFuture<>();
    continueReadFully(buffer, offset, length, 0, result.getPromise());
    return result;
  }

  /**
   * Discards up to {@code n} bytes, taking peeked bytes first.
   *
   * @param n The number of bytes to skip
   * @return A future for the number of bytes skipped, which is less than {@code n} only
   *     if the stream ended. It fails with the source's error if the source failed.
   * @throws IllegalArgumentException if {@code n} is negative
   */
  public FlowFuture<Long> skip(long n) {
    if (n < 0) {
      throw new IllegalArgumentException("n must not be negative: " + n);
    }
    FlowFuture<Long> result = new FlowFuture<>();
    byte[] scratch = new byte[(int) Math.min(n, config.getSkipBufferSize())];
    continueSkip(scratch, n, 0L, result.getPromise());
    return result;
  }

  /**
   * @return true once the source has ended, failed or closed. Peeked bytes may still be readable.
   */
  public boolean isEndOfStream() {
    return endOfStream;
  }

  /**
   * @return the number of peeked bytes held by this reader
   */
  public int getBufferedBytes() {
    return peekBuffer.size();
  }

  /**
   * @return true if a read is waiting on the source
   */
  public boolean hasPendingRead() {
    return request != null;
  }

  private void continueReadFully(byte[] buffer, int offset, int length, int filled, FlowPromise<Integer> promise) {
    int total = filled;
    while (total < length) {
      FlowFuture<Integer> next;
      try {
        next = read(buffer, offset + total, length - total);
      } catch (RuntimeException e) {
        promise.completeExceptionally(e);
        return;
      }
      if (!next.isDone()) {
        int soFar = total;
        next.whenComplete((n, exception) -> {
          if (exception != null) {
            promise.completeExceptionally(shortReadError(exception, soFar));
          } else {
            continueReadFully(buffer, offset, length, soFar + n, promise);
          }
        });
        return;
      }
      try {
        total += next.getNow();
      } catch (ExecutionException e) {
        promise.completeExceptionally(shortReadError(e.getCause(), total));
        return;
      }
    }
    promise.complete(total);
  }

  private static Throwable shortReadError(Throwable exception, int bytesRead) {
    return EndOfStreamException.isEndOfStream(exception) ? new EndOfStreamException(bytesRead) : exception;
  }

  private void continueSkip(byte[] scratch, long n, long skipped, FlowPromise<Long> promise) {
    long total = skipped;
    while (total < n) {
      FlowFuture<Integer> next;
      try {
        next = read(scratch, 0, (int) Math.min(scratch.length, n - total));
      } catch (RuntimeException e) {
        promise.completeExceptionally(e);
        return;
      }
      if (!next.isDone()) {
        long soFar = total;
        next.whenComplete((count, exception) -> {
          if (exception != null) {
            finishSkip(promise, soFar, exception);
          } else {
            continueSkip(scratch, n, soFar + count, promise);
          }
        });
        return;
      }
      try {
        total += next.getNow();
      } catch (ExecutionException e) {
        finishSkip(promise, total, e.getCause());
        return;
      }
    }
    promise.complete(total);
  }

  private static void finishSkip(FlowPromise<Long> promise, long skipped, Throwable exception) {
    if (EndOfStreamException.isEndOfStream(exception)) {
      promise.complete(skipped);
    } else {
      promise.completeExceptionally(exception);
    }
  }

  /**
   * Requests bytes directly from the source. Completes at once if the source has data,
   * otherwise parks the request until a readiness signal brings some.
   */
  private FlowFuture<Integer> readFromSource(byte[] buffer, int offset, int length) {
    if (request != null) {
      throw new ConcurrentReadException("Concurrent read operation: a read of " + request.length
          + " bytes is still waiting on the source");
    }

    ByteBuffer chunk = source.tryRead(length);
    if (hasData(chunk)) {
      return FlowFuture.completed(deliver(chunk, buffer, offset, length));
    }
    if (endOfStream) {
      // Terminated while we were asking
      return FlowFuture.failed(terminationError);
    }

    ReadRequest pending = new ReadRequest(buffer, offset, length);
    request = pending;
    debug(LOGGER, "No data available, waiting for " + length + " bytes");
    awaitReadable(pending);
    return pending.future;
  }

  private void awaitReadable(ReadRequest pending) {
    source.readable().whenComplete((ignored, exception) -> retry(pending));
  }

  private void retry(ReadRequest pending) {
    if (request != pending) {
      // Already failed by termination
      return;
    }
    // Free the slot while calling into the source; a termination fired from inside
    // tryRead must not fail a request that is about to receive the returned chunk.
    request = null;
    ByteBuffer chunk;
    try {
      chunk = source.tryRead(pending.length);
    } catch (RuntimeException e) {
      pending.future.getPromise().completeExceptionally(e);
      return;
    }
    if (hasData(chunk)) {
      pending.future.getPromise().complete(deliver(chunk, pending.buffer, pending.offset, pending.length));
      return;
    }
    if (endOfStream) {
      pending.future.getPromise().completeExceptionally(terminationError);
      return;
    }
    request = pending;
    debug(LOGGER, "Source became readable without enough data, waiting again");
    awaitReadable(pending);
  }

  private static boolean hasData(ByteBuffer chunk) {
    return chunk != null && chunk.hasRemaining();
  }

  /**
   * Copies at most {@code length} bytes of {@code chunk}. Anything beyond that is kept
   * for the next read.
   */
  private int deliver(ByteBuffer chunk, byte[] buffer, int offset, int length) {
    int n = Math.min(chunk.remaining(), length);
    chunk.get(buffer, offset, n);
    if (chunk.hasRemaining()) {
      peekBuffer.push(chunk);
    }
    return n;
  }

  private void terminate(Throwable error) {
    if (endOfStream) {
      return;
    }
    endOfStream = true;
    terminationError = error;
    debug(LOGGER, "Source terminated: " + error);

    ReadRequest pending = request;
    if (pending != null) {
      request = null;
      if (!EndOfStreamException.isEndOfStream(error)) {
        warn(LOGGER, "Source terminated while a read of " + pending.length + " bytes was pending", error);
      }
      pending.future.getPromise().completeExceptionally(error);
    }
  }

  private void logCall(String operation, int offset, int length) {
    log(LOGGER, config.isDebugLogging() ? Level.INFO : Level.FINE,
        operation + "(offset=" + offset + ", length=" + length + "), buffered=" + peekBuffer.size());
  }

  private static void checkBounds(byte[] buffer, int offset, int length) {
    Objects.requireNonNull(buffer, "buffer");
    Objects.checkFromIndexSize(offset, length, buffer.length);
  }

  /**
   * A read parked until the source has data.
   */
  private static final class ReadRequest {
    final byte[] buffer;
    final int offset;
    final int length;
    final FlowFuture<Integer> future = new FlowFuture<>();

    ReadRequest(byte[] buffer, int offset, int length) {
      this.buffer = buffer;
      this.offset = offset;
      this.length = length;
    }
  }
}
