package io.github.panghy.streamreader.io;

import io.github.panghy.streamreader.core.FlowFuture;
import io.github.panghy.streamreader.core.FlowPromise;

import java.nio.ByteBuffer;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.logging.Logger;

import static io.github.panghy.streamreader.util.LoggingUtil.debug;

/**
 * A {@link ByteSource} fed by a producer that pushes chunks into it.
 *
 * <p>The producer calls {@link #write(ByteBuffer)} as data arrives and finishes with
 * exactly one of {@link #end()}, {@link #fail(Throwable)} or {@link #close()}. Every
 * one of those calls wakes the consumers parked on {@link #readable()}.</p>
 *
 * <p>{@link #tryRead(int)} only hands out a short chunk once the producer has ended,
 * so a reader sees fewer bytes than it asked for only at the end of the stream.
 * The end signal fires as soon as the last buffered byte has been taken, which may
 * be from inside the {@code tryRead} call that took it.</p>
 *
 * <p>Like the {@link StreamReader} on top of it, this class is not thread-safe. All
 * producer and consumer calls must happen on one thread, or be serialized by the
 * caller.</p>
 */
public class BufferedByteSource implements ByteSource {

  private static final Logger LOGGER = Logger.getLogger(BufferedByteSource.class.getName());

  private final Deque<ByteBuffer> chunks = new ArrayDeque<>();
  private final List<FlowPromise<Void>> readableWaiters = new ArrayList<>();
  private final FlowFuture<Void> endFuture = new FlowFuture<>();
  private final FlowFuture<Void> errorFuture = new FlowFuture<>();
  private final FlowFuture<Void> closeFuture = new FlowFuture<>();

  private int bufferedBytes;
  // Producer has called end(); buffered bytes may remain
  private boolean ended;
  // End signal fired, or failed, or closed. No data will ever be delivered again.
  private boolean terminated;

  /**
   * Appends a copy of the remaining bytes of {@code data}. The buffer's position is
   * not changed.
   *
   * @param data The bytes to append
   * @return true if accepted, false if the producer already finished
   */
  public boolean write(ByteBuffer data) {
    if (ended || terminated) {
      return false;
    }
    if (!data.hasRemaining()) {
      return true;
    }
    ByteBuffer copy = ByteBuffer.allocate(data.remaining());
    copy.put(data.duplicate());
    copy.flip();
    chunks.addLast(copy);
    bufferedBytes += copy.remaining();
    wakeReaders();
    return true;
  }

  /**
   * Appends a copy of {@code data}.
   *
   * @param data The bytes to append
   * @return true if accepted, false if the producer already finished
   */
  public boolean write(byte[] data) {
    return write(ByteBuffer.wrap(data));
  }

  /**
   * Marks the end of the data. Bytes already buffered stay readable; the end signal
   * fires once they have all been taken.
   *
   * @return true if this call ended the source, false if it had already finished
   */
  public boolean end() {
    if (ended || terminated) {
      return false;
    }
    ended = true;
    debug(LOGGER, "Source ended with " + bufferedBytes + " bytes still buffered");
    if (bufferedBytes == 0) {
      fireEnd();
    }
    wakeReaders();
    return true;
  }

  /**
   * Fails the source. Buffered bytes are discarded, {@link #onError()} fails with
   * {@code error} and {@link #onClose()} completes.
   *
   * @param error The error to report to consumers
   * @return true if this call failed the source, false if it was already terminated
   */
  public boolean fail(Throwable error) {
    if (terminated) {
      return false;
    }
    discard();
    debug(LOGGER, "Source failed: " + error);
    errorFuture.getPromise().completeExceptionally(error);
    closeFuture.getPromise().complete(null);
    wakeReaders();
    return true;
  }

  /**
   * Releases the source. Closing before {@link #end()} has been fully consumed is an
   * abrupt closure: buffered bytes are discarded and only {@link #onClose()} fires.
   *
   * @return true if this call closed the source, false if it was already terminated
   */
  public boolean close() {
    if (terminated) {
      return false;
    }
    discard();
    debug(LOGGER, "Source closed");
    closeFuture.getPromise().complete(null);
    wakeReaders();
    return true;
  }

  /**
   * @return the number of bytes buffered and not yet taken
   */
  public int getBufferedBytes() {
    return bufferedBytes;
  }

  @Override
  public ByteBuffer tryRead(int maxLength) {
    if (maxLength <= 0) {
      throw new IllegalArgumentException("maxLength must be positive: " + maxLength);
    }
    if (bufferedBytes == 0 || (bufferedBytes < maxLength && !ended)) {
      return null;
    }

    int length = Math.min(maxLength, bufferedBytes);
    ByteBuffer result;
    ByteBuffer head = chunks.peekFirst();
    if (head.remaining() == length) {
      result = chunks.removeFirst();
    } else {
      result = ByteBuffer.allocate(length);
      while (result.hasRemaining()) {
        head = chunks.peekFirst();
        if (head.remaining() <= result.remaining()) {
          result.put(chunks.removeFirst());
        } else {
          ByteBuffer part = head.duplicate();
          part.limit(part.position() + result.remaining());
          result.put(part);
          head.position(part.position());
        }
      }
      result.flip();
    }
    bufferedBytes -= length;

    if (ended && bufferedBytes == 0) {
      fireEnd();
    }
    return result;
  }

  @Override
  public FlowFuture<Void> readable() {
    if (terminated) {
      return FlowFuture.COMPLETED_VOID_FUTURE;
    }
    FlowFuture<Void> future = new FlowFuture<>();
    readableWaiters.add(future.getPromise());
    return future;
  }

  @Override
  public FlowFuture<Void> onEnd() {
    return endFuture;
  }

  @Override
  public FlowFuture<Void> onError() {
    return errorFuture;
  }

  @Override
  public FlowFuture<Void> onClose() {
    return closeFuture;
  }

  private void fireEnd() {
    if (terminated) {
      return;
    }
    terminated = true;
    debug(LOGGER, "Source drained after end");
    endFuture.getPromise().complete(null);
    closeFuture.getPromise().complete(null);
  }

  private void discard() {
    terminated = true;
    chunks.clear();
    bufferedBytes = 0;
  }

  private void wakeReaders() {
    if (readableWaiters.isEmpty()) {
      return;
    }
    // Waiters may register again while being woken
    List<FlowPromise<Void>> waiters = new ArrayList<>(readableWaiters);
    readableWaiters.clear();
    for (FlowPromise<Void> waiter : waiters) {
      waiter.complete(null);
    }
  }
}
