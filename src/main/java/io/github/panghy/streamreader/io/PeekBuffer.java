package io.github.panghy.streamreader.io;

import java.nio.ByteBuffer;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Bytes already pulled from a {@link ByteSource} but not yet consumed by a plain read.
 *
 * <p>Chunks are kept in delivery order: concatenating them reproduces exactly the
 * next bytes the source would have produced. {@link #take} consumes from the front
 * and leaves the unconsumed part of a partially read chunk at the front for the next
 * call.</p>
 */
public class PeekBuffer {

  private final Deque<ByteBuffer> chunks = new ArrayDeque<>();
  private int size;

  /**
   * Appends a chunk after everything already buffered. Empty chunks are ignored.
   *
   * @param chunk The bytes between its position and limit; the buffer is retained, not copied
   */
  public void push(ByteBuffer chunk) {
    if (chunk.hasRemaining()) {
      chunks.addLast(chunk);
      size += chunk.remaining();
    }
  }

  /**
   * Inserts a chunk ahead of everything already buffered. Used to put back bytes
   * that were handed out but must be delivered again.
   *
   * @param chunk The bytes between its position and limit; the buffer is retained, not copied
   */
  public void unread(ByteBuffer chunk) {
    if (chunk.hasRemaining()) {
      chunks.addFirst(chunk);
      size += chunk.remaining();
    }
  }

  /**
   * Removes up to {@code maxLength} bytes from the front and copies them into
   * {@code dst} starting at {@code offset}.
   *
   * @param dst       The destination array
   * @param offset    Where in {@code dst} to start writing
   * @param maxLength The most bytes to take
   * @return the number of bytes copied, 0 if the buffer is empty
   */
  public int take(byte[] dst, int offset, int maxLength) {
    int copied = 0;
    while (copied < maxLength && !chunks.isEmpty()) {
      ByteBuffer head = chunks.peekFirst();
      int n = Math.min(head.remaining(), maxLength - copied);
      head.get(dst, offset + copied, n);
      copied += n;
      if (!head.hasRemaining()) {
        chunks.removeFirst();
      }
    }
    size -= copied;
    return copied;
  }

  /**
   * @return the total number of buffered bytes
   */
  public int size() {
    return size;
  }

  public boolean isEmpty() {
    return size == 0;
  }
}
