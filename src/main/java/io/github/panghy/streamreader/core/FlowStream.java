package io.github.panghy.streamreader.core;

import java.util.function.Consumer;

/**
 * A stream of asynchronous values consumed through a future-based API.
 *
 * @param <T> The type of value provided by this stream
 */
public interface FlowStream<T> {

  /**
   * Returns a future that completes with the next value in the stream,
   * or completes exceptionally if the stream is closed with an error or
   * there are no more values.
   *
   * @return A future that completes with the next value
   */
  FlowFuture<T> nextAsync();

  /**
   * Returns a future that completes with true if this stream has more values,
   * or false if the stream is closed and has no more values.
   *
   * @return A future that completes with true if more values are available
   */
  FlowFuture<Boolean> hasNextAsync();

  /**
   * Closes this stream, making any pending nextAsync() calls complete exceptionally
   * with the given exception.
   *
   * @param exception The exception to complete pending futures with
   * @return A future that completes when the stream is closed
   */
  FlowFuture<Void> closeExceptionally(Throwable exception);

  /**
   * Closes this stream, making any pending nextAsync() calls complete exceptionally
   * with a default StreamClosedException.
   *
   * @return A future that completes when the stream is closed
   */
  FlowFuture<Void> close();

  /**
   * Returns whether this stream is closed.
   *
   * @return true if the stream is closed, false otherwise
   */
  boolean isClosed();

  /**
   * Returns a future that completes when this stream is closed.
   *
   * @return A future that completes when the stream is closed
   */
  FlowFuture<Void> onClose();

  /**
   * Executes the given action for each element of the stream, in sequence.
   * The action runs on whichever thread delivers the element.
   *
   * @param action The action to execute for each element
   * @return A future that completes when the stream closes normally, or
   *     exceptionally with the stream's close exception
   */
  FlowFuture<Void> forEach(Consumer<? super T> action);
}
