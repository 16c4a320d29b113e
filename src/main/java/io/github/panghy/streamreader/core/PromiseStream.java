package io.github.panghy.streamreader.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * The producer side of a stream of values.
 *
 * <p>Values are sent with {@link #send(Object)} and consumed through the
 * {@link FutureStream} returned by {@link #getFutureStream()}. A value sent while a
 * consumer is waiting completes that consumer's future directly; otherwise it is
 * buffered in order.</p>
 *
 * <p>{@link #close()} ends the stream normally: consumers drain the buffer and then
 * see {@code hasNextAsync() == false}. {@link #closeExceptionally(Throwable)} fails
 * consumers with the given exception once the buffer is drained.</p>
 *
 * @param <T> The type of value flowing through this stream
 */
public class PromiseStream<T> {

  private final Queue<T> buffer = new ConcurrentLinkedQueue<>();
  private final Queue<FlowPromise<T>> nextPromises = new ConcurrentLinkedQueue<>();
  private final Queue<FlowPromise<Boolean>> hasNextPromises = new ConcurrentLinkedQueue<>();
  private final AtomicBoolean closed = new AtomicBoolean(false);
  private final AtomicReference<Throwable> closeException = new AtomicReference<>();
  private final FutureStream<T> futureStream;
  private final Object lock = new Object(); // Lock for synchronizing buffer and promise operations
  private final FlowFuture<Void> closeFuture = new FlowFuture<>();

  /**
   * Creates a new PromiseStream.
   */
  public PromiseStream() {
    this.futureStream = new FutureStreamImpl<>(this);
  }

  /**
   * Gets the FutureStream interface for consuming values from this stream.
   *
   * @return The FutureStream for this stream
   */
  public FutureStream<T> getFutureStream() {
    return futureStream;
  }

  /**
   * Sends a value to this stream, making it available to consumers.
   *
   * @param value The value to send
   * @return true if the stream accepted the value, false if the stream is closed
   */
  public boolean send(T value) {
    if (closed.get()) {
      return false;
    }

    synchronized (lock) {
      FlowPromise<T> promise = nextPromises.poll();
      if (promise != null) {
        // There's a waiting consumer, deliver directly
        promise.complete(value);
      } else {
        buffer.add(value);
      }

      // Consumers woken here may wait again; those waits belong to the next send
      List<FlowPromise<Boolean>> waiting = new ArrayList<>();
      FlowPromise<Boolean> hasNextPromise;
      while ((hasNextPromise = hasNextPromises.poll()) != null) {
        waiting.add(hasNextPromise);
      }
      for (FlowPromise<Boolean> waiter : waiting) {
        waiter.complete(true);
      }
    }

    return true;
  }

  /**
   * Closes this stream normally.
   *
   * @return true if this call closed the stream, false if it was already closed
   */
  public boolean close() {
    return closeExceptionally(new StreamClosedException());
  }

  /**
   * Closes this stream with an exception. Pending hasNext promises complete with
   * false and pending next promises fail with the given exception.
   *
   * @param exception The exception to complete pending promises with
   * @return true if this call closed the stream, false if it was already closed
   */
  public boolean closeExceptionally(Throwable exception) {
    if (!closed.compareAndSet(false, true)) {
      return false;
    }

    closeException.set(exception);

    synchronized (lock) {
      FlowPromise<T> nextPromise;
      while ((nextPromise = nextPromises.poll()) != null) {
        nextPromise.completeExceptionally(exception);
      }

      FlowPromise<Boolean> hasNextPromise;
      while ((hasNextPromise = hasNextPromises.poll()) != null) {
        if (isNormalClose(exception)) {
          hasNextPromise.complete(false);
        } else {
          hasNextPromise.completeExceptionally(exception);
        }
      }
    }

    if (isNormalClose(exception)) {
      closeFuture.getPromise().complete(null);
    } else {
      closeFuture.getPromise().completeExceptionally(exception);
    }

    return true;
  }

  /**
   * Checks if this stream is closed.
   *
   * @return true if closed, false otherwise
   */
  public boolean isClosed() {
    return closed.get();
  }

  /**
   * Gets the exception that caused this stream to close, if any.
   *
   * @return the exception that closed this stream, or null if still open
   */
  public Throwable getCloseException() {
    return closeException.get();
  }

  private static boolean isNormalClose(Throwable exception) {
    return exception instanceof StreamClosedException;
  }

  private static class FutureStreamImpl<E> implements FutureStream<E> {
    private final PromiseStream<E> parent;

    FutureStreamImpl(PromiseStream<E> parent) {
      this.parent = parent;
    }

    @Override
    public FlowFuture<E> nextAsync() {
      synchronized (parent.lock) {
        E value = parent.buffer.poll();
        if (value != null) {
          return FlowFuture.completed(value);
        }

        if (parent.closed.get()) {
          Throwable exception = parent.closeException.get();
          return FlowFuture.failed(exception != null ? exception : new StreamClosedException());
        }

        FlowFuture<E> future = new FlowFuture<>();
        parent.nextPromises.add(future.getPromise());
        return future;
      }
    }

    @Override
    public FlowFuture<Boolean> hasNextAsync() {
      synchronized (parent.lock) {
        if (!parent.buffer.isEmpty()) {
          return FlowFuture.completed(true);
        }

        if (parent.closed.get()) {
          Throwable exception = parent.closeException.get();
          if (exception != null && !isNormalClose(exception)) {
            return FlowFuture.failed(exception);
          }
          return FlowFuture.completed(false);
        }

        FlowFuture<Boolean> future = new FlowFuture<>();
        parent.hasNextPromises.add(future.getPromise());
        return future;
      }
    }

    @Override
    public FlowFuture<Void> closeExceptionally(Throwable exception) {
      parent.closeExceptionally(exception);
      return FlowFuture.COMPLETED_VOID_FUTURE;
    }

    @Override
    public FlowFuture<Void> close() {
      parent.close();
      return FlowFuture.COMPLETED_VOID_FUTURE;
    }

    @Override
    public boolean isClosed() {
      return parent.isClosed();
    }

    @Override
    public FlowFuture<Void> onClose() {
      return parent.closeFuture;
    }

    @Override
    public FlowFuture<Void> forEach(Consumer<? super E> action) {
      FlowFuture<Void> result = new FlowFuture<>();
      drain(action, result.getPromise());
      return result;
    }

    /**
     * Delivers every value that is ready without recursion, then parks on
     * hasNextAsync() until the producer sends more or closes.
     */
    private void drain(Consumer<? super E> action, FlowPromise<Void> done) {
      while (true) {
        FlowFuture<Boolean> hasNext = hasNextAsync();
        if (!hasNext.isDone()) {
          hasNext.whenComplete((ignored, exception) -> drain(action, done));
          return;
        }
        try {
          if (!hasNext.getNow()) {
            done.complete(null);
            return;
          }
          action.accept(nextAsync().getNow());
        } catch (ExecutionException e) {
          done.completeExceptionally(e.getCause());
          return;
        } catch (RuntimeException e) {
          done.completeExceptionally(e);
          return;
        }
      }
    }
  }
}
