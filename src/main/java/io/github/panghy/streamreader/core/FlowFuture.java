package io.github.panghy.streamreader.core;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.BiConsumer;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A single-assignment asynchronous value.
 * Similar to {@link CompletableFuture} but restricted to the operations a
 * cooperative, callback-driven reader needs: it is completed exactly once through
 * its {@link FlowPromise}, and continuations are attached with {@link #map},
 * {@link #flatMap} or {@link #whenComplete}.
 *
 * <p>Continuations run on the thread that completes the future. When the producer
 * of a byte stream completes a read future, the reader's continuation therefore
 * resumes inside the producer's own call, which is what makes the single-threaded
 * model work without a scheduler.</p>
 *
 * <p>The first completion wins. Later calls to {@code complete} or
 * {@code completeExceptionally} return {@code false} and leave the outcome
 * untouched.</p>
 *
 * @param <T> The type of value this future holds
 */
public class FlowFuture<T> {

  public static final FlowFuture<Void> COMPLETED_VOID_FUTURE = completed(null);

  private static final Logger LOGGER = Logger.getLogger(FlowFuture.class.getName());

  private final CompletableFuture<T> delegate = new CompletableFuture<>();
  private final FlowPromise<T> promise;

  /**
   * Creates a new FlowFuture with its corresponding FlowPromise.
   */
  public FlowFuture() {
    this.promise = new FlowPromise<>(this);
  }

  /**
   * Completes this future with a value. Called by the promise.
   *
   * @param value The value to complete with
   * @return true if this completion changed the future's state, false otherwise
   */
  boolean complete(T value) {
    return delegate.complete(value);
  }

  /**
   * Completes this future with an exception. Called by the promise.
   *
   * @param exception The exception to complete with
   * @return true if this completion changed the future's state, false otherwise
   */
  boolean completeExceptionally(Throwable exception) {
    return delegate.completeExceptionally(exception);
  }

  /**
   * Creates a new FlowFuture that's already completed with the given value.
   *
   * @param value The value to complete the future with
   * @param <U>   The type of the value
   * @return A completed FlowFuture
   */
  public static <U> FlowFuture<U> completed(U value) {
    FlowFuture<U> future = new FlowFuture<>();
    future.promise.complete(value);
    return future;
  }

  /**
   * Creates a new FlowFuture that's already completed exceptionally.
   *
   * @param exception The exception to complete the future with
   * @param <U>       The type of the future
   * @return A failed FlowFuture
   */
  public static <U> FlowFuture<U> failed(Throwable exception) {
    FlowFuture<U> future = new FlowFuture<>();
    future.promise.completeExceptionally(exception);
    return future;
  }

  /**
   * Returns the promise associated with this future.
   *
   * @return The promise that can complete this future
   */
  public FlowPromise<T> getPromise() {
    return promise;
  }

  /**
   * Checks if this future is completed (either successfully or with an exception).
   *
   * @return true if completed, false otherwise
   */
  public boolean isCompleted() {
    return delegate.isDone();
  }

  /**
   * Checks if this future is completed exceptionally.
   *
   * @return true if completed exceptionally, false otherwise
   */
  public boolean isCompletedExceptionally() {
    return delegate.isCompletedExceptionally();
  }

  /**
   * Returns true if this future completed.
   *
   * @return true if this future completed
   */
  public boolean isDone() {
    return delegate.isDone();
  }

  /**
   * Returns the exception that caused this future to complete exceptionally.
   *
   * @return The exception
   * @throws IllegalStateException if the future did not complete exceptionally
   */
  public Throwable getException() {
    if (!delegate.isCompletedExceptionally()) {
      throw new IllegalStateException("Future did not complete exceptionally");
    }
    try {
      delegate.getNow(null);
    } catch (CancellationException e) {
      return e;
    } catch (CompletionException e) {
      return e.getCause() != null ? e.getCause() : e;
    }
    throw new IllegalStateException("Future did not complete exceptionally");
  }

  /**
   * Attaches a callback to be invoked when this future completes.
   *
   * @param action The action to invoke when this future completes
   * @return This future
   */
  public FlowFuture<T> whenComplete(BiConsumer<? super T, ? super Throwable> action) {
    delegate.whenComplete((result, exception) -> {
      try {
        action.accept(result, unwrap(exception));
      } catch (Exception e) {
        // Log the exception and continue
        LOGGER.log(Level.SEVERE, "Exception in whenComplete callback", e);
      }
    });
    return this;
  }

  /**
   * Maps the value of this future to another value once it completes.
   *
   * @param mapper The function to apply to the result
   * @param <R>    The type of the resulting future
   * @return A new future that will complete with the mapped value
   */
  public <R> FlowFuture<R> map(Function<? super T, ? extends R> mapper) {
    FlowFuture<R> result = new FlowFuture<>();

    delegate.whenComplete((value, exception) -> {
      if (exception != null) {
        result.promise.completeExceptionally(unwrap(exception));
      } else {
        try {
          result.promise.complete(mapper.apply(value));
        } catch (Throwable ex) {
          result.promise.completeExceptionally(ex);
        }
      }
    });

    return result;
  }

  /**
   * Transforms the value of this future using a function that returns another future.
   *
   * @param mapper A function that takes a T and returns a FlowFuture<R>
   * @param <R>    The type of the resulting future
   * @return A new future that will complete with the result of the mapped future
   */
  public <R> FlowFuture<R> flatMap(Function<? super T, ? extends FlowFuture<R>> mapper) {
    FlowFuture<R> result = new FlowFuture<>();

    delegate.whenComplete((value, exception) -> {
      if (exception != null) {
        result.promise.completeExceptionally(unwrap(exception));
        return;
      }
      FlowFuture<R> mapped;
      try {
        mapped = mapper.apply(value);
      } catch (Throwable ex) {
        result.promise.completeExceptionally(ex);
        return;
      }
      mapped.delegate.whenComplete((mappedValue, mappedException) -> {
        if (mappedException != null) {
          result.promise.completeExceptionally(unwrap(mappedException));
        } else {
          result.promise.complete(mappedValue);
        }
      });
    });

    return result;
  }

  /**
   * Returns the value of this future if it has already completed,
   * or throws an exception if it completed exceptionally. This never blocks.
   *
   * @return the value
   * @throws ExecutionException    if the future completed exceptionally
   * @throws IllegalStateException if the future is not done
   */
  public T getNow() throws ExecutionException {
    if (!delegate.isDone()) {
      throw new IllegalStateException("Future is not done");
    }
    if (delegate.isCompletedExceptionally()) {
      throw new ExecutionException(getException());
    }
    return delegate.getNow(null);
  }

  /**
   * Converts this FlowFuture to a CompletableFuture. For unit testing and
   * integration with blocking code.
   *
   * @return The CompletableFuture representation of this FlowFuture
   */
  public CompletableFuture<T> toCompletableFuture() {
    return delegate;
  }

  private static Throwable unwrap(Throwable exception) {
    if (exception instanceof CompletionException && exception.getCause() != null) {
      return exception.getCause();
    }
    return exception;
  }
}
