package io.github.panghy.streamreader.core;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FlowFutureTest {

  @Test
  void testCreateAndCompleteSuccessfully() throws Exception {
    FlowFuture<String> future = new FlowFuture<>();

    assertFalse(future.isDone());
    assertFalse(future.isCompleted());

    future.getPromise().complete("test");

    assertTrue(future.isDone());
    assertTrue(future.isCompleted());
    assertFalse(future.isCompletedExceptionally());
    assertEquals("test", future.getNow());
  }

  @Test
  void testCreateAndCompleteFailed() {
    FlowFuture<String> future = new FlowFuture<>();
    IOException testException = new IOException("Test exception");

    future.getPromise().completeExceptionally(testException);

    assertTrue(future.isDone());
    assertTrue(future.isCompletedExceptionally());
    assertSame(testException, future.getException());
    ExecutionException e = assertThrows(ExecutionException.class, future::getNow);
    assertSame(testException, e.getCause());
  }

  @Test
  void testFirstCompletionWins() throws Exception {
    FlowFuture<String> future = new FlowFuture<>();

    assertTrue(future.getPromise().complete("first"));
    assertFalse(future.getPromise().complete("second"));
    assertFalse(future.getPromise().completeExceptionally(new RuntimeException("late")));

    assertEquals("first", future.getNow());
  }

  @Test
  void testFailureCannotBeOverwritten() {
    FlowFuture<String> future = new FlowFuture<>();
    RuntimeException first = new RuntimeException("first");

    assertTrue(future.getPromise().completeExceptionally(first));
    assertFalse(future.getPromise().complete("value"));

    assertSame(first, future.getException());
  }

  @Test
  void testStaticCreators() throws Exception {
    assertEquals("done", FlowFuture.completed("done").getNow());
    assertNull(FlowFuture.COMPLETED_VOID_FUTURE.getNow());

    RuntimeException failure = new RuntimeException("Failed");
    FlowFuture<String> failed = FlowFuture.failed(failure);
    assertTrue(failed.isCompletedExceptionally());
    assertSame(failure, failed.getException());
  }

  @Test
  void testGetNowOnIncompleteFutureThrows() {
    FlowFuture<String> future = new FlowFuture<>();
    assertThrows(IllegalStateException.class, future::getNow);
  }

  @Test
  void testGetExceptionOnSuccessfulFutureThrows() {
    FlowFuture<String> future = FlowFuture.completed("ok");
    assertThrows(IllegalStateException.class, future::getException);
  }

  @Test
  void testMap() throws Exception {
    FlowFuture<String> future = new FlowFuture<>();
    FlowFuture<Integer> mapped = future.map(String::length);

    assertFalse(mapped.isDone());

    future.getPromise().complete("test");

    assertTrue(mapped.isDone());
    assertEquals(4, mapped.getNow());
  }

  @Test
  void testMapPropagatesFailureUnwrapped() {
    FlowFuture<String> future = new FlowFuture<>();
    FlowFuture<Integer> mapped = future.map(String::length);
    IOException failure = new IOException("Oops");

    future.getPromise().completeExceptionally(failure);

    assertSame(failure, mapped.getException());
  }

  @Test
  void testMapWithMappingFailure() {
    FlowFuture<String> future = new FlowFuture<>();
    FlowFuture<Integer> mapped = future.map(s -> {
      throw new IllegalArgumentException("Bad mapping");
    });

    future.getPromise().complete("test");

    assertInstanceOf(IllegalArgumentException.class, mapped.getException());
  }

  @Test
  void testFlatMap() throws Exception {
    FlowFuture<String> future = new FlowFuture<>();
    FlowFuture<String> inner = new FlowFuture<>();
    FlowFuture<String> flatMapped = future.flatMap(s -> inner.map(t -> s + " " + t));

    future.getPromise().complete("hello");
    assertFalse(flatMapped.isDone());

    inner.getPromise().complete("world");
    assertEquals("hello world", flatMapped.getNow());
  }

  @Test
  void testFlatMapFailures() {
    RuntimeException outer = new RuntimeException("outer");
    FlowFuture<String> failedOuter = FlowFuture.<String>failed(outer).flatMap(FlowFuture::completed);
    assertSame(outer, failedOuter.getException());

    RuntimeException inner = new RuntimeException("inner");
    FlowFuture<String> failedInner = FlowFuture.completed("x").flatMap(s -> FlowFuture.failed(inner));
    assertSame(inner, failedInner.getException());

    FlowFuture<String> throwing = FlowFuture.completed("x").flatMap(s -> {
      throw new IllegalStateException("mapper");
    });
    assertInstanceOf(IllegalStateException.class, throwing.getException());
  }

  @Test
  void testWhenCompleteRunsOnCompletingThread() {
    FlowFuture<Integer> future = new FlowFuture<>();
    AtomicReference<Thread> ranOn = new AtomicReference<>();
    future.whenComplete((value, exception) -> ranOn.set(Thread.currentThread()));

    future.getPromise().complete(1);

    assertSame(Thread.currentThread(), ranOn.get());
  }

  @Test
  void testWhenCompleteCallbackExceptionIsLoggedNotPropagated() {
    FlowFuture<Integer> future = new FlowFuture<>();
    AtomicBoolean secondCallbackRan = new AtomicBoolean();
    future.whenComplete((value, exception) -> {
      throw new IllegalStateException("callback failure");
    });
    future.whenComplete((value, exception) -> secondCallbackRan.set(true));

    assertTrue(future.getPromise().complete(7));
    assertTrue(secondCallbackRan.get());
  }

  @Test
  void testToCompletableFuture() throws Exception {
    FlowFuture<String> future = new FlowFuture<>();
    future.getPromise().complete("bridge");
    assertEquals("bridge", future.toCompletableFuture().get());
  }
}
