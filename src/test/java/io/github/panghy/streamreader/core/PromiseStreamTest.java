package io.github.panghy.streamreader.core;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link PromiseStream} and {@link FutureStream}.
 */
class PromiseStreamTest {

  @Test
  void testSendBeforeReceive() throws Exception {
    PromiseStream<Integer> stream = new PromiseStream<>();

    assertTrue(stream.send(42));

    FlowFuture<Integer> value = stream.getFutureStream().nextAsync();
    assertTrue(value.isDone());
    assertEquals(42, value.getNow());
  }

  @Test
  void testReceiveBeforeSend() throws Exception {
    PromiseStream<String> stream = new PromiseStream<>();
    FutureStream<String> futureStream = stream.getFutureStream();

    FlowFuture<String> first = futureStream.nextAsync();
    FlowFuture<String> second = futureStream.nextAsync();
    FlowFuture<Boolean> hasNext = futureStream.hasNextAsync();
    assertFalse(first.isDone());
    assertFalse(hasNext.isDone());

    stream.send("first");
    stream.send("second");

    // Waiting consumers are served in order
    assertEquals("first", first.getNow());
    assertEquals("second", second.getNow());
    assertTrue(hasNext.getNow());
  }

  @Test
  void testCloseStream() throws Exception {
    PromiseStream<Integer> stream = new PromiseStream<>();
    FutureStream<Integer> futureStream = stream.getFutureStream();

    stream.send(1);
    assertTrue(stream.close());
    assertFalse(stream.close());

    assertFalse(stream.send(2));
    assertTrue(stream.isClosed());
    assertTrue(futureStream.isClosed());
    assertTrue(futureStream.onClose().isDone());
    assertFalse(futureStream.onClose().isCompletedExceptionally());

    // Buffered value is still delivered
    assertTrue(futureStream.hasNextAsync().getNow());
    assertEquals(1, futureStream.nextAsync().getNow());

    assertFalse(futureStream.hasNextAsync().getNow());
    ExecutionException e = assertThrows(ExecutionException.class, () -> futureStream.nextAsync().getNow());
    assertInstanceOf(StreamClosedException.class, e.getCause());
  }

  @Test
  void testCloseWithException() {
    PromiseStream<Integer> stream = new PromiseStream<>();
    FutureStream<Integer> futureStream = stream.getFutureStream();
    FlowFuture<Integer> pending = futureStream.nextAsync();
    FlowFuture<Boolean> pendingHasNext = futureStream.hasNextAsync();
    IOException failure = new IOException("Stream failed");

    futureStream.closeExceptionally(failure);

    assertSame(failure, pending.getException());
    assertSame(failure, pendingHasNext.getException());
    assertSame(failure, stream.getCloseException());
    assertSame(failure, futureStream.onClose().getException());
    assertSame(failure, futureStream.hasNextAsync().getException());
  }

  @Test
  void testPendingHasNextCompletesFalseOnNormalClose() throws Exception {
    PromiseStream<Integer> stream = new PromiseStream<>();
    FlowFuture<Boolean> hasNext = stream.getFutureStream().hasNextAsync();

    stream.getFutureStream().close();

    assertFalse(hasNext.getNow());
  }

  @Test
  void testForEachDeliversBufferedAndLaterValues() {
    PromiseStream<String> stream = new PromiseStream<>();
    List<String> seen = new ArrayList<>();
    stream.send("a");
    stream.send("b");

    FlowFuture<Void> done = stream.getFutureStream().forEach(seen::add);
    assertEquals(List.of("a", "b"), seen);
    assertFalse(done.isDone());

    stream.send("c");
    assertEquals(List.of("a", "b", "c"), seen);

    stream.close();
    assertTrue(done.isDone());
    assertFalse(done.isCompletedExceptionally());
  }

  @Test
  void testForEachFailsWithCloseException() {
    PromiseStream<String> stream = new PromiseStream<>();
    List<String> seen = new ArrayList<>();
    FlowFuture<Void> done = stream.getFutureStream().forEach(seen::add);
    IOException failure = new IOException("reset");

    stream.send("a");
    stream.closeExceptionally(failure);

    assertEquals(List.of("a"), seen);
    assertSame(failure, done.getException());
  }

  @Test
  void testForEachFailsWhenActionThrows() {
    PromiseStream<String> stream = new PromiseStream<>();
    stream.send("bad");

    FlowFuture<Void> done = stream.getFutureStream().forEach(value -> {
      throw new IllegalArgumentException(value);
    });

    assertInstanceOf(IllegalArgumentException.class, done.getException());
  }
}
