package io.github.panghy.streamreader.core;

/**
 * The consumer side of a {@link PromiseStream}. Holders of a FutureStream can only
 * read values, while the producer keeps the write capabilities.
 *
 * @param <T> The type of value provided by this stream
 */
public interface FutureStream<T> extends FlowStream<T> {
}
