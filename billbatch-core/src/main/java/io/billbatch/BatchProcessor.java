package io.billbatch;

/**
 * Caller-supplied function applied to every item of a batch job.
 *
 * <p>Implementations are invoked concurrently from several workers and must not share
 * unsynchronized mutable state between calls. A thrown exception marks the attempt as failed;
 * the registry's retry policy decides whether the item is tried again.
 *
 * @param <T> item type
 * @param <R> result type
 */
@FunctionalInterface
public interface BatchProcessor<T, R> {

    R process(T item) throws Exception;
}
