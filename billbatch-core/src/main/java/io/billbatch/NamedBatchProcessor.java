package io.billbatch;

/**
 * A {@link BatchProcessor} registered under a name, so that jobs can be submitted by
 * processor name with raw (JSON-shaped) items.
 */
public interface NamedBatchProcessor<T, R> extends BatchProcessor<T, R> {
    String name();

    Class<T> itemClass();
}
