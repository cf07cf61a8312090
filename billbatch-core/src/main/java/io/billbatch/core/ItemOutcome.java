package io.billbatch.core;

import java.time.Duration;

/**
 * Result of processing one item.
 *
 * <p>{@code index} is the item's position in the submitted list; together with {@code item}
 * it lets callers re-correlate outcomes, which are recorded in completion order.
 * {@code value} is present iff SUCCESS; {@code error}/{@code errorType} iff FAILED.
 */
public record ItemOutcome<T, R>(
        int index,
        T item,
        OutcomeStatus status,
        R value,
        String error,
        String errorType,
        int attemptsUsed,
        Duration duration
) {

    public static <T, R> ItemOutcome<T, R> success(int index, T item, R value, int attemptsUsed, Duration duration) {
        return new ItemOutcome<>(index, item, OutcomeStatus.SUCCESS, value, null, null, attemptsUsed, duration);
    }

    public static <T, R> ItemOutcome<T, R> failure(int index, T item, Throwable error, int attemptsUsed, Duration duration) {
        String message = error.getMessage() != null ? error.getMessage() : error.toString();
        return new ItemOutcome<>(index, item, OutcomeStatus.FAILED, null, message, error.getClass().getName(), attemptsUsed, duration);
    }

    public boolean isSuccess() {
        return status == OutcomeStatus.SUCCESS;
    }
}
