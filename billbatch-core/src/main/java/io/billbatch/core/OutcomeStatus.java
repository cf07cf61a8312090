package io.billbatch.core;

public enum OutcomeStatus {
    SUCCESS,
    FAILED
}
