package io.mapreducer.error;

public enum ErrorKind {
    CONFIGURATION,
    BUDGET_TIMEOUT,
    SEGMENT_FAILURE,
    REDUCE_FAILURE,
    CANCELLED
}
