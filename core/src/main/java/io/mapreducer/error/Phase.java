package io.mapreducer.error;

public enum Phase {
    MAP,
    REDUCE
}
