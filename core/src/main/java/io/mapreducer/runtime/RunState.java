package io.mapreducer.runtime;

public enum RunState {
    IDLE,
    MAPPING,
    REDUCING,
    DONE,
    FAILED;

    public boolean isTerminal() { return this == DONE || this == FAILED; }
}
