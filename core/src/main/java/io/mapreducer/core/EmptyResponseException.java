package io.mapreducer.core;

/** The model answered without usable content. Never retried. */
public class EmptyResponseException extends Exception {
    public EmptyResponseException(String message) { super(message); }
}
