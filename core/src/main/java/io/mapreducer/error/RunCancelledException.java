package io.mapreducer.error;

public class RunCancelledException extends SummarizationException {
    public RunCancelledException(Phase phase, String message, Throwable cause) {
        super(ErrorKind.CANCELLED, phase, null, message, cause);
    }
}
