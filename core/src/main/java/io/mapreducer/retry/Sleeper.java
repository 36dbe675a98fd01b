package io.mapreducer.retry;

import java.util.concurrent.TimeUnit;

@FunctionalInterface
public interface Sleeper {
    Sleeper SYSTEM = TimeUnit.MILLISECONDS::sleep;

    void sleep(long millis) throws InterruptedException;
}
