package com.skyfinal.lifecycle;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Cooperative cancellation token shared by the pipeline loops.
 *
 * Loops check {@link #isStopped()} at the top of each iteration and before
 * each blocking call, and pause with {@link #awaitStop(Duration)} instead of
 * {@code Thread.sleep} so a stop request wakes them immediately. In-flight
 * network calls are never aborted; they finish and the loop exits afterwards.
 */
public class StopSignal {

    private final CountDownLatch stopped = new CountDownLatch(1);

    public void stop() {
        stopped.countDown();
    }

    public boolean isStopped() {
        return stopped.getCount() == 0;
    }

    /**
     * Pauses for up to {@code timeout}, returning early once stop is requested.
     *
     * @return true if the signal fired (the caller should exit its loop)
     */
    public boolean awaitStop(Duration timeout) {
        if (timeout.isZero() || timeout.isNegative()) {
            return isStopped();
        }
        try {
            return stopped.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return true;
        }
    }
}
