package com.skyfinal.vision;

import java.time.Duration;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Single-slot, latest-wins frame buffer between the capture and the
 * classification threads.
 *
 * The producer never blocks: offering a frame while one is still waiting
 * discards the stale one. Consumers either peek (non-destructive) or take
 * (destructive, optionally waiting a bounded time for the next frame), so
 * they only ever see the most recent frame and never a backlog.
 */
public class LatestFrameSlot {

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition filled = lock.newCondition();

    private Frame frame;

    /**
     * Stores a frame, replacing any unconsumed one.
     *
     * @return the discarded stale frame, or null if the slot was empty
     */
    public Frame offer(Frame newFrame) {
        lock.lock();
        try {
            Frame stale = frame;
            frame = newFrame;
            filled.signalAll();
            return stale;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes and returns the buffered frame without waiting.
     */
    public Frame poll() {
        lock.lock();
        try {
            Frame current = frame;
            frame = null;
            return current;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes and returns the buffered frame, waiting up to {@code timeout}
     * for one to arrive.
     *
     * @return the frame, or null if none arrived in time
     */
    public Frame take(Duration timeout) throws InterruptedException {
        long remaining = timeout.toNanos();
        lock.lock();
        try {
            while (frame == null) {
                if (remaining <= 0) {
                    return null;
                }
                remaining = filled.awaitNanos(remaining);
            }
            Frame current = frame;
            frame = null;
            return current;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the buffered frame without consuming it.
     */
    public Frame peek() {
        lock.lock();
        try {
            return frame;
        } finally {
            lock.unlock();
        }
    }

    public boolean isEmpty() {
        return peek() == null;
    }
}
