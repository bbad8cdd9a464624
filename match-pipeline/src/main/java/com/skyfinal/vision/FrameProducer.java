package com.skyfinal.vision;

import com.skyfinal.lifecycle.StopSignal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Capture loop of the visual channel.
 *
 * Runs on its own thread, throttled only by a small fixed delay, and is
 * never paced by classification. Every cycle captures both regions,
 * composes them and overwrites the latest-frame slot. A failing cycle is
 * logged and followed by a longer pause; the loop itself keeps going until
 * the stop signal fires.
 */
public class FrameProducer implements Runnable {

    private static final Logger logger = LoggerFactory.getLogger(FrameProducer.class);

    private final ScreenCapturer capturer;
    private final FrameComposer composer;
    private final CaptureRegion killfeedRegion;
    private final CaptureRegion roundEndRegion;
    private final LatestFrameSlot slot;
    private final Duration captureDelay;
    private final Duration errorPause;
    private final StopSignal stopSignal;
    private final Clock clock;

    private final AtomicLong sequence = new AtomicLong();
    private final AtomicLong droppedFrames = new AtomicLong();

    public FrameProducer(ScreenCapturer capturer, FrameComposer composer,
                         CaptureRegion killfeedRegion, CaptureRegion roundEndRegion,
                         LatestFrameSlot slot, Duration captureDelay, Duration errorPause,
                         StopSignal stopSignal, Clock clock) {
        this.capturer = capturer;
        this.composer = composer;
        this.killfeedRegion = killfeedRegion;
        this.roundEndRegion = roundEndRegion;
        this.slot = slot;
        this.captureDelay = captureDelay;
        this.errorPause = errorPause;
        this.stopSignal = stopSignal;
        this.clock = clock;
    }

    @Override
    public void run() {
        logger.info("Frame capture started ({} + {})", killfeedRegion.getName(), roundEndRegion.getName());

        while (!stopSignal.isStopped()) {
            Duration pause = captureDelay;
            try {
                captureOnce();
            } catch (RuntimeException e) {
                logger.warn("Frame capture failed: {}", e.toString());
                pause = errorPause;
            }
            if (stopSignal.awaitStop(pause)) {
                break;
            }
        }

        logger.info("Frame capture stopped after {} frames ({} dropped)", sequence.get(), droppedFrames.get());
    }

    /**
     * Captures, composes and publishes one frame.
     */
    public Frame captureOnce() {
        BufferedImage killfeed = capturer.captureRegion(killfeedRegion);
        BufferedImage roundEnd = capturer.captureRegion(roundEndRegion);
        BufferedImage composite = composer.compose(killfeed, roundEnd);

        Frame frame = new Frame(composite, sequence.incrementAndGet(), clock.instant());
        if (slot.offer(frame) != null) {
            droppedFrames.incrementAndGet();
        }
        return frame;
    }

    public long getCapturedCount() {
        return sequence.get();
    }

    /**
     * Frames overwritten before any consumer read them.
     */
    public long getDroppedCount() {
        return droppedFrames.get();
    }
}
