package com.skyfinal.vision;

import com.skyfinal.lifecycle.StopSignal;
import com.skyfinal.sink.EventSink;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Classification loop of the visual channel.
 *
 * On its own cadence it takes the latest frame, sends it to the image
 * classifier and surfaces the result. Actionable labels (KILL, DEATH,
 * ROUND_END) are debounced per label: one is surfaced only when more than
 * the cooldown has passed since that same label was last surfaced.
 * NO_EVENT and errors always surface so operators can see the channel is
 * alive.
 *
 * The debounce map is touched only by the classification thread.
 * {@link #analyze(BufferedImage)} serves ad-hoc callers and bypasses it.
 */
public class FrameClassifier implements Runnable {

    private static final Logger logger = LoggerFactory.getLogger(FrameClassifier.class);

    private final LatestFrameSlot slot;
    private final FrameComposer composer;
    private final JpegEncoder encoder;
    private final ImageClassifier classifier;
    private final EventSink sink;
    private final Duration period;
    private final Duration cooldown;
    private final Duration frameWait;
    private final StopSignal stopSignal;
    private final Clock clock;

    private final Map<VisualLabel, Instant> lastSurfaced = new EnumMap<>(VisualLabel.class);

    public FrameClassifier(LatestFrameSlot slot, FrameComposer composer, JpegEncoder encoder,
                           ImageClassifier classifier, EventSink sink,
                           Duration period, Duration cooldown, Duration frameWait,
                           StopSignal stopSignal, Clock clock) {
        this.slot = slot;
        this.composer = composer;
        this.encoder = encoder;
        this.classifier = classifier;
        this.sink = sink;
        this.period = period;
        this.cooldown = cooldown;
        this.frameWait = frameWait;
        this.stopSignal = stopSignal;
        this.clock = clock;
    }

    @Override
    public void run() {
        logger.info("Frame classification started every {} (cooldown {})", period, cooldown);

        while (!stopSignal.isStopped()) {
            long start = System.nanoTime();
            try {
                classifyNext();
            } catch (RuntimeException e) {
                logger.error("Frame classification tick failed", e);
            }

            Duration remaining = period.minusNanos(System.nanoTime() - start);
            if (stopSignal.awaitStop(remaining)) {
                break;
            }
        }

        logger.info("Frame classification stopped");
    }

    /**
     * Waits briefly for the latest frame and classifies it. No frame in time
     * means no event this tick.
     */
    public Optional<VisualEvent> classifyNext() {
        Frame frame;
        try {
            frame = slot.take(frameWait);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        }
        if (frame == null || stopSignal.isStopped()) {
            return Optional.empty();
        }
        return classifyFrame(frame);
    }

    /**
     * Classifies one frame and applies the debounce policy.
     *
     * @return the event if it was surfaced, empty if it was debounced
     */
    public Optional<VisualEvent> classifyFrame(Frame frame) {
        VisualEvent event = classify(frame.getImage());
        if (!shouldSurface(event)) {
            logger.debug("Debounced {}", event.getLabel());
            return Optional.empty();
        }

        if (event.getLabel().isActionable()) {
            logger.info("Detected {}", event.getLabel());
        } else if (event.isError()) {
            logger.warn("{}", event.describe());
        } else {
            logger.debug("{}", event.describe());
        }
        try {
            sink.onVisualEvent(event);
        } catch (RuntimeException e) {
            logger.warn("Event sink rejected {}: {}", event.getLabel(), e.toString());
        }
        return Optional.of(event);
    }

    private boolean shouldSurface(VisualEvent event) {
        VisualLabel label = event.getLabel();
        if (!label.isActionable()) {
            return true;
        }
        Instant last = lastSurfaced.get(label);
        if (last != null && Duration.between(last, event.getTimestamp()).compareTo(cooldown) <= 0) {
            return false;
        }
        lastSurfaced.put(label, event.getTimestamp());
        return true;
    }

    /**
     * Classifies a frame on demand, outside the loop's cadence and debounce.
     *
     * With a full screenshot, the capture regions are cropped out of it and
     * composed like a captured frame. Without one, the latest buffered frame
     * is consumed; an empty buffer reads as NO_EVENT.
     *
     * @param screenshot full-screen image, or null to use the buffer
     */
    public VisualEvent analyze(BufferedImage screenshot) {
        BufferedImage image;
        if (screenshot != null) {
            image = composer.composeFromScreenshot(screenshot);
        } else {
            Frame frame = slot.poll();
            if (frame == null) {
                return VisualEvent.of(VisualLabel.NO_EVENT, clock.instant());
            }
            image = frame.getImage();
        }
        return classify(image);
    }

    private VisualEvent classify(BufferedImage image) {
        try {
            String raw = classifier.classify(encoder.encode(image));
            return VisualEvent.of(VisualLabel.parse(raw), clock.instant());
        } catch (IOException | RuntimeException e) {
            return VisualEvent.error(String.valueOf(e.getMessage()), clock.instant());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return VisualEvent.error("interrupted", clock.instant());
        }
    }
}
