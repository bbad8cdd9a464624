package com.skyfinal.vision;

import java.awt.image.BufferedImage;
import java.time.Instant;

/**
 * A pre-processed composite ready for classification.
 *
 * The sequence number grows with every capture, so a consumer can tell how
 * many frames were skipped between two reads.
 */
public class Frame {

    private final BufferedImage image;
    private final long sequence;
    private final Instant capturedAt;

    public Frame(BufferedImage image, long sequence, Instant capturedAt) {
        this.image = image;
        this.sequence = sequence;
        this.capturedAt = capturedAt;
    }

    public BufferedImage getImage() {
        return image;
    }

    public long getSequence() {
        return sequence;
    }

    public Instant getCapturedAt() {
        return capturedAt;
    }

    @Override
    public String toString() {
        return "Frame{" +
                "sequence=" + sequence +
                ", size=" + image.getWidth() + "x" + image.getHeight() +
                ", capturedAt=" + capturedAt +
                '}';
    }
}
