package com.skyfinal.vision;

import com.skyfinal.MutableClock;
import com.skyfinal.lifecycle.StopSignal;

import org.junit.jupiter.api.*;

import java.awt.image.BufferedImage;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the capture loop:
 * - Frames land in the slot
 * - Overwritten frames are counted
 * - Capture failures do not end the loop
 */
@DisplayName("Frame Producer Tests")
class FrameProducerTest {

    private static final CaptureRegion KILLFEED = new CaptureRegion("killfeed", 40, 1240, 640, 260);
    private static final CaptureRegion ROUND_END = new CaptureRegion("round-end", 260, 350, 1220, 340);

    private LatestFrameSlot slot;
    private StopSignal stopSignal;
    private FrameComposer composer;

    @BeforeEach
    void setUp() {
        slot = new LatestFrameSlot();
        stopSignal = new StopSignal();
        composer = new FrameComposer(KILLFEED, ROUND_END, 0.5);
    }

    private FrameProducer producer(ScreenCapturer capturer) {
        return new FrameProducer(capturer, composer, KILLFEED, ROUND_END, slot,
                Duration.ofMillis(5), Duration.ofMillis(20), stopSignal,
                new MutableClock(Instant.parse("2024-05-01T12:00:00Z")));
    }

    private static BufferedImage blank(CaptureRegion region) {
        return new BufferedImage(region.getWidth(), region.getHeight(), BufferedImage.TYPE_INT_RGB);
    }

    @Test
    @DisplayName("Should publish a composed frame to the slot")
    void testCaptureOnce() {
        FrameProducer producer = producer(FrameProducerTest::blank);

        Frame frame = producer.captureOnce();

        assertSame(frame, slot.peek());
        assertEquals(1, frame.getSequence());
        assertEquals(composer.getFinalWidth(), frame.getImage().getWidth());
        assertEquals(composer.getFinalHeight(), frame.getImage().getHeight());
    }

    @Test
    @DisplayName("Should count frames overwritten before they were read")
    void testDroppedFrames() {
        FrameProducer producer = producer(FrameProducerTest::blank);

        producer.captureOnce();
        producer.captureOnce();
        producer.captureOnce();

        assertEquals(3, producer.getCapturedCount());
        assertEquals(2, producer.getDroppedCount());
        assertEquals(3, slot.poll().getSequence());
    }

    @Test
    @DisplayName("Should keep capturing after failures")
    void testLoopSurvivesFailures() throws Exception {
        AtomicInteger attempts = new AtomicInteger();
        ScreenCapturer flaky = region -> {
            if (attempts.incrementAndGet() <= 4) {
                throw new IllegalStateException("display unavailable");
            }
            return blank(region);
        };
        FrameProducer producer = producer(flaky);
        Thread thread = new Thread(producer, "producer-test");
        thread.start();

        Frame frame = slot.take(Duration.ofSeconds(5));
        stopSignal.stop();
        thread.join(2000);

        assertNotNull(frame, "A frame should arrive once capture recovers");
        assertFalse(thread.isAlive());
        assertTrue(attempts.get() > 4);
        System.out.println("✓ Capture recovered after " + (attempts.get() - 1) + " attempts");
    }
}
