package com.skyfinal.vision;

import java.awt.image.BufferedImage;

/**
 * Grabs the pixels of one screen region. Hides the OS-level capture mechanism.
 */
@FunctionalInterface
public interface ScreenCapturer {

    BufferedImage captureRegion(CaptureRegion region);
}
