package com.skyfinal.vision;

import java.awt.AWTException;
import java.awt.Robot;
import java.awt.image.BufferedImage;

/**
 * Captures screen regions through {@link Robot}. Needs a display; fails at
 * construction in a headless environment.
 */
public class RobotScreenCapturer implements ScreenCapturer {

    private final Robot robot;

    public RobotScreenCapturer() throws AWTException {
        this.robot = new Robot();
    }

    @Override
    public BufferedImage captureRegion(CaptureRegion region) {
        return robot.createScreenCapture(region.toRectangle());
    }
}
