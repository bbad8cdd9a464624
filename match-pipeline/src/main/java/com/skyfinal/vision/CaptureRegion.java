package com.skyfinal.vision;

import java.awt.Rectangle;

/**
 * A fixed rectangle of the screen, in absolute pixel coordinates.
 */
public class CaptureRegion {

    private final String name;
    private final int top;
    private final int left;
    private final int width;
    private final int height;

    public CaptureRegion(String name, int top, int left, int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Region " + name + " must have a positive size, got "
                    + width + "x" + height);
        }
        this.name = name;
        this.top = top;
        this.left = left;
        this.width = width;
        this.height = height;
    }

    public String getName() {
        return name;
    }

    public int getTop() {
        return top;
    }

    public int getLeft() {
        return left;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public Rectangle toRectangle() {
        return new Rectangle(left, top, width, height);
    }

    @Override
    public String toString() {
        return "CaptureRegion{" +
                "name='" + name + '\'' +
                ", top=" + top +
                ", left=" + left +
                ", width=" + width +
                ", height=" + height +
                '}';
    }
}
