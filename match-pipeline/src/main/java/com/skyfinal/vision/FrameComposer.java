package com.skyfinal.vision;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;

/**
 * Stitches the kill-feed and round-end regions into one small composite.
 *
 * The kill feed is stretched to the round-end region's width with
 * nearest-neighbour sampling (cheap, and it runs every capture), stacked
 * under the round-end region, and the result is downscaled with area
 * averaging, which keeps thin UI text legible. All target sizes are computed
 * once up front.
 */
public class FrameComposer {

    private static final Logger logger = LoggerFactory.getLogger(FrameComposer.class);

    private final CaptureRegion killfeedRegion;
    private final CaptureRegion roundEndRegion;
    private final int targetWidth;
    private final int killfeedTargetHeight;
    private final int finalWidth;
    private final int finalHeight;

    public FrameComposer(CaptureRegion killfeedRegion, CaptureRegion roundEndRegion, double scaleFactor) {
        this.killfeedRegion = killfeedRegion;
        this.roundEndRegion = roundEndRegion;
        this.targetWidth = roundEndRegion.getWidth();

        double killfeedScale = (double) targetWidth / killfeedRegion.getWidth();
        this.killfeedTargetHeight = Math.max(1, (int) (killfeedRegion.getHeight() * killfeedScale));

        this.finalWidth = Math.max(1, (int) (targetWidth * scaleFactor));
        this.finalHeight = Math.max(1, (int) ((roundEndRegion.getHeight() + killfeedTargetHeight) * scaleFactor));
    }

    /**
     * Builds the composite from two freshly captured regions.
     */
    public BufferedImage compose(BufferedImage killfeed, BufferedImage roundEnd) {
        BufferedImage killfeedResized = resizeNearest(killfeed, targetWidth, killfeedTargetHeight);

        BufferedImage stacked = new BufferedImage(targetWidth,
                roundEnd.getHeight() + killfeedResized.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = stacked.createGraphics();
        try {
            g.drawImage(roundEnd, 0, 0, targetWidth, roundEnd.getHeight(), null);
            g.drawImage(killfeedResized, 0, roundEnd.getHeight(), null);
        } finally {
            g.dispose();
        }

        return resizeArea(stacked, finalWidth, finalHeight);
    }

    /**
     * Builds the composite from a full screenshot by cropping both regions out
     * of it. When the screenshot does not contain the regions, the whole image
     * is downscaled instead.
     */
    public BufferedImage composeFromScreenshot(BufferedImage screenshot) {
        if (contains(screenshot, killfeedRegion) && contains(screenshot, roundEndRegion)) {
            return compose(crop(screenshot, killfeedRegion), crop(screenshot, roundEndRegion));
        }
        logger.debug("Screenshot {}x{} does not cover the capture regions, downscaling it whole",
                screenshot.getWidth(), screenshot.getHeight());
        return resizeArea(screenshot, finalWidth, finalHeight);
    }

    private static boolean contains(BufferedImage image, CaptureRegion region) {
        return region.getLeft() >= 0 && region.getTop() >= 0
                && region.getLeft() + region.getWidth() <= image.getWidth()
                && region.getTop() + region.getHeight() <= image.getHeight();
    }

    private static BufferedImage crop(BufferedImage image, CaptureRegion region) {
        return image.getSubimage(region.getLeft(), region.getTop(), region.getWidth(), region.getHeight());
    }

    static BufferedImage resizeNearest(BufferedImage source, int width, int height) {
        BufferedImage out = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = out.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_NEAREST_NEIGHBOR);
            g.drawImage(source, 0, 0, width, height, null);
        } finally {
            g.dispose();
        }
        return out;
    }

    /**
     * Downscales by averaging every source pixel that a destination pixel
     * covers, weighted by the covered fraction.
     */
    static BufferedImage resizeArea(BufferedImage source, int width, int height) {
        int srcW = source.getWidth();
        int srcH = source.getHeight();
        int[] src = source.getRGB(0, 0, srcW, srcH, null, 0, srcW);
        int[] dst = new int[width * height];

        double scaleX = (double) srcW / width;
        double scaleY = (double) srcH / height;

        for (int dy = 0; dy < height; dy++) {
            double y0 = dy * scaleY;
            double y1 = Math.min(srcH, y0 + scaleY);
            for (int dx = 0; dx < width; dx++) {
                double x0 = dx * scaleX;
                double x1 = Math.min(srcW, x0 + scaleX);

                double r = 0;
                double gr = 0;
                double b = 0;
                double total = 0;
                for (int sy = (int) y0; sy < Math.ceil(y1); sy++) {
                    double wy = Math.min(y1, sy + 1) - Math.max(y0, sy);
                    for (int sx = (int) x0; sx < Math.ceil(x1); sx++) {
                        double w = wy * (Math.min(x1, sx + 1) - Math.max(x0, sx));
                        int rgb = src[sy * srcW + sx];
                        r += ((rgb >> 16) & 0xFF) * w;
                        gr += ((rgb >> 8) & 0xFF) * w;
                        b += (rgb & 0xFF) * w;
                        total += w;
                    }
                }

                dst[dy * width + dx] = total > 0
                        ? (channel(r / total) << 16) | (channel(gr / total) << 8) | channel(b / total)
                        : 0;
            }
        }

        BufferedImage out = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        out.setRGB(0, 0, width, height, dst, 0, width);
        return out;
    }

    private static int channel(double value) {
        return Math.min(255, Math.max(0, (int) Math.round(value)));
    }

    public int getFinalWidth() {
        return finalWidth;
    }

    public int getFinalHeight() {
        return finalHeight;
    }

    public int getKillfeedTargetHeight() {
        return killfeedTargetHeight;
    }
}
