package com.skyfinal.vision;

import java.io.IOException;

/**
 * Single-label image classification service. Hides the remote protocol.
 */
@FunctionalInterface
public interface ImageClassifier {

    /**
     * Classifies one JPEG-encoded image.
     *
     * @return the raw answer text; interpretation is up to the caller
     * @throws IOException on transport failure, timeout or an error status
     */
    String classify(byte[] jpeg) throws IOException, InterruptedException;
}
