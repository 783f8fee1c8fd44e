package com.project.image.carving.config;

import java.awt.Color;

/**
 * Tunables for one resize request. Built once from application properties and handed to the
 * carving service on every call.
 *
 * @param downsize      shrink wide images before carving to bound running time
 * @param maxWidth      width the image is shrunk to when {@code downsize} is on
 * @param seamColor     highlight used by the seam preview
 */
public record CarvingOptions(boolean downsize, int maxWidth, Color seamColor) {

    public CarvingOptions {
        if (maxWidth < 1) {
            throw new IllegalArgumentException("maxWidth must be positive, got " + maxWidth);
        }
        if (seamColor == null) {
            throw new IllegalArgumentException("seamColor is required");
        }
    }

    public static CarvingOptions defaults() {
        return new CarvingOptions(true, 500, new Color(200, 200, 255));
    }

    public CarvingOptions withDownsize(boolean enabled) {
        return new CarvingOptions(enabled, maxWidth, seamColor);
    }
}
