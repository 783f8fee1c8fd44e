package com.project.image.carving.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.awt.image.BufferedImage;

/**
 * Matches the source to the reference's aspect ratio: the reference is scaled to the source's
 * height and the width difference becomes the delta. The result is clamped so the source keeps at
 * least one column and never more than doubles.
 */
@Service
public class ReferenceWidthDeltaEstimator implements WidthDeltaEstimator {
    private static final Logger log = LoggerFactory.getLogger(ReferenceWidthDeltaEstimator.class);

    @Override
    public int estimate(BufferedImage source, BufferedImage reference) {
        if (source == null || reference == null) {
            throw new IllegalArgumentException("Both a source and a reference image are required");
        }
        int w = source.getWidth(), h = source.getHeight();
        long targetWidth = Math.round((double) reference.getWidth() * h / reference.getHeight());
        long dx = targetWidth - w;

        int clamped = (int) Math.max(1 - w, Math.min(w, dx));
        log.debug("Reference {}x{} -> target width {} for {}x{} source, dx={}",
                reference.getWidth(), reference.getHeight(), targetWidth, w, h, clamped);
        return clamped;
    }
}
