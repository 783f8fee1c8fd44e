package com.project.image.carving.service;

import java.awt.image.BufferedImage;

/**
 * Derives how many columns to add (positive) or remove (negative) from a source image by comparing
 * it with a second image. Plugged into the controller so carving works without any particular
 * estimator.
 */
@FunctionalInterface
public interface WidthDeltaEstimator {
    int estimate(BufferedImage source, BufferedImage reference);
}
