package com.project.image.carving.engine;

import com.project.image.carving.exceptions.MalformedImageException;

import java.util.Arrays;

/**
 * Height x width grid of RGB samples kept as doubles, so repeated averaging during seam
 * insertion does not lose precision. Samples are stored row-major in a flat array:
 * {@code (y * width + x) * 3 + channel}.
 *
 * <p>Instances are never modified after construction; every seam operation returns a new image.
 */
public final class PixelImage {
    public static final int CHANNELS = 3;

    private final int width;
    private final int height;
    private final double[] samples;

    public PixelImage(int width, int height, double[] samples) {
        if (width < 1 || height < 1) {
            throw new MalformedImageException("Image must be at least 1x1, got " + width + "x" + height);
        }
        if (samples == null || samples.length != width * height * CHANNELS) {
            throw new MalformedImageException("Expected " + (width * height * CHANNELS) + " samples for "
                    + width + "x" + height + "x" + CHANNELS + ", got "
                    + (samples == null ? "null" : String.valueOf(samples.length)));
        }
        this.width = width;
        this.height = height;
        this.samples = samples;
    }

    /** Builds an image from packed 0xRRGGBB values, one per pixel, row-major. */
    public static PixelImage fromRgb(int width, int height, int[] rgb) {
        if (rgb == null || rgb.length != width * height) {
            throw new MalformedImageException("Expected " + (width * height) + " pixels");
        }
        double[] samples = new double[rgb.length * CHANNELS];
        for (int i = 0; i < rgb.length; i++) {
            int p = rgb[i];
            samples[CHANNELS * i] = (p >> 16) & 0xFF;
            samples[CHANNELS * i + 1] = (p >> 8) & 0xFF;
            samples[CHANNELS * i + 2] = p & 0xFF;
        }
        return new PixelImage(width, height, samples);
    }

    /** Grey image where every channel of a pixel holds the same value. */
    public static PixelImage fromGray(int width, int height, double[] gray) {
        if (gray == null || gray.length != width * height) {
            throw new MalformedImageException("Expected " + (width * height) + " pixels");
        }
        double[] samples = new double[gray.length * CHANNELS];
        for (int i = 0; i < gray.length; i++) {
            Arrays.fill(samples, CHANNELS * i, CHANNELS * i + CHANNELS, gray[i]);
        }
        return new PixelImage(width, height, samples);
    }

    public int width() { return width; }

    public int height() { return height; }

    public double sample(int x, int y, int channel) {
        return samples[offset(x, y) + channel];
    }

    int offset(int x, int y) {
        return (y * width + x) * CHANNELS;
    }

    /** Package-level access for the carving operators; callers must not mutate it. */
    double[] samples() { return samples; }

    /** Defensive copy of the raw samples. */
    public double[] toArray() {
        return Arrays.copyOf(samples, samples.length);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PixelImage other)) return false;
        return width == other.width && height == other.height && Arrays.equals(samples, other.samples);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * width + height) + Arrays.hashCode(samples);
    }

    @Override
    public String toString() {
        return "PixelImage[" + width + "x" + height + "]";
    }
}
