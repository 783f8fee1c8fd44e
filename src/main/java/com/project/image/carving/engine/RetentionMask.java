package com.project.image.carving.engine;

import java.util.Arrays;

/**
 * Marks which pixels survive a seam removal: {@code false} for the seam pixel, {@code true} elsewhere.
 */
public final class RetentionMask {
    private final int width;
    private final int height;
    private final boolean[] keep;

    public RetentionMask(int width, int height, boolean[] keep) {
        if (keep == null || keep.length != width * height) {
            throw new IllegalArgumentException("Mask data does not match " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
        this.keep = Arrays.copyOf(keep, keep.length);
    }

    /** Mask with exactly the seam's pixels dropped. */
    public static RetentionMask forSeam(Seam seam, int width) {
        seam.validate(width);
        boolean[] keep = new boolean[width * seam.length()];
        Arrays.fill(keep, true);
        for (int y = 0; y < seam.length(); y++) {
            keep[y * width + seam.column(y)] = false;
        }
        return new RetentionMask(width, seam.length(), keep);
    }

    public int width() { return width; }

    public int height() { return height; }

    public boolean isKept(int x, int y) {
        return keep[y * width + x];
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof RetentionMask other
                && width == other.width && height == other.height && Arrays.equals(keep, other.keep));
    }

    @Override
    public int hashCode() {
        return 31 * (31 * width + height) + Arrays.hashCode(keep);
    }
}
