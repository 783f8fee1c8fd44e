package com.project.image.carving.engine;

import java.util.Arrays;

/**
 * Per-pixel forward-energy costs, row-major, same dimensions as the image they were computed from.
 */
public final class EnergyGrid {
    private final int width;
    private final int height;
    private final double[] values;

    EnergyGrid(int width, int height, double[] values) {
        this.width = width;
        this.height = height;
        this.values = values;
    }

    public int width() { return width; }

    public int height() { return height; }

    public double get(int x, int y) {
        return values[y * width + x];
    }

    /** Copy of one row. */
    public double[] row(int y) {
        return Arrays.copyOfRange(values, y * width, (y + 1) * width);
    }

    double[] values() { return values; }
}
