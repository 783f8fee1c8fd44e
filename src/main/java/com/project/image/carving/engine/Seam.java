package com.project.image.carving.engine;

import java.util.Arrays;

/**
 * One column index per row, top to bottom. Seams returned by {@link SeamFinder} are 8-connected:
 * consecutive rows differ by at most one column.
 */
public final class Seam {
    private final int[] columns;

    public Seam(int[] columns) {
        if (columns == null || columns.length == 0) {
            throw new IllegalArgumentException("Seam must cover at least one row");
        }
        this.columns = Arrays.copyOf(columns, columns.length);
    }

    public static Seam of(int... columns) {
        return new Seam(columns);
    }

    public int length() { return columns.length; }

    public int column(int row) { return columns[row]; }

    public int[] toArray() {
        return Arrays.copyOf(columns, columns.length);
    }

    /**
     * Checks the path against an image of the given width.
     *
     * @throws IllegalArgumentException if an index is out of range or the path is not 8-connected
     */
    public Seam validate(int width) {
        checkBounds(width);
        for (int y = 1; y < columns.length; y++) {
            if (Math.abs(columns[y] - columns[y - 1]) > 1) {
                throw new IllegalArgumentException("Seam jumps from " + columns[y - 1] + " to "
                        + columns[y] + " at row " + y);
            }
        }
        return this;
    }

    /**
     * Range check only. Seams shifted by batch index correction may lose 8-connectivity and are
     * still valid insertion positions.
     */
    public Seam checkBounds(int width) {
        for (int y = 0; y < columns.length; y++) {
            if (columns[y] < 0 || columns[y] >= width) {
                throw new IllegalArgumentException("Seam column " + columns[y] + " at row " + y
                        + " outside [0, " + (width - 1) + "]");
            }
        }
        return this;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof Seam other && Arrays.equals(columns, other.columns));
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(columns);
    }

    @Override
    public String toString() {
        return "Seam" + Arrays.toString(columns);
    }
}
