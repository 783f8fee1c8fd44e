package com.project.image.carving.engine;

import java.util.Arrays;

/**
 * Finds the vertical seam of least cumulative forward energy.
 *
 * <p>Unlike {@link EnergyMap}, the accumulation here clamps at the row edges: column 0 only looks at
 * columns 0 and 1 above it, the last column only at the last two. Ties go to the lowest column.
 */
public final class SeamFinder {
    private final EnergyMap energyMap;

    public SeamFinder() {
        this(new EnergyMap());
    }

    public SeamFinder(EnergyMap energyMap) {
        this.energyMap = energyMap;
    }

    public SeamSearchResult findMinimumSeam(PixelImage image) {
        final int w = image.width(), h = image.height();
        double[] cost = energyMap.computeForwardEnergy(image).values().clone();
        int[] backtrack = new int[w * h];

        for (int y = 1; y < h; y++) {
            int row = y * w, above = (y - 1) * w;
            for (int x = 0; x < w; x++) {
                int from = Math.max(0, x - 1);
                int to = Math.min(w - 1, x + 1);
                int best = from;
                for (int k = from + 1; k <= to; k++) {
                    if (cost[above + k] < cost[above + best]) {
                        best = k;
                    }
                }
                backtrack[row + x] = best;
                cost[row + x] += cost[above + best];
            }
        }

        int last = (h - 1) * w;
        int x = 0;
        for (int k = 1; k < w; k++) {
            if (cost[last + k] < cost[last + x]) {
                x = k;
            }
        }

        int[] columns = new int[h];
        boolean[] keep = new boolean[w * h];
        Arrays.fill(keep, true);
        for (int y = h - 1; y >= 0; y--) {
            columns[y] = x;
            keep[y * w + x] = false;
            x = backtrack[y * w + x];
        }
        return new SeamSearchResult(new Seam(columns), new RetentionMask(w, h, keep));
    }
}
