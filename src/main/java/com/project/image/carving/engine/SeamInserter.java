package com.project.image.carving.engine;

import com.project.image.carving.exceptions.CarvingException;
import com.project.image.carving.exceptions.CarvingPreconditionException;

/**
 * Widens an image by duplicating its cheapest seams.
 *
 * <p>The seams are found by simulating removal on a scratch copy, so that a batch of insertions
 * spreads over different low-energy paths instead of stretching the same one {@code count} times.
 * They are then applied to the original image in the order they were found.
 */
public final class SeamInserter {
    private final SeamFinder finder;
    private final SeamRemover remover;

    public SeamInserter() {
        this(new SeamFinder(), new SeamRemover());
    }

    public SeamInserter(SeamFinder finder, SeamRemover remover) {
        this.finder = finder;
        this.remover = remover;
    }

    public PixelImage insertSeams(PixelImage image, int count) {
        if (count < 1) {
            throw new CarvingPreconditionException("Seam count must be at least 1, got " + count);
        }
        if (count > image.width()) {
            throw new CarvingPreconditionException("Cannot insert " + count + " seams into an image "
                    + image.width() + " pixels wide");
        }

        SeamBatch batch = discoverSeams(image, count);

        PixelImage output = image;
        while (!batch.isEmpty()) {
            Seam seam = batch.pollFirst();
            output = insertSeam(output, seam);
            batch.shiftAfterCommit(seam);
        }
        return output;
    }

    /**
     * Runs {@code count} removals on a scratch copy and records each seam as it was found, in the
     * coordinates of the copy at that moment. These are also exactly the seams a removal of
     * {@code count} columns would take out.
     */
    public SeamBatch discoverSeams(PixelImage image, int count) {
        SeamBatch batch = new SeamBatch();
        PixelImage working = image;
        for (int i = 0; i < count; i++) {
            if (Thread.currentThread().isInterrupted()) {
                throw new CarvingException("Seam discovery interrupted after " + i + " of " + count + " seams");
            }
            SeamSearchResult found = finder.findMinimumSeam(working);
            batch.add(found.seam());
            // the scratch copy is thrown away, so the last removal is not needed
            if (i < count - 1) {
                working = remover.removeSeam(working, found.mask());
            }
        }
        return batch;
    }

    /**
     * Inserts one synthesized column along {@code seam}. In each row the new pixel is the average
     * of the seam pixel and its left neighbour, placed before the seam pixel; in column 0 it is the
     * average with the right neighbour, placed after it.
     */
    public PixelImage insertSeam(PixelImage image, Seam seam) {
        final int w = image.width(), h = image.height(), c = PixelImage.CHANNELS;
        if (seam.length() != h) {
            throw new IllegalArgumentException("Seam covers " + seam.length() + " rows, image has " + h);
        }
        seam.checkBounds(w);

        double[] src = image.samples();
        double[] out = new double[(w + 1) * h * c];
        for (int y = 0; y < h; y++) {
            int col = seam.column(y);
            int srcRow = y * w * c;
            int dstRow = y * (w + 1) * c;

            int newAt, a, b;
            if (col == 0) {
                newAt = 1;
                a = 0;
                b = Math.min(1, w - 1);
            } else {
                newAt = col;
                a = col - 1;
                b = col;
            }

            System.arraycopy(src, srcRow, out, dstRow, newAt * c);
            for (int ch = 0; ch < c; ch++) {
                out[dstRow + newAt * c + ch] = (src[srcRow + a * c + ch] + src[srcRow + b * c + ch]) / 2.0;
            }
            System.arraycopy(src, srcRow + newAt * c, out, dstRow + (newAt + 1) * c, (w - newAt) * c);
        }
        return new PixelImage(w + 1, h, out);
    }
}
