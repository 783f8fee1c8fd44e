package com.project.image.carving.engine;

import com.project.image.carving.exceptions.InvalidMaskException;

/** Drops the one masked-out pixel of every row, shrinking the image by a column. */
public final class SeamRemover {

    public PixelImage removeSeam(PixelImage image, RetentionMask mask) {
        final int w = image.width(), h = image.height();
        if (mask.width() != w || mask.height() != h) {
            throw new InvalidMaskException("Mask is " + mask.width() + "x" + mask.height()
                    + " but image is " + w + "x" + h);
        }
        if (w == 1) {
            throw new InvalidMaskException("Cannot remove the only column of the image");
        }

        final int c = PixelImage.CHANNELS;
        double[] src = image.samples();
        double[] out = new double[(w - 1) * h * c];
        int o = 0;
        for (int y = 0; y < h; y++) {
            int seamX = droppedColumn(mask, y);
            for (int x = 0; x < w; x++) {
                if (x == seamX) continue;
                System.arraycopy(src, image.offset(x, y), out, o, c);
                o += c;
            }
        }
        return new PixelImage(w - 1, h, out);
    }

    private static int droppedColumn(RetentionMask mask, int y) {
        int found = -1, count = 0;
        for (int x = 0; x < mask.width(); x++) {
            if (!mask.isKept(x, y)) {
                found = x;
                count++;
            }
        }
        if (count != 1) {
            throw new InvalidMaskException("Row " + y + " marks " + count + " pixels for removal, expected 1");
        }
        return found;
    }
}
