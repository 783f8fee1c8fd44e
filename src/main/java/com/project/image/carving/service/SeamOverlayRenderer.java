package com.project.image.carving.service;

import com.project.image.carving.engine.PixelImage;
import com.project.image.carving.engine.Seam;
import com.project.image.carving.engine.SeamBatch;
import com.project.image.carving.engine.SeamInserter;
import com.project.image.carving.exceptions.CarvingPreconditionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.awt.Color;
import java.awt.image.BufferedImage;

/**
 * Paints the seams a carve would touch onto the image, so the user can see which paths are
 * considered low-importance.
 */
@Service
public class SeamOverlayRenderer {
    private static final Logger log = LoggerFactory.getLogger(SeamOverlayRenderer.class);

    private final SeamInserter inserter;

    public SeamOverlayRenderer() {
        this(new SeamInserter());
    }

    SeamOverlayRenderer(SeamInserter inserter) {
        this.inserter = inserter;
    }

    public BufferedImage render(PixelImage image, int seamCount, Color highlight) {
        final int w = image.width(), h = image.height();
        if (seamCount < 1 || seamCount > w) {
            throw new CarvingPreconditionException("Seam preview needs 1.." + w + " seams, got " + seamCount);
        }

        SeamBatch batch = inserter.discoverSeams(image, seamCount);
        boolean[] marked = markInOriginalColumns(batch, w, h);

        BufferedImage overlay = ImageConversions.toBufferedImage(image);
        int highlightRGB = highlight.getRGB() & 0xFFFFFF;
        int count = 0;
        for (int i = 0; i < marked.length; i++) {
            if (marked[i]) {
                overlay.setRGB(i % w, i / w, highlightRGB);
                count++;
            }
        }
        log.debug("Seam preview: {} seams, {} pixels highlighted", seamCount, count);
        return overlay;
    }

    /**
     * Each seam is expressed in the columns left over after the seams before it were removed, so
     * every row keeps the list of original columns still present and takes the seam's entry out.
     */
    static boolean[] markInOriginalColumns(SeamBatch batch, int w, int h) {
        int[][] remaining = new int[h][w];
        int[] rowWidth = new int[h];
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) remaining[y][x] = x;
            rowWidth[y] = w;
        }

        boolean[] marked = new boolean[w * h];
        Seam seam;
        while ((seam = batch.pollFirst()) != null) {
            for (int y = 0; y < h; y++) {
                int at = seam.column(y);
                marked[y * w + remaining[y][at]] = true;
                System.arraycopy(remaining[y], at + 1, remaining[y], at, rowWidth[y] - at - 1);
                rowWidth[y]--;
            }
        }
        return marked;
    }
}
