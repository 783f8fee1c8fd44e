package com.project.image.carving;

import com.project.image.carving.engine.PixelImage;

import java.util.Random;

/** Small fixture images shared by the engine tests. */
final class TestImages {

    private TestImages() {}

    static PixelImage gray(double[][] rows) {
        int h = rows.length, w = rows[0].length;
        double[] flat = new double[w * h];
        for (int y = 0; y < h; y++) {
            System.arraycopy(rows[y], 0, flat, y * w, w);
        }
        return PixelImage.fromGray(w, h, flat);
    }

    static PixelImage random(int w, int h, long seed) {
        Random rnd = new Random(seed);
        int[] rgb = new int[w * h];
        for (int i = 0; i < rgb.length; i++) {
            rgb[i] = rnd.nextInt(0x1000000);
        }
        return PixelImage.fromRgb(w, h, rgb);
    }

    static double[] row(PixelImage image, int y, int channel) {
        double[] out = new double[image.width()];
        for (int x = 0; x < out.length; x++) {
            out[x] = image.sample(x, y, channel);
        }
        return out;
    }
}
