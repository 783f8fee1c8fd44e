package com.project.image.carving.engine;

/**
 * Forward energy (Rubinstein, Shamir, Avidan: "Improved Seam Carving for Video Retargeting").
 *
 * <p>The cost of a pixel is the new luminance edge created between its neighbours if the pixel were
 * removed, picked along the cheapest of the three ways a seam can enter it from the row above.
 * Left and right neighbours wrap around the row; row 0 costs nothing.
 */
public final class EnergyMap {

    // BGR2GRAY weights 0.299, 0.587, 0.114 in 14-bit fixed point
    private static final int R2Y = 4899;
    private static final int G2Y = 9617;
    private static final int B2Y = 1868;
    private static final int GRAY_SHIFT = 14;

    public EnergyGrid computeForwardEnergy(PixelImage image) {
        final int w = image.width(), h = image.height();
        double[] gray = luminance(image);

        double[] energy = new double[w * h];
        double[] prevMin = new double[w];
        double[] curMin = new double[w];

        for (int y = 1; y < h; y++) {
            int row = y * w, above = (y - 1) * w;
            for (int x = 0; x < w; x++) {
                int left = x == 0 ? w - 1 : x - 1;
                int right = x == w - 1 ? 0 : x + 1;

                double l = gray[row + left];
                double r = gray[row + right];
                double u = gray[above + x];

                double cU = Math.abs(r - l);
                double cL = Math.abs(u - l) + cU;
                double cR = Math.abs(u - r) + cU;

                double mU = prevMin[x] + cU;
                double mL = prevMin[left] + cL;
                double mR = prevMin[right] + cR;

                // strict comparisons keep U, then L, then R on ties
                double best = mU, cost = cU;
                if (mL < best) { best = mL; cost = cL; }
                if (mR < best) { best = mR; cost = cR; }

                curMin[x] = best;
                energy[row + x] = cost;
            }
            double[] t = prevMin; prevMin = curMin; curMin = t;
        }
        return new EnergyGrid(w, h, energy);
    }

    /** 8-bit grey level per pixel; samples are truncated to 0..255 before weighting. */
    static double[] luminance(PixelImage image) {
        int n = image.width() * image.height();
        double[] samples = image.samples();
        double[] gray = new double[n];
        for (int i = 0; i < n; i++) {
            int r = toByte(samples[PixelImage.CHANNELS * i]);
            int g = toByte(samples[PixelImage.CHANNELS * i + 1]);
            int b = toByte(samples[PixelImage.CHANNELS * i + 2]);
            gray[i] = (r * R2Y + g * G2Y + b * B2Y + (1 << (GRAY_SHIFT - 1))) >> GRAY_SHIFT;
        }
        return gray;
    }

    private static int toByte(double v) {
        int i = (int) v;
        return i < 0 ? 0 : Math.min(255, i);
    }
}
