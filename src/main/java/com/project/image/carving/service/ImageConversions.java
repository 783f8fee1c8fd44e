package com.project.image.carving.service;

import com.project.image.carving.engine.PixelImage;
import com.project.image.carving.exceptions.CarvingException;
import com.project.image.carving.exceptions.MalformedImageException;

import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import javax.imageio.ImageIO;

/**
 * Moves pixels between decoded {@link BufferedImage}s and the carving engine's {@link PixelImage}.
 * This is where image shape is checked; the engine itself assumes a valid 3-channel grid.
 */
public final class ImageConversions {

    private ImageConversions() {}

    public static PixelImage toPixelImage(BufferedImage input) {
        if (input == null) {
            throw new MalformedImageException("No image data");
        }
        final int w = input.getWidth(), h = input.getHeight();
        if (w < 1 || h < 1) {
            throw new MalformedImageException("Image has no pixels: " + w + "x" + h);
        }
        int[] argb = new int[w * h];
        input.getRGB(0, 0, w, h, argb, 0, w);
        return PixelImage.fromRgb(w, h, argb);
    }

    /** Rounds and clamps every sample to 0..255. */
    public static BufferedImage toBufferedImage(PixelImage image) {
        final int w = image.width(), h = image.height();
        BufferedImage out = new BufferedImage(w, h, BufferedImage.TYPE_INT_RGB);
        int[] rgb = new int[w * h];
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                int r = clamp(image.sample(x, y, 0));
                int g = clamp(image.sample(x, y, 1));
                int b = clamp(image.sample(x, y, 2));
                rgb[y * w + x] = (r << 16) | (g << 8) | b;
            }
        }
        out.setRGB(0, 0, w, h, rgb, 0, w);
        return out;
    }

    public static byte[] toPng(BufferedImage img) {
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream()) {
            ImageIO.write(img, "png", baos);
            return baos.toByteArray();
        } catch (Exception e) {
            throw new CarvingException("Failed to encode image", e);
        }
    }

    private static int clamp(double v) {
        long rounded = Math.round(v);
        return (int) (rounded < 0 ? 0 : Math.min(255, rounded));
    }
}
