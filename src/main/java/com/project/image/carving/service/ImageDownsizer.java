package com.project.image.carving.service;

import com.project.image.carving.exceptions.CarvingException;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.awt.image.DataBufferByte;

/**
 * Pre-carve policy: shrinks images wider than the configured width, keeping the aspect ratio.
 * Carving cost grows with width times the number of seams, so large uploads are brought down first.
 */
@Service
public class ImageDownsizer {
    private static final Logger log = LoggerFactory.getLogger(ImageDownsizer.class);

    private static final boolean OPENCV_AVAILABLE;

    static {
        boolean loaded = false;
        try {
            nu.pattern.OpenCV.loadLocally();
            loaded = true;
            log.info("OpenCV loaded successfully");
        } catch (Exception | LinkageError e) {
            log.error("Failed to load OpenCV, falling back to Java2D scaling", e);
        }
        OPENCV_AVAILABLE = loaded;
    }

    /**
     * Returns {@code input} itself when it is already narrow enough.
     */
    public BufferedImage downsize(BufferedImage input, int maxWidth) {
        final int w = input.getWidth(), h = input.getHeight();
        if (w <= maxWidth) {
            return input;
        }
        int targetHeight = Math.max(1, (int) (h * maxWidth / (double) w));
        log.debug("Downsizing {}x{} to {}x{}", w, h, maxWidth, targetHeight);

        return OPENCV_AVAILABLE
                ? resizeWithOpenCV(input, maxWidth, targetHeight)
                : resizeWithJava2D(input, maxWidth, targetHeight);
    }

    private BufferedImage resizeWithOpenCV(BufferedImage input, int width, int height) {
        try {
            Mat source = bufferedImageToMat(input);
            Mat resized = new Mat();
            Imgproc.resize(source, resized, new Size(width, height), 0, 0, Imgproc.INTER_LINEAR);
            return matToBufferedImage(resized);
        } catch (Exception e) {
            log.error("OpenCV resize failed", e);
            throw new CarvingException("Downsizing failed: " + e.getMessage(), e);
        }
    }

    private BufferedImage resizeWithJava2D(BufferedImage input, int width, int height) {
        BufferedImage out = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D graphics = out.createGraphics();
        graphics.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
        graphics.drawImage(input, 0, 0, width, height, null);
        graphics.dispose();
        return out;
    }

    private Mat bufferedImageToMat(BufferedImage image) {
        BufferedImage bgrImage = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_3BYTE_BGR);
        Graphics2D graphics = bgrImage.createGraphics();
        graphics.drawImage(image, 0, 0, null);
        graphics.dispose();
        byte[] pixels = ((DataBufferByte) bgrImage.getRaster().getDataBuffer()).getData();
        Mat mat = new Mat(image.getHeight(), image.getWidth(), CvType.CV_8UC3);
        mat.put(0, 0, pixels);
        return mat;
    }

    private BufferedImage matToBufferedImage(Mat mat) {
        BufferedImage out = new BufferedImage(mat.cols(), mat.rows(), BufferedImage.TYPE_3BYTE_BGR);
        byte[] pixels = ((DataBufferByte) out.getRaster().getDataBuffer()).getData();
        mat.get(0, 0, pixels);
        return out;
    }
}
