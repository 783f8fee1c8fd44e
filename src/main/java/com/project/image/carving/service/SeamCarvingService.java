package com.project.image.carving.service;

import com.project.image.carving.DTOs.CarvingResult;
import com.project.image.carving.config.CarvingOptions;
import com.project.image.carving.engine.PixelImage;
import com.project.image.carving.engine.SeamFinder;
import com.project.image.carving.engine.SeamInserter;
import com.project.image.carving.engine.SeamRemover;
import com.project.image.carving.engine.SeamSearchResult;
import com.project.image.carving.exceptions.CarvingException;
import com.project.image.carving.exceptions.CarvingPreconditionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.awt.image.BufferedImage;
import java.util.function.ToIntFunction;

@Service
public class SeamCarvingService {
    private static final Logger log = LoggerFactory.getLogger(SeamCarvingService.class);

    private final SeamFinder finder;
    private final SeamRemover remover;
    private final SeamInserter inserter;
    private final ImageDownsizer downsizer;
    private final SeamOverlayRenderer overlayRenderer;

    public SeamCarvingService() {
        this(new ImageDownsizer(), new SeamOverlayRenderer());
    }

    @Autowired
    public SeamCarvingService(ImageDownsizer downsizer, SeamOverlayRenderer overlayRenderer) {
        this.finder = new SeamFinder();
        this.remover = new SeamRemover();
        this.inserter = new SeamInserter(finder, remover);
        this.downsizer = downsizer;
        this.overlayRenderer = overlayRenderer;
    }

    /**
     * Changes the width of {@code image} by {@code dx} columns: negative removes that many seams one
     * after another, positive inserts them as a single batch, zero returns the image as is.
     *
     * @throws CarvingPreconditionException if the image is empty, the result would have no columns,
     *                                      or more columns are requested than the image has
     */
    public PixelImage carve(PixelImage image, int dx) {
        if (image == null) {
            throw new CarvingPreconditionException("No image to carve");
        }
        final int w = image.width(), h = image.height();
        if (h <= 0 || w + dx <= 0 || dx > w) {
            throw new CarvingPreconditionException("Cannot change width " + w + " by " + dx
                    + " (allowed range " + (1 - w) + ".." + w + ")");
        }

        if (dx == 0) {
            return image;
        }
        if (dx > 0) {
            log.debug("Inserting {} seams into {}x{}", dx, w, h);
            return inserter.insertSeams(image, dx);
        }

        log.debug("Removing {} seams from {}x{}", -dx, w, h);
        PixelImage output = image;
        for (int i = 0; i < -dx; i++) {
            if (Thread.currentThread().isInterrupted()) {
                throw new CarvingException("Carving interrupted after " + i + " of " + (-dx) + " seams");
            }
            SeamSearchResult found = finder.findMinimumSeam(output);
            output = remover.removeSeam(output, found.mask());
        }
        return output;
    }

    /**
     * Full pipeline for a decoded upload: optional downsizing, carving, PNG encoding, and optionally
     * a preview of the seams the carve used.
     */
    public CarvingResult resize(BufferedImage input, int dx, CarvingOptions options, boolean withSeamPreview) {
        return resize(input, working -> dx, options, withSeamPreview);
    }

    /**
     * Same pipeline, but dx is worked out from the image actually carved, i.e. after downsizing.
     * Use this when dx is derived from image content, such as a reference image's aspect ratio.
     */
    public CarvingResult resize(BufferedImage input, ToIntFunction<BufferedImage> dxForWorkingImage,
                                CarvingOptions options, boolean withSeamPreview) {
        if (input == null) {
            throw new CarvingException("Image is missing or could not be decoded.");
        }
        log.info("Starting carve for image {}x{}", input.getWidth(), input.getHeight());
        long started = System.nanoTime();

        BufferedImage working = options.downsize()
                ? downsizer.downsize(input, options.maxWidth())
                : input;
        if (working != input) {
            log.info("Downsized to {}x{} before carving", working.getWidth(), working.getHeight());
        }

        int dx = dxForWorkingImage.applyAsInt(working);
        log.debug("dx={} for working image {}x{}", dx, working.getWidth(), working.getHeight());

        PixelImage pixels = ImageConversions.toPixelImage(working);
        PixelImage carved = carve(pixels, dx);

        byte[] preview = null;
        if (withSeamPreview && dx != 0) {
            preview = ImageConversions.toPng(
                    overlayRenderer.render(pixels, Math.abs(dx), options.seamColor()));
        }

        long elapsed = (System.nanoTime() - started) / 1_000_000;
        log.info("Carve completed: {}x{} -> {}x{} in {} ms",
                pixels.width(), pixels.height(), carved.width(), carved.height(), elapsed);

        return new CarvingResult(
                input.getWidth(), input.getHeight(),
                pixels.width(), pixels.height(),
                carved.width(), carved.height(),
                dx, elapsed,
                ImageConversions.toPng(ImageConversions.toBufferedImage(carved)),
                preview
        );
    }
}
