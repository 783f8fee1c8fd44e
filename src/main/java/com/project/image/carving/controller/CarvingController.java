package com.project.image.carving.controller;

import com.project.image.carving.DTOs.CarvingResult;
import com.project.image.carving.config.CarvingOptions;
import com.project.image.carving.exceptions.CarvingException;
import com.project.image.carving.exceptions.CarvingPreconditionException;
import com.project.image.carving.service.SeamCarvingService;
import com.project.image.carving.service.StorageService;
import com.project.image.carving.service.WidthDeltaEstimator;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.multipart.MultipartFile;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.Arrays;
import java.util.List;
import java.util.function.ToIntFunction;
import javax.imageio.ImageIO;

@Controller
@Validated
public class CarvingController {
    private static final Logger log = LoggerFactory.getLogger(CarvingController.class);

    private static final List<String> SUPPORTED_FORMATS = Arrays.asList(
            "image/jpeg", "image/jpg", "image/png", "image/gif", "image/bmp"
    );
    private static final long MAX_UPLOAD_BYTES = 10 * 1024 * 1024; // 10MB
    private static final int MAX_DIMENSION = 4000;

    private final SeamCarvingService carvingService;
    private final StorageService storageService;
    private final WidthDeltaEstimator deltaEstimator;
    private final CarvingOptions options;

    @Value("${app.carving.default-dx:-50}")
    private int defaultDx;

    public CarvingController(SeamCarvingService carvingService, StorageService storageService,
                             WidthDeltaEstimator deltaEstimator, CarvingOptions options) {
        this.carvingService = carvingService;
        this.storageService = storageService;
        this.deltaEstimator = deltaEstimator;
        this.options = options;
    }

    @GetMapping("/carve")
    public String showForm(Model model) {
        populateFormModel(model);
        return "carve";
    }

    @PostMapping(value = "/carve", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public String handleUpload(
            @RequestParam("file") @NotNull MultipartFile file,
            @RequestParam(name = "reference", required = false) MultipartFile reference,
            @RequestParam(name = "dx", required = false)
            @Min(value = -MAX_DIMENSION, message = "dx cannot remove more than 4000 columns")
            @Max(value = MAX_DIMENSION, message = "dx cannot add more than 4000 columns")
            Integer dx,
            @RequestParam(name = "preview", defaultValue = "false") boolean preview,
            Model model
    ) throws IOException {

        validateUploadedFile(file);
        log.info("Processing file: {} ({}KB), dx: {}, preview: {}",
                file.getOriginalFilename(), file.getSize() / 1024, dx, preview);

        var storedOriginal = storageService.store(file);
        BufferedImage input = loadAndValidateImage(file);

        ToIntFunction<BufferedImage> delta = resolveDelta(reference, dx);

        try {
            CarvingResult result = carvingService.resize(input, delta, options, preview);

            var carvedStored = storageService.storeResultImage(result.resultPng(), "carved");
            StorageService.StoredFile previewStored = result.hasSeamPreview()
                    ? storageService.storeResultImage(result.seamPreviewPng(), "seams")
                    : null;

            populateResultModel(model, storedOriginal, carvedStored, previewStored, result);
            log.info("Carving completed successfully for {}", file.getOriginalFilename());
            return "result";

        } catch (CarvingPreconditionException e) {
            log.warn("Carving rejected for {}: {}", file.getOriginalFilename(), e.getMessage());
            populateFormModel(model);
            model.addAttribute("error", e.getMessage());
            model.addAttribute("suggestion",
                    "dx is applied after downsizing; choose a value between 1 - width and width of the working image.");
            return "carve";
        }
    }

    /**
     * An explicit dx is used as given; otherwise dx is estimated against the image that is actually
     * carved, so downsizing cannot push it outside the carvable range.
     */
    private ToIntFunction<BufferedImage> resolveDelta(MultipartFile reference, Integer dx) throws IOException {
        if (dx != null) {
            return working -> dx;
        }
        if (reference == null || reference.isEmpty()) {
            throw new IllegalArgumentException("Enter dx or upload a reference image to derive it from");
        }
        validateUploadedFile(reference);
        BufferedImage referenceImage = loadAndValidateImage(reference);
        String referenceName = reference.getOriginalFilename();
        return working -> {
            int estimated = deltaEstimator.estimate(working, referenceImage);
            log.info("Estimated dx={} from reference {}", estimated, referenceName);
            return estimated;
        };
    }

    private void validateUploadedFile(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new IllegalArgumentException("Please choose a file to upload");
        }

        String contentType = file.getContentType();
        if (contentType == null || !SUPPORTED_FORMATS.contains(contentType.toLowerCase())) {
            throw new IllegalArgumentException(
                    "Unsupported file format: " + contentType +
                            ". Supported formats: " + String.join(", ", SUPPORTED_FORMATS)
            );
        }

        if (file.getSize() > MAX_UPLOAD_BYTES) {
            throw new IllegalArgumentException("File is too large. Maximum size: 10MB");
        }
    }

    private BufferedImage loadAndValidateImage(MultipartFile file) throws IOException {
        BufferedImage input;
        try (var inputStream = file.getInputStream()) {
            input = ImageIO.read(inputStream);
        }

        if (input == null) {
            throw new CarvingException("The file is not a valid image or is corrupted.");
        }
        if (input.getWidth() > MAX_DIMENSION || input.getHeight() > MAX_DIMENSION) {
            throw new CarvingException("Image is too large. Maximum size: 4000x4000 pixels");
        }

        log.debug("Image loaded successfully: {}x{}", input.getWidth(), input.getHeight());
        return input;
    }

    private void populateFormModel(Model model) {
        model.addAttribute("defaultDx", defaultDx);
        model.addAttribute("maxWidth", options.maxWidth());
        model.addAttribute("downsize", options.downsize());
        model.addAttribute("supportedFormats", String.join(", ", SUPPORTED_FORMATS));
    }

    private void populateResultModel(Model model, StorageService.StoredFile original,
                                     StorageService.StoredFile carved, StorageService.StoredFile seams,
                                     CarvingResult result) {
        model.addAttribute("originalPath", "/" + original.relativeWebPath());
        model.addAttribute("carvedPath", "/" + carved.relativeWebPath());
        model.addAttribute("seamsPath", seams == null ? null : "/" + seams.relativeWebPath());

        model.addAttribute("originalSize", result.originalWidth() + "x" + result.originalHeight());
        model.addAttribute("workingSize", result.workingWidth() + "x" + result.workingHeight());
        model.addAttribute("carvedSize", result.width() + "x" + result.height());
        model.addAttribute("dx", result.dx());
        model.addAttribute("seamsRemoved", result.seamsRemoved());
        model.addAttribute("seamsInserted", result.seamsInserted());
        model.addAttribute("elapsedMs", result.elapsedMillis());
    }
}
