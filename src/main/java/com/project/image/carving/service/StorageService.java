package com.project.image.carving.service;

import com.project.image.carving.exceptions.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Keeps uploaded originals and carving outputs on disk under app.upload.dir.
 */
@Service
public class StorageService {
    private static final Logger log = LoggerFactory.getLogger(StorageService.class);
    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS");

    private final Path rootDir;
    // disambiguates files written within the same millisecond
    private final AtomicInteger sequence = new AtomicInteger();

    public StorageService(@Value("${app.upload.dir:uploads}") String root) {
        this.rootDir = Paths.get(root).toAbsolutePath().normalize();
        try {
            Files.createDirectories(this.rootDir);
            log.info("Using upload directory: {}", this.rootDir);
        } catch (IOException e) {
            throw new StorageException("Cannot create upload directory: " + rootDir, e);
        }
    }

    public record StoredFile(Path path, String filename, String relativeWebPath) {}

    public StoredFile store(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new StorageException("Empty upload");
        }
        String contentType = file.getContentType();
        if (contentType == null || !contentType.startsWith("image/")) {
            throw new StorageException("Only image uploads are allowed (received: " + contentType + ")");
        }
        String original = StringUtils.cleanPath(file.getOriginalFilename() == null ? "upload" : file.getOriginalFilename());
        String safeBase = original.replaceAll("[^a-zA-Z0-9._-]", "_");
        Path target = rootDir.resolve(nextName(safeBase));
        try (InputStream in = file.getInputStream()) {
            Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
            log.debug("Stored upload {} as {}", original, target.getFileName());
            return toStored(target);
        } catch (IOException e) {
            throw new StorageException("Failed to store file", e);
        }
    }

    /** Writes a PNG produced by the carver; {@code suffix} tells result kinds apart, e.g. "carved". */
    public StoredFile storeResultImage(byte[] pngBytes, String suffix) {
        if (pngBytes == null || pngBytes.length == 0) {
            throw new StorageException("No image data to store");
        }
        Path target = rootDir.resolve(nextName(suffix + ".png"));
        try {
            Files.write(target, pngBytes);
            return toStored(target);
        } catch (IOException e) {
            throw new StorageException("Failed to store result image", e);
        }
    }

    private String nextName(String base) {
        return STAMP.format(LocalDateTime.now()) + "_" + (sequence.incrementAndGet() % 1000) + "_" + base;
    }

    private StoredFile toStored(Path target) {
        String filename = target.getFileName().toString();
        return new StoredFile(target, filename, "uploads/" + filename);
    }
}
