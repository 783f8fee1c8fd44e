package com.project.image.carving.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.ResourceHandlerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Serves stored originals and carving results under /uploads/** straight from app.upload.dir,
 * whatever the working directory is.
 */
@Configuration
public class StaticResourceConfig implements WebMvcConfigurer {

    // same property and default as StorageService
    @Value("${app.upload.dir:uploads}")
    private String uploadDir;

    @Override
    public void addResourceHandlers(ResourceHandlerRegistry registry) {
        Path resultsRoot = Paths.get(uploadDir).toAbsolutePath().normalize();
        // result names are timestamped and never rewritten
        registry.addResourceHandler("/uploads/**")
                .addResourceLocations(resultsRoot.toUri().toString())
                .setCachePeriod(3600);
    }
}
