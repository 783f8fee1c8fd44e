package com.project.image.carving.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.awt.Color;

/**
 * Binds the app.carving.* properties into a single {@link CarvingOptions} bean.
 */
@Configuration
public class CarvingConfig {
    private static final Logger log = LoggerFactory.getLogger(CarvingConfig.class);

    @Bean
    public CarvingOptions carvingOptions(
            @Value("${app.carving.downsize.enabled:true}") boolean downsize,
            @Value("${app.carving.downsize.max-width:500}") int maxWidth,
            @Value("${app.carving.seam-color:200,200,255}") String seamColor) {
        CarvingOptions options = new CarvingOptions(downsize, maxWidth, parseColor(seamColor));
        log.info("Carving options: downsize={}, maxWidth={}, seamColor={}", downsize, maxWidth, seamColor);
        return options;
    }

    /** Parses "R,G,B" with components in 0..255. */
    public static Color parseColor(String value) {
        String[] parts = value.split(",");
        if (parts.length != 3) {
            throw new IllegalArgumentException("Expected R,G,B but got: " + value);
        }
        try {
            return new Color(Integer.parseInt(parts[0].trim()),
                    Integer.parseInt(parts[1].trim()),
                    Integer.parseInt(parts[2].trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid colour component in: " + value, e);
        }
    }
}
