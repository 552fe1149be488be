package com.example.depositaccrual.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.lang.NonNull;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * CORS configuration for the front end consuming the accrual API.
 * Local development origins are always allowed; more come from cors.allowed.origins (comma-separated).
 */
@Configuration
public class CorsConfig implements WebMvcConfigurer {

    @Value("${cors.allowed.origins:}")
    private String additionalAllowedOrigins;

    List<String> getAllowedOrigins() {
        List<String> origins = new ArrayList<>(Arrays.asList(
            "http://localhost:3000",
            "http://localhost:5173"
        ));

        if (additionalAllowedOrigins != null && !additionalAllowedOrigins.trim().isEmpty()) {
            for (String origin : additionalAllowedOrigins.split(",")) {
                String trimmedOrigin = origin.trim();
                if (!trimmedOrigin.isEmpty() && !origins.contains(trimmedOrigin)) {
                    origins.add(trimmedOrigin);
                }
            }
        }

        return origins;
    }

    @Override
    public void addCorsMappings(@NonNull CorsRegistry registry) {
        registry.addMapping("/api/**")
                .allowedOrigins(getAllowedOrigins().toArray(new String[0]))
                .allowedMethods("GET", "POST", "PUT", "DELETE", "OPTIONS")
                .allowedHeaders("*")
                .exposedHeaders("Content-Disposition")
                .maxAge(3600);
    }
}
