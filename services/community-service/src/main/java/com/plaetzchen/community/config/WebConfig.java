package com.plaetzchen.community.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Web MVC configuration: CORS for the browser front end.
 *
 * <p>Origins come from {@link CommunityServiceProperties#corsAllowedOrigins()} so production and
 * local development (React dev server on localhost:3000) differ only in configuration.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final CommunityServiceProperties properties;

    public WebConfig(CommunityServiceProperties properties) {
        this.properties = properties;
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/api/**")
                .allowedOrigins(properties.corsAllowedOrigins().toArray(String[]::new))
                .allowedMethods("GET", "POST", "PUT", "DELETE", "PATCH", "OPTIONS")
                .allowedHeaders("*")
                .exposedHeaders("X-Correlation-ID")
                .allowCredentials(true)
                .maxAge(3600);
    }
}
