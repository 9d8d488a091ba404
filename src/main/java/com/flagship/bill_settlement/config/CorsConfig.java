package com.flagship.bill_settlement.config;

import com.flagship.bill_settlement.observability.CorrelationContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Cross-origin access for browser front ends calling the settlement API.
 *
 * settlement.cors.allowed-origins takes origin patterns, so "*" still
 * works with credentials enabled.
 */
@Slf4j
@Configuration
public class CorsConfig implements WebMvcConfigurer {

    @Value("${settlement.cors.allowed-origins:*}")
    private String[] allowedOrigins;

    @Value("${settlement.cors.max-age-seconds:3600}")
    private long maxAgeSeconds;

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        log.info("Configuring CORS: origins={}", String.join(",", allowedOrigins));

        registry.addMapping("/**")
            .allowedOriginPatterns(allowedOrigins)
            .allowedMethods("GET", "POST", "PUT", "DELETE", "PATCH", "OPTIONS")
            .allowedHeaders("*")
            .exposedHeaders(CorrelationContext.CORRELATION_ID_HEADER)
            .allowCredentials(true)
            .maxAge(maxAgeSeconds);
    }
}
