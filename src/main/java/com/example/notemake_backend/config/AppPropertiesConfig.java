package com.example.notemake_backend.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Enables application-specific configuration properties.
 */
@Configuration
@EnableConfigurationProperties({CacheProperties.class, ExtractionProperties.class, AiProperties.class})
public class AppPropertiesConfig {
}
