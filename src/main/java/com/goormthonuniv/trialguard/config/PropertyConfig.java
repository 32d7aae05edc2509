package com.goormthonuniv.trialguard.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.PropertySource;

/**
 * Optional per-deployment overrides (corpus location, cache sizing) kept out of application.yml.
 */
@Configuration
@PropertySource(
        value = "classpath:properties/trialguard-env.properties",
        ignoreResourceNotFound = true
)
public class PropertyConfig {
}
