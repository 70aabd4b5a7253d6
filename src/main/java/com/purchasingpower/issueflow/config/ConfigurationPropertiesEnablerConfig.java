package com.purchasingpower.issueflow.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the standalone {@code @ConfigurationProperties} classes that are not
 * themselves annotated as components.
 */
@Configuration
@EnableConfigurationProperties({
    GlobalRetryConfig.class
})
public class ConfigurationPropertiesEnablerConfig {
}
