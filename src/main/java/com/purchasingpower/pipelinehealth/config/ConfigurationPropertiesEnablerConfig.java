package com.purchasingpower.pipelinehealth.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the standalone {@code @ConfigurationProperties} classes that are
 * not themselves annotated as components.
 *
 * <ul>
 *   <li>{@link GlobalRetryConfig} - Outbound retry and backoff settings
 * </ul>
 *
 * @since 1.0.0
 */
@Configuration
@EnableConfigurationProperties({
    GlobalRetryConfig.class
})
public class ConfigurationPropertiesEnablerConfig {
}
