package com.purchasingpower.pipelinehealth.configuration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private GitHubProperties github = new GitHubProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private AnalysisProperties analysis = new AnalysisProperties();
}
