package com.purchasingpower.pipelinehealth.configuration;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.time.Duration;

@Data
public class GitHubProperties {

    @NotBlank
    private String baseUrl = "https://api.github.com";

    /**
     * Personal access or app token. Optional: without it only public
     * repositories can be analyzed, under the anonymous rate limit.
     */
    private String token;

    @NotBlank
    private String apiVersion = "2022-11-28";

    @Min(1)
    @Max(100)
    private int perPage = 100;

    @NotNull
    private Duration timeout = Duration.ofSeconds(20);
}
