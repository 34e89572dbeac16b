package com.purchasingpower.pipelinehealth.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.purchasingpower.pipelinehealth.ci.CiProvider;
import com.purchasingpower.pipelinehealth.ci.CiTimestamps;
import com.purchasingpower.pipelinehealth.ci.PipelineJob;
import com.purchasingpower.pipelinehealth.ci.PipelineRun;
import com.purchasingpower.pipelinehealth.ci.ProjectRef;
import com.purchasingpower.pipelinehealth.ci.RunOutcome;
import com.purchasingpower.pipelinehealth.config.GlobalRetryConfig;
import com.purchasingpower.pipelinehealth.configuration.AppProperties;
import com.purchasingpower.pipelinehealth.configuration.GitHubProperties;
import com.purchasingpower.pipelinehealth.exception.CiProviderException;
import com.purchasingpower.pipelinehealth.model.github.GitHubJob;
import com.purchasingpower.pipelinehealth.model.github.GitHubJobsPage;
import com.purchasingpower.pipelinehealth.model.github.GitHubRunsPage;
import com.purchasingpower.pipelinehealth.model.github.GitHubWorkflowRun;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.net.URI;
import java.time.Duration;
import java.util.List;

/**
 * {@link CiProvider} backed by the GitHub Actions REST API.
 *
 * <p>Transient failures (connection errors, 429, 5xx) are retried with
 * exponential backoff per {@link GlobalRetryConfig}; everything else surfaces
 * immediately as {@link CiProviderException}.
 */
@Slf4j
@Component
public class GitHubActionsClient implements CiProvider {

    private static final String PROVIDER = "github";

    private final WebClient webClient;
    private final GitHubProperties props;
    private final GlobalRetryConfig retryConfig;

    public GitHubActionsClient(WebClient.Builder builder, AppProperties appProperties, GlobalRetryConfig retryConfig) {
        this.props = appProperties.getGithub();
        this.retryConfig = retryConfig;

        builder = builder
                .baseUrl(props.getBaseUrl())
                .defaultHeader(HttpHeaders.ACCEPT, "application/vnd.github+json")
                .defaultHeader("X-GitHub-Api-Version", props.getApiVersion());

        String token = props.getToken();
        if (token != null && !token.isBlank()) {
            builder = builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + token);
        } else {
            log.warn("No GitHub token configured; only public repositories can be analyzed");
        }
        this.webClient = builder.build();
    }

    @Override
    public void verifyAccess(ProjectRef project) {
        execute("verifyAccess", project.fullName(),
                webClient.get()
                        .uri("/repos/{owner}/{repo}", project.owner(), project.name())
                        .retrieve()
                        .bodyToMono(JsonNode.class));
    }

    @Override
    public List<PipelineRun> listRuns(ProjectRef project, String workflowId, String runId) {
        if (runId != null && !runId.isBlank()) {
            GitHubWorkflowRun run = execute("getRun", project.fullName() + " run " + runId,
                    webClient.get()
                            .uri("/repos/{owner}/{repo}/actions/runs/{runId}", project.owner(), project.name(), runId)
                            .retrieve()
                            .bodyToMono(GitHubWorkflowRun.class));
            if (run == null) {
                throw new CiProviderException("Run " + runId + " returned an empty body", 0, null);
            }
            return List.of(toPipelineRun(run));
        }

        GitHubRunsPage page;
        if (workflowId != null && !workflowId.isBlank()) {
            page = execute("listWorkflowRuns", project.fullName() + " workflow " + workflowId,
                    webClient.get()
                            .uri(uri -> uri.path("/repos/{owner}/{repo}/actions/workflows/{workflowId}/runs")
                                    .queryParam("per_page", props.getPerPage())
                                    .build(project.owner(), project.name(), workflowId))
                            .retrieve()
                            .bodyToMono(GitHubRunsPage.class));
        } else {
            page = execute("listRuns", project.fullName(),
                    webClient.get()
                            .uri(uri -> uri.path("/repos/{owner}/{repo}/actions/runs")
                                    .queryParam("per_page", props.getPerPage())
                                    .build(project.owner(), project.name()))
                            .retrieve()
                            .bodyToMono(GitHubRunsPage.class));
        }

        if (page == null || page.workflowRuns() == null) {
            return List.of();
        }
        return page.workflowRuns().stream()
                .map(GitHubActionsClient::toPipelineRun)
                .toList();
    }

    @Override
    public List<PipelineJob> listJobs(PipelineRun run) {
        if (run.jobsUrl() == null || run.jobsUrl().isBlank()) {
            throw new CiProviderException("Run " + run.id() + " has no jobs reference", 0, null);
        }

        URI jobsUri = UriComponentsBuilder.fromUriString(run.jobsUrl())
                .queryParam("per_page", props.getPerPage())
                .build()
                .toUri();

        GitHubJobsPage page = execute("listJobs", "run " + run.id(),
                webClient.get()
                        .uri(jobsUri)
                        .retrieve()
                        .bodyToMono(GitHubJobsPage.class));

        if (page == null || page.jobs() == null) {
            return List.of();
        }
        return page.jobs().stream()
                .map(GitHubActionsClient::toPipelineJob)
                .toList();
    }

    private <T> T execute(String operation, String target, Mono<T> request) {
        ProviderCall call = ProviderCall.start(PROVIDER, operation, target, log);
        try {
            T body = request
                    .retryWhen(buildRetrySpec(call))
                    .block(props.getTimeout());
            call.succeeded(body);
            return body;
        } catch (WebClientResponseException e) {
            int status = e.getStatusCode().value();
            call.failed("HTTP " + status, e);
            throw new CiProviderException(operation + " for " + target + " returned HTTP " + status, status, e);
        } catch (RuntimeException e) {
            call.failed(e.getMessage(), e);
            throw new CiProviderException(operation + " for " + target + " failed: " + e.getMessage(), e);
        }
    }

    private Retry buildRetrySpec(ProviderCall call) {
        return Retry.backoff(retryConfig.getMaxAttempts(), Duration.ofMillis(retryConfig.getBackoffMs()))
                .maxBackoff(Duration.ofMillis(retryConfig.getMaxBackoffMs()))
                .filter(GitHubActionsClient::isRetryable)
                .doBeforeRetry(signal -> call.retrying(signal.totalRetries(), signal.failure()))
                .onRetryExhaustedThrow((spec, signal) -> signal.failure());
    }

    private static boolean isRetryable(Throwable ex) {
        if (ex instanceof WebClientRequestException) {
            return true;
        }
        if (!(ex instanceof WebClientResponseException webEx)) {
            return false;
        }
        return webEx.getStatusCode().is5xxServerError() || webEx.getStatusCode().value() == 429;
    }

    private static PipelineRun toPipelineRun(GitHubWorkflowRun run) {
        return new PipelineRun(
                String.valueOf(run.id()),
                run.name(),
                RunOutcome.fromWire(run.conclusion()),
                CiTimestamps.parse("created_at", run.createdAt()),
                CiTimestamps.parse("updated_at", run.updatedAt()),
                run.jobsUrl());
    }

    private static PipelineJob toPipelineJob(GitHubJob job) {
        return new PipelineJob(
                job.name(),
                RunOutcome.fromWire(job.conclusion()),
                CiTimestamps.parseOptional("completed_at", job.completedAt()));
    }
}
