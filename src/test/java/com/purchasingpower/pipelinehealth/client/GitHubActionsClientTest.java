package com.purchasingpower.pipelinehealth.client;

import com.purchasingpower.pipelinehealth.ci.PipelineJob;
import com.purchasingpower.pipelinehealth.ci.PipelineRun;
import com.purchasingpower.pipelinehealth.ci.ProjectRef;
import com.purchasingpower.pipelinehealth.ci.RunOutcome;
import com.purchasingpower.pipelinehealth.config.GlobalRetryConfig;
import com.purchasingpower.pipelinehealth.configuration.AppProperties;
import com.purchasingpower.pipelinehealth.exception.CiProviderException;
import com.purchasingpower.pipelinehealth.exception.MalformedRunDataException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests GitHubActionsClient against canned HTTP responses.
 */
@DisplayName("GitHub Actions client")
class GitHubActionsClientTest {

    private static final ProjectRef PROJECT = new ProjectRef("acme", "widgets");

    private static final String RUNS_PAGE = """
        {
          "total_count": 2,
          "workflow_runs": [
            {
              "id": 101,
              "name": "CI",
              "status": "completed",
              "conclusion": "failure",
              "created_at": "2024-03-10T08:00:00Z",
              "updated_at": "2024-03-10T08:12:00Z",
              "jobs_url": "https://api.github.com/repos/acme/widgets/actions/runs/101/jobs",
              "head_branch": "main"
            },
            {
              "id": 102,
              "name": "CI",
              "status": "in_progress",
              "conclusion": null,
              "created_at": "2024-03-10T09:00:00Z",
              "updated_at": "2024-03-10T09:01:00Z",
              "jobs_url": "https://api.github.com/repos/acme/widgets/actions/runs/102/jobs"
            }
          ]
        }
        """;

    private final List<ClientRequest> requests = new CopyOnWriteArrayList<>();
    private final Deque<ClientResponse> responses = new ArrayDeque<>();
    private final AppProperties props = new AppProperties();
    private final GlobalRetryConfig retryConfig = new GlobalRetryConfig();

    @BeforeEach
    void setUp() {
        props.getGithub().setToken("secret-token");
        retryConfig.setMaxAttempts(0);
        retryConfig.setBackoffMs(1);
        retryConfig.setMaxBackoffMs(5);
    }

    private GitHubActionsClient client() {
        WebClient.Builder builder = WebClient.builder().exchangeFunction(request -> {
            requests.add(request);
            ClientResponse response = responses.poll();
            return Mono.just(response != null ? response : json(HttpStatus.INTERNAL_SERVER_ERROR, "{}"));
        });
        return new GitHubActionsClient(builder, props, retryConfig);
    }

    private void respond(HttpStatus status, String body) {
        responses.add(json(status, body));
    }

    private static ClientResponse json(HttpStatus status, String body) {
        return ClientResponse.create(status)
            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .body(body)
            .build();
    }

    @Test
    @DisplayName("Should list repository runs and map them to pipeline runs")
    void listRuns_repository() {
        respond(HttpStatus.OK, RUNS_PAGE);

        List<PipelineRun> runs = client().listRuns(PROJECT, null, null);

        assertThat(runs).extracting(PipelineRun::id).containsExactly("101", "102");
        assertThat(runs).extracting(PipelineRun::outcome).containsExactly(RunOutcome.FAILURE, RunOutcome.OTHER);
        assertThat(runs.get(0).createdAt()).isEqualTo(Instant.parse("2024-03-10T08:00:00Z"));
        assertThat(runs.get(0).durationMinutes()).isEqualTo(12.0);

        ClientRequest request = requests.get(0);
        assertThat(request.url().getPath()).isEqualTo("/repos/acme/widgets/actions/runs");
        assertThat(request.url().getQuery()).isEqualTo("per_page=100");
        assertThat(request.headers().getFirst(HttpHeaders.AUTHORIZATION)).isEqualTo("Bearer secret-token");
        assertThat(request.headers().getFirst("X-GitHub-Api-Version")).isEqualTo("2022-11-28");
    }

    @Test
    @DisplayName("Should narrow the listing to a workflow")
    void listRuns_workflow() {
        respond(HttpStatus.OK, RUNS_PAGE);

        client().listRuns(PROJECT, "ci.yml", null);

        assertThat(requests.get(0).url().getPath()).isEqualTo("/repos/acme/widgets/actions/workflows/ci.yml/runs");
    }

    @Test
    @DisplayName("Should fetch exactly one run when a run id is given")
    void listRuns_singleRun() {
        respond(HttpStatus.OK, """
            {"id": 42, "name": "CI", "conclusion": "success",
             "created_at": "2024-03-01T00:00:00Z", "updated_at": "2024-03-01T00:45:00Z",
             "jobs_url": "https://api.github.com/repos/acme/widgets/actions/runs/42/jobs"}
            """);

        List<PipelineRun> runs = client().listRuns(PROJECT, "ignored.yml", "42");

        assertThat(runs).singleElement().satisfies(run -> {
            assertThat(run.id()).isEqualTo("42");
            assertThat(run.outcome()).isEqualTo(RunOutcome.SUCCESS);
            assertThat(run.durationMinutes()).isEqualTo(45.0);
        });
        assertThat(requests.get(0).url().getPath()).isEqualTo("/repos/acme/widgets/actions/runs/42");
    }

    @Test
    @DisplayName("Should report a missing run as not found")
    void listRuns_notFound() {
        respond(HttpStatus.NOT_FOUND, "{\"message\": \"Not Found\"}");

        assertThatThrownBy(() -> client().listRuns(PROJECT, null, "999"))
            .isInstanceOfSatisfying(CiProviderException.class, e -> {
                assertThat(e.isNotFound()).isTrue();
                assertThat(e.getStatusCode()).isEqualTo(404);
            });
    }

    @Test
    @DisplayName("Should fail on a timestamp outside the wire format")
    void listRuns_malformedTimestamp() {
        respond(HttpStatus.OK, RUNS_PAGE.replace("2024-03-10T08:00:00Z", "10/03/2024 08:00"));

        assertThatThrownBy(() -> client().listRuns(PROJECT, null, null))
            .isInstanceOf(MalformedRunDataException.class)
            .hasMessageContaining("created_at");
    }

    @Test
    @DisplayName("Should list jobs through the run's jobs url")
    void listJobs() {
        respond(HttpStatus.OK, """
            {"total_count": 2, "jobs": [
              {"id": 1, "name": "build", "status": "completed", "conclusion": "failure", "completed_at": "2024-03-10T08:10:00Z"},
              {"id": 2, "name": "deploy", "status": "queued", "conclusion": null, "completed_at": null}
            ]}
            """);
        PipelineRun run = new PipelineRun("101", "CI", RunOutcome.FAILURE,
            Instant.parse("2024-03-10T08:00:00Z"), Instant.parse("2024-03-10T08:12:00Z"),
            "https://api.github.com/repos/acme/widgets/actions/runs/101/jobs");

        List<PipelineJob> jobs = client().listJobs(run);

        assertThat(jobs).containsExactly(
            new PipelineJob("build", RunOutcome.FAILURE, Instant.parse("2024-03-10T08:10:00Z")),
            new PipelineJob("deploy", RunOutcome.OTHER, null));
        assertThat(requests.get(0).url().toString())
            .isEqualTo("https://api.github.com/repos/acme/widgets/actions/runs/101/jobs?per_page=100");
    }

    @Test
    @DisplayName("Should refuse to list jobs of a run without a jobs url")
    void listJobs_noReference() {
        PipelineRun run = new PipelineRun("7", "CI", RunOutcome.FAILURE,
            Instant.parse("2024-03-10T08:00:00Z"), Instant.parse("2024-03-10T08:12:00Z"), null);

        assertThatThrownBy(() -> client().listJobs(run)).isInstanceOf(CiProviderException.class);
        assertThat(requests).isEmpty();
    }

    @Test
    @DisplayName("Should surface rejected access with its status")
    void verifyAccess_forbidden() {
        respond(HttpStatus.FORBIDDEN, "{\"message\": \"Forbidden\"}");

        assertThatThrownBy(() -> client().verifyAccess(PROJECT))
            .isInstanceOfSatisfying(CiProviderException.class, e -> {
                assertThat(e.getStatusCode()).isEqualTo(403);
                assertThat(e.isNotFound()).isFalse();
            });
        assertThat(requests.get(0).url().getPath()).isEqualTo("/repos/acme/widgets");
    }

    @Test
    @DisplayName("Should retry a server error and succeed on the next attempt")
    void retry_serverError() {
        retryConfig.setMaxAttempts(2);
        respond(HttpStatus.SERVICE_UNAVAILABLE, "{}");
        respond(HttpStatus.OK, "{\"full_name\": \"acme/widgets\"}");

        client().verifyAccess(PROJECT);

        assertThat(requests).hasSize(2);
    }

    @Test
    @DisplayName("Should not retry a client error")
    void retry_clientErrorNotRetried() {
        retryConfig.setMaxAttempts(2);
        respond(HttpStatus.UNAUTHORIZED, "{}");
        respond(HttpStatus.OK, "{}");

        assertThatThrownBy(() -> client().verifyAccess(PROJECT)).isInstanceOf(CiProviderException.class);
        assertThat(requests).hasSize(1);
    }

    @Test
    @DisplayName("Should omit the authorization header without a token")
    void anonymousAccess() {
        props.getGithub().setToken("");
        respond(HttpStatus.OK, "{}");

        client().verifyAccess(PROJECT);

        assertThat(requests.get(0).headers().containsKey(HttpHeaders.AUTHORIZATION)).isFalse();
    }
}
