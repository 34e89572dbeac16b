package com.purchasingpower.pipelinehealth.ci;

import com.purchasingpower.pipelinehealth.exception.CiProviderException;

import java.util.List;

/**
 * Source of pipeline runs and their jobs.
 *
 * <p>Implementations own transport concerns (authentication, paging, retries).
 * Every method reports provider failures as {@link CiProviderException};
 * {@link CiProviderException#isNotFound()} tells a missing resource apart from
 * any other failure.
 *
 * @since 1.0.0
 */
public interface CiProvider {

    /**
     * Confirm that the project exists and is readable with the configured credentials.
     *
     * @throws CiProviderException if access cannot be confirmed
     */
    void verifyAccess(ProjectRef project);

    /**
     * List recent runs of a project.
     *
     * @param project Project to list runs for
     * @param workflowId Optional workflow id or file name narrowing the listing, ignored when {@code runId} is set
     * @param runId Optional run id; when present the result holds exactly that run
     * @return Runs, most recent first as the provider orders them
     * @throws CiProviderException if the listing fails
     */
    List<PipelineRun> listRuns(ProjectRef project, String workflowId, String runId);

    /**
     * List the jobs of one run.
     *
     * @throws CiProviderException if the listing fails
     */
    List<PipelineJob> listJobs(PipelineRun run);
}
