/**
 * CI provider abstraction: the run and job records the analysis engine reads,
 * and the {@code CiProvider} contract it reads them through.
 *
 * <p>Key classes:
 * <ul>
 *   <li>{@code CiProvider} - Lists runs and jobs for a project</li>
 *   <li>{@code PipelineRun} / {@code PipelineJob} - Immutable fetched records</li>
 *   <li>{@code RunOutcome} - Terminal or non-terminal state of a run or job</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.purchasingpower.pipelinehealth.ci;
