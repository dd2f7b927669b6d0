package br.edu.ifba.asrgot.scheduler;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Point-in-time scheduler counters.
 *
 * @param queuedTasks     tasks waiting for a worker
 * @param processingTasks tasks currently running
 * @param completedTasks  finished tasks still held for retrieval
 * @param maxConcurrent   worker pool size
 */
public record SchedulerStats(
    @JsonProperty("queued_tasks") int queuedTasks,
    @JsonProperty("processing_tasks") int processingTasks,
    @JsonProperty("completed_tasks") int completedTasks,
    @JsonProperty("max_concurrent") int maxConcurrent
) {
}
