package br.edu.ifba.asrgot.scheduler;

import br.edu.ifba.asrgot.llm.ModelResponse;
import org.jetbrains.annotations.NotNull;

import java.time.Duration;
import java.util.Optional;

/**
 * Queues model calls and runs them on a bounded worker pool.
 *
 * <p>Results are retrieved by polling and stay available for a retention window after
 * the task finishes.</p>
 */
public interface TaskScheduler extends AutoCloseable {

    /**
     * Queues a task.
     *
     * @return the task id
     * @throws br.edu.ifba.asrgot.exception.SingleToolRuleViolationException if the capability rule is broken;
     *         the task is not queued
     */
    @NotNull
    String enqueue(@NotNull ModelTask task);

    /**
     * Waits up to {@code timeout} for the task's result.
     *
     * @throws br.edu.ifba.asrgot.exception.TaskNotFoundException     unknown or evicted id
     * @throws br.edu.ifba.asrgot.exception.TaskFailedException       the model call failed
     * @throws br.edu.ifba.asrgot.exception.SchedulerTimeoutException the task did not finish in time
     */
    @NotNull
    ModelResponse getResult(@NotNull String taskId, @NotNull Duration timeout);

    @NotNull
    Optional<TaskStatus> getStatus(@NotNull String taskId);

    @NotNull
    SchedulerStats getStats();

    /**
     * Stops the workers. Queued tasks fail.
     */
    @Override
    void close();
}
