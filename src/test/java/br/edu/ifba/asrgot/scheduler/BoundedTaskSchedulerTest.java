package br.edu.ifba.asrgot.scheduler;

import br.edu.ifba.asrgot.core.ApiCredentials;
import br.edu.ifba.asrgot.exception.SchedulerTimeoutException;
import br.edu.ifba.asrgot.exception.SingleToolRuleViolationException;
import br.edu.ifba.asrgot.exception.TaskFailedException;
import br.edu.ifba.asrgot.exception.TaskNotFoundException;
import br.edu.ifba.asrgot.llm.Capability;
import br.edu.ifba.asrgot.llm.ModelCallService;
import br.edu.ifba.asrgot.llm.ModelOptions;
import br.edu.ifba.asrgot.llm.ModelRequest;
import br.edu.ifba.asrgot.llm.ModelResponse;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class BoundedTaskSchedulerTest {

    private static final ApiCredentials CREDENTIALS = ApiCredentials.gemini("test-key");
    private static final Duration WAIT = Duration.ofSeconds(5);

    private BoundedTaskScheduler scheduler;

    @AfterEach
    void tearDown() {
        if (scheduler != null) {
            scheduler.close();
        }
    }

    // =========================================================================
    // Results
    // =========================================================================

    @Test
    @DisplayName("Enqueued task completes with the model response")
    void testEnqueueAndGetResult() {
        // Arrange
        scheduler = new BoundedTaskScheduler(echo());

        // Act
        String taskId = scheduler.enqueue(ModelTask.of(request("hello")));
        ModelResponse response = scheduler.getResult(taskId, WAIT);

        // Assert
        assertTrue(taskId.matches("task_\\d+_[a-z0-9]{9}"));
        assertEquals("echo: hello", response.text());
        assertEquals(TaskStatus.COMPLETED, scheduler.getStatus(taskId).orElseThrow());
    }

    @Test
    void testUnknownTask() {
        scheduler = new BoundedTaskScheduler(echo());

        assertThrows(TaskNotFoundException.class, () -> scheduler.getResult("task_0_missing00", WAIT));
        assertTrue(scheduler.getStatus("task_0_missing00").isEmpty());
    }

    @Test
    @DisplayName("A failed call surfaces as TaskFailedException with the cause's message")
    void testFailedTask() {
        // Arrange
        scheduler = new BoundedTaskScheduler(
            request -> CompletableFuture.failedFuture(new IllegalStateException("quota exceeded")));

        // Act
        String taskId = scheduler.enqueue(ModelTask.of(request("hello")));
        TaskFailedException error = assertThrows(TaskFailedException.class,
            () -> scheduler.getResult(taskId, WAIT));

        // Assert
        assertEquals("quota exceeded", error.getMessage());
        assertEquals(TaskStatus.FAILED, scheduler.getStatus(taskId).orElseThrow());
    }

    @Test
    @DisplayName("Waiting past the timeout raises SchedulerTimeoutException")
    void testTimeout() {
        // Arrange
        CompletableFuture<ModelResponse> never = new CompletableFuture<>();
        scheduler = new BoundedTaskScheduler(request -> never);

        // Act
        String taskId = scheduler.enqueue(ModelTask.of(request("slow")));

        // Assert
        assertThrows(SchedulerTimeoutException.class, () -> scheduler.getResult(taskId, Duration.ofMillis(100)));
        never.complete(ModelResponse.of("late"));
    }

    // =========================================================================
    // Ordering and limits
    // =========================================================================

    @Test
    @DisplayName("Queued tasks are dispatched by priority, then enqueue order")
    void testPriorityOrder() throws InterruptedException {
        // Arrange
        CountDownLatch blocker = new CountDownLatch(1);
        CountDownLatch started = new CountDownLatch(1);
        List<String> order = Collections.synchronizedList(new ArrayList<>());
        scheduler = new BoundedTaskScheduler(request -> {
            if (request.prompt().equals("blocker")) {
                started.countDown();
                try {
                    blocker.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            } else {
                order.add(request.prompt());
            }
            return CompletableFuture.completedFuture(ModelResponse.of(request.prompt()));
        }, 1, Duration.ofSeconds(30));

        String first = scheduler.enqueue(ModelTask.of(request("blocker")));
        assertTrue(started.await(5, TimeUnit.SECONDS));

        // Act
        String low = scheduler.enqueue(new ModelTask(request("low"), TaskPriority.LOW));
        String mediumA = scheduler.enqueue(new ModelTask(request("medium-a"), TaskPriority.MEDIUM));
        String high = scheduler.enqueue(new ModelTask(request("high"), TaskPriority.HIGH));
        String mediumB = scheduler.enqueue(new ModelTask(request("medium-b"), TaskPriority.MEDIUM));
        assertEquals(4, scheduler.getStats().queuedTasks());
        blocker.countDown();

        for (String taskId : List.of(first, low, mediumA, high, mediumB)) {
            scheduler.getResult(taskId, WAIT);
        }

        // Assert
        assertEquals(List.of("high", "medium-a", "medium-b", "low"), order);
    }

    @Test
    void testStatsReportConcurrencyLimit() {
        scheduler = new BoundedTaskScheduler(echo());

        SchedulerStats stats = scheduler.getStats();

        assertEquals(BoundedTaskScheduler.DEFAULT_MAX_CONCURRENT, stats.maxConcurrent());
        assertEquals(0, stats.queuedTasks());
        assertEquals(0, stats.processingTasks());
    }

    @Test
    @DisplayName("Finished tasks are evicted after the retention window")
    void testRetentionEviction() throws InterruptedException {
        // Arrange
        scheduler = new BoundedTaskScheduler(echo(), 1, Duration.ofMillis(50));
        String taskId = scheduler.enqueue(ModelTask.of(request("hello")));
        scheduler.getResult(taskId, WAIT);

        // Act
        long deadline = System.currentTimeMillis() + 5000;
        while (scheduler.getStatus(taskId).isPresent() && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }

        // Assert
        assertTrue(scheduler.getStatus(taskId).isEmpty());
        assertThrows(TaskNotFoundException.class, () -> scheduler.getResult(taskId, WAIT));
    }

    @Test
    @DisplayName("Requests breaking the single-tool rule are rejected at enqueue")
    void testCapabilityRuleEnforcedOnEnqueue() {
        scheduler = new BoundedTaskScheduler(echo());
        ModelRequest twoTools = new ModelRequest("prompt", CREDENTIALS,
            EnumSet.of(Capability.THINKING, Capability.SEARCH_GROUNDING, Capability.CODE_EXECUTION),
            null, ModelOptions.NONE);

        assertThrows(SingleToolRuleViolationException.class, () -> scheduler.enqueue(ModelTask.of(twoTools)));
        assertEquals(0, scheduler.getStats().queuedTasks());
    }

    @Test
    void testEnqueueAfterClose() {
        scheduler = new BoundedTaskScheduler(echo());
        scheduler.close();

        assertThrows(IllegalStateException.class, () -> scheduler.enqueue(ModelTask.of(request("late"))));
    }

    @Test
    void testRejectsInvalidConcurrency() {
        assertThrows(IllegalArgumentException.class,
            () -> new BoundedTaskScheduler(echo(), 0, Duration.ofSeconds(1)));
    }

    private static ModelCallService echo() {
        return request -> CompletableFuture.completedFuture(ModelResponse.of("echo: " + request.prompt()));
    }

    private static ModelRequest request(String prompt) {
        return ModelRequest.thinking(prompt, CREDENTIALS, ModelOptions.NONE);
    }
}
