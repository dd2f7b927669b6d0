package br.edu.ifba.asrgot.scheduler;

import br.edu.ifba.asrgot.exception.SchedulerTimeoutException;
import br.edu.ifba.asrgot.exception.TaskFailedException;
import br.edu.ifba.asrgot.exception.TaskNotFoundException;
import br.edu.ifba.asrgot.llm.ModelCallService;
import br.edu.ifba.asrgot.llm.ModelResponse;
import br.edu.ifba.asrgot.llm.TokenEstimator;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.PriorityBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link TaskScheduler} with a fixed number of worker threads.
 *
 * <p>Dispatch order is priority first (high, medium, low), then enqueue order. Finished
 * tasks are evicted after the retention window.</p>
 */
public class BoundedTaskScheduler implements TaskScheduler {

    private static final Logger logger = LoggerFactory.getLogger(BoundedTaskScheduler.class);

    public static final int DEFAULT_MAX_CONCURRENT = 3;
    public static final Duration DEFAULT_RETENTION = Duration.ofSeconds(30);

    private static final String ID_ALPHABET = "abcdefghijklmnopqrstuvwxyz0123456789";

    private final ModelCallService modelCallService;
    private final int maxConcurrent;
    private final Duration retention;

    private final PriorityBlockingQueue<TaskRecord> queue;
    private final Map<String, TaskRecord> tasks = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final AtomicInteger processing = new AtomicInteger();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final List<Thread> workers = new ArrayList<>();
    private final ScheduledExecutorService evictor;

    public BoundedTaskScheduler(@NotNull ModelCallService modelCallService) {
        this(modelCallService, DEFAULT_MAX_CONCURRENT, DEFAULT_RETENTION);
    }

    public BoundedTaskScheduler(@NotNull ModelCallService modelCallService, int maxConcurrent,
                                @NotNull Duration retention) {
        if (maxConcurrent < 1) {
            throw new IllegalArgumentException("maxConcurrent must be >= 1, got: " + maxConcurrent);
        }
        if (retention.isNegative()) {
            throw new IllegalArgumentException("retention must not be negative");
        }
        this.modelCallService = Objects.requireNonNull(modelCallService, "modelCallService must not be null");
        this.maxConcurrent = maxConcurrent;
        this.retention = retention;
        this.queue = new PriorityBlockingQueue<>(16, Comparator
            .comparing((TaskRecord r) -> r.task.priority())
            .thenComparingLong(r -> r.sequence));

        this.evictor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "asrgot-scheduler-evictor");
            thread.setDaemon(true);
            return thread;
        });

        for (int i = 0; i < maxConcurrent; i++) {
            Thread worker = new Thread(this::workLoop, "asrgot-scheduler-worker-" + i);
            worker.setDaemon(true);
            worker.start();
            workers.add(worker);
        }
        logger.info("Task scheduler started with {} workers, retention {}", maxConcurrent, retention);
    }

    @Override
    @NotNull
    public String enqueue(@NotNull ModelTask task) {
        Objects.requireNonNull(task, "task must not be null");
        if (closed.get()) {
            throw new IllegalStateException("Scheduler is closed");
        }
        CapabilityRule.validate(task.request().capabilities());

        String taskId = newTaskId();
        TaskRecord record = new TaskRecord(taskId, task, sequence.getAndIncrement(),
            TokenEstimator.estimateTokensApproximate(task.request().prompt()));
        tasks.put(taskId, record);
        queue.add(record);

        logger.debug("Queued task {} (priority={}, capabilities={}, promptTokens={})",
            taskId, task.priority(), task.request().capabilities(), record.promptTokens);
        return taskId;
    }

    @Override
    @NotNull
    public ModelResponse getResult(@NotNull String taskId, @NotNull Duration timeout) {
        TaskRecord record = tasks.get(taskId);
        if (record == null) {
            throw new TaskNotFoundException(taskId);
        }
        try {
            return record.result.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new SchedulerTimeoutException(taskId, timeout);
        } catch (ExecutionException e) {
            Throwable cause = unwrap(e.getCause());
            throw new TaskFailedException(messageOf(cause), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TaskFailedException("Interrupted while waiting for task " + taskId, e);
        }
    }

    @Override
    @NotNull
    public Optional<TaskStatus> getStatus(@NotNull String taskId) {
        TaskRecord record = tasks.get(taskId);
        return record == null ? Optional.empty() : Optional.of(record.status);
    }

    @Override
    @NotNull
    public SchedulerStats getStats() {
        int finished = 0;
        for (TaskRecord record : tasks.values()) {
            if (record.status.isFinished()) {
                finished++;
            }
        }
        return new SchedulerStats(queue.size(), processing.get(), finished, maxConcurrent);
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        for (Thread worker : workers) {
            worker.interrupt();
        }
        evictor.shutdownNow();

        List<TaskRecord> pending = new ArrayList<>();
        queue.drainTo(pending);
        for (TaskRecord record : pending) {
            record.status = TaskStatus.FAILED;
            record.result.completeExceptionally(new TaskFailedException("Scheduler shut down"));
        }
        logger.info("Task scheduler closed, {} queued tasks failed", pending.size());
    }

    private void workLoop() {
        while (!closed.get()) {
            TaskRecord record;
            try {
                record = queue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            run(record);
        }
    }

    private void run(TaskRecord record) {
        processing.incrementAndGet();
        record.status = TaskStatus.PROCESSING;
        try {
            ModelResponse response = modelCallService.call(record.task.request()).join();
            record.status = TaskStatus.COMPLETED;
            record.result.complete(response);
        } catch (RuntimeException e) {
            Throwable cause = unwrap(e);
            logger.warn("Task {} failed: {}", record.taskId, messageOf(cause));
            record.status = TaskStatus.FAILED;
            record.result.completeExceptionally(cause);
        } finally {
            processing.decrementAndGet();
            scheduleEviction(record.taskId);
        }
    }

    private void scheduleEviction(String taskId) {
        if (closed.get()) {
            return;
        }
        evictor.schedule(() -> {
            if (tasks.remove(taskId) != null) {
                logger.debug("Evicted task {}", taskId);
            }
        }, retention.toMillis(), TimeUnit.MILLISECONDS);
    }

    private static String newTaskId() {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        StringBuilder suffix = new StringBuilder(9);
        for (int i = 0; i < 9; i++) {
            suffix.append(ID_ALPHABET.charAt(random.nextInt(ID_ALPHABET.length())));
        }
        return "task_" + System.currentTimeMillis() + "_" + suffix;
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String messageOf(Throwable error) {
        String message = error != null ? error.getMessage() : null;
        return message != null && !message.isBlank() ? message : "Unknown error";
    }

    private static final class TaskRecord {
        private final String taskId;
        private final ModelTask task;
        private final long sequence;
        private final int promptTokens;
        private final CompletableFuture<ModelResponse> result = new CompletableFuture<>();
        private volatile TaskStatus status = TaskStatus.QUEUED;

        private TaskRecord(String taskId, ModelTask task, long sequence, int promptTokens) {
            this.taskId = taskId;
            this.task = task;
            this.sequence = sequence;
            this.promptTokens = promptTokens;
        }
    }
}
