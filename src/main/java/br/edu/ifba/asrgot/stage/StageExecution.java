package br.edu.ifba.asrgot.stage;

import br.edu.ifba.asrgot.core.ApiCredentials;
import br.edu.ifba.asrgot.core.GraphDocument;
import br.edu.ifba.asrgot.core.GraphNode;
import br.edu.ifba.asrgot.core.ResearchContext;
import br.edu.ifba.asrgot.core.ResearchStage;
import br.edu.ifba.asrgot.core.StageContext;
import br.edu.ifba.asrgot.core.TokenUsage;
import br.edu.ifba.asrgot.llm.ModelOptions;
import br.edu.ifba.asrgot.llm.ModelRequest;
import br.edu.ifba.asrgot.llm.ModelResponse;
import br.edu.ifba.asrgot.scheduler.ModelTask;
import br.edu.ifba.asrgot.scheduler.TaskPriority;
import br.edu.ifba.asrgot.scheduler.TaskScheduler;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Working state of one stage run.
 *
 * <p>Carries copies of the session graph and state, the stage input, and access to the
 * task scheduler. Token usage and the number of model calls are accumulated as calls
 * complete so the engine can record them even when the stage fails.</p>
 */
public class StageExecution {

    private static final Logger logger = LoggerFactory.getLogger(StageExecution.class);

    private final ResearchStage stage;
    private final String query;
    private final ApiCredentials credentials;
    private final GraphDocument graph;
    private final SessionState session;
    private final StageSettings settings;
    private final TaskScheduler scheduler;
    private final List<StageContext> history;

    private TokenUsage tokenUsage = TokenUsage.ZERO;
    private int modelCalls;

    public StageExecution(@NotNull ResearchStage stage,
                          @Nullable String query,
                          @NotNull ApiCredentials credentials,
                          @NotNull GraphDocument graph,
                          @NotNull SessionState session,
                          @NotNull StageSettings settings,
                          @NotNull TaskScheduler scheduler,
                          @NotNull List<StageContext> history) {
        this.stage = Objects.requireNonNull(stage, "stage must not be null");
        this.query = query;
        this.credentials = Objects.requireNonNull(credentials, "credentials must not be null");
        this.graph = Objects.requireNonNull(graph, "graph must not be null");
        this.session = Objects.requireNonNull(session, "session must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.history = List.copyOf(history);
    }

    // =========================================================================
    // Requests
    // =========================================================================

    @NotNull
    public ModelRequest thinking(@NotNull String prompt) {
        return ModelRequest.thinking(prompt, credentials, options());
    }

    @NotNull
    public ModelRequest searchGrounded(@NotNull String prompt) {
        return ModelRequest.searchGrounded(prompt, credentials, options());
    }

    @NotNull
    public ModelRequest structured(@NotNull String prompt, @NotNull Map<String, Object> schema) {
        return ModelRequest.structured(prompt, credentials, schema, options());
    }

    /**
     * Enqueues one request and waits for its result.
     */
    @NotNull
    public String ask(@NotNull ModelRequest request, @NotNull TaskPriority priority, @NotNull Duration timeout) {
        return askAll(List.of(new ModelTask(request, priority)), timeout).get(0);
    }

    @NotNull
    public String ask(@NotNull ModelRequest request) {
        return ask(request, TaskPriority.MEDIUM, settings.resultTimeout());
    }

    /**
     * Enqueues every task before waiting on any of them, so they run concurrently up to the
     * scheduler's limit. Results come back in task order.
     *
     * @throws br.edu.ifba.asrgot.exception.AsrGotException the first failure met while collecting
     */
    @NotNull
    public List<String> askAll(@NotNull List<ModelTask> tasks, @NotNull Duration timeout) {
        List<String> taskIds = new ArrayList<>(tasks.size());
        for (ModelTask task : tasks) {
            taskIds.add(scheduler.enqueue(task));
        }
        logger.debug("Stage {} enqueued {} model tasks", stage.getNumber(), taskIds.size());

        List<String> texts = new ArrayList<>(taskIds.size());
        for (String taskId : taskIds) {
            ModelResponse response = scheduler.getResult(taskId, timeout);
            modelCalls++;
            tokenUsage = tokenUsage.plus(response.usage());
            texts.add(response.text());
        }
        return texts;
    }

    @NotNull
    public List<String> askAll(@NotNull List<ModelRequest> requests) {
        List<ModelTask> tasks = new ArrayList<>(requests.size());
        for (ModelRequest request : requests) {
            tasks.add(ModelTask.of(request));
        }
        return askAll(tasks, settings.resultTimeout());
    }

    // =========================================================================
    // Graph helpers
    // =========================================================================

    /**
     * Adds the node, or replaces the node with the same id.
     */
    public void upsertNode(@NotNull GraphNode node) {
        if (!graph.addNode(node)) {
            graph.updateNode(node);
        }
    }

    // =========================================================================
    // Accessors
    // =========================================================================

    @NotNull
    public ResearchStage getStage() {
        return stage;
    }

    @Nullable
    public String getQuery() {
        return query;
    }

    @NotNull
    public GraphDocument getGraph() {
        return graph;
    }

    @NotNull
    public SessionState getSession() {
        return session;
    }

    @NotNull
    public ResearchContext getResearchContext() {
        return session.getResearchContext();
    }

    @NotNull
    public StageSettings getSettings() {
        return settings;
    }

    /**
     * Stage contexts recorded before this run started.
     */
    @NotNull
    public List<StageContext> getHistory() {
        return history;
    }

    @NotNull
    public TokenUsage getTokenUsage() {
        return tokenUsage;
    }

    public int getModelCalls() {
        return modelCalls;
    }

    private ModelOptions options() {
        return ModelOptions.forStage("stage_" + stage.getNumber());
    }
}
