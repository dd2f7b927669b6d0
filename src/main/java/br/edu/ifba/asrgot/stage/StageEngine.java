package br.edu.ifba.asrgot.stage;

import br.edu.ifba.asrgot.core.ApiCredentials;
import br.edu.ifba.asrgot.core.GraphDocument;
import br.edu.ifba.asrgot.core.ResearchContext;
import br.edu.ifba.asrgot.core.ResearchStage;
import br.edu.ifba.asrgot.core.StageContext;
import br.edu.ifba.asrgot.core.StageResult;
import br.edu.ifba.asrgot.core.StageStatus;
import br.edu.ifba.asrgot.exception.EmptyQueryException;
import br.edu.ifba.asrgot.exception.InvalidStageNumberException;
import br.edu.ifba.asrgot.exception.MissingCredentialsException;
import br.edu.ifba.asrgot.exception.StagePrerequisiteNotMetException;
import br.edu.ifba.asrgot.scheduler.TaskScheduler;
import br.edu.ifba.asrgot.stage.handlers.CompositionHandler;
import br.edu.ifba.asrgot.stage.handlers.DecompositionHandler;
import br.edu.ifba.asrgot.stage.handlers.EvidenceIntegrationHandler;
import br.edu.ifba.asrgot.stage.handlers.FinalSynthesisHandler;
import br.edu.ifba.asrgot.stage.handlers.HypothesisGenerationHandler;
import br.edu.ifba.asrgot.stage.handlers.InitializationHandler;
import br.edu.ifba.asrgot.stage.handlers.PruningMergingHandler;
import br.edu.ifba.asrgot.stage.handlers.ReflectionHandler;
import br.edu.ifba.asrgot.stage.handlers.SubgraphExtractionHandler;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Runs the nine ASR-GoT stages for one research session.
 *
 * <p>Each call to {@link #executeStage(int, String)} checks its preconditions, hands the
 * stage's {@link StageHandler} copies of the graph and session state, and commits the
 * copies only when the handler returns. A failing stage leaves the graph untouched and
 * appends an error {@link StageContext}.</p>
 *
 * <h2>Usage:</h2>
 * <pre>{@code
 * StageEngine engine = StageEngine.builder()
 *     .scheduler(scheduler)
 *     .credentials(ApiCredentials.gemini(apiKey))
 *     .build();
 *
 * engine.executeStage(1, "How does sleep affect memory consolidation?");
 * for (int stage = 2; stage <= 9; stage++) {
 *     engine.executeStage(stage, null);
 * }
 * String report = engine.getFinalReport().orElseThrow();
 * }</pre>
 *
 * <p>Stage execution is synchronous and an engine is meant to be driven by one caller at
 * a time; public methods are synchronized so concurrent readers see committed state.</p>
 */
public class StageEngine {

    private static final Logger logger = LoggerFactory.getLogger(StageEngine.class);

    public static final String MDC_STAGE = "asrgot.stage";
    public static final String MDC_SESSION = "asrgot.session";

    private final String sessionId;
    private final TaskScheduler scheduler;
    private final ApiCredentials credentials;
    private final StageSettings settings;
    private final StageToolkit toolkit;
    private final Map<ResearchStage, StageHandler> handlers;

    private GraphDocument graph = new GraphDocument();
    private SessionState session = new SessionState();
    private final List<StageResult> stageResults = new ArrayList<>();
    private final List<StageContext> stageContexts = new ArrayList<>();

    private StageEngine(Builder builder) {
        this.sessionId = builder.sessionId != null ? builder.sessionId : UUID.randomUUID().toString();
        this.scheduler = Objects.requireNonNull(builder.scheduler, "scheduler must not be null");
        this.credentials = builder.credentials != null ? builder.credentials : ApiCredentials.NONE;
        this.settings = builder.settings != null ? builder.settings : StageSettings.defaults();
        this.toolkit = builder.toolkit != null ? builder.toolkit : StageToolkit.defaults();
        this.handlers = new EnumMap<>(ResearchStage.class);
        for (StageHandler handler : defaultHandlers(toolkit)) {
            handlers.put(handler.getStage(), handler);
        }
        handlers.putAll(builder.overrides);
    }

    /**
     * Executes one stage.
     *
     * @param stageNumber stage to run, 1 to 9
     * @param query       research question; required for stage 1, ignored otherwise
     * @return the result of the stage
     * @throws InvalidStageNumberException      stage outside [1, 9]
     * @throws EmptyQueryException              stage 1 without a query
     * @throws MissingCredentialsException      no credential configured
     * @throws StagePrerequisiteNotMetException previous stage not completed while ordering is enforced
     */
    @NotNull
    public synchronized StageResult executeStage(int stageNumber, @Nullable String query) {
        ResearchStage stage = checkPreconditions(stageNumber, query);
        StageHandler handler = handlers.get(stage);

        MDC.put(MDC_STAGE, String.valueOf(stageNumber));
        MDC.put(MDC_SESSION, sessionId);
        logger.info("Starting stage {} ({})", stageNumber, handler.getName());
        long startTime = System.currentTimeMillis();

        StageContext running = StageContext.running(stage);
        StageExecution execution = new StageExecution(stage, query, credentials, graph.copy(),
            session.copy(), settings, scheduler, stageContexts);
        try {
            StageOutcome outcome = handler.execute(execution);

            GraphDocument working = execution.getGraph();
            working.touch(stageNumber, toolkit.informationTheory().graphComplexity(working));
            StageContext completed = running.completed(execution.getTokenUsage(), execution.getModelCalls());

            graph = working;
            session = execution.getSession();
            stageContexts.add(completed);

            StageResult result = new StageResult(
                stageNumber,
                StageStatus.COMPLETED,
                outcome.content(),
                working.getNodes(),
                toolkit.algorithms().getValidEdges(working),
                toolkit.algorithms().getValidHyperedges(working),
                Instant.now(),
                new StageResult.Metadata(
                    System.currentTimeMillis() - startTime,
                    execution.getTokenUsage(),
                    toolkit.confidenceModel().aggregate(outcome.touchedNodes()),
                    outcome.figures()
                )
            );
            stageResults.add(result);

            logger.info("Stage {} completed in {}ms: {} nodes, {} edges, {} hyperedges",
                stageNumber, result.metadata().durationMs(), working.nodeCount(), working.edgeCount(),
                working.hyperedgeCount());
            return result;
        } catch (RuntimeException e) {
            stageContexts.add(running.failed(e.getMessage(), execution.getTokenUsage(), execution.getModelCalls()));
            logger.error("Stage {} failed: {}", stageNumber, e.getMessage(), e);
            throw e;
        } finally {
            MDC.remove(MDC_STAGE);
            MDC.remove(MDC_SESSION);
        }
    }

    private ResearchStage checkPreconditions(int stageNumber, @Nullable String query) {
        if (!ResearchStage.isValid(stageNumber)) {
            throw new InvalidStageNumberException(stageNumber);
        }
        ResearchStage stage = ResearchStage.of(stageNumber);
        if (stage == ResearchStage.INITIALIZATION && (query == null || query.isBlank())) {
            throw new EmptyQueryException();
        }
        if (!credentials.hasAny()) {
            throw new MissingCredentialsException("At least one API credential is required");
        }
        if (settings.enforceStageOrder() && stageNumber > ResearchStage.FIRST) {
            int required = stageNumber - 1;
            boolean satisfied = stageContexts.stream()
                .anyMatch(context -> context.stageId() == required && context.isCompleted());
            if (!satisfied) {
                throw new StagePrerequisiteNotMetException(stageNumber, required);
            }
        }
        return stage;
    }

    /**
     * Structural check of a stage result: valid stage number, a status, non-blank content and
     * a timestamp.
     */
    public boolean validateStageResult(@Nullable StageResult candidate) {
        if (candidate == null) {
            return false;
        }
        return ResearchStage.isValid(candidate.stage())
            && candidate.status() != null
            && candidate.content() != null
            && !candidate.content().isBlank()
            && candidate.timestamp() != null;
    }

    /**
     * Scalar confidence from a list of evidence texts.
     */
    public double calculateConfidence(@Nullable List<String> evidence) {
        return toolkit.confidenceModel().calculateConfidence(evidence);
    }

    /**
     * Copy of the committed graph.
     */
    @NotNull
    public synchronized GraphDocument getGraphData() {
        return graph.copy();
    }

    /**
     * Results of completed stages, oldest first. The returned list is a copy.
     */
    @NotNull
    public synchronized List<StageResult> getStageResults() {
        return new ArrayList<>(stageResults);
    }

    @NotNull
    public synchronized List<StageContext> getStageContexts() {
        return Collections.unmodifiableList(new ArrayList<>(stageContexts));
    }

    @NotNull
    public synchronized ResearchContext getResearchContext() {
        return session.getResearchContext();
    }

    /**
     * Report produced by stage 9, if it has run.
     */
    @NotNull
    public synchronized Optional<String> getFinalReport() {
        return session.getFinalReport();
    }

    @NotNull
    public String getSessionId() {
        return sessionId;
    }

    @NotNull
    public StageSettings getSettings() {
        return settings;
    }

    private static List<StageHandler> defaultHandlers(StageToolkit toolkit) {
        return List.of(
            new InitializationHandler(toolkit),
            new DecompositionHandler(toolkit),
            new HypothesisGenerationHandler(toolkit),
            new EvidenceIntegrationHandler(toolkit),
            new PruningMergingHandler(toolkit),
            new SubgraphExtractionHandler(toolkit),
            new CompositionHandler(toolkit),
            new ReflectionHandler(),
            new FinalSynthesisHandler(toolkit)
        );
    }

    /**
     * Creates a new builder for StageEngine.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for StageEngine.
     */
    public static class Builder {
        private String sessionId;
        private TaskScheduler scheduler;
        private ApiCredentials credentials;
        private StageSettings settings;
        private StageToolkit toolkit;
        private final Map<ResearchStage, StageHandler> overrides = new EnumMap<>(ResearchStage.class);

        public Builder sessionId(@NotNull String sessionId) {
            this.sessionId = sessionId;
            return this;
        }

        /**
         * Scheduler that runs the model calls. Required.
         */
        public Builder scheduler(@NotNull TaskScheduler scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        public Builder credentials(@NotNull ApiCredentials credentials) {
            this.credentials = credentials;
            return this;
        }

        public Builder settings(@NotNull StageSettings settings) {
            this.settings = settings;
            return this;
        }

        public Builder toolkit(@NotNull StageToolkit toolkit) {
            this.toolkit = toolkit;
            return this;
        }

        /**
         * Replaces the default handler of the handler's stage.
         */
        public Builder handler(@NotNull StageHandler handler) {
            this.overrides.put(handler.getStage(), handler);
            return this;
        }

        public StageEngine build() {
            if (scheduler == null) {
                throw new IllegalStateException("scheduler is required");
            }
            return new StageEngine(this);
        }
    }
}
