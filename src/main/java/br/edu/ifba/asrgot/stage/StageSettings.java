package br.edu.ifba.asrgot.stage;

import br.edu.ifba.asrgot.config.AsrGotConfig;
import org.jetbrains.annotations.NotNull;

import java.time.Duration;
import java.util.Objects;

/**
 * Tunables read by the stage engine and its handlers.
 *
 * @param enforceStageOrder      reject stage k unless stage k-1 completed
 * @param pruneThreshold         mean-confidence floor used by stage 5
 * @param highImpactThreshold    impact threshold used by stage 6
 * @param hypothesesPerDimension hypotheses requested per dimension in stage 3 (3 to 5)
 * @param resultTimeout          polling timeout for a single model call
 * @param reportTimeout          polling timeout for the stage 9 report call
 */
public record StageSettings(
    boolean enforceStageOrder,
    double pruneThreshold,
    double highImpactThreshold,
    int hypothesesPerDimension,
    Duration resultTimeout,
    Duration reportTimeout
) {

    public static final int MIN_HYPOTHESES = 3;
    public static final int MAX_HYPOTHESES = 5;

    public StageSettings {
        Objects.requireNonNull(resultTimeout, "resultTimeout must not be null");
        Objects.requireNonNull(reportTimeout, "reportTimeout must not be null");
        if (hypothesesPerDimension < MIN_HYPOTHESES || hypothesesPerDimension > MAX_HYPOTHESES) {
            throw new IllegalArgumentException(
                "hypothesesPerDimension must be between 3 and 5, got: " + hypothesesPerDimension);
        }
    }

    @NotNull
    public static StageSettings defaults() {
        return new StageSettings(true, 0.2, 0.7, 4, Duration.ofSeconds(30), Duration.ofSeconds(120));
    }

    @NotNull
    public static StageSettings from(@NotNull AsrGotConfig config) {
        AsrGotConfig.Pipeline pipeline = config.pipeline();
        return new StageSettings(
            pipeline.enforceStageOrder(),
            pipeline.pruneThreshold(),
            pipeline.highImpactThreshold(),
            pipeline.hypothesesPerDimension(),
            pipeline.resultTimeout(),
            pipeline.reportTimeout()
        );
    }

    @NotNull
    public StageSettings withEnforceStageOrder(boolean enforce) {
        return new StageSettings(enforce, pruneThreshold, highImpactThreshold, hypothesesPerDimension,
            resultTimeout, reportTimeout);
    }
}
