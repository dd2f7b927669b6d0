package br.edu.ifba.asrgot.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

import java.time.Duration;

/**
 * Configuration of the reasoning pipeline.
 *
 * All properties are read from application.properties with the prefix "asrgot".
 */
@ConfigMapping(prefix = "asrgot")
public interface AsrGotConfig {

    /**
     * Stage engine settings.
     */
    Pipeline pipeline();

    /**
     * Node similarity settings used when merging in stage 5.
     */
    Similarity similarity();

    /**
     * Task scheduler settings.
     */
    Scheduler scheduler();

    /**
     * Model call settings.
     */
    Model model();

    /**
     * Validates configuration at startup.
     * Throws IllegalArgumentException if invalid.
     */
    default void validate() {
        Similarity.Weight weight = similarity().weight();
        double weightSum = weight.jaccard() + weight.containment() + weight.edit() + weight.abbreviation();
        if (Math.abs(weightSum - 1.0) > 0.01) {
            throw new IllegalArgumentException(
                String.format(
                    "Similarity weights must sum to 1.0, got %.3f (jaccard=%.2f, containment=%.2f, edit=%.2f, abbrev=%.2f)",
                    weightSum, weight.jaccard(), weight.containment(), weight.edit(), weight.abbreviation()
                )
            );
        }

        if (similarity().threshold() < 0.0 || similarity().threshold() > 1.0) {
            throw new IllegalArgumentException(
                String.format("Similarity threshold must be in [0.0, 1.0], got %.3f", similarity().threshold())
            );
        }

        int hypotheses = pipeline().hypothesesPerDimension();
        if (hypotheses < 3 || hypotheses > 5) {
            throw new IllegalArgumentException(
                String.format("Hypotheses per dimension must be between 3 and 5, got %d", hypotheses)
            );
        }
    }

    interface Pipeline {

        /**
         * Rejects stage k unless stage k-1 has completed.
         */
        @WithName("enforce-stage-order")
        @WithDefault("true")
        boolean enforceStageOrder();

        /**
         * Mean-confidence floor below which stage 5 removes nodes.
         */
        @WithName("prune-threshold")
        @WithDefault("0.2")
        @Min(0)
        @Max(1)
        double pruneThreshold();

        /**
         * Impact threshold for the stage 6 subgraph.
         */
        @WithName("high-impact-threshold")
        @WithDefault("0.7")
        @Min(0)
        @Max(1)
        double highImpactThreshold();

        @WithName("hypotheses-per-dimension")
        @WithDefault("4")
        @Min(3)
        @Max(5)
        int hypothesesPerDimension();

        /**
         * Per-request polling timeout.
         */
        @WithName("result-timeout")
        @WithDefault("30S")
        Duration resultTimeout();

        /**
         * Polling timeout for the final report call.
         */
        @WithName("report-timeout")
        @WithDefault("120S")
        Duration reportTimeout();
    }

    interface Similarity {

        /**
         * Score at or above which two nodes are grouped for merging.
         */
        @WithDefault("0.75")
        double threshold();

        Weight weight();

        interface Weight {
            @WithDefault("0.35")
            double jaccard();

            @WithDefault("0.25")
            double containment();

            @WithDefault("0.30")
            double edit();

            @WithDefault("0.10")
            double abbreviation();
        }
    }

    interface Scheduler {

        @WithName("max-concurrent")
        @WithDefault("3")
        @Min(1)
        int maxConcurrent();

        /**
         * How long finished results stay retrievable.
         */
        @WithDefault("30S")
        Duration retention();
    }

    interface Model {

        @WithDefault("gemini-2.5-pro")
        String name();

        @WithDefault("0.4")
        double temperature();

        @WithName("max-output-tokens")
        @WithDefault("65536")
        int maxOutputTokens();

        @WithName("top-p")
        @WithDefault("0.8")
        double topP();

        @WithName("top-k")
        @WithDefault("40")
        int topK();

        /**
         * Prompts estimated above this many tokens are split into chunks.
         */
        @WithName("chunk-token-threshold")
        @WithDefault("200000")
        int chunkTokenThreshold();
    }
}
