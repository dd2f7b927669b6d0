package br.edu.ifba.asrgot.extraction;

import br.edu.ifba.asrgot.core.ConfidenceVector;
import br.edu.ifba.asrgot.core.EdgeType;
import br.edu.ifba.asrgot.core.EvidenceQuality;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Optional;

/**
 * Turns loosely structured model output into structured fields.
 *
 * <p>Every method accepts null or blank text and then returns a fixed default:</p>
 * <ul>
 *   <li>field: {@code "General Science"}</li>
 *   <li>objectives: {@code ["Comprehensive analysis"]}</li>
 *   <li>confidence vector: {@code [0.8, 0.7, 0.9, 0.6]}</li>
 *   <li>statistical power: {@code 0.85}</li>
 * </ul>
 *
 * <p>Implementations must be deterministic for identical input.</p>
 */
public interface TextSignalExtractor {

    String DEFAULT_FIELD = "General Science";

    List<String> DEFAULT_OBJECTIVES = List.of("Comprehensive analysis");

    double DEFAULT_STATISTICAL_POWER = 0.85;

    @NotNull
    String extractField(@Nullable String text);

    @NotNull
    List<String> extractObjectives(@Nullable String text);

    /**
     * Content following a dimension label such as {@code "Scope:"}.
     *
     * @param category dimension label
     * @param field    research field used in the fallback sentence
     */
    @NotNull
    String extractDimensionContent(@Nullable String text, @NotNull String category, @NotNull String field);

    /**
     * Text of hypothesis {@code index} (1-based), found through markers such as
     * {@code "Hypothesis 2:"}, {@code "hypothesis_2"} or {@code "H2:"}.
     */
    @NotNull
    String extractHypothesisContent(@Nullable String text, int index, @NotNull String field);

    /**
     * Falsification criteria of hypothesis {@code index} (1-based).
     */
    @NotNull
    String extractFalsificationCriteria(@Nullable String text, int index, @NotNull String field);

    double extractStatisticalPower(@Nullable String text);

    double extractEmpiricalSupport(@Nullable String text);

    double extractTheoreticalBasis(@Nullable String text);

    double extractMethodologicalRigor(@Nullable String text);

    double extractConsensusAlignment(@Nullable String text);

    /**
     * Builds the four-dimensional confidence from keyword signals in the text.
     */
    @NotNull
    ConfidenceVector parseConfidenceVector(@Nullable String text);

    @NotNull
    EvidenceQuality assessEvidenceQuality(@Nullable String text);

    /**
     * "peer-reviewed", "preprint" or "unknown".
     */
    @NotNull
    String detectPeerReviewStatus(@Nullable String text);

    /**
     * Relation type signalled by causal, contradicting, correlational or temporal markers.
     *
     * @return empty when the text carries none of them
     */
    @NotNull
    Optional<EdgeType> detectRelationType(@Nullable String text);

    /**
     * Body of a Markdown or labelled section, up to the next heading or label.
     */
    @NotNull
    Optional<String> extractSection(@Nullable String text, @NotNull String heading);
}
