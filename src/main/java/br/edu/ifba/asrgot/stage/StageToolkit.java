package br.edu.ifba.asrgot.stage;

import br.edu.ifba.asrgot.algorithms.GraphAlgorithms;
import br.edu.ifba.asrgot.algorithms.HyperedgeBuilder;
import br.edu.ifba.asrgot.algorithms.NodeSimilarityCalculator;
import br.edu.ifba.asrgot.confidence.ConfidenceModel;
import br.edu.ifba.asrgot.confidence.InformationTheory;
import br.edu.ifba.asrgot.extraction.HeuristicTextSignalExtractor;
import br.edu.ifba.asrgot.extraction.TextSignalExtractor;
import br.edu.ifba.asrgot.report.MarkdownReportExporter;
import br.edu.ifba.asrgot.report.ReportExporter;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * Stateless collaborators shared by the stage handlers.
 */
public record StageToolkit(
    TextSignalExtractor extractor,
    ConfidenceModel confidenceModel,
    InformationTheory informationTheory,
    GraphAlgorithms algorithms,
    HyperedgeBuilder hyperedgeBuilder,
    ReportExporter reportExporter
) {

    public static final double DEFAULT_SIMILARITY_THRESHOLD = 0.75;

    public StageToolkit {
        Objects.requireNonNull(extractor, "extractor must not be null");
        Objects.requireNonNull(confidenceModel, "confidenceModel must not be null");
        Objects.requireNonNull(informationTheory, "informationTheory must not be null");
        Objects.requireNonNull(algorithms, "algorithms must not be null");
        Objects.requireNonNull(hyperedgeBuilder, "hyperedgeBuilder must not be null");
        Objects.requireNonNull(reportExporter, "reportExporter must not be null");
    }

    /**
     * Heuristic extraction, default similarity weights and threshold, Markdown reports.
     */
    @NotNull
    public static StageToolkit defaults() {
        return new StageToolkit(
            new HeuristicTextSignalExtractor(),
            new ConfidenceModel(),
            new InformationTheory(),
            new GraphAlgorithms(new NodeSimilarityCalculator(), DEFAULT_SIMILARITY_THRESHOLD),
            new HyperedgeBuilder(),
            new MarkdownReportExporter()
        );
    }
}
