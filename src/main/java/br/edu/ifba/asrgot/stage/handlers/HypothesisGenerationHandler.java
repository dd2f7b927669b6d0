package br.edu.ifba.asrgot.stage.handlers;

import br.edu.ifba.asrgot.core.ConfidenceVector;
import br.edu.ifba.asrgot.core.EdgeType;
import br.edu.ifba.asrgot.core.GraphEdge;
import br.edu.ifba.asrgot.core.GraphNode;
import br.edu.ifba.asrgot.core.HypothesisDetails;
import br.edu.ifba.asrgot.core.NodeMetadata;
import br.edu.ifba.asrgot.core.NodeType;
import br.edu.ifba.asrgot.core.ResearchContext;
import br.edu.ifba.asrgot.core.ResearchStage;
import br.edu.ifba.asrgot.extraction.TextSignalExtractor;
import br.edu.ifba.asrgot.scheduler.ModelTask;
import br.edu.ifba.asrgot.scheduler.TaskPriority;
import br.edu.ifba.asrgot.stage.StageExecution;
import br.edu.ifba.asrgot.stage.StageHandler;
import br.edu.ifba.asrgot.stage.StageOutcome;
import br.edu.ifba.asrgot.stage.StageToolkit;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Stage 3: generates testable hypotheses with falsification criteria for every dimension.
 *
 * <p>One model call per dimension, all queued before any result is awaited. Hypothesis
 * {@code i} of dimension {@code d} gets id {@code h{d}_{i}} and impact {@code 0.6 + 0.1 (i - 1)}.</p>
 */
public class HypothesisGenerationHandler implements StageHandler {

    static final double DIMENSION_EDGE_CONFIDENCE = 0.7;

    private final TextSignalExtractor extractor;

    public HypothesisGenerationHandler(@NotNull StageToolkit toolkit) {
        this.extractor = toolkit.extractor();
    }

    @Override
    @NotNull
    public ResearchStage getStage() {
        return ResearchStage.HYPOTHESIS_GENERATION;
    }

    @Override
    @NotNull
    public StageOutcome execute(@NotNull StageExecution execution) {
        ResearchContext context = execution.getResearchContext();
        int perDimension = execution.getSettings().hypothesesPerDimension();
        List<GraphNode> dimensions = execution.getGraph().nodesOfType(NodeType.DIMENSION);

        List<ModelTask> tasks = new ArrayList<>(dimensions.size());
        for (GraphNode dimension : dimensions) {
            tasks.add(new ModelTask(execution.thinking(buildPrompt(context, dimension, perDimension)),
                TaskPriority.HIGH));
        }
        List<String> responses = execution.askAll(tasks, execution.getSettings().resultTimeout());

        List<GraphNode> hypotheses = new ArrayList<>();
        for (int d = 0; d < dimensions.size(); d++) {
            GraphNode dimension = dimensions.get(d);
            String analysis = responses.get(d);
            for (int i = 1; i <= perDimension; i++) {
                GraphNode hypothesis = buildHypothesis(dimension, analysis, i, context.field());
                execution.upsertNode(hypothesis);
                execution.getGraph().addEdge(GraphEdge.of("edge_" + dimension.getId() + "_" + hypothesis.getId(),
                    dimension.getId(), hypothesis.getId(), EdgeType.SUPPORTIVE, DIMENSION_EDGE_CONFIDENCE));
                hypotheses.add(hypothesis);
            }
        }

        List<String> texts = new ArrayList<>(hypotheses.size());
        for (GraphNode hypothesis : hypotheses) {
            texts.add(hypothesis.getMetadata().value());
        }
        execution.getSession().setResearchContext(context.withHypotheses(texts));

        Map<String, Number> figures = new LinkedHashMap<>();
        figures.put("hypothesis_nodes", hypotheses.size());
        figures.put("dimensions", dimensions.size());

        return new StageOutcome(buildContent(dimensions, hypotheses), hypotheses, figures);
    }

    private GraphNode buildHypothesis(GraphNode dimension, String analysis, int index, String field) {
        ConfidenceVector confidence = extractor.extractSection(analysis, "Hypothesis " + index)
            .map(extractor::parseConfidenceVector)
            .orElse(ConfidenceVector.DEFAULT);

        return GraphNode.builder()
            .id("h" + dimension.getId() + "_" + index)
            .label("Hypothesis " + index + ": " + dimension.getLabel())
            .type(NodeType.HYPOTHESIS)
            .confidence(confidence)
            .metadata(NodeMetadata.builder()
                .stage(ResearchStage.HYPOTHESIS_GENERATION.getNumber())
                .impactScore(Math.min(1.0, 0.6 + 0.1 * (index - 1)))
                .addTag(field)
                .value(extractor.extractHypothesisContent(analysis, index, field))
                .notes("Generated for " + dimension.getLabel() + " dimension")
                .hypothesis(new HypothesisDetails(
                    extractor.extractFalsificationCriteria(analysis, index, field), dimension.getId()))
                .build())
            .build();
    }

    private String buildPrompt(ResearchContext context, GraphNode dimension, int count) {
        return """
            Generate %d testable hypotheses for the %s dimension in %s research.

            **Research Context**: %s
            **Dimension Focus**: %s
            **Dimension Content**: %s

            For each hypothesis, provide:
            1. **Hypothesis Statement**: Clear, testable proposition
            2. **Falsification Criteria**: How it could be proven wrong
            3. **Testing Approach**: Methodology for validation
            4. **Expected Impact**: Potential significance if confirmed
            5. **Resource Requirements**: What is needed to test it

            Start each one with "Hypothesis N:" where N is its number. Keep them
            scientifically rigorous, relevant to %s and varying in scope from broad to specific.
            """.formatted(count, dimension.getLabel(), context.field(), context.topic(),
                dimension.getLabel(), dimension.getMetadata().value(), context.field());
    }

    private String buildContent(List<GraphNode> dimensions, List<GraphNode> hypotheses) {
        StringBuilder content = new StringBuilder();
        content.append("# Stage 3: Hypothesis Generation Complete\n\n");
        content.append("Generated ").append(hypotheses.size()).append(" hypotheses across ")
            .append(dimensions.size()).append(" dimensions.\n\n");
        for (GraphNode dimension : dimensions) {
            content.append("### ").append(dimension.getLabel()).append('\n');
            for (GraphNode hypothesis : hypotheses) {
                HypothesisDetails details = hypothesis.getMetadata().hypothesis();
                if (details == null || !dimension.getId().equals(details.dimensionId())) {
                    continue;
                }
                content.append("- **").append(hypothesis.getId()).append("**: ")
                    .append(abbreviate(hypothesis.getMetadata().value(), 150)).append('\n');
                content.append("  - Falsification: ").append(abbreviate(details.falsificationCriteria(), 100)).append('\n');
            }
            content.append('\n');
        }
        return content.toString();
    }

    static String abbreviate(String text, int max) {
        if (text == null) {
            return "";
        }
        String trimmed = text.trim();
        return trimmed.length() <= max ? trimmed : trimmed.substring(0, max) + "...";
    }
}
