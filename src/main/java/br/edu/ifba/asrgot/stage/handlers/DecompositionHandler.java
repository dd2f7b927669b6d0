package br.edu.ifba.asrgot.stage.handlers;

import br.edu.ifba.asrgot.core.ConfidenceVector;
import br.edu.ifba.asrgot.core.EdgeType;
import br.edu.ifba.asrgot.core.GraphEdge;
import br.edu.ifba.asrgot.core.GraphNode;
import br.edu.ifba.asrgot.core.NodeMetadata;
import br.edu.ifba.asrgot.core.NodeType;
import br.edu.ifba.asrgot.core.ResearchContext;
import br.edu.ifba.asrgot.core.ResearchStage;
import br.edu.ifba.asrgot.extraction.TextSignalExtractor;
import br.edu.ifba.asrgot.scheduler.TaskPriority;
import br.edu.ifba.asrgot.stage.StageExecution;
import br.edu.ifba.asrgot.stage.StageHandler;
import br.edu.ifba.asrgot.stage.StageOutcome;
import br.edu.ifba.asrgot.stage.StageToolkit;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Stage 2: splits the task into seven dimension nodes linked from the root.
 */
public class DecompositionHandler implements StageHandler {

    public static final List<String> DIMENSIONS = List.of(
        "Scope", "Objectives", "Constraints", "Data Needs", "Use Cases", "Potential Biases", "Knowledge Gaps");

    public static final ConfidenceVector DIMENSION_CONFIDENCE = new ConfidenceVector(0.7, 0.8, 0.7, 0.7);

    static final double ROOT_EDGE_CONFIDENCE = 0.8;

    private final TextSignalExtractor extractor;

    public DecompositionHandler(@NotNull StageToolkit toolkit) {
        this.extractor = toolkit.extractor();
    }

    @Override
    @NotNull
    public ResearchStage getStage() {
        return ResearchStage.DECOMPOSITION;
    }

    @Override
    @NotNull
    public StageOutcome execute(@NotNull StageExecution execution) {
        ResearchContext context = execution.getResearchContext();
        String analysis = execution.ask(execution.thinking(buildPrompt(context)), TaskPriority.HIGH,
            execution.getSettings().resultTimeout());

        List<GraphNode> dimensions = new ArrayList<>();
        for (int i = 0; i < DIMENSIONS.size(); i++) {
            String label = DIMENSIONS.get(i);
            GraphNode node = GraphNode.builder()
                .id(dimensionId(i + 1, label))
                .label(label)
                .type(NodeType.DIMENSION)
                .confidence(DIMENSION_CONFIDENCE)
                .metadata(NodeMetadata.builder()
                    .stage(ResearchStage.DECOMPOSITION.getNumber())
                    .impactScore(i < 3 ? 0.9 : 0.7)
                    .addTag(context.field())
                    .value(extractor.extractDimensionContent(analysis, label, context.field()))
                    .notes("Dimension analysis for " + context.field())
                    .build())
                .build();
            execution.upsertNode(node);
            execution.getGraph().addEdge(GraphEdge.of("edge_root_" + node.getId(), InitializationHandler.ROOT_ID,
                node.getId(), EdgeType.SUPPORTIVE, ROOT_EDGE_CONFIDENCE));
            dimensions.add(node);
        }

        return new StageOutcome(buildContent(context, dimensions), dimensions,
            Map.of("dimension_nodes", dimensions.size()));
    }

    /**
     * {@code n{index}_{lower_snake_label}}, e.g. {@code n4_data_needs}.
     */
    static String dimensionId(int index, String label) {
        return "n" + index + "_" + label.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "_");
    }

    private String buildPrompt(ResearchContext context) {
        return """
            Based on this research context, create a detailed dimension analysis:

            **Research Field**: %s
            **Research Topic**: %s
            **Current Objectives**: %s

            Analyze each dimension:

            1. **Scope**: Define precise boundaries and scale of investigation
            2. **Objectives**: Refine and expand specific research goals
            3. **Constraints**: Identify limitations, resources, ethical considerations
            4. **Data Needs**: Specify required data types, sources, quality criteria
            5. **Use Cases**: Practical applications and stakeholder benefits
            6. **Potential Biases**: Cognitive and systematic biases to watch for
            7. **Knowledge Gaps**: Current limitations in understanding

            For each dimension provide a detailed description (2-3 sentences), specific
            considerations for %s, a priority level (High/Medium/Low) and its
            interconnections with other dimensions. Start each dimension with its name
            followed by a colon.
            """.formatted(context.field(), context.topic(), String.join(", ", context.objectives()),
                context.field());
    }

    private String buildContent(ResearchContext context, List<GraphNode> dimensions) {
        StringBuilder content = new StringBuilder();
        content.append("# Stage 2: Decomposition Complete\n\n");
        content.append("**Field**: ").append(context.field()).append("\n\n");
        content.append("## Dimensions\n");
        for (GraphNode dimension : dimensions) {
            content.append("### ").append(dimension.getLabel()).append(" (").append(dimension.getId()).append(")\n");
            content.append(dimension.getMetadata().value()).append("\n\n");
        }
        return content.toString();
    }
}
