package br.edu.ifba.asrgot.stage.handlers;

import br.edu.ifba.asrgot.algorithms.ConnectivitySummary;
import br.edu.ifba.asrgot.algorithms.GraphAlgorithms;
import br.edu.ifba.asrgot.core.GraphDocument;
import br.edu.ifba.asrgot.core.GraphNode;
import br.edu.ifba.asrgot.core.ResearchStage;
import br.edu.ifba.asrgot.stage.StageExecution;
import br.edu.ifba.asrgot.stage.StageHandler;
import br.edu.ifba.asrgot.stage.StageOutcome;
import br.edu.ifba.asrgot.stage.StageToolkit;
import org.jetbrains.annotations.NotNull;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Stage 6: selects the high-impact nodes and their neighbors for composition.
 *
 * <p>The session graph is not changed; the subgraph is kept in the session state.</p>
 */
public class SubgraphExtractionHandler implements StageHandler {

    static final double COMPLEXITY_PER_COMPONENT = 0.3;

    private static final int LISTED_NODES = 15;

    private final GraphAlgorithms algorithms;

    public SubgraphExtractionHandler(@NotNull StageToolkit toolkit) {
        this.algorithms = toolkit.algorithms();
    }

    @Override
    @NotNull
    public ResearchStage getStage() {
        return ResearchStage.SUBGRAPH_EXTRACTION;
    }

    @Override
    @NotNull
    public StageOutcome execute(@NotNull StageExecution execution) {
        double threshold = execution.getSettings().highImpactThreshold();
        GraphDocument subgraph = algorithms.extractHighImpactSubgraph(execution.getGraph(), threshold, true);
        ConnectivitySummary connectivity = algorithms.summarizeConnectivity(subgraph);
        execution.getSession().setExtractedSubgraph(subgraph);

        Map<String, Number> figures = new LinkedHashMap<>();
        figures.put("subgraph_nodes", subgraph.nodeCount());
        figures.put("subgraph_edges", subgraph.edgeCount());
        figures.put("components", connectivity.components());
        figures.put("paths", connectivity.paths());
        figures.put("complexity_score", connectivity.components() * COMPLEXITY_PER_COMPONENT);

        return new StageOutcome(buildContent(subgraph, threshold, connectivity), subgraph.getNodes(), figures);
    }

    private String buildContent(GraphDocument subgraph, double threshold, ConnectivitySummary connectivity) {
        StringBuilder content = new StringBuilder();
        content.append("# Stage 6: Subgraph Extraction Complete\n\n");
        content.append(String.format(Locale.ROOT, "Impact threshold: %.2f%n%n", threshold));
        content.append("- Nodes: ").append(subgraph.nodeCount()).append('\n');
        content.append("- Edges: ").append(subgraph.edgeCount()).append('\n');
        content.append("- Components: ").append(connectivity.components()).append('\n');
        content.append("- Paths: ").append(connectivity.paths()).append("\n\n");

        List<GraphNode> ranked = subgraph.getNodes().stream()
            .sorted(Comparator.comparingDouble(GraphNode::impactScore).reversed())
            .limit(LISTED_NODES)
            .collect(Collectors.toList());
        if (!ranked.isEmpty()) {
            content.append("## Highest Impact Nodes\n");
            for (GraphNode node : ranked) {
                content.append(String.format(Locale.ROOT, "- %s (%s, impact %.2f)%n",
                    node.getLabel(), node.getType().getValue(), node.impactScore()));
            }
        }
        return content.toString();
    }
}
