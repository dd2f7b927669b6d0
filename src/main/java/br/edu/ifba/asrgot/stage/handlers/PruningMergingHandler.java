package br.edu.ifba.asrgot.stage.handlers;

import br.edu.ifba.asrgot.algorithms.GraphAlgorithms;
import br.edu.ifba.asrgot.confidence.InformationTheory;
import br.edu.ifba.asrgot.core.GraphDocument;
import br.edu.ifba.asrgot.core.GraphNode;
import br.edu.ifba.asrgot.core.ResearchStage;
import br.edu.ifba.asrgot.stage.StageExecution;
import br.edu.ifba.asrgot.stage.StageHandler;
import br.edu.ifba.asrgot.stage.StageOutcome;
import br.edu.ifba.asrgot.stage.StageToolkit;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Stage 5: removes low-confidence nodes and merges near-duplicates.
 *
 * <p>No model call. Pruning runs first so pruned nodes never survive a merge. Relations
 * left dangling by either step are dropped from the committed graph.</p>
 */
public class PruningMergingHandler implements StageHandler {

    private final GraphAlgorithms algorithms;
    private final InformationTheory informationTheory;

    public PruningMergingHandler(@NotNull StageToolkit toolkit) {
        this.algorithms = toolkit.algorithms();
        this.informationTheory = toolkit.informationTheory();
    }

    @Override
    @NotNull
    public ResearchStage getStage() {
        return ResearchStage.PRUNING_MERGING;
    }

    @Override
    @NotNull
    public StageOutcome execute(@NotNull StageExecution execution) {
        GraphDocument graph = execution.getGraph();
        double complexityBefore = informationTheory.graphComplexity(graph);
        int nodesBefore = graph.nodeCount();

        List<String> pruned = algorithms.pruneLowConfidence(graph, execution.getSettings().pruneThreshold());
        Map<String, String> redirects = algorithms.mergeSimilarNodes(graph);

        graph.replaceEdges(algorithms.getValidEdges(graph));
        graph.replaceHyperedges(algorithms.getValidHyperedges(graph));

        double complexityAfter = informationTheory.graphComplexity(graph);
        double gain = informationTheory.informationGain(complexityBefore, complexityAfter);

        Set<String> survivors = new LinkedHashSet<>(redirects.values());
        List<GraphNode> merged = new ArrayList<>();
        for (String id : survivors) {
            graph.getNode(id).ifPresent(merged::add);
        }

        Map<String, Number> figures = new LinkedHashMap<>();
        figures.put("pruned_nodes", pruned.size());
        figures.put("merged_nodes", redirects.size());
        figures.put("information_gain", gain);
        figures.put("node_count", graph.nodeCount());
        figures.put("edge_count", graph.edgeCount());

        List<GraphNode> scored = merged.isEmpty() ? graph.getNodes() : merged;
        return new StageOutcome(
            buildContent(nodesBefore, graph, pruned, redirects, complexityBefore, complexityAfter, gain),
            scored, figures);
    }

    private String buildContent(int nodesBefore, GraphDocument graph, List<String> pruned,
                                Map<String, String> redirects, double before, double after, double gain) {
        StringBuilder content = new StringBuilder();
        content.append("# Stage 5: Pruning/Merging Complete\n\n");
        content.append("- Nodes before: ").append(nodesBefore).append('\n');
        content.append("- Pruned: ").append(pruned.size()).append('\n');
        content.append("- Merged: ").append(redirects.size()).append('\n');
        content.append("- Nodes after: ").append(graph.nodeCount()).append('\n');
        content.append("- Edges after: ").append(graph.edgeCount()).append("\n\n");
        content.append(String.format(Locale.ROOT, "Complexity %.3f -> %.3f (information gain %.3f)%n",
            before, after, gain));
        if (!pruned.isEmpty()) {
            content.append("\n## Pruned Nodes\n");
            for (String id : pruned) {
                content.append("- ").append(id).append('\n');
            }
        }
        if (!redirects.isEmpty()) {
            content.append("\n## Merged Nodes\n");
            redirects.forEach((absorbed, survivor) ->
                content.append("- ").append(absorbed).append(" -> ").append(survivor).append('\n'));
        }
        return content.toString();
    }
}
