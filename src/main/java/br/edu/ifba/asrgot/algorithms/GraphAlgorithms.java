package br.edu.ifba.asrgot.algorithms;

import br.edu.ifba.asrgot.core.ConfidenceVector;
import br.edu.ifba.asrgot.core.GraphDocument;
import br.edu.ifba.asrgot.core.GraphEdge;
import br.edu.ifba.asrgot.core.GraphNode;
import br.edu.ifba.asrgot.core.HyperEdge;
import br.edu.ifba.asrgot.core.NodeType;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Structural operations over a {@link GraphDocument}: similarity grouping and merging,
 * pruning, rewiring, validity filtering, subgraph extraction and connectivity counts.
 *
 * <p>Stateless apart from its configuration; safe to share between sessions.</p>
 */
public class GraphAlgorithms {

    private static final Logger logger = LoggerFactory.getLogger(GraphAlgorithms.class);

    private final NodeSimilarityCalculator similarityCalculator;
    private final double similarityThreshold;

    public GraphAlgorithms(@NotNull NodeSimilarityCalculator similarityCalculator, double similarityThreshold) {
        if (similarityThreshold < 0.0 || similarityThreshold > 1.0) {
            throw new IllegalArgumentException("similarityThreshold must be in [0.0, 1.0], got: " + similarityThreshold);
        }
        this.similarityCalculator = Objects.requireNonNull(similarityCalculator, "similarityCalculator must not be null");
        this.similarityThreshold = similarityThreshold;
    }

    public double getSimilarityThreshold() {
        return similarityThreshold;
    }

    // =========================================================================
    // Grouping and merging
    // =========================================================================

    /**
     * Groups nodes whose labels are similar.
     *
     * Algorithm (threshold-based connected components):
     * 1. Link two nodes of the same type when their similarity reaches the threshold
     * 2. Each connected component becomes a group
     *
     * Groups and their members keep the input order, so the first member of a group is
     * the earliest node in the input. Singletons are returned as groups of size one.
     *
     * @param nodes nodes to group
     * @return groups of nodes, empty for empty input
     */
    @NotNull
    public List<List<GraphNode>> identifySimilarNodes(@NotNull Collection<GraphNode> nodes) {
        List<GraphNode> list = new ArrayList<>(nodes);
        int n = list.size();
        List<List<GraphNode>> groups = new ArrayList<>();
        if (n == 0) {
            return groups;
        }

        boolean[][] linked = new boolean[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                boolean similar = similarityCalculator
                    .computeSimilarity(list.get(i), list.get(j))
                    .isAbove(similarityThreshold);
                linked[i][j] = similar;
                linked[j][i] = similar;
            }
        }

        boolean[] visited = new boolean[n];
        for (int i = 0; i < n; i++) {
            if (visited[i]) {
                continue;
            }
            Set<Integer> component = new TreeSet<>();
            dfs(i, visited, component, linked, n);
            List<GraphNode> group = new ArrayList<>(component.size());
            for (int index : component) {
                group.add(list.get(index));
            }
            groups.add(group);
        }
        return groups;
    }

    private void dfs(int node, boolean[] visited, Set<Integer> component, boolean[][] linked, int n) {
        visited[node] = true;
        component.add(node);
        for (int neighbor = 0; neighbor < n; neighbor++) {
            if (!visited[neighbor] && linked[node][neighbor]) {
                dfs(neighbor, visited, component, linked, n);
            }
        }
    }

    /**
     * Merges a group into one node.
     *
     * <p>The first member keeps its id, label and type. Confidence is the arithmetic mean of
     * all members, tags are unioned, evidence counts summed and the maximum impact kept.</p>
     *
     * @throws IllegalArgumentException if the group is empty
     */
    @NotNull
    public GraphNode mergeNodes(@NotNull List<GraphNode> group) {
        if (group == null || group.isEmpty()) {
            throw new IllegalArgumentException("group cannot be null or empty");
        }
        GraphNode first = group.get(0);
        if (group.size() == 1) {
            return first;
        }

        List<ConfidenceVector> vectors = new ArrayList<>(group.size());
        var metadata = first.getMetadata();
        for (GraphNode node : group) {
            vectors.add(node.getConfidence());
            if (node != first) {
                metadata = metadata.mergeWith(node.getMetadata());
            }
        }
        return first
            .withConfidence(ConfidenceVector.average(vectors))
            .withMetadata(metadata);
    }

    /**
     * Groups the graph's nodes, merges every group of size greater than one into its first
     * member and rewires relations to the survivors. The root node is never merged.
     *
     * @return ids of the removed (absorbed) nodes mapped to their survivor
     */
    @NotNull
    public Map<String, String> mergeSimilarNodes(@NotNull GraphDocument graph) {
        List<GraphNode> candidates = graph.findNodes(node -> node.getType() != NodeType.ROOT);
        Map<String, String> redirects = new LinkedHashMap<>();

        for (List<GraphNode> group : identifySimilarNodes(candidates)) {
            if (group.size() < 2) {
                continue;
            }
            GraphNode merged = mergeNodes(group);
            graph.updateNode(merged);
            for (GraphNode absorbed : group.subList(1, group.size())) {
                graph.removeNode(absorbed.getId());
                redirects.put(absorbed.getId(), merged.getId());
            }
            logger.debug("Merged {} nodes into {}", group.size(), merged.getId());
        }

        if (!redirects.isEmpty()) {
            rewireEdges(graph, redirects);
        }
        return redirects;
    }

    /**
     * Redirects edges and hyperedges from absorbed ids to their survivors.
     *
     * <p>Self-loops created by the redirect are dropped, as are edges duplicating an
     * earlier edge with the same source, target and type. Hyperedges left with fewer than
     * two distinct members are dropped.</p>
     */
    public void rewireEdges(@NotNull GraphDocument graph, @NotNull Map<String, String> redirects) {
        List<GraphEdge> rewired = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (GraphEdge edge : graph.getEdges()) {
            GraphEdge current = edge;
            for (Map.Entry<String, String> redirect : redirects.entrySet()) {
                current = current.redirect(redirect.getKey(), redirect.getValue());
            }
            if (current.isSelfLoop()) {
                continue;
            }
            String key = current.source() + "->" + current.target() + ":" + current.type();
            if (seen.add(key)) {
                rewired.add(current);
            }
        }
        graph.replaceEdges(rewired);

        List<HyperEdge> hyperedges = new ArrayList<>();
        for (HyperEdge hyperedge : graph.getHyperedges()) {
            HyperEdge current = hyperedge;
            for (Map.Entry<String, String> redirect : redirects.entrySet()) {
                if (current == null) {
                    break;
                }
                current = current.redirect(redirect.getKey(), redirect.getValue());
            }
            if (current != null) {
                hyperedges.add(current);
            }
        }
        graph.replaceHyperedges(hyperedges);
    }

    // =========================================================================
    // Pruning
    // =========================================================================

    /**
     * Removes nodes whose mean confidence is below {@code floor}. The root is never removed.
     *
     * @return ids of the removed nodes
     */
    @NotNull
    public List<String> pruneLowConfidence(@NotNull GraphDocument graph, double floor) {
        List<String> removed = new ArrayList<>();
        for (GraphNode node : graph.getNodes()) {
            if (node.getType() == NodeType.ROOT) {
                continue;
            }
            if (node.getConfidence().mean() < floor) {
                graph.removeNode(node.getId());
                removed.add(node.getId());
            }
        }
        if (!removed.isEmpty()) {
            logger.debug("Pruned {} nodes below mean confidence {}", removed.size(), floor);
        }
        return removed;
    }

    // =========================================================================
    // Valid views
    // =========================================================================

    /**
     * Edges whose endpoints both exist, with missing weights defaulted to the confidence
     * (or 0.5 when that is missing too).
     */
    @NotNull
    public List<GraphEdge> getValidEdges(@NotNull GraphDocument graph) {
        List<GraphEdge> valid = new ArrayList<>();
        for (GraphEdge edge : graph.getEdges()) {
            if (graph.containsNode(edge.source()) && graph.containsNode(edge.target())) {
                valid.add(edge.resolved());
            }
        }
        return valid;
    }

    /**
     * Hyperedges whose members all exist.
     */
    @NotNull
    public List<HyperEdge> getValidHyperedges(@NotNull GraphDocument graph) {
        List<HyperEdge> valid = new ArrayList<>();
        for (HyperEdge hyperedge : graph.getHyperedges()) {
            if (hyperedge.nodes().stream().allMatch(graph::containsNode)) {
                valid.add(hyperedge);
            }
        }
        return valid;
    }

    // =========================================================================
    // Subgraphs
    // =========================================================================

    /**
     * Node-induced subgraph over the nodes whose impact score exceeds {@code threshold}.
     */
    @NotNull
    public GraphDocument extractHighImpactSubgraph(@NotNull GraphDocument graph, double threshold) {
        return extractHighImpactSubgraph(graph, threshold, false);
    }

    /**
     * Subgraph over the nodes whose impact score exceeds {@code threshold}, optionally
     * extended with their immediate neighbors. Only valid edges and hyperedges fully inside
     * the selection are kept.
     */
    @NotNull
    public GraphDocument extractHighImpactSubgraph(@NotNull GraphDocument graph, double threshold,
                                                   boolean includeNeighbors) {
        Set<String> selected = new LinkedHashSet<>();
        for (GraphNode node : graph.getNodes()) {
            if (node.impactScore() > threshold) {
                selected.add(node.getId());
            }
        }

        List<GraphEdge> validEdges = getValidEdges(graph);
        if (includeNeighbors) {
            for (String nodeId : new ArrayList<>(selected)) {
                selected.addAll(neighbors(validEdges, nodeId));
            }
        }

        GraphDocument subgraph = new GraphDocument();
        for (GraphNode node : graph.getNodes()) {
            if (selected.contains(node.getId())) {
                subgraph.addNode(node);
            }
        }
        for (GraphEdge edge : validEdges) {
            if (selected.contains(edge.source()) && selected.contains(edge.target())) {
                subgraph.addEdge(edge);
            }
        }
        for (HyperEdge hyperedge : getValidHyperedges(graph)) {
            if (selected.containsAll(hyperedge.nodes())) {
                subgraph.addHyperedge(hyperedge);
            }
        }
        subgraph.setMetadata(graph.getMetadata());
        return subgraph;
    }

    private static Set<String> neighbors(List<GraphEdge> edges, String nodeId) {
        Set<String> result = new LinkedHashSet<>();
        for (GraphEdge edge : edges) {
            if (edge.source().equals(nodeId)) {
                result.add(edge.target());
            } else if (edge.target().equals(nodeId)) {
                result.add(edge.source());
            }
        }
        return result;
    }

    // =========================================================================
    // Connectivity
    // =========================================================================

    /**
     * Number of weakly connected components over valid edges. Isolated nodes count as
     * their own component.
     */
    public int countComponents(@NotNull GraphDocument graph) {
        Map<String, Set<String>> undirected = adjacency(graph, false);
        Set<String> visited = new HashSet<>();
        int components = 0;
        for (String start : undirected.keySet()) {
            if (visited.contains(start)) {
                continue;
            }
            components++;
            reach(start, undirected, visited);
        }
        return components;
    }

    /**
     * Number of ordered node pairs connected by a directed path over valid edges.
     */
    public int countPaths(@NotNull GraphDocument graph) {
        Map<String, Set<String>> directed = adjacency(graph, true);
        int paths = 0;
        for (String start : directed.keySet()) {
            Set<String> visited = new HashSet<>();
            reach(start, directed, visited);
            paths += visited.size() - 1;
        }
        return paths;
    }

    @NotNull
    public ConnectivitySummary summarizeConnectivity(@NotNull GraphDocument graph) {
        return new ConnectivitySummary(countComponents(graph), countPaths(graph));
    }

    private Map<String, Set<String>> adjacency(GraphDocument graph, boolean directed) {
        Map<String, Set<String>> adjacency = new LinkedHashMap<>();
        for (GraphNode node : graph.getNodes()) {
            adjacency.put(node.getId(), new LinkedHashSet<>());
        }
        for (GraphEdge edge : getValidEdges(graph)) {
            adjacency.get(edge.source()).add(edge.target());
            if (!directed) {
                adjacency.get(edge.target()).add(edge.source());
            }
        }
        return adjacency;
    }

    private static void reach(String start, Map<String, Set<String>> adjacency, Set<String> visited) {
        Deque<String> stack = new ArrayDeque<>();
        stack.push(start);
        while (!stack.isEmpty()) {
            String current = stack.pop();
            if (!visited.add(current)) {
                continue;
            }
            for (String next : adjacency.getOrDefault(current, Set.of())) {
                if (!visited.contains(next)) {
                    stack.push(next);
                }
            }
        }
    }
}
